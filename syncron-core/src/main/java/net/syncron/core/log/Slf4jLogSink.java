package net.syncron.core.log;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/** tag 를 로거 이름으로 쓰는 기본 수신기 */
public final class Slf4jLogSink implements LogSink {
    public static final Slf4jLogSink INSTANCE = new Slf4jLogSink();

    private final Map<String, Logger> loggers = new ConcurrentHashMap<>();

    private Slf4jLogSink() {}

    @Override
    public void accept(LogEvent event) {
        Logger log = loggers.computeIfAbsent(event.tag(), LoggerFactory::getLogger);
        switch (event.level()) {
            case DEBUG -> log.debug(event.message());
            case INFO -> log.info(event.message());
            case WARN -> log.warn(event.message());
            case ERROR -> log.error(event.message());
        }
    }
}
