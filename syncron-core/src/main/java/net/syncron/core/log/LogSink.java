package net.syncron.core.log;

/** 사용자 지정 로그 수신기. 지정하지 않으면 slf4j 로 보낸다. */
@FunctionalInterface
public interface LogSink {
    void accept(LogEvent event);
}
