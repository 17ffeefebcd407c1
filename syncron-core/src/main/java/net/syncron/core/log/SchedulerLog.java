package net.syncron.core.log;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Objects;

/**
 * 스케줄러 내부 로그 창구. log=false 면 아무것도 내보내지 않는다.
 * 수신기 자체가 던지는 예외는 스케줄링을 깨지 않도록 여기서 멈춘다.
 */
public final class SchedulerLog {
    public static final String DEFAULT_TAG = "Syncron";

    private final boolean enabled;
    private final LogSink sink;
    private final String tag;

    public SchedulerLog(boolean enabled, LogSink sink, String tag) {
        this.enabled = enabled;
        this.sink = sink == null ? Slf4jLogSink.INSTANCE : sink;
        this.tag = Objects.requireNonNull(tag);
    }

    public static SchedulerLog disabled() {
        return new SchedulerLog(false, null, DEFAULT_TAG);
    }

    public void debug(String message) { emit(LogLevel.DEBUG, message); }
    public void info(String message) { emit(LogLevel.INFO, message); }
    public void warn(String message) { emit(LogLevel.WARN, message); }
    public void error(String message) { emit(LogLevel.ERROR, message); }

    public void error(String message, Throwable t) {
        emit(LogLevel.ERROR, message + " " + stackTrace(t));
    }

    public boolean isEnabled() { return enabled; }

    public String tag() { return tag; }

    private void emit(LogLevel level, String message) {
        if (!enabled) return;
        try {
            sink.accept(new LogEvent(level, message, tag));
        } catch (RuntimeException e) {
            Slf4jLogSink.INSTANCE.accept(new LogEvent(LogLevel.WARN,
                    "log sink failed: " + e + " (message: " + message + ")", tag));
        }
    }

    public static String stackTrace(Throwable t) {
        if (t == null) return "null";
        StringWriter sw = new StringWriter();
        t.printStackTrace(new PrintWriter(sw));
        return sw.toString();
    }
}
