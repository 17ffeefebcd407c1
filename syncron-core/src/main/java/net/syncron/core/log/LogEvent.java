package net.syncron.core.log;

public record LogEvent(LogLevel level, String message, String tag) {
}
