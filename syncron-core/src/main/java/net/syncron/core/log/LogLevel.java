package net.syncron.core.log;

public enum LogLevel {
    DEBUG, INFO, WARN, ERROR;

    public String code() { return name().toLowerCase(); }
}
