package net.syncron.core.model;

public enum SchedulerState {
    STOPPED, RUNNING, PAUSED;

    public boolean isRunning() { return this == RUNNING; }
}
