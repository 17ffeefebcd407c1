package net.syncron.core.timer;

@FunctionalInterface
public interface Cancellable {
    /** @return 이번 호출로 실제 취소되었으면 true */
    boolean cancel();
}
