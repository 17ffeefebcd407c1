package net.syncron.core.timer;

public enum TimerState {
    IDLE,       // 시작 전 또는 스케줄 소진
    WAITING,    // 다음 발생(또는 재평가) 대기 중
    FIRING,     // 콜백 실행 중
    CANCELLED
}
