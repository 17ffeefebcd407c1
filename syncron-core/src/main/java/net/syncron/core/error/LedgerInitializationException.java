package net.syncron.core.error;

/** 원장 스키마/유니크 인덱스 준비 실패. 이 상태로 돌리면 중복 실행 방지가 보장되지 않는다. */
public class LedgerInitializationException extends Exception {
    public LedgerInitializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
