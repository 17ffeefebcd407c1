package net.syncron.core.error;

/** add() 시점의 잘못된 잡 정의. 등록은 진행되지 않는다. */
public class InvalidJobException extends IllegalArgumentException {
    public InvalidJobException(String message) {
        super(message);
    }

    public InvalidJobException(String message, Throwable cause) {
        super(message, cause);
    }
}
