package io.github.hongjungwan.smartlog.api.exception;

/**
 * SmartLog SDK 예외의 최상위 타입. 모든 SDK 예외는 unchecked.
 */
public class SmartLogException extends RuntimeException {

    public SmartLogException(String message) {
        super(message);
    }

    public SmartLogException(String message, Throwable cause) {
        super(message, cause);
    }
}
