package io.github.hongjungwan.smartlog.api.exception;

/**
 * 프로세스 간 잠금 파일을 열거나 잠글 수 없음.
 */
public class LockException extends SmartLogException {

    public LockException(String message, Throwable cause) {
        super(message, cause);
    }
}
