package io.github.hongjungwan.smartlog.api.exception;

/**
 * 로거 생성 실패 (디렉토리, 잠금 파일, 로그 파일 준비 단계). 해당 로거는 등록되지 않는다.
 */
public class ConstructionException extends SmartLogException {

    public ConstructionException(String message) {
        super(message);
    }

    public ConstructionException(String message, Throwable cause) {
        super(message, cause);
    }
}
