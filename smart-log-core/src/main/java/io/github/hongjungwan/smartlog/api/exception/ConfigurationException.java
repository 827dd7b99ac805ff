package io.github.hongjungwan.smartlog.api.exception;

/**
 * 잘못된 로거 설정 (알 수 없는 설정 키, 타입 불일치, 범위 밖의 값).
 */
public class ConfigurationException extends SmartLogException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
