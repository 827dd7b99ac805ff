package io.github.hongjungwan.smartlog.api.exception;

import lombok.Getter;

/**
 * 어떤 심각도 이름과도 매칭되지 않는 문자열. 호출자 버그이므로 즉시 실패.
 */
@Getter
public class UnknownSeverityException extends ConfigurationException {

    private final String input;

    public UnknownSeverityException(String input) {
        super("Unknown severity: " + input);
        this.input = input;
    }
}
