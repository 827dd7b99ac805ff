package io.github.hongjungwan.smartlog.core.bridge;

import io.github.hongjungwan.smartlog.api.Severity;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * 호스트가 보고하는 오류 종류와 기록 심각도의 고정 매핑.
 */
public enum ErrorCategory {

    /** 런타임 코어 장애 */
    CORE(Severity.EMERGENCY),
    /** 처리 불가 오류, 미처리 예외 */
    ERROR(Severity.ALERT),
    /** 경고, deprecation */
    WARNING(Severity.WARNING),
    /** 참고 알림 */
    NOTICE(Severity.NOTICE);

    private final Severity severity;

    ErrorCategory(Severity severity) {
        this.severity = severity;
    }

    public Severity severity() {
        return severity;
    }

    public static Set<ErrorCategory> all() {
        return EnumSet.allOf(ErrorCategory.class);
    }

    /** 대소문자 무시 이름 매칭. 알 수 없으면 empty */
    public static Optional<ErrorCategory> find(String type) {
        if (type == null) {
            return Optional.empty();
        }
        String normalized = type.trim().toUpperCase(Locale.ROOT);
        for (ErrorCategory category : values()) {
            if (category.name().equals(normalized)) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }

    /** 미처리 Throwable 분류: VirtualMachineError는 CORE, 그 외는 ERROR */
    public static ErrorCategory classify(Throwable throwable) {
        return throwable instanceof VirtualMachineError ? CORE : ERROR;
    }
}
