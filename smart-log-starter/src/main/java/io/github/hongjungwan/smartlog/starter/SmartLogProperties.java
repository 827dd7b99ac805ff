package io.github.hongjungwan.smartlog.starter;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * SmartLog SDK 설정 Properties (prefix: smart-log).
 *
 * <pre>
 * smart-log:
 *   loggers:
 *     default:
 *       directory: /var/log/app
 *     payment:
 *       directory: /var/log/app/payment
 *       severity-threshold: error
 *       smart-severity-threshold: critical
 *   error-bridge:
 *     enabled: true
 * </pre>
 */
@Data
@ConfigurationProperties(prefix = "smart-log")
public class SmartLogProperties {

    /** SDK 활성화 여부 */
    private boolean enabled = true;

    /** 이름별 로거 설정 */
    private Map<String, LoggerProperties> loggers = new LinkedHashMap<>();

    /** 전역 오류 브리지 설정 */
    private ErrorBridgeProperties errorBridge = new ErrorBridgeProperties();

    /** 시작 시 자가 진단 설정 */
    private DoctorProperties doctor = new DoctorProperties();

    /**
     * 로거 한 개의 설정. 지정하지 않은 항목은 SDK 기본값을 따른다.
     */
    @Data
    public static class LoggerProperties {
        private String directory;

        /** 심각도 이름(prefix 허용) 또는 off */
        private String severityThreshold;
        private String smartSeverityThreshold;
        private Long maxFileSize;
        private Integer maxDays;
        private String dateFormat;

        /** "rwxr-x---" 또는 "0750" */
        private String defaultPermission;

        /** null이 아닌 항목만 이름 기반 override 맵으로 변환 */
        public Map<String, Object> toOverrides() {
            Map<String, Object> overrides = new LinkedHashMap<>();
            putIfPresent(overrides, "severityThreshold", severityThreshold);
            putIfPresent(overrides, "smartSeverityThreshold", smartSeverityThreshold);
            putIfPresent(overrides, "maxFileSize", maxFileSize);
            putIfPresent(overrides, "maxDays", maxDays);
            putIfPresent(overrides, "dateFormat", dateFormat);
            putIfPresent(overrides, "defaultPermission", defaultPermission);
            return overrides;
        }

        private static void putIfPresent(Map<String, Object> overrides, String key, Object value) {
            if (value != null) {
                overrides.put(key, value);
            }
        }
    }

    @Data
    public static class ErrorBridgeProperties {
        /** 미처리 예외 핸들러와 shutdown hook 설치 여부 */
        private boolean enabled = false;

        /** 오류를 기록할 로거 이름 */
        private String logger = "default";

        /** 포착한 예외를 System.err에도 출력 */
        private boolean displayErrors = false;

        /** 기록할 오류 종류: core, error, warning, notice */
        private List<String> categories = List.of("core", "error", "warning", "notice");
    }

    @Data
    public static class DoctorProperties {
        private boolean enabled = true;
    }
}
