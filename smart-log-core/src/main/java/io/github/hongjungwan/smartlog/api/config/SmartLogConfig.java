package io.github.hongjungwan.smartlog.api.config;

import io.github.hongjungwan.smartlog.api.Severity;
import io.github.hongjungwan.smartlog.api.SeverityScale;
import io.github.hongjungwan.smartlog.api.exception.ConfigurationException;
import io.github.hongjungwan.smartlog.spi.CallSiteResolver;
import lombok.Getter;

import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Clock;
import java.time.format.DateTimeFormatter;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 로거별 설정. 생성 후 변경 불가 (hot reload 없음).
 */
@Getter
public final class SmartLogConfig {

    public static final int DEFAULT_SEVERITY_THRESHOLD = Severity.INFORMATIONAL.rank();
    public static final int DEFAULT_SMART_SEVERITY_THRESHOLD = Severity.NOTICE.rank();
    public static final long DEFAULT_MAX_FILE_SIZE = 100_000_000L;
    public static final int DEFAULT_MAX_DAYS = 7;
    public static final String DEFAULT_DATE_FORMAT = "yyyy-MM-dd HH:mm:ss.SSSSSS";
    public static final String DEFAULT_PERMISSION = "rwxrwxrwx";

    /** 로그 디렉토리 */
    private final String directory;

    /** 이 rank 이하(더 심각)의 메시지를 기록. OFF면 로깅 전체 비활성화 */
    private final int severityThreshold;

    /** 이 rank 이하의 메시지가 하나라도 오면 flush 윈도우 전체를 기록 */
    private final int smartSeverityThreshold;

    /** 이 크기(bytes)를 넘은 파일은 다음 번호로 회전 */
    private final long maxFileSize;

    /** 보관 기간(일). 더 오래된 로그 파일은 생성 시 삭제 */
    private final int maxDays;

    /** 타임스탬프 패턴 (DateTimeFormatter) */
    private final String dateFormat;

    /** 디렉토리/파일 생성 권한 */
    private final Set<PosixFilePermission> defaultPermission;

    /** 타임스탬프, 파일 날짜, 보관 기간 계산의 기준 시계 */
    private final Clock clock;

    /** 명시적 file/line이 없을 때 호출 위치 해석 */
    private final CallSiteResolver callSiteResolver;

    private final DateTimeFormatter timestampFormatter;

    private SmartLogConfig(Builder builder) {
        this.directory = builder.directory;
        this.severityThreshold = builder.severityThreshold;
        this.smartSeverityThreshold = builder.smartSeverityThreshold;
        this.maxFileSize = builder.maxFileSize;
        this.maxDays = builder.maxDays;
        this.dateFormat = builder.dateFormat;
        this.defaultPermission = Set.copyOf(builder.defaultPermission);
        this.clock = builder.clock;
        this.callSiteResolver = builder.callSiteResolver;
        this.timestampFormatter = builder.timestampFormatter;
    }

    public boolean isOff() {
        return SeverityScale.isOff(severityThreshold);
    }

    public static Builder builder() {
        return new Builder();
    }

    /** 디렉토리만 지정한 기본 설정 */
    public static SmartLogConfig forDirectory(String directory) {
        return builder().directory(directory).build();
    }

    /**
     * 이름 기반 override 맵으로 설정 생성.
     *
     * <p>허용 키: severityThreshold, smartSeverityThreshold, maxFileSize, dateFormat,
     * defaultPermission, maxDays. 그 외 키는 ConfigurationException.</p>
     */
    public static SmartLogConfig fromSettings(String directory, Map<String, ?> overrides) {
        Builder builder = builder().directory(directory);
        if (overrides == null) {
            return builder.build();
        }

        for (Map.Entry<String, ?> entry : overrides.entrySet()) {
            String key = entry.getKey();
            Object value = entry.getValue();
            switch (key) {
                case "severityThreshold" -> builder.severityThreshold(toThreshold(key, value));
                case "smartSeverityThreshold" -> builder.smartSeverityThreshold(toThreshold(key, value));
                case "maxFileSize" -> builder.maxFileSize(toNumber(key, value).longValue());
                case "maxDays" -> builder.maxDays(toInt(key, toNumber(key, value)));
                case "dateFormat" -> builder.dateFormat(toText(key, value));
                case "defaultPermission" -> builder.defaultPermission(value);
                default -> throw new ConfigurationException("Unknown configuration key: " + key);
            }
        }
        return builder.build();
    }

    private static int toThreshold(String key, Object value) {
        if (value instanceof Severity severity) {
            return severity.rank();
        }
        if (value instanceof Number number) {
            return checkRank(key, toInt(key, number));
        }
        if (value instanceof String text) {
            return SeverityScale.threshold(text);
        }
        throw new ConfigurationException("Invalid value for " + key + ": " + value);
    }

    private static Number toNumber(String key, Object value) {
        if (value instanceof Number number) {
            return number;
        }
        if (value instanceof String text) {
            try {
                return Long.parseLong(text.trim());
            } catch (NumberFormatException e) {
                throw new ConfigurationException("Invalid number for " + key + ": " + text, e);
            }
        }
        throw new ConfigurationException("Invalid value for " + key + ": " + value);
    }

    /** int 범위를 벗어나면 ConfigurationException */
    private static int toInt(String key, Number number) {
        try {
            return Math.toIntExact(number.longValue());
        } catch (ArithmeticException e) {
            throw new ConfigurationException("Value for " + key + " out of range: " + number, e);
        }
    }

    private static String toText(String key, Object value) {
        if (value instanceof String text) {
            return text;
        }
        throw new ConfigurationException("Invalid value for " + key + ": " + value);
    }

    private static int checkRank(String key, int rank) {
        try {
            return SeverityScale.ordinal(rank);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid value for " + key + ": " + rank, e);
        }
    }

    /** "rwxr-x---", "0750" 또는 8진수 정수(0750) */
    static Set<PosixFilePermission> parsePermission(Object value) {
        if (value instanceof Set<?> set) {
            Set<PosixFilePermission> permissions = EnumSet.noneOf(PosixFilePermission.class);
            for (Object item : set) {
                if (!(item instanceof PosixFilePermission permission)) {
                    throw new ConfigurationException("Invalid permission: " + item);
                }
                permissions.add(permission);
            }
            return permissions;
        }
        if (value instanceof Number number) {
            return fromMode(number.intValue());
        }
        if (value instanceof String text) {
            String trimmed = text.trim();
            if (trimmed.matches("0?[0-7]{3}")) {
                return fromMode(Integer.parseInt(trimmed, 8));
            }
            try {
                return PosixFilePermissions.fromString(trimmed);
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Invalid permission: " + text, e);
            }
        }
        throw new ConfigurationException("Invalid permission: " + value);
    }

    private static Set<PosixFilePermission> fromMode(int mode) {
        if (mode < 0 || mode > 0777) {
            throw new ConfigurationException("Invalid permission mode: " + Integer.toOctalString(mode));
        }
        PosixFilePermission[] bits = {
                PosixFilePermission.OTHERS_EXECUTE, PosixFilePermission.OTHERS_WRITE, PosixFilePermission.OTHERS_READ,
                PosixFilePermission.GROUP_EXECUTE, PosixFilePermission.GROUP_WRITE, PosixFilePermission.GROUP_READ,
                PosixFilePermission.OWNER_EXECUTE, PosixFilePermission.OWNER_WRITE, PosixFilePermission.OWNER_READ
        };
        Set<PosixFilePermission> permissions = EnumSet.noneOf(PosixFilePermission.class);
        for (int i = 0; i < bits.length; i++) {
            if ((mode & (1 << i)) != 0) {
                permissions.add(bits[i]);
            }
        }
        return permissions;
    }

    public static final class Builder {
        private String directory;
        private int severityThreshold = DEFAULT_SEVERITY_THRESHOLD;
        private int smartSeverityThreshold = DEFAULT_SMART_SEVERITY_THRESHOLD;
        private long maxFileSize = DEFAULT_MAX_FILE_SIZE;
        private int maxDays = DEFAULT_MAX_DAYS;
        private String dateFormat = DEFAULT_DATE_FORMAT;
        private Set<PosixFilePermission> defaultPermission = PosixFilePermissions.fromString(DEFAULT_PERMISSION);
        private Clock clock = Clock.systemDefaultZone();
        private CallSiteResolver callSiteResolver = CallSiteResolver.stackWalking();
        private DateTimeFormatter timestampFormatter;

        private Builder() {}

        public Builder directory(String directory) {
            this.directory = directory;
            return this;
        }

        public Builder severityThreshold(int rank) {
            this.severityThreshold = checkRank("severityThreshold", rank);
            return this;
        }

        public Builder severityThreshold(Severity severity) {
            return severityThreshold(Objects.requireNonNull(severity, "severity").rank());
        }

        /** 이름 prefix 또는 "off" */
        public Builder severityThreshold(String severity) {
            this.severityThreshold = SeverityScale.threshold(severity);
            return this;
        }

        /** 로깅 비활성화 */
        public Builder off() {
            this.severityThreshold = SeverityScale.OFF;
            return this;
        }

        public Builder smartSeverityThreshold(int rank) {
            this.smartSeverityThreshold = checkRank("smartSeverityThreshold", rank);
            return this;
        }

        public Builder smartSeverityThreshold(Severity severity) {
            return smartSeverityThreshold(Objects.requireNonNull(severity, "severity").rank());
        }

        public Builder smartSeverityThreshold(String severity) {
            this.smartSeverityThreshold = SeverityScale.threshold(severity);
            return this;
        }

        public Builder maxFileSize(long maxFileSize) {
            this.maxFileSize = maxFileSize;
            return this;
        }

        public Builder maxDays(int maxDays) {
            this.maxDays = maxDays;
            return this;
        }

        public Builder dateFormat(String dateFormat) {
            this.dateFormat = dateFormat;
            return this;
        }

        public Builder defaultPermission(Object permission) {
            this.defaultPermission = parsePermission(permission);
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder callSiteResolver(CallSiteResolver callSiteResolver) {
            this.callSiteResolver = callSiteResolver;
            return this;
        }

        public SmartLogConfig build() {
            if (maxFileSize < 0) {
                throw new ConfigurationException("maxFileSize must not be negative, got: " + maxFileSize);
            }
            if (maxDays < 0) {
                throw new ConfigurationException("maxDays must not be negative, got: " + maxDays);
            }
            if (clock == null) {
                throw new ConfigurationException("clock is required");
            }
            if (callSiteResolver == null) {
                throw new ConfigurationException("callSiteResolver is required");
            }
            if (dateFormat == null || dateFormat.isEmpty()) {
                throw new ConfigurationException("dateFormat is required");
            }
            try {
                this.timestampFormatter = DateTimeFormatter.ofPattern(dateFormat);
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Invalid dateFormat: " + dateFormat, e);
            }
            return new SmartLogConfig(this);
        }
    }
}
