package io.github.hongjungwan.smartlog.api;

/**
 * SmartLog SDK의 메인 로거 인터페이스.
 *
 * <p>모든 심각도의 메시지를 메모리에 버퍼링하고, {@link #flush()} 또는 {@link #close()} 시점에
 * smart 규칙에 따라 CSV로 기록한다. 평소에는 severityThreshold 이하만 기록하지만,
 * smartSeverityThreshold 이상의 이벤트가 한 번이라도 발생하면 해당 flush 윈도우의 전체
 * 레코드(debug 포함)를 순서대로 기록한다.</p>
 *
 * <p>로깅 호출은 파일 시스템이나 잠금을 건드리지 않으며 I/O로 실패하지 않는다.</p>
 */
public interface SmartLogger extends AutoCloseable {

    /** "데이터 없음" 센티널. null은 유효한 데이터로 기록된다. */
    Object NO_DATA = NoData.INSTANCE;

    /**
     * 메시지 기록.
     *
     * @param message  메시지
     * @param severity 심각도
     * @param data     부가 데이터, 없으면 {@link #NO_DATA}
     * @param options  호출별 override (file, line, function, data). null 허용
     */
    void log(String message, Severity severity, Object data, LogOptions options);

    /** 예외 기록. 메시지는 "타입: 메시지", 위치는 예외 발생 지점, 트레이스 컬럼 포함 */
    void log(Throwable throwable, Severity severity, Object data, LogOptions options);

    /**
     * 이름으로 심각도를 지정해 기록 ("err", "info" 등 prefix 허용).
     *
     * @throws io.github.hongjungwan.smartlog.api.exception.UnknownSeverityException 매칭되는 심각도가 없는 경우
     */
    void log(String message, String severity, Object data, LogOptions options);

    default void log(String message, int rank, Object data, LogOptions options) {
        log(message, Severity.fromRank(rank), data, options);
    }

    default void log(String message, Severity severity) {
        log(message, severity, NO_DATA, null);
    }

    /** 버퍼된 레코드를 smart 규칙에 따라 기록하고 버퍼를 비운다 */
    void flush();

    /** 마지막 flush 후 파일 핸들 해제. 여러 번 호출해도 안전 */
    @Override
    void close();

    String getName();

    /** OFF가 아니고 닫히지 않았으면 true */
    boolean isEnabled();

    // ---- emergency ----

    default void emergency(String message) {
        log(message, Severity.EMERGENCY, NO_DATA, null);
    }

    default void emergency(String message, Object data) {
        log(message, Severity.EMERGENCY, data, null);
    }

    default void emergency(String message, Object data, LogOptions options) {
        log(message, Severity.EMERGENCY, data, options);
    }

    default void emergency(Throwable throwable) {
        log(throwable, Severity.EMERGENCY, NO_DATA, null);
    }

    default void emergency(Throwable throwable, Object data) {
        log(throwable, Severity.EMERGENCY, data, null);
    }

    // ---- alert ----

    default void alert(String message) {
        log(message, Severity.ALERT, NO_DATA, null);
    }

    default void alert(String message, Object data) {
        log(message, Severity.ALERT, data, null);
    }

    default void alert(String message, Object data, LogOptions options) {
        log(message, Severity.ALERT, data, options);
    }

    default void alert(Throwable throwable) {
        log(throwable, Severity.ALERT, NO_DATA, null);
    }

    default void alert(Throwable throwable, Object data) {
        log(throwable, Severity.ALERT, data, null);
    }

    // ---- critical ----

    default void critical(String message) {
        log(message, Severity.CRITICAL, NO_DATA, null);
    }

    default void critical(String message, Object data) {
        log(message, Severity.CRITICAL, data, null);
    }

    default void critical(String message, Object data, LogOptions options) {
        log(message, Severity.CRITICAL, data, options);
    }

    default void critical(Throwable throwable) {
        log(throwable, Severity.CRITICAL, NO_DATA, null);
    }

    default void critical(Throwable throwable, Object data) {
        log(throwable, Severity.CRITICAL, data, null);
    }

    // ---- error ----

    default void error(String message) {
        log(message, Severity.ERROR, NO_DATA, null);
    }

    default void error(String message, Object data) {
        log(message, Severity.ERROR, data, null);
    }

    default void error(String message, Object data, LogOptions options) {
        log(message, Severity.ERROR, data, options);
    }

    default void error(Throwable throwable) {
        log(throwable, Severity.ERROR, NO_DATA, null);
    }

    default void error(Throwable throwable, Object data) {
        log(throwable, Severity.ERROR, data, null);
    }

    // ---- warning ----

    default void warning(String message) {
        log(message, Severity.WARNING, NO_DATA, null);
    }

    default void warning(String message, Object data) {
        log(message, Severity.WARNING, data, null);
    }

    default void warning(String message, Object data, LogOptions options) {
        log(message, Severity.WARNING, data, options);
    }

    default void warning(Throwable throwable) {
        log(throwable, Severity.WARNING, NO_DATA, null);
    }

    default void warning(Throwable throwable, Object data) {
        log(throwable, Severity.WARNING, data, null);
    }

    // ---- notice ----

    default void notice(String message) {
        log(message, Severity.NOTICE, NO_DATA, null);
    }

    default void notice(String message, Object data) {
        log(message, Severity.NOTICE, data, null);
    }

    default void notice(String message, Object data, LogOptions options) {
        log(message, Severity.NOTICE, data, options);
    }

    default void notice(Throwable throwable) {
        log(throwable, Severity.NOTICE, NO_DATA, null);
    }

    default void notice(Throwable throwable, Object data) {
        log(throwable, Severity.NOTICE, data, null);
    }

    // ---- informational ----

    default void info(String message) {
        log(message, Severity.INFORMATIONAL, NO_DATA, null);
    }

    default void info(String message, Object data) {
        log(message, Severity.INFORMATIONAL, data, null);
    }

    default void info(String message, Object data, LogOptions options) {
        log(message, Severity.INFORMATIONAL, data, options);
    }

    default void info(Throwable throwable) {
        log(throwable, Severity.INFORMATIONAL, NO_DATA, null);
    }

    default void info(Throwable throwable, Object data) {
        log(throwable, Severity.INFORMATIONAL, data, null);
    }

    // ---- debug ----

    default void debug(String message) {
        log(message, Severity.DEBUG, NO_DATA, null);
    }

    default void debug(String message, Object data) {
        log(message, Severity.DEBUG, data, null);
    }

    default void debug(String message, Object data, LogOptions options) {
        log(message, Severity.DEBUG, data, options);
    }

    default void debug(Throwable throwable) {
        log(throwable, Severity.DEBUG, NO_DATA, null);
    }

    default void debug(Throwable throwable, Object data) {
        log(throwable, Severity.DEBUG, data, null);
    }
}
