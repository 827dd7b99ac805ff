package io.github.hongjungwan.smartlog.core.logback;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.IThrowableProxy;
import ch.qos.logback.classic.spi.ThrowableProxy;
import ch.qos.logback.core.UnsynchronizedAppenderBase;
import io.github.hongjungwan.smartlog.api.LogOptions;
import io.github.hongjungwan.smartlog.api.Severity;
import io.github.hongjungwan.smartlog.api.SmartLogger;

/**
 * SLF4J/Logback 이벤트를 SmartLogger로 전달하는 Appender.
 *
 * <p>레벨 매핑: ERROR→error, WARN→warning, INFO→informational, DEBUG/TRACE→debug.
 * 예외가 있으면 예외를 메시지/트레이스로 기록하고 원래 메시지는 data 컬럼에 남긴다.
 * SDK 자체 로그는 되먹임을 막기 위해 전달하지 않는다.</p>
 */
public class SmartLogAppender extends UnsynchronizedAppenderBase<ILoggingEvent> {

    private static final String SDK_LOGGER_PREFIX = "io.github.hongjungwan.smartlog";

    private SmartLogger target;
    private boolean includeCallerData = true;

    public SmartLogAppender() {
    }

    public SmartLogAppender(SmartLogger target) {
        this.target = target;
    }

    public void setTarget(SmartLogger target) {
        this.target = target;
    }

    public void setIncludeCallerData(boolean includeCallerData) {
        this.includeCallerData = includeCallerData;
    }

    @Override
    public void start() {
        if (target == null) {
            addError("No target SmartLogger set for appender [" + getName() + "]");
            return;
        }
        super.start();
    }

    @Override
    protected void append(ILoggingEvent event) {
        if (event.getLoggerName() != null && event.getLoggerName().startsWith(SDK_LOGGER_PREFIX)) {
            return;
        }

        Severity severity = toSeverity(event.getLevel());
        Throwable throwable = extractThrowable(event.getThrowableProxy());
        if (throwable != null) {
            target.log(throwable, severity, event.getFormattedMessage(), null);
            return;
        }
        target.log(event.getFormattedMessage(), severity, SmartLogger.NO_DATA, callerOptions(event));
    }

    static Severity toSeverity(Level level) {
        return switch (level.toInt()) {
            case Level.ERROR_INT -> Severity.ERROR;
            case Level.WARN_INT -> Severity.WARNING;
            case Level.INFO_INT -> Severity.INFORMATIONAL;
            default -> Severity.DEBUG;
        };
    }

    private LogOptions callerOptions(ILoggingEvent event) {
        StackTraceElement[] callerData = includeCallerData ? event.getCallerData() : null;
        if (callerData == null || callerData.length == 0) {
            // 호출 위치 대신 로거 이름을 location으로 기록
            return LogOptions.builder().file(event.getLoggerName()).build();
        }
        StackTraceElement caller = callerData[0];
        return LogOptions.builder()
                .file(caller.getFileName())
                .line(caller.getLineNumber())
                .function(caller.getClassName() + "." + caller.getMethodName())
                .build();
    }

    private static Throwable extractThrowable(IThrowableProxy proxy) {
        if (proxy instanceof ThrowableProxy throwableProxy) {
            return throwableProxy.getThrowable();
        }
        return null;
    }
}
