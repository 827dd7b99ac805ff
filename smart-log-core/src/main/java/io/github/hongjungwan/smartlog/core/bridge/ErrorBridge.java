package io.github.hongjungwan.smartlog.core.bridge;

import io.github.hongjungwan.smartlog.api.LogOptions;
import io.github.hongjungwan.smartlog.api.SmartLogger;
import io.github.hongjungwan.smartlog.api.SmartLoggerRegistry;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.PrintStream;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * 프로세스 전역 오류/미처리 예외를 지정된 로거의 log 호출로 전달하는 어댑터.
 *
 * <p>세 가지 알림을 구독한다:</p>
 * <ul>
 *   <li>미처리 예외 - 기본 {@link Thread.UncaughtExceptionHandler} (이전 핸들러로 체이닝)</li>
 *   <li>런타임 오류 보고 - 호스트가 {@link #reportError} 호출</li>
 *   <li>종료 검사 - shutdown hook에서 아직 기록되지 않은 치명 오류를 기록하고 레지스트리를 닫음</li>
 * </ul>
 *
 * <p>파일/라인은 스택 검사가 아니라 이벤트에서 가져온다. 브리지 안에서 발생한 로깅 실패는
 * SLF4J로만 보고하고 실패한 스레드로 다시 던지지 않는다.</p>
 */
@Slf4j
public class ErrorBridge implements AutoCloseable {

    private static final String BRIDGE_FILE = "ErrorBridge.java";

    private final SmartLoggerRegistry registry;
    @Getter
    private final String loggerName;
    private final Set<ErrorCategory> captured;
    private final boolean displayErrors;
    private final PrintStream display;

    private final AtomicReference<PendingFatal> pendingFatal = new AtomicReference<>();
    private final AtomicBoolean installed = new AtomicBoolean(false);

    private Thread.UncaughtExceptionHandler previousHandler;
    private Thread.UncaughtExceptionHandler installedHandler;
    private Thread shutdownHook;

    ErrorBridge(SmartLoggerRegistry registry, String loggerName, Set<ErrorCategory> captured,
                boolean displayErrors, PrintStream display) {
        this.registry = registry;
        this.loggerName = loggerName;
        this.captured = captured.isEmpty() ? EnumSet.noneOf(ErrorCategory.class) : EnumSet.copyOf(captured);
        this.displayErrors = displayErrors;
        this.display = display;
    }

    /**
     * 브리지 설치.
     *
     * @param registry      대상 로거를 찾을 레지스트리
     * @param loggerName    오류를 기록할 로거 이름
     * @param captured      기록할 오류 종류
     * @param displayErrors true면 포착한 예외를 System.err에도 출력
     */
    public static ErrorBridge install(SmartLoggerRegistry registry, String loggerName,
                                      Set<ErrorCategory> captured, boolean displayErrors) {
        ErrorBridge bridge = new ErrorBridge(registry, loggerName, captured, displayErrors, System.err);
        bridge.installHandlers();
        return bridge;
    }

    /** 모든 오류 종류를 "default" 로거로 기록 */
    public static ErrorBridge install(SmartLoggerRegistry registry) {
        return install(registry, SmartLoggerRegistry.DEFAULT_LOGGER, ErrorCategory.all(), false);
    }

    void installHandlers() {
        if (!installed.compareAndSet(false, true)) {
            return;
        }
        previousHandler = Thread.getDefaultUncaughtExceptionHandler();
        installedHandler = this::uncaughtException;
        Thread.setDefaultUncaughtExceptionHandler(installedHandler);

        shutdownHook = new Thread(this::onShutdown, "smart-log-shutdown");
        Runtime.getRuntime().addShutdownHook(shutdownHook);
        log.info("ErrorBridge installed for logger '{}' (categories={})", loggerName, captured);
    }

    /** 미처리 예외 처리. 로깅 후 이전 핸들러에 위임 */
    void uncaughtException(Thread thread, Throwable throwable) {
        reportUncaught(throwable);
        if (previousHandler != null) {
            previousHandler.uncaughtException(thread, throwable);
        }
    }

    /** 미처리 예외 기록. VirtualMachineError는 emergency, 나머지는 alert */
    public void reportUncaught(Throwable throwable) {
        if (displayErrors) {
            throwable.printStackTrace(display);
        }
        ErrorCategory category = ErrorCategory.classify(throwable);
        withLogger(logger -> logger.log(throwable, category.severity(), SmartLogger.NO_DATA, null));
    }

    /**
     * 호스트 런타임 오류 보고. 포착 대상이 아닌 종류는 무시한다.
     *
     * @param category 오류 종류
     * @param message  오류 메시지
     * @param file     발생 파일
     * @param line     발생 라인
     */
    public void reportError(ErrorCategory category, String message, String file, int line) {
        if (!captured.contains(category)) {
            return;
        }
        log(category, message, file, line);
    }

    /** 이름으로 종류를 지정한 보고. 알 수 없는 종류는 warning으로 기록 */
    public void reportError(String type, String message, String file, int line) {
        Optional<ErrorCategory> category = ErrorCategory.find(type);
        if (category.isPresent()) {
            reportError(category.get(), message, file, line);
            return;
        }
        withLogger(logger -> logger.warning("Unknown error type (" + type + ")", SmartLogger.NO_DATA,
                LogOptions.at(BRIDGE_FILE, 0)));
    }

    /**
     * 치명 오류를 기록 대기 상태로 남긴다. 프로세스가 정상 경로로 기록하지 못하고 종료되면
     * shutdown hook이 기록한다.
     */
    public void recordFatal(String message, String file, int line) {
        pendingFatal.set(new PendingFatal(ErrorCategory.CORE, message, file, line));
    }

    private void log(ErrorCategory category, String message, String file, int line) {
        if (displayErrors) {
            display.println(category.severity().upperLabel() + ": " + message + " in " + file + "(" + line + ")");
        }
        withLogger(logger -> logger.log(message, category.severity(), SmartLogger.NO_DATA, LogOptions.at(file, line)));
    }

    /** 종료 시: 남은 치명 오류 기록 후 레지스트리 close (버퍼 flush) */
    void onShutdown() {
        PendingFatal fatal = pendingFatal.getAndSet(null);
        if (fatal != null && captured.contains(fatal.category())) {
            log(fatal.category(), fatal.message(), fatal.file(), fatal.line());
        }
        try {
            registry.close();
        } catch (RuntimeException e) {
            log.error("Failed to flush loggers on shutdown", e);
        }
    }

    private void withLogger(Consumer<SmartLogger> action) {
        Optional<SmartLogger> logger = registry.get(loggerName);
        if (logger.isEmpty()) {
            log.warn("ErrorBridge target logger '{}' is not registered", loggerName);
            return;
        }
        try {
            action.accept(logger.get());
        } catch (RuntimeException e) {
            log.error("ErrorBridge failed to log to '{}'", loggerName, e);
        }
    }

    public boolean isInstalled() {
        return installed.get();
    }

    /** 핸들러 제거. 이전 기본 핸들러를 복원한다 */
    @Override
    public void close() {
        if (!installed.compareAndSet(true, false)) {
            return;
        }
        if (Thread.getDefaultUncaughtExceptionHandler() == installedHandler) {
            Thread.setDefaultUncaughtExceptionHandler(previousHandler);
        }
        try {
            Runtime.getRuntime().removeShutdownHook(shutdownHook);
        } catch (IllegalStateException e) {
            log.debug("Shutdown already in progress, hook not removed");
        }
        log.info("ErrorBridge for logger '{}' uninstalled", loggerName);
    }

    private record PendingFatal(ErrorCategory category, String message, String file, int line) {
    }
}
