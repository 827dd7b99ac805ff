package io.github.hongjungwan.smartlog.core.bridge;

import io.github.hongjungwan.smartlog.api.LogOptions;
import io.github.hongjungwan.smartlog.api.Severity;
import io.github.hongjungwan.smartlog.api.SmartLogger;
import io.github.hongjungwan.smartlog.api.SmartLoggerRegistry;
import io.github.hongjungwan.smartlog.api.config.SmartLogConfig;
import io.github.hongjungwan.smartlog.core.file.LogFileReader;
import io.github.hongjungwan.smartlog.core.file.LogRow;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
@DisplayName("ErrorBridge 테스트")
class ErrorBridgeTest {

    @Mock
    private SmartLogger logger;

    private SmartLoggerRegistry registry;
    private ByteArrayOutputStream displayed;

    @BeforeEach
    void setUp() {
        registry = new SmartLoggerRegistry((name, config) -> logger);
        registry.add(Map.of(SmartLoggerRegistry.DEFAULT_LOGGER, SmartLogConfig.forDirectory("/unused")));
        displayed = new ByteArrayOutputStream();
    }

    private ErrorBridge bridge(EnumSet<ErrorCategory> captured, boolean displayErrors) {
        return new ErrorBridge(registry, SmartLoggerRegistry.DEFAULT_LOGGER, captured, displayErrors,
                new PrintStream(displayed, true, StandardCharsets.UTF_8));
    }

    @Nested
    @DisplayName("미처리 예외")
    class UncaughtTests {

        @Test
        @DisplayName("일반 예외는 alert로 기록해야 한다")
        void shouldLogExceptionAsAlert() {
            // given
            ErrorBridge bridge = bridge(EnumSet.allOf(ErrorCategory.class), false);
            IllegalStateException failure = new IllegalStateException("unhandled");

            // when
            bridge.reportUncaught(failure);

            // then
            verify(logger).log(same(failure), eq(Severity.ALERT), eq(SmartLogger.NO_DATA), isNull());
        }

        @Test
        @DisplayName("VirtualMachineError는 emergency로 기록해야 한다")
        void shouldLogVmErrorAsEmergency() {
            // given
            ErrorBridge bridge = bridge(EnumSet.allOf(ErrorCategory.class), false);
            StackOverflowError failure = new StackOverflowError();

            // when
            bridge.reportUncaught(failure);

            // then
            verify(logger).log(same(failure), eq(Severity.EMERGENCY), eq(SmartLogger.NO_DATA), isNull());
        }

        @Test
        @DisplayName("displayErrors면 스택 트레이스도 출력해야 한다")
        void shouldDisplayWhenEnabled() {
            // given
            ErrorBridge bridge = bridge(EnumSet.allOf(ErrorCategory.class), true);

            // when
            bridge.reportUncaught(new IllegalStateException("shown"));

            // then
            assertThat(displayed.toString(StandardCharsets.UTF_8))
                    .contains("java.lang.IllegalStateException: shown");
        }

        @Test
        @DisplayName("설치 시 이전 기본 핸들러로 체이닝하고 close 시 복원해야 한다")
        void shouldChainAndRestoreHandler() {
            // given
            Thread.UncaughtExceptionHandler original = Thread.getDefaultUncaughtExceptionHandler();
            List<Throwable> forwarded = new ArrayList<>();
            Thread.UncaughtExceptionHandler previous = (thread, throwable) -> forwarded.add(throwable);
            Thread.setDefaultUncaughtExceptionHandler(previous);
            RuntimeException failure = new RuntimeException("crash");

            try {
                ErrorBridge bridge = ErrorBridge.install(registry, SmartLoggerRegistry.DEFAULT_LOGGER,
                        ErrorCategory.all(), false);
                assertThat(bridge.isInstalled()).isTrue();

                // when
                Thread.getDefaultUncaughtExceptionHandler().uncaughtException(Thread.currentThread(), failure);
                bridge.close();

                // then
                verify(logger).log(same(failure), eq(Severity.ALERT), eq(SmartLogger.NO_DATA), isNull());
                assertThat(forwarded).containsExactly(failure);
                assertThat(Thread.getDefaultUncaughtExceptionHandler()).isSameAs(previous);
                assertThat(bridge.isInstalled()).isFalse();
            } finally {
                Thread.setDefaultUncaughtExceptionHandler(original);
            }
        }

        @Test
        @DisplayName("기본 설치는 default 로거로 모든 종류를 기록해야 한다")
        void shouldInstallWithDefaults() {
            // given
            Thread.UncaughtExceptionHandler original = Thread.getDefaultUncaughtExceptionHandler();
            ErrorBridge bridge = ErrorBridge.install(registry);

            try {
                // when
                bridge.reportError(ErrorCategory.NOTICE, "cache warmed", "Cache.java", 4);

                // then
                assertThat(bridge.getLoggerName()).isEqualTo(SmartLoggerRegistry.DEFAULT_LOGGER);
                verify(logger).log(eq("cache warmed"), eq(Severity.NOTICE), eq(SmartLogger.NO_DATA), any(LogOptions.class));
            } finally {
                bridge.close();
                Thread.setDefaultUncaughtExceptionHandler(original);
            }
        }
    }

    @Nested
    @DisplayName("런타임 오류 보고")
    class ReportErrorTests {

        @Test
        @DisplayName("이벤트의 파일/라인으로 고정 심각도에 기록해야 한다")
        void shouldLogWithEventLocation() {
            // given
            ErrorBridge bridge = bridge(EnumSet.allOf(ErrorCategory.class), false);

            // when
            bridge.reportError(ErrorCategory.WARNING, "deprecated call", "Legacy.java", 12);

            // then
            verify(logger).log(eq("deprecated call"), eq(Severity.WARNING), eq(SmartLogger.NO_DATA),
                    argThat(options -> "Legacy.java".equals(options.getFile()) && options.getLine() == 12));
        }

        @Test
        @DisplayName("포착 대상이 아닌 종류는 무시해야 한다")
        void shouldIgnoreUncapturedCategory() {
            // given
            ErrorBridge bridge = bridge(EnumSet.of(ErrorCategory.ERROR), false);

            // when
            bridge.reportError(ErrorCategory.NOTICE, "fyi", "App.java", 1);

            // then
            verifyNoInteractions(logger);
        }

        @Test
        @DisplayName("이름으로 보고한 알 수 없는 종류는 warning으로 기록해야 한다")
        void shouldLogUnknownTypeAsWarning() {
            // given
            ErrorBridge bridge = bridge(EnumSet.allOf(ErrorCategory.class), false);

            // when
            bridge.reportError("strict", "whatever", "App.java", 3);

            // then
            verify(logger).warning(eq("Unknown error type (strict)"), eq(SmartLogger.NO_DATA), any(LogOptions.class));
        }

        @Test
        @DisplayName("이름으로 보고한 종류는 대소문자를 무시해야 한다")
        void shouldResolveTypeName() {
            // given
            ErrorBridge bridge = bridge(EnumSet.allOf(ErrorCategory.class), false);

            // when
            bridge.reportError("notice", "heads up", "App.java", 5);

            // then
            verify(logger).log(eq("heads up"), eq(Severity.NOTICE), eq(SmartLogger.NO_DATA), any(LogOptions.class));
        }

        @Test
        @DisplayName("displayErrors면 보고 내용을 출력해야 한다")
        void shouldDisplayReport() {
            // given
            ErrorBridge bridge = bridge(EnumSet.allOf(ErrorCategory.class), true);

            // when
            bridge.reportError(ErrorCategory.ERROR, "cannot continue", "Job.java", 77);

            // then
            assertThat(displayed.toString(StandardCharsets.UTF_8)).contains("ALERT: cannot continue in Job.java(77)");
        }

        @Test
        @DisplayName("로거 실패는 호출자로 전파되지 않아야 한다")
        void shouldSwallowLoggerFailure() {
            // given
            ErrorBridge bridge = bridge(EnumSet.allOf(ErrorCategory.class), false);
            doThrow(new IllegalStateException("broken"))
                    .when(logger).log(any(String.class), any(Severity.class), any(), any());

            // when & then
            assertThatCode(() -> bridge.reportError(ErrorCategory.ERROR, "x", "A.java", 1))
                    .doesNotThrowAnyException();
        }

        @Test
        @DisplayName("등록되지 않은 로거 이름이면 아무것도 하지 않아야 한다")
        void shouldIgnoreMissingLogger() {
            // given
            ErrorBridge bridge = new ErrorBridge(registry, "missing", ErrorCategory.all(), false, System.err);

            // when & then
            assertThatCode(() -> bridge.reportError(ErrorCategory.ERROR, "x", "A.java", 1))
                    .doesNotThrowAnyException();
            verifyNoInteractions(logger);
        }
    }

    @Nested
    @DisplayName("종료 처리")
    class ShutdownTests {

        @Test
        @DisplayName("대기 중인 치명 오류를 기록하고 레지스트리를 닫아야 한다")
        void shouldLogPendingFatalAndCloseRegistry() {
            // given
            ErrorBridge bridge = bridge(EnumSet.allOf(ErrorCategory.class), false);
            bridge.recordFatal("out of memory", "Worker.java", 99);

            // when
            bridge.onShutdown();

            // then
            verify(logger).log(eq("out of memory"), eq(Severity.EMERGENCY), eq(SmartLogger.NO_DATA),
                    argThat(options -> "Worker.java".equals(options.getFile()) && options.getLine() == 99));
            verify(logger).close();
            assertThat(registry.isClosed()).isTrue();
        }

        @Test
        @DisplayName("CORE가 포착 대상이 아니면 치명 오류를 기록하지 않아야 한다")
        void shouldSkipFatalWhenNotCaptured() {
            // given
            ErrorBridge bridge = bridge(EnumSet.of(ErrorCategory.WARNING), false);
            bridge.recordFatal("out of memory", "Worker.java", 99);

            // when
            bridge.onShutdown();

            // then
            verify(logger, never()).log(any(String.class), any(Severity.class), any(), any());
            verify(logger).close();
        }
    }

    @Nested
    @DisplayName("파일 기록 통합")
    class IntegrationTests {

        @TempDir
        Path tempDir;

        @Test
        @DisplayName("보고된 오류가 종료 시 로그 파일에 기록되어야 한다")
        void shouldPersistOnShutdown() throws Exception {
            // given
            SmartLoggerRegistry fileRegistry = new SmartLoggerRegistry();
            fileRegistry.add(Map.of("errors", SmartLogConfig.forDirectory(tempDir.toString())));
            ErrorBridge bridge = new ErrorBridge(fileRegistry, "errors", ErrorCategory.all(), false, System.err);

            // when
            bridge.reportError(ErrorCategory.ERROR, "payment rejected", "Payment.java", 31);
            bridge.onShutdown();

            // then
            List<LogRow> rows = new LogFileReader().readDirectory(tempDir);
            assertThat(rows).hasSize(1);
            assertThat(rows.get(0).severity()).isEqualTo("ALERT");
            assertThat(rows.get(0).location()).isEqualTo("Payment.java(31)");
        }
    }
}
