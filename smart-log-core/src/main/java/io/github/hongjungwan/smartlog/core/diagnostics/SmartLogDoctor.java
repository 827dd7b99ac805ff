package io.github.hongjungwan.smartlog.core.diagnostics;

import io.github.hongjungwan.smartlog.api.SeverityScale;
import io.github.hongjungwan.smartlog.api.config.SmartLogConfig;
import io.github.hongjungwan.smartlog.api.exception.LockException;
import io.github.hongjungwan.smartlog.core.internal.InterProcessMutex;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * SDK 자가 진단. 로거별 디렉토리 쓰기 권한, 잠금 획득 가능 여부, 설정 이상 여부 검사.
 *
 * <p>OFF 로거는 파일 시스템을 건드리지 않도록 검사를 건너뛴다.</p>
 */
@Slf4j
public class SmartLogDoctor {

    private final Map<String, SmartLogConfig> configs;

    public SmartLogDoctor(Map<String, SmartLogConfig> configs) {
        this.configs = new LinkedHashMap<>(configs);
    }

    /** 모든 진단 검사 실행 */
    public DiagnosticReport diagnose() {
        log.info("Running SmartLog diagnostic checks for {} logger(s)...", configs.size());

        List<DiagnosticResult> results = new ArrayList<>();
        configs.forEach((name, config) -> results.addAll(diagnose(name, config)));

        DiagnosticReport report = new DiagnosticReport(results);
        if (report.hasFailures()) {
            log.warn("Diagnostic failures detected:");
            report.getFailedChecks().forEach(result ->
                    log.warn("  - {}: {}", result.getName(), result.getMessage()));
        } else {
            log.info("All diagnostic checks passed successfully");
        }
        report.getWarnings().forEach(result ->
                log.warn("  - {}: {}", result.getName(), result.getMessage()));
        return report;
    }

    List<DiagnosticResult> diagnose(String name, SmartLogConfig config) {
        List<DiagnosticResult> results = new ArrayList<>();
        if (config.isOff()) {
            results.add(DiagnosticResult.success(name + ": Logging", "Logging is OFF, file checks skipped"));
            return results;
        }

        Path directory = toPath(config.getDirectory());
        if (directory == null) {
            results.add(DiagnosticResult.failure(name + ": Directory Access",
                    "Invalid or missing log directory: " + config.getDirectory()));
        } else {
            DiagnosticResult directoryCheck = checkDirectoryWritable(name, directory);
            results.add(directoryCheck);
            if (directoryCheck.isSuccess()) {
                results.add(checkLockAcquisition(name, directory));
            }
        }
        results.add(checkThresholds(name, config));
        results.add(checkRetention(name, config));
        return results;
    }

    private static Path toPath(String directory) {
        if (directory == null || directory.isBlank()) {
            return null;
        }
        try {
            return Path.of(directory);
        } catch (InvalidPathException e) {
            return null;
        }
    }

    /** 검사 1: 디렉토리 생성 및 쓰기 권한 */
    private DiagnosticResult checkDirectoryWritable(String name, Path directory) {
        String check = name + ": Directory Access";
        try {
            Files.createDirectories(directory);

            Path testFile = directory.resolve(".smart-log-write-test");
            Files.writeString(testFile, "test");
            String content = Files.readString(testFile);
            Files.deleteIfExists(testFile);

            if ("test".equals(content)) {
                return DiagnosticResult.success(check, "Log directory writable: " + directory);
            }
            return DiagnosticResult.failure(check, "Write verification failed: " + directory);
        } catch (IOException e) {
            return DiagnosticResult.failure(check, "Cannot write to log directory " + directory + ": " + e.getMessage());
        }
    }

    /** 검사 2: 잠금 파일 획득/해제 */
    private DiagnosticResult checkLockAcquisition(String name, Path directory) {
        String check = name + ": Lock File";
        InterProcessMutex mutex = new InterProcessMutex(directory);
        try {
            mutex.acquire();
            mutex.release();
            return DiagnosticResult.success(check, "Lock file usable: " + mutex.getLockFile());
        } catch (LockException e) {
            return DiagnosticResult.failure(check, e.getMessage());
        }
    }

    /** 검사 3: smart 임계치가 기록 임계치보다 덜 심각하면 모든 윈도우가 escalation 된다 */
    private DiagnosticResult checkThresholds(String name, SmartLogConfig config) {
        String check = name + ": Thresholds";
        int threshold = config.getSeverityThreshold();
        int smart = config.getSmartSeverityThreshold();
        if (smart != SeverityScale.OFF && smart >= threshold) {
            return DiagnosticResult.warning(check, "smartSeverityThreshold (" + SeverityScale.label(smart)
                    + ") is not more severe than severityThreshold (" + SeverityScale.label(threshold)
                    + "); every written record escalates to full verbosity");
        }
        return DiagnosticResult.success(check, "Thresholds consistent");
    }

    /** 검사 4: 보관 기간/회전 크기 */
    private DiagnosticResult checkRetention(String name, SmartLogConfig config) {
        String check = name + ": Retention";
        if (config.getMaxDays() == 0) {
            return DiagnosticResult.warning(check, "maxDays is 0; all log files except the active one are deleted on startup");
        }
        if (config.getMaxFileSize() == 0) {
            return DiagnosticResult.warning(check, "maxFileSize is 0; every startup rotates to a new file");
        }
        return DiagnosticResult.success(check,
                "Keeping " + config.getMaxDays() + " days, rotating above " + config.getMaxFileSize() + " bytes");
    }

    /** 진단 결과 */
    public static class DiagnosticResult {
        private final String name;
        private final Status status;
        private final String message;

        public enum Status {
            SUCCESS, WARNING, FAILURE
        }

        private DiagnosticResult(String name, Status status, String message) {
            this.name = name;
            this.status = status;
            this.message = message;
        }

        public static DiagnosticResult success(String name, String message) {
            return new DiagnosticResult(name, Status.SUCCESS, message);
        }

        public static DiagnosticResult warning(String name, String message) {
            return new DiagnosticResult(name, Status.WARNING, message);
        }

        public static DiagnosticResult failure(String name, String message) {
            return new DiagnosticResult(name, Status.FAILURE, message);
        }

        public String getName() {
            return name;
        }

        public Status getStatus() {
            return status;
        }

        public String getMessage() {
            return message;
        }

        public boolean isSuccess() {
            return status == Status.SUCCESS;
        }

        public boolean isFailure() {
            return status == Status.FAILURE;
        }
    }

    /** 진단 리포트 */
    public static class DiagnosticReport {
        private final List<DiagnosticResult> results;

        public DiagnosticReport(List<DiagnosticResult> results) {
            this.results = new ArrayList<>(results);
        }

        public boolean hasFailures() {
            return results.stream().anyMatch(DiagnosticResult::isFailure);
        }

        public List<DiagnosticResult> getFailedChecks() {
            return results.stream()
                    .filter(DiagnosticResult::isFailure)
                    .toList();
        }

        public List<DiagnosticResult> getWarnings() {
            return results.stream()
                    .filter(result -> result.getStatus() == DiagnosticResult.Status.WARNING)
                    .toList();
        }

        public List<DiagnosticResult> getAllResults() {
            return new ArrayList<>(results);
        }
    }
}
