package io.github.hongjungwan.smartlog.core.internal;

import io.github.hongjungwan.smartlog.api.LogOptions;
import io.github.hongjungwan.smartlog.api.Severity;
import io.github.hongjungwan.smartlog.api.SeverityScale;
import io.github.hongjungwan.smartlog.api.SmartLogger;
import io.github.hongjungwan.smartlog.api.config.SmartLogConfig;
import io.github.hongjungwan.smartlog.api.domain.LogRecord;
import io.github.hongjungwan.smartlog.api.exception.ConstructionException;
import io.github.hongjungwan.smartlog.api.exception.LockException;
import io.github.hongjungwan.smartlog.api.exception.LogPermissionException;
import io.github.hongjungwan.smartlog.api.exception.SmartLogException;
import io.github.hongjungwan.smartlog.api.exception.WriteException;
import io.github.hongjungwan.smartlog.spi.CallSite;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 파일 기반 SmartLogger 구현. 심각도별 큐에 버퍼링하고 flush 시 smart 규칙으로 CSV 기록.
 *
 * <p>생성 시 디렉토리 생성, 활성 파일 결정(회전), 보관 기간 초과 파일 삭제를 잠금 안에서
 * 한 번 수행한다. severityThreshold가 OFF면 파일 시스템을 전혀 건드리지 않는다.</p>
 *
 * <p>큐 변경(순번 증가 + append)은 ReentrantLock으로 원자적으로 처리하므로 여러 스레드에서
 * 공유해도 된다. flush는 배치를 큐에서 먼저 떼어낸 뒤 I/O를 수행하므로 로깅 호출이
 * 디스크 I/O를 기다리지 않는다.</p>
 */
@Slf4j
public class DefaultSmartLogger implements SmartLogger {

    private final String name;
    @Getter
    private final SmartLogConfig config;
    @Getter
    private final Path logDirectory;

    private final LogFileManager fileManager;
    private final InterProcessMutex mutex;
    private final CsvLogWriter csvWriter = new CsvLogWriter();
    private final LogDataSerializer dataSerializer = new LogDataSerializer();

    private final ReentrantLock queueLock = new ReentrantLock();
    private final List<List<LogRecord>> queues = new ArrayList<>(Severity.count());
    private long nextSequence = 0;
    private boolean verbose = false;

    private final AtomicBoolean closed = new AtomicBoolean(false);

    /**
     * @throws ConstructionException 디렉토리/잠금/로그 파일 준비 실패. 권한 문제는 {@link LogPermissionException}
     */
    public DefaultSmartLogger(String name, SmartLogConfig config) {
        this.name = Objects.requireNonNull(name, "name");
        this.config = Objects.requireNonNull(config, "config");
        resetQueues();

        if (config.getDirectory() == null) {
            throw new ConstructionException("Log directory is required");
        }
        this.logDirectory = normalizeDirectory(config.getDirectory());

        if (config.isOff()) {
            this.fileManager = null;
            this.mutex = null;
            log.debug("Logger '{}' is OFF - no files will be created in {}", name, logDirectory);
            return;
        }

        this.fileManager = new LogFileManager(logDirectory, config);
        this.mutex = new InterProcessMutex(logDirectory);
        initialize();
    }

    /** 끝의 경로 구분자 제거 ("/var/log/app/" → "/var/log/app") */
    static Path normalizeDirectory(String directory) {
        String trimmed = directory;
        while (trimmed.length() > 1 && (trimmed.endsWith("/") || trimmed.endsWith("\\"))) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return Path.of(trimmed);
    }

    private void initialize() {
        try {
            fileManager.ensureDirectory();
        } catch (IOException e) {
            throw new ConstructionException("Cannot create log directory: " + logDirectory, e);
        }

        Path lockFile = mutex.getLockFile();
        if (Files.exists(lockFile) && !Files.isWritable(lockFile)) {
            throw new LogPermissionException("Please check permissions on lock file", lockFile);
        }

        try {
            mutex.acquire();
        } catch (LockException e) {
            throw new ConstructionException("Could not lock " + lockFile, e);
        }

        SmartLogException failure = null;
        try {
            fileManager.resolveActiveFile();
            fileManager.open();
            fileManager.deleteExpired(config.getClock().instant());
        } catch (ConstructionException e) {
            failure = e;
        } catch (IOException | SmartLogException e) {
            failure = new ConstructionException("Failed to prepare log file in " + logDirectory, e);
        }

        // 실패 여부와 관계없이 잠금부터 해제한 뒤 예외 전파
        try {
            mutex.release();
        } catch (LockException e) {
            if (failure == null) {
                failure = new ConstructionException("Could not unlock " + lockFile, e);
            } else {
                failure.addSuppressed(e);
            }
        }

        if (failure != null) {
            closeFileAfterFailure(failure);
            throw failure;
        }

        log.debug("Logger '{}' writing to {}", name, fileManager.getActiveFile());
    }

    @Override
    public void log(String message, Severity severity, Object data, LogOptions options) {
        if (!isEnabled()) {
            return;
        }
        Objects.requireNonNull(severity, "severity");
        LogOptions opts = options == null ? LogOptions.none() : options;
        enqueue(severity, message, null, resolveCallSite(opts), opts.hasData() ? opts.getData() : data);
    }

    @Override
    public void log(Throwable throwable, Severity severity, Object data, LogOptions options) {
        if (!isEnabled()) {
            return;
        }
        Objects.requireNonNull(throwable, "throwable");
        Objects.requireNonNull(severity, "severity");
        LogOptions opts = options == null ? LogOptions.none() : options;
        enqueue(severity,
                ThrowableFormatter.message(throwable),
                ThrowableFormatter.trace(throwable),
                ThrowableFormatter.origin(throwable),
                opts.hasData() ? opts.getData() : data);
    }

    @Override
    public void log(String message, String severity, Object data, LogOptions options) {
        if (!isEnabled()) {
            return;
        }
        log(message, SeverityScale.severity(severity), data, options);
    }

    private CallSite resolveCallSite(LogOptions options) {
        if (options.hasLocation()) {
            return new CallSite(options.getFile(), options.getLine(), options.getFunction());
        }
        CallSite resolved = config.getCallSiteResolver().resolve();
        if (options.getFunction() != null) {
            return new CallSite(resolved.file(), resolved.line(), options.getFunction());
        }
        return resolved;
    }

    private void enqueue(Severity severity, String message, String trace, CallSite site, Object data) {
        String serializedData = dataSerializer.serialize(data);

        queueLock.lock();
        try {
            if (severity.isAtLeastAsSevereAs(config.getSmartSeverityThreshold())) {
                verbose = true;
            }
            LogRecord record = LogRecord.builder()
                    .sequence(nextSequence++)
                    .timestamp(config.getTimestampFormatter().format(ZonedDateTime.now(config.getClock())))
                    .severity(severity)
                    .context(site.function())
                    .message(message)
                    .trace(trace)
                    .data(serializedData)
                    .location(site.toLocation())
                    .build();
            queues.get(severity.rank()).add(record);
        } finally {
            queueLock.unlock();
        }
    }

    @Override
    public void flush() {
        if (config.isOff() || closed.get()) {
            return;
        }
        writeBatch(drainWindow());
    }

    /**
     * 현재 flush 윈도우에서 기록할 레코드를 순번 순으로 꺼내고 큐와 verbose 플래그를 초기화.
     * 기록 대상이 아닌 레코드는 버려진다.
     */
    private List<LogRecord> drainWindow() {
        queueLock.lock();
        try {
            int lastRank = verbose ? Severity.count() - 1 : config.getSeverityThreshold();
            List<LogRecord> batch = new ArrayList<>();
            for (int rank = 0; rank <= lastRank; rank++) {
                batch.addAll(queues.get(rank));
            }
            batch.sort(Comparator.comparingLong(LogRecord::getSequence));

            resetQueues();
            verbose = false;
            return batch;
        } finally {
            queueLock.unlock();
        }
    }

    private void writeBatch(List<LogRecord> batch) {
        if (batch.isEmpty()) {
            return;
        }

        byte[] rows;
        try {
            rows = csvWriter.toCsv(batch);
        } catch (IOException e) {
            throw new WriteException("Failed to format " + batch.size() + " log records", batch.size(), e);
        }

        mutex.acquire();

        WriteException failure = null;
        try {
            appendRows(rows);
        } catch (IOException e) {
            failure = new WriteException("Failed to write " + batch.size() + " log records to "
                    + fileManager.getActiveFile(), batch.size(), e);
        }

        try {
            mutex.release();
        } catch (LockException e) {
            if (failure == null) {
                throw e;
            }
            failure.addSuppressed(e);
        }

        if (failure != null) {
            throw failure;
        }
    }

    /** 잠금을 잡은 상태에서 호출된다 */
    protected void appendRows(byte[] rows) throws IOException {
        fileManager.append(rows);
    }

    protected LogFileManager getFileManager() {
        return fileManager;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        if (config.isOff()) {
            return;
        }

        SmartLogException failure = null;
        try {
            writeBatch(drainWindow());
        } catch (SmartLogException e) {
            failure = e;
        }

        try {
            fileManager.close();
        } catch (IOException e) {
            WriteException closeFailure = new WriteException("Failed to close log file " + fileManager.getActiveFile(), 0, e);
            if (failure == null) {
                failure = closeFailure;
            } else {
                failure.addSuppressed(closeFailure);
            }
        }

        if (failure != null) {
            throw failure;
        }
        log.debug("Logger '{}' closed", name);
    }

    private void closeFileAfterFailure(SmartLogException failure) {
        try {
            fileManager.close();
        } catch (IOException e) {
            failure.addSuppressed(e);
        }
    }

    private void resetQueues() {
        queues.clear();
        for (int i = 0; i < Severity.count(); i++) {
            queues.add(new ArrayList<>());
        }
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public boolean isEnabled() {
        return !config.isOff() && !closed.get();
    }

    public boolean isClosed() {
        return closed.get();
    }

    /** 현재 flush 윈도우에서 escalation이 발생했는지 */
    public boolean isVerbose() {
        queueLock.lock();
        try {
            return verbose;
        } finally {
            queueLock.unlock();
        }
    }

    /** 버퍼에 남아 있는 레코드 수 (전체 심각도) */
    public int pendingCount() {
        queueLock.lock();
        try {
            return queues.stream().mapToInt(List::size).sum();
        } finally {
            queueLock.unlock();
        }
    }

    /** 버퍼된 레코드 스냅샷 (순번 순) */
    public List<LogRecord> pendingRecords() {
        queueLock.lock();
        try {
            return queues.stream()
                    .flatMap(List::stream)
                    .sorted(Comparator.comparingLong(LogRecord::getSequence))
                    .toList();
        } finally {
            queueLock.unlock();
        }
    }

    /** 활성 로그 파일. OFF면 null */
    public Path getActiveFile() {
        return fileManager == null ? null : fileManager.getActiveFile();
    }
}
