package io.github.hongjungwan.smartlog.core.internal;

import io.github.hongjungwan.smartlog.api.config.SmartLogConfig;
import io.github.hongjungwan.smartlog.api.exception.LogPermissionException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.FileAttribute;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * 로그 디렉토리 관리. 활성 파일 결정(크기 기반 회전), append 핸들, 보관 기간 초과 파일 삭제.
 *
 * <p>파일명 형식: {@code log_<yyyy-MM-dd>-<NNN>.csv}. 회전과 삭제는 로거 생성 시 한 번만
 * 수행되며 호출자가 {@link InterProcessMutex}를 잡고 있어야 한다.</p>
 */
@Slf4j
public class LogFileManager implements Closeable {

    public static final String FILE_PREFIX = "log_";
    public static final String FILE_SUFFIX = ".csv";

    private static final Pattern LOG_FILE_PATTERN =
            Pattern.compile("log_(?<date>[0-9]{4}-[0-9]{2}-[0-9]{2})(-[0-9]+)?\\.csv");
    private static final long SECONDS_PER_DAY = 24L * 60 * 60;

    @Getter
    private final Path directory;
    private final SmartLogConfig config;
    private final boolean posix;

    @Getter
    private Path activeFile;
    private OutputStream out;

    public LogFileManager(Path directory, SmartLogConfig config) {
        this.directory = directory;
        this.config = config;
        this.posix = directory.getFileSystem().supportedFileAttributeViews().contains("posix");
    }

    /** 디렉토리(및 상위 디렉토리)가 없으면 설정된 권한으로 생성 */
    public void ensureDirectory() throws IOException {
        if (Files.isDirectory(directory)) {
            return;
        }
        if (posix) {
            Files.createDirectories(directory, permissionAttribute());
        } else {
            Files.createDirectories(directory);
        }
        log.debug("Created log directory: {}", directory);
    }

    /**
     * 오늘 날짜의 활성 파일 결정. 000부터 시작해 파일이 존재하고 maxFileSize를 넘는 동안 번호 증가.
     *
     * @throws LogPermissionException 결정된 파일이 존재하지만 쓸 수 없는 경우
     */
    public Path resolveActiveFile() throws IOException {
        String date = LocalDate.now(config.getClock()).format(DateTimeFormatter.ISO_LOCAL_DATE);

        int counter = 0;
        Path candidate = fileFor(date, counter);
        while (Files.exists(candidate) && Files.size(candidate) > config.getMaxFileSize()) {
            candidate = fileFor(date, ++counter);
        }

        if (Files.exists(candidate) && !Files.isWritable(candidate)) {
            throw new LogPermissionException("Cannot write to log file. Please check permissions on log file", candidate);
        }

        if (counter > 0) {
            log.debug("Rotated log file to {} (maxFileSize={})", candidate.getFileName(), config.getMaxFileSize());
        }
        activeFile = candidate;
        return candidate;
    }

    private Path fileFor(String date, int counter) {
        return directory.resolve(FILE_PREFIX + date + "-" + String.format("%03d", counter) + FILE_SUFFIX);
    }

    /** 활성 파일을 append 모드로 연다. 새 파일은 설정된 권한으로 생성 */
    public void open() throws IOException {
        if (activeFile == null) {
            resolveActiveFile();
        }
        if (posix && !Files.exists(activeFile)) {
            try {
                Files.createFile(activeFile, permissionAttribute());
            } catch (FileAlreadyExistsException e) {
                log.debug("Log file created concurrently: {}", activeFile);
            }
        }
        out = Files.newOutputStream(activeFile,
                StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
    }

    public boolean isOpen() {
        return out != null;
    }

    /** 배치 한 번을 쓰고 OS로 flush */
    public void append(byte[] rows) throws IOException {
        if (out == null) {
            throw new IOException("Log file is not open: " + activeFile);
        }
        out.write(rows);
        out.flush();
    }

    /**
     * 보관 기간이 지난 로그 파일 삭제. 파일명의 날짜(자정 기준)가 {@code reference - maxDays}보다
     * 엄격히 이전이면 삭제한다. 날짜를 해석할 수 없는 파일과 활성 파일은 건드리지 않는다.
     *
     * @return 삭제한 파일 수
     */
    public int deleteExpired(Instant reference) throws IOException {
        Instant cutoff = reference.minusSeconds(config.getMaxDays() * SECONDS_PER_DAY);
        ZoneId zone = config.getClock().getZone();

        int deleted = 0;
        for (Path file : listLogFiles()) {
            if (file.equals(activeFile)) {
                continue;
            }
            Optional<LocalDate> fileDate = parseDate(file.getFileName().toString());
            if (fileDate.isPresent() && fileDate.get().atStartOfDay(zone).toInstant().isBefore(cutoff)) {
                Files.deleteIfExists(file);
                deleted++;
                log.debug("Deleted expired log file: {}", file);
            }
        }

        if (deleted > 0) {
            log.info("Deleted {} log file(s) older than {} days from {}", deleted, config.getMaxDays(), directory);
        }
        return deleted;
    }

    /** 파일명 규칙에 맞는 로그 파일 목록 (이름순) */
    public List<Path> listLogFiles() throws IOException {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(directory)) {
            return files
                    .filter(Files::isRegularFile)
                    .filter(path -> LOG_FILE_PATTERN.matcher(path.getFileName().toString()).matches())
                    .sorted()
                    .toList();
        }
    }

    /** 파일명에 포함된 날짜. 패턴 불일치 또는 잘못된 날짜면 empty */
    public static Optional<LocalDate> parseDate(String fileName) {
        Matcher matcher = LOG_FILE_PATTERN.matcher(fileName);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        try {
            return Optional.of(LocalDate.parse(matcher.group("date")));
        } catch (DateTimeParseException e) {
            log.debug("Ignoring log file with unparsable date: {}", fileName);
            return Optional.empty();
        }
    }

    private FileAttribute<Set<PosixFilePermission>> permissionAttribute() {
        return PosixFilePermissions.asFileAttribute(config.getDefaultPermission());
    }

    @Override
    public void close() throws IOException {
        if (out != null) {
            try {
                out.close();
            } finally {
                out = null;
            }
        }
    }
}
