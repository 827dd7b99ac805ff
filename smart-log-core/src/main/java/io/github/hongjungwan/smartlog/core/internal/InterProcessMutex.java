package io.github.hongjungwan.smartlog.core.internal;

import io.github.hongjungwan.smartlog.api.exception.LockException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.FileLockInterruptionException;
import java.nio.channels.OverlappingFileLockException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 로그 디렉토리 단위의 프로세스 간 배타 잠금. 파일 생성, 회전, 쓰기, 삭제를 직렬화한다.
 *
 * <p>JDK의 FileLock은 프로세스 단위이므로, 같은 JVM 안의 스레드/인스턴스는 경로별
 * ReentrantLock으로 먼저 직렬화한 뒤 파일 잠금을 잡는다. 경로별 잠금은 디렉토리의 실제 경로
 * (심볼릭 링크 해석 후)로 찾으며, 디렉토리가 생성된 뒤인 첫 acquire 시점에 결정된다.
 * 잠금 파일 내용("Locked"/"Unlocked")은 디버깅용 표시일 뿐이다.</p>
 */
@Slf4j
public class InterProcessMutex {

    public static final String LOCK_FILE_NAME = ".lockfile";

    private static final byte[] LOCKED_MARKER = "Locked\n".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] UNLOCKED_MARKER = "Unlocked\n".getBytes(StandardCharsets.US_ASCII);

    private static final long OVERLAP_RETRY_MILLIS = 10;

    private static final ConcurrentMap<Path, ReentrantLock> IN_PROCESS_LOCKS = new ConcurrentHashMap<>();

    @Getter
    private final Path lockFile;
    private volatile ReentrantLock inProcessLock;

    private FileChannel channel;
    private FileLock fileLock;

    public InterProcessMutex(Path directory) {
        this.lockFile = lockFileFor(directory);
    }

    /** 디렉토리에 대응하는 잠금 파일 경로 */
    public static Path lockFileFor(Path directory) {
        return directory.resolve(LOCK_FILE_NAME);
    }

    /**
     * 잠금 획득. 다른 프로세스/스레드가 잡고 있으면 블로킹 (타임아웃 없음).
     *
     * @throws LockException 잠금 파일을 쓰기 모드로 열 수 없거나 잠글 수 없는 경우
     */
    public void acquire() {
        ReentrantLock lock = inProcessLock();
        lock.lock();
        if (lock.getHoldCount() > 1) {
            lock.unlock();
            throw new LockException("Lock already held by current thread: " + lockFile, null);
        }

        try {
            channel = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
            fileLock = lockBlocking(channel);
            mark(LOCKED_MARKER);
        } catch (IOException e) {
            LockException failure = new LockException("Could not lock " + lockFile, e);
            closeAfterFailure(failure);
            lock.unlock();
            throw failure;
        }
    }

    /**
     * 잠금 해제. 잡고 있지 않은 상태에서 호출하면 경고만 남긴다.
     *
     * @throws LockException 파일 잠금 해제 실패 (in-process 잠금은 항상 해제됨)
     */
    public void release() {
        if (!isHeldByCurrentThread()) {
            log.warn("release() called on [{}] but the lock is not held by the caller", lockFile);
            return;
        }

        IOException failure = null;
        try {
            mark(UNLOCKED_MARKER);
        } catch (IOException e) {
            failure = e;
        }
        try {
            fileLock.release();
        } catch (IOException e) {
            failure = chain(failure, e);
        }
        try {
            channel.close();
        } catch (IOException e) {
            failure = chain(failure, e);
        } finally {
            fileLock = null;
            channel = null;
            inProcessLock.unlock();
        }

        if (failure != null) {
            throw new LockException("Failed to release lock " + lockFile, failure);
        }
    }

    public boolean isHeldByCurrentThread() {
        ReentrantLock lock = inProcessLock;
        return lock != null && lock.isHeldByCurrentThread() && fileLock != null;
    }

    private ReentrantLock inProcessLock() {
        ReentrantLock lock = inProcessLock;
        if (lock == null) {
            lock = IN_PROCESS_LOCKS.computeIfAbsent(lockKey(), path -> new ReentrantLock());
            inProcessLock = lock;
        }
        return lock;
    }

    /** 심볼릭 링크로 같은 디렉토리를 가리키는 인스턴스가 같은 잠금을 공유하도록 실제 경로 사용 */
    private Path lockKey() {
        Path directory = lockFile.toAbsolutePath().getParent();
        try {
            return directory.toRealPath().resolve(LOCK_FILE_NAME);
        } catch (IOException e) {
            throw new LockException("Lock directory is not accessible: " + directory, e);
        }
    }

    /**
     * 파일 잠금을 블로킹으로 획득. 하드 링크나 바인드 마운트처럼 실제 경로로도 구분되지 않는 별칭을
     * 같은 JVM이 이미 잠근 경우 OverlappingFileLockException이 나므로 해제될 때까지 재시도한다.
     */
    private static FileLock lockBlocking(FileChannel channel) throws IOException {
        while (true) {
            try {
                return channel.lock();
            } catch (OverlappingFileLockException e) {
                try {
                    Thread.sleep(OVERLAP_RETRY_MILLIS);
                } catch (InterruptedException interrupted) {
                    Thread.currentThread().interrupt();
                    throw new FileLockInterruptionException();
                }
            }
        }
    }

    private void mark(byte[] marker) throws IOException {
        channel.truncate(0);
        channel.write(ByteBuffer.wrap(marker), 0);
        channel.force(false);
    }

    private void closeAfterFailure(LockException failure) {
        if (channel == null) {
            return;
        }
        try {
            channel.close();
        } catch (IOException e) {
            failure.addSuppressed(e);
        } finally {
            channel = null;
            fileLock = null;
        }
    }

    private static IOException chain(IOException first, IOException next) {
        if (first == null) {
            return next;
        }
        first.addSuppressed(next);
        return first;
    }
}
