package io.github.hongjungwan.smartlog.core.internal;

import io.github.hongjungwan.smartlog.api.exception.LockException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assumptions.assumeThat;

@DisplayName("InterProcessMutex 테스트")
class InterProcessMutexTest {

    private static final long CHILD_HOLD_MILLIS = 1500;

    @TempDir
    Path tempDir;

    @Nested
    @DisplayName("잠금 파일")
    class LockFileTests {

        @Test
        @DisplayName("잠금 중에는 Locked, 해제 후에는 Unlocked를 기록해야 한다")
        void shouldWriteMarkers() throws IOException {
            // given
            InterProcessMutex mutex = new InterProcessMutex(tempDir);

            // when
            mutex.acquire();
            String whileLocked = Files.readString(mutex.getLockFile());
            mutex.release();
            String afterRelease = Files.readString(mutex.getLockFile());

            // then
            assertThat(mutex.getLockFile()).isEqualTo(tempDir.resolve(".lockfile"));
            assertThat(whileLocked).isEqualTo("Locked\n");
            assertThat(afterRelease).isEqualTo("Unlocked\n");
        }

        @Test
        @DisplayName("디렉토리가 없으면 LockException을 던져야 한다")
        void shouldFailWhenDirectoryMissing() {
            // given
            InterProcessMutex mutex = new InterProcessMutex(tempDir.resolve("missing"));

            // when & then
            assertThatThrownBy(mutex::acquire).isInstanceOf(LockException.class);
            assertThat(mutex.isHeldByCurrentThread()).isFalse();
        }
    }

    @Nested
    @DisplayName("해제")
    class ReleaseTests {

        @Test
        @DisplayName("잡지 않은 잠금 해제는 경고만 남기고 실패하지 않아야 한다")
        void shouldIgnoreReleaseWithoutAcquire() {
            InterProcessMutex mutex = new InterProcessMutex(tempDir);

            assertThatCode(mutex::release).doesNotThrowAnyException();
        }

        @Test
        @DisplayName("해제 후 다시 획득할 수 있어야 한다")
        void shouldReacquireAfterRelease() {
            // given
            InterProcessMutex mutex = new InterProcessMutex(tempDir);
            mutex.acquire();
            mutex.release();

            // when
            mutex.acquire();

            // then
            assertThat(mutex.isHeldByCurrentThread()).isTrue();
            mutex.release();
        }

        @Test
        @DisplayName("같은 스레드에서 중복 획득은 거부해야 한다")
        void shouldRejectNestedAcquire() {
            // given
            InterProcessMutex first = new InterProcessMutex(tempDir);
            InterProcessMutex second = new InterProcessMutex(tempDir);
            first.acquire();

            try {
                // when & then
                assertThatThrownBy(second::acquire).isInstanceOf(LockException.class);
            } finally {
                first.release();
            }
        }
    }

    @Nested
    @DisplayName("배타성")
    class ExclusionTests {

        @Test
        @DisplayName("같은 디렉토리의 다른 인스턴스는 해제될 때까지 대기해야 한다")
        void shouldBlockOtherHolders() throws Exception {
            // given
            InterProcessMutex holder = new InterProcessMutex(tempDir);
            InterProcessMutex waiter = new InterProcessMutex(tempDir);
            CountDownLatch started = new CountDownLatch(1);
            AtomicBoolean acquired = new AtomicBoolean(false);
            ExecutorService executor = Executors.newSingleThreadExecutor();

            holder.acquire();
            try {
                // when
                Future<?> future = executor.submit(() -> {
                    started.countDown();
                    waiter.acquire();
                    acquired.set(true);
                    waiter.release();
                });
                started.await();
                Thread.sleep(100);

                // then
                assertThat(acquired).isFalse();
                holder.release();
                future.get(5, TimeUnit.SECONDS);
                assertThat(acquired).isTrue();
            } finally {
                executor.shutdownNow();
            }
        }

        @Test
        @DisplayName("심볼릭 링크로 같은 디렉토리를 가리키는 인스턴스도 해제될 때까지 대기해야 한다")
        void shouldBlockHoldersThroughSymlink() throws Exception {
            // given
            Path real = Files.createDirectory(tempDir.resolve("real"));
            Path link = tempDir.resolve("link");
            assumeThat(createSymlink(link, real)).isTrue();

            InterProcessMutex holder = new InterProcessMutex(real);
            InterProcessMutex waiter = new InterProcessMutex(link);
            CountDownLatch started = new CountDownLatch(1);
            AtomicBoolean acquired = new AtomicBoolean(false);
            ExecutorService executor = Executors.newSingleThreadExecutor();

            holder.acquire();
            try {
                // when
                Future<?> future = executor.submit(() -> {
                    started.countDown();
                    waiter.acquire();
                    acquired.set(true);
                    waiter.release();
                });
                started.await();
                Thread.sleep(100);

                // then
                assertThat(acquired).isFalse();
                assertThat(future).isNotDone();
                holder.release();
                future.get(5, TimeUnit.SECONDS);
                assertThat(acquired).isTrue();
            } finally {
                executor.shutdownNow();
            }
        }

        @Test
        @Timeout(30)
        @DisplayName("다른 프로세스가 잡은 잠금은 그 프로세스가 해제할 때까지 대기해야 한다")
        void shouldBlockUntilOtherProcessReleases() throws Exception {
            // given
            Process child = startLockHolder(tempDir, CHILD_HOLD_MILLIS);
            try {
                BufferedReader output = new BufferedReader(
                        new InputStreamReader(child.getInputStream(), StandardCharsets.UTF_8));
                awaitLine(output, LockHoldingProcess.LOCKED);

                try (FileChannel channel = FileChannel.open(tempDir.resolve(".lockfile"), StandardOpenOption.WRITE)) {
                    assertThat(channel.tryLock()).isNull();
                }
                InterProcessMutex mutex = new InterProcessMutex(tempDir);

                // when
                long start = System.nanoTime();
                mutex.acquire();
                long waitedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

                // then
                try {
                    assertThat(waitedMillis).isGreaterThanOrEqualTo(CHILD_HOLD_MILLIS / 3);
                    assertThat(Files.readString(mutex.getLockFile())).isEqualTo("Locked\n");
                } finally {
                    mutex.release();
                }
                assertThat(child.waitFor(10, TimeUnit.SECONDS)).isTrue();
                assertThat(child.exitValue()).isZero();
            } finally {
                child.destroyForcibly();
            }
        }
    }

    private static Process startLockHolder(Path directory, long holdMillis) throws IOException {
        String java = Path.of(System.getProperty("java.home"), "bin", "java").toString();
        return new ProcessBuilder(java,
                "-cp", System.getProperty("java.class.path"),
                LockHoldingProcess.class.getName(),
                directory.toString(),
                String.valueOf(holdMillis))
                .redirectErrorStream(true)
                .start();
    }

    private static void awaitLine(BufferedReader output, String expected) throws IOException {
        String line;
        while ((line = output.readLine()) != null) {
            if (line.equals(expected)) {
                return;
            }
        }
        throw new AssertionError("Lock holder exited before printing " + expected);
    }

    private static boolean createSymlink(Path link, Path target) {
        try {
            Files.createSymbolicLink(link, target);
            return true;
        } catch (IOException | UnsupportedOperationException e) {
            return false;
        }
    }
}
