package io.github.hongjungwan.smartlog.api;

import io.github.hongjungwan.smartlog.api.config.SmartLogConfig;
import io.github.hongjungwan.smartlog.api.exception.ConfigurationException;
import io.github.hongjungwan.smartlog.api.exception.SmartLogException;
import io.github.hongjungwan.smartlog.core.internal.DefaultSmartLogger;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BiFunction;

/**
 * 이름별 SmartLogger 모음. 전역 싱글톤 대신 애플리케이션 진입점이 소유하고 참조로 전달한다.
 *
 * <pre>{@code
 * try (SmartLoggerRegistry registry = new SmartLoggerRegistry()) {
 *     registry.add(Map.of(
 *             "default", SmartLogConfig.forDirectory("/var/log/app"),
 *             "payment", SmartLogConfig.builder()
 *                     .directory("/var/log/app/payment")
 *                     .severityThreshold("error")
 *                     .smartSeverityThreshold("critical")
 *                     .build()));
 *
 *     registry.get().ifPresent(log -> log.info("Started"));
 * }
 * }</pre>
 */
@Slf4j
public class SmartLoggerRegistry implements AutoCloseable {

    public static final String DEFAULT_LOGGER = "default";

    private final Map<String, SmartLogger> loggers = new LinkedHashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final BiFunction<String, SmartLogConfig, SmartLogger> loggerFactory;
    private boolean closed = false;

    public SmartLoggerRegistry() {
        this(DefaultSmartLogger::new);
    }

    /** 테스트 또는 커스텀 구현용 팩토리 지정 */
    public SmartLoggerRegistry(BiFunction<String, SmartLogConfig, SmartLogger> loggerFactory) {
        this.loggerFactory = loggerFactory;
    }

    /**
     * 설정별 로거 생성 후 등록. 전부 성공해야 등록되며, 하나라도 실패하면 이미 만든
     * 로거를 닫고 예외를 전파한다 (all-or-nothing).
     *
     * @throws ConfigurationException 이미 등록된 이름 또는 닫힌 레지스트리
     * @throws io.github.hongjungwan.smartlog.api.exception.ConstructionException 로거 생성 실패
     */
    public void add(Map<String, SmartLogConfig> configs) {
        lock.lock();
        try {
            if (closed) {
                throw new ConfigurationException("Registry is closed");
            }
            for (String name : configs.keySet()) {
                if (loggers.containsKey(name)) {
                    throw new ConfigurationException("Logger already registered: " + name);
                }
            }

            Map<String, SmartLogger> created = new LinkedHashMap<>();
            try {
                for (Map.Entry<String, SmartLogConfig> entry : configs.entrySet()) {
                    created.put(entry.getKey(), loggerFactory.apply(entry.getKey(), entry.getValue()));
                }
            } catch (RuntimeException e) {
                discard(created, e);
                throw e;
            }

            loggers.putAll(created);
            log.info("Registered {} logger(s): {}", created.size(), created.keySet());
        } finally {
            lock.unlock();
        }
    }

    /**
     * 목록 형식 일괄 설정: 첫 원소는 디렉토리, 두 번째 원소(선택)는 이름 기반 override 맵.
     *
     * <pre>{@code
     * registry.addFromSettings(Map.of(
     *         "default", List.of("/var/log/app"),
     *         "payment", List.of("/var/log/app/payment", Map.of("severityThreshold", "error"))));
     * }</pre>
     */
    public void addFromSettings(Map<String, ? extends List<?>> settings) {
        Map<String, SmartLogConfig> configs = new LinkedHashMap<>();
        for (Map.Entry<String, ? extends List<?>> entry : settings.entrySet()) {
            configs.put(entry.getKey(), toConfig(entry.getKey(), entry.getValue()));
        }
        add(configs);
    }

    private static SmartLogConfig toConfig(String name, List<?> setting) {
        if (setting == null || setting.isEmpty() || !(setting.get(0) instanceof String directory)) {
            throw new ConfigurationException("Logger '" + name + "' requires a directory as first element");
        }
        if (setting.size() > 2) {
            throw new ConfigurationException("Logger '" + name + "' expects [directory, overrides], got "
                    + setting.size() + " elements");
        }
        if (setting.size() == 1) {
            return SmartLogConfig.fromSettings(directory, null);
        }
        if (!(setting.get(1) instanceof Map<?, ?> raw)) {
            throw new ConfigurationException("Logger '" + name + "' overrides must be a map");
        }
        Map<String, Object> overrides = new LinkedHashMap<>();
        raw.forEach((key, value) -> overrides.put(String.valueOf(key), value));
        return SmartLogConfig.fromSettings(directory, overrides);
    }

    /** 이름으로 조회. 없으면 empty, 예외를 던지지 않는다 */
    public Optional<SmartLogger> get(String name) {
        lock.lock();
        try {
            return Optional.ofNullable(loggers.get(name));
        } finally {
            lock.unlock();
        }
    }

    /** "default" 로거 조회 */
    public Optional<SmartLogger> get() {
        return get(DEFAULT_LOGGER);
    }

    /** 이름으로 조회, 없으면 ConfigurationException */
    public SmartLogger require(String name) {
        return get(name).orElseThrow(() -> new ConfigurationException("Unknown logger: " + name));
    }

    public Set<String> names() {
        lock.lock();
        try {
            return Set.copyOf(loggers.keySet());
        } finally {
            lock.unlock();
        }
    }

    /** 모든 로거 flush. 실패는 모아서 첫 예외에 suppressed로 붙여 전파 */
    public void flushAll() {
        SmartLogException failure = null;
        for (SmartLogger logger : snapshot()) {
            try {
                logger.flush();
            } catch (SmartLogException e) {
                failure = collect(failure, e);
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    /** 모든 로거 종료 (마지막 flush 포함). 두 번째 호출부터는 no-op */
    @Override
    public void close() {
        List<SmartLogger> toClose;
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            toClose = new ArrayList<>(loggers.values());
        } finally {
            lock.unlock();
        }

        SmartLogException failure = null;
        for (SmartLogger logger : toClose) {
            try {
                logger.close();
            } catch (SmartLogException e) {
                log.error("Failed to close logger '{}'", logger.getName(), e);
                failure = collect(failure, e);
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    private List<SmartLogger> snapshot() {
        lock.lock();
        try {
            return new ArrayList<>(loggers.values());
        } finally {
            lock.unlock();
        }
    }

    private static void discard(Map<String, SmartLogger> created, RuntimeException cause) {
        for (SmartLogger logger : created.values()) {
            try {
                logger.close();
            } catch (RuntimeException e) {
                cause.addSuppressed(e);
            }
        }
    }

    private static SmartLogException collect(SmartLogException first, SmartLogException next) {
        if (first == null) {
            return next;
        }
        first.addSuppressed(next);
        return first;
    }
}
