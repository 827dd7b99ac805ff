package io.github.hongjungwan.smartlog.starter;

import io.github.hongjungwan.smartlog.api.SmartLoggerRegistry;
import io.github.hongjungwan.smartlog.api.config.SmartLogConfig;
import io.github.hongjungwan.smartlog.api.exception.ConfigurationException;
import io.github.hongjungwan.smartlog.api.exception.SmartLogException;
import io.github.hongjungwan.smartlog.core.bridge.ErrorBridge;
import io.github.hongjungwan.smartlog.core.bridge.ErrorCategory;
import io.github.hongjungwan.smartlog.core.diagnostics.SmartLogDoctor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.SmartLifecycle;
import org.springframework.context.annotation.Bean;

import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * SmartLog SDK Spring Boot 자동 설정.
 */
@AutoConfiguration
@EnableConfigurationProperties(SmartLogProperties.class)
@ConditionalOnProperty(prefix = "smart-log", name = "enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class SmartLogAutoConfiguration {

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public SmartLoggerRegistry smartLoggerRegistry(SmartLogProperties properties) {
        SmartLoggerRegistry registry = new SmartLoggerRegistry();
        Map<String, SmartLogConfig> configs = toConfigs(properties);
        if (!configs.isEmpty()) {
            registry.add(configs);
        }
        return registry;
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "smart-log.doctor", name = "enabled", havingValue = "true", matchIfMissing = true)
    public SmartLogDoctor smartLogDoctor(SmartLogProperties properties) {
        return new SmartLogDoctor(toConfigs(properties));
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "smart-log.error-bridge", name = "enabled", havingValue = "true")
    public ErrorBridge errorBridge(SmartLoggerRegistry registry, SmartLogProperties properties) {
        SmartLogProperties.ErrorBridgeProperties bridge = properties.getErrorBridge();
        return ErrorBridge.install(registry, bridge.getLogger(), toCategories(bridge), bridge.isDisplayErrors());
    }

    @Bean
    public SmartLogLifecycle smartLogLifecycle(SmartLoggerRegistry registry, ObjectProvider<SmartLogDoctor> doctor) {
        return new SmartLogLifecycle(registry, doctor.getIfAvailable());
    }

    static Map<String, SmartLogConfig> toConfigs(SmartLogProperties properties) {
        Map<String, SmartLogConfig> configs = new LinkedHashMap<>();
        properties.getLoggers().forEach((name, logger) -> {
            if (logger.getDirectory() == null || logger.getDirectory().isBlank()) {
                throw new ConfigurationException("smart-log.loggers." + name + ".directory is required");
            }
            configs.put(name, SmartLogConfig.fromSettings(logger.getDirectory(), logger.toOverrides()));
        });
        return configs;
    }

    static Set<ErrorCategory> toCategories(SmartLogProperties.ErrorBridgeProperties bridge) {
        Set<ErrorCategory> categories = EnumSet.noneOf(ErrorCategory.class);
        for (String name : bridge.getCategories()) {
            categories.add(ErrorCategory.find(name)
                    .orElseThrow(() -> new ConfigurationException("Unknown error category: " + name)));
        }
        return categories;
    }

    /**
     * SDK 시작 진단과 종료 시 flush를 관리하는 SmartLifecycle 구현체.
     */
    static class SmartLogLifecycle implements SmartLifecycle {

        private final SmartLoggerRegistry registry;
        private final SmartLogDoctor doctor;
        private volatile boolean running = false;

        SmartLogLifecycle(SmartLoggerRegistry registry, SmartLogDoctor doctor) {
            this.registry = registry;
            this.doctor = doctor;
        }

        @Override
        public void start() {
            log.info("Starting SmartLog SDK with logger(s) {}", registry.names());

            if (doctor != null) {
                SmartLogDoctor.DiagnosticReport report = doctor.diagnose();
                if (report.hasFailures()) {
                    log.warn("Diagnostic failures detected - affected loggers may fail to write");
                }
            }

            running = true;
        }

        @Override
        public void stop() {
            log.info("Stopping SmartLog SDK...");
            try {
                registry.flushAll();
            } catch (SmartLogException e) {
                log.error("Failed to flush loggers on shutdown", e);
            }
            running = false;
            log.info("SmartLog SDK stopped");
        }

        @Override
        public boolean isRunning() {
            return running;
        }

        @Override
        public int getPhase() {
            return Integer.MIN_VALUE + 100;
        }
    }
}
