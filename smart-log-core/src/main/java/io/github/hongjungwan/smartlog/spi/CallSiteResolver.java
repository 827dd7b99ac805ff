package io.github.hongjungwan.smartlog.spi;

import io.github.hongjungwan.smartlog.core.internal.StackWalkingCallSiteResolver;

/**
 * SPI for resolving the call site of a logging call.
 *
 * <p>Consulted only when the caller did not pass an explicit file/line through
 * {@link io.github.hongjungwan.smartlog.api.LogOptions}.</p>
 *
 * <h2>Implementation Example:</h2>
 * <pre>{@code
 * SmartLogConfig config = SmartLogConfig.builder()
 *         .directory("/var/log/app")
 *         .callSiteResolver(() -> CallSite.of("batch-job", 0))
 *         .build();
 * }</pre>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface CallSiteResolver {

    /**
     * Resolve the location of the code that invoked the logger.
     *
     * @return the call site, never {@code null}
     */
    CallSite resolve();

    /** StackWalker 기반 기본 구현. SDK 내부 프레임은 건너뛴다. */
    static CallSiteResolver stackWalking() {
        return StackWalkingCallSiteResolver.INSTANCE;
    }

    /** 위치를 기록하지 않음 (location 컬럼은 "()") */
    static CallSiteResolver none() {
        return CallSite::unknown;
    }
}
