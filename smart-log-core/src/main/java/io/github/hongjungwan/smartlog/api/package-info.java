/**
 * Public API for SmartLog SDK.
 *
 * <p>This package contains the interfaces and value types that applications
 * interact with directly. Implementation classes live under
 * {@code io.github.hongjungwan.smartlog.core} and may change without notice.</p>
 *
 * <h2>Main Entry Points:</h2>
 * <ul>
 *   <li>{@link io.github.hongjungwan.smartlog.api.SmartLogger} - Buffered severity-aware logger</li>
 *   <li>{@link io.github.hongjungwan.smartlog.api.SmartLoggerRegistry} - Named logger collection</li>
 *   <li>{@link io.github.hongjungwan.smartlog.api.config.SmartLogConfig} - Per-logger configuration</li>
 *   <li>{@link io.github.hongjungwan.smartlog.api.SeverityScale} - Severity name/rank resolution</li>
 * </ul>
 *
 * <h2>Usage Example:</h2>
 * <pre>{@code
 * try (SmartLoggerRegistry registry = new SmartLoggerRegistry()) {
 *     registry.add(Map.of("default", SmartLogConfig.forDirectory("/var/log/app")));
 *     SmartLogger logger = registry.require("default");
 *
 *     logger.debug("Loading order", Map.of("orderId", 42));
 *     logger.error("Payment declined");   // debug record above is written too
 *     logger.flush();
 * }
 * }</pre>
 */
package io.github.hongjungwan.smartlog.api;
