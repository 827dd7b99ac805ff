/**
 * Service Provider Interfaces (SPI) for SmartLog SDK.
 *
 * <p>This package contains extension points that can be plugged into
 * {@link io.github.hongjungwan.smartlog.api.config.SmartLogConfig}:</p>
 *
 * <ul>
 *   <li>{@link io.github.hongjungwan.smartlog.spi.CallSiteResolver} - Location of a logging call</li>
 * </ul>
 *
 * @since 1.0.0
 */
package io.github.hongjungwan.smartlog.spi;
