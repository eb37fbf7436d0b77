/**
 * Configuration loading and validation for PulseGuard.
 *
 * <p>
 * The YAML file is loaded by {@link com.pulseguard.core.config.ConfigLoader}
 * into a {@link com.pulseguard.core.config.PulseGuardConfig}. Validation runs
 * right after parsing and reports every error in a single exception.
 * </p>
 *
 * @since 1.0.0
 */
package com.pulseguard.core.config;
