/**
 * Domain model classes for PulseGuard.
 *
 * <ul>
 * <li>{@link com.pulseguard.core.model.Reading} — one observation of a
 * keyed numeric stream</li>
 * <li>{@link com.pulseguard.core.model.Alert} — anomaly alert with detector
 * diagnostics</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.pulseguard.core.model;
