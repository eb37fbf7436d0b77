/**
 * Apache Flink streaming job for PulseGuard.
 *
 * <p>
 * Wires the EMA/MAD detector into a Flink pipeline that consumes readings
 * from Kafka, keeps one detector per stream in keyed state, and publishes
 * alerts back to Kafka.
 * </p>
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.pulseguard.flink.PulseGuardJob} — main entry point</li>
 * <li>{@link com.pulseguard.flink.AnomalyProcessFunction} — keyed process
 * function</li>
 * <li>{@link com.pulseguard.flink.JobConfig} — environment-driven
 * configuration</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.pulseguard.flink;
