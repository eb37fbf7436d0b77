package com.pulseguard.flink;

import com.pulseguard.core.config.ConfigLoader;
import com.pulseguard.core.config.DetectorSettings;
import com.pulseguard.core.config.PulseGuardConfig;
import com.pulseguard.core.model.Alert;
import com.pulseguard.core.model.Reading;
import org.apache.flink.api.common.eventtime.WatermarkStrategy;
import org.apache.flink.api.common.typeinfo.Types;
import org.apache.flink.connector.kafka.sink.KafkaRecordSerializationSchema;
import org.apache.flink.connector.kafka.sink.KafkaSink;
import org.apache.flink.connector.kafka.source.KafkaSource;
import org.apache.flink.connector.kafka.source.enumerator.initializer.OffsetsInitializer;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Main entry point for the PulseGuard Flink job.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   Kafka (readings topic)
 *     → Deserialize JSON → Reading
 *     → Key by streamId
 *     → AnomalyProcessFunction (one EMA/MAD detector per stream)
 *     → Serialize Alert → JSON
 *     → Kafka (alerts topic)
 * </pre>
 *
 * <p>
 * Checkpointing is not enabled: detector state lives only as long as the job
 * and a restart begins every stream from a cold start.
 * </p>
 *
 * @since 1.0.0
 */
public final class PulseGuardJob {

        private static final Logger LOG = LoggerFactory.getLogger(PulseGuardJob.class);

        private PulseGuardJob() {
                // entry-point class — not instantiable
        }

        public static void main(String[] args) throws Exception {
                JobConfig config = JobConfig.fromEnvironment();
                LOG.info("Starting PulseGuard with config: {}", config);

                DetectorSettings detector = loadConfig(config).getDetector();
                LOG.info("Detector settings: {}", detector);

                StreamExecutionEnvironment env = StreamExecutionEnvironment.getExecutionEnvironment();
                env.setParallelism(config.getParallelism());

                buildPipeline(env, config, detector);

                env.execute("PulseGuard – Stream Anomaly Detection");
        }

        // ---------------------------------------------------------------
        // Pipeline assembly
        // ---------------------------------------------------------------

        /**
         * Build the full Kafka → Flink → Kafka pipeline.
         */
        static void buildPipeline(StreamExecutionEnvironment env,
                        JobConfig config,
                        DetectorSettings settings) {
                KafkaSource<Reading> kafkaSource = KafkaSource.<Reading>builder()
                                .setBootstrapServers(config.getKafkaBootstrapServers())
                                .setTopics(config.getKafkaInputTopic())
                                .setGroupId(config.getKafkaGroupId())
                                .setStartingOffsets(OffsetsInitializer.latest())
                                .setValueOnlyDeserializer(new ReadingDeserializationSchema())
                                .build();

                // Detection is order-based, event time plays no role.
                DataStream<Reading> readings = env.fromSource(
                                kafkaSource,
                                WatermarkStrategy.noWatermarks(),
                                "kafka-readings-source");

                DataStream<Alert> alerts = readings
                                .filter(Objects::nonNull)
                                .keyBy(Reading::getStreamId, Types.STRING)
                                .process(new AnomalyProcessFunction(settings))
                                .name("anomaly-detection");

                KafkaSink<Alert> kafkaSink = KafkaSink.<Alert>builder()
                                .setBootstrapServers(config.getKafkaBootstrapServers())
                                .setRecordSerializer(
                                                KafkaRecordSerializationSchema.builder()
                                                                .setTopic(config.getKafkaAlertTopic())
                                                                .setValueSerializationSchema(
                                                                                new AlertSerializationSchema())
                                                                .build())
                                .build();

                alerts.sinkTo(kafkaSink).name("kafka-alerts-sink");
        }

        // ---------------------------------------------------------------
        // Helpers
        // ---------------------------------------------------------------

        private static PulseGuardConfig loadConfig(JobConfig config) {
                String path = config.getDetectorConfigPath();
                if (path != null && !path.isBlank()) {
                        return ConfigLoader.fromFile(path);
                }
                return ConfigLoader.load();
        }
}
