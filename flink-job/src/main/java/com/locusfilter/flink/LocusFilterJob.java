package com.locusfilter.flink;

import com.esotericsoftware.kryo.serializers.JavaSerializer;
import com.locusfilter.core.config.FilterConfig;
import com.locusfilter.core.config.FilterConfigLoader;
import com.locusfilter.core.filter.FilterDefinition;
import com.locusfilter.core.model.LocusData;
import com.locusfilter.core.runner.FilterReport;
import com.locusfilter.core.runner.RunnerConfig;
import org.apache.flink.api.common.eventtime.WatermarkStrategy;
import org.apache.flink.connector.kafka.sink.KafkaRecordSerializationSchema;
import org.apache.flink.connector.kafka.sink.KafkaSink;
import org.apache.flink.connector.kafka.source.KafkaSource;
import org.apache.flink.connector.kafka.source.enumerator.initializer.OffsetsInitializer;
import org.apache.flink.streaming.api.CheckpointingMode;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.streaming.api.environment.CheckpointConfig;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Main entry point for the Locus Filter Flink job.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   Kafka (loci topic)
 *     → Deserialize JSON → LocusData
 *     → Key by locus id
 *     → FilterProcessFunction (runs every configured filter)
 *     → Serialize FilterReport → JSON
 *     → Kafka (reports topic)
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * Kafka, Flink and health settings come from {@link JobConfig}; filters and
 * output streams from {@code filters.yml} (see {@link FilterConfigLoader});
 * the per-filter budget from {@link RunnerConfig#fromEnvironment}.
 * </p>
 *
 * @since 1.0.0
 */
public final class LocusFilterJob {

        private static final Logger LOG = LoggerFactory.getLogger(LocusFilterJob.class);

        private LocusFilterJob() {
                // entry-point class, not instantiable
        }

        public static void main(String[] args) throws Exception {
                // 1. Load configuration
                JobConfig config = JobConfig.fromEnvironment();
                LOG.info("Starting Locus Filter with config: {}", config);

                // 2. Load filters
                FilterConfig filterConfig = FilterConfigLoader.load();
                List<FilterDefinition> filters = filterConfig.getFilters();

                if (filters.isEmpty()) {
                        throw new IllegalStateException(
                                        "No filters defined. Provide filters via "
                                                        + FilterConfigLoader.ENV_FILTERS_PATH
                                                        + " or a classpath "
                                                        + FilterConfigLoader.DEFAULT_RESOURCE + " file.");
                }
                LOG.info("Loaded {} filter(s) writing to {} stream(s)",
                                filters.size(), filterConfig.getStreams().size());

                RunnerConfig runnerConfig = RunnerConfig.fromEnvironment(filterConfig.getStreamRegistry());

                // 3. Start health server (for K8s probes) with shutdown hook
                HealthServer healthServer = new HealthServer();
                healthServer.start(config.getHealthPort());
                Runtime.getRuntime().addShutdownHook(new Thread(healthServer::stop, "health-shutdown"));

                // 4. Set up Flink execution environment
                StreamExecutionEnvironment env = StreamExecutionEnvironment.getExecutionEnvironment();
                env.setParallelism(config.getParallelism());
                configureCheckpointing(env, config);
                registerSerializers(env);

                // 5. Build pipeline
                buildPipeline(env, config, filters, runnerConfig);
                healthServer.markReady();

                // 6. Execute
                env.execute("Locus Filter – Filter Execution");
        }

        // ---------------------------------------------------------------
        // Pipeline assembly
        // ---------------------------------------------------------------

        /**
         * Build the full Kafka → Flink → Kafka pipeline.
         */
        static void buildPipeline(StreamExecutionEnvironment env,
                        JobConfig config,
                        List<FilterDefinition> filters,
                        RunnerConfig runnerConfig) {
                KafkaSource<LocusData> kafkaSource = KafkaSource.<LocusData>builder()
                                .setBootstrapServers(config.getBootstrapServers())
                                .setTopics(config.getLociTopic())
                                .setGroupId(config.getGroupId())
                                .setStartingOffsets(OffsetsInitializer.earliest())
                                .setValueOnlyDeserializer(new LocusDataDeserializationSchema())
                                .build();

                DataStream<LocusData> loci = env.fromSource(
                                kafkaSource,
                                WatermarkStrategy.noWatermarks(),
                                "kafka-loci-source");

                DataStream<FilterReport> reports = loci
                                .filter(Objects::nonNull) // drop deserialization failures
                                .keyBy(LocusData::getLocusId)
                                .process(new FilterProcessFunction(filters, runnerConfig))
                                .name("filter-execution");

                KafkaSink<FilterReport> kafkaSink = KafkaSink.<FilterReport>builder()
                                .setBootstrapServers(config.getBootstrapServers())
                                .setRecordSerializer(
                                                KafkaRecordSerializationSchema.builder()
                                                                .setTopic(config.getReportsTopic())
                                                                .setValueSerializationSchema(
                                                                                new FilterReportSerializationSchema())
                                                                .build())
                                .build();

                reports.sinkTo(kafkaSink).name("kafka-reports-sink");
        }

        // ---------------------------------------------------------------
        // Helpers
        // ---------------------------------------------------------------

        // Model classes hold unmodifiable collections that Kryo cannot rebuild.
        private static void registerSerializers(StreamExecutionEnvironment env) {
                env.getConfig().registerTypeWithKryoSerializer(LocusData.class, JavaSerializer.class);
                env.getConfig().registerTypeWithKryoSerializer(FilterReport.class, JavaSerializer.class);
        }

        private static void configureCheckpointing(StreamExecutionEnvironment env, JobConfig config) {
                long interval = config.getCheckpointInterval().toMillis();
                env.enableCheckpointing(interval, CheckpointingMode.EXACTLY_ONCE);

                CheckpointConfig cpConfig = env.getCheckpointConfig();
                cpConfig.setMinPauseBetweenCheckpoints(interval / 2);
                cpConfig.setCheckpointTimeout(interval * 2);
                cpConfig.setMaxConcurrentCheckpoints(1);
                cpConfig.setExternalizedCheckpointCleanup(
                                CheckpointConfig.ExternalizedCheckpointCleanup.RETAIN_ON_CANCELLATION);
        }
}
