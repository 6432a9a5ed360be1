package kz.qazmarka.mts.config;

import org.apache.hadoop.conf.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import kz.qazmarka.mts.util.Parsers;

/**
 * Загружает {@link MtsConfig} из Hadoop {@link Configuration}, инкапсулируя логику парсинга.
 */
final class MtsConfigLoader {
    private static final Logger LOG = LoggerFactory.getLogger(MtsConfigLoader.class);

    /**
     * Формирует {@link MtsConfig}, объединяя секции {@code mts.*} из конфигурации.
     *
     * @param cfg исходная конфигурация
     * @return иммутабельная конфигурация, готовая к передаче в рабочие компоненты
     */
    MtsConfig load(Configuration cfg) {
        if (cfg == null) {
            throw new IllegalArgumentException("Конфигурация не может быть null");
        }
        ConfigSections sections = ConfigSections.collect(cfg);
        MtsConfigBuilder builder = new MtsConfigBuilder();
        applySchedulingSection(builder, sections.scheduling);
        applyDependencySection(builder, sections.dependency);
        applyCheckpointSection(builder, sections.checkpoint);
        applyBackpressureSection(builder, sections.backpressure);
        applyRetrySection(builder, sections.retry);
        builder.jmxEnabled(sections.monitoring.isJmxEnabled());
        builder.throughputLogIntervalMs(sections.monitoring.getThroughputLogIntervalMs());
        MtsConfig config = builder.build();
        if (LOG.isDebugEnabled()) {
            LOG.debug("Конфигурация применителя: {}", config);
        }
        return config;
    }

    private static void applySchedulingSection(MtsConfigBuilder builder, SchedulingSettings s) {
        builder.scheduling()
                .workers(s.getWorkers())
                .workerQueueCapacity(s.getWorkerQueueCapacity())
                .commitOrder(s.isCommitOrder())
                .untilAfterGaps(s.isUntilAfterGaps())
                .sqlDelayMs(s.getSqlDelayMs())
                .done();
    }

    private static void applyDependencySection(MtsConfigBuilder builder, DependencySettings d) {
        builder.dependency()
                .policy(d.getPolicy())
                .queueMaxGroups(d.getQueueMaxGroups())
                .queueMaxBytes(d.getQueueMaxBytes())
                .refillPercent(d.getRefillPercent())
                .maxKeys(d.getMaxKeys())
                .done();
    }

    private static void applyCheckpointSection(MtsConfigBuilder builder, CheckpointSettings c) {
        builder.checkpoint()
                .group(c.getGroup())
                .periodMs(c.getPeriodMs())
                .syncOnCommit(c.isSyncOnCommit())
                .flushAfterIsolation(c.isFlushAfterIsolation())
                .done();
    }

    private static void applyBackpressureSection(MtsConfigBuilder builder, BackpressureSection b) {
        if (b.levelsInverted()) {
            LOG.warn("Нижний порог {}={} не меньше верхнего {}={}: нижний будет уменьшен",
                    MtsConfig.K_UNDERRUN_LEVEL, b.underrunLevel, MtsConfig.K_OVERRUN_LEVEL, b.overrunLevel);
        }
        builder.backpressure()
                .pendingBytesMax(b.pendingBytesMax)
                .overrunLevel(b.overrunLevel)
                .underrunLevel(Math.min(b.underrunLevel, b.overrunLevel - 1))
                .basicNapMs(b.basicNapMs)
                .done();
    }

    private static void applyRetrySection(MtsConfigBuilder builder, RetrySettings r) {
        builder.retry()
                .maxRetries(r.getMaxRetries())
                .backoffBaseMs(r.getBackoffBaseMs())
                .backoffMaxMs(r.getBackoffMaxMs())
                .done();
    }

    private static final class ConfigSections {
        final SchedulingSettings scheduling;
        final DependencySettings dependency;
        final CheckpointSettings checkpoint;
        final BackpressureSection backpressure;
        final RetrySettings retry;
        final MonitoringSettings monitoring;

        private ConfigSections(SchedulingSettings scheduling,
                               DependencySettings dependency,
                               CheckpointSettings checkpoint,
                               BackpressureSection backpressure,
                               RetrySettings retry,
                               MonitoringSettings monitoring) {
            this.scheduling = scheduling;
            this.dependency = dependency;
            this.checkpoint = checkpoint;
            this.backpressure = backpressure;
            this.retry = retry;
            this.monitoring = monitoring;
        }

        static ConfigSections collect(Configuration cfg) {
            SchedulingSettings scheduling = new SchedulingSettings(
                    Parsers.readIntMin(cfg, MtsConfig.K_WORKERS, MtsConfig.DEFAULT_WORKERS, 0),
                    Parsers.readIntMin(cfg, MtsConfig.K_WORKER_QUEUE_CAPACITY, MtsConfig.DEFAULT_WORKER_QUEUE_CAPACITY, 1),
                    Parsers.readBoolean(cfg, MtsConfig.K_COMMIT_ORDER, MtsConfig.DEFAULT_COMMIT_ORDER),
                    Parsers.readBoolean(cfg, MtsConfig.K_UNTIL_AFTER_GAPS, MtsConfig.DEFAULT_UNTIL_AFTER_GAPS),
                    Parsers.readLongMin(cfg, MtsConfig.K_SQL_DELAY_MS, MtsConfig.DEFAULT_SQL_DELAY_MS, 0L));
            String rawPolicy = cfg.getTrimmed(MtsConfig.K_DEP_POLICY);
            ConflictPolicy policy = Parsers.readEnum(cfg, MtsConfig.K_DEP_POLICY, ConflictPolicy.class,
                    MtsConfig.DEFAULT_DEP_POLICY);
            if (rawPolicy != null && !rawPolicy.isEmpty()
                    && !policy.name().equalsIgnoreCase(rawPolicy.replace('-', '_'))) {
                LOG.warn("Неизвестная политика конфликтов {}='{}': используется {}",
                        MtsConfig.K_DEP_POLICY, rawPolicy, policy);
            }
            DependencySettings dependency = new DependencySettings(
                    policy,
                    Parsers.readIntMin(cfg, MtsConfig.K_DEP_QUEUE_MAX_GROUPS, MtsConfig.DEFAULT_DEP_QUEUE_MAX_GROUPS, 1),
                    Parsers.readLongMin(cfg, MtsConfig.K_DEP_QUEUE_MAX_BYTES, MtsConfig.DEFAULT_DEP_QUEUE_MAX_BYTES, 1L),
                    Parsers.readIntRange(cfg, MtsConfig.K_DEP_REFILL_THRESHOLD, MtsConfig.DEFAULT_DEP_REFILL_THRESHOLD, 0, 100),
                    Parsers.readIntMin(cfg, MtsConfig.K_DEP_MAX_KEYS, MtsConfig.DEFAULT_DEP_MAX_KEYS, 1));
            CheckpointSettings checkpoint = new CheckpointSettings(
                    Parsers.readIntRange(cfg, MtsConfig.K_CHECKPOINT_GROUP, MtsConfig.DEFAULT_CHECKPOINT_GROUP,
                            1, MtsConfig.MAX_CHECKPOINT_GROUP),
                    Parsers.readLongMin(cfg, MtsConfig.K_CHECKPOINT_PERIOD_MS, MtsConfig.DEFAULT_CHECKPOINT_PERIOD_MS, 0L),
                    Parsers.readBoolean(cfg, MtsConfig.K_CHECKPOINT_SYNC_ON_COMMIT, MtsConfig.DEFAULT_CHECKPOINT_SYNC_ON_COMMIT),
                    Parsers.readBoolean(cfg, MtsConfig.K_CHECKPOINT_FLUSH_AFTER_ISOLATION,
                            MtsConfig.DEFAULT_CHECKPOINT_FLUSH_AFTER_ISOLATION));
            BackpressureSection backpressure = BackpressureSection.from(cfg);
            RetrySettings retry = new RetrySettings(
                    Parsers.readIntMin(cfg, MtsConfig.K_RETRIES, MtsConfig.DEFAULT_RETRIES, 0),
                    Parsers.readLongMin(cfg, MtsConfig.K_RETRY_BACKOFF_BASE_MS, MtsConfig.DEFAULT_RETRY_BACKOFF_BASE_MS, 0L),
                    Parsers.readLongMin(cfg, MtsConfig.K_RETRY_BACKOFF_MAX_MS, MtsConfig.DEFAULT_RETRY_BACKOFF_MAX_MS, 0L));
            MonitoringSettings monitoring = new MonitoringSettings(
                    Parsers.readBoolean(cfg, MtsConfig.K_JMX_ENABLED, MtsConfig.DEFAULT_JMX_ENABLED),
                    Parsers.readLongMin(cfg, MtsConfig.K_THROUGHPUT_LOG_INTERVAL_MS,
                            MtsConfig.DEFAULT_THROUGHPUT_LOG_INTERVAL_MS, 0L));
            return new ConfigSections(scheduling, dependency, checkpoint, backpressure, retry, monitoring);
        }
    }
}
