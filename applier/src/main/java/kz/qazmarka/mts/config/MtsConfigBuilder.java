package kz.qazmarka.mts.config;

/**
 * Отдельный билдер для сборки итогового {@link MtsConfig} без жёсткой связности.
 * Используется загрузчиком конфигурации, поверхностью управления и тестами для
 * декларативной настройки секций. Значения нормализуются в {@link #build()}.
 */
public final class MtsConfigBuilder {
    private int workers = MtsConfig.DEFAULT_WORKERS;
    private int workerQueueCapacity = MtsConfig.DEFAULT_WORKER_QUEUE_CAPACITY;
    private boolean commitOrder = MtsConfig.DEFAULT_COMMIT_ORDER;
    private boolean untilAfterGaps = MtsConfig.DEFAULT_UNTIL_AFTER_GAPS;
    private long sqlDelayMs = MtsConfig.DEFAULT_SQL_DELAY_MS;
    private ConflictPolicy policy = MtsConfig.DEFAULT_DEP_POLICY;
    private int queueMaxGroups = MtsConfig.DEFAULT_DEP_QUEUE_MAX_GROUPS;
    private long queueMaxBytes = MtsConfig.DEFAULT_DEP_QUEUE_MAX_BYTES;
    private int refillPercent = MtsConfig.DEFAULT_DEP_REFILL_THRESHOLD;
    private int maxKeys = MtsConfig.DEFAULT_DEP_MAX_KEYS;
    private int checkpointGroup = MtsConfig.DEFAULT_CHECKPOINT_GROUP;
    private long checkpointPeriodMs = MtsConfig.DEFAULT_CHECKPOINT_PERIOD_MS;
    private boolean syncOnCommit = MtsConfig.DEFAULT_CHECKPOINT_SYNC_ON_COMMIT;
    private boolean flushAfterIsolation = MtsConfig.DEFAULT_CHECKPOINT_FLUSH_AFTER_ISOLATION;
    private long pendingBytesMax = MtsConfig.DEFAULT_PENDING_JOBS_SIZE_MAX;
    private int overrunLevel = MtsConfig.DEFAULT_OVERRUN_LEVEL;
    private int underrunLevel = MtsConfig.DEFAULT_UNDERRUN_LEVEL;
    private long basicNapMs = MtsConfig.DEFAULT_BASIC_NAP_MS;
    private int maxRetries = MtsConfig.DEFAULT_RETRIES;
    private long backoffBaseMs = MtsConfig.DEFAULT_RETRY_BACKOFF_BASE_MS;
    private long backoffMaxMs = MtsConfig.DEFAULT_RETRY_BACKOFF_MAX_MS;
    private boolean jmxEnabled = MtsConfig.DEFAULT_JMX_ENABLED;
    private long throughputLogIntervalMs = MtsConfig.DEFAULT_THROUGHPUT_LOG_INTERVAL_MS;

    public MtsConfigBuilder() {
        // значения по умолчанию
    }

    MtsConfigBuilder(MtsConfig src) {
        SchedulingSettings s = src.getScheduling();
        workers = s.getWorkers();
        workerQueueCapacity = s.getWorkerQueueCapacity();
        commitOrder = s.isCommitOrder();
        untilAfterGaps = s.isUntilAfterGaps();
        sqlDelayMs = s.getSqlDelayMs();
        DependencySettings d = src.getDependency();
        policy = d.getPolicy();
        queueMaxGroups = d.getQueueMaxGroups();
        queueMaxBytes = d.getQueueMaxBytes();
        refillPercent = d.getRefillPercent();
        maxKeys = d.getMaxKeys();
        CheckpointSettings c = src.getCheckpoint();
        checkpointGroup = c.getGroup();
        checkpointPeriodMs = c.getPeriodMs();
        syncOnCommit = c.isSyncOnCommit();
        flushAfterIsolation = c.isFlushAfterIsolation();
        BackpressureSettings b = src.getBackpressure();
        pendingBytesMax = b.getPendingBytesMax();
        overrunLevel = b.getOverrunLevel();
        underrunLevel = b.getUnderrunLevel();
        basicNapMs = b.getBasicNapMs();
        RetrySettings r = src.getRetry();
        maxRetries = r.getMaxRetries();
        backoffBaseMs = r.getBackoffBaseMs();
        backoffMaxMs = r.getBackoffMaxMs();
        jmxEnabled = src.getMonitoring().isJmxEnabled();
        throughputLogIntervalMs = src.getMonitoring().getThroughputLogIntervalMs();
    }

    public SchedulingOptions scheduling() {
        return new SchedulingOptions();
    }

    public DependencyOptions dependency() {
        return new DependencyOptions();
    }

    public CheckpointOptions checkpoint() {
        return new CheckpointOptions();
    }

    public BackpressureOptions backpressure() {
        return new BackpressureOptions();
    }

    public RetryOptions retry() {
        return new RetryOptions();
    }

    public MtsConfigBuilder jmxEnabled(boolean enabled) {
        this.jmxEnabled = enabled;
        return this;
    }

    public MtsConfigBuilder throughputLogIntervalMs(long value) {
        this.throughputLogIntervalMs = value;
        return this;
    }

    public MtsConfig build() {
        int under = clamp(underrunLevel, 0, 99);
        int over = clamp(overrunLevel, under + 1, 100);
        long retryBase = Math.max(0L, backoffBaseMs);
        return new MtsConfig(
                new SchedulingSettings(Math.max(0, workers),
                        Math.max(1, workerQueueCapacity),
                        commitOrder,
                        untilAfterGaps,
                        Math.max(0L, sqlDelayMs)),
                new DependencySettings(policy == null ? MtsConfig.DEFAULT_DEP_POLICY : policy,
                        Math.max(1, queueMaxGroups),
                        Math.max(1L, queueMaxBytes),
                        clamp(refillPercent, 0, 100),
                        Math.max(1, maxKeys)),
                new CheckpointSettings(clamp(checkpointGroup, 1, MtsConfig.MAX_CHECKPOINT_GROUP),
                        Math.max(0L, checkpointPeriodMs),
                        syncOnCommit,
                        flushAfterIsolation),
                new BackpressureSettings(Math.max(1L, pendingBytesMax), over, under, Math.max(1L, basicNapMs)),
                new RetrySettings(Math.max(0, maxRetries), retryBase, Math.max(retryBase, backoffMaxMs)),
                new MonitoringSettings(jmxEnabled, Math.max(0L, throughputLogIntervalMs)));
    }

    private static int clamp(int v, int min, int max) {
        if (v < min) return min;
        return (v > max) ? max : v;
    }

    public final class SchedulingOptions {
        public SchedulingOptions workers(int value) {
            workers = value;
            return this;
        }

        public SchedulingOptions workerQueueCapacity(int value) {
            workerQueueCapacity = value;
            return this;
        }

        public SchedulingOptions commitOrder(boolean value) {
            commitOrder = value;
            return this;
        }

        public SchedulingOptions untilAfterGaps(boolean value) {
            untilAfterGaps = value;
            return this;
        }

        public SchedulingOptions sqlDelayMs(long value) {
            sqlDelayMs = value;
            return this;
        }

        public MtsConfigBuilder done() {
            return MtsConfigBuilder.this;
        }
    }

    public final class DependencyOptions {
        public DependencyOptions policy(ConflictPolicy value) {
            policy = value;
            return this;
        }

        public DependencyOptions queueMaxGroups(int value) {
            queueMaxGroups = value;
            return this;
        }

        public DependencyOptions queueMaxBytes(long value) {
            queueMaxBytes = value;
            return this;
        }

        public DependencyOptions refillPercent(int value) {
            refillPercent = value;
            return this;
        }

        public DependencyOptions maxKeys(int value) {
            maxKeys = value;
            return this;
        }

        public MtsConfigBuilder done() {
            return MtsConfigBuilder.this;
        }
    }

    public final class CheckpointOptions {
        public CheckpointOptions group(int value) {
            checkpointGroup = value;
            return this;
        }

        public CheckpointOptions periodMs(long value) {
            checkpointPeriodMs = value;
            return this;
        }

        public CheckpointOptions syncOnCommit(boolean value) {
            syncOnCommit = value;
            return this;
        }

        public CheckpointOptions flushAfterIsolation(boolean value) {
            flushAfterIsolation = value;
            return this;
        }

        public MtsConfigBuilder done() {
            return MtsConfigBuilder.this;
        }
    }

    public final class BackpressureOptions {
        public BackpressureOptions pendingBytesMax(long value) {
            pendingBytesMax = value;
            return this;
        }

        public BackpressureOptions overrunLevel(int value) {
            overrunLevel = value;
            return this;
        }

        public BackpressureOptions underrunLevel(int value) {
            underrunLevel = value;
            return this;
        }

        public BackpressureOptions basicNapMs(long value) {
            basicNapMs = value;
            return this;
        }

        public MtsConfigBuilder done() {
            return MtsConfigBuilder.this;
        }
    }

    public final class RetryOptions {
        public RetryOptions maxRetries(int value) {
            maxRetries = value;
            return this;
        }

        public RetryOptions backoffBaseMs(long value) {
            backoffBaseMs = value;
            return this;
        }

        public RetryOptions backoffMaxMs(long value) {
            backoffMaxMs = value;
            return this;
        }

        public MtsConfigBuilder done() {
            return MtsConfigBuilder.this;
        }
    }
}
