package kz.qazmarka.mts.config;

import java.util.Objects;

import org.apache.hadoop.conf.Configuration;

/**
 * Иммутабельная конфигурация применителя, прочитанная один раз из Hadoop {@link Configuration}.
 *
 * Содержит:
 *  - параметры пула исполнителей и упорядочивания фиксаций ({@link SchedulingSettings});
 *  - политику конфликтов и лимиты очереди резолвера ({@link DependencySettings});
 *  - размер очереди контрольных точек и политику сброса позиции ({@link CheckpointSettings});
 *  - пороги обратного давления ({@link BackpressureSettings});
 *  - повторы при транзиентных ошибках ({@link RetrySettings});
 *  - мониторинг ({@link MonitoringSettings}).
 *
 * Изменённую копию можно получить через {@link #toBuilder()}.
 */
public final class MtsConfig {

    // ==== Ключи конфигурации ====
    static final String K_WORKERS = "mts.parallel.workers";
    static final String K_WORKER_QUEUE_CAPACITY = "mts.worker.queue.capacity";
    static final String K_COMMIT_ORDER = "mts.commit.order";
    static final String K_UNTIL_AFTER_GAPS = "mts.until.after.gaps";
    static final String K_SQL_DELAY_MS = "mts.sql.delay.ms";
    static final String K_DEP_POLICY = "mts.dependency.policy";
    static final String K_DEP_QUEUE_MAX_GROUPS = "mts.dependency.queue.max.groups";
    static final String K_DEP_QUEUE_MAX_BYTES = "mts.dependency.queue.max.bytes";
    static final String K_DEP_REFILL_THRESHOLD = "mts.dependency.refill.threshold";
    static final String K_DEP_MAX_KEYS = "mts.dependency.max.keys";
    static final String K_CHECKPOINT_GROUP = "mts.checkpoint.group";
    static final String K_CHECKPOINT_PERIOD_MS = "mts.checkpoint.period.ms";
    static final String K_CHECKPOINT_SYNC_ON_COMMIT = "mts.checkpoint.sync.on.commit";
    static final String K_CHECKPOINT_FLUSH_AFTER_ISOLATION = "mts.checkpoint.flush.after.isolation";
    static final String K_PENDING_JOBS_SIZE_MAX = "mts.pending.jobs.size.max";
    static final String K_OVERRUN_LEVEL = "mts.worker.overrun.level";
    static final String K_UNDERRUN_LEVEL = "mts.worker.underrun.level";
    static final String K_BASIC_NAP_MS = "mts.coordinator.basic.nap.ms";
    static final String K_RETRIES = "mts.transaction.retries";
    static final String K_RETRY_BACKOFF_BASE_MS = "mts.retry.backoff.base.ms";
    static final String K_RETRY_BACKOFF_MAX_MS = "mts.retry.backoff.max.ms";
    static final String K_JMX_ENABLED = "mts.jmx.enabled";
    static final String K_THROUGHPUT_LOG_INTERVAL_MS = "mts.log.throughput.interval.ms";

    // ==== Значения по умолчанию ====
    static final int DEFAULT_WORKERS = 4;
    static final int DEFAULT_WORKER_QUEUE_CAPACITY = 1;
    static final boolean DEFAULT_COMMIT_ORDER = true;
    static final boolean DEFAULT_UNTIL_AFTER_GAPS = false;
    static final long DEFAULT_SQL_DELAY_MS = 0L;
    static final ConflictPolicy DEFAULT_DEP_POLICY = ConflictPolicy.SAME_WORKER;
    static final int DEFAULT_DEP_QUEUE_MAX_GROUPS = 1000;
    static final long DEFAULT_DEP_QUEUE_MAX_BYTES = 16L * 1024 * 1024;
    static final int DEFAULT_DEP_REFILL_THRESHOLD = 60;
    static final int DEFAULT_DEP_MAX_KEYS = 100_000;
    static final int DEFAULT_CHECKPOINT_GROUP = 512;
    /** Верхняя граница {@code checkpoint_group}. */
    static final int MAX_CHECKPOINT_GROUP = 524_280;
    static final long DEFAULT_CHECKPOINT_PERIOD_MS = 300L;
    static final boolean DEFAULT_CHECKPOINT_SYNC_ON_COMMIT = false;
    static final boolean DEFAULT_CHECKPOINT_FLUSH_AFTER_ISOLATION = true;
    static final long DEFAULT_PENDING_JOBS_SIZE_MAX = 16L * 1024 * 1024;
    static final int DEFAULT_OVERRUN_LEVEL = 90;
    static final int DEFAULT_UNDERRUN_LEVEL = 50;
    static final long DEFAULT_BASIC_NAP_MS = 5L;
    static final int DEFAULT_RETRIES = 10;
    static final long DEFAULT_RETRY_BACKOFF_BASE_MS = 20L;
    static final long DEFAULT_RETRY_BACKOFF_MAX_MS = 1000L;
    public static final boolean DEFAULT_JMX_ENABLED = true;
    static final long DEFAULT_THROUGHPUT_LOG_INTERVAL_MS = 5000L;

    private final SchedulingSettings scheduling;
    private final DependencySettings dependency;
    private final CheckpointSettings checkpoint;
    private final BackpressureSettings backpressure;
    private final RetrySettings retry;
    private final MonitoringSettings monitoring;

    /**
     * Публичные ключи {@code mts.*} для использования в других пакетах и тестах.
     * Значения синхронизированы с приватными K_* выше.
     */
    public static final class Keys {
        /** Число параллельных исполнителей; 0 выключает параллельное применение. */
        public static final String WORKERS = K_WORKERS;
        /** Ёмкость локальной очереди исполнителя. */
        public static final String WORKER_QUEUE_CAPACITY = K_WORKER_QUEUE_CAPACITY;
        /** Фиксировать группы строго в порядке источника. */
        public static final String COMMIT_ORDER = K_COMMIT_ORDER;
        /** Остановиться после воспроизведения разрыва восстановления. */
        public static final String UNTIL_AFTER_GAPS = K_UNTIL_AFTER_GAPS;
        /** Задержка применения относительно метки времени события на первичном сервере, мс. */
        public static final String SQL_DELAY_MS = K_SQL_DELAY_MS;
        /** Политика конфликтов: {@code same-worker} или {@code after-completion}. */
        public static final String DEPENDENCY_POLICY = K_DEP_POLICY;
        public static final String DEPENDENCY_QUEUE_MAX_GROUPS = K_DEP_QUEUE_MAX_GROUPS;
        public static final String DEPENDENCY_QUEUE_MAX_BYTES = K_DEP_QUEUE_MAX_BYTES;
        public static final String DEPENDENCY_REFILL_THRESHOLD = K_DEP_REFILL_THRESHOLD;
        public static final String DEPENDENCY_MAX_KEYS = K_DEP_MAX_KEYS;
        public static final String CHECKPOINT_GROUP = K_CHECKPOINT_GROUP;
        public static final String CHECKPOINT_PERIOD_MS = K_CHECKPOINT_PERIOD_MS;
        public static final String CHECKPOINT_SYNC_ON_COMMIT = K_CHECKPOINT_SYNC_ON_COMMIT;
        public static final String CHECKPOINT_FLUSH_AFTER_ISOLATION = K_CHECKPOINT_FLUSH_AFTER_ISOLATION;
        public static final String PENDING_JOBS_SIZE_MAX = K_PENDING_JOBS_SIZE_MAX;
        public static final String OVERRUN_LEVEL = K_OVERRUN_LEVEL;
        public static final String UNDERRUN_LEVEL = K_UNDERRUN_LEVEL;
        public static final String BASIC_NAP_MS = K_BASIC_NAP_MS;
        public static final String RETRIES = K_RETRIES;
        public static final String RETRY_BACKOFF_BASE_MS = K_RETRY_BACKOFF_BASE_MS;
        public static final String RETRY_BACKOFF_MAX_MS = K_RETRY_BACKOFF_MAX_MS;
        public static final String JMX_ENABLED = K_JMX_ENABLED;
        public static final String THROUGHPUT_LOG_INTERVAL_MS = K_THROUGHPUT_LOG_INTERVAL_MS;

        private Keys() {}
    }

    MtsConfig(SchedulingSettings scheduling,
              DependencySettings dependency,
              CheckpointSettings checkpoint,
              BackpressureSettings backpressure,
              RetrySettings retry,
              MonitoringSettings monitoring) {
        this.scheduling = Objects.requireNonNull(scheduling, "Секция scheduling не сформирована");
        this.dependency = Objects.requireNonNull(dependency, "Секция dependency не сформирована");
        this.checkpoint = Objects.requireNonNull(checkpoint, "Секция checkpoint не сформирована");
        this.backpressure = Objects.requireNonNull(backpressure, "Секция backpressure не сформирована");
        this.retry = Objects.requireNonNull(retry, "Секция retry не сформирована");
        this.monitoring = Objects.requireNonNull(monitoring, "Секция monitoring не сформирована");
    }

    /**
     * Читает конфигурацию {@code mts.*}.
     *
     * @param cfg исходная конфигурация Hadoop
     * @return иммутабельная конфигурация
     */
    public static MtsConfig from(Configuration cfg) {
        return new MtsConfigLoader().load(cfg);
    }

    /** Конфигурация со значениями по умолчанию. */
    public static MtsConfig defaults() {
        return new MtsConfigBuilder().build();
    }

    public static MtsConfigBuilder builder() {
        return new MtsConfigBuilder();
    }

    /** Билдер, заполненный значениями текущей конфигурации. */
    public MtsConfigBuilder toBuilder() {
        return new MtsConfigBuilder(this);
    }

    public SchedulingSettings getScheduling() {
        return scheduling;
    }

    public DependencySettings getDependency() {
        return dependency;
    }

    public CheckpointSettings getCheckpoint() {
        return checkpoint;
    }

    public BackpressureSettings getBackpressure() {
        return backpressure;
    }

    public RetrySettings getRetry() {
        return retry;
    }

    public MonitoringSettings getMonitoring() {
        return monitoring;
    }

    @Override
    public String toString() {
        return "MtsConfig{workers=" + scheduling.getWorkers()
                + ", workerQueue=" + scheduling.getWorkerQueueCapacity()
                + ", commitOrder=" + scheduling.isCommitOrder()
                + ", sqlDelay=" + scheduling.getSqlDelayMs() + "ms"
                + ", policy=" + dependency.getPolicy()
                + ", depQueue=" + dependency.getQueueMaxGroups() + '/' + dependency.getQueueMaxBytes() + "B"
                + ", checkpointGroup=" + checkpoint.getGroup()
                + ", pendingMax=" + backpressure.getPendingBytesMax() + "B"
                + ", retries=" + retry.getMaxRetries()
                + '}';
    }
}
