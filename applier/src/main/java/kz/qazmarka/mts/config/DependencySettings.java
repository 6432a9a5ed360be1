package kz.qazmarka.mts.config;

/**
 * Параметры резолвера зависимостей и его общей очереди готовых групп.
 */
public final class DependencySettings {
    private final ConflictPolicy policy;
    private final int queueMaxGroups;
    private final long queueMaxBytes;
    private final int refillPercent;
    private final int maxKeys;

    public DependencySettings(ConflictPolicy policy,
                              int queueMaxGroups,
                              long queueMaxBytes,
                              int refillPercent,
                              int maxKeys) {
        this.policy = policy;
        this.queueMaxGroups = queueMaxGroups;
        this.queueMaxBytes = queueMaxBytes;
        this.refillPercent = refillPercent;
        this.maxKeys = maxKeys;
    }

    public ConflictPolicy getPolicy() {
        return policy;
    }

    public int getQueueMaxGroups() {
        return queueMaxGroups;
    }

    public long getQueueMaxBytes() {
        return queueMaxBytes;
    }

    /** Процент от лимитов, ниже которого заполненная очередь снова принимает группы. */
    public int getRefillPercent() {
        return refillPercent;
    }

    /** Группы с большим числом ключей трактуются как группы с неизвестными ключами. */
    public int getMaxKeys() {
        return maxKeys;
    }
}
