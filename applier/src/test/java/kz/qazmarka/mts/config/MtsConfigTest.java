package kz.qazmarka.mts.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.apache.hadoop.conf.Configuration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Набор юнит‑тестов для конфигурации {@link MtsConfig}.
 *
 * Что проверяем:
 * - значения по умолчанию всех секций при пустой конфигурации;
 * - чтение ключей {@code mts.*}, включая политику конфликтов в записи через дефис;
 * - зажим выходящих за границы значений ({@code checkpoint_group}, проценты уровней);
 * - согласование уровней обратного давления, если нижний не меньше верхнего;
 * - {@link MtsConfig#toBuilder()} сохраняет все параметры, кроме изменённых.
 *
 * Используется только in‑memory {@link Configuration} без ресурсов по умолчанию.
 */
class MtsConfigTest {

    /**
     * GIVEN: пустая конфигурация.
     * WHEN:  читаем {@link MtsConfig}.
     * THEN:  все секции заполнены значениями по умолчанию.
     */
    @Test
    @DisplayName("Пустая конфигурация → значения по умолчанию")
    void defaultsFromEmptyConfiguration() {
        MtsConfig mc = MtsConfig.from(new Configuration(false));

        assertEquals(MtsConfig.DEFAULT_WORKERS, mc.getScheduling().getWorkers());
        assertEquals(1, mc.getScheduling().getWorkerQueueCapacity());
        assertTrue(mc.getScheduling().isCommitOrder());
        assertTrue(mc.getScheduling().isParallel());
        assertEquals(ConflictPolicy.SAME_WORKER, mc.getDependency().getPolicy());
        assertEquals(1000, mc.getDependency().getQueueMaxGroups());
        assertEquals(16L * 1024 * 1024, mc.getDependency().getQueueMaxBytes());
        assertEquals(60, mc.getDependency().getRefillPercent());
        assertEquals(512, mc.getCheckpoint().getGroup());
        assertEquals(300L, mc.getCheckpoint().getPeriodMs());
        assertFalse(mc.getCheckpoint().isSyncOnCommit());
        assertTrue(mc.getCheckpoint().isFlushAfterIsolation());
        assertEquals(90, mc.getBackpressure().getOverrunLevel());
        assertEquals(50, mc.getBackpressure().getUnderrunLevel());
        assertEquals(10, mc.getRetry().getMaxRetries());
        assertTrue(mc.getMonitoring().isJmxEnabled());
        assertEquals(0L, mc.getScheduling().getSqlDelayMs());
    }

    @Test
    @DisplayName("Ключи mts.* читаются, политика принимает запись через дефис")
    void explicitValuesAreRead() {
        Configuration c = new Configuration(false);
        c.setInt(MtsConfig.Keys.WORKERS, 8);
        c.set(MtsConfig.Keys.DEPENDENCY_POLICY, "after-completion");
        c.setInt(MtsConfig.Keys.DEPENDENCY_QUEUE_MAX_GROUPS, 2);
        c.setLong(MtsConfig.Keys.DEPENDENCY_QUEUE_MAX_BYTES, 4096L);
        c.set(MtsConfig.Keys.COMMIT_ORDER, "off");
        c.set(MtsConfig.Keys.CHECKPOINT_SYNC_ON_COMMIT, "yes");
        c.setInt(MtsConfig.Keys.RETRIES, 3);
        c.set(MtsConfig.Keys.JMX_ENABLED, "false");

        MtsConfig mc = MtsConfig.from(c);

        assertEquals(8, mc.getScheduling().getWorkers());
        assertEquals(ConflictPolicy.AFTER_COMPLETION, mc.getDependency().getPolicy());
        assertEquals(2, mc.getDependency().getQueueMaxGroups());
        assertEquals(4096L, mc.getDependency().getQueueMaxBytes());
        assertFalse(mc.getScheduling().isCommitOrder());
        assertTrue(mc.getCheckpoint().isSyncOnCommit());
        assertEquals(3, mc.getRetry().getMaxRetries());
        assertFalse(mc.getMonitoring().isJmxEnabled());
    }

    @Test
    @DisplayName("Задержка применения читается, отрицательная зажимается в ноль")
    void sqlDelayIsRead() {
        Configuration c = new Configuration(false);
        c.setLong(MtsConfig.Keys.SQL_DELAY_MS, 3_600_000L);
        assertEquals(3_600_000L, MtsConfig.from(c).getScheduling().getSqlDelayMs());

        c.setLong(MtsConfig.Keys.SQL_DELAY_MS, -5L);
        assertEquals(0L, MtsConfig.from(c).getScheduling().getSqlDelayMs());
        assertEquals(0L, MtsConfig.builder().scheduling().sqlDelayMs(-5L).done().build()
                .getScheduling().getSqlDelayMs());
    }

    @Test
    @DisplayName("Ноль исполнителей выключает параллельное применение")
    void zeroWorkersDisablesParallelism() {
        Configuration c = new Configuration(false);
        c.setInt(MtsConfig.Keys.WORKERS, 0);

        MtsConfig mc = MtsConfig.from(c);

        assertEquals(0, mc.getScheduling().getWorkers());
        assertFalse(mc.getScheduling().isParallel());
    }

    /**
     * GIVEN: {@code checkpoint_group} больше верхней границы, отрицательная ёмкость очереди,
     *        порог повторного заполнения больше 100.
     * WHEN:  читаем конфигурацию.
     * THEN:  значения зажаты в допустимые пределы.
     */
    @Test
    @DisplayName("Выходящие за границы значения зажимаются")
    void outOfRangeValuesAreClamped() {
        Configuration c = new Configuration(false);
        c.setInt(MtsConfig.Keys.CHECKPOINT_GROUP, 10_000_000);
        c.setInt(MtsConfig.Keys.WORKER_QUEUE_CAPACITY, -3);
        c.setInt(MtsConfig.Keys.DEPENDENCY_REFILL_THRESHOLD, 150);
        c.setLong(MtsConfig.Keys.PENDING_JOBS_SIZE_MAX, 10L);

        MtsConfig mc = MtsConfig.from(c);

        assertEquals(MtsConfig.MAX_CHECKPOINT_GROUP, mc.getCheckpoint().getGroup());
        assertEquals(1, mc.getScheduling().getWorkerQueueCapacity());
        assertEquals(100, mc.getDependency().getRefillPercent());
        assertEquals(1024L, mc.getBackpressure().getPendingBytesMax());
    }

    @Test
    @DisplayName("Нижний уровень не меньше верхнего → нижний уменьшается")
    void invertedLevelsAreAligned() {
        Configuration c = new Configuration(false);
        c.setInt(MtsConfig.Keys.OVERRUN_LEVEL, 60);
        c.setInt(MtsConfig.Keys.UNDERRUN_LEVEL, 80);

        MtsConfig mc = MtsConfig.from(c);

        assertEquals(60, mc.getBackpressure().getOverrunLevel());
        assertEquals(59, mc.getBackpressure().getUnderrunLevel());
    }

    @Test
    @DisplayName("Неизвестная политика конфликтов → политика по умолчанию")
    void unknownPolicyFallsBack() {
        Configuration c = new Configuration(false);
        c.set(MtsConfig.Keys.DEPENDENCY_POLICY, "random");

        assertEquals(ConflictPolicy.SAME_WORKER, MtsConfig.from(c).getDependency().getPolicy());
    }

    @Test
    @DisplayName("Максимальная пауза повтора не меньше базовой")
    void retryMaxNotBelowBase() {
        Configuration c = new Configuration(false);
        c.setLong(MtsConfig.Keys.RETRY_BACKOFF_BASE_MS, 500L);
        c.setLong(MtsConfig.Keys.RETRY_BACKOFF_MAX_MS, 100L);

        RetrySettings r = MtsConfig.from(c).getRetry();

        assertEquals(500L, r.getBackoffBaseMs());
        assertEquals(500L, r.getBackoffMaxMs());
    }

    @Test
    @DisplayName("toBuilder меняет только заданные параметры")
    void toBuilderKeepsOtherSections() {
        MtsConfig base = MtsConfig.builder()
                .scheduling().workers(3).commitOrder(false).done()
                .dependency().policy(ConflictPolicy.AFTER_COMPLETION).queueMaxGroups(7).done()
                .checkpoint().group(16).done()
                .retry().maxRetries(2).done()
                .jmxEnabled(false)
                .build();

        MtsConfig changed = base.toBuilder().scheduling().workers(6).done().build();

        assertEquals(6, changed.getScheduling().getWorkers());
        assertFalse(changed.getScheduling().isCommitOrder());
        assertEquals(ConflictPolicy.AFTER_COMPLETION, changed.getDependency().getPolicy());
        assertEquals(7, changed.getDependency().getQueueMaxGroups());
        assertEquals(16, changed.getCheckpoint().getGroup());
        assertEquals(2, changed.getRetry().getMaxRetries());
        assertFalse(changed.getMonitoring().isJmxEnabled());
        assertEquals(3, base.getScheduling().getWorkers());
    }

    @Test
    @DisplayName("null вместо конфигурации отклоняется")
    void nullConfigurationRejected() {
        assertThrows(IllegalArgumentException.class, () -> MtsConfig.from(null));
    }
}
