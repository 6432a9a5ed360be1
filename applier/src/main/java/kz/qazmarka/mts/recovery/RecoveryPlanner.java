package kz.qazmarka.mts.recovery;

import java.util.BitSet;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import kz.qazmarka.mts.checkpoint.DurableState;
import kz.qazmarka.mts.coordinator.CoordinatorContext;

/**
 * Восстановление после сбоя.
 *
 * {@link #plan(DurableState)} проверяет сохранённое состояние и строит план. Экземпляр
 * сопровождает координатор при повторном чтении журнала: для каждой группы решает,
 * воспроизвести её изолированно, пропустить или планировать обычно. Пока в разрыве
 * остаются непройденные группы, параллельное планирование запрещено.
 */
public final class RecoveryPlanner {

    private static final Logger LOG = LoggerFactory.getLogger(RecoveryPlanner.class);

    private final RecoveryPlan plan;
    private final int workers;
    private final CoordinatorContext ctx;
    private long lastProcessed;

    public RecoveryPlanner(RecoveryPlan plan, int workers, CoordinatorContext ctx) {
        this.plan = Objects.requireNonNull(plan, "plan");
        this.workers = workers;
        this.ctx = Objects.requireNonNull(ctx, "ctx");
        this.lastProcessed = plan.checkpoint().groupId();
        if (plan.hasGap()) {
            ctx.onRecoveryPlanned(plan.gapSize());
            LOG.info("Восстановление: контрольная точка G{}, назначено до G{}, к воспроизведению {} групп, пропуск {}",
                    plan.checkpoint().groupId(), plan.highestAssigned(),
                    plan.replayGroups().size(), plan.skippedCount());
        }
    }

    /**
     * Проверяет сохранённое состояние и строит план.
     *
     * @throws RecoveryGapException если наибольший назначенный номер меньше контрольной
     *                              точки или битовая карта выходит за пределы разрыва
     */
    public static RecoveryPlan plan(DurableState state) throws RecoveryGapException {
        Objects.requireNonNull(state, "state");
        long p = state.checkpoint().groupId();
        long q = state.highestAssignedGroupId();
        BitSet bits = state.completedBeyond();
        if (q < p) {
            throw new RecoveryGapException("Наибольший назначенный номер G" + q
                    + " меньше контрольной точки G" + p);
        }
        long gap = q - p;
        if (gap > Integer.MAX_VALUE || bits.length() > gap) {
            throw new RecoveryGapException("Битовая карта завершённых групп (" + bits
                    + ") не согласуется с разрывом (G" + p + ", G" + q + "]");
        }
        return new RecoveryPlan(state.checkpoint(), q, bits);
    }

    public RecoveryPlan plan() {
        return plan;
    }

    /**
     * Решение для очередной группы потока. Номера должны идти подряд.
     */
    public RecoveryAction decide(long groupId) {
        if (groupId > plan.highestAssigned()) {
            return RecoveryAction.SCHEDULE;
        }
        if (groupId != lastProcessed + 1L) {
            throw new IllegalStateException("Восстановление: ожидалась группа G" + (lastProcessed + 1L)
                    + ", получена G" + groupId);
        }
        lastProcessed = groupId;
        ctx.onRecoveryStep();
        RecoveryAction action = plan.isCompleted(groupId) ? RecoveryAction.SKIP : RecoveryAction.REPLAY;
        if (!isRecovering()) {
            LOG.info("Восстановление: разрыв до G{} закрыт, возобновляю параллельное планирование",
                    plan.highestAssigned());
        }
        return action;
    }

    /** {@code true}, пока в разрыве остаются непройденные группы. */
    public boolean isRecovering() {
        return lastProcessed < plan.highestAssigned();
    }

    public boolean isParallelSchedulingEligible() {
        return workers > 0 && !isRecovering();
    }

    /** Сколько групп разрыва ещё не пройдено. */
    public long remaining() {
        return Math.max(0L, plan.highestAssigned() - lastProcessed);
    }
}
