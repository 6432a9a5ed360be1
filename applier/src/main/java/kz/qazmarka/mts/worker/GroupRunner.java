package kz.qazmarka.mts.worker;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import kz.qazmarka.mts.config.RetrySettings;
import kz.qazmarka.mts.coordinator.CoordinatorContext;
import kz.qazmarka.mts.coordinator.FailureClass;
import kz.qazmarka.mts.dependency.DependencyResolver;
import kz.qazmarka.mts.group.GroupState;
import kz.qazmarka.mts.group.TransactionGroup;
import kz.qazmarka.mts.util.BackoffPolicy;

/**
 * Выполняет одну группу до отчёта: ожидание предшественников, применение с повторами,
 * очередь на фиксацию, фиксация или откат.
 *
 * Общий для исполнителей и для координатора (изолированное выполнение).
 * Ошибки не выбрасываются через границу потока: результат всегда возвращается отчётом.
 */
public final class GroupRunner {

    private static final Logger LOG = LoggerFactory.getLogger(GroupRunner.class);
    private static final int BACKOFF_JITTER_PERCENT = 20;

    private final GroupApplier applier;
    private final DependencyResolver resolver;
    private final CommitOrderManager commitOrder;
    private final CoordinatorContext ctx;
    private final int maxRetries;
    private final BackoffPolicy backoff;

    public GroupRunner(GroupApplier applier,
                       DependencyResolver resolver,
                       CommitOrderManager commitOrder,
                       RetrySettings retry,
                       CoordinatorContext ctx) {
        this.applier = Objects.requireNonNull(applier, "applier");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.commitOrder = Objects.requireNonNull(commitOrder, "commitOrder");
        this.ctx = Objects.requireNonNull(ctx, "ctx");
        this.maxRetries = retry.getMaxRetries();
        this.backoff = new BackoffPolicy(retry.getBackoffBaseMs(), retry.getBackoffMaxMs(), BACKOFF_JITTER_PERCENT);
    }

    /**
     * Выполняет группу. Прерывание потока приводит к откату и отказу от группы;
     * флаг прерывания при этом восстанавливается.
     *
     * @param group    группа
     * @param workerId номер исполнителя или {@link TransactionGroup#NO_WORKER} для координатора
     * @return отчёт о завершении
     */
    public CompletionReport run(TransactionGroup group, int workerId) {
        int attempts = 0;
        try {
            if (!resolver.awaitPredecessors(group)) {
                return abandon(group, workerId, attempts, "предшественник не зафиксирован");
            }
            boolean serialized = false;
            while (true) {
                attempts++;
                group.moveTo(GroupState.APPLYING);
                ApplyOutcome outcome;
                try {
                    outcome = applier.apply(group);
                } catch (DependencyViolationException e) {
                    safeRollback(group);
                    ctx.onDependencyViolation();
                    if (serialized) {
                        return fail(group, workerId, FailureClass.DEPENDENCY_VIOLATION, attempts, e);
                    }
                    LOG.warn("Репликация: нарушение зависимостей в группе {} ({}): повторяю последовательно",
                            group.id(), e.getMessage());
                    serialized = true;
                    if (!resolver.awaitOlderCompleted(group)) {
                        return abandon(group, workerId, attempts, "более ранняя группа не зафиксирована");
                    }
                    continue;
                } catch (RuntimeException e) {
                    safeRollback(group);
                    return fail(group, workerId, FailureClass.FATAL, attempts, e);
                }
                if (outcome == ApplyOutcome.SUCCESS) {
                    return commit(group, workerId, attempts);
                }
                safeRollback(group);
                if (outcome != ApplyOutcome.RETRYABLE) {
                    return fail(group, workerId, FailureClass.FATAL, attempts, null);
                }
                if (attempts > maxRetries) {
                    return fail(group, workerId, FailureClass.TRANSIENT, attempts, null);
                }
                ctx.onTransactionRetry(attempts == 1);
                if (LOG.isDebugEnabled()) {
                    LOG.debug("Репликация: повтор группы {} (попытка {} из {})", group.id(), attempts + 1, maxRetries + 1);
                }
                backoff.pause(attempts);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (group.state() == GroupState.APPLYING || group.state() == GroupState.APPLIED) {
                safeRollback(group);
            }
            return abandon(group, workerId, attempts, "поток прерван");
        }
    }

    private CompletionReport commit(TransactionGroup group, int workerId, int attempts) throws InterruptedException {
        group.moveTo(GroupState.APPLIED);
        if (!commitOrder.awaitTurn(group.id())) {
            safeRollback(group);
            return abandon(group, workerId, attempts, "упорядочивание фиксаций прервано");
        }
        try {
            applier.commit(group);
        } catch (RuntimeException e) {
            safeRollback(group);
            return fail(group, workerId, FailureClass.FATAL, attempts, e);
        }
        group.moveTo(GroupState.COMMITTED);
        commitOrder.finish(group.id());
        return CompletionReport.success(group, workerId, attempts);
    }

    private CompletionReport abandon(TransactionGroup group, int workerId, int attempts, String reason) {
        commitOrder.withdraw(group.id());
        group.moveTo(GroupState.FAILED);
        ctx.onAbandoned();
        if (LOG.isDebugEnabled()) {
            LOG.debug("Репликация: группа {} не применена ({}), будет воспроизведена после перезапуска",
                    group.id(), reason);
        }
        return CompletionReport.abandoned(group, workerId, attempts);
    }

    private CompletionReport fail(TransactionGroup group,
                                  int workerId,
                                  FailureClass failureClass,
                                  int attempts,
                                  Throwable cause) {
        commitOrder.withdraw(group.id());
        group.moveTo(GroupState.FAILED);
        LOG.error("Репликация: группа {} завершилась ошибкой {} после {} попыток (позиция {})",
                group.id(), failureClass, attempts, group.sourcePosition(), cause);
        return CompletionReport.failed(group, workerId, failureClass, attempts, cause);
    }

    private void safeRollback(TransactionGroup group) {
        if (group.cannotSafelyRollback()) {
            LOG.warn("Репликация: откат группы {} не отменит уже выполненные нетранзакционные изменения", group.id());
        }
        try {
            applier.rollback(group);
        } catch (RuntimeException e) {
            LOG.warn("Репликация: откат группы {} завершился ошибкой: {}", group.id(), e.toString());
        }
    }
}
