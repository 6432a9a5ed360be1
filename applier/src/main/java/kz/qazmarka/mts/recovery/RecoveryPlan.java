package kz.qazmarka.mts.recovery;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import kz.qazmarka.mts.checkpoint.Checkpoint;
import kz.qazmarka.mts.event.LogPosition;

/**
 * Неизменяемый план восстановления: контрольная точка P, наибольший назначенный номер Q
 * и группы (P, Q], которые нужно воспроизвести последовательно.
 */
public final class RecoveryPlan {

    private final Checkpoint checkpoint;
    private final long highestAssigned;
    private final BitSet completed;
    private final List<Long> replay;

    RecoveryPlan(Checkpoint checkpoint, long highestAssigned, BitSet completed) {
        this.checkpoint = Objects.requireNonNull(checkpoint, "checkpoint");
        this.highestAssigned = highestAssigned;
        this.completed = (BitSet) completed.clone();
        List<Long> ids = new ArrayList<>();
        for (long id = checkpoint.groupId() + 1L; id <= highestAssigned; id++) {
            if (!isCompleted(id)) {
                ids.add(id);
            }
        }
        this.replay = Collections.unmodifiableList(ids);
    }

    public Checkpoint checkpoint() {
        return checkpoint;
    }

    /** Позиция журнала-источника, с которой следует продолжить чтение. */
    public LogPosition startPosition() {
        return checkpoint.sourcePosition();
    }

    /** Номер, который получит первая прочитанная группа. */
    public long firstGroupId() {
        return checkpoint.groupId() + 1L;
    }

    public long highestAssigned() {
        return highestAssigned;
    }

    /** Размер разрыва Q − P. */
    public long gapSize() {
        return highestAssigned - checkpoint.groupId();
    }

    /** Номера групп разрыва, подлежащих воспроизведению, по возрастанию. */
    public List<Long> replayGroups() {
        return replay;
    }

    /** Число групп разрыва, уже применённых до сбоя. */
    public int skippedCount() {
        return completed.cardinality();
    }

    public boolean hasGap() {
        return highestAssigned > checkpoint.groupId();
    }

    public boolean isCompleted(long groupId) {
        long offset = groupId - checkpoint.groupId() - 1L;
        return offset >= 0L && offset < Integer.MAX_VALUE && completed.get((int) offset);
    }

    @Override
    public String toString() {
        return "RecoveryPlan{" + checkpoint + ", Q=G" + highestAssigned + ", replay=" + replay + '}';
    }
}
