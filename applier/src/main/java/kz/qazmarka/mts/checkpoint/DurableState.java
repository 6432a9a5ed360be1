package kz.qazmarka.mts.checkpoint;

import java.util.BitSet;
import java.util.Objects;

/**
 * То, что переживает перезапуск: контрольная точка, наибольший назначенный номер группы
 * и битовая карта групп, завершённых за контрольной точкой.
 *
 * Бит {@code i} карты соответствует группе {@code checkpoint.groupId() + 1 + i}.
 */
public final class DurableState {

    public static final DurableState EMPTY = new DurableState(Checkpoint.INITIAL, 0L, new BitSet());

    private final Checkpoint checkpoint;
    private final long highestAssignedGroupId;
    private final BitSet completedBeyond;

    public DurableState(Checkpoint checkpoint, long highestAssignedGroupId, BitSet completedBeyond) {
        this.checkpoint = Objects.requireNonNull(checkpoint, "checkpoint");
        this.highestAssignedGroupId = highestAssignedGroupId;
        this.completedBeyond = (BitSet) Objects.requireNonNull(completedBeyond, "completedBeyond").clone();
    }

    public Checkpoint checkpoint() {
        return checkpoint;
    }

    public long highestAssignedGroupId() {
        return highestAssignedGroupId;
    }

    /** Копия битовой карты. */
    public BitSet completedBeyond() {
        return (BitSet) completedBeyond.clone();
    }

    /** {@code true}, если группа за контрольной точкой отмечена завершённой. */
    public boolean isCompleted(long groupId) {
        long offset = groupId - checkpoint.groupId() - 1L;
        return offset >= 0L && offset < Integer.MAX_VALUE && completedBeyond.get((int) offset);
    }

    /** Число групп в разрыве (P, Q]. */
    public long gapSize() {
        return Math.max(0L, highestAssignedGroupId - checkpoint.groupId());
    }

    @Override
    public String toString() {
        return "DurableState{" + checkpoint + ", highest=G" + highestAssignedGroupId
                + ", completedBeyond=" + completedBeyond + '}';
    }
}
