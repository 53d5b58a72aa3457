package ru.tigran.quotaadmission.counter;

import java.util.List;

/**
 * Durable per-study store of quota counters.
 *
 * Counters are mutated only through {@link #incrementIfBelowCap}, {@link #decrement} and
 * {@link #resetAll}. Implementations must execute {@link #incrementIfBelowCap} as one atomic
 * operation against the backing store; splitting it into a read and a separate write allows two
 * concurrent callers to both pass the cap check.
 *
 * Increments and decrements carry an operation id chosen by the caller (one per admission attempt).
 * The store records every increment it applied under that id, so a call that is repeated after a
 * timeout or a lost reply is answered from the record instead of being applied a second time.
 *
 * All methods throw {@link ru.tigran.quotaadmission.exception.StoreUnavailableException} when the
 * backing store cannot be reached.
 */
public interface QuotaCounterStore {

    /**
     * Increments the counter by one if its current value is strictly below cap.
     * A counter that does not exist yet is created with count 0 before the check.
     * If this operation already incremented the cell, nothing changes and the recorded result is returned.
     *
     * @param researchId  research study
     * @param cellKey     cell key
     * @param cap         cap of the cell, recorded alongside the counter
     * @param operationId id of the admission attempt
     * @return whether the increment happened and the resulting count
     */
    IncrementResult incrementIfBelowCap(String researchId, String cellKey, int cap, String operationId);

    /**
     * Undoes the increment recorded for this operation and cell. Not a general "release slot" operation.
     * A no-op when the operation never incremented the cell or was already undone, so it is safe
     * to call for a cell whose increment outcome is unknown. Never takes a counter below zero.
     *
     * @return count after the call
     */
    long decrement(String researchId, String cellKey, String operationId);

    /**
     * Snapshot of all counters of a research study. Not required to be consistent across cells.
     */
    List<QuotaCounter> findAll(String researchId);

    /**
     * Sets every counter of a research study to zero. Caps are kept.
     *
     * @return number of counters that were reset
     */
    int resetAll(String researchId);

    /**
     * Round-trips the backing store. Used by the health indicator.
     */
    boolean isAvailable();
}
