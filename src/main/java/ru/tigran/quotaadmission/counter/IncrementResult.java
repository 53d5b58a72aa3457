package ru.tigran.quotaadmission.counter;

/**
 * Outcome of a conditional increment.
 *
 * @param success true if the counter was incremented
 * @param count   counter value after the call (unchanged value when success is false)
 */
public record IncrementResult(boolean success, long count) {

    public static IncrementResult acquired(long count) {
        return new IncrementResult(true, count);
    }

    public static IncrementResult rejected(long count) {
        return new IncrementResult(false, count);
    }
}
