package FormalLanguage.Model;

import java.util.concurrent.CancellationException;

/**
 * Cooperative stop signal for product construction and minimization. Either flag can stop an
 * operation: an interrupt set from any thread, or a state count above the threshold.
 */
public class Cancellation {

    private final int stateThreshold;

    private volatile boolean interrupted;
    private volatile boolean thresholdExceeded;

    public Cancellation() {
        this(false, Integer.MAX_VALUE);
    }

    public Cancellation(boolean interrupted, int stateThreshold) {
        this.interrupted = interrupted;
        this.stateThreshold = stateThreshold;
    }

    public boolean isInterrupted() {
        return interrupted;
    }

    public void setInterrupted() {
        this.interrupted = true;
    }

    public int getStateThreshold() {
        return stateThreshold;
    }

    public boolean isThresholdExceeded() {
        return thresholdExceeded;
    }

    public boolean isAboveThreshold(int states) {
        if (states > stateThreshold) {
            this.thresholdExceeded = true;
        }
        return this.thresholdExceeded;
    }

    public boolean isCancelled() {
        return isInterrupted() || isThresholdExceeded();
    }

    public String cancelLabel() {
        return this.isInterrupted() ? "INTERRUPTED" : "THRESHOLD";
    }

    /**
     * Throws if the operation should stop.
     * @param states - state count of the running operation: product states built so far, or the
     *        number of states a minimization refines
     * @throws CancellationException if interrupted or above the state threshold
     */
    public void check(int states) {
        if (isInterrupted() || isAboveThreshold(states)) {
            throw new CancellationException(cancelLabel() + ": stopped at " + states + " states (threshold "
                + stateThreshold + ")");
        }
    }
}
