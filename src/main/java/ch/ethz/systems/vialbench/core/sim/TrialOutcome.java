package ch.ethz.systems.vialbench.core.sim;

/**
 * Either a completed trial or a trial rejected before simulating. Rejection
 * is an expected outcome when sweeping a parameter space, so it is a value
 * rather than an exception.
 */
public class TrialOutcome {

    private final TrialResult result;
    private final InvalidTrialReason invalidReason;
    private final String detail;

    private TrialOutcome(TrialResult result, InvalidTrialReason invalidReason, String detail) {
        this.result = result;
        this.invalidReason = invalidReason;
        this.detail = detail;
    }

    public static TrialOutcome completed(TrialResult result) {
        if (result == null) {
            throw new IllegalArgumentException("Completed outcome requires a result.");
        }
        return new TrialOutcome(result, null, null);
    }

    public static TrialOutcome invalid(InvalidTrialReason reason, String detail) {
        if (reason == null) {
            throw new IllegalArgumentException("Invalid outcome requires a reason.");
        }
        return new TrialOutcome(null, reason, detail);
    }

    public boolean isValid() {
        return result != null;
    }

    /**
     * @return Result of the trial
     *
     * @throws IllegalStateException    If the trial was rejected
     */
    public TrialResult getResult() {
        if (result == null) {
            throw new IllegalStateException("Trial was rejected (" + invalidReason + "): " + detail);
        }
        return result;
    }

    /**
     * @return Reason of rejection, or null for a completed trial
     */
    public InvalidTrialReason getInvalidReason() {
        return invalidReason;
    }

    public String getDetail() {
        return detail;
    }

    @Override
    public String toString() {
        return isValid() ? "TrialOutcome{" + result + "}" : "TrialOutcome{invalid=" + invalidReason + ", " + detail + "}";
    }

}
