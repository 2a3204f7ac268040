package ch.ethz.systems.vialbench.core.sweep;

/**
 * Thrown when every trial of a sweep was rejected, so there is nothing to rank.
 */
public class NoUsableScheduleException extends RuntimeException {

    public NoUsableScheduleException(long abortedTrials) {
        super("There is no trial data: all " + abortedTrials + " trials were aborted. "
                + "Check for dosages larger than the vial volume or non-positive dosages.");
    }

}
