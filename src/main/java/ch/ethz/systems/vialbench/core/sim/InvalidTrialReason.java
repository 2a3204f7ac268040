package ch.ethz.systems.vialbench.core.sim;

/**
 * Why a trial was rejected before simulating.
 */
public enum InvalidTrialReason {

    /** Nobody to simulate. */
    EMPTY_ROSTER,

    /** The largest dosage does not fit in a single vial. */
    DOSAGE_EXCEEDS_VIAL_VOLUME,

    /** The smallest dosage is zero or negative. */
    NON_POSITIVE_DOSAGE,

    /** Somebody injects less often than once per whole number of days. */
    INVALID_FREQUENCY

}
