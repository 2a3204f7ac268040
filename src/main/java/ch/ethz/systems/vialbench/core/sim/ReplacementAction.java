package ch.ethz.systems.vialbench.core.sim;

/**
 * Outcome of evaluating whether the active vial has to be replaced.
 */
public enum ReplacementAction {

    /** Remainder could not serve anyone; it was wasted and a fresh vial opened. */
    DISCARDED,

    /** Remainder serves some people only; it became a leftover and a fresh vial opened. */
    RETAINED_AS_LEFTOVER,

    /** Remainder still covers the largest dosage. */
    NONE

}
