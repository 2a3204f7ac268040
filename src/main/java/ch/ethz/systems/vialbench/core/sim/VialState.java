package ch.ethz.systems.vialbench.core.sim;

import ch.ethz.systems.vialbench.core.sim.leftover.ILeftoverPool;

/**
 * Mutable volume bookkeeping of a single trial. Created when the trial
 * starts with the first vial already open, changed only by the trial's
 * injection and replacement steps, and read once when the trial ends.
 *
 * At all times:
 * waste + consumed + activeRemaining + leftovers + displacedLeftover
 * = vialsUsed * vialVolume
 */
public class VialState {

    // =========================================================================
    // STATE
    // =========================================================================

    private final double vialVolume;

    /** Leftover fragments of replaced vials */
    private final ILeftoverPool leftovers;

    /** Volume left in the open vial (mL) */
    private double activeRemaining;

    /** Vials opened so far, including the open one */
    private int vialsUsed;

    /** Cumulative discarded volume (mL) */
    private double waste;

    /** Cumulative injected volume (mL) */
    private double consumed;

    /** Cumulative volume of leftovers overwritten by newer ones (mL) */
    private double displacedLeftover;

    /** Current simulated day */
    private int day;

    public VialState(double vialVolume, ILeftoverPool leftovers) {
        this.vialVolume = vialVolume;
        this.leftovers = leftovers;
        this.activeRemaining = vialVolume;
        this.vialsUsed = 1;
        this.waste = 0.0;
        this.consumed = 0.0;
        this.displacedLeftover = 0.0;
        this.day = 1;
    }

    // =========================================================================
    // TRANSITIONS
    // =========================================================================

    void drawFromActive(double dose) {
        activeRemaining = activeRemaining - dose;
        consumed = consumed + dose;
    }

    void recordLeftoverInjection(double dose, double discarded) {
        consumed = consumed + dose;
        waste = waste + discarded;
    }

    /**
     * Throw away what is left in the active vial and open a fresh one.
     */
    void discardActive() {
        waste = waste + activeRemaining;
        openFreshVial();
    }

    /**
     * Move what is left in the active vial into the leftover pool and open a fresh one.
     */
    void retainActive() {
        displacedLeftover = displacedLeftover + leftovers.retain(activeRemaining);
        openFreshVial();
    }

    private void openFreshVial() {
        vialsUsed = vialsUsed + 1;
        activeRemaining = vialVolume;
    }

    void advanceDay() {
        day = day + 1;
    }

    // =========================================================================
    // ACCESSORS
    // =========================================================================

    public double getVialVolume() {
        return vialVolume;
    }

    public ILeftoverPool getLeftovers() {
        return leftovers;
    }

    public double getActiveRemaining() {
        return activeRemaining;
    }

    public int getVialsUsed() {
        return vialsUsed;
    }

    public double getWaste() {
        return waste;
    }

    public double getConsumed() {
        return consumed;
    }

    public double getDisplacedLeftover() {
        return displacedLeftover;
    }

    public int getDay() {
        return day;
    }

    @Override
    public String toString() {
        return "VialState{day=" + day +
                ", vialsUsed=" + vialsUsed +
                ", activeRemaining=" + activeRemaining +
                ", leftovers=" + leftovers.getFragments() +
                ", waste=" + waste +
                ", consumed=" + consumed +
                ", displacedLeftover=" + displacedLeftover + "}";
    }

}
