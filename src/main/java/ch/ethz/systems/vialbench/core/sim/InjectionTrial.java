package ch.ethz.systems.vialbench.core.sim;

import ch.ethz.systems.vialbench.core.log.SimulationLogger;
import ch.ethz.systems.vialbench.core.sim.leftover.ILeftoverPool;
import ch.ethz.systems.vialbench.core.sim.leftover.LeftoverFragment;

import java.util.List;

/**
 * Day-by-day simulation of one validated roster.
 *
 * Each day, everyone due injects. Leftover fragments are used before the
 * open vial. After every pass over the roster the open vial is checked: if
 * it can no longer serve the largest dosage it is either wasted (it cannot
 * serve anyone) or kept as a leftover (it can still serve someone), and a
 * fresh vial is opened. People who could not be served retry in the next
 * pass, which always succeeds for at least one of them because the failed
 * pass forced a fresh vial. A day therefore needs at most (due + 1) passes.
 *
 * The trial ends once the target number of vials has been opened; the day
 * that reaches the target is always completed.
 */
public class InjectionTrial {

    private final DosageRoster roster;
    private final int numVials;
    private final VialState state;

    /**
     * @param roster    Validated roster
     * @param numVials  Target number of vials
     * @param state     Fresh state, owned by this trial from now on
     */
    public InjectionTrial(DosageRoster roster, int numVials, VialState state) {
        this.roster = roster;
        this.numVials = numVials;
        this.state = state;
    }

    /**
     * Run until the target number of vials is opened.
     *
     * @return Result at the day the target was reached
     */
    public TrialResult run() {
        while (state.getVialsUsed() < numVials) {
            processDay(state.getDay());
            if (state.getVialsUsed() >= numVials) {
                break;
            }
            state.advanceDay();
        }
        return new TrialResult(state.getWaste(), state.getDay(), state.getVialsUsed(), roster.getPeople());
    }

    /**
     * Serve everyone due on the given day.
     *
     * @param day   Day to process
     *
     * @throws IllegalStateException    If the day does not converge within its pass bound
     */
    void processDay(int day) {
        List<PersonDosage> people = roster.getPeople();
        boolean[] handled = new boolean[people.size()];
        int due = 0;
        for (int i = 0; i < people.size(); i++) {
            handled[i] = !people.get(i).isDueOn(day);
            if (!handled[i]) {
                due++;
            }
        }

        int maxPasses = due + 1;
        for (int pass = 1; ; pass++) {
            boolean allHandled = true;
            for (int i = 0; i < people.size(); i++) {
                if (!handled[i]) {
                    handled[i] = doInjection(people.get(i).getDosage());
                    allHandled &= handled[i];
                }
            }
            updateVialsUsed();
            if (allHandled) {
                return;
            }
            if (pass >= maxPasses) {
                throw new IllegalStateException("Day " + day + " did not converge within " + maxPasses
                        + " passes: " + state);
            }
        }
    }

    /**
     * Try to inject a dose, from a leftover fragment if one covers it,
     * otherwise from the open vial.
     *
     * @param dose  Dose (mL)
     *
     * @return True iff the dose could be served
     */
    boolean doInjection(double dose) {
        ILeftoverPool leftovers = state.getLeftovers();
        LeftoverFragment fragment = leftovers.findFragmentFor(dose);
        if (fragment != null) {
            double discarded = leftovers.consume(fragment, dose, roster.getMinDosage());
            state.recordLeftoverInjection(dose, discarded);
            return true;
        } else if (state.getActiveRemaining() - dose >= 0) {
            state.drawFromActive(dose);
            return true;
        }
        return false;
    }

    /**
     * Replace the open vial if it cannot serve the largest dosage any more.
     *
     * @return Action taken
     */
    ReplacementAction updateVialsUsed() {
        double remaining = state.getActiveRemaining();
        if (remaining < roster.getMinDosage()) {
            state.discardActive();
            logReplacement(ReplacementAction.DISCARDED, remaining);
            return ReplacementAction.DISCARDED;
        } else if (remaining < roster.getMaxDosage()) {
            state.retainActive();
            logReplacement(ReplacementAction.RETAINED_AS_LEFTOVER, remaining);
            return ReplacementAction.RETAINED_AS_LEFTOVER;
        }
        return ReplacementAction.NONE;
    }

    private void logReplacement(ReplacementAction action, double remaining) {
        if (SimulationLogger.isVialReplacementLoggingEnabled()) {
            SimulationLogger.logVialReplacement(state.getDay(),
                    action + " remaining=" + remaining + ",vialsUsed=" + state.getVialsUsed() + ",waste=" + state.getWaste());
        }
    }

    public VialState getState() {
        return state;
    }

}
