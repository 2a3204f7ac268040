package ch.ethz.systems.vialbench.core.sim;

import ch.ethz.systems.vialbench.core.log.SimulationLogger;
import ch.ethz.systems.vialbench.core.sim.leftover.LeftoverPolicy;

import java.util.List;

/**
 * Validates each trial's dosages and runs it as an {@link InjectionTrial}.
 * Holds no trial state, so one instance serves every trial of a sweep.
 */
public class InjectionSimulator implements IVialSimulator {

    private final LeftoverPolicy leftoverPolicy;

    public InjectionSimulator() {
        this(LeftoverPolicy.SINGLE_SLOT);
    }

    public InjectionSimulator(LeftoverPolicy leftoverPolicy) {
        if (leftoverPolicy == null) {
            throw new IllegalArgumentException("Leftover policy must be set.");
        }
        this.leftoverPolicy = leftoverPolicy;
    }

    @Override
    public TrialOutcome simulate(List<PersonSchedule> schedules, int numVials, double vialVolume) {
        if (numVials < 1) {
            throw new IllegalArgumentException("Number of vials must be at least 1: " + numVials);
        }
        if (!(vialVolume > 0) || Double.isInfinite(vialVolume)) {
            throw new IllegalArgumentException("Vial volume must be positive and finite: " + vialVolume);
        }

        DosageRoster roster = DosageRoster.normalize(schedules);
        InvalidTrialReason violation = roster.findViolation(vialVolume);
        if (violation != null) {
            String detail = "roster=" + roster.getPeople() + ", vialVolume=" + vialVolume;
            if (SimulationLogger.isTrialOutcomeLoggingEnabled()) {
                SimulationLogger.logTrialOutcome("ABORTED " + violation + " " + detail);
            }
            return TrialOutcome.invalid(violation, detail);
        }

        InjectionTrial trial = new InjectionTrial(roster, numVials, new VialState(vialVolume, leftoverPolicy.createPool()));
        TrialResult result = trial.run();
        if (SimulationLogger.isTrialOutcomeLoggingEnabled()) {
            SimulationLogger.logTrialOutcome("COMPLETED " + result);
        }
        return TrialOutcome.completed(result);
    }

    public LeftoverPolicy getLeftoverPolicy() {
        return leftoverPolicy;
    }

}
