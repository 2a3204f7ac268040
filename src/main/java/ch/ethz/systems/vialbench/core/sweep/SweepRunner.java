package ch.ethz.systems.vialbench.core.sweep;

import ch.ethz.systems.vialbench.core.log.SimulationLogger;
import ch.ethz.systems.vialbench.core.sim.IVialSimulator;
import ch.ethz.systems.vialbench.core.sim.PersonSchedule;
import ch.ethz.systems.vialbench.core.sim.TrialOutcome;
import ch.ethz.systems.vialbench.core.sim.TrialResult;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs every trial of a sweep in order, drops rejected trials and duplicate
 * results, and ranks the rest by waste.
 */
public class SweepRunner {

    private final IVialSimulator simulator;
    private final int numVials;
    private final double vialVolume;

    public SweepRunner(IVialSimulator simulator, int numVials, double vialVolume) {
        this.simulator = simulator;
        this.numVials = numVials;
        this.vialVolume = vialVolume;
    }

    /**
     * @param sweep     Combinations to simulate
     *
     * @return Ranked unique results
     *
     * @throws NoUsableScheduleException    If every trial was rejected
     */
    public SweepSummary run(ParameterSweep sweep) {
        SimulationLogger.logInfo("SWEEP_START", "trials=" + sweep.size() + ",numVials=" + numVials + ",vialVolume=" + vialVolume);

        // First occurrence wins, so ties keep enumeration order
        Map<TrialKey, TrialResult> unique = new LinkedHashMap<>();
        long total = 0;
        long aborted = 0;
        for (List<PersonSchedule> combination : sweep) {
            total++;
            TrialOutcome outcome = simulator.simulate(combination, numVials, vialVolume);
            if (outcome.isValid()) {
                TrialResult result = outcome.getResult();
                unique.putIfAbsent(new TrialKey(result), result);
            } else {
                aborted++;
            }
        }

        SimulationLogger.logInfo("SWEEP_DONE", "trials=" + total + ",aborted=" + aborted + ",unique=" + unique.size());
        if (unique.isEmpty()) {
            throw new NoUsableScheduleException(aborted);
        }

        List<TrialResult> ranked = new ArrayList<>(unique.values());
        ranked.sort(Comparator.comparingDouble(TrialResult::getWaste));
        return new SweepSummary(sweep.getNames(), ranked, total, aborted, numVials);
    }

}
