package ch.ethz.systems.vialbench.core.sweep;

import ch.ethz.systems.vialbench.core.sim.TrialResult;

import java.util.List;

/**
 * Ranked unique results of a sweep, least waste first.
 */
public class SweepSummary {

    private final List<String> names;
    private final List<TrialResult> results;
    private final long totalTrials;
    private final long abortedTrials;
    private final int numVials;

    public SweepSummary(List<String> names, List<TrialResult> results, long totalTrials, long abortedTrials, int numVials) {
        this.names = List.copyOf(names);
        this.results = List.copyOf(results);
        this.totalTrials = totalTrials;
        this.abortedTrials = abortedTrials;
        this.numVials = numVials;
    }

    /**
     * @return People in configured order
     */
    public List<String> getNames() {
        return names;
    }

    public List<TrialResult> getResults() {
        return results;
    }

    public TrialResult getBest() {
        return results.get(0);
    }

    public long getTotalTrials() {
        return totalTrials;
    }

    public long getAbortedTrials() {
        return abortedTrials;
    }

    public int getNumVials() {
        return numVials;
    }

}
