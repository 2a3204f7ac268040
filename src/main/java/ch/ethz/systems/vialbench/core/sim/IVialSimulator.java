package ch.ethz.systems.vialbench.core.sim;

import java.util.List;

/**
 * Runs a single trial of shared vial use.
 */
public interface IVialSimulator {

    /**
     * Simulate one fixed assignment of dose rate and interval per person until
     * the given number of vials has been opened.
     *
     * @param schedules     Per-person schedules, names unique
     * @param numVials      Target number of vials (at least 1)
     * @param vialVolume    Volume of a vial (mL, positive)
     *
     * @return Completed result, or an invalid outcome if the dosages cannot be simulated
     *
     * @throws IllegalArgumentException     If the arguments themselves are malformed
     */
    TrialOutcome simulate(List<PersonSchedule> schedules, int numVials, double vialVolume);

}
