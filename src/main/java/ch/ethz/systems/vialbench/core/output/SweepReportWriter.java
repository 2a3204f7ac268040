package ch.ethz.systems.vialbench.core.output;

import ch.ethz.systems.vialbench.core.sim.PersonDosage;
import ch.ethz.systems.vialbench.core.sim.TrialResult;
import ch.ethz.systems.vialbench.core.sweep.SweepSummary;

import java.io.PrintStream;
import java.util.List;
import java.util.Locale;

/**
 * Prints the least wasteful schedules of a sweep in human readable form.
 * People are listed in their configured order, not by dosage.
 */
public class SweepReportWriter {

    private final PrintStream out;

    public SweepReportWriter(PrintStream out) {
        this.out = out;
    }

    /**
     * @param summary       Sweep summary
     * @param numOutcomes   How many of the best outcomes to print
     */
    public void write(SweepSummary summary, int numOutcomes) {
        if (summary.getAbortedTrials() > 0) {
            out.println(summary.getAbortedTrials() + " trials were aborted.");
            out.println("This is likely a result of having a dose larger than the vial volume or a negative dose.");
            out.println();
        }

        List<TrialResult> results = summary.getResults();
        int shown = Math.min(numOutcomes, results.size());
        out.println("The least wasteful dosage schedules are:");
        for (int i = 0; i < shown; i++) {
            TrialResult result = results.get(i);
            out.println("Optimal outcome: " + (i + 1));
            out.println(String.format(Locale.ROOT, "Total wasted medicine: %.2f mL", result.getWaste()));
            out.println("In " + result.getDay() + " days, you will have used " + summary.getNumVials() + " vials");
            for (String name : summary.getNames()) {
                PersonDosage person = result.findPerson(name);
                out.println(String.format(Locale.ROOT, "%s's dosage: %.2f mL every %d days",
                        person.getName(), person.getDosage(), person.getFrequency()));
            }
            out.println();
        }
        out.flush();
    }

}
