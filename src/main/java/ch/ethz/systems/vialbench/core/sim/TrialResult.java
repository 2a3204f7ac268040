package ch.ethz.systems.vialbench.core.sim;

import java.util.List;

/**
 * Outcome of a completed trial.
 */
public class TrialResult {

    private final double waste;
    private final int day;
    private final int vialsUsed;
    private final List<PersonDosage> roster;

    /**
     * @param waste         Volume wasted (mL)
     * @param day           Day on which the vial target was reached
     * @param vialsUsed     Vials opened by then
     * @param roster        People sorted by descending dosage
     */
    public TrialResult(double waste, int day, int vialsUsed, List<PersonDosage> roster) {
        this.waste = waste;
        this.day = day;
        this.vialsUsed = vialsUsed;
        this.roster = List.copyOf(roster);
    }

    public double getWaste() {
        return waste;
    }

    public int getDay() {
        return day;
    }

    public int getVialsUsed() {
        return vialsUsed;
    }

    public List<PersonDosage> getRoster() {
        return roster;
    }

    /**
     * @param name  Person name
     *
     * @return That person's dosage, or null if not in the roster
     */
    public PersonDosage findPerson(String name) {
        for (PersonDosage person : roster) {
            if (person.getName().equals(name)) {
                return person;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return "TrialResult{waste=" + waste + ", day=" + day + ", vialsUsed=" + vialsUsed + ", roster=" + roster + "}";
    }

}
