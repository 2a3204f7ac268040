package ch.ethz.systems.vialbench.core.sweep;

import ch.ethz.systems.vialbench.core.sim.PersonDosage;
import ch.ethz.systems.vialbench.core.sim.TrialResult;

import java.util.List;
import java.util.Objects;

/**
 * Identity of a result for de-duplication: waste in hundredths of a mL, day,
 * and the ordered roster.
 */
final class TrialKey {

    private final long wasteHundredths;
    private final int day;
    private final List<PersonDosage> roster;

    TrialKey(TrialResult result) {
        this.wasteHundredths = Math.round(result.getWaste() * 100);
        this.day = result.getDay();
        this.roster = result.getRoster();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TrialKey)) return false;
        TrialKey that = (TrialKey) o;
        return wasteHundredths == that.wasteHundredths && day == that.day && roster.equals(that.roster);
    }

    @Override
    public int hashCode() {
        return Objects.hash(wasteHundredths, day, roster);
    }

}
