package ch.ethz.systems.vialbench.core.sim;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * A person's per-injection dosage within one trial.
 */
public class PersonDosage {

    /** Dosages are cut off at this many decimal places (mL). */
    public static final int DOSAGE_SCALE = 2;

    private final String name;
    private final double dosage;
    private final int frequency;

    public PersonDosage(String name, double dosage, int frequency) {
        this.name = name;
        this.dosage = dosage;
        this.frequency = frequency;
    }

    /**
     * Derive the per-injection dosage from a dose rate: rate times interval,
     * rounded half-even on the exact binary value to {@link #DOSAGE_SCALE} places.
     *
     * @param schedule  Person schedule
     *
     * @return Person dosage
     */
    public static PersonDosage fromSchedule(PersonSchedule schedule) {
        double raw = schedule.getDoseRatePerDay() * schedule.getIntervalDays();
        double rounded = new BigDecimal(raw).setScale(DOSAGE_SCALE, RoundingMode.HALF_EVEN).doubleValue();
        return new PersonDosage(schedule.getName(), rounded, schedule.getIntervalDays());
    }

    /**
     * @param day   Simulated day (starting at 1)
     *
     * @return True iff this person injects on the given day
     */
    public boolean isDueOn(int day) {
        return day % frequency == 0;
    }

    public String getName() {
        return name;
    }

    public double getDosage() {
        return dosage;
    }

    public int getFrequency() {
        return frequency;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PersonDosage)) return false;
        PersonDosage that = (PersonDosage) o;
        return Double.compare(that.dosage, dosage) == 0
                && frequency == that.frequency
                && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, dosage, frequency);
    }

    @Override
    public String toString() {
        return name + ": " + dosage + " mL every " + frequency + " days";
    }

}
