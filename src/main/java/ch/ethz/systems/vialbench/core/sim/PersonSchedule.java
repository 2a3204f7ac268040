package ch.ethz.systems.vialbench.core.sim;

import java.util.Objects;

/**
 * One person's parameters for a single trial: how much medication they use
 * per day on average and how many days pass between their injections.
 */
public class PersonSchedule {

    private final String name;
    private final double doseRatePerDay;
    private final int intervalDays;

    /**
     * @param name              Person identifier, unique within a trial
     * @param doseRatePerDay    Average use in mL per day
     * @param intervalDays      Days between injections
     */
    public PersonSchedule(String name, double doseRatePerDay, int intervalDays) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("Person name must be non-empty.");
        }
        if (!Double.isFinite(doseRatePerDay)) {
            throw new IllegalArgumentException("Dose rate of " + name + " must be finite: " + doseRatePerDay);
        }
        this.name = name;
        this.doseRatePerDay = doseRatePerDay;
        this.intervalDays = intervalDays;
    }

    public String getName() {
        return name;
    }

    public double getDoseRatePerDay() {
        return doseRatePerDay;
    }

    public int getIntervalDays() {
        return intervalDays;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PersonSchedule)) return false;
        PersonSchedule that = (PersonSchedule) o;
        return Double.compare(that.doseRatePerDay, doseRatePerDay) == 0
                && intervalDays == that.intervalDays
                && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, doseRatePerDay, intervalDays);
    }

    @Override
    public String toString() {
        return name + "(" + doseRatePerDay + " mL/day every " + intervalDays + " days)";
    }

}
