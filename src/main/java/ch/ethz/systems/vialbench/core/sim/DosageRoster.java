package ch.ethz.systems.vialbench.core.sim;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * The people of one trial, ordered by descending dosage. Equal dosages keep
 * their input order. Replacement and leftover decisions only look at the
 * first (largest) and last (smallest) entry.
 */
public class DosageRoster {

    private final List<PersonDosage> people;

    private DosageRoster(List<PersonDosage> people) {
        this.people = Collections.unmodifiableList(people);
    }

    /**
     * Compute every person's dosage and sort the roster.
     *
     * @param schedules     Per-person schedules in configured order
     *
     * @return Sorted roster (not yet validated)
     */
    public static DosageRoster normalize(List<PersonSchedule> schedules) {
        Set<String> names = new HashSet<>();
        List<PersonDosage> dosages = new ArrayList<>(schedules.size());
        for (PersonSchedule schedule : schedules) {
            if (!names.add(schedule.getName())) {
                throw new IllegalArgumentException("Duplicate person in trial: " + schedule.getName());
            }
            dosages.add(PersonDosage.fromSchedule(schedule));
        }
        dosages.sort(Comparator.comparingDouble(PersonDosage::getDosage).reversed());
        return new DosageRoster(dosages);
    }

    /**
     * Check the roster against the vial volume.
     *
     * @param vialVolume    Volume of one vial (mL)
     *
     * @return The first violated condition, or null if the roster can be simulated
     */
    public InvalidTrialReason findViolation(double vialVolume) {
        if (people.isEmpty()) {
            return InvalidTrialReason.EMPTY_ROSTER;
        }
        if (getMaxDosage() > vialVolume) {
            return InvalidTrialReason.DOSAGE_EXCEEDS_VIAL_VOLUME;
        }
        if (getMinDosage() <= 0) {
            return InvalidTrialReason.NON_POSITIVE_DOSAGE;
        }
        for (PersonDosage person : people) {
            if (person.getFrequency() < 1) {
                return InvalidTrialReason.INVALID_FREQUENCY;
            }
        }
        return null;
    }

    public List<PersonDosage> getPeople() {
        return people;
    }

    public int size() {
        return people.size();
    }

    public double getMaxDosage() {
        return people.get(0).getDosage();
    }

    public double getMinDosage() {
        return people.get(people.size() - 1).getDosage();
    }

}
