package ch.ethz.systems.vialbench.core.sweep;

import ch.ethz.systems.vialbench.core.sim.PersonSchedule;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Every combination of dose rate and frequency across all people. The
 * factors are ordered person by person, dose rate before frequency, and the
 * last factor varies fastest.
 */
public class ParameterSweep implements Iterable<List<PersonSchedule>> {

    private final List<PersonRange> people;

    public ParameterSweep(List<PersonRange> people) {
        if (people.isEmpty()) {
            throw new IllegalArgumentException("A sweep needs at least one person.");
        }
        this.people = Collections.unmodifiableList(new ArrayList<>(people));
    }

    /**
     * @return Number of combinations
     */
    public long size() {
        long size = 1;
        for (PersonRange person : people) {
            size = Math.multiplyExact(size, (long) person.doseRateCount() * person.frequencyCount());
        }
        return size;
    }

    public List<PersonRange> getPeople() {
        return people;
    }

    /**
     * @return Names in configured order
     */
    public List<String> getNames() {
        List<String> names = new ArrayList<>(people.size());
        for (PersonRange person : people) {
            names.add(person.getName());
        }
        return names;
    }

    @Override
    public Iterator<List<PersonSchedule>> iterator() {
        return new CombinationIterator();
    }

    /**
     * Odometer over the factor indices: [rate of person 0, frequency of person 0, rate of person 1, ...].
     */
    private class CombinationIterator implements Iterator<List<PersonSchedule>> {

        private final int[] indices = new int[people.size() * 2];
        private boolean exhausted = false;

        @Override
        public boolean hasNext() {
            return !exhausted;
        }

        @Override
        public List<PersonSchedule> next() {
            if (exhausted) {
                throw new NoSuchElementException();
            }
            List<PersonSchedule> combination = new ArrayList<>(people.size());
            for (int p = 0; p < people.size(); p++) {
                PersonRange person = people.get(p);
                combination.add(new PersonSchedule(person.getName(),
                        person.doseRateAt(indices[2 * p]), person.frequencyAt(indices[2 * p + 1])));
            }
            advance();
            return combination;
        }

        private void advance() {
            for (int factor = indices.length - 1; factor >= 0; factor--) {
                indices[factor]++;
                if (indices[factor] < factorSize(factor)) {
                    return;
                }
                indices[factor] = 0;
            }
            exhausted = true;
        }

        private int factorSize(int factor) {
            PersonRange person = people.get(factor / 2);
            return factor % 2 == 0 ? person.doseRateCount() : person.frequencyCount();
        }

    }

}
