package ch.ethz.systems.vialbench.core.sim.leftover;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Keeps every retained fragment until it drops below the smallest dosage.
 * A dose is served by the smallest fragment that covers it; among fragments
 * of equal size the oldest one is used.
 */
public class SmallestFitLeftoverPool implements ILeftoverPool {

    // Oldest first
    private final List<LeftoverFragment> fragments = new ArrayList<>();

    @Override
    public LeftoverFragment findFragmentFor(double dose) {
        LeftoverFragment best = null;
        for (LeftoverFragment fragment : fragments) {
            if (fragment.canCover(dose) && (best == null || fragment.getAmount() < best.getAmount())) {
                best = fragment;
            }
        }
        return best;
    }

    @Override
    public double consume(LeftoverFragment fragment, double dose, double minDosage) {
        if (!fragments.contains(fragment)) {
            throw new IllegalArgumentException("Fragment is not held by this pool: " + fragment);
        }
        fragment.draw(dose);
        if (fragment.getAmount() - minDosage < 0) {
            fragments.remove(fragment);
            return fragment.getAmount();
        }
        return 0.0;
    }

    @Override
    public double retain(double amount) {
        fragments.add(new LeftoverFragment(amount));
        return 0.0;
    }

    @Override
    public double totalRemaining() {
        double total = 0.0;
        for (LeftoverFragment fragment : fragments) {
            total += fragment.getAmount();
        }
        return total;
    }

    @Override
    public List<LeftoverFragment> getFragments() {
        return Collections.unmodifiableList(fragments);
    }

}
