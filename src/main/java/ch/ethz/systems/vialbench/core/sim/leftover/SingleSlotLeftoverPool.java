package ch.ethz.systems.vialbench.core.sim.leftover;

import java.util.Collections;
import java.util.List;

/**
 * Holds at most one leftover fragment. Retaining a new fragment while the
 * previous one is still usable overwrites it; the overwritten volume is not
 * wasted, only reported back to the caller as displaced.
 */
public class SingleSlotLeftoverPool implements ILeftoverPool {

    private LeftoverFragment slot = null;

    @Override
    public LeftoverFragment findFragmentFor(double dose) {
        if (slot != null && slot.canCover(dose)) {
            return slot;
        }
        return null;
    }

    @Override
    public double consume(LeftoverFragment fragment, double dose, double minDosage) {
        if (fragment != slot) {
            throw new IllegalArgumentException("Fragment is not held by this pool: " + fragment);
        }
        fragment.draw(dose);
        if (fragment.getAmount() - minDosage < 0) {
            slot = null;
            return fragment.getAmount();
        }
        return 0.0;
    }

    @Override
    public double retain(double amount) {
        double displaced = slot == null ? 0.0 : slot.getAmount();
        slot = new LeftoverFragment(amount);
        return displaced;
    }

    @Override
    public double totalRemaining() {
        return slot == null ? 0.0 : slot.getAmount();
    }

    @Override
    public List<LeftoverFragment> getFragments() {
        return slot == null ? Collections.emptyList() : Collections.singletonList(slot);
    }

}
