package ch.ethz.systems.vialbench.core.sim.leftover;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SmallestFitLeftoverPoolTest {

    private SmallestFitLeftoverPool pool;

    @BeforeEach
    void setUp() {
        pool = new SmallestFitLeftoverPool();
    }

    @Test
    @DisplayName("The smallest fragment that covers the dose is chosen")
    void findFragmentFor_picksSmallestFit() {
        pool.retain(4.0);
        pool.retain(1.5);
        pool.retain(2.5);

        assertEquals(2.5, pool.findFragmentFor(2.0).getAmount());
        assertEquals(1.5, pool.findFragmentFor(1.0).getAmount());
        assertEquals(4.0, pool.findFragmentFor(3.0).getAmount());
        assertNull(pool.findFragmentFor(4.5));
    }

    @Test
    @DisplayName("Among equal fragments the oldest is used")
    void findFragmentFor_tieGoesToOldest() {
        pool.retain(2.0);
        pool.retain(2.0);

        assertSame(pool.getFragments().get(0), pool.findFragmentFor(1.0));
    }

    @Test
    @DisplayName("Retaining never displaces")
    void retain_keepsEverything() {
        assertEquals(0.0, pool.retain(2.0));
        assertEquals(0.0, pool.retain(3.0));

        assertEquals(2, pool.getFragments().size());
        assertEquals(5.0, pool.totalRemaining());
    }

    @Test
    @DisplayName("Only the exhausted fragment is dropped")
    void consume_dropsOnlyExhaustedFragment() {
        pool.retain(3.0);
        pool.retain(2.5);
        LeftoverFragment fragment = pool.findFragmentFor(2.0);

        assertEquals(0.5, pool.consume(fragment, 2.0, 1.0), 1e-9);

        assertEquals(1, pool.getFragments().size());
        assertEquals(3.0, pool.totalRemaining());
    }

    @Test
    @DisplayName("Fragments are read-only from outside")
    void getFragments_isUnmodifiable() {
        pool.retain(2.0);

        assertThrows(UnsupportedOperationException.class, () -> pool.getFragments().clear());
    }

}
