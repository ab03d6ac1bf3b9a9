package dumb.afsolve;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static dumb.afsolve.Extensions.*;
import static org.junit.jupiter.api.Assertions.*;

class ExtensionsTest extends AbstractTest {

    @Test
    void conflictFreeness() {
        var f = af(TWO_CYCLE);
        assertTrue(isConflictFree(f, set()));
        assertTrue(isConflictFree(f, set("a")));
        assertFalse(isConflictFree(f, set("a", "b")));
        assertFalse(isConflictFree(af(SELF_LOOP), set("a")));
    }

    @Test
    void admissibility() {
        var f = af(CHAIN);
        assertTrue(isAdmissible(f, set()));
        assertTrue(isAdmissible(f, set("a")));
        assertTrue(isAdmissible(f, set("a", "c")));
        assertFalse(isAdmissible(f, set("c")), "c is attacked by b and nothing in {c} attacks b");
        assertFalse(isAdmissible(f, set("b")));
    }

    @Test
    void completenessRequiresContainingWhatItDefends() {
        var f = af(CHAIN);
        assertTrue(isComplete(f, set("a", "c")));
        assertFalse(isComplete(f, set("a")), "{a} defends c");
        assertFalse(isComplete(f, set()), "{} defends the unattacked a");
    }

    @Test
    void selfLoopEmptySetIsComplete() {
        var f = af(SELF_LOOP);
        assertTrue(isComplete(f, set()));
        assertFalse(isComplete(f, set("a")));
        assertFalse(isStable(f, set()));
    }

    @Test
    void stability() {
        var f = af(TWO_CYCLE);
        assertTrue(isStable(f, set("a")));
        assertTrue(isStable(f, set("b")));
        assertFalse(isStable(f, set()));
        assertFalse(isStable(f, set("a", "b")));

        var odd = af(THREE_CYCLE);
        for (var s : bruteForce(odd, false)) assertFalse(isStable(odd, s));
    }

    @Test
    void characteristicFunction() {
        var f = af(CHAIN);
        assertEquals(Set.of("a"), defended(f, set()));
        assertEquals(Set.of("a", "c"), defended(f, set("a")));
    }

    @Test
    void groundedIsLeastFixedPoint() {
        assertEquals(Set.of("a", "c"), grounded(af(CHAIN)));
        assertEquals(Set.of(), grounded(af(TWO_CYCLE)));
        assertEquals(Set.of(), grounded(af(SELF_LOOP)));
        assertEquals(Set.of(), grounded(af(FLOATING)));
    }

    @Test
    void labellingOfCompleteExtensionIsComplete() {
        var f = af(FLOATING);
        var l = labellingOf(f, set("a", "d"));
        assertEquals(Label.IN, l.label("a"));
        assertEquals(Label.OUT, l.label("b"));
        assertEquals(Label.OUT, l.label("c"));
        assertEquals(Label.IN, l.label("d"));
        assertTrue(l.isComplete());
        assertTrue(l.isStable());

        assertFalse(labellingOf(f, set("d")).isComplete());
    }

    @Test
    void unknownArgumentRejected() {
        assertThrows(IllegalArgumentException.class, () -> isComplete(af(CHAIN), set("z")));
    }
}
