package dumb.afsolve;

import java.util.BitSet;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * Extension-based predicates over a candidate set of arguments. These answer the
 * verification problems directly, without search.
 */
public final class Extensions {

    private Extensions() {
    }

    /** No member of {@code s} attacks a member of {@code s}. */
    public static boolean isConflictFree(Framework f, Collection<String> s) {
        var members = bits(f, s);
        for (var i = members.nextSetBit(0); i >= 0; i = members.nextSetBit(i + 1)) {
            for (var t : f.targetIndices(i)) if (members.get(t)) return false;
        }
        return true;
    }

    /** Conflict-free, and {@code s} defends each of its members. */
    public static boolean isAdmissible(Framework f, Collection<String> s) {
        if (!isConflictFree(f, s)) return false;
        var members = bits(f, s);
        var defended = defended(f, members);
        var missing = (BitSet) members.clone();
        missing.andNot(defended);
        return missing.isEmpty();
    }

    /** Admissible, and equal to the set of arguments it defends. */
    public static boolean isComplete(Framework f, Collection<String> s) {
        return isAdmissible(f, s) && defended(f, bits(f, s)).equals(bits(f, s));
    }

    /** Conflict-free, and every other argument is attacked by a member of {@code s}. */
    public static boolean isStable(Framework f, Collection<String> s) {
        if (!isConflictFree(f, s)) return false;
        var covered = attackedBy(f, bits(f, s));
        covered.or(bits(f, s));
        return covered.cardinality() == f.size();
    }

    /** The characteristic function: arguments whose every attacker is attacked by {@code s}. */
    public static Set<String> defended(Framework f, Collection<String> s) {
        return names(f, defended(f, bits(f, s)));
    }

    /** Least fixed point of {@link #defended}, reached by iterating from the empty set. */
    public static Set<String> grounded(Framework f) {
        var current = new BitSet(f.size());
        while (true) {
            var next = defended(f, current);
            if (next.equals(current)) return names(f, current);
            current = next;
        }
    }

    /**
     * Labelling induced by a candidate extension: members IN, arguments they attack OUT,
     * the rest UNDEC. For a complete extension this is its complete labelling.
     */
    public static Labelling labellingOf(Framework f, Collection<String> s) {
        var members = bits(f, s);
        var out = attackedBy(f, members);
        var labels = new Label[f.size()];
        for (var i = 0; i < labels.length; i++)
            labels[i] = members.get(i) ? Label.IN : out.get(i) ? Label.OUT : Label.UNDEC;
        return new Labelling(f, labels);
    }

    private static BitSet defended(Framework f, BitSet s) {
        var attacked = attackedBy(f, s);
        var result = new BitSet(f.size());
        next:
        for (var i = 0; i < f.size(); i++) {
            for (var a : f.attackerIndices(i)) if (!attacked.get(a)) continue next;
            result.set(i);
        }
        return result;
    }

    private static BitSet attackedBy(Framework f, BitSet s) {
        var result = new BitSet(f.size());
        for (var i = s.nextSetBit(0); i >= 0; i = s.nextSetBit(i + 1))
            for (var t : f.targetIndices(i)) result.set(t);
        return result;
    }

    private static BitSet bits(Framework f, Collection<String> s) {
        requireNonNull(s);
        var b = new BitSet(f.size());
        for (var arg : s) {
            var i = f.indexOf(arg);
            if (i < 0) throw new IllegalArgumentException("Unknown argument: " + arg);
            b.set(i);
        }
        return b;
    }

    private static Set<String> names(Framework f, BitSet b) {
        var result = new LinkedHashSet<String>();
        for (var i = b.nextSetBit(0); i >= 0; i = b.nextSetBit(i + 1)) result.add(f.argument(i));
        return result;
    }
}
