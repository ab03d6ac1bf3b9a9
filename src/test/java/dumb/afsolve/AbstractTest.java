package dumb.afsolve;

import dumb.afsolve.io.ApxParser;

import java.util.*;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.fail;

abstract class AbstractTest {

    static final String SELF_LOOP = """
            arg(a).
            att(a,a).
            """;

    static final String TWO_CYCLE = """
            arg(a).
            arg(b).
            att(a,b).
            att(b,a).
            """;

    static final String THREE_CYCLE = """
            arg(a).
            arg(b).
            arg(c).
            att(a,b).
            att(b,c).
            att(c,a).
            """;

    static final String CHAIN = """
            arg(a).
            arg(b).
            arg(c).
            att(a,b).
            att(b,c).
            """;

    /** a and b attack each other and both attack c, which attacks d. */
    static final String FLOATING = """
            arg(a).
            arg(b).
            arg(c).
            arg(d).
            att(a,b).
            att(b,a).
            att(a,c).
            att(b,c).
            att(c,d).
            """;

    static Framework af(String apx) {
        try {
            return ApxParser.parse(apx);
        } catch (ApxParser.ParseException | AfException e) {
            fail("Failed to parse APX:\n" + apx + "\n" + e.getMessage());
            return null;
        }
    }

    static Set<String> set(String... args) {
        return new LinkedHashSet<>(Arrays.asList(args));
    }

    static Set<Set<String>> extensions(Collection<Labelling> labellings) {
        return labellings.stream().map(Labelling::extension).collect(Collectors.toSet());
    }

    static boolean solve(String apx, String code, String... target) {
        var problem = Problem.fromCode(code).orElseThrow(() -> new IllegalArgumentException("Unknown problem " + code));
        try {
            return new Solver().evaluate(af(apx), problem, set(target));
        } catch (AfException e) {
            fail(code + " " + Arrays.toString(target) + " failed: " + e.getMessage(), e);
            return false;
        }
    }

    /** Every subset of the framework's arguments satisfying {@code complete} or {@code stable}, by brute force. */
    static Set<Set<String>> bruteForce(Framework f, boolean stable) {
        var args = f.arguments();
        var result = new HashSet<Set<String>>();
        for (var mask = 0; mask < (1 << args.size()); mask++) {
            var s = new LinkedHashSet<String>();
            for (var i = 0; i < args.size(); i++) if ((mask & (1 << i)) != 0) s.add(args.get(i));
            if (stable ? Extensions.isStable(f, s) : Extensions.isComplete(f, s)) result.add(s);
        }
        return result;
    }

    /** Seeded random framework over arguments a0..a(n-1); self-attacks included. */
    static Framework random(Random rng, int n, double density) {
        var args = new ArrayList<String>();
        for (var i = 0; i < n; i++) args.add("a" + i);
        var attacks = new ArrayList<Framework.Attack>();
        for (var s : args)
            for (var t : args)
                if (rng.nextDouble() < density) attacks.add(new Framework.Attack(s, t));
        try {
            return Framework.build(args, attacks);
        } catch (AfException.MalformedFramework e) {
            throw new IllegalStateException(e);
        }
    }

    /** {@code n} disjoint 2-cycles x_i and y_i, declared x0, y0, x1, y1, ... */
    static Framework disjointCycles(int n) {
        var args = new ArrayList<String>();
        var attacks = new ArrayList<Framework.Attack>();
        for (var i = 0; i < n; i++) {
            args.add("x" + i);
            args.add("y" + i);
            attacks.add(new Framework.Attack("x" + i, "y" + i));
            attacks.add(new Framework.Attack("y" + i, "x" + i));
        }
        try {
            return Framework.build(args, attacks);
        } catch (AfException.MalformedFramework e) {
            throw new IllegalStateException(e);
        }
    }
}
