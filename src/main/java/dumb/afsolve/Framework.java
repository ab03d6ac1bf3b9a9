package dumb.afsolve;

import java.util.*;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static java.util.Objects.requireNonNull;

/**
 * Immutable argumentation framework: a set of arguments and the attack relation among them.
 * <p>
 * Arguments keep their declaration order, which is also the order the search branches in.
 * Attacker and target lists are indexed once at construction; every accessor is a read.
 */
public final class Framework {

    private final List<String> arguments;
    private final Map<String, Integer> index;
    private final Set<Attack> attacks;
    private final int[][] attackers;
    private final int[][] targets;

    private Framework(List<String> arguments, Set<Attack> attacks) {
        this.arguments = List.copyOf(arguments);
        this.attacks = Collections.unmodifiableSet(new LinkedHashSet<>(attacks));

        var idx = new HashMap<String, Integer>(arguments.size() * 2);
        for (var i = 0; i < this.arguments.size(); i++) idx.put(this.arguments.get(i), i);
        this.index = Collections.unmodifiableMap(idx);

        List<List<Integer>> in = new ArrayList<>(), out = new ArrayList<>();
        for (var i = 0; i < this.arguments.size(); i++) {
            in.add(new ArrayList<>());
            out.add(new ArrayList<>());
        }
        for (var a : this.attacks) {
            int s = idx.get(a.source()), t = idx.get(a.target());
            out.get(s).add(t);
            in.get(t).add(s);
        }
        this.attackers = in.stream().map(l -> l.stream().mapToInt(Integer::intValue).toArray()).toArray(int[][]::new);
        this.targets = out.stream().map(l -> l.stream().mapToInt(Integer::intValue).toArray()).toArray(int[][]::new);
    }

    /**
     * Builds a framework, rejecting attacks whose endpoints are not among {@code arguments}.
     * Duplicate arguments and attacks collapse.
     */
    public static Framework build(Collection<String> arguments, Collection<Attack> attacks) throws AfException.MalformedFramework {
        requireNonNull(arguments);
        requireNonNull(attacks);
        var args = new LinkedHashSet<String>();
        for (var a : arguments) args.add(requireNonNull(a, "argument"));
        for (var a : attacks) {
            if (!args.contains(a.source())) throw new AfException.MalformedFramework(a.source(), a.target(), a.source());
            if (!args.contains(a.target())) throw new AfException.MalformedFramework(a.source(), a.target(), a.target());
        }
        return new Framework(new ArrayList<>(args), new LinkedHashSet<>(attacks));
    }

    public int size() {
        return arguments.size();
    }

    public boolean contains(String argument) {
        return index.containsKey(argument);
    }

    /** Arguments in declaration order. */
    public List<String> arguments() {
        return arguments;
    }

    public Set<Attack> attacks() {
        return attacks;
    }

    public Set<String> attackersOf(String argument) {
        return names(attackers[require(argument)]);
    }

    public Set<String> attackedBy(String argument) {
        return names(targets[require(argument)]);
    }

    public boolean attacks(String source, String target) {
        int s = require(source), t = require(target);
        return IntStream.of(attackers[t]).anyMatch(x -> x == s);
    }

    /** Position of {@code argument} in declaration order, or -1. */
    public int indexOf(String argument) {
        var i = index.get(argument);
        return i == null ? -1 : i;
    }

    public String argument(int i) {
        return arguments.get(i);
    }

    /** Indices of the attackers of argument {@code i}. The returned array must not be modified. */
    int[] attackerIndices(int i) {
        return attackers[i];
    }

    /** Indices of the arguments attacked by argument {@code i}. The returned array must not be modified. */
    int[] targetIndices(int i) {
        return targets[i];
    }

    private int require(String argument) {
        var i = index.get(requireNonNull(argument));
        if (i == null) throw new IllegalArgumentException("Unknown argument: " + argument);
        return i;
    }

    private Set<String> names(int[] ids) {
        return IntStream.of(ids).mapToObj(arguments::get).collect(Collectors.toCollection(LinkedHashSet::new));
    }

    @Override
    public String toString() {
        return "Framework[" + arguments.size() + " arguments, " + attacks.size() + " attacks]";
    }

    /** {@code source} attacks {@code target}. */
    public record Attack(String source, String target) {
        public Attack {
            requireNonNull(source);
            requireNonNull(target);
        }

        public boolean selfAttack() {
            return source.equals(target);
        }

        @Override
        public String toString() {
            return "att(" + source + "," + target + ")";
        }
    }
}
