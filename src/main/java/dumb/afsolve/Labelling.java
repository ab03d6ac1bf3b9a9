package dumb.afsolve;

import org.jetbrains.annotations.Nullable;

import java.util.*;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static java.util.Objects.requireNonNull;

/**
 * Assignment of {@link Label}s to the arguments of a {@link Framework}.
 * <p>
 * A labelling may be partial while the search is building it (unassigned arguments have no
 * label); only total labellings are handed to callers. Instances are not modified once
 * published.
 */
public final class Labelling {

    private final Framework framework;
    private final Label[] labels;

    Labelling(Framework framework, Label[] labels) {
        this.framework = framework;
        this.labels = labels;
    }

    /** Every argument unassigned. */
    public static Labelling empty(Framework framework) {
        return new Labelling(requireNonNull(framework), new Label[framework.size()]);
    }

    /** Labelling from an explicit map; arguments missing from the map stay unassigned. */
    public static Labelling of(Framework framework, Map<String, Label> labels) {
        var l = new Label[framework.size()];
        labels.forEach((arg, label) -> {
            var i = framework.indexOf(arg);
            if (i < 0) throw new IllegalArgumentException("Unknown argument: " + arg);
            l[i] = requireNonNull(label);
        });
        return new Labelling(framework, l);
    }

    /**
     * Forced label of argument {@code i}: OUT when some attacker is IN, IN when every attacker is
     * OUT, UNDEC when every attacker is labelled and neither holds, null while undetermined.
     */
    static @Nullable Label forced(Framework f, Label[] labels, int i) {
        var attackers = f.attackerIndices(i);
        var out = 0;
        var unassigned = false;
        for (var a : attackers) {
            var l = labels[a];
            if (l == Label.IN) return Label.OUT;
            if (l == Label.OUT) out++;
            else if (l == null) unassigned = true;
        }
        if (out == attackers.length) return Label.IN;
        return unassigned ? null : Label.UNDEC;
    }

    static boolean allAttackersOut(Framework f, Label[] labels, int i) {
        for (var a : f.attackerIndices(i))
            if (labels[a] != Label.OUT) return false;
        return true;
    }

    static boolean someAttackerIn(Framework f, Label[] labels, int i) {
        for (var a : f.attackerIndices(i))
            if (labels[a] == Label.IN) return true;
        return false;
    }

    public Framework framework() {
        return framework;
    }

    public @Nullable Label label(String argument) {
        return labels[require(argument)];
    }

    public boolean isIn(String argument) {
        return label(argument) == Label.IN;
    }

    public boolean isTotal() {
        for (var l : labels) if (l == null) return false;
        return true;
    }

    /** Arguments labelled IN, in declaration order. */
    public Set<String> extension() {
        return withLabel(Label.IN);
    }

    public Set<String> withLabel(Label label) {
        return IntStream.range(0, labels.length)
                .filter(i -> labels[i] == label)
                .mapToObj(framework::argument)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    /** Every attacker of {@code argument} is labelled OUT. */
    public boolean canBeIn(String argument) {
        return allAttackersOut(framework, labels, require(argument));
    }

    /** Some attacker of {@code argument} is labelled IN. */
    public boolean mustBeOut(String argument) {
        return someAttackerIn(framework, labels, require(argument));
    }

    public @Nullable Label forcedLabel(String argument) {
        return forced(framework, labels, require(argument));
    }

    /** Total, and every argument carries exactly the label its attackers force. */
    public boolean isComplete() {
        for (var i = 0; i < labels.length; i++) {
            if (labels[i] == null || labels[i] != forced(framework, labels, i)) return false;
        }
        return true;
    }

    public boolean isStable() {
        return isComplete() && Arrays.stream(labels).noneMatch(l -> l == Label.UNDEC);
    }

    private int require(String argument) {
        var i = framework.indexOf(requireNonNull(argument));
        if (i < 0) throw new IllegalArgumentException("Unknown argument: " + argument);
        return i;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof Labelling l && framework == l.framework && Arrays.equals(labels, l.labels));
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(labels);
    }

    @Override
    public String toString() {
        return "Labelling[IN=" + withLabel(Label.IN) + ", OUT=" + withLabel(Label.OUT) + ", UNDEC=" + withLabel(Label.UNDEC) + "]";
    }
}
