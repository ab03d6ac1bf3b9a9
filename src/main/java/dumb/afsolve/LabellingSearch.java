package dumb.afsolve;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.function.Predicate;
import java.util.stream.IntStream;

import static java.util.Objects.requireNonNull;

/**
 * Enumerates the complete (or stable) labellings of a {@link Framework} by depth-first
 * backtracking with constraint propagation.
 * <p>
 * The depth-first walk runs on an explicit stack of branch frames over a single label array.
 * Every assignment is recorded on a trail, and leaving a branch undoes the trail back to the
 * frame's mark. All of that state belongs to one run, so an instance keeps nothing between
 * calls and may serve concurrent queries. Labellings are produced in a fixed order for a given
 * framework and branch order; the caller's {@link Visitor} decides when to stop.
 * <p>
 * A search may be focused on one argument and a set of labels it must carry. The focus
 * argument is branched on first and only with those labels, so every labelling reached
 * satisfies the focus and subtrees that cannot are never entered.
 */
public final class LabellingSearch {

    private static final Logger logger = LoggerFactory.getLogger(LabellingSearch.class);

    private static final Label[] COMPLETE_BRANCHES = {Label.UNDEC, Label.IN, Label.OUT};
    private static final Label[] STABLE_BRANCHES = {Label.IN, Label.OUT};

    private final Framework framework;
    private final Semantics semantics;
    private final int[] order;
    private final long timeoutMillis;
    private final boolean logStats;

    public LabellingSearch(Framework framework, Semantics semantics) {
        this(framework, semantics, BranchOrder.INSERTION, 0, false);
    }

    /**
     * @param timeoutMillis wall-clock budget per search, checked at every node; 0 disables it
     * @param logStats      report search statistics at INFO rather than DEBUG
     */
    public LabellingSearch(Framework framework, Semantics semantics, BranchOrder branchOrder, long timeoutMillis, boolean logStats) {
        this.framework = requireNonNull(framework);
        this.semantics = requireNonNull(semantics);
        this.order = requireNonNull(branchOrder).order(framework);
        if (timeoutMillis < 0) throw new IllegalArgumentException("timeoutMillis must be >= 0: " + timeoutMillis);
        this.timeoutMillis = timeoutMillis;
        this.logStats = logStats;
    }

    public Framework framework() {
        return framework;
    }

    public Semantics semantics() {
        return semantics;
    }

    /**
     * The grounded labelling: propagation from the empty labelling with no branching, every
     * argument left undetermined labelled UNDEC. It is complete for every framework.
     */
    public Labelling grounded() {
        var run = new Run(l -> true);
        run.seedAll();
        if (!run.propagate(true)) throw new IllegalStateException("Propagation from the empty labelling cannot fail");
        var labels = run.labels;
        for (var i = 0; i < labels.length; i++) if (labels[i] == null) labels[i] = Label.UNDEC;
        return new Labelling(framework, labels);
    }

    /** First labelling accepted by {@code goal}, if any. */
    public Optional<Labelling> find(Predicate<Labelling> goal) throws AfException.Timeout {
        requireNonNull(goal);
        var found = new Labelling[1];
        forEach(l -> {
            if (!goal.test(l)) return false;
            found[0] = l;
            return true;
        });
        return Optional.ofNullable(found[0]);
    }

    /** First labelling in which {@code argument} carries one of {@code accepted}, if any. */
    public Optional<Labelling> findLabelled(String argument, Set<Label> accepted) throws AfException.Timeout {
        var found = new Labelling[1];
        forEach(argument, accepted, l -> {
            found[0] = l;
            return true;
        });
        return Optional.ofNullable(found[0]);
    }

    /** Every labelling, in search order. */
    public List<Labelling> all() throws AfException.Timeout {
        var result = new ArrayList<Labelling>();
        forEach(l -> {
            result.add(l);
            return false;
        });
        return result;
    }

    /**
     * Visits labellings in search order until the visitor asks to stop or the space is exhausted.
     *
     * @return statistics of the run; {@link Stats#stopped()} tells whether the visitor stopped it
     */
    public Stats forEach(Visitor visitor) throws AfException.Timeout {
        return search(new Run(requireNonNull(visitor)), -1, EnumSet.allOf(Label.class));
    }

    /**
     * Visits only the labellings in which {@code argument} carries one of {@code accepted}.
     * The argument is branched on before any other.
     */
    public Stats forEach(String argument, Set<Label> accepted, Visitor visitor) throws AfException.Timeout {
        var focus = framework.indexOf(requireNonNull(argument));
        if (focus < 0) throw new IllegalArgumentException("Unknown argument: " + argument);
        var labels = requireNonNull(accepted).isEmpty() ? EnumSet.noneOf(Label.class) : EnumSet.copyOf(accepted);
        return search(new Run(requireNonNull(visitor)), focus, labels);
    }

    private Stats search(Run run, int focus, EnumSet<Label> accepted) throws AfException.Timeout {
        run.stats.stopped = explore(run, focus, accepted);
        if (logStats) logger.info("{} search over {}: {}", semantics, framework, run.stats);
        else logger.debug("{} search over {}: {}", semantics, framework, run.stats);
        return run.stats;
    }

    private boolean explore(Run run, int focus, EnumSet<Label> accepted) throws AfException.Timeout {
        var allowUndec = semantics == Semantics.COMPLETE;
        var labels = run.labels;
        var frames = new ArrayDeque<Frame>();

        run.tick();
        run.seedAll();
        if (!run.propagate(allowUndec)) {
            run.stats.deadEnds++;
            return false;
        }
        if (focus >= 0) {
            if (labels[focus] != null && !accepted.contains(labels[focus])) {
                run.stats.deadEnds++;
                return false;
            }
            if (labels[focus] == null) frames.push(new Frame(focus, branches(accepted), 0, run.trailSize));
        }

        var descend = frames.isEmpty();
        var resume = 0;
        while (true) {
            if (descend) {
                var pos = nextUnassigned(labels, resume);
                if (pos < 0) {
                    if (leaf(run)) return true;
                } else {
                    frames.push(new Frame(order[pos], branches(null), pos + 1, run.trailSize));
                }
            }

            descend = false;
            while (!frames.isEmpty()) {
                var top = frames.peek();
                run.undo(top.mark);
                if (top.next == top.labels.length) {
                    frames.pop();
                    continue;
                }
                run.tick();
                run.assign(top.argument, top.labels[top.next++]);
                run.enqueue(top.argument);
                if (run.propagate(allowUndec)) {
                    descend = true;
                    resume = top.resume;
                    break;
                }
                run.stats.deadEnds++;
            }
            if (!descend) return false;
        }
    }

    /** Hands a total labelling to the visitor if it passes the final check. */
    private boolean leaf(Run run) {
        var labelling = new Labelling(framework, run.labels.clone());
        if (!labelling.isComplete() || (semantics == Semantics.STABLE && !labelling.isStable())) {
            run.stats.deadEnds++;
            return false;
        }
        run.stats.solutions++;
        return run.visitor.visit(labelling);
    }

    /** Branch labels in search order, restricted to {@code accepted} when given. */
    private Label[] branches(EnumSet<Label> accepted) {
        var all = semantics == Semantics.STABLE ? STABLE_BRANCHES : COMPLETE_BRANCHES;
        if (accepted == null) return all;
        return Arrays.stream(all).filter(accepted::contains).toArray(Label[]::new);
    }

    /**
     * Position in the branch order of the first unassigned argument at or after {@code from}.
     * Every argument before {@code from} is assigned whenever this is called.
     */
    private int nextUnassigned(Label[] labels, int from) {
        for (var p = from; p < order.length; p++) if (labels[order[p]] == null) return p;
        return -1;
    }

    public enum Semantics {COMPLETE, STABLE}

    /** Order in which unassigned arguments are branched on. Affects speed only, never the answer. */
    public enum BranchOrder {
        /** Declaration order. */
        INSERTION,
        /** Most attacks in and out first, ties in declaration order. */
        MOST_CONNECTED;

        int[] order(Framework f) {
            var all = IntStream.range(0, f.size());
            if (this == INSERTION) return all.toArray();
            return all.boxed()
                    .sorted(Comparator.comparingInt((Integer i) -> -(f.attackerIndices(i).length + f.targetIndices(i).length))
                            .thenComparingInt(i -> i))
                    .mapToInt(Integer::intValue)
                    .toArray();
        }
    }

    /** Receives each labelling; returning true ends the search. */
    @FunctionalInterface
    public interface Visitor {
        boolean visit(Labelling labelling);
    }

    public static final class Stats {
        long nodes, deadEnds, solutions;
        boolean stopped;

        public long nodes() {
            return nodes;
        }

        public long deadEnds() {
            return deadEnds;
        }

        public long solutions() {
            return solutions;
        }

        public boolean stopped() {
            return stopped;
        }

        @Override
        public String toString() {
            return String.format("nodes=%d deadEnds=%d solutions=%d%s", nodes, deadEnds, solutions, stopped ? " (stopped)" : "");
        }
    }

    /**
     * One branching decision: the argument, its remaining labels, where to resume the scan for
     * the next unassigned argument, and the trail size to undo to before each label is tried.
     */
    private static final class Frame {
        final int argument;
        final Label[] labels;
        final int resume;
        final int mark;
        int next;

        Frame(int argument, Label[] labels, int resume, int mark) {
            this.argument = argument;
            this.labels = labels;
            this.resume = resume;
            this.mark = mark;
        }
    }

    /** Mutable state of a single search: labels, assignment trail, propagation worklist, counters. */
    private final class Run {
        final Visitor visitor;
        final Stats stats = new Stats();
        final long deadline;
        final Label[] labels = new Label[framework.size()];
        final int[] trail = new int[framework.size()];
        final boolean[] queued = new boolean[framework.size()];
        final Deque<Integer> work = new ArrayDeque<>();
        int trailSize;

        Run(Visitor visitor) {
            this.visitor = visitor;
            this.deadline = timeoutMillis > 0 ? System.nanoTime() + timeoutMillis * 1_000_000L : 0;
        }

        void tick() throws AfException.Timeout {
            stats.nodes++;
            if (deadline != 0 && System.nanoTime() - deadline > 0)
                throw new AfException.Timeout(timeoutMillis, stats);
        }

        void assign(int i, Label label) {
            labels[i] = label;
            trail[trailSize++] = i;
        }

        void undo(int mark) {
            while (trailSize > mark) labels[trail[--trailSize]] = null;
        }

        void seedAll() {
            for (var i = 0; i < labels.length; i++) {
                if (!queued[i]) {
                    queued[i] = true;
                    work.add(i);
                }
            }
        }

        /** Queues {@code x} and every argument whose forced label may have changed with it. */
        void enqueue(int x) {
            if (!queued[x]) {
                queued[x] = true;
                work.add(x);
            }
            for (var t : framework.targetIndices(x)) {
                if (!queued[t]) {
                    queued[t] = true;
                    work.add(t);
                }
            }
        }

        /**
         * Assigns forced labels until nothing changes. An unassigned argument takes the label its
         * attackers force; an IN argument forces its unassigned attackers OUT.
         *
         * @return false if some assigned label contradicts what its attackers force; the
         * worklist is left empty either way
         */
        boolean propagate(boolean allowUndec) {
            while (!work.isEmpty()) {
                int x = work.poll();
                queued[x] = false;
                var current = labels[x];
                var forced = Labelling.forced(framework, labels, x);

                if (current == null) {
                    if (forced == null) continue;
                    if (forced == Label.UNDEC && !allowUndec) return abandon();
                    assign(x, forced);
                    enqueue(x);
                    continue;
                }

                if (forced != null && forced != current) return abandon();
                if (current == Label.UNDEC && !allowUndec) return abandon();
                if (current == Label.IN) {
                    for (var a : framework.attackerIndices(x)) {
                        if (labels[a] == null) {
                            assign(a, Label.OUT);
                            enqueue(a);
                        } else if (labels[a] != Label.OUT) {
                            return abandon();
                        }
                    }
                }
            }
            return true;
        }

        private boolean abandon() {
            for (var i : work) queued[i] = false;
            work.clear();
            return false;
        }
    }
}
