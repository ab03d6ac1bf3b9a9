package dumb.afsolve;

import dumb.afsolve.LabellingSearch.BranchOrder;
import dumb.afsolve.LabellingSearch.Semantics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * Answers a {@link Problem} over a {@link Framework}. Verification goes straight to
 * {@link Extensions}; acceptance runs a {@link LabellingSearch} focused on the queried
 * argument, which stops at the first witness (credulous: labelled IN) or counterexample
 * (skeptical: labelled OUT or UNDEC).
 * <p>
 * Skeptical acceptance under stable semantics is vacuously true when the framework has no
 * stable extension.
 */
public class Solver {

    private static final Logger logger = LoggerFactory.getLogger(Solver.class);

    private final BranchOrder branchOrder;
    private final long timeoutMillis;
    private final boolean logStats;

    public Solver() {
        this(BranchOrder.INSERTION, 0, false);
    }

    public Solver(BranchOrder branchOrder, long timeoutMillis, boolean logStats) {
        this.branchOrder = requireNonNull(branchOrder);
        if (timeoutMillis < 0) throw new IllegalArgumentException("timeoutMillis must be >= 0: " + timeoutMillis);
        this.timeoutMillis = timeoutMillis;
        this.logStats = logStats;
    }

    public static Solver of(AfSolve.Configuration config) {
        return new Solver(config.branchOrder(), config.timeoutMillis(), config.logStats());
    }

    /**
     * @param target the candidate extension for VE-*, exactly one argument otherwise
     * @throws AfException.Arity           a DC-* or DS-* target that is not a single argument
     * @throws AfException.UnknownArgument a target argument outside the framework
     * @throws AfException.Timeout         the configured search budget ran out
     */
    public boolean evaluate(Framework framework, Problem problem, Collection<String> target) throws AfException {
        requireNonNull(framework);
        requireNonNull(problem);
        var args = new LinkedHashSet<>(requireNonNull(target));

        if (problem.singleArgument() && args.size() != 1) throw new AfException.Arity(problem, args.size());
        var unknown = args.stream().filter(a -> !framework.contains(a)).collect(Collectors.toCollection(LinkedHashSet::new));
        if (!unknown.isEmpty()) throw new AfException.UnknownArgument(unknown);

        logger.debug("{} {} over {}", problem.code(), args, framework);
        return switch (problem.task()) {
            case VERIFY -> verify(framework, problem.semantics(), args);
            case CREDULOUS -> credulous(framework, problem.semantics(), args.iterator().next());
            case SKEPTICAL -> skeptical(framework, problem.semantics(), args.iterator().next());
        };
    }

    public boolean evaluate(Framework framework, Problem problem, String argument) throws AfException {
        return evaluate(framework, problem, Set.of(argument));
    }

    private boolean verify(Framework f, Semantics semantics, Set<String> candidate) {
        return switch (semantics) {
            case COMPLETE -> Extensions.isComplete(f, candidate);
            case STABLE -> Extensions.isStable(f, candidate);
        };
    }

    /** Some extension contains {@code argument}. */
    private boolean credulous(Framework f, Semantics semantics, String argument) throws AfException.Timeout {
        return search(f, semantics).findLabelled(argument, EnumSet.of(Label.IN)).isPresent();
    }

    /** No extension leaves {@code argument} out. */
    private boolean skeptical(Framework f, Semantics semantics, String argument) throws AfException.Timeout {
        return search(f, semantics).findLabelled(argument, EnumSet.of(Label.OUT, Label.UNDEC)).isEmpty();
    }

    private LabellingSearch search(Framework f, Semantics semantics) {
        return new LabellingSearch(f, semantics, branchOrder, timeoutMillis, logStats);
    }
}
