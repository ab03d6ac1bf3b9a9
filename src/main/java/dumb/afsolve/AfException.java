package dumb.afsolve;

import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * Typed failure raised by the solver core. Each kind is fatal to the query that raised it;
 * nothing is retried since every input is structural and deterministic.
 */
public abstract class AfException extends Exception {

    protected AfException(String message) {
        super(message);
    }

    /** An attack names an argument that was never declared. */
    public static class MalformedFramework extends AfException {
        private final String source, target;

        public MalformedFramework(String source, String target, String undeclared) {
            super("Attack (" + source + "," + target + ") references undeclared argument '" + undeclared + "'");
            this.source = requireNonNull(source);
            this.target = requireNonNull(target);
        }

        public String source() {
            return source;
        }

        public String target() {
            return target;
        }
    }

    /** A query target is not part of the framework. */
    public static class UnknownArgument extends AfException {
        private final Set<String> unknown;

        public UnknownArgument(Set<String> unknown) {
            super("Argument(s) not in the framework: " + unknown);
            this.unknown = Set.copyOf(unknown);
        }

        public Set<String> unknown() {
            return unknown;
        }
    }

    /** A credulous or skeptical query was given zero or several arguments. */
    public static class Arity extends AfException {
        private final Problem problem;
        private final int given;

        public Arity(Problem problem, int given) {
            super("Problem " + problem.code() + " expects exactly one argument, got " + given);
            this.problem = problem;
            this.given = given;
        }

        public Problem problem() {
            return problem;
        }

        public int given() {
            return given;
        }
    }

    /** The configured search deadline elapsed before an answer was reached. */
    public static class Timeout extends AfException {
        private final long budgetMillis;

        public Timeout(long budgetMillis, LabellingSearch.Stats stats) {
            super("Search exceeded " + budgetMillis + " ms (" + stats + ")");
            this.budgetMillis = budgetMillis;
        }

        public long budgetMillis() {
            return budgetMillis;
        }
    }
}
