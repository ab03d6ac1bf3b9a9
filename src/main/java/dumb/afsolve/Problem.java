package dumb.afsolve;

import dumb.afsolve.LabellingSearch.Semantics;

import java.util.Arrays;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * The six query classes, each a task under a semantics. The code is the name used on the
 * command line, e.g. {@code DC-ST}.
 */
public enum Problem {
    VE_CO(Task.VERIFY, Semantics.COMPLETE),
    DC_CO(Task.CREDULOUS, Semantics.COMPLETE),
    DS_CO(Task.SKEPTICAL, Semantics.COMPLETE),
    VE_ST(Task.VERIFY, Semantics.STABLE),
    DC_ST(Task.CREDULOUS, Semantics.STABLE),
    DS_ST(Task.SKEPTICAL, Semantics.STABLE);

    private final Task task;
    private final Semantics semantics;

    Problem(Task task, Semantics semantics) {
        this.task = task;
        this.semantics = semantics;
    }

    public static Optional<Problem> fromCode(String code) {
        return Arrays.stream(values()).filter(p -> p.code().equals(code)).findFirst();
    }

    public static String codes() {
        return Arrays.stream(values()).map(Problem::code).collect(Collectors.joining(", "));
    }

    public String code() {
        return name().replace('_', '-');
    }

    public Task task() {
        return task;
    }

    public Semantics semantics() {
        return semantics;
    }

    /** Whether the target must be exactly one argument. */
    public boolean singleArgument() {
        return task != Task.VERIFY;
    }

    public enum Task {
        /** Is the target set an extension? */
        VERIFY,
        /** Is the target argument in some extension? */
        CREDULOUS,
        /** Is the target argument in every extension? */
        SKEPTICAL
    }
}
