package io.github.cobfuscator.cfg;

import io.github.cobfuscator.ast.Expr;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.IntUnaryOperator;

/**
 * How control leaves a basic block. Targets are block ids.
 */
public abstract class Terminator {

    public abstract List<Integer> successors();

    /** Copy with every target passed through {@code mapping}. */
    public abstract Terminator remap(IntUnaryOperator mapping);

    public static final class Fallthrough extends Terminator {
        public final int target;

        public Fallthrough(int target) {
            this.target = target;
        }

        @Override
        public List<Integer> successors() {
            return List.of(target);
        }

        @Override
        public Terminator remap(IntUnaryOperator mapping) {
            return new Fallthrough(mapping.applyAsInt(target));
        }

        @Override
        public String toString() {
            return "goto " + target;
        }
    }

    public static final class Branch extends Terminator {
        public final Expr condition;
        public final int whenTrue;
        public final int whenFalse;

        public Branch(Expr condition, int whenTrue, int whenFalse) {
            this.condition = condition;
            this.whenTrue = whenTrue;
            this.whenFalse = whenFalse;
        }

        @Override
        public List<Integer> successors() {
            return List.of(whenTrue, whenFalse);
        }

        @Override
        public Terminator remap(IntUnaryOperator mapping) {
            return new Branch(condition, mapping.applyAsInt(whenTrue), mapping.applyAsInt(whenFalse));
        }

        @Override
        public String toString() {
            return "branch " + whenTrue + " / " + whenFalse;
        }
    }

    /** Return from the function; {@code value} is null for a bare {@code return;}. */
    public static final class Return extends Terminator {
        public final Expr value;
        public final int exit;

        public Return(Expr value, int exit) {
            this.value = value;
            this.exit = exit;
        }

        @Override
        public List<Integer> successors() {
            return List.of(exit);
        }

        @Override
        public Terminator remap(IntUnaryOperator mapping) {
            return new Return(value, mapping.applyAsInt(exit));
        }

        @Override
        public String toString() {
            return "return -> " + exit;
        }
    }

    public static final class SwitchCase {
        public final Expr label;
        public final int target;

        public SwitchCase(Expr label, int target) {
            this.label = label;
            this.target = target;
        }
    }

    /** Multi-way dispatch on {@code value}; cases keep source order. */
    public static final class SwitchDispatch extends Terminator {
        public final Expr value;
        public final List<SwitchCase> cases;
        public final int defaultTarget;

        public SwitchDispatch(Expr value, List<SwitchCase> cases, int defaultTarget) {
            this.value = value;
            this.cases = Collections.unmodifiableList(cases);
            this.defaultTarget = defaultTarget;
        }

        @Override
        public List<Integer> successors() {
            List<Integer> result = new ArrayList<>(cases.size() + 1);
            for (SwitchCase c : cases) {
                result.add(c.target);
            }
            result.add(defaultTarget);
            return result;
        }

        @Override
        public Terminator remap(IntUnaryOperator mapping) {
            List<SwitchCase> mapped = new ArrayList<>(cases.size());
            for (SwitchCase c : cases) {
                mapped.add(new SwitchCase(c.label, mapping.applyAsInt(c.target)));
            }
            return new SwitchDispatch(value, mapped, mapping.applyAsInt(defaultTarget));
        }

        @Override
        public String toString() {
            return "switch " + successors();
        }
    }

    /** Carried only by the exit block. */
    public static final class Exit extends Terminator {
        public static final Exit INSTANCE = new Exit();

        private Exit() {
        }

        @Override
        public List<Integer> successors() {
            return List.of();
        }

        @Override
        public Terminator remap(IntUnaryOperator mapping) {
            return this;
        }

        @Override
        public String toString() {
            return "exit";
        }
    }
}
