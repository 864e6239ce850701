package org.legalis.symbolic;

import lombok.Getter;

import java.util.Objects;
import java.util.Optional;

/**
 * 可满足性查询的三种结果。UNKNOWN 与另外两种始终可区分。
 */
public abstract class VerificationResult {

    public enum Outcome {
        SATISFIABLE,
        UNSATISFIABLE,
        UNKNOWN
    }

    private VerificationResult() {
    }

    public abstract Outcome getOutcome();

    public boolean isSatisfiable() {
        return getOutcome() == Outcome.SATISFIABLE;
    }

    public boolean isUnsatisfiable() {
        return getOutcome() == Outcome.UNSATISFIABLE;
    }

    public boolean isUnknown() {
        return getOutcome() == Outcome.UNKNOWN;
    }

    /**
     * 仅在 SATISFIABLE 时有模型。
     */
    public Optional<SatModel> getModel() {
        return Optional.empty();
    }

    public static Satisfiable satisfiable(SatModel model) {
        return new Satisfiable(model);
    }

    public static Unsatisfiable unsatisfiable() {
        return Unsatisfiable.INSTANCE;
    }

    public static Unknown unknown(String reason) {
        return new Unknown(reason);
    }

    public static final class Satisfiable extends VerificationResult {

        private final SatModel model;

        private Satisfiable(SatModel model) {
            this.model = model;
        }

        @Override
        public Outcome getOutcome() {
            return Outcome.SATISFIABLE;
        }

        @Override
        public Optional<SatModel> getModel() {
            return Optional.ofNullable(model);
        }

        @Override
        public String toString() {
            return "Satisfiable" + (model == null ? "" : model.toString());
        }
    }

    public static final class Unsatisfiable extends VerificationResult {

        private static final Unsatisfiable INSTANCE = new Unsatisfiable();

        private Unsatisfiable() {
        }

        @Override
        public Outcome getOutcome() {
            return Outcome.UNSATISFIABLE;
        }

        @Override
        public String toString() {
            return "Unsatisfiable";
        }
    }

    @Getter
    public static final class Unknown extends VerificationResult {

        private final String reason;

        private Unknown(String reason) {
            this.reason = Objects.requireNonNullElse(reason, "unknown");
        }

        @Override
        public Outcome getOutcome() {
            return Outcome.UNKNOWN;
        }

        @Override
        public String toString() {
            return "Unknown(" + reason + ")";
        }
    }
}
