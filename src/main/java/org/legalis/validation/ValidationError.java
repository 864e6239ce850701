package org.legalis.validation;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * 语义校验发现的结构错误。
 * 每个错误都带有出错法规的 id，getMessage() 给出完整的可读描述
 * （循环依赖包含完整路径，数值区间包含上下界）。
 */
@Getter
@EqualsAndHashCode
public abstract class ValidationError {

    public enum Kind {
        INVALID_DATE_RANGE,
        CIRCULAR_DEPENDENCY,
        UNDEFINED_REFERENCE,
        INVALID_NUMERIC_RANGE,
        MISSING_REQUIRED_FIELD,
        DUPLICATE_STATUTE_ID,
        INVALID_AMENDMENT,
        SELF_REFERENCE,
        DEAD_CODE,
        UNREACHABLE_EFFECT
    }

    private final String statuteId;

    private ValidationError(String statuteId) {
        this.statuteId = Objects.requireNonNull(statuteId, "statuteId cannot be null.");
    }

    public abstract Kind getKind();

    public abstract String getMessage();

    @Override
    public String toString() {
        return getKind() + ": " + getMessage();
    }

    // === 工厂方法 ===

    public static InvalidDateRange invalidDateRange(String statuteId, LocalDate effective, LocalDate expiry) {
        return new InvalidDateRange(statuteId, effective, expiry);
    }

    public static CircularDependency circularDependency(String statuteId, List<String> cycle) {
        return new CircularDependency(statuteId, cycle);
    }

    public static UndefinedReference undefinedReference(String statuteId, String referenced) {
        return new UndefinedReference(statuteId, referenced);
    }

    public static InvalidNumericRange invalidNumericRange(String statuteId, long min, long max) {
        return new InvalidNumericRange(statuteId, min, max);
    }

    public static MissingRequiredField missingRequiredField(String statuteId, String field) {
        return new MissingRequiredField(statuteId, field);
    }

    public static DuplicateStatuteId duplicateStatuteId(String statuteId) {
        return new DuplicateStatuteId(statuteId);
    }

    public static InvalidAmendment invalidAmendment(String statuteId, String target) {
        return new InvalidAmendment(statuteId, target);
    }

    public static SelfReference selfReference(String statuteId) {
        return new SelfReference(statuteId);
    }

    public static DeadCode deadCode(String statuteId, String reason) {
        return new DeadCode(statuteId, reason);
    }

    public static UnreachableEffect unreachableEffect(String statuteId, String description) {
        return new UnreachableEffect(statuteId, description);
    }

    // === 变体 ===

    @Getter
    @EqualsAndHashCode(callSuper = true)
    public static final class InvalidDateRange extends ValidationError {
        private final LocalDate effective;
        private final LocalDate expiry;

        private InvalidDateRange(String statuteId, LocalDate effective, LocalDate expiry) {
            super(statuteId);
            this.effective = Objects.requireNonNull(effective);
            this.expiry = Objects.requireNonNull(expiry);
        }

        @Override
        public Kind getKind() {
            return Kind.INVALID_DATE_RANGE;
        }

        @Override
        public String getMessage() {
            return String.format("Invalid date range in statute '%s': effective date %s is after expiry date %s",
                    getStatuteId(), effective, expiry);
        }
    }

    @Getter
    @EqualsAndHashCode(callSuper = true)
    public static final class CircularDependency extends ValidationError {
        /** 完整路径，首尾是同一个 id */
        private final List<String> cycle;

        private CircularDependency(String statuteId, List<String> cycle) {
            super(statuteId);
            this.cycle = List.copyOf(cycle);
        }

        public String getCyclePath() {
            return String.join(" -> ", cycle);
        }

        @Override
        public Kind getKind() {
            return Kind.CIRCULAR_DEPENDENCY;
        }

        @Override
        public String getMessage() {
            return String.format("Circular dependency detected in statute '%s': %s", getStatuteId(), getCyclePath());
        }
    }

    @Getter
    @EqualsAndHashCode(callSuper = true)
    public static final class UndefinedReference extends ValidationError {
        private final String referenced;

        private UndefinedReference(String statuteId, String referenced) {
            super(statuteId);
            this.referenced = Objects.requireNonNull(referenced);
        }

        @Override
        public Kind getKind() {
            return Kind.UNDEFINED_REFERENCE;
        }

        @Override
        public String getMessage() {
            return String.format("Undefined statute reference in '%s': statute '%s' does not exist",
                    getStatuteId(), referenced);
        }
    }

    @Getter
    @EqualsAndHashCode(callSuper = true)
    public static final class InvalidNumericRange extends ValidationError {
        private final long min;
        private final long max;

        private InvalidNumericRange(String statuteId, long min, long max) {
            super(statuteId);
            this.min = min;
            this.max = max;
        }

        @Override
        public Kind getKind() {
            return Kind.INVALID_NUMERIC_RANGE;
        }

        @Override
        public String getMessage() {
            return String.format("Invalid numeric range in statute '%s': min (%d) >= max (%d)", getStatuteId(), min, max);
        }
    }

    @Getter
    @EqualsAndHashCode(callSuper = true)
    public static final class MissingRequiredField extends ValidationError {
        private final String field;

        private MissingRequiredField(String statuteId, String field) {
            super(statuteId);
            this.field = Objects.requireNonNull(field);
        }

        @Override
        public Kind getKind() {
            return Kind.MISSING_REQUIRED_FIELD;
        }

        @Override
        public String getMessage() {
            return String.format("Missing required field '%s' in statute '%s'", field, getStatuteId());
        }
    }

    @EqualsAndHashCode(callSuper = true)
    public static final class DuplicateStatuteId extends ValidationError {

        private DuplicateStatuteId(String statuteId) {
            super(statuteId);
        }

        @Override
        public Kind getKind() {
            return Kind.DUPLICATE_STATUTE_ID;
        }

        @Override
        public String getMessage() {
            return String.format("Duplicate statute ID '%s' found at multiple locations", getStatuteId());
        }
    }

    @Getter
    @EqualsAndHashCode(callSuper = true)
    public static final class InvalidAmendment extends ValidationError {
        private final String target;

        private InvalidAmendment(String statuteId, String target) {
            super(statuteId);
            this.target = Objects.requireNonNull(target);
        }

        @Override
        public Kind getKind() {
            return Kind.INVALID_AMENDMENT;
        }

        @Override
        public String getMessage() {
            return String.format("Invalid amendment in statute '%s': target statute '%s' does not exist",
                    getStatuteId(), target);
        }
    }

    @EqualsAndHashCode(callSuper = true)
    public static final class SelfReference extends ValidationError {

        private SelfReference(String statuteId) {
            super(statuteId);
        }

        @Override
        public Kind getKind() {
            return Kind.SELF_REFERENCE;
        }

        @Override
        public String getMessage() {
            return String.format("Self-reference in statute '%s': statute cannot reference itself", getStatuteId());
        }
    }

    /**
     * DeadCodeDetector 的发现：永远不成立的条件，或没有被任何法规引用的法规。
     */
    @Getter
    @EqualsAndHashCode(callSuper = true)
    public static final class DeadCode extends ValidationError {
        private final String reason;

        private DeadCode(String statuteId, String reason) {
            super(statuteId);
            this.reason = Objects.requireNonNull(reason);
        }

        @Override
        public Kind getKind() {
            return Kind.DEAD_CODE;
        }

        @Override
        public String getMessage() {
            return String.format("Dead code detected in statute '%s': %s", getStatuteId(), reason);
        }
    }

    @Getter
    @EqualsAndHashCode(callSuper = true)
    public static final class UnreachableEffect extends ValidationError {
        private final String description;

        private UnreachableEffect(String statuteId, String description) {
            super(statuteId);
            this.description = Objects.requireNonNull(description);
        }

        @Override
        public Kind getKind() {
            return Kind.UNREACHABLE_EFFECT;
        }

        @Override
        public String getMessage() {
            return String.format("Unreachable effect in statute '%s': %s", getStatuteId(), description);
        }
    }
}
