package org.legalis.validation;

import lombok.Getter;

import java.util.List;
import java.util.Objects;

/**
 * 一次文档校验的完整结果。
 * 严格模式下，存在警告也视为未通过。
 */
@Getter
public final class ValidationReport {

    private final List<ValidationError> errors;
    private final List<String> warnings;
    private final boolean strict;

    ValidationReport(List<ValidationError> errors, List<String> warnings, boolean strict) {
        this.errors = List.copyOf(Objects.requireNonNull(errors));
        this.warnings = List.copyOf(Objects.requireNonNull(warnings));
        this.strict = strict;
    }

    public boolean isValid() {
        return errors.isEmpty() && (!strict || warnings.isEmpty());
    }

    public boolean hasErrors(ValidationError.Kind kind) {
        return errors.stream().anyMatch(e -> e.getKind() == kind);
    }

    public List<ValidationError> errorsOf(ValidationError.Kind kind) {
        return errors.stream().filter(e -> e.getKind() == kind).toList();
    }

    /**
     * @throws DocumentValidationException 如果报告未通过。
     */
    public void throwIfInvalid() {
        if (!isValid()) {
            throw new DocumentValidationException(errors, strict ? warnings : List.of());
        }
    }

    @Override
    public String toString() {
        return "ValidationReport{valid=" + isValid() + ", errors=" + errors.size()
                + ", warnings=" + warnings.size() + (strict ? ", strict" : "") + "}";
    }
}
