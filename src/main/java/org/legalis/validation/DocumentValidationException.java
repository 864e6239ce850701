package org.legalis.validation;

import lombok.Getter;

import java.util.List;

/**
 * 文档未通过语义校验。携带全部错误。
 */
@Getter
public class DocumentValidationException extends RuntimeException {

    private final transient List<ValidationError> errors;

    public DocumentValidationException(List<ValidationError> errors, List<String> warnings) {
        super(buildMessage(errors, warnings));
        this.errors = List.copyOf(errors);
    }

    private static String buildMessage(List<ValidationError> errors, List<String> warnings) {
        StringBuilder sb = new StringBuilder("Document validation failed with ")
                .append(errors.size()).append(" error(s)");
        if (!warnings.isEmpty()) {
            sb.append(" and ").append(warnings.size()).append(" warning(s)");
        }
        for (ValidationError error : errors) {
            sb.append("\n  - ").append(error.getMessage());
        }
        for (String warning : warnings) {
            sb.append("\n  - warning: ").append(warning);
        }
        return sb.toString();
    }
}
