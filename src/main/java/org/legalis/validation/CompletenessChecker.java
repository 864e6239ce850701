package org.legalis.validation;

import org.legalis.statute.ast.LegalDocument;
import org.legalis.statute.ast.StatuteNode;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * 检查法规是否填写了必填字段。id 和 title 始终必填，conditions / effects 可以通过 requireField 追加。
 */
public class CompletenessChecker {

    public static final String ID = "id";
    public static final String TITLE = "title";
    public static final String CONDITIONS = "conditions";
    public static final String EFFECTS = "effects";

    private static final Set<String> KNOWN_FIELDS = Set.of(ID, TITLE, CONDITIONS, EFFECTS);

    private final Set<String> requiredFields = new LinkedHashSet<>(List.of(ID, TITLE));

    /**
     * @throws IllegalArgumentException 如果字段名未知。
     */
    public CompletenessChecker requireField(String field) {
        Objects.requireNonNull(field, "Field cannot be null.");
        if (!KNOWN_FIELDS.contains(field)) {
            throw new IllegalArgumentException("Unknown statute field: " + field + ", expected one of " + KNOWN_FIELDS);
        }
        requiredFields.add(field);
        return this;
    }

    public Set<String> getRequiredFields() {
        return Set.copyOf(requiredFields);
    }

    public List<ValidationError> checkStatute(StatuteNode statute) {
        List<ValidationError> errors = new ArrayList<>();
        String id = statute.getId();
        if (id.isEmpty()) {
            errors.add(ValidationError.missingRequiredField(id, ID));
        }
        if (statute.getTitle() == null || statute.getTitle().isEmpty()) {
            errors.add(ValidationError.missingRequiredField(id, TITLE));
        }
        if (requiredFields.contains(CONDITIONS) && statute.getConditions().isEmpty()) {
            errors.add(ValidationError.missingRequiredField(id, CONDITIONS));
        }
        if (requiredFields.contains(EFFECTS) && statute.getEffects().isEmpty()) {
            errors.add(ValidationError.missingRequiredField(id, EFFECTS));
        }
        return errors;
    }

    public List<ValidationError> checkDocument(LegalDocument document) {
        List<ValidationError> errors = new ArrayList<>();
        for (StatuteNode statute : document.getStatutes()) {
            errors.addAll(checkStatute(statute));
        }
        return errors;
    }
}
