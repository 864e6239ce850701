package org.legalis.validation;

import org.legalis.statute.ast.LegalDocument;
import org.legalis.statute.ast.StatuteNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 校验过程中的交叉引用表和警告收集器。
 * 重复 id 时保留第一次出现的法规。
 */
public class ValidationContext {

    private final Map<String, StatuteNode> statutes;
    private final List<String> warnings;

    public ValidationContext(LegalDocument document) {
        this.statutes = new LinkedHashMap<>();
        for (StatuteNode statute : document.getStatutes()) {
            statutes.putIfAbsent(statute.getId(), statute);
        }
        this.warnings = new ArrayList<>();
    }

    public boolean statuteExists(String id) {
        return statutes.containsKey(id);
    }

    public Optional<StatuteNode> getStatute(String id) {
        return Optional.ofNullable(statutes.get(id));
    }

    void addWarning(String warning) {
        warnings.add(warning);
    }

    public List<String> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }
}
