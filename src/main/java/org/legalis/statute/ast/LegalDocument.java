package org.legalis.statute.ast;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * 一个 DSL 文档：导入声明和按出现顺序排列的法规。
 */
@Value
@Builder
public class LegalDocument {
    @Singular("importNode")
    List<ImportNode> imports;
    @Singular
    List<StatuteNode> statutes;

    public static LegalDocument of(List<StatuteNode> statutes) {
        return LegalDocument.builder().statutes(statutes).build();
    }
}
