package org.legalis.statute.ast;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

/**
 * 解析后的一条法规，SemanticValidator 的输入。
 * requires 是依赖的法规 id，supersedes 是被本法规取代的法规 id。
 */
@Value
@Builder
public class StatuteNode {
    @NonNull
    String id;
    @Builder.Default
    String title = "";
    @Singular
    List<ConditionNode> conditions;
    @Singular
    List<EffectNode> effects;
    @Singular("require")
    List<String> requires;
    @Singular("supersede")
    List<String> supersedes;
    @Singular
    List<AmendmentNode> amendments;
    @Singular
    List<ExceptionNode> exceptions;
    LocalDate effectiveDate;
    LocalDate expiryDate;
}
