package org.legalis.statute.ast;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * EXCEPTION 子句：满足这些条件时法规不适用。
 */
@Value
@Builder
public class ExceptionNode {
    @Singular
    List<ConditionNode> conditions;
    @Builder.Default
    String description = "";
}
