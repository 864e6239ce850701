package org.legalis.statute.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import org.legalis.expressions.conditions.Condition;

import java.util.List;
import java.util.Optional;

/**
 * 编译后的法规：前提条件全部成立时产生 effect。
 * 没有前提条件的法规总是适用。
 */
@Value
@Builder
public class Statute {
    @NonNull
    String id;
    @Builder.Default
    String title = "";
    @Singular
    List<Condition> preconditions;
    @NonNull
    Effect effect;

    /**
     * 所有前提条件的合取；没有前提条件时为空。
     */
    public Optional<Condition> combinedPreconditions() {
        if (preconditions.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(Condition.allOf(preconditions));
    }
}
