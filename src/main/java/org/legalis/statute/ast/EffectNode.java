package org.legalis.statute.ast;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * THEN 子句，例如 GRANT "voting rights"。
 */
@Value
@Builder
public class EffectNode {
    @NonNull
    String effectType;
    @Builder.Default
    String description = "";
}
