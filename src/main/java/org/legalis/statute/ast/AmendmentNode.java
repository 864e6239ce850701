package org.legalis.statute.ast;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * AMENDMENT 子句：修订 targetId 指向的法规。
 * date 为 yyyy-MM-dd 格式的字符串，可省略。
 */
@Value
@Builder
public class AmendmentNode {
    @NonNull
    String targetId;
    Integer version;
    String date;
    @Builder.Default
    String description = "";
}
