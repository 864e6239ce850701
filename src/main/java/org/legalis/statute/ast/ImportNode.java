package org.legalis.statute.ast;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

@Value
@Builder
public class ImportNode {
    @NonNull
    String path;
    String alias;
}
