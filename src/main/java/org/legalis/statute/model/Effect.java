package org.legalis.statute.model;

import lombok.NonNull;
import lombok.Value;

/**
 * 法规适用时产生的效果，例如 GRANT "voting rights"。
 */
@Value(staticConstructor = "of")
public class Effect {
    @NonNull
    EffectType type;
    @NonNull
    String description;

    @Override
    public String toString() {
        return type + " \"" + description + "\"";
    }
}
