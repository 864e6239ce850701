package org.legalis.verification;

import lombok.Getter;

import java.util.List;
import java.util.Objects;

/**
 * 语料一致性检查发现的一个问题。
 */
@Getter
public final class ConsistencyIssue {

    public enum Kind {
        DEAD_STATUTE(true),
        CONTRADICTORY_PRECONDITIONS(true),
        EFFECT_CONFLICT(true),
        REDUNDANT_PRECONDITION(false);

        private final boolean fatal;

        Kind(boolean fatal) {
            this.fatal = fatal;
        }

        /**
         * 冗余条件不影响法规的含义，只作提示。
         */
        public boolean isFatal() {
            return fatal;
        }
    }

    private final Kind kind;
    private final List<String> statuteIds;
    private final String message;

    ConsistencyIssue(Kind kind, List<String> statuteIds, String message) {
        this.kind = Objects.requireNonNull(kind);
        this.statuteIds = List.copyOf(statuteIds);
        this.message = Objects.requireNonNull(message);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ConsistencyIssue)) {
            return false;
        }
        ConsistencyIssue that = (ConsistencyIssue) o;
        return kind == that.kind && statuteIds.equals(that.statuteIds) && message.equals(that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, statuteIds, message);
    }

    @Override
    public String toString() {
        return kind + " " + statuteIds + ": " + message;
    }
}
