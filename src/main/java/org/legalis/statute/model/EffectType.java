package org.legalis.statute.model;

/**
 * 法规效果的类别。
 */
public enum EffectType {
    GRANT,
    REVOKE,
    OBLIGATION,
    PROHIBITION,
    MONETARY_TRANSFER,
    STATUS_CHANGE,
    CUSTOM;

    /**
     * 授予与撤销、义务与禁止互相冲突。
     */
    public boolean conflictsWith(EffectType other) {
        return switch (this) {
            case GRANT -> other == REVOKE;
            case REVOKE -> other == GRANT;
            case OBLIGATION -> other == PROHIBITION;
            case PROHIBITION -> other == OBLIGATION;
            default -> false;
        };
    }
}
