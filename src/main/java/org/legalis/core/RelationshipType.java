package org.legalis.core;

/**
 * 实体之间的法律关系类型。
 */
public enum RelationshipType {
    PARENT_CHILD,
    SPOUSE,
    EMPLOYMENT,
    GUARDIAN,
    BUSINESS_OWNER,
    CONTRACTUAL
}
