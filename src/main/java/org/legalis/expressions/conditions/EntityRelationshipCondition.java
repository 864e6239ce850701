package org.legalis.expressions.conditions;

import lombok.Getter;
import org.legalis.core.RelationshipType;

import java.util.Objects;
import java.util.Optional;

/**
 * 主体与某个（或任意）实体之间存在某种关系。
 */
public final class EntityRelationshipCondition extends Condition {

    @Getter
    private final RelationshipType relationshipType;
    private final String targetEntityId;

    private EntityRelationshipCondition(RelationshipType relationshipType, String targetEntityId) {
        super(ConditionKind.ENTITY_RELATIONSHIP);
        this.relationshipType = Objects.requireNonNull(relationshipType, "Relationship type cannot be null.");
        this.targetEntityId = targetEntityId;
    }

    public static EntityRelationshipCondition of(RelationshipType relationshipType, String targetEntityId) {
        return new EntityRelationshipCondition(relationshipType, targetEntityId);
    }

    public static EntityRelationshipCondition any(RelationshipType relationshipType) {
        return new EntityRelationshipCondition(relationshipType, null);
    }

    public Optional<String> getTargetEntityId() {
        return Optional.ofNullable(targetEntityId);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EntityRelationshipCondition)) {
            return false;
        }
        EntityRelationshipCondition that = (EntityRelationshipCondition) o;
        return relationshipType == that.relationshipType && Objects.equals(targetEntityId, that.targetEntityId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ConditionKind.ENTITY_RELATIONSHIP, relationshipType, targetEntityId);
    }

    @Override
    public String toString() {
        return targetEntityId == null ? "has " + relationshipType : relationshipType + " with " + targetEntityId;
    }
}
