package org.legalis.expressions.conditions;

import lombok.Getter;
import org.apache.commons.lang3.Validate;
import org.legalis.core.RegionType;

import java.util.Objects;

/**
 * 主体位于某个地理区域内。
 */
@Getter
public final class GeographicCondition extends Condition {

    private final RegionType regionType;
    private final String regionId;

    private GeographicCondition(RegionType regionType, String regionId) {
        super(ConditionKind.GEOGRAPHIC);
        this.regionType = Objects.requireNonNull(regionType, "Region type cannot be null.");
        this.regionId = Validate.notBlank(regionId, "Region id cannot be blank");
    }

    public static GeographicCondition of(RegionType regionType, String regionId) {
        return new GeographicCondition(regionType, regionId);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof GeographicCondition)) {
            return false;
        }
        GeographicCondition that = (GeographicCondition) o;
        return regionType == that.regionType && regionId.equals(that.regionId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ConditionKind.GEOGRAPHIC, regionType, regionId);
    }

    @Override
    public String toString() {
        return "in " + regionType + "(" + regionId + ")";
    }
}
