package org.janelia.vizbridge.geometry;

import org.janelia.vizbridge.model.ComponentType;

/**
 * A 64-bit integer array holds values that do not fit the 32-bit type it has to be narrowed to.
 */
public class ValueOutOfRangeException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    private final String arrayName;
    private final String valueRange;
    private final ComponentType targetType;

    public ValueOutOfRangeException(String arrayName, String valueRange, ComponentType targetType) {
        super(String.format("Values of %s in %s do not fit in %s [%d, %d]",
                arrayName, valueRange, targetType, targetType.getMinIntegerValue(), targetType.getMaxIntegerValue()));
        this.arrayName = arrayName;
        this.valueRange = valueRange;
        this.targetType = targetType;
    }

    public String getArrayName() {
        return arrayName;
    }

    public String getValueRange() {
        return valueRange;
    }

    public ComponentType getTargetType() {
        return targetType;
    }
}
