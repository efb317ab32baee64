package org.janelia.vizbridge.model;

import java.nio.Buffer;

import com.google.common.base.Preconditions;
import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;
import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * Named point or cell attribute array. Only types that fit in 32 bits (plus float64) are allowed,
 * 64-bit integer sources must be narrowed before they get here.
 */
public class DataArray {

    private final String name;
    private final int numberOfComponents;
    private final ComponentType dataType;
    private final Buffer values;

    public DataArray(String name, int numberOfComponents, ComponentType dataType, Buffer values) {
        Preconditions.checkArgument(numberOfComponents > 0, "Invalid number of components %s for %s", numberOfComponents, name);
        Preconditions.checkArgument(!dataType.is64BitInteger(),
                "Array %s of type %s must be narrowed to 32 bits", name, dataType);
        Preconditions.checkArgument(TypedBuffers.matches(values, dataType),
                "A %s buffer cannot hold %s values", values.getClass().getSimpleName(), dataType);
        Preconditions.checkArgument(values.limit() % numberOfComponents == 0,
                "Array %s has %s values which is not a multiple of %s components", name, values.limit(), numberOfComponents);
        this.name = name;
        this.numberOfComponents = numberOfComponents;
        this.dataType = dataType;
        this.values = TypedBuffers.readOnly(values);
    }

    public String getName() {
        return name;
    }

    public int getNumberOfComponents() {
        return numberOfComponents;
    }

    public ComponentType getDataType() {
        return dataType;
    }

    /**
     * @return the total number of values (tuples times components)
     */
    public int getSize() {
        return values.limit();
    }

    public int getNumberOfTuples() {
        return values.limit() / numberOfComponents;
    }

    public Buffer getValues() {
        return TypedBuffers.readOnly(values);
    }

    public double getValue(int index) {
        return TypedBuffers.getDouble(values, dataType, index);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;

        if (o == null || getClass() != o.getClass()) return false;

        DataArray dataArray = (DataArray) o;

        return new EqualsBuilder()
                .append(numberOfComponents, dataArray.numberOfComponents)
                .append(name, dataArray.name)
                .append(dataType, dataArray.dataType)
                .isEquals() && TypedBuffers.contentEquals(values, dataArray.values);
    }

    @Override
    public int hashCode() {
        return new HashCodeBuilder(17, 37)
                .append(name)
                .append(numberOfComponents)
                .append(dataType)
                .append(TypedBuffers.contentHashCode(values))
                .toHashCode();
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("name", name)
                .append("numberOfComponents", numberOfComponents)
                .append("dataType", dataType)
                .append("size", getSize())
                .toString();
    }
}
