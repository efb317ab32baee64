package org.janelia.vizbridge.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.stream.IntStream;

import com.google.common.base.Preconditions;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;
import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * Ordered attribute arrays of the points or the cells of a poly data together with
 * the index of the array that is active for each {@link AttributeRole}.
 */
public class DataSetAttributes {

    private static final DataSetAttributes EMPTY = new DataSetAttributes(Collections.emptyList(), new EnumMap<>(AttributeRole.class));

    private final List<DataArray> arrays;
    private final Map<AttributeRole, Integer> activeRoles;

    private DataSetAttributes(List<DataArray> arrays, Map<AttributeRole, Integer> activeRoles) {
        this.arrays = Collections.unmodifiableList(new ArrayList<>(arrays));
        Map<AttributeRole, Integer> roles = new EnumMap<>(AttributeRole.class);
        roles.putAll(activeRoles);
        this.activeRoles = Collections.unmodifiableMap(roles);
    }

    public static DataSetAttributes empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<DataArray> getArrays() {
        return arrays;
    }

    public int getNumberOfArrays() {
        return arrays.size();
    }

    public boolean isEmpty() {
        return arrays.isEmpty();
    }

    public DataArray getArray(int index) {
        return arrays.get(index);
    }

    public OptionalInt getActiveIndex(AttributeRole role) {
        Integer index = activeRoles.get(role);
        return index == null ? OptionalInt.empty() : OptionalInt.of(index);
    }

    public Map<AttributeRole, Integer> getActiveRoles() {
        return activeRoles;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;

        if (o == null || getClass() != o.getClass()) return false;

        DataSetAttributes that = (DataSetAttributes) o;

        return new EqualsBuilder()
                .append(arrays, that.arrays)
                .append(activeRoles, that.activeRoles)
                .isEquals();
    }

    @Override
    public int hashCode() {
        return new HashCodeBuilder(17, 37)
                .append(arrays)
                .append(activeRoles)
                .toHashCode();
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("arrays", arrays)
                .append("activeRoles", activeRoles)
                .toString();
    }

    public static class Builder {
        private final List<DataArray> arrays = new ArrayList<>();
        private final Map<AttributeRole, Integer> activeIndexes = new EnumMap<>(AttributeRole.class);
        private final Map<AttributeRole, String> activeNames = new EnumMap<>(AttributeRole.class);

        private Builder() {
        }

        public Builder addArray(DataArray array) {
            arrays.add(Preconditions.checkNotNull(array));
            return this;
        }

        public Builder setActive(AttributeRole role, int arrayIndex) {
            activeIndexes.put(role, arrayIndex);
            activeNames.remove(role);
            return this;
        }

        /**
         * Designate the active array of a role by name. The name is resolved against
         * the arrays when the attributes are built: when several arrays share the name the last one is
         * designated, and a name that matches no array leaves the role unset.
         */
        public Builder setActive(AttributeRole role, String arrayName) {
            if (StringUtils.isNotEmpty(arrayName)) {
                activeNames.put(role, arrayName);
                activeIndexes.remove(role);
            }
            return this;
        }

        public DataSetAttributes build() {
            if (arrays.isEmpty()) {
                return EMPTY;
            }
            Map<AttributeRole, Integer> roles = new EnumMap<>(AttributeRole.class);
            activeIndexes.forEach((role, index) -> {
                Preconditions.checkElementIndex(index, arrays.size(), "active " + role.getKey() + " index");
                roles.put(role, index);
            });
            activeNames.forEach((role, name) -> IntStream.range(0, arrays.size())
                    .filter(i -> Objects.equals(arrays.get(i).getName(), name))
                    .reduce((first, last) -> last)
                    .ifPresent(i -> roles.put(role, i)));
            return new DataSetAttributes(arrays, roles);
        }
    }
}
