package org.janelia.vizbridge.model;

import java.nio.FloatBuffer;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;

public class DataSetAttributesTest {

    @Test
    public void activeNameDesignatesTheLastArrayWithThatName() {
        DataSetAttributes attributes = DataSetAttributes.builder()
                .addArray(scalars("v"))
                .addArray(scalars("w"))
                .addArray(scalars("v"))
                .setActive(AttributeRole.SCALARS, "v")
                .setActive(AttributeRole.TCOORDS, "w")
                .setActive(AttributeRole.NORMALS, "missing")
                .build();

        assertEquals(2, attributes.getActiveIndex(AttributeRole.SCALARS).getAsInt());
        assertEquals(1, attributes.getActiveIndex(AttributeRole.TCOORDS).getAsInt());
        assertFalse(attributes.getActiveIndex(AttributeRole.NORMALS).isPresent());
    }

    @Test
    public void activeIndexIsKeptAsGiven() {
        DataSetAttributes attributes = DataSetAttributes.builder()
                .addArray(scalars("v"))
                .addArray(scalars("v"))
                .setActive(AttributeRole.SCALARS, 0)
                .build();

        assertEquals(0, attributes.getActiveIndex(AttributeRole.SCALARS).getAsInt());
    }

    @Test
    public void noArrays() {
        assertSame(DataSetAttributes.empty(), DataSetAttributes.builder().build());
    }

    private static DataArray scalars(String name) {
        return new DataArray(name, 1, ComponentType.FLOAT32, FloatBuffer.wrap(new float[] {1, 2}));
    }
}
