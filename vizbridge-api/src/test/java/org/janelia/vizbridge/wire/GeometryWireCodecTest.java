package org.janelia.vizbridge.wire;

import java.nio.FloatBuffer;
import java.nio.ShortBuffer;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.janelia.vizbridge.geometry.ValueOutOfRangeException;
import org.janelia.vizbridge.model.AttributeRole;
import org.janelia.vizbridge.model.CellType;
import org.janelia.vizbridge.model.ComponentType;
import org.janelia.vizbridge.model.DataArray;
import org.janelia.vizbridge.model.DataSetAttributes;
import org.janelia.vizbridge.model.PolyData;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class GeometryWireCodecTest {

    private final GeometryWireCodec codec = new GeometryWireCodec();
    private final WireJson wireJson = new WireJson();

    @Test
    public void encodedDocumentLayout() {
        ObjectNode document = codec.encodeGeometry(triangle());

        assertEquals("vtkPolyData", document.get("vtkClass").asText());
        assertEquals("Float32Array", document.at("/points/dataType").asText());
        assertEquals(9, document.at("/points/size").asInt());
        assertTrue(document.at("/points/values").isBinary());
        assertEquals("Uint32Array", document.at("/polys/dataType").asText());
        assertEquals(4, document.at("/polys/size").asInt());
        assertFalse(document.has("lines"));
        assertFalse(document.has("cellData"));
        assertEquals(1, document.at("/pointData/activeScalars").asInt());
        assertEquals("elevation", document.at("/pointData/arrays/1/data/name").asText());
    }

    @Test
    public void documentSurvivesJsonText() throws Exception {
        PolyData triangle = triangle();
        String text = wireJson.getMapper().writeValueAsString(codec.encodeGeometry(triangle));

        PolyData decoded = codec.decodeGeometry(wireJson.getMapper().readTree(text));

        assertEquals(triangle, decoded);
        assertEquals(1, decoded.getPointData().getActiveIndex(AttributeRole.SCALARS).getAsInt());
    }

    @Test(expected = CorruptPayloadException.class)
    public void notAPolyDataDocument() throws Exception {
        codec.decodeGeometry(wireJson.getMapper().readTree("{\"vtkClass\": \"vtkImageData\"}"));
    }

    @Test(expected = CorruptPayloadException.class)
    public void cellsReferencingMissingPoints() {
        ObjectNode document = codec.encodeGeometry(triangle());
        ObjectNode lines = document.putObject("lines");
        lines.put("dataType", "Uint32Array");
        lines.putArray("values").add(2).add(0).add(7);
        codec.decodeGeometry(document);
    }

    @Test(expected = ValueOutOfRangeException.class)
    public void outOfRangeConnectivity() {
        ObjectNode document = codec.encodeGeometry(triangle());
        ObjectNode lines = document.putObject("lines");
        lines.put("dataType", "BigInt64Array");
        lines.putArray("values").add(2).add(0).add(-5000000000L);
        codec.decodeGeometry(document);
    }

    private static PolyData triangle() {
        DataSetAttributes pointData = DataSetAttributes.builder()
                .addArray(new DataArray("ids", 1, ComponentType.UINT16, ShortBuffer.wrap(new short[] {1, 2, 3})))
                .addArray(new DataArray("elevation", 1, ComponentType.FLOAT32, FloatBuffer.wrap(new float[] {0.5f, 1.5f, 2.5f})))
                .setActive(AttributeRole.SCALARS, "elevation")
                .build();
        return PolyData.builder()
                .points(new float[] {0, 0, 0, 1, 0, 0, 0, 1, 1})
                .cells(CellType.POLYS, new int[] {3, 0, 1, 2})
                .pointData(pointData)
                .build();
    }
}
