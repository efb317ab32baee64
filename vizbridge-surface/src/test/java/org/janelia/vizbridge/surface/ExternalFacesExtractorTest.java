package org.janelia.vizbridge.surface;

import java.util.Arrays;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.janelia.vizbridge.capability.Capability;
import org.janelia.vizbridge.capability.CapabilityRegistry;
import org.janelia.vizbridge.config.ConfigProvider;
import org.janelia.vizbridge.geometry.GeometryNormalizer;
import org.janelia.vizbridge.model.CellType;
import org.janelia.vizbridge.model.PolyData;
import org.junit.Test;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class ExternalFacesExtractorTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final ExternalFacesExtractor extractor = new ExternalFacesExtractor();

    @Test
    public void imageDataVolume() throws Exception {
        ObjectNode surface = extractor.extractSurface(json("{'vtkClass': 'vtkImageData', 'extent': [0, 2, 0, 2, 0, 2]}"));

        assertEquals("vtkPolyData", surface.get("vtkClass").asText());
        assertEquals(27 * 3, surface.at("/points/values").size());
        assertFalse(surface.has("verts"));
        assertEquals(24 * 5, surface.at("/polys/values").size());
    }

    @Test
    public void imageDataPlane() throws Exception {
        ObjectNode surface = extractor.extractSurface(json("{'vtkClass': 'vtkImageData'," +
                "'extent': [0, 2, 0, 1, 0, 0], 'origin': [1, 2, 3], 'spacing': [0.5, 1, 2]}"));

        assertArrayEquals(new int[] {4, 0, 1, 4, 3, 4, 1, 2, 5, 4}, intValues(surface.at("/polys/values")));
        JsonNode points = surface.at("/points/values");
        assertEquals(1.5, points.get(3).asDouble(), 0.);
        assertEquals(2, points.get(4).asDouble(), 0.);
        assertEquals(3, points.get(5).asDouble(), 0.);
        assertEquals(3, points.get(3 * 4 + 1).asDouble(), 0.);
    }

    @Test
    public void imageDataDirectionIsColumnMajor() throws Exception {
        ObjectNode surface = extractor.extractSurface(json("{'vtkClass': 'vtkImageData'," +
                "'dimensions': [2, 1, 1], 'direction': [0, 1, 0, -1, 0, 0, 0, 0, 1]}"));

        JsonNode points = surface.at("/points/values");
        assertEquals(0, points.get(3).asDouble(), 1e-12);
        assertEquals(1, points.get(4).asDouble(), 1e-12);
        assertArrayEquals(new int[] {2, 0, 1}, intValues(surface.at("/lines/values")));
    }

    @Test
    public void rectilinearGrid() throws Exception {
        ObjectNode surface = extractor.extractSurface(json("{'vtkClass': 'vtkRectilinearGrid', 'extent': [0, 1, 0, 1, 0, 0]," +
                "'xCoordinates': {'dataType': 'Float32Array', 'values': [0, 10]}," +
                "'yCoordinates': {'dataType': 'Float32Array', 'values': [5, 7]}," +
                "'zCoordinates': {'dataType': 'Float32Array', 'values': [-1]}}"));

        JsonNode points = surface.at("/points/values");
        assertEquals(4 * 3, points.size());
        assertEquals(10, points.get(9).asDouble(), 0.);
        assertEquals(7, points.get(10).asDouble(), 0.);
        assertEquals(-1, points.get(11).asDouble(), 0.);
        assertArrayEquals(new int[] {4, 0, 1, 3, 2}, intValues(surface.at("/polys/values")));
    }

    @Test(expected = IllegalArgumentException.class)
    public void structuredGridWithTooFewPoints() throws Exception {
        extractor.extractSurface(json("{'vtkClass': 'vtkStructuredGrid', 'dimensions': [2, 2, 1]," +
                "'points': {'dataType': 'Float32Array', 'values': [0, 0, 0, 1, 0, 0, 0, 1, 0]}}"));
    }

    @Test
    public void tetrasSharingAFace() throws Exception {
        ObjectNode surface = extractor.extractSurface(json("{'vtkClass': 'vtkUnstructuredGrid'," +
                "'points': {'dataType': 'Float32Array', 'values': [0, 0, 0, 1, 0, 0, 0, 1, 0, 0, 0, 1, 1, 1, 1]}," +
                "'cells': {'dataType': 'Uint32Array', 'values': [4, 0, 1, 2, 3, 4, 1, 2, 3, 4]}," +
                "'cellTypes': {'dataType': 'Uint8Array', 'values': [10, 10]}," +
                "'cellData': {'activeScalars': 0, 'arrays': [{'data': {'name': 'region', 'dataType': 'Int16Array', 'values': [10, 20]}}]}}"));

        int[] polys = intValues(surface.at("/polys/values"));
        assertEquals(6 * 4, polys.length);
        for (int pos = 0; pos < polys.length; pos += 4) {
            assertEquals(3, polys[pos]);
        }
        assertArrayEquals(new int[] {10, 10, 10, 20, 20, 20}, intValues(surface.at("/cellData/arrays/0/data/values")));
        assertEquals(6, surface.at("/cellData/arrays/0/data/size").asInt());
        assertEquals(0, surface.at("/cellData/activeScalars").asInt());
    }

    @Test
    public void hexahedronAndLowerDimensionalCells() throws Exception {
        ObjectNode surface = extractor.extractSurface(json("{'vtkClass': 'vtkUnstructuredGrid'," +
                "'points': {'dataType': 'Float64Array', 'values': [" +
                "0, 0, 0, 1, 0, 0, 1, 1, 0, 0, 1, 0, 0, 0, 1, 1, 0, 1, 1, 1, 1, 0, 1, 1]}," +
                "'cells': {'dataType': 'BigInt64Array', 'values': [8, 0, 1, 2, 3, 4, 5, 6, 7, 2, 0, 6, 1, 7, 3, 0, 1, 2]}," +
                "'cellTypes': {'dataType': 'Int32Array', 'values': [12, 3, 42, 5]}}"));

        assertArrayEquals(new int[] {2, 0, 6}, intValues(surface.at("/lines/values")));
        int[] polys = intValues(surface.at("/polys/values"));
        assertEquals(6 * 5 + 4, polys.length);
        assertArrayEquals(new int[] {4, 0, 4, 7, 3}, Arrays.copyOfRange(polys, 0, 5));
    }

    @Test(expected = IllegalArgumentException.class)
    public void unsupportedDocument() throws Exception {
        extractor.extractSurface(json("{'vtkClass': 'vtkPolyData'}"));
    }

    @Test
    public void discoveredByGeometryNormalizer() throws Exception {
        CapabilityRegistry registry = CapabilityRegistry.probe(ConfigProvider.getInstance().get());
        assertTrue(registry.isAvailable(Capability.SURFACE_EXTRACTION));

        PolyData polyData = new GeometryNormalizer(registry)
                .normalizeGeometry(json("{'vtkClass': 'vtkImageData', 'extent': [0, 2, 0, 2, 0, 2], 'spacing': [1, 1, 0.5]}"))
                .orElseThrow(AssertionError::new);

        assertEquals(27, polyData.getNumberOfPoints());
        assertEquals(24, polyData.getNumberOfCells(CellType.POLYS));
        assertArrayEquals(new float[] {2, 2, 1}, polyData.getPoint(26), 0f);
    }

    private JsonNode json(String text) throws Exception {
        return mapper.readTree(text.replace('\'', '"'));
    }

    private static int[] intValues(JsonNode arrayNode) {
        int[] values = new int[arrayNode.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = arrayNode.get(i).asInt();
        }
        return values;
    }
}
