package org.janelia.vizbridge.geometry;

import java.util.Arrays;
import java.util.Optional;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import net.imglib2.RealPoint;
import net.imglib2.img.array.ArrayImgs;
import org.janelia.vizbridge.capability.Capability;
import org.janelia.vizbridge.capability.CapabilityRegistry;
import org.janelia.vizbridge.capability.MissingCapabilityException;
import org.janelia.vizbridge.model.AttributeRole;
import org.janelia.vizbridge.model.CellType;
import org.janelia.vizbridge.model.ComponentType;
import org.janelia.vizbridge.model.DataArray;
import org.janelia.vizbridge.model.PolyData;
import org.jgrapht.Graph;
import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.graph.SimpleGraph;
import org.junit.Before;
import org.junit.Test;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.LinearRing;
import org.locationtech.jts.geom.Polygon;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class GeometryNormalizerTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final GeometryFactory geometryFactory = new GeometryFactory();
    private GeometryNormalizer geometryNormalizer;

    @Before
    public void setUp() {
        geometryNormalizer = new GeometryNormalizer(CapabilityRegistry.builder().withAll().build(), null);
    }

    @Test
    public void planarCoordinateArray() {
        double[][] coords = new double[][] {{1, 2}, {3, 4}, {5, 6}};

        PolyData polyData = geometryNormalizer.normalizeGeometry(coords).orElseThrow(AssertionError::new);

        assertEquals(3, polyData.getNumberOfPoints());
        assertArrayEquals(new float[] {3, 4, PolyData.PLANAR_Z}, polyData.getPoint(1), 0f);
        assertArrayEquals(new int[] {1, 0, 1, 1, 1, 2}, toArray(polyData, CellType.VERTS));
        assertFalse(polyData.hasCells(CellType.LINES));
        assertTrue(polyData.getPointData().isEmpty());
    }

    @Test
    public void explicitZIsKeptEvenWhenNotANumber() {
        float[][] coords = new float[][] {{1, 2, Float.NaN}, {3, 4, 5}};

        PolyData polyData = geometryNormalizer.normalizeGeometry(coords).orElseThrow(AssertionError::new);

        assertTrue(Float.isNaN(polyData.getPoint(0)[2]));
        assertEquals(5f, polyData.getPoint(1)[2], 0f);
    }

    @Test
    public void coordinateArraysWithMissingRowsAreNotConverted() {
        assertFalse(geometryNormalizer.normalizeGeometry(new float[][] {null}).isPresent());
        assertFalse(geometryNormalizer.normalizeGeometry(new double[][] {null, {1, 2}}).isPresent());
        assertFalse(geometryNormalizer.normalizeGeometry(new double[][] {{1, 2}, null}).isPresent());
        assertFalse(geometryNormalizer.normalizePointSet(new float[][] {null, {1, 2, 3}}).isPresent());
    }

    @Test
    public void pointSourcesAreEquivalent() {
        float[][] floatCoords = new float[][] {{1, 2, 3}, {4, 5, 6}};
        PolyData fromArray = geometryNormalizer.normalizeGeometry(floatCoords).orElseThrow(AssertionError::new);
        PolyData fromPoints = geometryNormalizer.normalizeGeometry(Arrays.asList(
                new RealPoint(1, 2, 3), new RealPoint(4, 5, 6))).orElseThrow(AssertionError::new);
        PolyData fromImg = geometryNormalizer.normalizeGeometry(
                ArrayImgs.doubles(new double[] {1, 2, 3, 4, 5, 6}, 3, 2)).orElseThrow(AssertionError::new);

        assertEquals(fromArray, fromPoints);
        assertEquals(fromArray, fromImg);
    }

    @Test
    public void unsupportedSourcesAreNotConverted() throws Exception {
        assertFalse(geometryNormalizer.normalizeGeometry(null).isPresent());
        assertFalse(geometryNormalizer.normalizeGeometry("points").isPresent());
        assertFalse(geometryNormalizer.normalizeGeometry(new double[][] {{1, 2, 3, 4}}).isPresent());
        assertFalse(geometryNormalizer.normalizeGeometry(json("{'vtkClass': 'vtkTable'}")).isPresent());
    }

    @Test
    public void polyDataDocumentWithAttributes() throws Exception {
        JsonNode document = json("{" +
                "'vtkClass': 'vtkPolyData'," +
                "'points': {'vtkClass': 'vtkPoints', 'dataType': 'Float64Array', 'numberOfComponents': 3, 'values': [0, 0, 0, 1, 0, 0, 0, 1, 0]}," +
                "'polys': {'vtkClass': 'vtkCellArray', 'dataType': 'BigUint64Array', 'values': [3, 0, 1, 2]}," +
                "'pointData': {'vtkClass': 'vtkDataSetAttributes', 'activeScalars': 1, 'arrays': [" +
                "  {'data': {'name': 'labels', 'dataType': 'BigInt64Array', 'numberOfComponents': 1, 'values': [7, -8, 9]}}," +
                "  {'data': {'name': 'weights', 'dataType': 'Float32Array', 'numberOfComponents': 1, 'values': [0.5, 1.5, 2.5]}}" +
                "]}" +
                "}");

        PolyData polyData = geometryNormalizer.normalizeGeometry(document).orElseThrow(AssertionError::new);

        assertEquals(3, polyData.getNumberOfPoints());
        assertArrayEquals(new int[] {3, 0, 1, 2}, toArray(polyData, CellType.POLYS));
        assertEquals(2, polyData.getPointData().getNumberOfArrays());
        DataArray labels = polyData.getPointData().getArray(0);
        assertEquals("labels", labels.getName());
        assertEquals(ComponentType.INT32, labels.getDataType());
        assertEquals(-8, labels.getValue(1), 0.);
        assertEquals(1, polyData.getPointData().getActiveIndex(AttributeRole.SCALARS).getAsInt());
        assertFalse(polyData.getPointData().getActiveIndex(AttributeRole.NORMALS).isPresent());
    }

    @Test
    public void activeRolesKeepTheDesignatedIndexOfArraysSharingAName() throws Exception {
        JsonNode document = json("{" +
                "'vtkClass': 'vtkPolyData'," +
                "'points': {'dataType': 'Float32Array', 'numberOfComponents': 3, 'values': [0, 0, 0, 1, 0, 0]}," +
                "'pointData': {'activeScalars': 1, 'activeVectors': 0, 'arrays': [" +
                "  {'data': {'name': 'v', 'dataType': 'Float32Array', 'numberOfComponents': 1, 'values': [1, 2]}}," +
                "  {'data': {'name': 'v', 'dataType': 'Float32Array', 'numberOfComponents': 1, 'values': [3, 4]}}" +
                "]}" +
                "}");

        PolyData polyData = geometryNormalizer.normalizeGeometry(document).orElseThrow(AssertionError::new);

        assertEquals(1, polyData.getPointData().getActiveIndex(AttributeRole.SCALARS).getAsInt());
        assertEquals(0, polyData.getPointData().getActiveIndex(AttributeRole.VECTORS).getAsInt());
    }

    @Test
    public void wide64BitValuesAreRejected() throws Exception {
        JsonNode document = json("{" +
                "'vtkClass': 'vtkPolyData'," +
                "'points': {'dataType': 'Float32Array', 'numberOfComponents': 3, 'values': [0, 0, 0, 1, 1, 1]}," +
                "'cellData': {'arrays': [{'data': {'name': 'ids', 'dataType': 'BigUint64Array', 'values': [1, 5000000000]}}]}" +
                "}");
        try {
            geometryNormalizer.normalizeGeometry(document);
            fail("Expected a value out of range error");
        } catch (ValueOutOfRangeException e) {
            assertEquals("ids", e.getArrayName());
            assertEquals(ComponentType.UINT32, e.getTargetType());
        }
    }

    @Test
    public void gridWithoutSurfaceExtractor() throws Exception {
        JsonNode document = json("{'vtkClass': 'vtkImageData', 'extent': [0, 1, 0, 1, 0, 1]}");
        try {
            geometryNormalizer.normalizeGeometry(document);
            fail("Expected a missing capability error");
        } catch (MissingCapabilityException e) {
            assertEquals(Capability.SURFACE_EXTRACTION, e.getCapability());
        }
    }

    @Test
    public void gridWithSurfaceExtractor() throws Exception {
        ObjectNode surface = (ObjectNode) json("{'vtkClass': 'vtkPolyData'," +
                "'points': {'dataType': 'Float32Array', 'values': [0, 0, 0, 1, 0, 0, 1, 1, 0]}," +
                "'polys': {'dataType': 'Uint32Array', 'values': [3, 0, 1, 2]}}");
        GeometryNormalizer normalizer = new GeometryNormalizer(CapabilityRegistry.builder().withAll().build(), grid -> surface);

        PolyData polyData = normalizer.normalizeGeometry(json("{'vtkClass': 'vtkUnstructuredGrid'}")).orElseThrow(AssertionError::new);

        assertEquals(3, polyData.getNumberOfPoints());
        assertEquals(1, polyData.getNumberOfCells(CellType.POLYS));
    }

    @Test
    public void jtsLineString() {
        LineString line = geometryFactory.createLineString(new Coordinate[] {
                new Coordinate(0, 0), new Coordinate(1, 0), new Coordinate(1, 1, 2)
        });

        PolyData polyData = geometryNormalizer.normalizeGeometry(line).orElseThrow(AssertionError::new);

        assertEquals(3, polyData.getNumberOfPoints());
        assertArrayEquals(new float[] {1, 0, PolyData.PLANAR_Z}, polyData.getPoint(1), 0f);
        assertArrayEquals(new float[] {1, 1, 2}, polyData.getPoint(2), 0f);
        assertArrayEquals(new int[] {1, 0, 1, 1, 1, 2}, toArray(polyData, CellType.VERTS));
        assertArrayEquals(new int[] {2, 0, 1, 2, 1, 2}, toArray(polyData, CellType.LINES));
    }

    @Test
    public void jtsPolygons() {
        Polygon square = geometryFactory.createPolygon(ring(0, 0, 4, 4));
        Polygon squareWithHole = geometryFactory.createPolygon(ring(0, 0, 4, 4), new LinearRing[] {ring(1, 1.5, 2, 2.5)});

        PolyData simple = geometryNormalizer.normalizeGeometry(square).orElseThrow(AssertionError::new);
        PolyData triangulated = geometryNormalizer.normalizeGeometry(squareWithHole).orElseThrow(AssertionError::new);

        assertEquals(4, simple.getNumberOfPoints());
        assertArrayEquals(new int[] {4, 0, 1, 2, 3}, toArray(simple, CellType.POLYS));

        assertEquals(8, triangulated.getNumberOfPoints());
        int[] polys = toArray(triangulated, CellType.POLYS);
        double area = 0;
        for (int pos = 0; pos < polys.length; pos += polys[pos] + 1) {
            assertEquals(3, polys[pos]);
            float[] p0 = triangulated.getPoint(polys[pos + 1]);
            float[] p1 = triangulated.getPoint(polys[pos + 2]);
            float[] p2 = triangulated.getPoint(polys[pos + 3]);
            area += Math.abs((p1[0] - p0[0]) * (p2[1] - p0[1]) - (p2[0] - p0[0]) * (p1[1] - p0[1])) / 2;
        }
        assertEquals(15, area, 1e-6);
    }

    @Test
    public void jtsGeometryWithoutCapability() {
        GeometryNormalizer normalizer = new GeometryNormalizer(
                CapabilityRegistry.builder().withAll().with(Capability.JTS, false).build(), null);
        try {
            normalizer.normalizeGeometry(geometryFactory.createPoint(new Coordinate(1, 2)));
            fail("Expected a missing capability error");
        } catch (MissingCapabilityException e) {
            assertEquals(Capability.JTS, e.getCapability());
        }
    }

    @Test
    public void skeletonBranches() {
        Graph<RealPoint, DefaultEdge> skeleton = new SimpleGraph<>(DefaultEdge.class);
        RealPoint a = new RealPoint(0, 0, 0);
        RealPoint b = new RealPoint(1, 0, 0);
        RealPoint c = new RealPoint(2, 0, 0);
        RealPoint d = new RealPoint(3, 1, 0);
        RealPoint e = new RealPoint(3, -1, 0);
        Arrays.asList(a, b, c, d, e).forEach(skeleton::addVertex);
        skeleton.addEdge(a, b);
        skeleton.addEdge(b, c);
        skeleton.addEdge(c, d);
        skeleton.addEdge(c, e);

        PolyData polyData = geometryNormalizer.normalizeGeometry(skeleton).orElseThrow(AssertionError::new);

        assertEquals(5, polyData.getNumberOfPoints());
        assertEquals(7, polyData.getNumberOfCells(CellType.VERTS));
        assertEquals(4, polyData.getNumberOfCells(CellType.LINES));
        assertArrayEquals(new int[] {2, 0, 1, 2, 1, 2, 2, 2, 3, 2, 2, 4}, toArray(polyData, CellType.LINES));
    }

    @Test
    public void skeletonCycle() {
        Graph<RealPoint, DefaultEdge> skeleton = new SimpleGraph<>(DefaultEdge.class);
        RealPoint a = new RealPoint(0, 0);
        RealPoint b = new RealPoint(1, 0);
        RealPoint c = new RealPoint(0, 1);
        Arrays.asList(a, b, c).forEach(skeleton::addVertex);
        skeleton.addEdge(a, b);
        skeleton.addEdge(b, c);
        skeleton.addEdge(c, a);

        PolyData polyData = geometryNormalizer.normalizeGeometry(skeleton).orElseThrow(AssertionError::new);

        assertEquals(3, polyData.getNumberOfPoints());
        assertEquals(4, polyData.getNumberOfCells(CellType.VERTS));
        assertEquals(3, polyData.getNumberOfCells(CellType.LINES));
        assertArrayEquals(new float[] {0, 1, PolyData.PLANAR_Z}, polyData.getPoint(2), 0f);
    }

    @Test
    public void pointSets() throws Exception {
        Polygon square = geometryFactory.createPolygon(ring(0, 0, 1, 1));
        Graph<RealPoint, DefaultEdge> skeleton = new SimpleGraph<>(DefaultEdge.class);
        skeleton.addVertex(new RealPoint(1, 1));
        JsonNode mesh = json("{'vtkClass': 'vtkPolyData'," +
                "'points': {'dataType': 'Float32Array', 'values': [0, 0, 0, 1, 0, 0, 1, 1, 0]}," +
                "'polys': {'dataType': 'Uint32Array', 'values': [3, 0, 1, 2]}," +
                "'pointData': {'arrays': [{'data': {'name': 'w', 'dataType': 'Uint8Array', 'values': [1, 2, 3]}}]}}");

        assertTrue(geometryNormalizer.normalizePointSet(new double[][] {{1, 2}}).isPresent());
        assertTrue(geometryNormalizer.normalizePointSet(geometryFactory.createPoint(new Coordinate(1, 2))).isPresent());
        assertFalse(geometryNormalizer.normalizePointSet(square).isPresent());
        assertFalse(geometryNormalizer.normalizePointSet(skeleton).isPresent());
        assertFalse(geometryNormalizer.normalizePointSet(json("{'vtkClass': 'vtkImageData'}")).isPresent());

        Optional<PolyData> meshPoints = geometryNormalizer.normalizePointSet(mesh);
        assertTrue(meshPoints.isPresent());
        assertEquals(3, meshPoints.get().getNumberOfPoints());
        assertEquals(1, meshPoints.get().getCellTypes().size());
        assertArrayEquals(new int[] {1, 0, 1, 1, 1, 2}, toArray(meshPoints.get(), CellType.VERTS));
        assertEquals(1, meshPoints.get().getPointData().getNumberOfArrays());
    }

    private LinearRing ring(double x0, double y0, double x1, double y1) {
        return geometryFactory.createLinearRing(new Coordinate[] {
                new Coordinate(x0, y0), new Coordinate(x1, y0), new Coordinate(x1, y1), new Coordinate(x0, y1), new Coordinate(x0, y0)
        });
    }

    private JsonNode json(String text) throws Exception {
        return mapper.readTree(text.replace('\'', '"'));
    }

    private static int[] toArray(PolyData polyData, CellType cellType) {
        int[] connectivity = new int[polyData.getCells(cellType).remaining()];
        polyData.getCells(cellType).get(connectivity);
        return connectivity;
    }
}
