package org.janelia.vizbridge.image;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.janelia.vizbridge.capability.CapabilityRegistry;
import org.janelia.vizbridge.model.ComponentType;
import org.janelia.vizbridge.model.PixelType;
import org.janelia.vizbridge.model.SpatialImage;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;

public class VtkJsImageDataConverterTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private ImageNormalizer imageNormalizer;

    @Before
    public void setUp() {
        imageNormalizer = new ImageNormalizer(
                CapabilityRegistry.builder().withAll().build(),
                new DefaultBufferOwnershipPolicy(true));
    }

    @Test
    public void scalarVolume() throws Exception {
        JsonNode document = json("{'vtkClass': 'vtkImageData'," +
                "'extent': [0, 2, 0, 1, 0, 0], 'spacing': [0.5, 2, 3], 'origin': [10, 20, 30]," +
                "'pointData': {'vtkClass': 'vtkDataSetAttributes', 'arrays': [" +
                "  {'data': {'name': 'density', 'dataType': 'Uint16Array', 'numberOfComponents': 1, 'values': [0, 1, 2, 3, 4, 5]}}" +
                "]}}");

        SpatialImage image = imageNormalizer.normalizeImage(document).orElseThrow(AssertionError::new);

        assertArrayEquals(new long[] {1, 2, 3}, image.getDims());
        assertArrayEquals(new double[] {3, 2, 0.5}, image.getSpacing(), 0.);
        assertArrayEquals(new double[] {30, 20, 10}, image.getOrigin(), 0.);
        assertArrayEquals(SpatialImage.identity(3), image.getDirection(), 0.);
        assertEquals(ComponentType.UINT16, image.getComponentType());
        assertEquals(PixelType.SCALAR, image.getPixelType());
        assertEquals(5, image.getIntegerValue(new long[] {0, 1, 2}, 0));
        assertEquals(1, image.getIntegerValue(new long[] {0, 0, 1}, 0));
    }

    @Test
    public void extentOffsetAndDirection() throws Exception {
        JsonNode document = json("{'vtkClass': 'vtkImageData'," +
                "'extent': [1, 2, 0, 0, 0, 0], 'direction': [0, 1, 0, -1, 0, 0, 0, 0, 1]," +
                "'pointData': {'arrays': [{'data': {'name': 'v', 'dataType': 'Float32Array', 'values': [1.5, 2.5]}}]}}");

        SpatialImage image = imageNormalizer.normalizeImage(document).orElseThrow(AssertionError::new);

        assertArrayEquals(new long[] {1, 1, 2}, image.getDims());
        assertArrayEquals(new double[] {0, 1, 0}, image.getOrigin(), 1e-12);
        assertArrayEquals(new double[] {1, 0, 0, 0, 0, 1, 0, -1, 0}, image.getDirection(), 0.);
        assertEquals(2.5, image.getRealValue(new long[] {0, 0, 1}, 0), 0.);
    }

    @Test
    public void activeScalarsAmongSeveralArrays() throws Exception {
        JsonNode document = json("{'vtkClass': 'vtkImageData', 'dimensions': [2, 1, 1]," +
                "'pointData': {'activeScalars': 1, 'arrays': [" +
                "  {'data': {'name': 'labels', 'dataType': 'Int32Array', 'values': [7, 8]}}," +
                "  {'data': {'name': 'color', 'dataType': 'Uint8Array', 'numberOfComponents': 3, 'values': [1, 2, 3, 4, 5, 6]}}" +
                "]}}");

        SpatialImage image = imageNormalizer.normalizeImage(document).orElseThrow(AssertionError::new);

        assertEquals(PixelType.RGB, image.getPixelType());
        assertEquals(3, image.getComponentsPerPixel());
        assertEquals(ComponentType.UINT8, image.getComponentType());
        assertEquals(6, image.getIntegerValue(new long[] {0, 0, 1}, 2));
    }

    @Test
    public void documentsWithoutScalarsAreNotConverted() throws Exception {
        assertFalse(imageNormalizer.normalizeImage(json("{'vtkClass': 'vtkImageData', 'dimensions': [2, 2, 1]}")).isPresent());
        assertFalse(imageNormalizer.normalizeImage(json("{'vtkClass': 'vtkImageData', 'dimensions': [2, 1, 1]," +
                "'pointData': {'arrays': [" +
                "  {'data': {'name': 'a', 'dataType': 'Int8Array', 'values': [1, 2]}}," +
                "  {'data': {'name': 'b', 'dataType': 'Int8Array', 'values': [3, 4]}}" +
                "]}}")).isPresent());
        assertFalse(imageNormalizer.normalizeImage(json("{'vtkClass': 'vtkPolyData'}")).isPresent());
    }

    @Test(expected = IllegalArgumentException.class)
    public void scalarCountMustMatchTheExtent() throws Exception {
        imageNormalizer.normalizeImage(json("{'vtkClass': 'vtkImageData', 'extent': [0, 1, 0, 1, 0, 0]," +
                "'pointData': {'arrays': [{'data': {'name': 'v', 'dataType': 'Uint8Array', 'values': [1, 2, 3]}}]}}"));
    }

    private JsonNode json(String text) throws Exception {
        return mapper.readTree(text.replace('\'', '"'));
    }
}
