package org.janelia.vizbridge.geometry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;

import com.fasterxml.jackson.databind.JsonNode;
import org.janelia.vizbridge.capability.Capability;
import org.janelia.vizbridge.capability.CapabilityRegistry;
import org.janelia.vizbridge.capability.MissingCapabilityException;
import org.janelia.vizbridge.model.CellType;
import org.janelia.vizbridge.model.PolyData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts point sets, paths, skeletons, meshes and grids into {@link PolyData}.
 * The converters are tried in priority order and the first one that accepts the source wins.
 */
public class GeometryNormalizer {

    private static final Logger LOG = LoggerFactory.getLogger(GeometryNormalizer.class);

    private static final Map<Capability, String> CAPABILITY_PACKAGES = new EnumMap<>(Capability.class);
    static {
        CAPABILITY_PACKAGES.put(Capability.JTS, "org.locationtech.jts.");
        CAPABILITY_PACKAGES.put(Capability.JGRAPHT, "org.jgrapht.");
    }

    private final CapabilityRegistry capabilityRegistry;
    private final List<GeometryConverter> converters;

    public GeometryNormalizer() {
        this(CapabilityRegistry.getInstance());
    }

    public GeometryNormalizer(CapabilityRegistry capabilityRegistry) {
        this(capabilityRegistry, capabilityRegistry.isAvailable(Capability.SURFACE_EXTRACTION) ? loadSurfaceExtractor() : null);
    }

    /**
     * @param surfaceExtractor extractor used for grid documents or null if grids cannot be converted
     */
    public GeometryNormalizer(CapabilityRegistry capabilityRegistry, SurfaceExtractor surfaceExtractor) {
        this.capabilityRegistry = capabilityRegistry;
        VtkJsPolyDataConverter polyDataConverter = new VtkJsPolyDataConverter();
        List<GeometryConverter> availableConverters = new ArrayList<>();
        availableConverters.add(new PolyDataConverter());
        availableConverters.add(new CoordinateArrayConverter());
        availableConverters.add(new ImgLib2PointsConverter());
        availableConverters.add(new RealLocalizableCollectionConverter());
        if (capabilityRegistry.isAvailable(Capability.JTS)) {
            availableConverters.add(new JtsGeometryConverter());
        }
        if (capabilityRegistry.isAvailable(Capability.JGRAPHT)) {
            availableConverters.add(new SkeletonGraphConverter());
        }
        availableConverters.add(polyDataConverter);
        availableConverters.add(new VtkJsGridConverter(surfaceExtractor, polyDataConverter));
        this.converters = Collections.unmodifiableList(availableConverters);
    }

    private static SurfaceExtractor loadSurfaceExtractor() {
        return ServiceLoader.load(SurfaceExtractor.class, GeometryNormalizer.class.getClassLoader())
                .findFirst()
                .orElse(null);
    }

    public List<GeometryConverter> getConverters() {
        return converters;
    }

    /**
     * @return the canonical poly data or an empty result if the object is not a supported geometry
     * @throws MissingCapabilityException if the object was recognized but converting it needs an unavailable capability
     * @throws ValueOutOfRangeException if a 64-bit integer array does not fit in 32 bits
     */
    public Optional<PolyData> normalizeGeometry(Object source) {
        return findConverter(source).flatMap(converter -> {
            LOG.debug("Convert {} with {}", source.getClass().getName(), converter.getClass().getSimpleName());
            return converter.convert(source);
        });
    }

    /**
     * Like {@link #normalizeGeometry(Object)} but only for point-only sources and vtk.js poly data
     * documents. For documents only the points, the vertex cells (one per point when the document has
     * none) and the attributes are kept.
     */
    public Optional<PolyData> normalizePointSet(Object source) {
        Optional<GeometryConverter> converter = findConverter(source);
        if (!converter.isPresent()) {
            return Optional.empty();
        }
        boolean document = source instanceof JsonNode;
        if (!document && !converter.get().isPointSet(source)) {
            LOG.debug("{} is not a point set", source.getClass().getName());
            return Optional.empty();
        }
        if (document && !(converter.get() instanceof VtkJsPolyDataConverter)) {
            LOG.debug("Only poly data documents can be point sets");
            return Optional.empty();
        }
        Optional<PolyData> polyData = converter.get().convert(source);
        if (!document) {
            return polyData;
        }
        return polyData.map(GeometryNormalizer::toPointSet);
    }

    private static PolyData toPointSet(PolyData polyData) {
        int[] verts;
        if (polyData.hasCells(CellType.VERTS)) {
            verts = new int[polyData.getCells(CellType.VERTS).remaining()];
            polyData.getCells(CellType.VERTS).get(verts);
        } else {
            int nPoints = polyData.getNumberOfPoints();
            verts = new int[2 * nPoints];
            for (int i = 0; i < nPoints; i++) {
                verts[2 * i] = 1;
                verts[2 * i + 1] = i;
            }
        }
        float[] points = new float[3 * polyData.getNumberOfPoints()];
        polyData.getPoints().get(points);
        return PolyData.builder()
                .points(points)
                .cells(CellType.VERTS, verts)
                .pointData(polyData.getPointData())
                .cellData(polyData.getCellData())
                .build();
    }

    private Optional<GeometryConverter> findConverter(Object source) {
        if (source == null) {
            return Optional.empty();
        }
        for (GeometryConverter converter : converters) {
            if (converter.accepts(source)) {
                return Optional.of(converter);
            }
        }
        CAPABILITY_PACKAGES.forEach((capability, packagePrefix) -> {
            if (!capabilityRegistry.isAvailable(capability) && isFromPackage(source.getClass(), packagePrefix)) {
                throw new MissingCapabilityException(capability, "Converting a " + source.getClass().getName());
            }
        });
        LOG.debug("No geometry converter for {}", source.getClass().getName());
        return Optional.empty();
    }

    private static boolean isFromPackage(Class<?> c, String packagePrefix) {
        if (c == null) {
            return false;
        }
        if (c.getName().startsWith(packagePrefix)) {
            return true;
        }
        for (Class<?> i : c.getInterfaces()) {
            if (isFromPackage(i, packagePrefix)) {
                return true;
            }
        }
        return isFromPackage(c.getSuperclass(), packagePrefix);
    }
}
