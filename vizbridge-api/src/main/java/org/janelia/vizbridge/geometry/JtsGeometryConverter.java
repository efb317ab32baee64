package org.janelia.vizbridge.geometry;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.janelia.vizbridge.capability.Capability;
import org.janelia.vizbridge.model.PolyData;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryCollection;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.triangulate.polygon.PolygonTriangulator;

/**
 * Converts JTS geometries: points become vertex cells, line strings become paths and polygons
 * become polygon cells. Polygons with holes are triangulated. Collections concatenate their members.
 */
public class JtsGeometryConverter extends AbstractGeometryConverter<Geometry> {

    public JtsGeometryConverter() {
        super(Geometry.class, Capability.JTS);
    }

    @Override
    public boolean isPointSet(Object source) {
        Geometry geometry = (Geometry) source;
        if (geometry instanceof Point) {
            return true;
        } else if (geometry instanceof GeometryCollection) {
            for (int i = 0; i < geometry.getNumGeometries(); i++) {
                if (!isPointSet(geometry.getGeometryN(i))) {
                    return false;
                }
            }
            return true;
        } else {
            return false;
        }
    }

    @Override
    protected PolyData convertSource(Geometry source) {
        GeometryAccumulator geometry = new GeometryAccumulator();
        addGeometry(source, geometry);
        return geometry.build();
    }

    private void addGeometry(Geometry source, GeometryAccumulator geometry) {
        if (source.isEmpty()) {
            return;
        }
        if (source instanceof Point) {
            geometry.addVertex(addCoordinate(((Point) source).getCoordinate(), geometry));
        } else if (source instanceof LineString) {
            List<Integer> path = new ArrayList<>();
            for (Coordinate c : source.getCoordinates()) {
                path.add(addCoordinate(c, geometry));
            }
            geometry.addPath(path);
        } else if (source instanceof Polygon) {
            addPolygon((Polygon) source, geometry);
        } else if (source instanceof GeometryCollection) {
            for (int i = 0; i < source.getNumGeometries(); i++) {
                addGeometry(source.getGeometryN(i), geometry);
            }
        } else {
            throw new IllegalArgumentException("Unsupported JTS geometry " + source.getGeometryType());
        }
    }

    private void addPolygon(Polygon polygon, GeometryAccumulator geometry) {
        if (polygon.getNumInteriorRing() == 0) {
            geometry.addPolygon(addRing(polygon.getExteriorRing().getCoordinates(), geometry, new HashMap<>()));
        } else {
            Geometry triangles = PolygonTriangulator.triangulate(polygon);
            Map<Coordinate, Integer> sharedPoints = new HashMap<>();
            for (int i = 0; i < triangles.getNumGeometries(); i++) {
                Polygon triangle = (Polygon) triangles.getGeometryN(i);
                geometry.addPolygon(addRing(triangle.getExteriorRing().getCoordinates(), geometry, sharedPoints));
            }
        }
    }

    /**
     * Add the points of a closed ring, without the closing point, reusing already added ring points.
     */
    private List<Integer> addRing(Coordinate[] ring, GeometryAccumulator geometry, Map<Coordinate, Integer> sharedPoints) {
        List<Integer> indexes = new ArrayList<>();
        int n = ring.length > 1 && ring[0].equals3D(ring[ring.length - 1]) ? ring.length - 1 : ring.length;
        for (int i = 0; i < n; i++) {
            Coordinate c = ring[i];
            indexes.add(sharedPoints.computeIfAbsent(c, coord -> addCoordinate(coord, geometry)));
        }
        return indexes;
    }

    /**
     * JTS marks a coordinate without z with a NaN z ordinate.
     */
    private static int addCoordinate(Coordinate c, GeometryAccumulator geometry) {
        return Double.isNaN(c.getZ()) ? geometry.addPlanarPoint(c.getX(), c.getY()) : geometry.addPoint(c.getX(), c.getY(), c.getZ());
    }
}
