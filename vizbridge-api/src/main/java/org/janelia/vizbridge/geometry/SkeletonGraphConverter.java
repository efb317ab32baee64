package org.janelia.vizbridge.geometry;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import net.imglib2.RealLocalizable;
import org.janelia.vizbridge.capability.Capability;
import org.janelia.vizbridge.model.PolyData;
import org.jgrapht.Graph;
import org.jgrapht.Graphs;

/**
 * Converts a skeleton graph whose vertices are {@link RealLocalizable} positions.
 *
 * The graph is split into maximal paths between junctions (degree other than 2) and end points,
 * followed by the cycles made only of degree 2 vertices. Every path contributes a vertex cell per
 * point and a line cell per consecutive pair. Points are the graph vertices in vertex set order.
 */
@SuppressWarnings("rawtypes")
public class SkeletonGraphConverter extends AbstractGeometryConverter<Graph> {

    public SkeletonGraphConverter() {
        super(Graph.class, Capability.JGRAPHT);
    }

    @Override
    protected boolean acceptsSource(Graph source) {
        Set<?> vertices = source.vertexSet();
        if (vertices.isEmpty()) {
            return false;
        }
        for (Object v : vertices) {
            if (!(v instanceof RealLocalizable)) {
                return false;
            }
            int n = ((RealLocalizable) v).numDimensions();
            if (n != 2 && n != 3) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean isPointSet(Object source) {
        return false;
    }

    @SuppressWarnings("unchecked")
    @Override
    protected PolyData convertSource(Graph source) {
        return convertGraph((Graph<Object, Object>) source);
    }

    private static <V, E> PolyData convertGraph(Graph<V, E> graph) {
        GeometryAccumulator geometry = new GeometryAccumulator();
        Map<V, Integer> pointIndexes = new HashMap<>();
        for (V v : graph.vertexSet()) {
            pointIndexes.put(v, geometry.addPoint(((RealLocalizable) v).positionAsDoubleArray()));
        }
        for (List<V> path : splitIntoPaths(graph)) {
            List<Integer> indexes = new ArrayList<>();
            path.forEach(v -> indexes.add(pointIndexes.get(v)));
            geometry.addPath(indexes);
        }
        return geometry.build();
    }

    static <V, E> List<List<V>> splitIntoPaths(Graph<V, E> graph) {
        List<List<V>> paths = new ArrayList<>();
        Set<E> visitedEdges = new HashSet<>();
        for (V v : graph.vertexSet()) {
            if (graph.edgesOf(v).size() == 2) {
                continue;
            }
            if (graph.edgesOf(v).isEmpty()) {
                List<V> isolated = new ArrayList<>();
                isolated.add(v);
                paths.add(isolated);
                continue;
            }
            for (E e : graph.edgesOf(v)) {
                if (!visitedEdges.contains(e)) {
                    paths.add(walk(graph, v, e, visitedEdges));
                }
            }
        }
        // what is left are cycles of degree 2 vertices
        for (V v : graph.vertexSet()) {
            for (E e : graph.edgesOf(v)) {
                if (!visitedEdges.contains(e)) {
                    paths.add(walk(graph, v, e, visitedEdges));
                }
            }
        }
        return paths;
    }

    private static <V, E> List<V> walk(Graph<V, E> graph, V start, E startEdge, Set<E> visitedEdges) {
        List<V> path = new ArrayList<>();
        path.add(start);
        V current = start;
        E edge = startEdge;
        while (edge != null) {
            visitedEdges.add(edge);
            V next = Graphs.getOppositeVertex(graph, edge, current);
            path.add(next);
            if (next.equals(start) || graph.edgesOf(next).size() != 2) {
                break;
            }
            edge = null;
            for (E candidate : graph.edgesOf(next)) {
                if (!visitedEdges.contains(candidate)) {
                    edge = candidate;
                    break;
                }
            }
            current = next;
        }
        return path;
    }
}
