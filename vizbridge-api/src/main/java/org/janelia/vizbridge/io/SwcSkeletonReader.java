package org.janelia.vizbridge.io;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.common.base.Preconditions;
import org.apache.commons.lang3.StringUtils;
import org.jgrapht.Graph;
import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.graph.SimpleGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads SWC neuron reconstructions ({@code id type x y z radius parent} per line) into an undirected
 * skeleton graph with an edge between every node and its parent.
 */
public class SwcSkeletonReader {

    private static final Logger LOG = LoggerFactory.getLogger(SwcSkeletonReader.class);

    private final double xSpacing;
    private final double ySpacing;
    private final double zSpacing;

    public SwcSkeletonReader() {
        this(1., 1., 1.);
    }

    /**
     * Node coordinates are divided by the spacing of their axis.
     */
    public SwcSkeletonReader(double xSpacing, double ySpacing, double zSpacing) {
        Preconditions.checkArgument(xSpacing > 0 && ySpacing > 0 && zSpacing > 0, "Spacing must be positive");
        this.xSpacing = xSpacing;
        this.ySpacing = ySpacing;
        this.zSpacing = zSpacing;
    }

    public Graph<SkeletonNode, DefaultEdge> readSkeleton(Path swcFile) {
        try (InputStream swcStream = Files.newInputStream(swcFile)) {
            return readSkeleton(swcStream);
        } catch (IOException e) {
            throw new UncheckedIOException("Error reading " + swcFile, e);
        }
    }

    public Graph<SkeletonNode, DefaultEdge> readSkeleton(InputStream swcStream) {
        Map<Integer, SkeletonNode> nodes = new LinkedHashMap<>();
        List<int[]> parentLinks = new ArrayList<>();
        BufferedReader br = new BufferedReader(new InputStreamReader(swcStream, StandardCharsets.UTF_8));
        int lineNumber = 0;
        try {
            for (;;) {
                String line = br.readLine();
                if (line == null) {
                    break;
                }
                lineNumber++;
                line = StringUtils.trim(line);
                if (line.isEmpty() || line.charAt(0) == '#') {
                    continue;
                }
                String[] tokens = StringUtils.split(line);
                if (tokens.length < 7) {
                    throw new IllegalArgumentException("Line " + lineNumber + " has only " + tokens.length + " of the 7 SWC fields");
                }
                int id = Integer.parseInt(tokens[0]);
                int type = Integer.parseInt(tokens[1]);
                double x = Double.parseDouble(tokens[2]) / xSpacing;
                double y = Double.parseDouble(tokens[3]) / ySpacing;
                double z = Double.parseDouble(tokens[4]) / zSpacing;
                double radius = "NA".equals(tokens[5]) ? 0. : Double.parseDouble(tokens[5]);
                int parent = Integer.parseInt(tokens[6]);
                if (nodes.put(id, new SkeletonNode(id, type, x, y, z, radius)) != null) {
                    throw new IllegalArgumentException("Duplicate node id " + id + " at line " + lineNumber);
                }
                if (parent != -1) {
                    parentLinks.add(new int[] {id, parent});
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid SWC value at line " + lineNumber, e);
        }

        Graph<SkeletonNode, DefaultEdge> skeleton = new SimpleGraph<>(DefaultEdge.class);
        nodes.values().forEach(skeleton::addVertex);
        for (int[] link : parentLinks) {
            SkeletonNode child = nodes.get(link[0]);
            SkeletonNode parent = nodes.get(link[1]);
            if (parent == null || parent.equals(child)) {
                LOG.warn("Ignore link from node {} to invalid parent {}", link[0], link[1]);
                continue;
            }
            skeleton.addEdge(parent, child);
        }
        LOG.debug("Read {} skeleton nodes and {} edges", skeleton.vertexSet().size(), skeleton.edgeSet().size());
        return skeleton;
    }
}
