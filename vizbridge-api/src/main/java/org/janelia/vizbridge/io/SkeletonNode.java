package org.janelia.vizbridge.io;

import net.imglib2.RealLocalizable;
import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * Sample point of a neuron reconstruction. Nodes are identified by their SWC id.
 */
public class SkeletonNode implements RealLocalizable {

    private final int id;
    private final int type;
    private final double[] position;
    private final double radius;

    public SkeletonNode(int id, int type, double x, double y, double z, double radius) {
        this.id = id;
        this.type = type;
        this.position = new double[] {x, y, z};
        this.radius = radius;
    }

    public int getId() {
        return id;
    }

    public int getType() {
        return type;
    }

    public double getRadius() {
        return radius;
    }

    @Override
    public int numDimensions() {
        return 3;
    }

    @Override
    public void localize(float[] p) {
        for (int d = 0; d < 3; d++) {
            p[d] = (float) position[d];
        }
    }

    @Override
    public void localize(double[] p) {
        System.arraycopy(position, 0, p, 0, 3);
    }

    @Override
    public float getFloatPosition(int d) {
        return (float) position[d];
    }

    @Override
    public double getDoublePosition(int d) {
        return position[d];
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;

        if (o == null || getClass() != o.getClass()) return false;

        return id == ((SkeletonNode) o).id;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(id);
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("id", id)
                .append("type", type)
                .append("position", position)
                .append("radius", radius)
                .toString();
    }
}
