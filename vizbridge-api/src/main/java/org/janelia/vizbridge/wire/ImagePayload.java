package org.janelia.vizbridge.wire;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * Wire form of an image. All per axis values are in the renderer's axis order, fastest axis first.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ImagePayload {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ImageType {
        private int dimension;
        private String componentType;
        private int pixelType;
        private int components;

        public ImageType() {
        }

        public ImageType(int dimension, String componentType, int pixelType, int components) {
            this.dimension = dimension;
            this.componentType = componentType;
            this.pixelType = pixelType;
            this.components = components;
        }

        public int getDimension() {
            return dimension;
        }

        public void setDimension(int dimension) {
            this.dimension = dimension;
        }

        public String getComponentType() {
            return componentType;
        }

        public void setComponentType(String componentType) {
            this.componentType = componentType;
        }

        public int getPixelType() {
            return pixelType;
        }

        public void setPixelType(int pixelType) {
            this.pixelType = pixelType;
        }

        public int getComponents() {
            return components;
        }

        public void setComponents(int components) {
            this.components = components;
        }

        @Override
        public String toString() {
            return new ToStringBuilder(this)
                    .append("dimension", dimension)
                    .append("componentType", componentType)
                    .append("pixelType", pixelType)
                    .append("components", components)
                    .toString();
        }
    }

    public static class Direction {
        private double[] data;
        private int rows;
        private int columns;

        public Direction() {
        }

        public Direction(double[] data, int rows, int columns) {
            this.data = data;
            this.rows = rows;
            this.columns = columns;
        }

        public double[] getData() {
            return data;
        }

        public void setData(double[] data) {
            this.data = data;
        }

        public int getRows() {
            return rows;
        }

        public void setRows(int rows) {
            this.rows = rows;
        }

        public int getColumns() {
            return columns;
        }

        public void setColumns(int columns) {
            this.columns = columns;
        }
    }

    private ImageType imageType;
    private double[] origin;
    private double[] spacing;
    private long[] size;
    private Direction direction;
    private byte[] compressedData;

    public ImageType getImageType() {
        return imageType;
    }

    public void setImageType(ImageType imageType) {
        this.imageType = imageType;
    }

    public double[] getOrigin() {
        return origin;
    }

    public void setOrigin(double[] origin) {
        this.origin = origin;
    }

    public double[] getSpacing() {
        return spacing;
    }

    public void setSpacing(double[] spacing) {
        this.spacing = spacing;
    }

    public long[] getSize() {
        return size;
    }

    public void setSize(long[] size) {
        this.size = size;
    }

    public Direction getDirection() {
        return direction;
    }

    public void setDirection(Direction direction) {
        this.direction = direction;
    }

    public byte[] getCompressedData() {
        return compressedData;
    }

    public void setCompressedData(byte[] compressedData) {
        this.compressedData = compressedData;
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("imageType", imageType)
                .append("origin", origin)
                .append("spacing", spacing)
                .append("size", size)
                .append("compressedBytes", compressedData == null ? 0 : compressedData.length)
                .toString();
    }
}
