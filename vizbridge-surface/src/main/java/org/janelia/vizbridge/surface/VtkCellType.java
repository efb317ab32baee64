package org.janelia.vizbridge.surface;

/**
 * VTK linear cell type codes and the faces of the 3-D ones.
 */
final class VtkCellType {
    static final int VERTEX = 1;
    static final int POLY_VERTEX = 2;
    static final int LINE = 3;
    static final int POLY_LINE = 4;
    static final int TRIANGLE = 5;
    static final int TRIANGLE_STRIP = 6;
    static final int POLYGON = 7;
    static final int PIXEL = 8;
    static final int QUAD = 9;
    static final int TETRA = 10;
    static final int VOXEL = 11;
    static final int HEXAHEDRON = 12;
    static final int WEDGE = 13;
    static final int PYRAMID = 14;

    private static final int[][] TETRA_FACES = {
            {0, 1, 3}, {1, 2, 3}, {2, 0, 3}, {0, 2, 1}
    };
    private static final int[][] VOXEL_FACES = {
            {0, 4, 6, 2}, {1, 3, 7, 5}, {0, 1, 5, 4}, {2, 6, 7, 3}, {0, 2, 3, 1}, {4, 5, 7, 6}
    };
    private static final int[][] HEXAHEDRON_FACES = {
            {0, 4, 7, 3}, {1, 2, 6, 5}, {0, 1, 5, 4}, {3, 7, 6, 2}, {0, 3, 2, 1}, {4, 5, 6, 7}
    };
    private static final int[][] WEDGE_FACES = {
            {0, 1, 2}, {3, 5, 4}, {0, 3, 4, 1}, {1, 4, 5, 2}, {2, 5, 3, 0}
    };
    private static final int[][] PYRAMID_FACES = {
            {0, 3, 2, 1}, {0, 1, 4}, {1, 2, 4}, {2, 3, 4}, {3, 0, 4}
    };

    private VtkCellType() {
    }

    /**
     * @return the local point indexes of the faces of a 3-D cell or null for any other cell type
     */
    static int[][] getFaces(int cellType) {
        switch (cellType) {
            case TETRA: return TETRA_FACES;
            case VOXEL: return VOXEL_FACES;
            case HEXAHEDRON: return HEXAHEDRON_FACES;
            case WEDGE: return WEDGE_FACES;
            case PYRAMID: return PYRAMID_FACES;
            default: return null;
        }
    }

    static int getNumberOfPoints(int cellType) {
        switch (cellType) {
            case VERTEX: return 1;
            case LINE: return 2;
            case TRIANGLE: return 3;
            case PIXEL:
            case QUAD:
            case TETRA:
                return 4;
            case PYRAMID: return 5;
            case WEDGE: return 6;
            case VOXEL:
            case HEXAHEDRON:
                return 8;
            default:
                return -1;
        }
    }
}
