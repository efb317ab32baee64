package org.janelia.vizbridge.model;

/**
 * The cell kinds of a poly data, in the order they are written on the wire.
 */
public enum CellType {
    VERTS("verts"),
    LINES("lines"),
    POLYS("polys"),
    STRIPS("strips");

    private final String key;

    CellType(String key) {
        this.key = key;
    }

    /**
     * @return the field name used for this cell kind in the geometry documents
     */
    public String getKey() {
        return key;
    }
}
