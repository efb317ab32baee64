package org.janelia.vizbridge.model;

/**
 * Named slots of a data set attributes collection that point to one of its arrays.
 */
public enum AttributeRole {
    SCALARS("activeScalars"),
    NORMALS("activeNormals"),
    VECTORS("activeVectors"),
    TCOORDS("activeTCoords"),
    GLOBAL_IDS("activeGlobalIds"),
    PEDIGREE_IDS("activePedigreeIds");

    private final String key;

    AttributeRole(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
