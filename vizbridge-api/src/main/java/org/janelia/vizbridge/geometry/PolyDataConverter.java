package org.janelia.vizbridge.geometry;

import org.janelia.vizbridge.model.CellType;
import org.janelia.vizbridge.model.PolyData;

/**
 * Canonical poly data needs no conversion.
 */
public class PolyDataConverter extends AbstractGeometryConverter<PolyData> {

    public PolyDataConverter() {
        super(PolyData.class, null);
    }

    @Override
    public boolean isPointSet(Object source) {
        PolyData polyData = (PolyData) source;
        return !polyData.hasCells(CellType.LINES) && !polyData.hasCells(CellType.POLYS) && !polyData.hasCells(CellType.STRIPS);
    }

    @Override
    protected PolyData convertSource(PolyData source) {
        return source;
    }
}
