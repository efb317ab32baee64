package org.janelia.vizbridge.geometry;

import java.util.Optional;

import org.janelia.vizbridge.capability.Capability;
import org.janelia.vizbridge.model.PolyData;

public abstract class AbstractGeometryConverter<S> implements GeometryConverter {

    private final Class<S> sourceClass;
    private final Capability requiredCapability;

    protected AbstractGeometryConverter(Class<S> sourceClass, Capability requiredCapability) {
        this.sourceClass = sourceClass;
        this.requiredCapability = requiredCapability;
    }

    @Override
    public Capability getRequiredCapability() {
        return requiredCapability;
    }

    @Override
    public boolean accepts(Object source) {
        return sourceClass.isInstance(source) && acceptsSource(sourceClass.cast(source));
    }

    @Override
    public boolean isPointSet(Object source) {
        return true;
    }

    @Override
    public Optional<PolyData> convert(Object source) {
        return Optional.of(convertSource(sourceClass.cast(source)));
    }

    protected boolean acceptsSource(S source) {
        return true;
    }

    protected abstract PolyData convertSource(S source);
}
