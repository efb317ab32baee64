package org.janelia.vizbridge.image;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import org.janelia.vizbridge.capability.Capability;
import org.janelia.vizbridge.capability.CapabilityRegistry;
import org.janelia.vizbridge.config.ConfigProvider;
import org.janelia.vizbridge.model.SpatialImage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts image-like objects into a {@link SpatialImage}. The converters are tried in priority
 * order and the first one that accepts the source wins. Converters whose capability is not
 * available are never consulted.
 */
public class ImageNormalizer {

    private static final Logger LOG = LoggerFactory.getLogger(ImageNormalizer.class);

    private final List<ImageConverter> converters;

    public ImageNormalizer() {
        this(CapabilityRegistry.getInstance(), DefaultBufferOwnershipPolicy.fromConfig(ConfigProvider.getDefaultConfig()));
    }

    public ImageNormalizer(CapabilityRegistry capabilityRegistry, BufferOwnershipPolicy bufferOwnershipPolicy) {
        List<ImageConverter> availableConverters = new ArrayList<>();
        availableConverters.add(new ImgLib2IntervalConverter(bufferOwnershipPolicy));
        if (capabilityRegistry.isAvailable(Capability.IMAGEJ)) {
            availableConverters.add(new ImagePlusConverter());
        }
        if (capabilityRegistry.isAvailable(Capability.AWT)) {
            availableConverters.add(new RasterConverter());
        }
        availableConverters.add(new VtkJsImageDataConverter());
        if (capabilityRegistry.isAvailable(Capability.IMAGEJ_SESSION) && capabilityRegistry.isAvailable(Capability.IMAGEJ)) {
            availableConverters.add(new ImageJSessionConverter(new ImagePlusConverter()));
        }
        this.converters = Collections.unmodifiableList(availableConverters);
    }

    public List<ImageConverter> getConverters() {
        return converters;
    }

    /**
     * @return the canonical image or an empty result if the object is not a supported image
     */
    public Optional<SpatialImage> normalizeImage(Object source) {
        if (source == null) {
            return Optional.empty();
        }
        for (ImageConverter converter : converters) {
            if (converter.accepts(source)) {
                LOG.debug("Convert {} with {}", source.getClass().getName(), converter.getClass().getSimpleName());
                return converter.convert(source);
            }
        }
        LOG.debug("No image converter for {}", source.getClass().getName());
        return Optional.empty();
    }
}
