package org.janelia.vizbridge.image;

import java.util.Optional;

import ij.ImagePlus;
import ij.WindowManager;
import org.janelia.vizbridge.capability.Capability;
import org.janelia.vizbridge.model.SpatialImage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves an {@link ImageJImageReference} in the running ImageJ session and copies the image.
 */
public class ImageJSessionConverter extends AbstractImageConverter<ImageJImageReference> {

    private static final Logger LOG = LoggerFactory.getLogger(ImageJSessionConverter.class);

    private final ImagePlusConverter imagePlusConverter;

    public ImageJSessionConverter(ImagePlusConverter imagePlusConverter) {
        super(ImageJImageReference.class, Capability.IMAGEJ_SESSION);
        this.imagePlusConverter = imagePlusConverter;
    }

    @Override
    protected Optional<SpatialImage> convertSource(ImageJImageReference reference) {
        ImagePlus imp = reference.getImageId() != null
                ? WindowManager.getImage(reference.getImageId())
                : WindowManager.getImage(reference.getTitle());
        if (imp == null) {
            LOG.debug("{} does not resolve to any open image", reference);
            return Optional.empty();
        }
        return imagePlusConverter.convert(imp);
    }
}
