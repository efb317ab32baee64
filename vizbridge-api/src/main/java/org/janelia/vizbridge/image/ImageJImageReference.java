package org.janelia.vizbridge.image;

import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * Reference to an image open in the running ImageJ session, either by its id or by its title.
 */
public class ImageJImageReference {

    private final Integer imageId;
    private final String title;

    private ImageJImageReference(Integer imageId, String title) {
        this.imageId = imageId;
        this.title = title;
    }

    public static ImageJImageReference ofId(int imageId) {
        return new ImageJImageReference(imageId, null);
    }

    public static ImageJImageReference ofTitle(String title) {
        return new ImageJImageReference(null, title);
    }

    public Integer getImageId() {
        return imageId;
    }

    public String getTitle() {
        return title;
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("imageId", imageId)
                .append("title", title)
                .toString();
    }
}
