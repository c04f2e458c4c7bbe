package com.slidebind.template.layout;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import com.slidebind.debug.Debug;
import com.slidebind.template.deck.DeckShape;
import com.slidebind.template.deck.DeckSlide;
import com.slidebind.template.deck.Geometry;
import com.slidebind.template.deck.ImageContentType;
import com.slidebind.template.deck.PictureRequest;

/**
 * Replaces a placeholder shape with a picture of the same geometry.
 *
 * All inputs are checked and the image is fully read before the slide is touched;
 * a shape without a parent or an unsupported content type aborts the substitution
 * and leaves the shape as it was.
 */
public class ImageSubstitutionEngine {

    private static final String TAG = "slidebind.image";

    /** Offset used when the placeholder has no geometry: 1.67 inch. */
    public static final long FALLBACK_OFFSET = 1524000L;
    public static final String RELATIONSHIP_PREFIX = "rId";
    public static final String NAME_SUFFIX = "_Image";

    /**
     * @return the new picture, or null when the substitution was aborted
     * @throws IOException when the image cannot be read
     */
    public DeckShape substitute(DeckShape shape, Path file, ImageContentType type,
                                int widthPx, int heightPx, boolean lockAspectRatio) throws IOException {
        if (type == null) {
            Debug.get().w(TAG, "Unsupported content type for " + file + "; shape '" + shape.getName() + "' kept");
            return null;
        }
        if (!shape.hasParent() || shape.getSlide() == null) {
            Debug.get().w(TAG, "Shape '" + shape.getName() + "' has no parent; image not inserted");
            return null;
        }

        byte[] data;
        try (InputStream in = Files.newInputStream(file)) {
            data = in.readAllBytes();
        }

        DeckSlide slide = shape.getSlide();
        // The placeholder is detached once replaced; read it only before that.
        String name = shape.getName();
        PictureRequest request = buildRequest(shape, slide, type, data, widthPx, heightPx, lockAspectRatio);
        try {
            DeckShape picture = slide.replaceWithPicture(shape, request);
            Debug.get().i(TAG, "Replaced shape '" + name + "' with " + request);
            return picture;
        } catch (IllegalStateException e) {
            Debug.get().w(TAG, "Picture replacement aborted for '" + name + "': " + e.getMessage());
            return null;
        }
    }

    public PictureRequest buildRequest(DeckShape shape, DeckSlide slide, ImageContentType type, byte[] data,
                                       int widthPx, int heightPx, boolean lockAspectRatio) {
        Geometry g = shape.getGeometry();
        if (g == null) {
            g = new Geometry(FALLBACK_OFFSET, FALLBACK_OFFSET,
                    (long) widthPx * Geometry.EMU_PER_PIXEL, (long) heightPx * Geometry.EMU_PER_PIXEL);
        }
        return new PictureRequest(
                slide.maxShapeId() + 1,
                shape.getName() + NAME_SUFFIX,
                g,
                shape.hasOutline(),
                lockAspectRatio,
                nextRelationshipId(slide),
                type,
                data);
    }

    /** First {@code rId<n>} not yet used on the slide. */
    public static String nextRelationshipId(DeckSlide slide) {
        int n = 1;
        while (slide.hasRelationship(RELATIONSHIP_PREFIX + n)) n++;
        return RELATIONSHIP_PREFIX + n;
    }
}
