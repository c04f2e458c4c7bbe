package com.slidebind.template.deck;

import java.io.IOException;
import java.util.List;

/** One slide of a deck. */
public interface DeckSlide {
    /** Zero-based position in the deck. */
    int getIndex();

    /** Every shape on the slide, group members included, in document order. */
    List<DeckShape> getShapes();

    /** Largest shape id in use on the slide, 0 when none. */
    int maxShapeId();

    boolean hasRelationship(String relationshipId);

    /** Text of the slide's speaker notes, empty when it has none. */
    default String getNotesText() {
        return "";
    }

    /**
     * Replaces {@code shape} with a picture built from {@code request}. Either the
     * whole replacement happens or nothing changes.
     *
     * @return the new picture shape
     * @throws IOException when the image part cannot be written
     * @throws IllegalStateException when the shape cannot be replaced
     */
    DeckShape replaceWithPicture(DeckShape shape, PictureRequest request) throws IOException;
}
