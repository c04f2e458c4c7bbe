package com.slidebind.template.deck;

import java.util.List;

/** A positioned element on a slide, optionally with a text body. */
public interface DeckShape {
    int getId();

    String getName();

    boolean hasTextBody();

    /** Paragraphs of the text body; empty when there is none. */
    List<DeckParagraph> getParagraphs();

    /** Current geometry, or null when the shape defines none. */
    Geometry getGeometry();

    void setGeometry(Geometry geometry);

    boolean isHidden();

    void setHidden(boolean hidden);

    /** Empties every writable run. */
    void clearText();

    /** Whether the shape sits in a container that can replace it. */
    boolean hasParent();

    /** True when an outline is set on the shape itself. */
    boolean hasOutline();

    DeckSlide getSlide();

    /** Paragraph texts joined by {@code '\n'}. */
    default String getText() {
        StringBuilder sb = new StringBuilder();
        List<DeckParagraph> ps = getParagraphs();
        for (int i = 0; i < ps.size(); i++) {
            if (i > 0) sb.append('\n');
            for (DeckRun r : ps.get(i).getRuns()) sb.append(r.getText());
        }
        return sb.toString();
    }
}
