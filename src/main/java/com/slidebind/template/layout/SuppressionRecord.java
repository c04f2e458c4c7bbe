package com.slidebind.template.layout;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.slidebind.template.deck.Geometry;

/** Geometry, hidden flag and run texts of a shape as they were before suppression. */
public final class SuppressionRecord {
    private final int slideIndex;
    private final int shapeId;
    private final Geometry geometry;
    private final boolean hidden;
    private final List<List<String>> runTexts;

    public SuppressionRecord(int slideIndex, int shapeId, Geometry geometry, boolean hidden) {
        this(slideIndex, shapeId, geometry, hidden, Collections.<List<String>>emptyList());
    }

    public SuppressionRecord(int slideIndex, int shapeId, Geometry geometry, boolean hidden,
                             List<List<String>> runTexts) {
        this.slideIndex = slideIndex;
        this.shapeId = shapeId;
        this.geometry = geometry;
        this.hidden = hidden;
        List<List<String>> copy = new ArrayList<>();
        if (runTexts != null) {
            for (List<String> p : runTexts) copy.add(Collections.unmodifiableList(new ArrayList<>(p)));
        }
        this.runTexts = Collections.unmodifiableList(copy);
    }

    public int getSlideIndex() { return slideIndex; }
    public int getShapeId() { return shapeId; }
    /** Original geometry, or null when the shape had none. */
    public Geometry getGeometry() { return geometry; }
    public boolean isHidden() { return hidden; }

    /** Text of every run, paragraph by paragraph. */
    public List<List<String>> getRunTexts() { return runTexts; }

    /** Original shape text, paragraphs joined by {@code '\n'}. */
    public String getText() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < runTexts.size(); i++) {
            if (i > 0) sb.append('\n');
            for (String t : runTexts.get(i)) sb.append(t);
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "SuppressionRecord[slide=" + slideIndex + ", shape=" + shapeId + ", " + geometry + ", hidden=" + hidden + "]";
    }
}
