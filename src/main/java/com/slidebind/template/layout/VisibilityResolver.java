package com.slidebind.template.layout;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.slidebind.debug.Debug;
import com.slidebind.template.deck.DeckParagraph;
import com.slidebind.template.deck.DeckRun;
import com.slidebind.template.deck.DeckShape;
import com.slidebind.template.deck.DeckSlide;
import com.slidebind.template.deck.Geometry;
import com.slidebind.template.parser.ArrayReference;
import com.slidebind.template.parser.ArrayReferenceScanner;

/**
 * Decides whether shapes bound to collection items stay visible, and hides or
 * restores them.
 *
 * Suppression sets the hidden flag, shrinks the shape to 1x1 EMU, moves it off the
 * canvas and clears its text. The original geometry, hidden flag and run texts are
 * kept in this instance's record arena, keyed by slide index and shape id, until
 * the shape is restored. One instance covers one generation run, so a later pass
 * with more data can bring a suppressed shape back.
 */
public class VisibilityResolver {

    private static final String TAG = "slidebind.visibility";

    public static final long OFFSCREEN = -10000000L;
    public static final long SUPPRESSED_EXTENT = 1L;

    private final Map<String, SuppressionRecord> arena = new LinkedHashMap<>();
    private final Map<String, VisibilityState> states = new HashMap<>();

    /**
     * SUPPRESSED when any reference indexes past its array's count, VISIBLE when at
     * least one reference is in range, UNKNOWN otherwise. Arrays missing from
     * {@code counts} are not judged.
     */
    public static VisibilityState decide(List<ArrayReference> refs, Map<String, Integer> counts) {
        if (refs == null || refs.isEmpty() || counts == null || counts.isEmpty()) return VisibilityState.UNKNOWN;

        Map<String, Integer> folded = new HashMap<>();
        for (Map.Entry<String, Integer> e : counts.entrySet()) {
            if (e.getKey() != null && e.getValue() != null) folded.put(e.getKey().toLowerCase(Locale.ROOT), e.getValue());
        }

        boolean inRange = false;
        for (ArrayReference r : refs) {
            Integer count = folded.get(r.getArrayName().toLowerCase(Locale.ROOT));
            if (count == null) continue;
            if (r.getIndex() >= count) return VisibilityState.SUPPRESSED;
            inRange = true;
        }
        return inRange ? VisibilityState.VISIBLE : VisibilityState.UNKNOWN;
    }

    /** Applies a decision. Returns whether the shape changed. */
    public synchronized boolean apply(DeckShape shape, VisibilityState state) {
        switch (state) {
            case SUPPRESSED: return suppress(shape);
            case VISIBLE: return restore(shape);
            default: return false;
        }
    }

    public synchronized boolean suppress(DeckShape shape) {
        String key = key(shape);
        if (shape.isHidden()) {
            Debug.get().d(TAG, "Shape '" + shape.getName() + "' already hidden; skipped");
            return false;
        }

        Geometry g = shape.getGeometry();
        arena.putIfAbsent(key, new SuppressionRecord(slideIndex(shape), shape.getId(), g, false, runTexts(shape)));

        shape.setHidden(true);
        if (g != null) shape.setGeometry(new Geometry(OFFSCREEN, OFFSCREEN, SUPPRESSED_EXTENT, SUPPRESSED_EXTENT));
        shape.clearText();
        states.put(key, VisibilityState.SUPPRESSED);

        Debug.get().i(TAG, "Suppressed shape '" + shape.getName() + "' (" + key + ")");
        return true;
    }

    public synchronized boolean restore(DeckShape shape) {
        String key = key(shape);
        states.put(key, VisibilityState.VISIBLE);
        SuppressionRecord rec = arena.remove(key);
        if (rec == null) return false;

        if (rec.getGeometry() != null) shape.setGeometry(rec.getGeometry());
        shape.setHidden(rec.isHidden());
        restoreRunTexts(shape, rec.getRunTexts());

        Debug.get().i(TAG, "Restored shape '" + shape.getName() + "' (" + key + ")");
        return true;
    }

    /** Decides and applies for one shape from its current text. */
    public VisibilityState scanShape(DeckShape shape, Map<String, Integer> counts) {
        VisibilityState state = decide(ArrayReferenceScanner.scan(shape.getText()), counts);
        apply(shape, state);
        return state;
    }

    /**
     * Decides a shape this resolver suppressed from the text it had before
     * suppression, or returns null when there is no record for it.
     */
    public synchronized VisibilityState decideSuppressed(DeckShape shape, Map<String, Integer> counts) {
        SuppressionRecord rec = arena.get(key(shape));
        if (rec == null) return null;
        return decide(ArrayReferenceScanner.scan(rec.getText()), counts);
    }

    /**
     * Re-scans every shape. Shapes hidden by this resolver are decided from their
     * recorded text and restored once in range; other hidden shapes are skipped.
     *
     * @return the number of shapes suppressed by this scan
     */
    public int scanSlide(DeckSlide slide, Map<String, Integer> counts) {
        int suppressed = 0;
        for (DeckShape shape : slide.getShapes()) {
            if (!shape.hasTextBody()) continue;
            if (shape.isHidden()) {
                if (decideSuppressed(shape, counts) == VisibilityState.VISIBLE) restore(shape);
                continue;
            }
            if (scanShape(shape, counts) == VisibilityState.SUPPRESSED) suppressed++;
        }
        return suppressed;
    }

    public synchronized VisibilityState stateOf(DeckShape shape) {
        VisibilityState s = states.get(key(shape));
        return (s == null) ? VisibilityState.UNKNOWN : s;
    }

    /** The record kept for a suppressed shape, or null. */
    public synchronized SuppressionRecord recordOf(DeckShape shape) {
        return arena.get(key(shape));
    }

    public synchronized int size() {
        return arena.size();
    }

    /** Drops every record; called when a generation run ends. */
    public synchronized void clear() {
        arena.clear();
        states.clear();
    }

    private static List<List<String>> runTexts(DeckShape shape) {
        List<List<String>> out = new ArrayList<>();
        for (DeckParagraph p : shape.getParagraphs()) {
            List<String> texts = new ArrayList<>();
            for (DeckRun r : p.getRuns()) texts.add(r.getText());
            out.add(texts);
        }
        return out;
    }

    // Runs are matched by position; a paragraph whose run count changed gets its text in its first writable run.
    private static void restoreRunTexts(DeckShape shape, List<List<String>> texts) {
        List<DeckParagraph> ps = shape.getParagraphs();
        for (int i = 0; i < ps.size() && i < texts.size(); i++) {
            List<DeckRun> runs = ps.get(i).getRuns();
            List<String> saved = texts.get(i);
            if (runs.size() == saved.size()) {
                for (int j = 0; j < runs.size(); j++) {
                    if (runs.get(j).isWritable()) runs.get(j).setText(saved.get(j));
                }
                continue;
            }
            StringBuilder joined = new StringBuilder();
            for (String t : saved) joined.append(t);
            boolean written = false;
            for (DeckRun r : runs) {
                if (!r.isWritable()) continue;
                r.setText(written ? "" : joined.toString());
                written = true;
            }
            if (!written && joined.length() > 0) ps.get(i).appendRun(joined.toString());
        }
    }

    private static int slideIndex(DeckShape shape) {
        return (shape.getSlide() == null) ? -1 : shape.getSlide().getIndex();
    }

    private static String key(DeckShape shape) {
        return slideIndex(shape) + ":" + shape.getId();
    }
}
