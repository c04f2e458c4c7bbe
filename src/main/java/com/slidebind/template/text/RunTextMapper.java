package com.slidebind.template.text;

import java.util.ArrayList;
import java.util.List;

import com.slidebind.debug.Debug;
import com.slidebind.template.deck.DeckParagraph;
import com.slidebind.template.deck.DeckRun;

/**
 * Writes evaluated text back into a paragraph's runs.
 *
 * A span held by one run is replaced inside that run. A span crossing several
 * runs is spread over them in proportion to their original lengths, the last
 * run taking the rounding remainder. Either way the paragraph text afterwards is
 * exactly the requested text.
 *
 * When a run refuses text (line breaks) the paragraph is rebuilt instead: fixed
 * runs stay where they are, the first writable run of each stretch between them
 * takes that stretch's text and the other writable runs are emptied.
 */
public final class RunTextMapper {

    private static final String TAG = "slidebind.text";

    private RunTextMapper() {}

    /**
     * Replaces {@code [start, end)} of the paragraph's logical text.
     *
     * @return whether the paragraph text changed
     */
    public static boolean replaceSpan(DeckParagraph paragraph, int start, int end, String replacement) {
        ParagraphText pt = ParagraphText.of(paragraph);
        String text = pt.getText();
        if (start < 0 || end > text.length() || start > end) {
            Debug.get().w(TAG, "Span [" + start + "," + end + ") outside paragraph of length " + text.length());
            return false;
        }

        String repl = (replacement == null) ? "" : replacement;
        String newText = text.substring(0, start) + repl + text.substring(end);
        if (newText.equals(text)) return false;

        List<RunSegment> runs = pt.contributing(start, end);
        if (runs.isEmpty()) return rebuild(pt, newText);
        for (RunSegment s : runs) {
            if (!s.run.isWritable()) return rebuild(pt, newText);
        }

        RunSegment first = runs.get(0);
        RunSegment last = runs.get(runs.size() - 1);
        String combined = text.substring(first.start, start) + repl + text.substring(end, last.end());

        try {
            if (runs.size() == 1) {
                first.run.setText(combined);
            } else {
                int[] weights = new int[runs.size()];
                for (int i = 0; i < weights.length; i++) weights[i] = runs.get(i).length;
                int[] pieces = distribute(combined.length(), weights);
                int at = 0;
                for (int i = 0; i < pieces.length; i++) {
                    runs.get(i).run.setText(combined.substring(at, at + pieces[i]));
                    at += pieces[i];
                }
            }
        } catch (RuntimeException e) {
            Debug.get().w(TAG, "Run rejected text, rebuilding paragraph: " + e.getMessage());
            return rebuild(pt, newText);
        }

        verify(paragraph, newText);
        return true;
    }

    /**
     * Rewrites the whole paragraph text, touching only the runs that hold the
     * stretch between the common prefix and common suffix.
     */
    public static boolean rewrite(DeckParagraph paragraph, String newText) {
        String old = ParagraphText.of(paragraph).getText();
        String target = (newText == null) ? "" : newText;
        if (old.equals(target)) return false;

        int max = Math.min(old.length(), target.length());
        int prefix = 0;
        while (prefix < max && old.charAt(prefix) == target.charAt(prefix)) prefix++;
        int suffix = 0;
        while (suffix < max - prefix
                && old.charAt(old.length() - 1 - suffix) == target.charAt(target.length() - 1 - suffix)) {
            suffix++;
        }
        return replaceSpan(paragraph, prefix, old.length() - suffix,
                target.substring(prefix, target.length() - suffix));
    }

    /**
     * Splits {@code total} characters over runs weighted by their original
     * lengths. Every piece is non-negative and the pieces sum to {@code total}.
     */
    static int[] distribute(int total, int[] weights) {
        int n = weights.length;
        int[] out = new int[n];
        if (n == 0) return out;

        long sum = 0;
        for (int w : weights) sum += Math.max(0, w);
        if (sum == 0) {
            out[n - 1] = total;
            return out;
        }

        int used = 0;
        for (int i = 0; i < n - 1; i++) {
            out[i] = (int) ((long) total * Math.max(0, weights[i]) / sum);
            used += out[i];
        }
        out[n - 1] = total - used;
        return out;
    }

    // -------------------------
    // Clear-and-rebuild fallback
    // -------------------------

    private static boolean rebuild(ParagraphText pt, String newText) {
        Debug.get().w(TAG, "Clear-and-rebuild fallback for paragraph '" + abbreviate(pt.getText()) + "'");

        boolean exact = true;
        int cursor = 0;
        List<DeckRun> stretch = new ArrayList<>();
        for (RunSegment seg : pt.getSegments()) {
            if (seg.run.isWritable()) {
                stretch.add(seg.run);
                continue;
            }
            String fixed = seg.run.getText();
            if (fixed == null) fixed = "";
            int pos = newText.indexOf(fixed, cursor);
            if (pos < 0) {
                pos = newText.length();
                exact = false;
            }
            exact &= fill(stretch, newText.substring(cursor, pos));
            cursor = Math.min(newText.length(), pos + fixed.length());
            stretch.clear();
        }

        String rest = newText.substring(cursor);
        if (stretch.isEmpty()) {
            if (!rest.isEmpty()) pt.getParagraph().appendRun(rest);
        } else {
            exact &= fill(stretch, rest);
        }

        if (!exact) Debug.get().w(TAG, "Paragraph text could not be mapped exactly onto its runs");
        verify(pt.getParagraph(), newText);
        return true;
    }

    private static boolean fill(List<DeckRun> stretch, String piece) {
        if (stretch.isEmpty()) return piece.isEmpty();
        boolean placed = false;
        for (DeckRun r : stretch) {
            String t = placed ? "" : piece;
            try {
                r.setText(t);
                placed = true;
            } catch (RuntimeException e) {
                Debug.get().e(TAG, "Writable run refused text: " + e.getMessage(), e);
            }
        }
        return placed || piece.isEmpty();
    }

    private static void verify(DeckParagraph paragraph, String expected) {
        String actual = ParagraphText.of(paragraph).getText();
        if (!actual.equals(expected)) {
            Debug.get().w(TAG, "Paragraph text is '" + abbreviate(actual) + "', expected '" + abbreviate(expected) + "'");
        }
    }

    private static String abbreviate(String s) {
        return (s.length() <= 60) ? s : s.substring(0, 57) + "...";
    }
}
