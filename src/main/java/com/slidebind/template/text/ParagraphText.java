package com.slidebind.template.text;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.slidebind.template.deck.DeckParagraph;
import com.slidebind.template.deck.DeckRun;

/**
 * Logical text of a paragraph with the offset of every run in it.
 * A snapshot: stale once any run is rewritten.
 */
public final class ParagraphText {
    private final DeckParagraph paragraph;
    private final String text;
    private final List<RunSegment> segments;

    private ParagraphText(DeckParagraph paragraph, String text, List<RunSegment> segments) {
        this.paragraph = paragraph;
        this.text = text;
        this.segments = segments;
    }

    public static ParagraphText of(DeckParagraph paragraph) {
        StringBuilder sb = new StringBuilder();
        List<RunSegment> segs = new ArrayList<>();
        for (DeckRun run : paragraph.getRuns()) {
            String t = run.getText();
            if (t == null) t = "";
            segs.add(new RunSegment(run, sb.length(), t.length()));
            sb.append(t);
        }
        return new ParagraphText(paragraph, sb.toString(), Collections.unmodifiableList(segs));
    }

    public DeckParagraph getParagraph() { return paragraph; }
    public String getText() { return text; }
    public List<RunSegment> getSegments() { return segments; }

    /**
     * Runs holding part of {@code [start, end)}. An empty range selects the run
     * the insertion point falls in, or the last run at the end of the text.
     */
    public List<RunSegment> contributing(int start, int end) {
        List<RunSegment> out = new ArrayList<>();
        if (start == end) {
            RunSegment last = null;
            for (RunSegment s : segments) {
                if (s.start <= start && start < s.end()) {
                    out.add(s);
                    return out;
                }
                last = s;
            }
            if (last != null && start == text.length()) out.add(last);
            return out;
        }
        for (RunSegment s : segments) {
            if (s.overlaps(start, end)) out.add(s);
        }
        return out;
    }
}
