package com.slidebind.template.text;

import com.slidebind.template.deck.DeckRun;

/** A run and the slice of the paragraph text it contributes. */
public final class RunSegment {
    public final DeckRun run;
    public final int start;
    public final int length;

    public RunSegment(DeckRun run, int start, int length) {
        this.run = run;
        this.start = start;
        this.length = length;
    }

    /** Exclusive end offset. */
    public int end() { return start + length; }

    /** Whether this run holds part of {@code [from, to)}. */
    boolean overlaps(int from, int to) {
        return length > 0 && start < to && end() > from;
    }

    @Override
    public String toString() {
        return "RunSegment[" + start + "+" + length + "]";
    }
}
