package com.slidebind.template.deck;

import java.util.List;

/** Ordered runs of one paragraph; their concatenation is the paragraph text. */
public interface DeckParagraph {
    List<DeckRun> getRuns();

    /** Appends a writable run, formatted like the paragraph's last run where possible. */
    DeckRun appendRun(String text);
}
