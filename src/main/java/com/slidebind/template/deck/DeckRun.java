package com.slidebind.template.deck;

/** A span of text sharing one formatting descriptor. */
public interface DeckRun {
    String getText();

    /**
     * Replaces the text, keeping formatting.
     *
     * @throws UnsupportedOperationException when the run is not writable
     */
    void setText(String text);

    /** False for runs such as line breaks whose text is fixed. */
    boolean isWritable();
}
