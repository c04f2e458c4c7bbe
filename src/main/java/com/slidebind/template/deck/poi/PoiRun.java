package com.slidebind.template.deck.poi;

import org.apache.poi.xslf.usermodel.XSLFTextRun;
import org.openxmlformats.schemas.drawingml.x2006.main.CTTextLineBreak;

import com.slidebind.template.deck.DeckRun;

final class PoiRun implements DeckRun {
    final XSLFTextRun run;

    PoiRun(XSLFTextRun run) {
        this.run = run;
    }

    @Override
    public String getText() {
        String t = run.getRawText();
        return (t == null) ? "" : t;
    }

    @Override
    public void setText(String text) {
        if (!isWritable()) throw new UnsupportedOperationException("Line break text is fixed");
        run.setText(text);
    }

    @Override
    public boolean isWritable() {
        return !(run.getXmlObject() instanceof CTTextLineBreak);
    }
}
