package com.slidebind.template.deck.poi;

import java.util.ArrayList;
import java.util.List;

import org.apache.poi.xslf.usermodel.XSLFTextParagraph;
import org.apache.poi.xslf.usermodel.XSLFTextRun;
import org.openxmlformats.schemas.drawingml.x2006.main.CTRegularTextRun;
import org.openxmlformats.schemas.drawingml.x2006.main.CTTextCharacterProperties;

import com.slidebind.template.deck.DeckParagraph;
import com.slidebind.template.deck.DeckRun;

final class PoiParagraph implements DeckParagraph {
    final XSLFTextParagraph paragraph;

    PoiParagraph(XSLFTextParagraph paragraph) {
        this.paragraph = paragraph;
    }

    @Override
    public List<DeckRun> getRuns() {
        List<DeckRun> out = new ArrayList<>();
        for (XSLFTextRun r : paragraph.getTextRuns()) out.add(new PoiRun(r));
        return out;
    }

    @Override
    public DeckRun appendRun(String text) {
        CTTextCharacterProperties template = null;
        List<XSLFTextRun> runs = paragraph.getTextRuns();
        for (int i = runs.size() - 1; i >= 0 && template == null; i--) {
            Object xml = runs.get(i).getXmlObject();
            if (xml instanceof CTRegularTextRun && ((CTRegularTextRun) xml).isSetRPr()) {
                template = ((CTRegularTextRun) xml).getRPr();
            }
        }

        XSLFTextRun run = paragraph.addNewTextRun();
        if (template != null) {
            ((CTRegularTextRun) run.getXmlObject()).setRPr((CTTextCharacterProperties) template.copy());
        }
        run.setText(text);
        return new PoiRun(run);
    }
}
