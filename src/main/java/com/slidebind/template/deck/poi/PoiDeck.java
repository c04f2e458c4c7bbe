package com.slidebind.template.deck.poi;

import java.util.ArrayList;
import java.util.List;

import org.apache.poi.xslf.usermodel.XMLSlideShow;
import org.apache.poi.xslf.usermodel.XSLFSlide;

import com.slidebind.template.deck.DeckSlide;

/** Exposes an {@link XMLSlideShow} through the deck contract. */
public final class PoiDeck {
    private final XMLSlideShow ppt;

    public PoiDeck(XMLSlideShow ppt) {
        if (ppt == null) throw new IllegalArgumentException("ppt is null");
        this.ppt = ppt;
    }

    public XMLSlideShow getSlideShow() { return ppt; }

    public List<DeckSlide> getSlides() {
        List<XSLFSlide> slides = ppt.getSlides();
        List<DeckSlide> out = new ArrayList<>(slides.size());
        for (int i = 0; i < slides.size(); i++) out.add(new PoiSlide(ppt, slides.get(i), i));
        return out;
    }

    public PoiSlide slide(int index) {
        return new PoiSlide(ppt, ppt.getSlides().get(index), index);
    }
}
