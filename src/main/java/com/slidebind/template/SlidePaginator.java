package com.slidebind.template;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.apache.poi.xslf.usermodel.XMLSlideShow;
import org.apache.poi.xslf.usermodel.XSLFSlide;

import com.slidebind.debug.Debug;
import com.slidebind.template.deck.DeckParagraph;
import com.slidebind.template.deck.DeckShape;
import com.slidebind.template.deck.DeckSlide;
import com.slidebind.template.deck.poi.PoiSlide;
import com.slidebind.template.layout.RepeatWindow;
import com.slidebind.template.parser.ArrayReference;
import com.slidebind.template.parser.ArrayReferenceScanner;
import com.slidebind.template.text.ParagraphText;
import com.slidebind.template.text.RunTextMapper;

/**
 * Spreads a collection over copies of a template slide.
 *
 * The template's highest {@code Name[i]} index decides how many items fit on a
 * slide. Each copy is inserted right after the previous one and its references
 * are shifted to the copy's window.
 */
public class SlidePaginator {

    private static final String TAG = "slidebind.page";

    /** Items per slide and slides needed for one collection. */
    public static final class Plan {
        public final int itemsPerSlide;
        public final int slidesNeeded;

        Plan(int itemsPerSlide, int slidesNeeded) {
            this.itemsPerSlide = itemsPerSlide;
            this.slidesNeeded = slidesNeeded;
        }

        @Override
        public String toString() {
            return "Plan[" + itemsPerSlide + " per slide, " + slidesNeeded + " slides]";
        }
    }

    /** A slide produced by pagination with the window it shows. */
    public static final class Page {
        public final DeckSlide slide;
        public final RepeatWindow window;

        Page(DeckSlide slide, RepeatWindow window) {
            this.slide = slide;
            this.window = window;
        }
    }

    private final TemplateOptions options;

    public SlidePaginator(TemplateOptions options) {
        this.options = (options == null) ? new TemplateOptions() : options;
    }

    /** Plan for {@code totalCount} items, or null when the slide never indexes the collection. */
    public Plan plan(DeckSlide template, String arrayName, int totalCount) {
        Integer maxIndex = maxIndex(template, arrayName);
        if (maxIndex == null) return null;

        int perSlide = Math.max(1, Math.min(maxIndex + 1, options.getMaxItemsPerSlide()));
        int needed = (totalCount <= 0) ? 1 : (totalCount + perSlide - 1) / perSlide;
        if (needed > options.getMaxSlidesFromTemplate()) {
            Debug.get().w(TAG, arrayName + " needs " + needed + " slides; capped at " + options.getMaxSlidesFromTemplate());
            needed = options.getMaxSlidesFromTemplate();
        }
        // every shifted reference must stay addressable, or a copy would repeat early items
        int shiftable = (ArrayReferenceScanner.MAX_INDEX - maxIndex) / perSlide + 1;
        if (needed > shiftable) {
            Debug.get().w(TAG, arrayName + " needs " + needed + " slides; indexes stop at "
                    + ArrayReferenceScanner.MAX_INDEX + ", capped at " + shiftable);
            needed = shiftable;
        }
        return new Plan(perSlide, Math.max(1, needed));
    }

    /**
     * Clones slide {@code templateIndex} as often as the plan requires.
     *
     * @return the template followed by its copies, each with its window
     */
    public List<Page> paginate(XMLSlideShow ppt, int templateIndex, String arrayName, int totalCount) {
        XSLFSlide template = ppt.getSlides().get(templateIndex);
        Plan plan = plan(new PoiSlide(ppt, template, templateIndex), arrayName, totalCount);

        List<Page> pages = new ArrayList<>();
        if (plan == null) {
            Debug.get().d(TAG, "Slide " + templateIndex + " has no " + arrayName + "[i] references");
            pages.add(new Page(new PoiSlide(ppt, template, templateIndex), null));
            return pages;
        }
        Debug.get().i(TAG, arrayName + " x" + totalCount + " on slide " + templateIndex + ": " + plan);

        List<XSLFSlide> created = new ArrayList<>();
        created.add(template);
        XSLFSlide previous = template;
        for (int batch = 1; batch < plan.slidesNeeded; batch++) {
            XSLFSlide copy = ppt.createSlide(template.getSlideLayout());
            copy.importContent(template);
            ppt.setSlideOrder(copy, ppt.getSlides().indexOf(previous) + 1);
            shiftReferences(new PoiSlide(ppt, copy, -1), arrayName, batch * plan.itemsPerSlide);
            created.add(copy);
            previous = copy;
        }

        for (int batch = 0; batch < created.size(); batch++) {
            XSLFSlide s = created.get(batch);
            PoiSlide slide = new PoiSlide(ppt, s, ppt.getSlides().indexOf(s));
            pages.add(new Page(slide, new RepeatWindow(arrayName, batch * plan.itemsPerSlide, plan.itemsPerSlide, totalCount)));
        }
        return pages;
    }

    /** Shifts every {@code arrayName[i]} on the slide by {@code offset}, run formatting kept. */
    public static void shiftReferences(DeckSlide slide, String arrayName, int offset) {
        for (DeckShape shape : slide.getShapes()) {
            for (DeckParagraph p : shape.getParagraphs()) {
                String text = ParagraphText.of(p).getText();
                String shifted = ArrayReferenceScanner.shift(text, arrayName, offset);
                if (!shifted.equals(text)) RunTextMapper.rewrite(p, shifted);
            }
        }
    }

    private static Integer maxIndex(DeckSlide slide, String arrayName) {
        List<ArrayReference> refs = new ArrayList<>();
        for (DeckShape shape : slide.getShapes()) {
            if (shape.hasTextBody()) refs.addAll(ArrayReferenceScanner.scan(shape.getText()));
        }
        for (Map.Entry<String, Integer> e : ArrayReferenceScanner.maxIndexes(refs).entrySet()) {
            if (e.getKey().equalsIgnoreCase(arrayName)) return e.getValue();
        }
        return null;
    }
}
