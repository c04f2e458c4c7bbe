import com.slidebind.template.SlideBinder;
import com.slidebind.template.deck.DeckShape;
import com.slidebind.template.deck.Geometry;
import com.slidebind.template.deck.poi.PoiDeck;
import com.slidebind.template.deck.poi.PoiSlide;
import com.slidebind.template.layout.SuppressionRecord;
import com.slidebind.template.layout.VisibilityResolver;
import com.slidebind.template.layout.VisibilityState;
import com.slidebind.template.parser.ArrayReference;
import com.slidebind.template.parser.ArrayReferenceScanner;

import org.apache.poi.xslf.usermodel.XMLSlideShow;
import org.apache.poi.xslf.usermodel.XSLFSlide;
import org.apache.poi.xslf.usermodel.XSLFTextBox;
import org.junit.jupiter.api.Test;

import java.awt.geom.Rectangle2D;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

public class SlideBindVisibilityTest {

    private static ArrayReference ref(String name, int index) {
        return new ArrayReference(name, index, null, name + "[" + index + "]", false);
    }

    private static List<Map<String, Object>> items(int n) {
        List<Map<String, Object>> out = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("Title", "Item " + i);
            out.add(m);
        }
        return out;
    }

    private static DeckShape shapeNamed(PoiSlide slide, String name) {
        for (DeckShape s : slide.getShapes()) {
            if (name.equals(s.getName())) return s;
        }
        throw new AssertionError("no shape " + name);
    }

    // ---------------- decision ----------------

    @Test
    public void decide_indexAgainstCount() {
        Random rnd = new Random(7L);
        for (int round = 0; round < 200; round++) {
            int count = rnd.nextInt(6);
            int index = rnd.nextInt(8);
            VisibilityState s = VisibilityResolver.decide(List.of(ref("Items", index)), Map.of("Items", count));
            assertEquals(index >= count ? VisibilityState.SUPPRESSED : VisibilityState.VISIBLE, s,
                    "index " + index + " of " + count);
        }
    }

    @Test
    public void decide_anyOutOfRangeSuppresses_caseInsensitive() {
        List<ArrayReference> refs = List.of(ref("items", 0), ref("ITEMS", 3));
        assertEquals(VisibilityState.SUPPRESSED, VisibilityResolver.decide(refs, Map.of("Items", 2)));
    }

    @Test
    public void decide_unknownArrays_andNoRefs() {
        assertEquals(VisibilityState.UNKNOWN, VisibilityResolver.decide(List.of(ref("Other", 99)), Map.of("Items", 2)));
        assertEquals(VisibilityState.UNKNOWN, VisibilityResolver.decide(List.of(), Map.of("Items", 2)));
        assertEquals(VisibilityState.VISIBLE,
                VisibilityResolver.decide(List.of(ref("Other", 99), ref("Items", 1)), Map.of("Items", 2)));
    }

    @Test
    public void scanner_findsFunctionArgumentReferences() {
        List<ArrayReference> refs = ArrayReferenceScanner.scan("${Items[0].Title} ${ppt.Image(Items[9].ImageUrl, width: 10)}");
        assertEquals(2, refs.size());
        assertFalse(refs.get(0).isInFunction());
        assertTrue(refs.get(1).isInFunction());
        assertEquals(9, refs.get(1).getIndex());
        assertEquals(Map.of("Items", 9), ArrayReferenceScanner.maxIndexes(refs));
    }

    // ---------------- suppress / restore ----------------

    @Test
    public void suppressThenRestore_putsShapeBack() {
        XMLSlideShow ppt = SlideBindTestDecks.deckWithSlide();
        SlideBindTestDecks.textBox(ppt.getSlides().get(0), "Card", new Rectangle2D.Double(36, 72, 200, 50), "${Items[3].Title}");
        PoiSlide slide = new PoiDeck(ppt).slide(0);
        DeckShape shape = shapeNamed(slide, "Card");
        Geometry original = shape.getGeometry();

        VisibilityResolver vr = new VisibilityResolver();
        assertTrue(vr.suppress(shape));
        assertTrue(shape.isHidden());
        assertEquals(new Geometry(VisibilityResolver.OFFSCREEN, VisibilityResolver.OFFSCREEN, 1, 1), shape.getGeometry());
        assertEquals("", shape.getText());
        assertEquals(VisibilityState.SUPPRESSED, vr.stateOf(shape));

        SuppressionRecord rec = vr.recordOf(shape);
        assertNotNull(rec);
        assertEquals(original, rec.getGeometry());
        assertEquals(shape.getId(), rec.getShapeId());
        assertEquals(0, rec.getSlideIndex());

        assertTrue(vr.restore(shape));
        assertFalse(shape.isHidden());
        assertEquals(original, shape.getGeometry());
        assertEquals("${Items[3].Title}", shape.getText());
        assertNull(vr.recordOf(shape));
        assertEquals(0, vr.size());
        assertEquals(VisibilityState.VISIBLE, vr.stateOf(shape));
    }

    @Test
    public void restoreWithoutRecord_isNoOp() {
        XMLSlideShow ppt = SlideBindTestDecks.deckWithSlide();
        SlideBindTestDecks.textBox(ppt.getSlides().get(0), "Card", "x");
        DeckShape shape = shapeNamed(new PoiDeck(ppt).slide(0), "Card");
        Geometry before = shape.getGeometry();

        assertFalse(new VisibilityResolver().restore(shape));
        assertEquals(before, shape.getGeometry());
    }

    @Test
    public void alreadyHiddenShape_isLeftAlone() {
        XMLSlideShow ppt = SlideBindTestDecks.deckWithSlide();
        SlideBindTestDecks.textBox(ppt.getSlides().get(0), "Ghost", "${Items[5].Title}");
        DeckShape shape = shapeNamed(new PoiDeck(ppt).slide(0), "Ghost");
        shape.setHidden(true);
        Geometry before = shape.getGeometry();

        VisibilityResolver vr = new VisibilityResolver();
        assertFalse(vr.suppress(shape));
        assertEquals(before, shape.getGeometry());
        assertEquals(0, vr.size());
        assertEquals("${Items[5].Title}", shape.getText());
    }

    @Test
    public void secondSuppress_keepsFirstRecord() {
        XMLSlideShow ppt = SlideBindTestDecks.deckWithSlide();
        SlideBindTestDecks.textBox(ppt.getSlides().get(0), "Card", "${Items[5].Title}");
        DeckShape shape = shapeNamed(new PoiDeck(ppt).slide(0), "Card");
        Geometry original = shape.getGeometry();

        VisibilityResolver vr = new VisibilityResolver();
        vr.suppress(shape);
        shape.setHidden(false);
        vr.suppress(shape);
        assertEquals(original, vr.recordOf(shape).getGeometry());
        assertEquals(1, vr.size());
    }

    @Test
    public void clear_dropsEveryRecord() {
        XMLSlideShow ppt = SlideBindTestDecks.deckWithSlide();
        XSLFSlide s = ppt.getSlides().get(0);
        SlideBindTestDecks.textBox(s, "A", "${Items[5].Title}");
        SlideBindTestDecks.textBox(s, "B", "${Items[6].Title}");
        SlideBindTestDecks.textBox(s, "C", "${Items[0].Title}");

        VisibilityResolver vr = new VisibilityResolver();
        assertEquals(2, vr.scanSlide(new PoiDeck(ppt).slide(0), Map.of("Items", 1)));
        assertEquals(2, vr.size());
        vr.clear();
        assertEquals(0, vr.size());
    }

    // ---------------- end to end ----------------

    @Test
    public void outOfRangeShape_isSuppressed_inRangeShape_staysVisible() {
        XMLSlideShow ppt = SlideBindTestDecks.deckWithSlide();
        XSLFSlide s = ppt.getSlides().get(0);
        XSLFTextBox missing = SlideBindTestDecks.textBox(s, "Missing", "${Items[5].Title}");
        XSLFTextBox present = SlideBindTestDecks.textBox(s, "Present", "${Items[1].Title}");

        SlideBinder binder = new SlideBinder();
        binder.process(ppt, Map.of("Items", items(2)));

        PoiSlide slide = new PoiDeck(ppt).slide(0);
        DeckShape m = shapeNamed(slide, "Missing");
        DeckShape p = shapeNamed(slide, "Present");

        assertTrue(m.isHidden());
        assertEquals(VisibilityState.SUPPRESSED, binder.getVisibilityResolver().stateOf(m));
        assertEquals("", SlideBindTestDecks.paragraphText(SlideBindTestDecks.paragraph(missing)));

        assertFalse(p.isHidden());
        assertEquals(VisibilityState.VISIBLE, binder.getVisibilityResolver().stateOf(p));
        assertEquals("Item 1", SlideBindTestDecks.paragraphText(SlideBindTestDecks.paragraph(present)));

        binder.reset();
        assertEquals(0, binder.getVisibilityResolver().size());
    }

    @Test
    public void mixedReferences_oneOutOfRange_suppressesWholeShape() {
        XMLSlideShow ppt = SlideBindTestDecks.deckWithSlide();
        XSLFTextBox box = SlideBindTestDecks.textBox(ppt.getSlides().get(0), "Pair", "${Items[0].Title} / ${Items[2].Title}");

        new SlideBinder().process(ppt, Map.of("Items", items(2)));

        assertTrue(shapeNamed(new PoiDeck(ppt).slide(0), "Pair").isHidden());
        assertEquals("", SlideBindTestDecks.paragraphText(SlideBindTestDecks.paragraph(box)));
    }

    // ---------------- re-pass ----------------

    @Test
    public void secondPass_withMoreItems_restoresAndBindsShape() {
        XMLSlideShow ppt = SlideBindTestDecks.deckWithSlide();
        XSLFTextBox box = SlideBindTestDecks.textBox(ppt.getSlides().get(0), "Card",
                new Rectangle2D.Double(36, 72, 200, 50), "Title: ", "${Items[3].Title}");
        Geometry original = shapeNamed(new PoiDeck(ppt).slide(0), "Card").getGeometry();
        SlideBinder binder = new SlideBinder();

        binder.process(ppt, Map.of("Items", items(2)));
        assertTrue(shapeNamed(new PoiDeck(ppt).slide(0), "Card").isHidden());

        binder.process(ppt, Map.of("Items", items(3)));
        assertTrue(shapeNamed(new PoiDeck(ppt).slide(0), "Card").isHidden(), "still out of range");
        assertEquals(1, binder.getVisibilityResolver().size());

        binder.process(ppt, Map.of("Items", items(5)));
        DeckShape card = shapeNamed(new PoiDeck(ppt).slide(0), "Card");
        assertFalse(card.isHidden());
        assertEquals(original, card.getGeometry());
        assertEquals("Title: Item 3", SlideBindTestDecks.paragraphText(SlideBindTestDecks.paragraph(box)));
        assertEquals("Item 3", SlideBindTestDecks.runText(SlideBindTestDecks.paragraph(box), 1));
        assertTrue(SlideBindTestDecks.paragraph(box).getTextRuns().get(1).isBold());
        assertEquals(VisibilityState.VISIBLE, binder.getVisibilityResolver().stateOf(card));
        assertEquals(0, binder.getVisibilityResolver().size());
    }

    @Test
    public void nestedCollection_outOfRange_isSuppressedThenRestored() {
        XMLSlideShow ppt = SlideBindTestDecks.deckWithSlide();
        XSLFTextBox box = SlideBindTestDecks.textBox(ppt.getSlides().get(0), "Line", "${Order.Lines[2].Title}");
        SlideBinder binder = new SlideBinder();

        binder.process(ppt, Map.of("Order", Map.of("Lines", items(1))));
        assertTrue(shapeNamed(new PoiDeck(ppt).slide(0), "Line").isHidden());
        assertEquals("", SlideBindTestDecks.paragraphText(SlideBindTestDecks.paragraph(box)));

        binder.process(ppt, Map.of("Order", Map.of("Lines", items(3))));
        assertFalse(shapeNamed(new PoiDeck(ppt).slide(0), "Line").isHidden());
        assertEquals("Item 2", SlideBindTestDecks.paragraphText(SlideBindTestDecks.paragraph(box)));
    }

    @Test
    public void scanSlide_restoresShapesBackInRange() {
        XMLSlideShow ppt = SlideBindTestDecks.deckWithSlide();
        SlideBindTestDecks.textBox(ppt.getSlides().get(0), "Card", "${Items[2].Title}");
        VisibilityResolver vr = new VisibilityResolver();

        assertEquals(1, vr.scanSlide(new PoiDeck(ppt).slide(0), Map.of("Items", 1)));
        DeckShape card = shapeNamed(new PoiDeck(ppt).slide(0), "Card");
        assertTrue(card.isHidden());
        assertEquals(VisibilityState.SUPPRESSED, vr.decideSuppressed(card, Map.of("Items", 2)));

        assertEquals(0, vr.scanSlide(new PoiDeck(ppt).slide(0), Map.of("Items", 3)));
        card = shapeNamed(new PoiDeck(ppt).slide(0), "Card");
        assertFalse(card.isHidden());
        assertEquals("${Items[2].Title}", card.getText());
        assertNull(vr.decideSuppressed(card, Map.of("Items", 3)));
    }
}
