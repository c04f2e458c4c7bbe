import com.slidebind.template.SlideBinder;
import com.slidebind.template.TemplateOptions;
import com.slidebind.template.deck.DeckParagraph;
import com.slidebind.template.deck.DeckShape;
import com.slidebind.template.deck.DeckSlide;
import com.slidebind.template.deck.Geometry;
import com.slidebind.template.deck.PictureRequest;
import com.slidebind.template.parser.Environment;
import com.slidebind.template.parser.UnresolvedPolicy;
import com.slidebind.template.parser.Value;

import org.apache.poi.xslf.usermodel.XMLSlideShow;
import org.apache.poi.xslf.usermodel.XSLFSlide;
import org.apache.poi.xslf.usermodel.XSLFTextBox;
import org.junit.jupiter.api.Test;

import java.io.InputStream;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class SlideBindBinderTest {

    private static String bind(SlideBinder binder, String template, Map<String, ?> data) {
        XMLSlideShow ppt = SlideBindTestDecks.deckWithSlide();
        XSLFTextBox box = SlideBindTestDecks.textBox(ppt.getSlides().get(0), "Box", template);
        binder.process(ppt, data);
        return SlideBindTestDecks.paragraphText(SlideBindTestDecks.paragraph(box));
    }

    /** Slide whose only shape fails as soon as it is touched. */
    private static final class BrokenSlide implements DeckSlide {
        @Override public int getIndex() { return 4; }
        @Override public int maxShapeId() { return 1; }
        @Override public boolean hasRelationship(String id) { return false; }
        @Override public DeckShape replaceWithPicture(DeckShape s, PictureRequest r) { throw new IllegalStateException(); }

        @Override
        public List<DeckShape> getShapes() {
            List<DeckShape> out = new ArrayList<>();
            out.add(new DeckShape() {
                @Override public int getId() { return 1; }
                @Override public String getName() { return "Broken"; }
                @Override public boolean hasTextBody() { return true; }
                @Override public List<DeckParagraph> getParagraphs() { return Collections.emptyList(); }
                @Override public Geometry getGeometry() { return null; }
                @Override public void setGeometry(Geometry g) { }
                @Override public boolean isHidden() { throw new IllegalStateException("corrupt shape"); }
                @Override public void setHidden(boolean h) { }
                @Override public void clearText() { }
                @Override public boolean hasParent() { return true; }
                @Override public boolean hasOutline() { return false; }
                @Override public DeckSlide getSlide() { return BrokenSlide.this; }
            });
            return out;
        }
    }

    // ---------------- environment ----------------

    @Test
    public void dataWinsOverGlobals() {
        SlideBinder b = new SlideBinder();
        b.registerGlobalVariable("Company", "Acme");
        b.registerGlobalVariable("Year", 1999);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("Year", 2042);
        assertEquals("Acme 2042", bind(b, "${Company} ${Year}", data));
    }

    @Test
    public void globalSuppliers_areReadPerRun() {
        SlideBinder b = new SlideBinder();
        int[] calls = { 0 };
        b.registerGlobalVariable("Counter", () -> ++calls[0]);

        assertEquals("1", bind(b, "${Counter}", Map.of()));
        assertEquals("2", bind(b, "${Counter}", Map.of()));
    }

    @Test
    public void slideAndShapeVariables() {
        assertEquals("Box on slide 1 (index 0)",
                bind(new SlideBinder(), "${_shape.Name} on slide ${_slide.Number} (index ${_slide.Index})", Map.of()));
    }

    @Test
    public void collectionCounts_listTopLevelCollections() {
        SlideBinder b = new SlideBinder();
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("Items", List.of(1, 2, 3));
        data.put("Name", "x");
        Environment env = b.buildEnvironment(data);

        Map<String, Integer> counts = SlideBinder.collectionCounts(env);
        assertEquals(Integer.valueOf(3), counts.get("Items"));
        assertFalse(counts.containsKey("Name"));
        assertEquals(Value.Type.FUNCTION, env.lookup("ppt.Image").getType());
    }

    @Test
    public void variableResolver_hook() {
        SlideBinder b = new SlideBinder();
        b.setVariableResolver((expr, env) -> expr.startsWith("Env.") ? Value.string(expr.substring(4).toLowerCase(Locale.ROOT)) : null);
        assertEquals("home / x", bind(b, "${Env.HOME} / ${Name}", Map.of("Name", "x")));
    }

    @Test
    public void multipleParagraphs_andShapesWithoutTokens() {
        XMLSlideShow ppt = SlideBindTestDecks.deckWithSlide();
        XSLFSlide s = ppt.getSlides().get(0);
        XSLFTextBox box = SlideBindTestDecks.textBox(s, "Multi", "First ${A}");
        box.addNewTextParagraph().addNewTextRun().setText("Second ${B}");
        SlideBindTestDecks.textBox(s, "Static", "no tokens");

        int changed = new SlideBinder().process(ppt, Map.of("A", "1", "B", "2"));

        assertEquals(1, changed);
        assertEquals("First 1", SlideBindTestDecks.paragraphText(box.getTextParagraphs().get(0)));
        assertEquals("Second 2", SlideBindTestDecks.paragraphText(box.getTextParagraphs().get(1)));
    }

    // ---------------- errors ----------------

    @Test
    public void nullInputs_areRejected() {
        SlideBinder b = new SlideBinder();
        assertThrows(IllegalArgumentException.class, () -> b.process((XMLSlideShow) null, Map.of()));
        assertThrows(IllegalArgumentException.class, () -> b.process((DeckSlide) null, Map.of()));
        assertThrows(IllegalArgumentException.class, () -> b.registerGlobalVariable(null, "x"));
    }

    @Test
    public void failingShape_isReported_andProcessingContinues() {
        SlideBinder b = new SlideBinder();
        List<String> reports = new ArrayList<>();
        b.setErrorReporter((kind, slide, shape, message, error) ->
                reports.add(kind + "|" + slide + "|" + shape + "|" + message));

        int changed = assertDoesNotThrow(() -> b.process(new BrokenSlide(), Map.of()));
        assertEquals(0, changed);
        assertEquals(List.of("ShapeProcessingFailure|4|Broken|corrupt shape"), reports);
    }

    public static final class Shipment {
        private final String carrier;
        private final LocalDate due;

        public Shipment(String carrier, LocalDate due) {
            this.carrier = carrier;
            this.due = due;
        }

        public String getCarrier() { return carrier; }
        public LocalDate getDue() { return due; }
    }

    @Test
    public void beanData_withJavaTimeFields_andUnconvertibleEntries_neverEscape() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("Shipment", new Shipment("Posten", LocalDate.of(2025, 1, 31)));
        data.put("Opaque", new Object());

        String out = assertDoesNotThrow(() -> bind(new SlideBinder(), "${Shipment.Carrier} ${Shipment.Due}${Opaque.X}", data));
        assertEquals("Posten 2025-01-31", out);
    }

    @Test
    public void nullData_bindsNothing() {
        assertEquals("[]", bind(new SlideBinder(), "[${Anything}]", null));
    }

    // ---------------- options ----------------

    @Test
    public void defaults_comeFromBundledResource() {
        TemplateOptions o = TemplateOptions.defaults();
        assertTrue(o.isRegisterBuiltInFunctions());
        assertEquals(300, o.getDefaultImageWidth());
        assertEquals(200, o.getDefaultImageHeight());
        assertEquals(100, o.getMaxSlidesFromTemplate());
        assertEquals(30, o.getMaxItemsPerSlide());
        assertEquals(UnresolvedPolicy.EMPTY, o.getUnresolvedPolicy());
        assertEquals(Locale.US, o.toLocale());
        assertNull(o.getImageBaseDirectory());
    }

    @Test
    public void options_fromJson_keepDefaultsForMissingFields() throws Exception {
        TemplateOptions o;
        try (InputStream in = getClass().getResourceAsStream("/slidebind-test-options.json")) {
            o = TemplateOptions.fromJson(in);
        }
        assertFalse(o.isRegisterGlobalVariables());
        assertTrue(o.isRegisterBuiltInFunctions());
        assertEquals(640, o.getDefaultImageWidth());
        assertEquals(12, o.getMaxItemsPerSlide());
        assertEquals(100, o.getMaxSlidesFromTemplate());
        assertEquals(UnresolvedPolicy.LITERAL, o.getUnresolvedPolicy());
        assertEquals(Locale.GERMANY, o.toLocale());
    }

    @Test
    public void options_driveBinding() throws Exception {
        TemplateOptions o;
        try (InputStream in = getClass().getResourceAsStream("/slidebind-test-options.json")) {
            o = TemplateOptions.fromJson(in);
        }
        SlideBinder b = new SlideBinder(o);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("Amount", 1234.5);
        assertEquals("1.234,50 ${Year}", bind(b, "${Amount:N2} ${Year}", data));
    }

    @Test
    public void builtInsCanBeDisabled() {
        TemplateOptions o = new TemplateOptions();
        o.setRegisterBuiltInFunctions(false);
        SlideBinder b = new SlideBinder(o);
        assertTrue(b.getFunctionRegistry().names().isEmpty());
        assertEquals("[Error: Function 'Chart' not found]", bind(b, "${ppt.Chart(x)}", Map.of()));
    }
}
