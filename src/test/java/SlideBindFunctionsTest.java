import com.slidebind.template.SlideBinder;
import com.slidebind.template.parser.Value;
import com.slidebind.template.plugins.ChartFunction;
import com.slidebind.template.plugins.FunctionRegistry;
import com.slidebind.template.plugins.FunctionResult;

import org.apache.poi.xslf.usermodel.XMLSlideShow;
import org.apache.poi.xslf.usermodel.XSLFTextBox;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class SlideBindFunctionsTest {

    private static String bind(SlideBinder binder, String template, Map<String, ?> data) {
        XMLSlideShow ppt = SlideBindTestDecks.deckWithSlide();
        XSLFTextBox box = SlideBindTestDecks.textBox(ppt.getSlides().get(0), "Box", template);
        binder.process(ppt, data);
        return SlideBindTestDecks.paragraphText(SlideBindTestDecks.paragraph(box));
    }

    private static Map<String, Object> data() {
        Map<String, Object> d = new LinkedHashMap<>();
        d.put("Name", "Ada");
        d.put("Items", List.of("a", "b", "c"));
        return d;
    }

    @Test
    public void builtIns_areRegistered() {
        FunctionRegistry r = new SlideBinder().getFunctionRegistry();
        assertEquals(List.of("Image", "Chart", "Table"), r.names());
        assertTrue(r.contains("ppt.image"));
        assertTrue(r.contains("TABLE"));
        assertEquals(Value.func("ppt.Chart").asFunc(), r.asValues().get("ppt.Chart").asFunc());
    }

    @Test
    public void chart_rendersPlaceholder() {
        assertEquals("Chart: " + ChartFunction.NOT_IMPLEMENTED,
                bind(new SlideBinder(), "Chart: ${ppt.Chart(Items, type: \"bar\")}", data()));
    }

    @Test
    public void table_describesRequest() {
        SlideBinder b = new SlideBinder();
        assertEquals("[Table: Items, Headers: True, StartRow: 0, EndRow: -1, Style: Medium]",
                bind(b, "${ppt.Table(Items)}", data()));
        assertEquals("[Table: Items, Headers: False, StartRow: 1, EndRow: 2, Style: Dark]",
                bind(b, "${ppt.Table(Items, headers: false, startRow: 1, endRow: 2, style: \"Dark\")}", data()));
    }

    @Test
    public void table_diagnostics() {
        SlideBinder b = new SlideBinder();
        assertEquals("[Error: Data source required]", bind(b, "${ppt.Table()}", data()));
        assertEquals("[Error: Data source 'Nope' not found]", bind(b, "${ppt.Table(Nope)}", data()));
    }

    @Test
    public void customFunction_receivesBoundValueAndArguments() {
        SlideBinder b = new SlideBinder();
        b.registerFunction("Upper", (ctx, bound, args) -> {
            String s = bound.toDisplayString().toUpperCase(Locale.ROOT);
            return FunctionResult.text(args.size() > 1 ? s + args.get(1).getValue() : s);
        });

        assertEquals("Hi ADA!", bind(b, "Hi ${ppt.Upper(Name, \"!\")}", data()));
        assertEquals("ADA", bind(b, "${ppt.upper(Name)}", data()));
    }

    @Test
    public void customFunction_seesShapeContext() {
        SlideBinder b = new SlideBinder();
        b.registerFunction("ppt.Where", (ctx, bound, args) ->
                FunctionResult.text(ctx.getShape().getName() + "@" + ctx.getSlideIndex()));

        assertEquals("Box@0", bind(b, "${ppt.Where()}", data()));
    }

    @Test
    public void throwingFunction_isWrapped() {
        SlideBinder b = new SlideBinder();
        b.registerFunction("Boom", (ctx, bound, args) -> { throw new IllegalStateException("kaput"); });

        assertEquals("x [Error in function 'Boom': kaput] y", bind(b, "x ${ppt.Boom(1)} y", data()));
    }

    @Test
    public void unknownFunction_andMissingImplementation() {
        SlideBinder b = new SlideBinder();
        b.registerFunction("Later", null);

        assertEquals("[Error: Function 'Missing' not found]", bind(b, "${ppt.Missing(1)}", data()));
        assertEquals("[Error: Function 'Later' has no implementation]", bind(b, "${ppt.Later()}", data()));
    }

    @Test
    public void otherNamespace_staysLiteral() {
        assertEquals("${fn.Upper(Name)}", bind(new SlideBinder(), "${fn.Upper(Name)}", data()));
    }

    @Test
    public void reRegistering_replacesFunction() {
        SlideBinder b = new SlideBinder();
        b.registerFunction("Chart", (ctx, bound, args) -> FunctionResult.text("custom chart"));
        assertEquals("custom chart", bind(b, "${ppt.Chart(Items)}", data()));
        assertEquals(3, b.getFunctionRegistry().names().size());
    }

    @Test
    public void emptyName_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> new FunctionRegistry().register(" ", null));
    }
}
