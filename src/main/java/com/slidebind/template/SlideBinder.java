package com.slidebind.template;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

import org.apache.poi.xslf.usermodel.XMLSlideShow;
import org.apache.poi.xslf.usermodel.XSLFSlide;

import com.slidebind.debug.Debug;
import com.slidebind.template.deck.DeckSlide;
import com.slidebind.template.deck.poi.PoiDeck;
import com.slidebind.template.deck.poi.PoiSlide;
import com.slidebind.template.directive.Directive;
import com.slidebind.template.directive.DirectiveParser;
import com.slidebind.template.layout.ImageSubstitutionEngine;
import com.slidebind.template.layout.RepeatWindow;
import com.slidebind.template.layout.VisibilityResolver;
import com.slidebind.template.parser.Environment;
import com.slidebind.template.parser.EvaluationResult;
import com.slidebind.template.parser.ExpressionEvaluator;
import com.slidebind.template.parser.GlobalVariables;
import com.slidebind.template.parser.Value;
import com.slidebind.template.parser.ValueBinder;
import com.slidebind.template.parser.VariableResolver;
import com.slidebind.template.plugins.BuiltInFunctions;
import com.slidebind.template.plugins.FunctionRegistry;
import com.slidebind.template.plugins.TemplateFunction;

/**
 * Binds {@code ${...}} expressions in slide text to host data.
 *
 * <pre>
 * SlideBinder binder = new SlideBinder();
 * binder.process(slideShow, data);
 * </pre>
 *
 * Expressions: {@code ${Name}}, {@code ${Customer.Address.City}},
 * {@code ${Items[0].Title}}, {@code ${ppt.Image(Items[0].Photo, width: 120)}},
 * each optionally followed by {@code :format}.
 *
 * Shapes bound to collection items past the end of the data are hidden. Failures
 * never escape {@link #process}: they are logged, passed to the
 * {@link ErrorReporter} when one is set, and the shape is skipped.
 *
 * One binder is one generation run: its {@link VisibilityResolver} remembers the
 * geometry of every shape it hid until {@link #reset()}.
 */
public class SlideBinder {

    private static final String TAG = "slidebind";

    private final TemplateOptions options;
    private final FunctionRegistry functions = new FunctionRegistry();
    private final Map<String, Supplier<Object>> globals = new LinkedHashMap<>();
    private final VisibilityResolver visibility = new VisibilityResolver();
    private final ImageSubstitutionEngine images = new ImageSubstitutionEngine();

    private VariableResolver variableResolver;
    private ErrorReporter errorReporter;

    public SlideBinder() {
        this(TemplateOptions.defaults());
    }

    public SlideBinder(TemplateOptions options) {
        this.options = (options == null) ? new TemplateOptions() : options;
        if (this.options.isRegisterBuiltInFunctions()) BuiltInFunctions.register(functions);
        if (this.options.isRegisterGlobalVariables()) globals.putAll(GlobalVariables.standard());
    }

    public TemplateOptions getOptions() { return options; }
    public FunctionRegistry getFunctionRegistry() { return functions; }
    public VisibilityResolver getVisibilityResolver() { return visibility; }

    public void registerFunction(String name, TemplateFunction fn) {
        functions.register(name, fn);
    }

    public void registerGlobalVariable(String name, Object value) {
        if (name == null) throw new IllegalArgumentException("name is null");
        globals.put(name, () -> value);
    }

    public void registerGlobalVariable(String name, Supplier<Object> supplier) {
        if (name == null || supplier == null) throw new IllegalArgumentException("name or supplier is null");
        globals.put(name, supplier);
    }

    public void setVariableResolver(VariableResolver resolver) { this.variableResolver = resolver; }

    public void setErrorReporter(ErrorReporter reporter) { this.errorReporter = reporter; }

    /** Forgets every suppression record; starts a new generation run. */
    public void reset() {
        visibility.clear();
    }

    /**
     * Globals, then template functions, then the data on top. Data wins over
     * globals of the same name.
     */
    public Environment buildEnvironment(Map<String, ?> data) {
        Map<String, Value> base = new LinkedHashMap<>(GlobalVariables.resolve(globals));
        base.putAll(functions.asValues());
        return new Environment(base).with(ValueBinder.bindAll(data));
    }

    /** Item count of every top-level collection in the environment. */
    public static Map<String, Integer> collectionCounts(Environment env) {
        Map<String, Integer> out = new LinkedHashMap<>();
        for (Map.Entry<String, Value> e : env.snapshot().entrySet()) {
            if (e.getValue().type == Value.Type.INDEXABLE) out.put(e.getKey(), e.getValue().asIndexable().count());
        }
        return out;
    }

    /**
     * Binds every slide of the deck. A slide whose notes carry
     * {@code #foreach: Items} is spread over as many copies as the collection
     * needs; {@code #if} directives show or hide named shapes before binding.
     *
     * @return the number of shapes changed
     */
    public int process(XMLSlideShow ppt, Map<String, ?> data) {
        if (ppt == null) throw new IllegalArgumentException("ppt is null");
        int changed = 0;
        // copies inserted by #foreach are bound by their template, not revisited here
        for (XSLFSlide s : new ArrayList<>(ppt.getSlides())) {
            int index = ppt.getSlides().indexOf(s);
            PoiSlide slide = new PoiSlide(ppt, s, index);
            List<Directive> directives = readDirectives(slide);
            Directive foreach = null;
            for (Directive d : directives) {
                if (d.is(Directive.FOREACH)) {
                    foreach = d;
                    break;
                }
            }
            if (foreach == null) {
                changed += bind(slide, data, directives, new RepeatWindow[0]);
            } else {
                changed += foreach(ppt, index, foreach, data, directives, null);
            }
        }
        Debug.get().i(TAG, "Processed " + ppt.getSlides().size() + " slides, " + changed + " shapes changed");
        return changed;
    }

    /**
     * Binds one slide. A window replaces the data count of its collection, so
     * items outside it count as missing.
     */
    public int process(DeckSlide slide, Map<String, ?> data, RepeatWindow... windows) {
        if (slide == null) throw new IllegalArgumentException("slide is null");
        return bind(slide, data, readDirectives(slide), windows);
    }

    /**
     * Spreads collection {@code arrayName} over copies of slide {@code templateIndex}
     * and binds each copy to its window.
     *
     * @return the template and its copies, in deck order
     */
    public List<DeckSlide> paginate(XMLSlideShow ppt, int templateIndex, String arrayName, Map<String, ?> data) {
        if (ppt == null || arrayName == null) throw new IllegalArgumentException("ppt or arrayName is null");
        List<DeckSlide> out = new ArrayList<>();
        PoiSlide template = new PoiDeck(ppt).slide(templateIndex);
        paginate(ppt, templateIndex, arrayName, data, readDirectives(template), out);
        return out;
    }

    /**
     * {@code #foreach: <collection>[, itemName: <name>]}. The collection is any
     * path expression; the slide indexes it as {@code itemName[i]}, which defaults
     * to the collection text itself.
     */
    private int foreach(XMLSlideShow ppt, int templateIndex, Directive d, Map<String, ?> data,
                        List<Directive> directives, List<DeckSlide> out) {
        String collection = d.getValue();
        String itemName = d.parameter("itemName");
        if (itemName == null || itemName.isEmpty()) itemName = collection;

        Environment env = buildEnvironment(data == null ? Collections.<String, Object>emptyMap() : data);
        EvaluationResult r = conditionEvaluator().evaluate(collection, env);
        if (r.getKind() != EvaluationResult.Kind.VALUE || r.getValue().type != Value.Type.INDEXABLE) {
            Debug.get().w(TAG, "#foreach collection '" + collection + "' not found on slide " + templateIndex);
            DeckSlide template = new PoiDeck(ppt).slide(templateIndex);
            if (out != null) out.add(template);
            return bind(template, data, directives, new RepeatWindow[0]);
        }

        // the collection is bound under the name the slide indexes, dotted or not
        Map<String, Object> scoped = new LinkedHashMap<>();
        if (data != null) scoped.putAll(data);
        scoped.put(itemName, r.getValue());
        return paginate(ppt, templateIndex, itemName, scoped, directives, out);
    }

    private int paginate(XMLSlideShow ppt, int templateIndex, String arrayName, Map<String, ?> data,
                         List<Directive> directives, List<DeckSlide> out) {
        Environment env = buildEnvironment(data == null ? Collections.<String, Object>emptyMap() : data);
        Value arr = env.lookup(arrayName);
        int total = (arr != null && arr.type == Value.Type.INDEXABLE) ? arr.asIndexable().count() : 0;

        int changed = 0;
        for (SlidePaginator.Page page : new SlidePaginator(options).paginate(ppt, templateIndex, arrayName, total)) {
            RepeatWindow[] windows = (page.window == null) ? new RepeatWindow[0] : new RepeatWindow[] { page.window };
            changed += bind(page.slide, data, directives, windows);
            if (out != null) out.add(page.slide);
        }
        return changed;
    }

    private int bind(DeckSlide slide, Map<String, ?> data, List<Directive> directives, RepeatWindow[] windows) {
        try {
            Environment env = buildEnvironment(data == null ? Collections.<String, Object>emptyMap() : data);
            Map<String, Integer> counts = collectionCounts(env);
            if (windows != null) {
                for (RepeatWindow w : windows) {
                    if (w == null) continue;
                    counts.put(w.getArrayName(), w.upperBound());
                    env = env.with(Collections.singletonMap("_batch", batchVariables(w)));
                }
            }

            int changed = ConditionDirectives.apply(slide, directives, env, conditionEvaluator(), visibility);
            SlideProcessor processor = new SlideProcessor(options, functions, visibility, images, variableResolver, errorReporter);
            return changed + processor.process(slide, env, counts);
        } catch (RuntimeException e) {
            Debug.get().e(TAG, "Slide " + slide.getIndex() + " failed", e);
            if (errorReporter != null) errorReporter.report("SlideProcessingFailure", slide.getIndex(), null, e.getMessage(), e);
            return 0;
        }
    }

    private static List<Directive> readDirectives(DeckSlide slide) {
        try {
            return DirectiveParser.parse(slide.getNotesText());
        } catch (RuntimeException e) {
            Debug.get().w(TAG, "Notes of slide " + slide.getIndex() + " unreadable: " + e.getMessage(), e);
            return Collections.emptyList();
        }
    }

    /** Index (0-based), Start and End (1-based, inclusive) and Count of a page's window. */
    private static Value batchVariables(RepeatWindow w) {
        Map<String, Object> b = new LinkedHashMap<>();
        b.put("Index", (w.getItemsPerSlide() == 0) ? 0 : w.getStartIndex() / w.getItemsPerSlide());
        b.put("Start", w.getStartIndex() + 1);
        b.put("End", w.getStartIndex() + w.available());
        b.put("Count", w.available());
        return ValueBinder.bind(b);
    }

    private ExpressionEvaluator conditionEvaluator() {
        ExpressionEvaluator ev = new ExpressionEvaluator(options.toLocale(), options.getUnresolvedPolicy(), null);
        ev.setVariableResolver(variableResolver);
        return ev;
    }
}
