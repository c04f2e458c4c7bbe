package com.slidebind.template;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.slidebind.debug.Debug;
import com.slidebind.template.deck.DeckParagraph;
import com.slidebind.template.deck.DeckShape;
import com.slidebind.template.deck.DeckSlide;
import com.slidebind.template.layout.ImageSubstitutionEngine;
import com.slidebind.template.layout.VisibilityResolver;
import com.slidebind.template.layout.VisibilityState;
import com.slidebind.template.parser.ArrayReference;
import com.slidebind.template.parser.ArrayReferenceScanner;
import com.slidebind.template.parser.Environment;
import com.slidebind.template.parser.EvaluationResult;
import com.slidebind.template.parser.ExpressionEvaluator;
import com.slidebind.template.parser.TokenExtractor;
import com.slidebind.template.parser.TokenSpan;
import com.slidebind.template.parser.Value;
import com.slidebind.template.parser.ValueBinder;
import com.slidebind.template.parser.VariableResolver;
import com.slidebind.template.plugins.FunctionRegistry;
import com.slidebind.template.text.ParagraphText;
import com.slidebind.template.text.RunTextMapper;

/**
 * Binds one slide: for every shape, extract tokens paragraph by paragraph,
 * evaluate them right to left, write the results back, then settle the shape's
 * visibility. A failing shape is reported and skipped.
 */
final class SlideProcessor {

    private static final String TAG = "slidebind";

    private final TemplateOptions options;
    private final FunctionRegistry registry;
    private final VisibilityResolver visibility;
    private final ImageSubstitutionEngine images;
    private final VariableResolver resolver;
    private final ErrorReporter reporter;

    SlideProcessor(TemplateOptions options, FunctionRegistry registry, VisibilityResolver visibility,
                   ImageSubstitutionEngine images, VariableResolver resolver, ErrorReporter reporter) {
        this.options = options;
        this.registry = registry;
        this.visibility = visibility;
        this.images = images;
        this.resolver = resolver;
        this.reporter = reporter;
    }

    /** @return the number of shapes changed */
    int process(DeckSlide slide, Environment base, Map<String, Integer> counts) {
        List<DeckShape> shapes = slide.getShapes();
        Debug.get().d(TAG, "Slide " + slide.getIndex() + ": " + shapes.size() + " shapes");

        int changed = 0;
        for (DeckShape shape : shapes) {
            // a substituted shape is detached from its slide, so the catch must not read it
            String name = shapeName(shape);
            try {
                if (processShape(slide, shape, shapes.size(), base, counts)) changed++;
            } catch (RuntimeException e) {
                Debug.get().e(TAG, "Shape '" + name + "' on slide " + slide.getIndex() + " failed", e);
                if (reporter != null) {
                    reporter.report("ShapeProcessingFailure", slide.getIndex(), name, e.getMessage(), e);
                }
            }
        }
        return changed;
    }

    private boolean processShape(DeckSlide slide, DeckShape shape, int shapeCount,
                                 Environment base, Map<String, Integer> counts) {
        if (!shape.hasTextBody()) return false;
        boolean restored = false;
        if (shape.isHidden()) {
            // only shapes this run suppressed come back; hidden template shapes stay as they are
            VisibilityState previous = visibility.decideSuppressed(shape, counts);
            if (previous == null || previous == VisibilityState.SUPPRESSED) return false;
            restored = visibility.restore(shape);
        }

        String text = shape.getText();
        if (!TokenExtractor.containsToken(text)) return restored;

        // references are read before write-back erases them
        List<ArrayReference> refs = ArrayReferenceScanner.scan(text);
        VisibilityState decided = VisibilityResolver.decide(refs, counts);
        if (decided == VisibilityState.SUPPRESSED) {
            return visibility.apply(shape, VisibilityState.SUPPRESSED);
        }

        Environment env = base.with(contextVariables(slide, shape, shapeCount, text));
        ProcessingContext ctx = new ProcessingContext(slide, shape, options, env, registry, images, resolver);
        ExpressionEvaluator evaluator = ctx.getEvaluator();

        boolean changed = restored;
        for (DeckParagraph paragraph : shape.getParagraphs()) {
            List<TokenSpan> spans = TokenExtractor.extract(ParagraphText.of(paragraph).getText());
            for (int i = spans.size() - 1; i >= 0; i--) {
                TokenSpan span = spans.get(i);
                if (span.isLiteral()) continue;

                EvaluationResult r = evaluator.resolve(span.getToken(), env);
                if (r.isOutOfRange()) {
                    Debug.get().i(TAG, "Out-of-range " + r.getReference() + " in '" + shape.getName() + "'");
                    return visibility.apply(shape, VisibilityState.SUPPRESSED) || changed;
                }
                if (r.getKind() == EvaluationResult.Kind.REPLACED || ctx.isReplaced()) return true;

                changed |= RunTextMapper.replaceSpan(paragraph, span.getStart(), span.getEnd(), evaluator.render(span, r));
            }
        }

        if (decided == VisibilityState.VISIBLE) changed |= visibility.apply(shape, VisibilityState.VISIBLE);
        return changed;
    }

    private static String shapeName(DeckShape shape) {
        try {
            return shape.getName();
        } catch (RuntimeException e) {
            Debug.get().w(TAG, "Shape name unreadable: " + e.getMessage());
            return "?";
        }
    }

    private static Map<String, Value> contextVariables(DeckSlide slide, DeckShape shape, int shapeCount, String text) {
        Map<String, Object> s = new LinkedHashMap<>();
        s.put("Index", slide.getIndex());
        s.put("Number", slide.getIndex() + 1);
        s.put("ShapeCount", shapeCount);

        Map<String, Object> sh = new LinkedHashMap<>();
        sh.put("Id", shape.getId());
        sh.put("Name", shape.getName());
        sh.put("Text", text);

        Map<String, Value> out = new LinkedHashMap<>();
        out.put("_slide", ValueBinder.bind(s));
        out.put("_shape", ValueBinder.bind(sh));
        return out;
    }
}
