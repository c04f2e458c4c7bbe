package com.slidebind.template;

import com.slidebind.template.deck.DeckShape;
import com.slidebind.template.deck.DeckSlide;
import com.slidebind.template.layout.ImageSubstitutionEngine;
import com.slidebind.template.parser.Environment;
import com.slidebind.template.parser.EvaluationResult;
import com.slidebind.template.parser.ExpressionEvaluator;
import com.slidebind.template.parser.FunctionArgument;
import com.slidebind.template.parser.VariableResolver;
import com.slidebind.template.plugins.FunctionRegistry;

/**
 * What a template function sees while one shape is processed: the slide, the
 * shape, the shape's environment and the evaluator bound to it.
 */
public final class ProcessingContext {
    private final DeckSlide slide;
    private final DeckShape shape;
    private final TemplateOptions options;
    private final Environment environment;
    private final ExpressionEvaluator evaluator;
    private final ImageSubstitutionEngine images;

    private DeckShape replacement;

    public ProcessingContext(DeckSlide slide, DeckShape shape, TemplateOptions options, Environment environment,
                             FunctionRegistry registry, ImageSubstitutionEngine images, VariableResolver resolver) {
        this.slide = slide;
        this.shape = shape;
        this.options = (options == null) ? new TemplateOptions() : options;
        this.environment = (environment == null) ? Environment.empty() : environment;
        this.images = (images == null) ? new ImageSubstitutionEngine() : images;
        this.evaluator = new ExpressionEvaluator(this.options.toLocale(), this.options.getUnresolvedPolicy(),
                (registry == null) ? null : (name, call, env) -> registry.execute(this, name, call));
        this.evaluator.setVariableResolver(resolver);
    }

    public DeckSlide getSlide() { return slide; }
    public DeckShape getShape() { return shape; }
    public int getSlideIndex() { return (slide == null) ? -1 : slide.getIndex(); }
    public TemplateOptions getOptions() { return options; }
    public Environment getEnvironment() { return environment; }
    public ExpressionEvaluator getEvaluator() { return evaluator; }
    public ImageSubstitutionEngine getImageEngine() { return images; }

    public EvaluationResult resolveArgument(FunctionArgument arg) {
        return evaluator.resolveArgument(arg, environment);
    }

    public EvaluationResult evaluate(String expression) {
        return evaluator.evaluate(expression, environment);
    }

    /** Records that the shape was swapped for {@code picture}; the old shape must not be touched again. */
    public void markReplaced(DeckShape picture) {
        this.replacement = picture;
    }

    public boolean isReplaced() { return replacement != null; }

    public DeckShape getReplacement() { return replacement; }
}
