package com.slidebind.template.plugins;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;

import com.slidebind.debug.Debug;
import com.slidebind.template.ProcessingContext;
import com.slidebind.template.TemplateOptions;
import com.slidebind.template.deck.DeckShape;
import com.slidebind.template.deck.ImageContentType;
import com.slidebind.template.parser.ArgumentParser;
import com.slidebind.template.parser.ArrayReference;
import com.slidebind.template.parser.EvaluationResult;
import com.slidebind.template.parser.FunctionArgument;
import com.slidebind.template.parser.Value;
import com.slidebind.template.parser.ValueFormatter;

/**
 * {@code ppt.Image(source, width: N, height: N, preserveAspectRatio: bool)}.
 *
 * The source is a quoted path, or a variable, property path or indexed path that
 * resolves to one; an unbound name is taken as a literal path. On success the
 * owning shape is replaced by the picture.
 */
public final class ImageFunction implements TemplateFunction {

    private static final String TAG = "slidebind.image";
    public static final String NAME = "Image";

    public static void register(FunctionRegistry registry) {
        registry.register(NAME, new ImageFunction());
    }

    @Override
    public FunctionResult execute(ProcessingContext ctx, Value bound, List<FunctionArgument> args) {
        FunctionArgument source = firstPositional(args);
        if (source == null || source.getValue().trim().isEmpty()) {
            Debug.get().w(TAG, "Image function called without a path");
            return FunctionResult.text("[Error: Image path required]");
        }

        try {
            String path;
            if (source.isQuoted()) {
                path = source.getValue();
            } else {
                EvaluationResult r = ctx.resolveArgument(source);
                if (r.isOutOfRange()) {
                    ArrayReference ref = r.getReference();
                    return FunctionResult.outOfRange(new ArrayReference(ref.getArrayName(), ref.getIndex(),
                            ref.getPropertyPath(), ref.getPattern(), true));
                }
                path = sourcePath(ctx, source, r);
                if (path == null) {
                    Debug.get().w(TAG, "Image source '" + source.getValue() + "' has no value");
                    return FunctionResult.text("[Error: Image source '" + source.getValue() + "' has no value]");
                }
            }

            TemplateOptions o = ctx.getOptions();
            int width = intArg(args, "width", o.getDefaultImageWidth());
            int height = intArg(args, "height", o.getDefaultImageHeight());
            boolean preserve = boolArg(args, "preserveAspectRatio", o.isPreserveImageAspectRatio());

            Path file = resolveFile(path, o.getImageBaseDirectory());
            if (file == null || !Files.isRegularFile(file)) {
                Debug.get().w(TAG, "Image file not found: " + path);
                return FunctionResult.text("[Error: Image file not found: " + path + "]");
            }

            ImageContentType type = ImageContentType.fromFileName(file.getFileName().toString());
            if (type == null) {
                String ext = ImageContentType.extension(file.getFileName().toString());
                Debug.get().w(TAG, "Unsupported image format: " + ext);
                return FunctionResult.text("[Error: Unsupported image format: " + ext + "]");
            }

            DeckShape picture = ctx.getImageEngine().substitute(ctx.getShape(), file, type, width, height, preserve);
            if (picture == null) return FunctionResult.text("[Image processing failed]");

            ctx.markReplaced(picture);
            return FunctionResult.replaced();
        } catch (IOException | RuntimeException e) {
            Debug.get().e(TAG, "Error processing image '" + source.getValue() + "'", e);
            return FunctionResult.text("[Error processing image: " + e.getMessage() + "]");
        }
    }

    /**
     * Path text for a resolved unquoted source, or null when a bound name yields
     * nothing. Names that are not bound at all are literal paths.
     */
    private static String sourcePath(ProcessingContext ctx, FunctionArgument source, EvaluationResult r) {
        switch (r.getKind()) {
            case VALUE: {
                Value v = r.getValue();
                if (v.isNull()) return null;
                String s = ctx.getEvaluator().getFormatter().format(v, null);
                return s.trim().isEmpty() ? null : s.trim();
            }
            case TEXT:
                return r.getText();
            default:
                return ctx.getEnvironment().exists(rootName(source.getValue())) ? null : source.getValue();
        }
    }

    static String rootName(String expr) {
        int end = 0;
        while (end < expr.length() && (Character.isLetterOrDigit(expr.charAt(end)) || expr.charAt(end) == '_')) end++;
        return expr.substring(0, end);
    }

    static Path resolveFile(String path, String baseDirectory) {
        try {
            Path p = Paths.get(path);
            if (!p.isAbsolute() && baseDirectory != null && !baseDirectory.isEmpty()) {
                p = Paths.get(baseDirectory).resolve(p);
            }
            return p;
        } catch (InvalidPathException e) {
            Debug.get().w(TAG, "Invalid image path '" + path + "': " + e.getMessage());
            return null;
        }
    }

    static FunctionArgument firstPositional(List<FunctionArgument> args) {
        for (FunctionArgument a : args) {
            if (!a.isKeyword()) return a;
        }
        return null;
    }

    static int intArg(List<FunctionArgument> args, String name, int def) {
        FunctionArgument a = ArgumentParser.keyword(args, name);
        if (a == null) return def;
        try {
            return Integer.parseInt(a.getValue().trim());
        } catch (NumberFormatException e) {
            Debug.get().w(TAG, "Ignoring " + name + ": '" + a.getValue() + "' is not an integer");
            return def;
        }
    }

    static boolean boolArg(List<FunctionArgument> args, String name, boolean def) {
        FunctionArgument a = ArgumentParser.keyword(args, name);
        if (a == null) return def;
        String v = a.getValue().trim().toLowerCase(Locale.ROOT);
        if (v.equals("true")) return true;
        if (v.equals("false")) return false;
        Debug.get().w(TAG, "Ignoring " + name + ": '" + a.getValue() + "' is not a boolean");
        return def;
    }
}
