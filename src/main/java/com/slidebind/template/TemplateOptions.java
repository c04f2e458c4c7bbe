package com.slidebind.template;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.slidebind.template.parser.UnresolvedPolicy;

/**
 * Binder settings. Plain bean so it can be read from JSON; the shipped defaults
 * live in {@code slidebind-defaults.json}.
 */
public class TemplateOptions {

    public static final String DEFAULTS_RESOURCE = "/slidebind-defaults.json";

    private static final ObjectMapper om = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private boolean registerBuiltInFunctions = true;
    private boolean registerGlobalVariables = true;
    private int defaultImageWidth = 300;
    private int defaultImageHeight = 200;
    private boolean preserveImageAspectRatio = true;
    private int maxSlidesFromTemplate = 100;
    private int maxItemsPerSlide = 30;
    private UnresolvedPolicy unresolvedPolicy = UnresolvedPolicy.EMPTY;
    private String locale = "en-US";
    private String imageBaseDirectory;

    /** Options from the bundled defaults resource. */
    public static TemplateOptions defaults() {
        try (InputStream in = TemplateOptions.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) return new TemplateOptions();
            return fromJson(in);
        } catch (IOException e) {
            throw new TemplateException("Cannot read " + DEFAULTS_RESOURCE, e);
        }
    }

    /** Reads options from JSON; missing fields keep their defaults, unknown ones are ignored. */
    public static TemplateOptions fromJson(InputStream in) throws IOException {
        return om.readValue(in, TemplateOptions.class);
    }

    public boolean isRegisterBuiltInFunctions() { return registerBuiltInFunctions; }
    public void setRegisterBuiltInFunctions(boolean v) { this.registerBuiltInFunctions = v; }

    public boolean isRegisterGlobalVariables() { return registerGlobalVariables; }
    public void setRegisterGlobalVariables(boolean v) { this.registerGlobalVariables = v; }

    public int getDefaultImageWidth() { return defaultImageWidth; }
    public void setDefaultImageWidth(int v) { this.defaultImageWidth = v; }

    public int getDefaultImageHeight() { return defaultImageHeight; }
    public void setDefaultImageHeight(int v) { this.defaultImageHeight = v; }

    public boolean isPreserveImageAspectRatio() { return preserveImageAspectRatio; }
    public void setPreserveImageAspectRatio(boolean v) { this.preserveImageAspectRatio = v; }

    public int getMaxSlidesFromTemplate() { return maxSlidesFromTemplate; }
    public void setMaxSlidesFromTemplate(int v) { this.maxSlidesFromTemplate = v; }

    public int getMaxItemsPerSlide() { return maxItemsPerSlide; }
    public void setMaxItemsPerSlide(int v) { this.maxItemsPerSlide = v; }

    public UnresolvedPolicy getUnresolvedPolicy() { return unresolvedPolicy; }
    public void setUnresolvedPolicy(UnresolvedPolicy v) {
        this.unresolvedPolicy = (v == null) ? UnresolvedPolicy.EMPTY : v;
    }

    /** BCP 47 language tag. */
    public String getLocale() { return locale; }
    public void setLocale(String v) { this.locale = (v == null || v.trim().isEmpty()) ? "en-US" : v.trim(); }

    public Locale toLocale() { return Locale.forLanguageTag(locale); }

    /** Directory relative image paths resolve against; null means the working directory. */
    public String getImageBaseDirectory() { return imageBaseDirectory; }
    public void setImageBaseDirectory(String v) { this.imageBaseDirectory = v; }
}
