package com.slidebind.template.deck;

import java.util.Locale;

/** Raster formats an image placeholder may be replaced with. */
public enum ImageContentType {
    PNG("image/png", "png"),
    JPEG("image/jpeg", "jpg", "jpeg"),
    GIF("image/gif", "gif"),
    BMP("image/bmp", "bmp"),
    TIFF("image/tiff", "tiff", "tif");

    private final String mimeType;
    private final String[] extensions;

    ImageContentType(String mimeType, String... extensions) {
        this.mimeType = mimeType;
        this.extensions = extensions;
    }

    public String getMimeType() { return mimeType; }

    /** Content type for a file name's extension, or null when unsupported. */
    public static ImageContentType fromFileName(String fileName) {
        String ext = extension(fileName);
        if (ext.isEmpty()) return null;
        for (ImageContentType t : values()) {
            for (String e : t.extensions) {
                if (e.equals(ext)) return t;
            }
        }
        return null;
    }

    /** Lower-cased extension without the dot, or empty. */
    public static String extension(String fileName) {
        if (fileName == null) return "";
        int slash = Math.max(fileName.lastIndexOf('/'), fileName.lastIndexOf('\\'));
        int dot = fileName.lastIndexOf('.');
        if (dot <= slash || dot == fileName.length() - 1) return "";
        return fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
