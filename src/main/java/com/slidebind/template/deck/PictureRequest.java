package com.slidebind.template.deck;

import java.util.Objects;

/**
 * Everything needed to swap a placeholder shape for a picture. Built and
 * validated before the document is touched.
 */
public final class PictureRequest {
    private final int shapeId;
    private final String name;
    private final Geometry geometry;
    private final boolean cloneOutline;
    private final boolean lockAspectRatio;
    private final String relationshipId;
    private final ImageContentType contentType;
    private final byte[] data;

    public PictureRequest(int shapeId, String name, Geometry geometry, boolean cloneOutline,
                          boolean lockAspectRatio, String relationshipId,
                          ImageContentType contentType, byte[] data) {
        this.shapeId = shapeId;
        this.name = Objects.requireNonNull(name, "name");
        this.geometry = Objects.requireNonNull(geometry, "geometry");
        this.cloneOutline = cloneOutline;
        this.lockAspectRatio = lockAspectRatio;
        this.relationshipId = Objects.requireNonNull(relationshipId, "relationshipId");
        this.contentType = Objects.requireNonNull(contentType, "contentType");
        this.data = Objects.requireNonNull(data, "data");
    }

    public int getShapeId() { return shapeId; }
    public String getName() { return name; }
    public Geometry getGeometry() { return geometry; }
    /** Copy the original's outline; otherwise draw the default one. */
    public boolean isCloneOutline() { return cloneOutline; }
    public boolean isLockAspectRatio() { return lockAspectRatio; }
    public String getRelationshipId() { return relationshipId; }
    public ImageContentType getContentType() { return contentType; }
    public byte[] getData() { return data; }

    @Override
    public String toString() {
        return "PictureRequest[id=" + shapeId + ", name=" + name + ", " + geometry
                + ", rel=" + relationshipId + ", " + contentType + ", " + data.length + " bytes]";
    }
}
