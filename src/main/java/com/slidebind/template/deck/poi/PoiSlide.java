package com.slidebind.template.deck.poi;

import java.awt.geom.Rectangle2D;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.apache.poi.sl.usermodel.PictureData.PictureType;
import org.apache.poi.xslf.usermodel.XMLSlideShow;
import org.apache.poi.xslf.usermodel.XSLFGroupShape;
import org.apache.poi.xslf.usermodel.XSLFNotes;
import org.apache.poi.xslf.usermodel.XSLFPictureData;
import org.apache.poi.xslf.usermodel.XSLFPictureShape;
import org.apache.poi.xslf.usermodel.XSLFRelation;
import org.apache.poi.xslf.usermodel.XSLFShape;
import org.apache.poi.xslf.usermodel.XSLFSlide;
import org.apache.poi.xslf.usermodel.XSLFTextShape;
import org.openxmlformats.schemas.drawingml.x2006.main.CTLineProperties;
import org.openxmlformats.schemas.drawingml.x2006.main.CTNonVisualDrawingProps;
import org.openxmlformats.schemas.drawingml.x2006.main.CTNonVisualPictureProperties;
import org.openxmlformats.schemas.drawingml.x2006.main.CTPictureLocking;
import org.openxmlformats.schemas.drawingml.x2006.main.CTShapeProperties;
import org.openxmlformats.schemas.presentationml.x2006.main.CTPicture;

import com.slidebind.template.deck.DeckShape;
import com.slidebind.template.deck.DeckSlide;
import com.slidebind.template.deck.ImageContentType;
import com.slidebind.template.deck.PictureRequest;

/** XSLF slide. Group members are listed after their group's preceding siblings, in XML order. */
public final class PoiSlide implements DeckSlide {

    /** Width of the outline drawn when the placeholder had none: 1.5 pt. */
    public static final int DEFAULT_OUTLINE_WIDTH = 19050;

    private final XMLSlideShow ppt;
    private final XSLFSlide slide;
    private final int index;

    public PoiSlide(XMLSlideShow ppt, XSLFSlide slide, int index) {
        this.ppt = ppt;
        this.slide = slide;
        this.index = index;
    }

    public XSLFSlide getXSLFSlide() { return slide; }

    @Override
    public int getIndex() { return index; }

    @Override
    public List<DeckShape> getShapes() {
        List<DeckShape> out = new ArrayList<>();
        collect(slide.getShapes(), null, out);
        return out;
    }

    private void collect(List<XSLFShape> shapes, XSLFGroupShape group, List<DeckShape> out) {
        for (XSLFShape s : shapes) {
            if (s instanceof XSLFGroupShape) {
                XSLFGroupShape g = (XSLFGroupShape) s;
                collect(g.getShapes(), g, out);
            } else {
                out.add(new PoiShape(this, s, group));
            }
        }
    }

    @Override
    public int maxShapeId() {
        return maxId(slide.getShapes());
    }

    private static int maxId(List<XSLFShape> shapes) {
        int max = 0;
        for (XSLFShape s : shapes) {
            max = Math.max(max, s.getShapeId());
            if (s instanceof XSLFGroupShape) max = Math.max(max, maxId(((XSLFGroupShape) s).getShapes()));
        }
        return max;
    }

    @Override
    public String getNotesText() {
        XSLFNotes notes = slide.getNotes();
        if (notes == null) return "";
        StringBuilder sb = new StringBuilder();
        for (XSLFShape s : notes.getShapes()) {
            if (!(s instanceof XSLFTextShape)) continue;
            String text = ((XSLFTextShape) s).getText();
            if (text == null || text.isEmpty()) continue;
            if (sb.length() > 0) sb.append('\n');
            sb.append(text);
        }
        return sb.toString();
    }

    @Override
    public boolean hasRelationship(String relationshipId) {
        return slide.getPackagePart().getRelationship(relationshipId) != null;
    }

    /**
     * Everything that can be checked is checked before the package is touched. If
     * a POI call fails after the picture was created, the picture and its
     * relationship are removed again and the placeholder is kept.
     */
    @Override
    public DeckShape replaceWithPicture(DeckShape target, PictureRequest request) throws IOException {
        if (!(target instanceof PoiShape) || target.getSlide() != this) {
            throw new IllegalStateException("Shape " + target + " does not belong to slide " + index);
        }
        PoiShape original = (PoiShape) target;
        if (!original.hasParent()) throw new IllegalStateException("Shape " + target + " has no parent");
        if (hasRelationship(request.getRelationshipId())) {
            throw new IllegalStateException("Relationship id " + request.getRelationshipId() + " already in use");
        }
        if (request.getData().length == 0) throw new IllegalStateException("Image data is empty");
        if (request.getShapeId() <= 0) throw new IllegalStateException("Invalid shape id " + request.getShapeId());

        PictureType type = pictureType(request.getContentType());
        Rectangle2D anchor = PoiShape.toAnchor(request.getGeometry());
        CTLineProperties outline = request.isCloneOutline() ? original.outline() : null;
        CTLineProperties outlineCopy = (outline == null) ? null : (CTLineProperties) outline.copy();

        XSLFPictureData data = ppt.addPicture(request.getData(), type);
        slide.addRelation(request.getRelationshipId(), XSLFRelation.IMAGES, data);
        XSLFPictureShape picture = (original.group != null)
                ? original.group.createPicture(data)
                : slide.createPicture(data);

        try {
            CTPicture ct = (CTPicture) picture.getXmlObject();
            CTNonVisualDrawingProps nv = ct.getNvPicPr().getCNvPr();
            nv.setId(request.getShapeId());
            nv.setName(request.getName());
            picture.setAnchor(anchor);

            CTNonVisualPictureProperties nvPic = ct.getNvPicPr().getCNvPicPr();
            CTPictureLocking locks = nvPic.isSetPicLocks() ? nvPic.getPicLocks() : nvPic.addNewPicLocks();
            locks.setNoChangeAspect(request.isLockAspectRatio());

            CTShapeProperties sp = ct.getSpPr();
            if (outlineCopy != null) {
                sp.setLn(outlineCopy);
            } else {
                CTLineProperties ln = sp.isSetLn() ? sp.getLn() : sp.addNewLn();
                ln.setW(DEFAULT_OUTLINE_WIDTH);
                ln.addNewSolidFill().addNewSrgbClr().setVal(new byte[] { 0, 0, 0 });
            }
        } catch (RuntimeException e) {
            // removing a picture shape also drops its image relationship once unused
            if (original.group != null) original.group.removeShape(picture);
            else slide.removeShape(picture);
            throw new IllegalStateException("Picture setup failed: " + e.getMessage(), e);
        }

        if (original.group != null) original.group.removeShape(original.shape);
        else slide.removeShape(original.shape);

        return new PoiShape(this, picture, original.group);
    }

    static PictureType pictureType(ImageContentType type) {
        switch (type) {
            case PNG: return PictureType.PNG;
            case JPEG: return PictureType.JPEG;
            case GIF: return PictureType.GIF;
            case BMP: return PictureType.BMP;
            case TIFF: return PictureType.TIFF;
            default: throw new IllegalArgumentException("Unsupported content type " + type);
        }
    }
}
