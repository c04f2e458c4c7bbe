package com.slidebind.template.deck.poi;

import java.awt.geom.Rectangle2D;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.poi.sl.usermodel.PlaceableShape;
import org.apache.poi.util.Units;
import org.apache.poi.xslf.usermodel.XSLFGroupShape;
import org.apache.poi.xslf.usermodel.XSLFShape;
import org.apache.poi.xslf.usermodel.XSLFTextParagraph;
import org.apache.poi.xslf.usermodel.XSLFTextShape;
import org.apache.xmlbeans.XmlObject;
import org.openxmlformats.schemas.drawingml.x2006.main.CTLineProperties;
import org.openxmlformats.schemas.drawingml.x2006.main.CTNonVisualDrawingProps;
import org.openxmlformats.schemas.drawingml.x2006.main.CTShapeProperties;
import org.openxmlformats.schemas.presentationml.x2006.main.CTConnector;
import org.openxmlformats.schemas.presentationml.x2006.main.CTGraphicalObjectFrame;
import org.openxmlformats.schemas.presentationml.x2006.main.CTGroupShape;
import org.openxmlformats.schemas.presentationml.x2006.main.CTPicture;
import org.openxmlformats.schemas.presentationml.x2006.main.CTShape;
import org.w3c.dom.Node;

import com.slidebind.template.deck.DeckParagraph;
import com.slidebind.template.deck.DeckRun;
import com.slidebind.template.deck.DeckShape;
import com.slidebind.template.deck.DeckSlide;
import com.slidebind.template.deck.Geometry;

/**
 * XSLF shape. Geometry is converted between POI's points and EMU; the hidden
 * flag and outline are read from the shape XML.
 */
public final class PoiShape implements DeckShape {
    private final PoiSlide slide;
    final XSLFShape shape;
    /** Enclosing group, or null for shapes directly on the slide. */
    final XSLFGroupShape group;

    PoiShape(PoiSlide slide, XSLFShape shape, XSLFGroupShape group) {
        this.slide = slide;
        this.shape = shape;
        this.group = group;
    }

    public XSLFShape getXSLFShape() { return shape; }

    @Override
    public int getId() { return shape.getShapeId(); }

    @Override
    public String getName() {
        String n = shape.getShapeName();
        return (n == null) ? "" : n;
    }

    @Override
    public boolean hasTextBody() {
        return shape instanceof XSLFTextShape;
    }

    @Override
    public List<DeckParagraph> getParagraphs() {
        if (!(shape instanceof XSLFTextShape)) return Collections.emptyList();
        List<DeckParagraph> out = new ArrayList<>();
        for (XSLFTextParagraph p : ((XSLFTextShape) shape).getTextParagraphs()) out.add(new PoiParagraph(p));
        return out;
    }

    @Override
    public Geometry getGeometry() {
        Rectangle2D a = shape.getAnchor();
        if (a == null) return null;
        return new Geometry(Units.toEMU(a.getX()), Units.toEMU(a.getY()),
                Units.toEMU(a.getWidth()), Units.toEMU(a.getHeight()));
    }

    @Override
    public void setGeometry(Geometry g) {
        if (g == null) return;
        if (!(shape instanceof PlaceableShape)) {
            throw new IllegalStateException("Shape '" + getName() + "' cannot be positioned");
        }
        ((PlaceableShape<?, ?>) shape).setAnchor(toAnchor(g));
    }

    static Rectangle2D toAnchor(Geometry g) {
        return new Rectangle2D.Double(Units.toPoints(g.x), Units.toPoints(g.y),
                Units.toPoints(g.cx), Units.toPoints(g.cy));
    }

    @Override
    public boolean isHidden() {
        CTNonVisualDrawingProps p = cNvPr(shape.getXmlObject());
        return p != null && p.isSetHidden() && p.getHidden();
    }

    @Override
    public void setHidden(boolean hidden) {
        CTNonVisualDrawingProps p = cNvPr(shape.getXmlObject());
        if (p == null) return;
        if (hidden) p.setHidden(true);
        else if (p.isSetHidden()) p.unsetHidden();
    }

    @Override
    public void clearText() {
        for (DeckParagraph p : getParagraphs()) {
            for (DeckRun r : p.getRuns()) {
                if (r.isWritable()) r.setText("");
            }
        }
    }

    @Override
    public boolean hasParent() {
        Node node = shape.getXmlObject().getDomNode();
        return node != null && node.getParentNode() != null;
    }

    @Override
    public boolean hasOutline() {
        return outline() != null;
    }

    @Override
    public DeckSlide getSlide() { return slide; }

    /** The shape's own line properties, or null. */
    CTLineProperties outline() {
        CTShapeProperties sp = spPr(shape.getXmlObject());
        return (sp != null && sp.isSetLn()) ? sp.getLn() : null;
    }

    static CTNonVisualDrawingProps cNvPr(XmlObject xml) {
        if (xml instanceof CTShape) return ((CTShape) xml).getNvSpPr().getCNvPr();
        if (xml instanceof CTPicture) return ((CTPicture) xml).getNvPicPr().getCNvPr();
        if (xml instanceof CTConnector) return ((CTConnector) xml).getNvCxnSpPr().getCNvPr();
        if (xml instanceof CTGroupShape) return ((CTGroupShape) xml).getNvGrpSpPr().getCNvPr();
        if (xml instanceof CTGraphicalObjectFrame) return ((CTGraphicalObjectFrame) xml).getNvGraphicFramePr().getCNvPr();
        return null;
    }

    private static CTShapeProperties spPr(XmlObject xml) {
        if (xml instanceof CTShape) return ((CTShape) xml).getSpPr();
        if (xml instanceof CTPicture) return ((CTPicture) xml).getSpPr();
        if (xml instanceof CTConnector) return ((CTConnector) xml).getSpPr();
        return null;
    }

    @Override
    public boolean equals(Object o) {
        return (o instanceof PoiShape) && ((PoiShape) o).shape == shape;
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(shape);
    }

    @Override
    public String toString() {
        return "PoiShape[" + getId() + " '" + getName() + "']";
    }
}
