package com.slidebind.template.deck;

/**
 * Shape offset and extent in EMU (914400 per inch, 12700 per point).
 */
public final class Geometry {
    public static final int EMU_PER_PIXEL = 9525;

    public final long x;
    public final long y;
    public final long cx;
    public final long cy;

    public Geometry(long x, long y, long cx, long cy) {
        this.x = x;
        this.y = y;
        this.cx = cx;
        this.cy = cy;
    }

    public Geometry withOffset(long nx, long ny) {
        return new Geometry(nx, ny, cx, cy);
    }

    public Geometry withExtent(long ncx, long ncy) {
        return new Geometry(x, y, ncx, ncy);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Geometry)) return false;
        Geometry g = (Geometry) o;
        return x == g.x && y == g.y && cx == g.cx && cy == g.cy;
    }

    @Override
    public int hashCode() {
        int h = Long.hashCode(x);
        h = 31 * h + Long.hashCode(y);
        h = 31 * h + Long.hashCode(cx);
        return 31 * h + Long.hashCode(cy);
    }

    @Override
    public String toString() {
        return "Geometry[off=" + x + "," + y + " ext=" + cx + "x" + cy + "]";
    }
}
