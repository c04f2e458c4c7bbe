package com.slidebind.template.layout;

/**
 * The slice of a collection one paginated slide shows: items
 * {@code [startIndex, startIndex + itemsPerSlide)} of {@code totalCount}.
 */
public final class RepeatWindow {
    private final String arrayName;
    private final int startIndex;
    private final int itemsPerSlide;
    private final int totalCount;

    public RepeatWindow(String arrayName, int startIndex, int itemsPerSlide, int totalCount) {
        if (arrayName == null || arrayName.isEmpty()) throw new IllegalArgumentException("arrayName is empty");
        if (startIndex < 0 || itemsPerSlide < 0 || totalCount < 0) {
            throw new IllegalArgumentException("negative window " + startIndex + "/" + itemsPerSlide + "/" + totalCount);
        }
        this.arrayName = arrayName;
        this.startIndex = startIndex;
        this.itemsPerSlide = itemsPerSlide;
        this.totalCount = totalCount;
    }

    public String getArrayName() { return arrayName; }
    public int getStartIndex() { return startIndex; }
    public int getItemsPerSlide() { return itemsPerSlide; }
    public int getTotalCount() { return totalCount; }

    /** Items actually present in this window. */
    public int available() {
        return Math.max(0, Math.min(totalCount - startIndex, itemsPerSlide));
    }

    /** Count to compare absolute (already shifted) indexes against. */
    public int upperBound() {
        return startIndex + available();
    }

    @Override
    public String toString() {
        return "RepeatWindow[" + arrayName + " " + startIndex + "+" + itemsPerSlide + " of " + totalCount + "]";
    }
}
