package org.grouping;

/**
 * グループ／クラスの枠（人数の下限・上限付き）
 */
public final class Bin {
    public final int index;
    public final String label;
    public final int minSize;
    public final int maxSize;

    public Bin(int index, String label, int minSize, int maxSize) {
        this.index = index;
        this.label = label;
        this.minSize = minSize;
        this.maxSize = maxSize;
    }

    @Override
    public String toString() {
        return String.format("%s [%d..%d]", label, minSize, maxSize);
    }
}
