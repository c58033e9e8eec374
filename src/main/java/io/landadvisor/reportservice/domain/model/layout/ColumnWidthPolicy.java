package io.landadvisor.reportservice.domain.model.layout;

import java.util.Arrays;

public enum ColumnWidthPolicy {

    /** Equal division of the content width across the header columns. */
    EQUAL,

    /** 35/65 split for two-column label/value tables, equal division otherwise. */
    LABEL_VALUE;

    public float[] widths(int columns, float contentWidth) {
        if (columns <= 0) {
            return new float[0];
        }
        if (this == LABEL_VALUE && columns == 2) {
            return new float[]{contentWidth * 0.35f, contentWidth * 0.65f};
        }
        float[] out = new float[columns];
        Arrays.fill(out, contentWidth / columns);
        return out;
    }
}
