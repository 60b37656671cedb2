package org.adcp.broker.format.model;

import lombok.Builder;
import lombok.Value;

@Builder
@Value
public class FormatFilter {

    private static final FormatFilter EMPTY = FormatFilter.builder().build();

    Integer minWidth;

    Integer maxWidth;

    Integer minHeight;

    Integer maxHeight;

    MediaKind mediaKind;

    String nameSearch;

    public static FormatFilter empty() {
        return EMPTY;
    }

    public boolean hasDimensionBounds() {
        return minWidth != null || maxWidth != null || minHeight != null || maxHeight != null;
    }
}
