package org.adcp.broker.creative.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Ad-server reservation describing which creative shape a line item expects. Immutable once the
 * owning package's line items exist.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PlaceholderSlot {

    int width;

    int height;

    String templateId;

    Integer expectedCreativeCount;

    SlotKind kind;

    public static PlaceholderSlot of(int width, int height) {
        return of(width, height, null, null);
    }

    /**
     * A slot taking only creatives of exactly this size, whatever the size. Used for slots derived from
     * format requirements, where a 1x1 size describes a pixel rather than an ad-server wildcard.
     */
    public static PlaceholderSlot exact(int width, int height) {
        return new PlaceholderSlot(width, height, null, null, SlotKind.EXACT);
    }

    /**
     * Every 1x1 slot is a wildcard: bound to a native template when {@code templateId} is present,
     * a programmatic placeholder otherwise.
     */
    public static PlaceholderSlot of(int width, int height, String templateId, Integer expectedCreativeCount) {
        final SlotKind kind;
        if (width == 1 && height == 1) {
            kind = templateId != null ? SlotKind.NATIVE_TEMPLATE : SlotKind.PROGRAMMATIC_WILDCARD;
        } else {
            kind = SlotKind.EXACT;
        }
        return new PlaceholderSlot(width, height, templateId, expectedCreativeCount, kind);
    }

    public PlaceholderSlot withExpectedCreativeCount(Integer expectedCreativeCount) {
        return new PlaceholderSlot(width, height, templateId, expectedCreativeCount, kind);
    }

    public boolean accepts(CreativeSize size) {
        return kind.isWildcard() || (size.getWidth() == width && size.getHeight() == height);
    }

    public String describe() {
        return switch (kind) {
            case EXACT -> width + "x" + height;
            case NATIVE_TEMPLATE -> "%dx%d (native template %s)".formatted(width, height, templateId);
            case PROGRAMMATIC_WILDCARD -> "%dx%d (wildcard)".formatted(width, height);
        };
    }
}
