package org.adcp.broker.creative;

import com.fasterxml.jackson.databind.JsonNode;
import org.adcp.broker.creative.model.PlaceholderSlot;
import org.adcp.broker.format.model.FormatDefinition;
import org.adcp.broker.format.model.FormatRequirements;
import org.adcp.broker.log.Logger;
import org.adcp.broker.log.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Derives the placeholder slots of a package from its resolved formats.
 * <p>
 * The {@code creative_placeholder} block of the ad server's placement configuration takes precedence
 * over the format's requirement dimensions. Only the placement block can declare a 1x1 wildcard, slots
 * taken from requirement dimensions always require the exact size. Formats providing neither (audio, for instance) contribute
 * no slot.
 */
public class PlaceholderSlotFactory {

    private static final Logger logger = LoggerFactory.getLogger(PlaceholderSlotFactory.class);

    private static final String CREATIVE_PLACEHOLDER = "creative_placeholder";
    private static final String WIDTH = "width";
    private static final String HEIGHT = "height";
    private static final String TEMPLATE_ID = "creative_template_id";
    private static final String EXPECTED_CREATIVE_COUNT = "expected_creative_count";

    private final String adServer;

    public PlaceholderSlotFactory(String adServer) {
        this.adServer = Objects.requireNonNull(adServer);
    }

    public PlaceholderSlot fromFormat(FormatDefinition format) {
        final JsonNode placeholder = placeholderConfig(format);
        if (placeholder != null && placeholder.path(WIDTH).canConvertToInt()
                && placeholder.path(HEIGHT).canConvertToInt()) {

            final JsonNode templateId = placeholder.get(TEMPLATE_ID);
            final JsonNode expectedCount = placeholder.get(EXPECTED_CREATIVE_COUNT);
            return PlaceholderSlot.of(
                    placeholder.get(WIDTH).asInt(),
                    placeholder.get(HEIGHT).asInt(),
                    templateId != null && !templateId.isNull() ? templateId.asText() : null,
                    expectedCount != null && expectedCount.canConvertToInt() ? expectedCount.asInt() : null);
        }

        final FormatRequirements requirements = format.getRequirements();
        if (requirements != null && requirements.hasDimensions()) {
            return PlaceholderSlot.exact(requirements.getWidth(), requirements.getHeight());
        }

        logger.debug("Format '{}' defines no placeholder for ad server {}", format.getFormatId(), adServer);
        return null;
    }

    /**
     * Builds the slots of one package. Identical slots are collapsed into one whose expected creative
     * count is the sum of the collapsed slots (a missing count counts as one).
     */
    public List<PlaceholderSlot> slotsFor(List<FormatDefinition> formats) {
        final Map<String, PlaceholderSlot> slots = new LinkedHashMap<>();
        for (FormatDefinition format : formats) {
            final PlaceholderSlot slot = fromFormat(format);
            if (slot == null) {
                continue;
            }
            slots.merge(slot.describe(), slot, (existing, duplicate) -> existing.withExpectedCreativeCount(
                    countOf(existing) + countOf(duplicate)));
        }
        return List.copyOf(slots.values());
    }

    private JsonNode placeholderConfig(FormatDefinition format) {
        final JsonNode adServerConfig = format.placementConfigFor(adServer);
        final JsonNode placeholder = adServerConfig != null ? adServerConfig.get(CREATIVE_PLACEHOLDER) : null;
        return placeholder != null && placeholder.isObject() ? placeholder : null;
    }

    private static int countOf(PlaceholderSlot slot) {
        return slot.getExpectedCreativeCount() != null ? slot.getExpectedCreativeCount() : 1;
    }
}
