package org.adcp.broker.format;

import org.apache.commons.lang3.StringUtils;
import org.adcp.broker.format.model.FormatDefinition;
import org.adcp.broker.format.model.FormatFilter;
import org.adcp.broker.format.model.FormatRequirements;
import org.adcp.broker.format.model.FormatScope;
import org.adcp.broker.log.Logger;
import org.adcp.broker.log.LoggerFactory;
import org.adcp.broker.util.JsonMergeUtil;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Lists the formats a tenant may use: the standard registry with the tenant's custom formats merged over it.
 */
public class FormatCatalog {

    private static final Logger logger = LoggerFactory.getLogger(FormatCatalog.class);

    private final FormatStorage formatStorage;
    private final JsonMergeUtil jsonMergeUtil;

    public FormatCatalog(FormatStorage formatStorage, JsonMergeUtil jsonMergeUtil) {
        this.formatStorage = Objects.requireNonNull(formatStorage);
        this.jsonMergeUtil = Objects.requireNonNull(jsonMergeUtil);
    }

    public List<FormatDefinition> listAvailableFormats(String tenantId, FormatFilter filter) {
        final FormatFilter effectiveFilter = filter != null ? filter : FormatFilter.empty();
        final Map<String, FormatDefinition> formats = new TreeMap<>();

        for (FormatDefinition standard : formatStorage.standardFormats()) {
            formats.put(standard.getFormatId(), standard.toBuilder().scope(FormatScope.STANDARD).build());
        }

        for (FormatDefinition custom : formatStorage.tenantFormats(tenantId)) {
            final FormatDefinition merged = jsonMergeUtil.merge(
                    formats.get(custom.getFormatId()), custom, FormatDefinition.class);
            if (merged.getMediaKind() == null) {
                logger.warn("Skipping custom format '{}' of tenant {}: no media kind and no standard base",
                        custom.getFormatId(), tenantId);
                continue;
            }
            formats.put(custom.getFormatId(), merged.toBuilder().scope(FormatScope.TENANT).build());
        }

        return formats.values().stream()
                .filter(format -> matches(format, effectiveFilter))
                .sorted(Comparator.comparing(FormatDefinition::getFormatId))
                .toList();
    }

    private static boolean matches(FormatDefinition format, FormatFilter filter) {
        if (filter.getMediaKind() != null && filter.getMediaKind() != format.getMediaKind()) {
            return false;
        }

        if (StringUtils.isNotBlank(filter.getNameSearch())
                && !StringUtils.containsIgnoreCase(format.getName(), filter.getNameSearch())
                && !StringUtils.containsIgnoreCase(format.getFormatId(), filter.getNameSearch())) {
            return false;
        }

        if (!filter.hasDimensionBounds()) {
            return true;
        }

        final FormatRequirements requirements = format.getRequirements();
        if (requirements == null || !requirements.hasDimensions()) {
            return false;
        }
        return within(requirements.getWidth(), filter.getMinWidth(), filter.getMaxWidth())
                && within(requirements.getHeight(), filter.getMinHeight(), filter.getMaxHeight());
    }

    private static boolean within(int value, Integer min, Integer max) {
        return (min == null || value >= min) && (max == null || value <= max);
    }
}
