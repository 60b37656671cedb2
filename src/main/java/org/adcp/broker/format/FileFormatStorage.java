package org.adcp.broker.format;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.apache.commons.collections4.ListUtils;
import org.apache.commons.collections4.MapUtils;
import org.apache.commons.lang3.StringUtils;
import org.adcp.broker.exception.InvalidConfigurationException;
import org.adcp.broker.format.model.FormatDefinition;
import org.adcp.broker.format.model.FormatScope;
import org.adcp.broker.format.model.FormatSettingsFile;
import org.adcp.broker.json.ObjectMapperProvider;
import org.adcp.broker.log.Logger;
import org.adcp.broker.log.LoggerFactory;
import org.adcp.broker.util.ResourceUtil;

import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Implementation of {@link FormatStorage}.
 * <p>
 * Reads the standard registry, tenant custom formats and product overrides from a YAML file once
 * and serves them from immutable in-memory maps.
 */
public class FileFormatStorage implements FormatStorage {

    private static final Logger logger = LoggerFactory.getLogger(FileFormatStorage.class);

    private final Map<String, FormatDefinition> standardFormats;
    private final Map<String, Map<String, FormatDefinition>> tenantFormats;
    private final Map<String, Map<String, FormatDefinition>> productOverrides;

    public FileFormatStorage(FormatSettingsFile settingsFile) {
        Objects.requireNonNull(settingsFile);

        standardFormats = index(FormatScope.STANDARD, "registry", settingsFile.getStandardFormats());
        standardFormats.values().forEach(FileFormatStorage::validateStandardFormat);

        tenantFormats = indexByOwner(FormatScope.TENANT, settingsFile.getTenantFormats());
        productOverrides = indexByOwner(FormatScope.PRODUCT, settingsFile.getProductOverrides());

        logger.info("Loaded {} standard format(s), custom formats for {} tenant(s), overrides for {} product(s)",
                standardFormats.size(), tenantFormats.size(), productOverrides.size());
    }

    public static FileFormatStorage fromLocation(String location) {
        final String content;
        try {
            content = ResourceUtil.read(location);
        } catch (IOException | IllegalArgumentException e) {
            throw new InvalidConfigurationException("Failed to read format settings from " + location, e);
        }

        final FormatSettingsFile settingsFile;
        try {
            settingsFile = ObjectMapperProvider.yamlMapper().readValue(content, FormatSettingsFile.class);
        } catch (JsonProcessingException e) {
            throw new InvalidConfigurationException("Corrupted format settings file " + location, e);
        }
        if (settingsFile == null) {
            throw new InvalidConfigurationException("Format settings file %s is empty".formatted(location));
        }
        return new FileFormatStorage(settingsFile);
    }

    @Override
    public Optional<FormatDefinition> lookupProductOverride(String productId, String formatId) {
        return lookup(productOverrides, productId, formatId);
    }

    @Override
    public Optional<FormatDefinition> lookupTenantCustom(String tenantId, String formatId) {
        return lookup(tenantFormats, tenantId, formatId);
    }

    @Override
    public Optional<FormatDefinition> lookupStandard(String formatId) {
        return Optional.ofNullable(formatId).map(standardFormats::get);
    }

    @Override
    public List<FormatDefinition> standardFormats() {
        return List.copyOf(standardFormats.values());
    }

    @Override
    public List<FormatDefinition> tenantFormats(String tenantId) {
        final Map<String, FormatDefinition> formats = tenantId != null ? tenantFormats.get(tenantId) : null;
        return formats != null ? List.copyOf(formats.values()) : Collections.emptyList();
    }

    private static Optional<FormatDefinition> lookup(Map<String, Map<String, FormatDefinition>> ownerToFormats,
                                                     String ownerId,
                                                     String formatId) {

        if (ownerId == null || formatId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(ownerToFormats.get(ownerId)).map(formats -> formats.get(formatId));
    }

    private static Map<String, Map<String, FormatDefinition>> indexByOwner(
            FormatScope scope, Map<String, List<FormatDefinition>> ownerToFormats) {

        final Map<String, Map<String, FormatDefinition>> result = new LinkedHashMap<>();
        MapUtils.emptyIfNull(ownerToFormats).forEach((ownerId, formats) ->
                result.put(ownerId, index(scope, ownerId, formats)));
        return Collections.unmodifiableMap(result);
    }

    private static Map<String, FormatDefinition> index(FormatScope scope,
                                                       String owner,
                                                       List<FormatDefinition> formats) {

        final Map<String, FormatDefinition> result = new LinkedHashMap<>();
        for (FormatDefinition format : ListUtils.emptyIfNull(formats)) {
            final String formatId = format != null ? format.getFormatId() : null;
            if (StringUtils.isBlank(formatId)) {
                throw new InvalidConfigurationException(
                        "Format without format_id in %s scope of %s".formatted(scope, owner));
            }
            if (result.putIfAbsent(formatId, format) != null) {
                throw new InvalidConfigurationException(
                        "Duplicate format_id '%s' in %s scope of %s".formatted(formatId, scope, owner));
            }
        }
        return Collections.unmodifiableMap(result);
    }

    private static void validateStandardFormat(FormatDefinition format) {
        if (format.getMediaKind() == null) {
            throw new InvalidConfigurationException(
                    "Standard format '%s' is missing media_kind".formatted(format.getFormatId()));
        }
    }
}
