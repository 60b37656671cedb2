package org.adcp.broker.targeting;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.lang3.StringUtils;
import org.adcp.broker.exception.InvalidConfigurationException;
import org.adcp.broker.json.ObjectMapperProvider;
import org.adcp.broker.log.Logger;
import org.adcp.broker.log.LoggerFactory;
import org.adcp.broker.targeting.model.AccessClass;
import org.adcp.broker.targeting.model.ClassificationFile;
import org.adcp.broker.targeting.model.DimensionClassification;
import org.adcp.broker.util.ResourceUtil;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Loads the {@link TargetingClassification} from a YAML file once per process.
 * <p>
 * A malformed table is fatal: every problem raises {@link InvalidConfigurationException}.
 */
public class TargetingClassificationLoader {

    private static final Logger logger = LoggerFactory.getLogger(TargetingClassificationLoader.class);

    private TargetingClassificationLoader() {
    }

    public static TargetingClassification load(String location) {
        final String content;
        try {
            content = ResourceUtil.read(location);
        } catch (IOException | IllegalArgumentException e) {
            throw new InvalidConfigurationException("Failed to read targeting classification from " + location, e);
        }

        final ClassificationFile file;
        try {
            file = ObjectMapperProvider.yamlMapper().readValue(content, ClassificationFile.class);
        } catch (JsonProcessingException e) {
            throw new InvalidConfigurationException("Malformed targeting classification " + location, e);
        }

        final TargetingClassification classification = toClassification(file, location);
        logger.info("Loaded {} targeting dimension(s) from {}", classification.size(), location);
        return classification;
    }

    static TargetingClassification toClassification(ClassificationFile file, String location) {
        if (file == null || CollectionUtils.isEmpty(file.getDimensions())) {
            throw new InvalidConfigurationException("Targeting classification %s declares no dimensions"
                    .formatted(location));
        }

        final Map<String, AccessClass> dimensionToAccess = new LinkedHashMap<>();
        for (DimensionClassification dimension : file.getDimensions()) {
            if (dimension == null || StringUtils.isBlank(dimension.getName())) {
                throw new InvalidConfigurationException("Targeting classification %s has a dimension without name"
                        .formatted(location));
            }
            if (dimension.getAccess() == null) {
                throw new InvalidConfigurationException("Dimension '%s' in %s has no access class"
                        .formatted(dimension.getName(), location));
            }
            if (dimensionToAccess.putIfAbsent(dimension.getName(), dimension.getAccess()) != null) {
                throw new InvalidConfigurationException("Dimension '%s' is declared twice in %s"
                        .formatted(dimension.getName(), location));
            }
        }
        return TargetingClassification.of(dimensionToAccess);
    }
}
