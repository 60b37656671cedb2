package org.adcp.broker.creative;

import org.apache.commons.lang3.StringUtils;
import org.adcp.broker.creative.model.CreativeAsset;
import org.adcp.broker.creative.model.CreativeSize;
import org.adcp.broker.log.Logger;
import org.adcp.broker.log.LoggerFactory;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Determines the dimensions of a creative: declared or measured size first, then a {@code WxH} token of
 * its format id (for example {@code display_300x250_image}), then the 300x250 default.
 */
public class CreativeDimensionsResolver {

    private static final Logger logger = LoggerFactory.getLogger(CreativeDimensionsResolver.class);

    private static final Pattern SIZE_TOKEN = Pattern.compile("^(\\d+)x(\\d+)$");
    private static final CreativeSize DEFAULT_SIZE = CreativeSize.of(300, 250);

    public CreativeSize resolve(CreativeAsset asset) {
        if (isPositive(asset.getWidth()) && isPositive(asset.getHeight())) {
            return CreativeSize.of(asset.getWidth(), asset.getHeight());
        }

        final CreativeSize fromFormat = fromFormatId(asset.getFormatId());
        if (fromFormat != null) {
            return fromFormat;
        }

        logger.warn("Could not determine dimensions for creative {}, using {} default",
                asset.getCreativeId(), DEFAULT_SIZE);
        return DEFAULT_SIZE;
    }

    private static CreativeSize fromFormatId(String formatId) {
        if (StringUtils.isBlank(formatId)) {
            return null;
        }
        for (String token : StringUtils.split(formatId.toLowerCase(), '_')) {
            final Matcher matcher = SIZE_TOKEN.matcher(token);
            if (matcher.matches()) {
                try {
                    return CreativeSize.of(Integer.parseInt(matcher.group(1)), Integer.parseInt(matcher.group(2)));
                } catch (NumberFormatException e) {
                    logger.debug("Ignoring oversized dimension token '{}' in format {}", token, formatId);
                }
            }
        }
        return null;
    }

    private static boolean isPositive(Integer value) {
        return value != null && value > 0;
    }
}
