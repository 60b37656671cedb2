package org.adcp.broker.creative.model;

import lombok.Builder;
import lombok.Value;
import org.apache.commons.collections4.MapUtils;
import org.apache.commons.lang3.StringUtils;
import org.adcp.broker.format.model.MediaKind;

import java.util.List;
import java.util.Map;

/**
 * A creative submitted by the buyer. {@code width}/{@code height} are measured when the asset is hosted
 * and declared otherwise (third-party tags cannot be measured).
 */
@Builder(toBuilder = true)
@Value
public class CreativeAsset {

    private static final String[] HTML5_EXTENSIONS = {".html", ".htm", ".html5", ".zip"};

    String creativeId;

    String name;

    String formatId;

    MediaKind mediaKind;

    Integer width;

    Integer height;

    String mediaUrl;

    String thirdPartyUrl;

    String snippet;

    String snippetType;

    Map<String, String> templateVariables;

    List<String> packageAssignments;

    public CreativeType creativeType() {
        if (StringUtils.isNoneBlank(snippet, snippetType)) {
            return StringUtils.equalsAny(snippetType, "vast_xml", "vast_url")
                    ? CreativeType.VAST
                    : CreativeType.THIRD_PARTY_TAG;
        }
        if (MapUtils.isNotEmpty(templateVariables)) {
            return CreativeType.NATIVE;
        }
        if (StringUtils.isNotBlank(thirdPartyUrl)) {
            return CreativeType.THIRD_PARTY_TAG;
        }
        if (StringUtils.endsWithAny(StringUtils.lowerCase(mediaUrl), HTML5_EXTENSIONS)
                || StringUtils.containsIgnoreCase(formatId, "html5")
                || StringUtils.containsIgnoreCase(formatId, "rich_media")) {
            return CreativeType.HTML5;
        }
        return CreativeType.HOSTED_ASSET;
    }
}
