package org.adcp.broker.format.model;

import lombok.Builder;
import lombok.Value;

@Builder(toBuilder = true)
@Value
public class FormatRequirements {

    Integer width;

    Integer height;

    Integer minDurationSeconds;

    Integer maxDurationSeconds;

    Integer minFileSizeKb;

    Integer maxFileSizeKb;

    public boolean hasDimensions() {
        return width != null && height != null;
    }
}
