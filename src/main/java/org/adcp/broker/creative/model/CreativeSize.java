package org.adcp.broker.creative.model;

import lombok.Value;

@Value(staticConstructor = "of")
public class CreativeSize {

    int width;

    int height;

    @Override
    public String toString() {
        return width + "x" + height;
    }
}
