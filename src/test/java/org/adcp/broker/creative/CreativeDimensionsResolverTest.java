package org.adcp.broker.creative;

import org.adcp.broker.creative.model.CreativeAsset;
import org.adcp.broker.creative.model.CreativeSize;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class CreativeDimensionsResolverTest {

    private CreativeDimensionsResolver target;

    @BeforeEach
    public void setUp() {
        target = new CreativeDimensionsResolver();
    }

    @Test
    public void resolveShouldPreferDeclaredDimensions() {
        // given
        final CreativeAsset asset = CreativeAsset.builder()
                .creativeId("c1")
                .formatId("display_728x90_image")
                .width(1200)
                .height(627)
                .build();

        // when and then
        assertThat(target.resolve(asset)).isEqualTo(CreativeSize.of(1200, 627));
    }

    @Test
    public void resolveShouldParseSizeTokenOfFormatIdWhenDimensionsAreMissing() {
        // given
        final CreativeAsset asset = CreativeAsset.builder().creativeId("c1").formatId("display_728x90_image").build();

        // when and then
        assertThat(target.resolve(asset)).isEqualTo(CreativeSize.of(728, 90));
    }

    @Test
    public void resolveShouldIgnoreNonPositiveDeclaredDimensions() {
        // given
        final CreativeAsset asset = CreativeAsset.builder()
                .creativeId("c1")
                .formatId("display_320x50_image")
                .width(0)
                .height(50)
                .build();

        // when and then
        assertThat(target.resolve(asset)).isEqualTo(CreativeSize.of(320, 50));
    }

    @Test
    public void resolveShouldFallBackToMediumRectangle() {
        // given
        final CreativeAsset asset = CreativeAsset.builder().creativeId("c1").formatId("native_in_feed").build();

        // when and then
        assertThat(target.resolve(asset)).isEqualTo(CreativeSize.of(300, 250));
    }
}
