package org.adcp.broker.creative.model;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

public class CreativeAssetTest {

    @Test
    public void creativeTypeShouldDetectVastSnippets() {
        // given
        final CreativeAsset asset = CreativeAsset.builder()
                .snippet("<VAST version=\"4.0\"/>")
                .snippetType("vast_xml")
                .build();

        // when and then
        assertThat(asset.creativeType()).isEqualTo(CreativeType.VAST);
    }

    @Test
    public void creativeTypeShouldTreatOtherSnippetsAsThirdPartyTags() {
        // given
        final CreativeAsset asset = CreativeAsset.builder()
                .snippet("<script src=\"https://ads.example/tag.js\"></script>")
                .snippetType("javascript")
                .build();

        // when and then
        assertThat(asset.creativeType()).isEqualTo(CreativeType.THIRD_PARTY_TAG);
    }

    @Test
    public void creativeTypeShouldDetectNativeFromTemplateVariables() {
        // given
        final CreativeAsset asset = CreativeAsset.builder()
                .templateVariables(Map.of("headline", "Spring sale"))
                .build();

        // when and then
        assertThat(asset.creativeType()).isEqualTo(CreativeType.NATIVE);
    }

    @Test
    public void creativeTypeShouldDetectHtml5FromMediaUrlOrFormat() {
        // when and then
        assertThat(CreativeAsset.builder().mediaUrl("https://cdn.example/ad/INDEX.HTML").build().creativeType())
                .isEqualTo(CreativeType.HTML5);
        assertThat(CreativeAsset.builder().formatId("display_300x250_html5").build().creativeType())
                .isEqualTo(CreativeType.HTML5);
    }

    @Test
    public void creativeTypeShouldDefaultToHostedAsset() {
        // given
        final CreativeAsset asset = CreativeAsset.builder().mediaUrl("https://cdn.example/banner.png").build();

        // when and then
        assertThat(asset.creativeType()).isEqualTo(CreativeType.HOSTED_ASSET);
    }
}
