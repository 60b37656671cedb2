package org.adcp.broker.util;

import com.fasterxml.jackson.databind.JsonNode;
import org.adcp.broker.MapperTest;
import org.adcp.broker.format.model.FormatDefinition;
import org.adcp.broker.format.model.FormatRequirements;
import org.adcp.broker.format.model.MediaKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class JsonMergeUtilTest extends MapperTest {

    private JsonMergeUtil target;

    @BeforeEach
    public void setUp() {
        target = new JsonMergeUtil(jacksonMapper);
    }

    @Test
    public void mergeShouldReturnOverrideWhenBaseIsNull() {
        // given
        final FormatDefinition override = FormatDefinition.builder().formatId("id").build();

        // when and then
        assertThat(target.merge(null, override, FormatDefinition.class)).isSameAs(override);
    }

    @Test
    public void mergeShouldReturnBaseWhenOverrideIsNull() {
        // given
        final FormatDefinition base = FormatDefinition.builder().formatId("id").build();

        // when and then
        assertThat(target.merge(base, null, FormatDefinition.class)).isSameAs(base);
    }

    @Test
    public void mergeShouldMergeNestedObjectsAndKeepUnsetBaseFields() {
        // given
        final FormatDefinition base = FormatDefinition.builder()
                .formatId("id")
                .mediaKind(MediaKind.VIDEO)
                .requirements(FormatRequirements.builder().width(640).height(360).maxDurationSeconds(30).build())
                .build();
        final FormatDefinition override = FormatDefinition.builder()
                .requirements(FormatRequirements.builder().maxDurationSeconds(15).build())
                .build();

        // when
        final FormatDefinition result = target.merge(base, override, FormatDefinition.class);

        // then
        assertThat(result).isEqualTo(FormatDefinition.builder()
                .formatId("id")
                .mediaKind(MediaKind.VIDEO)
                .requirements(FormatRequirements.builder().width(640).height(360).maxDurationSeconds(15).build())
                .build());
    }

    @Test
    public void mergeJsonsShouldReplaceArraysInsteadOfConcatenating() {
        // given
        final JsonNode base = json("{\"sizes\": [1, 2], \"keep\": true}");
        final JsonNode override = json("{\"sizes\": [3]}");

        // when
        final JsonNode result = target.mergeJsons(base, override);

        // then
        assertThat(result).isEqualTo(json("{\"sizes\": [3], \"keep\": true}"));
    }
}
