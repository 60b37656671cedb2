package org.adcp.broker.format;

import org.adcp.broker.MapperTest;
import org.adcp.broker.exception.UnknownFormatException;
import org.adcp.broker.format.model.FormatDefinition;
import org.adcp.broker.format.model.FormatRequirements;
import org.adcp.broker.format.model.FormatScope;
import org.adcp.broker.format.model.MediaKind;
import org.adcp.broker.util.JsonMergeUtil;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoMoreInteractions;

@ExtendWith(MockitoExtension.class)
public class FormatResolverTest extends MapperTest {

    private static final String FORMAT_ID = "display_300x250_image";

    @Mock
    private FormatStorage formatStorage;

    private FormatResolver target;

    @BeforeEach
    public void setUp() {
        target = new FormatResolver(formatStorage, new JsonMergeUtil(jacksonMapper));
    }

    @Test
    public void resolveShouldReturnStandardDefinitionWhenNoOverrideExists() {
        // given
        given(formatStorage.lookupProductOverride(anyString(), anyString())).willReturn(Optional.empty());
        given(formatStorage.lookupTenantCustom(anyString(), anyString())).willReturn(Optional.empty());
        given(formatStorage.lookupStandard(FORMAT_ID)).willReturn(Optional.of(standardFormat()));

        // when
        final FormatDefinition result = target.resolve(FORMAT_ID, "tenant-1", "product-1");

        // then
        assertThat(result.getScope()).isEqualTo(FormatScope.STANDARD);
        assertThat(result.getMediaKind()).isEqualTo(MediaKind.DISPLAY);
        assertThat(result.getRequirements().getWidth()).isEqualTo(300);
    }

    @Test
    public void resolveShouldPreferTenantDefinitionAndInheritStandardFields() {
        // given
        given(formatStorage.lookupTenantCustom("tenant-1", FORMAT_ID)).willReturn(Optional.of(
                FormatDefinition.builder().formatId(FORMAT_ID).name("Tenant rectangle").build()));
        given(formatStorage.lookupStandard(FORMAT_ID)).willReturn(Optional.of(standardFormat()));

        // when
        final FormatDefinition result = target.resolve(FORMAT_ID, "tenant-1", null);

        // then
        assertThat(result.getScope()).isEqualTo(FormatScope.TENANT);
        assertThat(result.getName()).isEqualTo("Tenant rectangle");
        assertThat(result.getMediaKind()).isEqualTo(MediaKind.DISPLAY);
        assertThat(result.getRequirements()).isEqualTo(standardFormat().getRequirements());
    }

    @Test
    public void resolveShouldDeepMergeProductOverrideOverAllLowerScopes() {
        // given
        given(formatStorage.lookupProductOverride("product-1", FORMAT_ID)).willReturn(Optional.of(
                FormatDefinition.builder()
                        .formatId(FORMAT_ID)
                        .placementConfig(jsonObject("""
                                {"gam": {"creative_placeholder": {"expected_creative_count": 2}}}"""))
                        .build()));
        given(formatStorage.lookupTenantCustom("tenant-1", FORMAT_ID)).willReturn(Optional.of(
                FormatDefinition.builder().formatId(FORMAT_ID).name("Tenant rectangle").build()));
        given(formatStorage.lookupStandard(FORMAT_ID)).willReturn(Optional.of(standardFormat()));

        // when
        final FormatDefinition result = target.resolve(FORMAT_ID, "tenant-1", "product-1");

        // then
        assertThat(result.getScope()).isEqualTo(FormatScope.PRODUCT);
        assertThat(result.getName()).isEqualTo("Tenant rectangle");
        assertThat(result.getPlacementConfig()).isEqualTo(json("""
                {"gam": {"creative_placeholder": {"width": 300, "height": 250, "expected_creative_count": 2}}}"""));
    }

    @Test
    public void resolveShouldSkipTenantAndProductScopesWhenIdentifiersAreAbsent() {
        // given
        given(formatStorage.lookupStandard(FORMAT_ID)).willReturn(Optional.of(standardFormat()));

        // when
        target.resolve(FORMAT_ID, null, null);

        // then
        verify(formatStorage).lookupStandard(FORMAT_ID);
        verifyNoMoreInteractions(formatStorage);
    }

    @Test
    public void resolveShouldReturnSameResultForRepeatedCalls() {
        // given
        given(formatStorage.lookupTenantCustom(anyString(), anyString())).willReturn(Optional.empty());
        given(formatStorage.lookupStandard(FORMAT_ID)).willReturn(Optional.of(standardFormat()));

        // when
        final FormatDefinition first = target.resolve(FORMAT_ID, "tenant-1", null);
        final FormatDefinition second = target.resolve(FORMAT_ID, "tenant-1", null);

        // then
        assertThat(first).isEqualTo(second);
    }

    @Test
    public void resolveShouldFailWithSearchedScopesWhenFormatIsUnknown() {
        // given
        given(formatStorage.lookupProductOverride(anyString(), anyString())).willReturn(Optional.empty());
        given(formatStorage.lookupTenantCustom(anyString(), anyString())).willReturn(Optional.empty());
        given(formatStorage.lookupStandard(any())).willReturn(Optional.empty());

        // when and then
        assertThatThrownBy(() -> target.resolve("display_1x2_unknown", "tenant-1", "product-1"))
                .isInstanceOf(UnknownFormatException.class)
                .hasMessage("Unknown format_id 'display_1x2_unknown' "
                        + "(searched: product product-1, tenant tenant-1, standard registry)")
                .satisfies(e -> assertThat(((UnknownFormatException) e).getSearchedScopes())
                        .containsExactly(FormatScope.PRODUCT, FormatScope.TENANT, FormatScope.STANDARD));
    }

    @Test
    public void resolveShouldFailWhenOnlyPartialOverrideExists() {
        // given
        given(formatStorage.lookupProductOverride("product-1", "display_160x600_image")).willReturn(Optional.of(
                FormatDefinition.builder().formatId("display_160x600_image").name("Skyscraper").build()));
        given(formatStorage.lookupStandard("display_160x600_image")).willReturn(Optional.empty());

        // when and then
        assertThatThrownBy(() -> target.resolve("display_160x600_image", null, "product-1"))
                .isInstanceOf(UnknownFormatException.class)
                .hasMessageContaining("only partial overrides")
                .hasMessageContaining("searched: product product-1, standard registry");
    }

    @Test
    public void resolveShouldFailForBlankFormatIdWithoutConsultingStorage() {
        // when and then
        assertThatThrownBy(() -> target.resolve(" ", "tenant-1", null))
                .isInstanceOf(UnknownFormatException.class);
        verifyNoMoreInteractions(formatStorage);
    }

    private static FormatDefinition standardFormat() {
        return FormatDefinition.builder()
                .formatId(FORMAT_ID)
                .name("Medium Rectangle")
                .mediaKind(MediaKind.DISPLAY)
                .requirements(FormatRequirements.builder().width(300).height(250).build())
                .placementConfig(jsonObject("""
                        {"gam": {"creative_placeholder": {"width": 300, "height": 250}}}"""))
                .build();
    }
}
