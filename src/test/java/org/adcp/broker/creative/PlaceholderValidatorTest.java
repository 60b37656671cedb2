package org.adcp.broker.creative;

import org.adcp.broker.creative.model.CreativeAsset;
import org.adcp.broker.creative.model.PackagePlaceholders;
import org.adcp.broker.creative.model.PlaceholderSlot;
import org.adcp.broker.creative.model.PlaceholderValidationResult;
import org.adcp.broker.creative.model.RejectionReason;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class PlaceholderValidatorTest {

    private PlaceholderValidator target;

    @BeforeEach
    public void setUp() {
        target = new PlaceholderValidator(new CreativeDimensionsResolver());
    }

    @Test
    public void validateShouldAcceptAnySizeForNativeTemplateSlot() {
        // given
        final PlaceholderSlot nativeSlot = PlaceholderSlot.of(1, 1, "12345678", null);

        // when
        final PlaceholderValidationResult result = target.validate(
                asset(1200, 627), List.of(PackagePlaceholders.of("pkg-1", List.of(nativeSlot))));

        // then
        assertThat(result.isAccepted()).isTrue();
        assertThat(result.getMatchedPackageId()).isEqualTo("pkg-1");
        assertThat(result.getMatchedSlot()).isEqualTo(nativeSlot);
    }

    @Test
    public void validateShouldAcceptAnySizeForProgrammaticWildcardSlot() {
        // when
        final PlaceholderValidationResult result = target.validate(
                asset(300, 250), List.of(PackagePlaceholders.of("pkg-1", List.of(PlaceholderSlot.of(1, 1)))));

        // then
        assertThat(result.isAccepted()).isTrue();
        assertThat(result.getMatchedSlot()).isEqualTo(PlaceholderSlot.of(1, 1));
    }

    @Test
    public void validateShouldPreferWildcardOverExactSlotOfSamePackage() {
        // given
        final PackagePlaceholders placeholders = PackagePlaceholders.of("pkg-1",
                List.of(PlaceholderSlot.of(300, 250), PlaceholderSlot.of(1, 1)));

        // when
        final PlaceholderValidationResult result = target.validate(asset(300, 250), List.of(placeholders));

        // then
        assertThat(result.getMatchedSlot()).isEqualTo(PlaceholderSlot.of(1, 1));
    }

    @Test
    public void validateShouldAcceptExactMatchInLaterPackage() {
        // given
        final List<PackagePlaceholders> packages = List.of(
                PackagePlaceholders.of("pkg-1", List.of(PlaceholderSlot.of(300, 250))),
                PackagePlaceholders.of("pkg-2", List.of(PlaceholderSlot.of(728, 90))));

        // when
        final PlaceholderValidationResult result = target.validate(asset(728, 90), packages);

        // then
        assertThat(result.isAccepted()).isTrue();
        assertThat(result.getMatchedPackageId()).isEqualTo("pkg-2");
    }

    @Test
    public void validateShouldRejectSizeMismatchListingAttemptedSlots() {
        // given
        final List<PackagePlaceholders> packages = List.of(
                PackagePlaceholders.of("pkg-1", List.of(PlaceholderSlot.of(300, 250))),
                PackagePlaceholders.of("pkg-2", List.of(PlaceholderSlot.of(300, 600))));

        // when
        final PlaceholderValidationResult result = target.validate(asset(728, 90), packages);

        // then
        assertThat(result.isAccepted()).isFalse();
        assertThat(result.getReason()).isEqualTo(RejectionReason.SLOT_MISMATCH);
        assertThat(result.getAttemptedSlots())
                .containsExactly(PlaceholderSlot.of(300, 250), PlaceholderSlot.of(300, 600));
        assertThat(result.getMessage()).isEqualTo("Creative c1 size 728x90 does not match any of: 300x250, 300x600");
    }

    @Test
    public void validateShouldRejectWhenAssignedPackagesHaveNoSlots() {
        // when
        final PlaceholderValidationResult result = target.validate(
                asset(300, 250), List.of(PackagePlaceholders.of("pkg-1", List.of())));

        // then
        assertThat(result.getReason()).isEqualTo(RejectionReason.NO_PLACEHOLDERS_CONFIGURED);
        assertThat(result.getAttemptedSlots()).isEmpty();
        assertThat(result.getMessage()).contains("pkg-1");
    }

    @Test
    public void validateShouldRejectWhenCreativeIsNotAssigned() {
        // when
        final PlaceholderValidationResult result = target.validate(asset(300, 250), null);

        // then
        assertThat(result.getReason()).isEqualTo(RejectionReason.NO_PLACEHOLDERS_CONFIGURED);
    }

    @Test
    public void validateShouldUseFormatSizeWhenCreativeHasNoDeclaredDimensions() {
        // given
        final CreativeAsset asset = CreativeAsset.builder().creativeId("c1").formatId("display_728x90_image").build();

        // when
        final PlaceholderValidationResult result = target.validate(
                asset, List.of(PackagePlaceholders.of("pkg-1", List.of(PlaceholderSlot.of(728, 90)))));

        // then
        assertThat(result.isAccepted()).isTrue();
    }

    @Test
    public void matchAllShouldReturnEveryPackageTakingTheCreative() {
        // given
        final List<PackagePlaceholders> packages = List.of(
                PackagePlaceholders.of("pkg-1", List.of(PlaceholderSlot.of(300, 250))),
                PackagePlaceholders.of("pkg-2", List.of(PlaceholderSlot.of(728, 90))),
                PackagePlaceholders.of("pkg-3", List.of(PlaceholderSlot.of(1, 1))));

        // when
        final List<PlaceholderValidationResult> result = target.matchAll(asset(300, 250), packages);

        // then
        assertThat(result).extracting(PlaceholderValidationResult::getMatchedPackageId)
                .containsExactly("pkg-1", "pkg-3");
    }

    private static CreativeAsset asset(int width, int height) {
        return CreativeAsset.builder()
                .creativeId("c1")
                .width(width)
                .height(height)
                .build();
    }
}
