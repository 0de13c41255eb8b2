package com.williamcallahan.photo_mosaic_engine.types;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MatchingStrategyTest {

    @Test
    void parsesConfigurationSpelling() {
        assertThat(MatchingStrategy.fromValue("color")).isEqualTo(MatchingStrategy.COLOR);
        assertThat(MatchingStrategy.fromValue("image-variance")).isEqualTo(MatchingStrategy.IMAGE_VARIANCE);
    }

    @Test
    void parsesEnumNamesCaseInsensitively() {
        assertThat(MatchingStrategy.fromValue(" IMAGE_VARIANCE ")).isEqualTo(MatchingStrategy.IMAGE_VARIANCE);
        assertThat(MatchingStrategy.fromValue("Color")).isEqualTo(MatchingStrategy.COLOR);
    }

    @Test
    void rejectsUnknownOrBlankValues() {
        assertThatThrownBy(() -> MatchingStrategy.fromValue("histogram"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("histogram");
        assertThatThrownBy(() -> MatchingStrategy.fromValue(" "))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void listingProviderParsesDisplayAgnosticNames() {
        assertThat(ListingProvider.fromValue("reddit")).isEqualTo(ListingProvider.REDDIT);
        assertThat(ListingProvider.fromValue("IMGUR").getDisplayName()).isEqualTo("Imgur");
        assertThatThrownBy(() -> ListingProvider.fromValue("flickr"))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
