package com.williamcallahan.photo_mosaic_engine.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MosaicGridTest {

    @Test
    void exactMultipleGivesSixteenCells() {
        MosaicGrid grid = MosaicGrid.forImage(100, 100, 25);

        assertThat(grid.numTilesX()).isEqualTo(4);
        assertThat(grid.numTilesY()).isEqualTo(4);
        assertThat(grid.cellCount()).isEqualTo(16);
        assertThat(grid.width()).isEqualTo(100);
        assertThat(grid.height()).isEqualTo(100);
    }

    @Test
    void remainderIsCropped() {
        MosaicGrid grid = MosaicGrid.forImage(110, 74, 25);

        assertThat(grid.width()).isEqualTo(100);
        assertThat(grid.height()).isEqualTo(50);
    }

    @Test
    void imageSmallerThanATileGivesEmptyGrid() {
        assertThat(MosaicGrid.forImage(24, 300, 25).isEmpty()).isTrue();
    }

    @Test
    void rejectsNonPositiveTileSize() {
        assertThatThrownBy(() -> MosaicGrid.forImage(100, 100, 0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void colorDescriptorRoundTripsPackedArgb() {
        ColorDescriptor descriptor = ColorDescriptor.fromArgb(0x80FF1020);

        assertThat(descriptor).isEqualTo(new ColorDescriptor(0xFF, 0x10, 0x20, 0x80));
        assertThat(descriptor.toArgb()).isEqualTo(0x80FF1020);
        assertThatThrownBy(() -> new ColorDescriptor(256, 0, 0, 0)).isInstanceOf(IllegalArgumentException.class);
    }
}
