package com.williamcallahan.photo_mosaic_engine.service.image;

import com.williamcallahan.photo_mosaic_engine.model.ColorDescriptor;
import com.williamcallahan.photo_mosaic_engine.model.Tile;
import com.williamcallahan.photo_mosaic_engine.testutil.TestImages;
import org.junit.jupiter.api.Test;

import java.awt.Rectangle;
import java.awt.image.BufferedImage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class TileImageProcessorTest {

    private final TileImageProcessor processor = new TileImageProcessor("bilinear");

    @Test
    void largestSquareIsCentered() {
        assertThat(TileImageProcessor.maxSquareInRect(200, 100)).isEqualTo(new Rectangle(50, 0, 100, 100));
        assertThat(TileImageProcessor.maxSquareInRect(100, 300)).isEqualTo(new Rectangle(0, 100, 100, 100));
        assertThat(TileImageProcessor.maxSquareInRect(64, 64)).isEqualTo(new Rectangle(0, 0, 64, 64));
    }

    @Test
    void producesSquareTileOfRequestedSize() {
        Tile tile = processor.toTile(TestImages.solid(90, 45, TestImages.GREEN), 15, "https://i.example.com/g.png");

        assertThat(tile.getSize()).isEqualTo(15);
        assertThat(tile.getImage().getWidth()).isEqualTo(15);
        assertThat(tile.getImage().getHeight()).isEqualTo(15);
        assertThat(tile.getSourceUrl()).isEqualTo("https://i.example.com/g.png");
    }

    @Test
    void landscapeImagesKeepOnlyTheCenterSquare() {
        BufferedImage source = TestImages.solid(300, 100, TestImages.BLUE);
        TestImages.fill(source, 100, 0, 100, 100, TestImages.RED);

        Tile tile = processor.toTile(source, 10, "center");

        ColorDescriptor average = tile.getDescriptor();
        assertThat(average.red()).isCloseTo(255, within(3));
        assertThat(average.blue()).isCloseTo(0, within(3));
        assertThat(average.alpha()).isCloseTo(255, within(3));
    }

    @Test
    void descriptorMatchesTheTilePixels() {
        Tile tile = processor.toTile(TestImages.solid(40, 40, 0xFF336699), 8, "solid");

        assertThat(tile.getDescriptor().green()).isCloseTo(0x66, within(2));
    }

    @Test
    void bicubicResamplingIsSupported() {
        Tile tile = new TileImageProcessor("BICUBIC").toTile(TestImages.solid(20, 20, TestImages.WHITE), 5, "white");

        assertThat(tile.getSize()).isEqualTo(5);
    }

    @Test
    void rejectsInvalidSettings() {
        assertThatThrownBy(() -> new TileImageProcessor("nearest")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> processor.toTile(TestImages.solid(4, 4, TestImages.WHITE), 0, "x"))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
