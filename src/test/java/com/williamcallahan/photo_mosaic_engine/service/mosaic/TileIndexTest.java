package com.williamcallahan.photo_mosaic_engine.service.mosaic;

import com.williamcallahan.photo_mosaic_engine.exception.EmptyTileIndexException;
import com.williamcallahan.photo_mosaic_engine.model.ColorDescriptor;
import com.williamcallahan.photo_mosaic_engine.model.Tile;
import com.williamcallahan.photo_mosaic_engine.testutil.TestImages;
import com.williamcallahan.photo_mosaic_engine.types.MatchingStrategy;
import com.williamcallahan.photo_mosaic_engine.util.ColorProfiler;
import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TileIndexTest {

    @Test
    void nearestByColorPicksTheClosestTile() {
        Tile black = TestImages.solidTile(4, 0x00000000);
        Tile white = TestImages.solidTile(4, 0x00FFFFFF);
        Tile gray = TestImages.solidTile(4, 0x00808080);
        TileIndex index = new TileIndex(List.of(white, gray, black));

        assertThat(index.nearestByColor(new ColorDescriptor(10, 10, 10, 0))).isSameAs(black);
        assertThat(index.nearestByColor(new ColorDescriptor(140, 120, 130, 0))).isSameAs(gray);
    }

    @Test
    void nearestByColorBreaksTiesByInsertionOrder() {
        Tile darker = TestImages.solidTile(4, 0xFF000000);
        Tile lighter = TestImages.solidTile(4, 0xFF0A0A0A);
        ColorDescriptor midway = new ColorDescriptor(5, 5, 5, 255);

        assertThat(new TileIndex(List.of(darker, lighter)).nearestByColor(midway)).isSameAs(darker);
        assertThat(new TileIndex(List.of(lighter, darker)).nearestByColor(midway)).isSameAs(lighter);
    }

    @Test
    void identicalDescriptorsResolveToTheFirstTile() {
        Tile first = TestImages.solidTile(4, TestImages.RED);
        Tile second = TestImages.solidTile(4, TestImages.RED);

        assertThat(new TileIndex(List.of(first, second)).nearestByColor(first.getDescriptor())).isSameAs(first);
    }

    @Test
    void nearestTileIsNeverFartherThanAnyOther() {
        List<Tile> tiles = new ArrayList<>();
        for (int shade = 0; shade < 256; shade += 37) {
            tiles.add(TestImages.solidTile(2, 0xFF000000 | (shade << 16) | ((255 - shade) << 8) | (shade / 2)));
        }
        TileIndex index = new TileIndex(tiles);
        ColorDescriptor query = new ColorDescriptor(90, 150, 20, 255);

        Tile nearest = index.nearestByColor(query);

        long best = ColorProfiler.colorDistance(query, nearest.getDescriptor());
        for (Tile tile : tiles) {
            assertThat(best).isLessThanOrEqualTo(ColorProfiler.colorDistance(query, tile.getDescriptor()));
        }
    }

    @Test
    void emptyIndexIsRejectedAtConstruction() {
        assertThatThrownBy(() -> new TileIndex(List.of())).isInstanceOf(EmptyTileIndexException.class);
        assertThatThrownBy(() -> new TileIndex(null)).isInstanceOf(EmptyTileIndexException.class);
    }

    @Test
    void mixedTileSizesAreRejected() {
        assertThatThrownBy(() -> new TileIndex(List.of(TestImages.solidTile(4, TestImages.RED), TestImages.solidTile(5, TestImages.RED))))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void strategiesDisagreeWhenStructureDiffersButAveragesMatch() {
        BufferedImage cell = TestImages.solid(4, 4, TestImages.WHITE);
        TestImages.fill(cell, 0, 0, 2, 4, TestImages.BLACK);

        Tile flatGray = TestImages.solidTile(4, 0xFF7F7F7F);
        BufferedImage mirrored = TestImages.solid(4, 4, TestImages.BLACK);
        TestImages.fill(mirrored, 0, 0, 2, 4, TestImages.WHITE);
        Tile mirror = TestImages.tileOf(mirrored, "test://mirror");
        BufferedImage copy = TestImages.solid(4, 4, TestImages.WHITE);
        TestImages.fill(copy, 0, 0, 2, 4, TestImages.BLACK);
        Tile exact = TestImages.tileOf(copy, "test://exact");

        TileIndex index = new TileIndex(List.of(flatGray, mirror, exact));

        assertThat(index.match(cell, MatchingStrategy.COLOR)).isSameAs(flatGray);
        assertThat(index.match(cell, MatchingStrategy.IMAGE_VARIANCE)).isSameAs(exact);
    }
}
