package com.williamcallahan.photo_mosaic_engine.util;

import com.williamcallahan.photo_mosaic_engine.model.ColorDescriptor;
import com.williamcallahan.photo_mosaic_engine.testutil.TestImages;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ColorProfilerTest {

    @Test
    void averageColorOfSolidImageIsThatColor() {
        BufferedImage image = TestImages.solid(7, 3, 0x80102030);

        assertThat(ColorProfiler.averageColor(image)).isEqualTo(new ColorDescriptor(0x10, 0x20, 0x30, 0x80));
    }

    @Test
    void averageColorTruncatesTheMean() {
        BufferedImage image = TestImages.solid(2, 1, TestImages.BLACK);
        image.setRGB(1, 0, 0xFF010101);

        assertThat(ColorProfiler.averageColor(image)).isEqualTo(new ColorDescriptor(0, 0, 0, 255));
    }

    @Test
    @DisplayName("Each averaged channel lies between the channel's minimum and maximum")
    void averageColorIsBoundedByChannelExtremes() {
        Random random = new Random(42);
        BufferedImage image = new BufferedImage(13, 11, BufferedImage.TYPE_INT_ARGB);
        int minRed = 255;
        int maxRed = 0;
        for (int y = 0; y < image.getHeight(); y++) {
            for (int x = 0; x < image.getWidth(); x++) {
                int argb = random.nextInt();
                image.setRGB(x, y, argb);
                int red = (argb >>> 16) & 0xFF;
                minRed = Math.min(minRed, red);
                maxRed = Math.max(maxRed, red);
            }
        }

        ColorDescriptor average = ColorProfiler.averageColor(image);

        assertThat(average.red()).isBetween(minRed, maxRed);
        assertThat(average.green()).isBetween(0, 255);
        assertThat(average.alpha()).isBetween(0, 255);
    }

    @Test
    void averageColorIgnoresPixelOrder() {
        Random random = new Random(7);
        List<Integer> pixels = new ArrayList<>();
        for (int i = 0; i < 64; i++) {
            pixels.add(random.nextInt());
        }
        BufferedImage original = imageOf(pixels, 8);
        Collections.shuffle(pixels, random);
        BufferedImage shuffled = imageOf(pixels, 8);

        assertThat(ColorProfiler.averageColor(shuffled)).isEqualTo(ColorProfiler.averageColor(original));
    }

    @Test
    void averageColorWorksOnSubimageViews() {
        BufferedImage image = TestImages.solid(10, 10, TestImages.BLACK);
        TestImages.fill(image, 5, 0, 5, 10, TestImages.WHITE);

        assertThat(ColorProfiler.averageColor(image.getSubimage(5, 0, 5, 10)))
            .isEqualTo(new ColorDescriptor(255, 255, 255, 255));
    }

    @Test
    void distanceToSelfIsZero() {
        ColorDescriptor color = new ColorDescriptor(12, 200, 77, 31);

        assertThat(ColorProfiler.colorDistance(color, color)).isZero();
    }

    @Test
    void distanceIsSymmetric() {
        ColorDescriptor a = new ColorDescriptor(250, 3, 40, 255);
        ColorDescriptor b = new ColorDescriptor(9, 180, 66, 128);

        assertThat(ColorProfiler.colorDistance(a, b)).isEqualTo(ColorProfiler.colorDistance(b, a));
    }

    @Test
    void distinctColorsAreNeverAtDistanceZero() {
        ColorDescriptor origin = new ColorDescriptor(0, 0, 0, 0);

        assertThat(ColorProfiler.colorDistance(origin, new ColorDescriptor(1, 0, 0, 0))).isPositive();
        assertThat(ColorProfiler.colorDistance(origin, new ColorDescriptor(0, 1, 0, 0))).isPositive();
        assertThat(ColorProfiler.colorDistance(origin, new ColorDescriptor(0, 0, 1, 0))).isPositive();
        assertThat(ColorProfiler.colorDistance(origin, new ColorDescriptor(0, 0, 0, 1))).isPositive();
    }

    @Test
    @DisplayName("(10,10,10,0) is closest to black among black, white and mid gray")
    void darkGrayIsClosestToBlack() {
        ColorDescriptor query = new ColorDescriptor(10, 10, 10, 0);
        long toBlack = ColorProfiler.colorDistance(query, new ColorDescriptor(0, 0, 0, 0));
        long toWhite = ColorProfiler.colorDistance(query, new ColorDescriptor(255, 255, 255, 0));
        long toGray = ColorProfiler.colorDistance(query, new ColorDescriptor(128, 128, 128, 0));

        assertThat(toBlack).isLessThan(toGray).isLessThan(toWhite);
    }

    @Test
    void grayDifferencesOnlyMoveLuma() {
        // Equal RGB steps carry no chroma, so the whole distance is the luma term
        long luma = ColorProfiler.luma(10, 10, 10);

        assertThat(ColorProfiler.blueChroma(10, 10, 10)).isZero();
        assertThat(ColorProfiler.redChroma(10, 10, 10)).isZero();
        assertThat(ColorProfiler.colorDistance(new ColorDescriptor(10, 10, 10, 0), new ColorDescriptor(0, 0, 0, 0)))
            .isEqualTo(luma * luma);
    }

    @Test
    void differenceVarianceOfIdenticalRegionsIsZero() {
        BufferedImage image = TestImages.solid(4, 4, 0xFF336699);

        assertThat(ColorProfiler.differenceVariance(image, TestImages.solid(4, 4, 0xFF336699))).isZero();
    }

    @Test
    void differenceVarianceIsMeanOfPerPixelDistances() {
        BufferedImage gray = TestImages.solid(3, 3, 0xFF0A0A0A);
        BufferedImage black = TestImages.solid(3, 3, TestImages.BLACK);
        long perPixel = ColorProfiler.colorDistance(ColorDescriptor.fromArgb(0xFF0A0A0A), ColorDescriptor.fromArgb(TestImages.BLACK));

        assertThat(ColorProfiler.differenceVariance(gray, black)).isEqualTo((double) perPixel);
    }

    @Test
    void differenceVarianceSeesStructureThatAveragesHide() {
        BufferedImage leftDark = TestImages.solid(4, 4, TestImages.WHITE);
        TestImages.fill(leftDark, 0, 0, 2, 4, TestImages.BLACK);
        BufferedImage rightDark = TestImages.solid(4, 4, TestImages.BLACK);
        TestImages.fill(rightDark, 0, 0, 2, 4, TestImages.WHITE);

        assertThat(ColorProfiler.averageColor(leftDark)).isEqualTo(ColorProfiler.averageColor(rightDark));
        assertThat(ColorProfiler.differenceVariance(leftDark, rightDark)).isPositive();
    }

    @Test
    void differenceVarianceRejectsMismatchedSizes() {
        assertThatThrownBy(() -> ColorProfiler.differenceVariance(
                TestImages.solid(4, 4, TestImages.BLACK), TestImages.solid(4, 5, TestImages.BLACK)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("4x4 vs 4x5");
    }

    private static BufferedImage imageOf(List<Integer> pixels, int width) {
        BufferedImage image = new BufferedImage(width, pixels.size() / width, BufferedImage.TYPE_INT_ARGB);
        for (int i = 0; i < pixels.size(); i++) {
            image.setRGB(i % width, i / width, pixels.get(i));
        }
        return image;
    }
}
