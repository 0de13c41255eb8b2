package com.williamcallahan.photo_mosaic_engine.service.image;

import com.williamcallahan.photo_mosaic_engine.testutil.TestImages;
import org.junit.jupiter.api.Test;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

class MosaicImageEncoderTest {

    @Test
    void encodesLosslessPng() throws IOException {
        BufferedImage canvas = TestImages.solid(12, 6, 0xFF204060);

        byte[] png = new MosaicImageEncoder().encodePng(canvas);

        assertThat(png).startsWith((byte) 0x89, (byte) 'P', (byte) 'N', (byte) 'G');
        BufferedImage decoded = ImageIO.read(new ByteArrayInputStream(png));
        assertThat(decoded.getWidth()).isEqualTo(12);
        assertThat(decoded.getHeight()).isEqualTo(6);
        assertThat(decoded.getRGB(3, 3)).isEqualTo(0xFF204060);
    }
}
