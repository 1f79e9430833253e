package eu.virtualparadox.docingest.ingest.ocr;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class ImageEnhancerTest {

    private final ImageEnhancer enhancer = new ImageEnhancer();

    private static BufferedImage darkSquareOnWhite(int size) {
        BufferedImage image = new BufferedImage(size, size, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = image.createGraphics();
        try {
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, size, size);
            g.setColor(new Color(40, 40, 40));
            g.fillRect(size * 3 / 10, size * 3 / 10, size * 4 / 10, size * 4 / 10);
        } finally {
            g.dispose();
        }
        return image;
    }

    @Test
    @DisplayName("Small images are upscaled twice and come back as pure black and white RGB")
    void smallImageIsUpscaledAndBinarized() {
        BufferedImage enhanced = enhancer.enhance(darkSquareOnWhite(200));

        assertEquals(400, enhanced.getWidth());
        assertEquals(400, enhanced.getHeight());
        assertEquals(BufferedImage.TYPE_INT_RGB, enhanced.getType());
        for (int y = 0; y < enhanced.getHeight(); y += 7) {
            for (int x = 0; x < enhanced.getWidth(); x += 7) {
                assertThat(enhanced.getRGB(x, y) & 0xFFFFFF).isIn(0x000000, 0xFFFFFF);
            }
        }
    }

    @Test
    @DisplayName("Dark content stays dark and the background stays light")
    void foregroundAndBackgroundSeparate() {
        BufferedImage enhanced = enhancer.enhance(darkSquareOnWhite(200));

        assertEquals(0x000000, enhanced.getRGB(200, 200) & 0xFFFFFF);
        assertEquals(0xFFFFFF, enhanced.getRGB(10, 10) & 0xFFFFFF);
    }

    @Test
    @DisplayName("Images at least 1000 pixels on both sides keep their size")
    void largeImageIsNotUpscaled() {
        BufferedImage source = new BufferedImage(1000, 1000, BufferedImage.TYPE_INT_RGB);
        assertSame(source, enhancer.upscaleIfSmall(source));

        BufferedImage narrow = new BufferedImage(999, 1200, BufferedImage.TYPE_INT_RGB);
        BufferedImage scaled = enhancer.upscaleIfSmall(narrow);
        assertEquals(1998, scaled.getWidth());
        assertEquals(2400, scaled.getHeight());
    }

    @Test
    @DisplayName("Otsu threshold separates a bimodal histogram")
    void otsuSplitsBimodalHistogram() {
        int[] gray = new int[200];
        for (int i = 0; i < gray.length; i++) {
            gray[i] = i < 120 ? 30 : 220;
        }
        int threshold = ImageEnhancer.otsuThreshold(gray);
        assertThat(threshold).isGreaterThanOrEqualTo(30).isLessThan(220);
    }
}
