package eu.virtualparadox.docingest.ingest.ocr;

import org.springframework.stereotype.Component;

import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.util.Arrays;

/**
 * Preprocessing for the second OCR pass.
 * <p>
 * Steps, in order:
 * <ol>
 *   <li>bicubic 2&times; upscale when either side is under {@value #UPSCALE_BELOW_PX} px,</li>
 *   <li>grayscale (ITU-R BT.601 luma),</li>
 *   <li>3&times;3 median filter to remove speckle,</li>
 *   <li>contrast-limited adaptive histogram equalization on an 8&times;8 tile grid,</li>
 *   <li>global binarization at Otsu's threshold.</li>
 * </ol>
 * The result is returned as an RGB image holding only black and white pixels.
 * Stateless and thread-safe.
 */
@Component
public class ImageEnhancer {

    static final int UPSCALE_BELOW_PX = 1000;
    static final int UPSCALE_FACTOR = 2;
    static final int CLAHE_GRID = 8;
    static final double CLAHE_CLIP_LIMIT = 1.5;

    private static final int LEVELS = 256;

    public BufferedImage enhance(final BufferedImage source) {
        final BufferedImage scaled = upscaleIfSmall(source);
        final int width = scaled.getWidth();
        final int height = scaled.getHeight();

        int[] gray = toGray(scaled);
        gray = median3x3(gray, width, height);
        gray = clahe(gray, width, height);
        gray = binarize(gray, otsuThreshold(gray));

        return toRgb(gray, width, height);
    }

    BufferedImage upscaleIfSmall(final BufferedImage source) {
        final int width = source.getWidth();
        final int height = source.getHeight();
        if (width >= UPSCALE_BELOW_PX && height >= UPSCALE_BELOW_PX) {
            return source;
        }
        final BufferedImage scaled = new BufferedImage(width * UPSCALE_FACTOR, height * UPSCALE_FACTOR,
                BufferedImage.TYPE_INT_RGB);
        final Graphics2D g = scaled.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BICUBIC);
            g.drawImage(source, 0, 0, scaled.getWidth(), scaled.getHeight(), null);
        } finally {
            g.dispose();
        }
        return scaled;
    }

    private static int[] toGray(final BufferedImage image) {
        final int width = image.getWidth();
        final int height = image.getHeight();
        final int[] rgb = image.getRGB(0, 0, width, height, null, 0, width);
        final int[] gray = new int[rgb.length];
        for (int i = 0; i < rgb.length; i++) {
            final int r = (rgb[i] >> 16) & 0xFF;
            final int g = (rgb[i] >> 8) & 0xFF;
            final int b = rgb[i] & 0xFF;
            gray[i] = (int) Math.round(0.299 * r + 0.587 * g + 0.114 * b);
        }
        return gray;
    }

    private static int[] median3x3(final int[] gray, final int width, final int height) {
        final int[] out = new int[gray.length];
        final int[] window = new int[9];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int n = 0;
                for (int dy = -1; dy <= 1; dy++) {
                    final int yy = clamp(y + dy, height);
                    for (int dx = -1; dx <= 1; dx++) {
                        window[n++] = gray[yy * width + clamp(x + dx, width)];
                    }
                }
                Arrays.sort(window);
                out[y * width + x] = window[4];
            }
        }
        return out;
    }

    /**
     * Contrast-limited adaptive histogram equalization. Each tile gets its own clipped
     * equalization table; pixels are mapped by bilinear interpolation between the tables of
     * the four nearest tile centres so that tile borders do not show.
     */
    private static int[] clahe(final int[] gray, final int width, final int height) {
        final int tileWidth = Math.max(1, (width + CLAHE_GRID - 1) / CLAHE_GRID);
        final int tileHeight = Math.max(1, (height + CLAHE_GRID - 1) / CLAHE_GRID);
        final int tilesX = (width + tileWidth - 1) / tileWidth;
        final int tilesY = (height + tileHeight - 1) / tileHeight;

        final int[][][] luts = new int[tilesY][tilesX][];
        for (int ty = 0; ty < tilesY; ty++) {
            for (int tx = 0; tx < tilesX; tx++) {
                final int x0 = tx * tileWidth;
                final int y0 = ty * tileHeight;
                final int x1 = Math.min(x0 + tileWidth, width);
                final int y1 = Math.min(y0 + tileHeight, height);
                luts[ty][tx] = tileLut(gray, width, x0, y0, x1, y1);
            }
        }

        final int[] out = new int[gray.length];
        for (int y = 0; y < height; y++) {
            final double fy = (y + 0.5) / tileHeight - 0.5;
            final int ty0 = Math.max(0, Math.min((int) Math.floor(fy), tilesY - 1));
            final int ty1 = Math.min(ty0 + 1, tilesY - 1);
            final double wy = clampUnit(fy - ty0);
            for (int x = 0; x < width; x++) {
                final double fx = (x + 0.5) / tileWidth - 0.5;
                final int tx0 = Math.max(0, Math.min((int) Math.floor(fx), tilesX - 1));
                final int tx1 = Math.min(tx0 + 1, tilesX - 1);
                final double wx = clampUnit(fx - tx0);

                final int v = gray[y * width + x];
                final double top = (1 - wx) * luts[ty0][tx0][v] + wx * luts[ty0][tx1][v];
                final double bottom = (1 - wx) * luts[ty1][tx0][v] + wx * luts[ty1][tx1][v];
                out[y * width + x] = (int) Math.round((1 - wy) * top + wy * bottom);
            }
        }
        return out;
    }

    private static int[] tileLut(final int[] gray, final int width,
                                 final int x0, final int y0, final int x1, final int y1) {
        final int[] hist = new int[LEVELS];
        for (int y = y0; y < y1; y++) {
            for (int x = x0; x < x1; x++) {
                hist[gray[y * width + x]]++;
            }
        }
        final int pixels = (x1 - x0) * (y1 - y0);

        // clip and spread the excess evenly over all bins
        final int limit = Math.max(1, (int) (CLAHE_CLIP_LIMIT * pixels / LEVELS));
        int excess = 0;
        for (int i = 0; i < LEVELS; i++) {
            if (hist[i] > limit) {
                excess += hist[i] - limit;
                hist[i] = limit;
            }
        }
        final int bonus = excess / LEVELS;
        final int remainder = excess % LEVELS;
        for (int i = 0; i < LEVELS; i++) {
            hist[i] += bonus + (i < remainder ? 1 : 0);
        }

        final int[] lut = new int[LEVELS];
        long cdf = 0;
        for (int i = 0; i < LEVELS; i++) {
            cdf += hist[i];
            lut[i] = (int) Math.min(LEVELS - 1, Math.round(cdf * (LEVELS - 1.0) / pixels));
        }
        return lut;
    }

    static int otsuThreshold(final int[] gray) {
        final long[] hist = new long[LEVELS];
        for (int v : gray) {
            hist[v]++;
        }
        final long total = gray.length;
        double sumAll = 0;
        for (int i = 0; i < LEVELS; i++) {
            sumAll += (double) i * hist[i];
        }

        double sumBackground = 0;
        long weightBackground = 0;
        double bestVariance = -1;
        int threshold = 0;
        for (int t = 0; t < LEVELS; t++) {
            weightBackground += hist[t];
            if (weightBackground == 0) {
                continue;
            }
            final long weightForeground = total - weightBackground;
            if (weightForeground == 0) {
                break;
            }
            sumBackground += (double) t * hist[t];
            final double meanBackground = sumBackground / weightBackground;
            final double meanForeground = (sumAll - sumBackground) / weightForeground;
            final double diff = meanBackground - meanForeground;
            final double variance = (double) weightBackground * weightForeground * diff * diff;
            if (variance > bestVariance) {
                bestVariance = variance;
                threshold = t;
            }
        }
        return threshold;
    }

    private static int[] binarize(final int[] gray, final int threshold) {
        final int[] out = new int[gray.length];
        for (int i = 0; i < gray.length; i++) {
            out[i] = gray[i] > threshold ? 255 : 0;
        }
        return out;
    }

    private static BufferedImage toRgb(final int[] gray, final int width, final int height) {
        final int[] rgb = new int[gray.length];
        for (int i = 0; i < gray.length; i++) {
            final int v = gray[i];
            rgb[i] = (v << 16) | (v << 8) | v;
        }
        final BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        image.setRGB(0, 0, width, height, rgb, 0, width);
        return image;
    }

    private static int clamp(final int value, final int size) {
        return Math.max(0, Math.min(value, size - 1));
    }

    private static double clampUnit(final double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
