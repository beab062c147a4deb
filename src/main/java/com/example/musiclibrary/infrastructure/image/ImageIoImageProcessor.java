package com.example.musiclibrary.infrastructure.image;

import com.example.musiclibrary.domain.model.ColorSwatches;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Locale;
import javax.imageio.ImageIO;
import org.springframework.stereotype.Component;

@Component
public class ImageIoImageProcessor implements ImageProcessor {

    private static final int SAMPLE_SIZE = 112;

    private static final float LIGHT_THEME_BRIGHTNESS = 0.40F;
    private static final float DARK_THEME_BRIGHTNESS = 0.80F;

    @Override
    public ColorSwatches extractSwatches(byte[] imageBytes) throws ImageProcessingException {
        if (imageBytes == null || imageBytes.length == 0) {
            throw new ImageProcessingException("Image is empty");
        }
        BufferedImage source;
        try {
            source = ImageIO.read(new ByteArrayInputStream(imageBytes));
        } catch (IOException | RuntimeException e) {
            throw new ImageProcessingException("Image decode failed: " + e.getMessage(), e);
        }
        if (source == null) {
            throw new ImageProcessingException("Unsupported image format");
        }

        int rgb = dominantColor(downscale(source));
        float[] hsb = Color.RGBtoHSB((rgb >> 16) & 0xFF, (rgb >> 8) & 0xFF, rgb & 0xFF, null);
        String light = toHex(Color.HSBtoRGB(hsb[0], Math.min(hsb[1], 0.80F), LIGHT_THEME_BRIGHTNESS));
        String dark = toHex(Color.HSBtoRGB(hsb[0], Math.min(hsb[1], 0.60F), DARK_THEME_BRIGHTNESS));
        return new ColorSwatches(light, dark);
    }

    private BufferedImage downscale(BufferedImage source) {
        int width = source.getWidth();
        int height = source.getHeight();
        double scale = Math.min(1.0D, (double) SAMPLE_SIZE / Math.max(width, height));
        int targetWidth = Math.max(1, (int) Math.round(width * scale));
        int targetHeight = Math.max(1, (int) Math.round(height * scale));
        BufferedImage target = new BufferedImage(targetWidth, targetHeight, BufferedImage.TYPE_INT_ARGB);
        Graphics2D graphics = target.createGraphics();
        try {
            graphics.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            graphics.drawImage(source, 0, 0, targetWidth, targetHeight, null);
        } finally {
            graphics.dispose();
        }
        return target;
    }

    /**
     * Average colour of the most populated 5-bit-per-channel bucket, ignoring transparent pixels.
     */
    private int dominantColor(BufferedImage image) {
        int[] counts = new int[1 << 15];
        long[] sumR = new long[1 << 15];
        long[] sumG = new long[1 << 15];
        long[] sumB = new long[1 << 15];
        for (int y = 0; y < image.getHeight(); y++) {
            for (int x = 0; x < image.getWidth(); x++) {
                int argb = image.getRGB(x, y);
                if (((argb >>> 24) & 0xFF) < 128) {
                    continue;
                }
                int r = (argb >> 16) & 0xFF;
                int g = (argb >> 8) & 0xFF;
                int b = argb & 0xFF;
                int bucket = ((r >> 3) << 10) | ((g >> 3) << 5) | (b >> 3);
                counts[bucket]++;
                sumR[bucket] += r;
                sumG[bucket] += g;
                sumB[bucket] += b;
            }
        }
        int best = -1;
        for (int i = 0; i < counts.length; i++) {
            if (counts[i] > 0 && (best < 0 || counts[i] > counts[best])) {
                best = i;
            }
        }
        if (best < 0) {
            return 0x808080;
        }
        int n = counts[best];
        return (int) (sumR[best] / n) << 16 | (int) (sumG[best] / n) << 8 | (int) (sumB[best] / n);
    }

    private String toHex(int rgb) {
        return String.format(Locale.ROOT, "%06x", rgb & 0xFFFFFF);
    }
}
