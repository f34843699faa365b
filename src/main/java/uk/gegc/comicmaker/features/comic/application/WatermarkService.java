package uk.gegc.comicmaker.features.comic.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.comicmaker.features.comic.config.ImageGenerationProperties;
import uk.gegc.comicmaker.features.plan.application.PlanPolicy;
import uk.gegc.comicmaker.features.plan.domain.model.PlanTier;

import javax.imageio.ImageIO;
import java.awt.*;
import java.awt.geom.AffineTransform;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;

/**
 * Text watermark overlay. FREE pages get a corner mark plus a repeating diagonal pattern, PRO
 * pages the corner mark only. Plans without the watermark requirement are returned untouched.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WatermarkService {

    private static final int STRONG_OPACITY = 180;
    private static final int STANDARD_OPACITY = 120;
    private static final int PADDING = 20;
    private static final int SHADOW_OFFSET = 2;
    private static final int PATTERN_SPACING_X = 300;
    private static final int PATTERN_SPACING_Y = 200;

    private final ImageGenerationProperties properties;
    private final PlanPolicy planPolicy;

    public enum Strength {
        NONE,
        STANDARD,
        STRONG
    }

    public Strength strengthFor(PlanTier plan) {
        if (!planPolicy.isWatermarkRequired(plan)) {
            return Strength.NONE;
        }
        return plan == PlanTier.FREE ? Strength.STRONG : Strength.STANDARD;
    }

    public boolean shouldWatermark(PlanTier plan) {
        return strengthFor(plan) != Strength.NONE;
    }

    /**
     * Returns the watermarked PNG, or the original bytes if the plan needs no watermark or the
     * overlay could not be drawn.
     */
    public byte[] apply(byte[] image, PlanTier plan) {
        Strength strength = strengthFor(plan);
        if (strength == Strength.NONE) {
            return image;
        }
        try {
            return overlay(image, strength);
        } catch (IOException | RuntimeException e) {
            log.error("Watermarking failed for {} plan, returning original image: {}", plan, e.getMessage());
            return image;
        }
    }

    private byte[] overlay(byte[] bytes, Strength strength) throws IOException {
        ImageIO.setUseCache(false);
        BufferedImage source = ImageIO.read(new ByteArrayInputStream(bytes));
        if (source == null) {
            throw new IOException("Unsupported image format");
        }

        int width = source.getWidth();
        int height = source.getHeight();
        BufferedImage result = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = result.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            g.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, width, height);
            g.drawImage(source, 0, 0, null);

            int opacity = strength == Strength.STRONG ? STRONG_OPACITY : STANDARD_OPACITY;
            int fontSize = Math.max(20, Math.min(width, height) / 15);

            if (strength == Strength.STRONG) {
                drawDiagonalPattern(g, width, height, Math.max(10, fontSize / 2), opacity / 2);
            }

            g.setFont(new Font(Font.SANS_SERIF, Font.BOLD, fontSize));
            FontMetrics metrics = g.getFontMetrics();
            String text = properties.getWatermarkText();
            int x = width - metrics.stringWidth(text) - PADDING;
            int y = height - metrics.getDescent() - PADDING;

            g.setColor(new Color(0, 0, 0, opacity));
            g.drawString(text, x + SHADOW_OFFSET, y + SHADOW_OFFSET);
            g.setColor(new Color(255, 255, 255, opacity));
            g.drawString(text, x, y);
        } finally {
            g.dispose();
        }

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ImageIO.write(result, "png", out);
        return out.toByteArray();
    }

    private void drawDiagonalPattern(Graphics2D g, int width, int height, int fontSize, int opacity) {
        AffineTransform original = g.getTransform();
        g.setFont(new Font(Font.SANS_SERIF, Font.PLAIN, fontSize));
        g.setColor(new Color(128, 128, 128, opacity));
        g.rotate(Math.toRadians(-30), width / 2.0, height / 2.0);
        String text = properties.getDiagonalWatermarkText();
        for (int y = -height; y < 2 * height; y += PATTERN_SPACING_Y) {
            int offset = Math.floorMod(y / PATTERN_SPACING_Y, 2) * (PATTERN_SPACING_X / 2);
            for (int x = -width; x < 2 * width; x += PATTERN_SPACING_X) {
                g.drawString(text, x + offset, y);
            }
        }
        g.setTransform(original);
    }
}
