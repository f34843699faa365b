package uk.gegc.comicmaker.features.comic.infra;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import uk.gegc.comicmaker.features.comic.application.ImageGenerationClient;
import uk.gegc.comicmaker.features.comic.domain.exception.ImageProviderException;
import uk.gegc.comicmaker.features.comic.domain.model.ImageResolution;

import javax.imageio.ImageIO;
import java.awt.*;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Offline provider that draws a labelled, seed-coloured panel. Same seed and prompt give the
 * same image.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "comicmaker.image", name = "provider", havingValue = "placeholder", matchIfMissing = true)
public class PlaceholderImageGenerationClient implements ImageGenerationClient {

    private static final int MAX_LINES = 8;

    @Override
    public byte[] generate(String prompt, ImageResolution resolution, long seed) {
        ImageIO.setUseCache(false);
        int width = resolution.getWidth();
        int height = resolution.getHeight();

        Random random = new Random(seed * 31 + prompt.hashCode());
        Color background = Color.getHSBColor(random.nextFloat(), 0.35f, 0.9f);

        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = image.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            g.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
            g.setColor(background);
            g.fillRect(0, 0, width, height);

            int fontSize = Math.max(10, width / 32);
            g.setFont(new Font(Font.SANS_SERIF, Font.PLAIN, fontSize));
            g.setColor(Color.DARK_GRAY);
            FontMetrics metrics = g.getFontMetrics();
            int y = metrics.getHeight() + fontSize;
            for (String line : wrap(prompt, metrics, width - 2 * fontSize)) {
                g.drawString(line, fontSize, y);
                y += metrics.getHeight();
            }
        } finally {
            g.dispose();
        }

        try {
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            ImageIO.write(image, "png", out);
            log.debug("Drew placeholder panel {}x{} for seed {}", width, height, seed);
            return out.toByteArray();
        } catch (IOException e) {
            throw new ImageProviderException("Failed to encode placeholder panel", false, e);
        }
    }

    private List<String> wrap(String text, FontMetrics metrics, int maxWidth) {
        List<String> lines = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (String word : text.split("\\s+")) {
            String candidate = current.length() == 0 ? word : current + " " + word;
            if (metrics.stringWidth(candidate) > maxWidth && current.length() > 0) {
                lines.add(current.toString());
                if (lines.size() == MAX_LINES) {
                    return lines;
                }
                current = new StringBuilder(word);
            } else {
                current = new StringBuilder(candidate);
            }
        }
        if (current.length() > 0) {
            lines.add(current.toString());
        }
        return lines;
    }
}
