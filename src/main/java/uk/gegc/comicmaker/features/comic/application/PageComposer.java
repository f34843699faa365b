package uk.gegc.comicmaker.features.comic.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.comicmaker.features.comic.config.ImageGenerationProperties;
import uk.gegc.comicmaker.features.project.domain.model.Scene;

import javax.imageio.ImageIO;
import java.awt.*;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * Lays four panels out on a 2x2 grid:
 * <pre>
 * +---+---+
 * | 1 | 2 |
 * +---+---+
 * | 3 | 4 |
 * +---+---+
 * </pre>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PageComposer {

    private static final int BORDER_WIDTH = 3;

    private final ImageGenerationProperties properties;

    public byte[] compose(List<byte[]> panelImages) {
        if (panelImages.size() != Scene.PANELS_PER_PAGE) {
            throw new IllegalArgumentException("A page needs exactly " + Scene.PANELS_PER_PAGE
                    + " panels, got " + panelImages.size());
        }
        ImageIO.setUseCache(false);

        int pageWidth = properties.getPageWidthPx();
        int pageHeight = properties.getPageHeightPx();
        int spacing = properties.getPanelSpacingPx();
        int margin = properties.getSafeMarginPx();
        int panelWidth = (pageWidth - 2 * margin - spacing) / 2;
        int panelHeight = (pageHeight - 2 * margin - spacing) / 2;

        int[][] positions = {
                {margin, margin},
                {margin + panelWidth + spacing, margin},
                {margin, margin + panelHeight + spacing},
                {margin + panelWidth + spacing, margin + panelHeight + spacing}
        };

        BufferedImage page = new BufferedImage(pageWidth, pageHeight, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = page.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BICUBIC);
            g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, pageWidth, pageHeight);

            for (int i = 0; i < positions.length; i++) {
                int x = positions[i][0];
                int y = positions[i][1];
                BufferedImage panel = readPanel(panelImages.get(i), i + 1);
                if (panel != null) {
                    g.drawImage(panel, x, y, panelWidth, panelHeight, null);
                } else {
                    g.setColor(new Color(200, 200, 200));
                    g.setStroke(new BasicStroke(2));
                    g.drawRect(x, y, panelWidth, panelHeight);
                }
            }

            g.setColor(Color.BLACK);
            g.setStroke(new BasicStroke(BORDER_WIDTH));
            for (int[] position : positions) {
                g.drawRect(position[0], position[1], panelWidth, panelHeight);
            }
        } finally {
            g.dispose();
        }

        try {
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            ImageIO.write(page, "png", out);
            return out.toByteArray();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to encode composed page", e);
        }
    }

    private BufferedImage readPanel(byte[] bytes, int panelNo) {
        try {
            BufferedImage image = ImageIO.read(new ByteArrayInputStream(bytes));
            if (image == null) {
                log.error("Panel {} is not a decodable image; drawing an empty frame", panelNo);
            }
            return image;
        } catch (IOException e) {
            log.error("Failed to read panel {}: {}", panelNo, e.getMessage());
            return null;
        }
    }
}
