package uk.gegc.comicmaker.features.asset.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.graphics.image.LosslessFactory;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;
import org.springframework.stereotype.Component;
import uk.gegc.comicmaker.features.asset.config.PdfProperties;
import uk.gegc.comicmaker.features.asset.domain.exception.PdfCompilationException;

import javax.imageio.ImageIO;
import java.awt.*;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.List;

/**
 * Lays out one page image per PDF page, centred and scaled to fit the trim size. Images are
 * resampled to the requested DPI before embedding.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PdfCompiler {

    private static final float POINTS_PER_INCH = 72f;

    private final PdfProperties properties;

    public byte[] compile(List<byte[]> pageImages, int dpi) {
        if (pageImages.isEmpty()) {
            throw new IllegalArgumentException("Cannot compile a PDF without pages");
        }
        ImageIO.setUseCache(false);

        float pageWidth = (float) properties.getPageWidthInches() * POINTS_PER_INCH;
        float pageHeight = (float) properties.getPageHeightInches() * POINTS_PER_INCH;
        int maxPixelWidth = (int) Math.round(properties.getPageWidthInches() * dpi);
        int maxPixelHeight = (int) Math.round(properties.getPageHeightInches() * dpi);

        try (PDDocument document = new PDDocument()) {
            for (int i = 0; i < pageImages.size(); i++) {
                BufferedImage source = ImageIO.read(new ByteArrayInputStream(pageImages.get(i)));
                if (source == null) {
                    throw new PdfCompilationException("Page " + (i + 1) + " is not a readable image", null);
                }
                BufferedImage resampled = resample(source, maxPixelWidth, maxPixelHeight);

                PDPage page = new PDPage(new PDRectangle(pageWidth, pageHeight));
                document.addPage(page);
                PDImageXObject image = LosslessFactory.createFromImage(document, resampled);

                float scale = Math.min(pageWidth / resampled.getWidth(), pageHeight / resampled.getHeight());
                float drawWidth = resampled.getWidth() * scale;
                float drawHeight = resampled.getHeight() * scale;
                float x = (pageWidth - drawWidth) / 2f;
                float y = (pageHeight - drawHeight) / 2f;

                try (PDPageContentStream content = new PDPageContentStream(document, page)) {
                    content.drawImage(image, x, y, drawWidth, drawHeight);
                }
            }

            ByteArrayOutputStream out = new ByteArrayOutputStream();
            document.save(out);
            byte[] bytes = out.toByteArray();
            log.debug("Compiled PDF with {} pages at {} dpi ({} bytes)", pageImages.size(), dpi, bytes.length);
            return bytes;
        } catch (IOException e) {
            throw new PdfCompilationException("Failed to compile PDF", e);
        }
    }

    private BufferedImage resample(BufferedImage source, int maxWidth, int maxHeight) {
        double scale = Math.min(1.0, Math.min((double) maxWidth / source.getWidth(), (double) maxHeight / source.getHeight()));
        int width = Math.max(1, (int) Math.round(source.getWidth() * scale));
        int height = Math.max(1, (int) Math.round(source.getHeight() * scale));

        BufferedImage target = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = target.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, width, height);
            g.drawImage(source, 0, 0, width, height, null);
        } finally {
            g.dispose();
        }
        return target;
    }
}
