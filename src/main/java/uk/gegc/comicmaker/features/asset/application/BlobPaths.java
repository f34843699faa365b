package uk.gegc.comicmaker.features.asset.application;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.comicmaker.features.asset.config.StorageProperties;

import java.util.UUID;

@Component
@RequiredArgsConstructor
public class BlobPaths {

    private final StorageProperties properties;

    public String pagePath(UUID projectId, int pageNo) {
        return properties.getPagePrefix() + "/" + projectId + "/pages/" + pageNo + ".png";
    }

    public String pdfPath(UUID projectId) {
        return properties.getPdfPrefix() + "/" + projectId + "/comic.pdf";
    }
}
