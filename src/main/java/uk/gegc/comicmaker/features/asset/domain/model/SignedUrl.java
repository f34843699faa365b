package uk.gegc.comicmaker.features.asset.domain.model;

import java.time.LocalDateTime;

public record SignedUrl(String url, LocalDateTime expiresAt) {}
