package com.osman.badges.core.pdf;

import com.osman.badges.core.BadgeException;

import java.nio.file.Path;

/**
 * Raised when an image or font file needed to compose a page does not exist.
 */
public class AssetNotFoundException extends BadgeException {
    private final Path asset;

    public AssetNotFoundException(String kind, Path asset) {
        super(kind + " not found: " + asset);
        this.asset = asset;
    }

    public Path getAsset() {
        return asset;
    }
}
