package com.osman.badges.core.pdf;

import org.apache.batik.transcoder.TranscoderException;
import org.apache.batik.transcoder.TranscoderInput;
import org.apache.batik.transcoder.TranscoderOutput;
import org.apache.batik.transcoder.image.ImageTranscoder;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.graphics.image.LosslessFactory;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;

import java.awt.Color;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads page background images. PNG, JPEG and the other formats PDFBox recognises are embedded
 * directly; SVG files are rasterized with Batik at {@link #SVG_SCALE} times the page size and the
 * result is reused for every page of the run.
 */
final class BackgroundImageLoader {

    static final float SVG_SCALE = 3f;

    private final Map<SvgKey, BufferedImage> svgCache = new ConcurrentHashMap<>();

    PDImageXObject load(PDDocument document, Path asset, float pageWidth, float pageHeight)
        throws AssetNotFoundException, IOException {
        if (!Files.isRegularFile(asset)) {
            throw new AssetNotFoundException("Background image", asset);
        }
        if (isSvg(asset)) {
            BufferedImage raster = rasterizeSvg(asset, pageWidth * SVG_SCALE, pageHeight * SVG_SCALE);
            return LosslessFactory.createFromImage(document, raster);
        }
        return PDImageXObject.createFromFileByContent(asset.toFile(), document);
    }

    private BufferedImage rasterizeSvg(Path svgFile, float width, float height) throws IOException {
        SvgKey key = new SvgKey(svgFile.toAbsolutePath(), Math.round(width), Math.round(height));
        BufferedImage cached = svgCache.get(key);
        if (cached != null) {
            return cached;
        }

        BufferedImageTranscoder transcoder = new BufferedImageTranscoder();
        transcoder.addTranscodingHint(ImageTranscoder.KEY_WIDTH, (float) key.width());
        transcoder.addTranscodingHint(ImageTranscoder.KEY_HEIGHT, (float) key.height());
        transcoder.addTranscodingHint(ImageTranscoder.KEY_BACKGROUND_COLOR, Color.WHITE);
        transcoder.addTranscodingHint(ImageTranscoder.KEY_ALLOW_EXTERNAL_RESOURCES, true);

        try (InputStream in = Files.newInputStream(svgFile)) {
            TranscoderInput input = new TranscoderInput(in);
            input.setURI(svgFile.toUri().toString());
            transcoder.transcode(input, (TranscoderOutput) null);
        } catch (TranscoderException ex) {
            throw new IOException("Failed to render SVG background " + svgFile + ": " + ex.getMessage(), ex);
        }
        BufferedImage image = transcoder.getBufferedImage();
        svgCache.putIfAbsent(key, image);
        return image;
    }

    private static boolean isSvg(Path asset) {
        return asset.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".svg");
    }

    private record SvgKey(Path file, int width, int height) {
    }

    private static final class BufferedImageTranscoder extends ImageTranscoder {
        private BufferedImage image;

        @Override
        public BufferedImage createImage(int w, int h) {
            return new BufferedImage(w, h, BufferedImage.TYPE_INT_ARGB);
        }

        @Override
        public void writeImage(BufferedImage img, TranscoderOutput out) {
            this.image = img;
        }

        BufferedImage getBufferedImage() {
            if (image == null) {
                throw new IllegalStateException("No image produced during SVG transcoding");
            }
            return image;
        }
    }
}
