package io.menucast.core.image;

import io.menucast.core.config.model.ImageConfig;
import io.menucast.core.publish.PublishErrorKind;
import io.menucast.core.publish.PublishException;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Iterator;
import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Re-encodes menu images as JPEG under a byte budget. Quality steps down from the start
 * value to the floor; the floor's output is used even when it is still over budget.
 */
public final class AdaptiveImageEncoder {
    private static final Logger LOG = LoggerFactory.getLogger(AdaptiveImageEncoder.class);
    private static final float EPSILON = 0.0001f;

    private final long maxBytes;
    private final float startQuality;
    private final float minQuality;
    private final float qualityStep;

    public AdaptiveImageEncoder(ImageConfig config) {
        this(config.maxBytes(), config.startQuality(), config.minQuality(), config.qualityStep());
    }

    public AdaptiveImageEncoder(long maxBytes, float startQuality, float minQuality, float qualityStep) {
        if (maxBytes <= 0) {
            throw new IllegalArgumentException("maxBytes must be > 0");
        }
        if (qualityStep <= 0) {
            throw new IllegalArgumentException("qualityStep must be > 0");
        }
        if (minQuality <= 0 || startQuality > 1 || minQuality > startQuality) {
            throw new IllegalArgumentException("qualities must satisfy 0 < min <= start <= 1");
        }
        this.maxBytes = maxBytes;
        this.startQuality = startQuality;
        this.minQuality = minQuality;
        this.qualityStep = qualityStep;
    }

    public EncodedImage encode(Path source) throws PublishException {
        BufferedImage image;
        try {
            image = ImageIO.read(source.toFile());
        } catch (IOException e) {
            throw PublishException.precondition("Unable to read image " + source.getFileName() + ": " + e.getMessage());
        }
        if (image == null) {
            throw PublishException.precondition("Unsupported image format: " + source.getFileName());
        }
        return encode(image);
    }

    public EncodedImage encode(BufferedImage source) throws PublishException {
        BufferedImage rgb = toOpaqueRgb(source);
        float quality = startQuality;
        byte[] bytes = encodeJpeg(rgb, quality);
        while (bytes.length > maxBytes && quality - qualityStep >= minQuality - EPSILON) {
            quality = Math.max(minQuality, quality - qualityStep);
            bytes = encodeJpeg(rgb, quality);
        }
        boolean withinBudget = bytes.length <= maxBytes;
        if (!withinBudget) {
            LOG.warn("Image still {} bytes at minimum quality {} (budget {})", bytes.length, quality, maxBytes);
        }
        LOG.debug("Encoded {}x{} image to {} bytes at quality {}", rgb.getWidth(), rgb.getHeight(), bytes.length, quality);
        return new EncodedImage(bytes, quality, withinBudget);
    }

    /**
     * Encodes at one explicit quality, bypassing the budget search.
     */
    public byte[] encodeAt(BufferedImage source, float quality) throws PublishException {
        return encodeJpeg(toOpaqueRgb(source), quality);
    }

    static BufferedImage toOpaqueRgb(BufferedImage source) {
        if (source.getType() == BufferedImage.TYPE_INT_RGB) {
            return source;
        }
        int width = source.getWidth();
        int height = source.getHeight();
        BufferedImage rgb = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        int[] row = new int[width];
        for (int y = 0; y < height; y++) {
            source.getRGB(0, y, width, 1, row, 0, width);
            for (int x = 0; x < width; x++) {
                row[x] &= 0x00FFFFFF;
            }
            rgb.setRGB(0, y, width, 1, row, 0, width);
        }
        return rgb;
    }

    private byte[] encodeJpeg(BufferedImage image, float quality) throws PublishException {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("jpeg");
        if (!writers.hasNext()) {
            throw new PublishException(PublishErrorKind.UNEXPECTED, "No JPEG writer available");
        }
        ImageWriter writer = writers.next();
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (ImageOutputStream ios = ImageIO.createImageOutputStream(out)) {
            writer.setOutput(ios);
            ImageWriteParam param = writer.getDefaultWriteParam();
            param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            param.setCompressionQuality(Math.max(0f, Math.min(1f, quality)));
            writer.write(null, new IIOImage(image, null, null), param);
        } catch (IOException e) {
            throw new PublishException(PublishErrorKind.UNEXPECTED, "JPEG encoding failed: " + e.getMessage(), e);
        } finally {
            writer.dispose();
        }
        return out.toByteArray();
    }
}
