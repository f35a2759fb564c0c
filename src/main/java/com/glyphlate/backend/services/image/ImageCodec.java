package com.glyphlate.backend.services.image;

import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Iterator;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;

import org.springframework.stereotype.Component;

import com.glyphlate.backend.exceptions.ImageProcessingException;

/**
 * Decodes uploaded raster images and encodes results. Output is always PNG.
 */
@Component
public class ImageCodec {

    public static final String OUTPUT_FORMAT = "png";
    public static final String OUTPUT_MEDIA_TYPE = "image/png";

    private static final String UNKNOWN_MEDIA_TYPE = "application/octet-stream";

    public BufferedImage decode(byte[] imageBytes) {
        if (imageBytes == null || imageBytes.length == 0) {
            throw new ImageProcessingException("Image is empty");
        }

        BufferedImage image;
        try {
            image = ImageIO.read(new ByteArrayInputStream(imageBytes));
        } catch (IOException e) {
            throw new ImageProcessingException("Failed to read image: " + e.getMessage(), e);
        }

        if (image == null) {
            throw new ImageProcessingException("Unsupported or corrupt image format");
        }
        if (image.getWidth() <= 0 || image.getHeight() <= 0) {
            throw new ImageProcessingException("Image has no pixels");
        }
        return image;
    }

    public byte[] encodePng(BufferedImage image) {
        try (ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            if (!ImageIO.write(image, OUTPUT_FORMAT, out)) {
                throw new ImageProcessingException("No PNG writer available");
            }
            return out.toByteArray();
        } catch (IOException e) {
            throw new ImageProcessingException("Failed to encode image: " + e.getMessage(), e);
        }
    }

    /**
     * MIME type of the encoded image as reported by the first matching ImageIO reader.
     */
    public String mediaTypeOf(byte[] imageBytes) {
        if (imageBytes == null || imageBytes.length == 0) return UNKNOWN_MEDIA_TYPE;

        try (ImageInputStream in = ImageIO.createImageInputStream(new ByteArrayInputStream(imageBytes))) {
            if (in == null) return UNKNOWN_MEDIA_TYPE;

            Iterator<ImageReader> readers = ImageIO.getImageReaders(in);
            if (!readers.hasNext()) return UNKNOWN_MEDIA_TYPE;

            ImageReader reader = readers.next();
            try {
                String[] mimeTypes = reader.getOriginatingProvider().getMIMETypes();
                return mimeTypes != null && mimeTypes.length > 0 ? mimeTypes[0] : UNKNOWN_MEDIA_TYPE;
            } finally {
                reader.dispose();
            }
        } catch (IOException e) {
            throw new ImageProcessingException("Failed to read image: " + e.getMessage(), e);
        }
    }
}
