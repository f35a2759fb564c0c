package com.glyphlate.backend.services.image;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;

import javax.imageio.ImageIO;

import org.junit.jupiter.api.Test;

import com.glyphlate.backend.exceptions.ImageProcessingException;

class ImageCodecTest {

    private final ImageCodec codec = new ImageCodec();

    @Test
    void mediaTypeOf_detectsEncodedFormat() throws IOException {
        BufferedImage image = new BufferedImage(8, 8, BufferedImage.TYPE_INT_RGB);

        ByteArrayOutputStream jpeg = new ByteArrayOutputStream();
        ImageIO.write(image, "jpg", jpeg);

        assertEquals("image/png", codec.mediaTypeOf(codec.encodePng(image)));
        assertEquals("image/jpeg", codec.mediaTypeOf(jpeg.toByteArray()));
    }

    @Test
    void mediaTypeOf_unknownBytes() {
        assertEquals("application/octet-stream", codec.mediaTypeOf(new byte[]{1, 2, 3}));
        assertEquals("application/octet-stream", codec.mediaTypeOf(null));
    }

    @Test
    void decode_readsEncodedImage() {
        byte[] png = codec.encodePng(new BufferedImage(40, 30, BufferedImage.TYPE_INT_RGB));

        BufferedImage decoded = codec.decode(png);

        assertEquals(40, decoded.getWidth());
        assertEquals(30, decoded.getHeight());
    }

    @Test
    void decode_garbage_isFatal() {
        assertThrows(ImageProcessingException.class, () -> codec.decode(new byte[]{1, 2, 3}));
        assertThrows(ImageProcessingException.class, () -> codec.decode(new byte[0]));
    }
}
