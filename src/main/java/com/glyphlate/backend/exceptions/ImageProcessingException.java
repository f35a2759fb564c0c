package com.glyphlate.backend.exceptions;

/**
 * Image could not be decoded, resized or re-encoded. Fatal for the request.
 */
public class ImageProcessingException extends RuntimeException {

    public ImageProcessingException(String message) {
        super(message);
    }

    public ImageProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
