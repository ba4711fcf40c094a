package com.photonamer.exception;

/**
 * Raised when a rename run cannot start: missing input directory, no geotagged
 * photos, or an invalid naming option.
 */
public class PhotoRenameException extends RuntimeException {

    public PhotoRenameException(String message) {
        super(message);
    }

    public PhotoRenameException(String message, Throwable cause) {
        super(message, cause);
    }
}
