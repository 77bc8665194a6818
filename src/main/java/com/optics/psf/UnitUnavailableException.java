package com.optics.psf;

/** Thrown when a diameter is requested in degrees but no usable focal length is known. */
public class UnitUnavailableException extends IllegalStateException {

    public UnitUnavailableException(String message) {
        super(message);
    }
}
