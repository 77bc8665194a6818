package com.optics.psf;

/**
 * Thrown when neither the iterative search nor the bracket scan finds a radius
 * containing the requested fraction of photons.
 */
public class PsfNotFoundException extends RuntimeException {

    private final double fraction;

    public PsfNotFoundException(double fraction, String message) {
        super(message);
        this.fraction = fraction;
    }

    public double getFraction() {
        return fraction;
    }
}
