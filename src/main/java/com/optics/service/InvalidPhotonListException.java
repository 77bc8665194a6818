package com.optics.service;

import java.io.IOException;

/** Thrown when a photon list cannot be turned into a usable photon sample. */
public class InvalidPhotonListException extends IOException {

    public InvalidPhotonListException(String message) {
        super(message);
    }

    public InvalidPhotonListException(String message, Throwable cause) {
        super(message, cause);
    }
}
