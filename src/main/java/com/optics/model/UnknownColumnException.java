package com.optics.model;

/** Thrown when a results query names a column that does not exist. */
public class UnknownColumnException extends IllegalArgumentException {

    public UnknownColumnException(String column) {
        super("Unknown results column '" + column + "'");
    }
}
