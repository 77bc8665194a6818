package com.optics.psf;

/** Units a containment diameter can be reported in. */
public enum PsfUnit {
    CM,
    DEG
}
