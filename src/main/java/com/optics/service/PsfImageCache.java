package com.optics.service;

import com.optics.model.ConfigurationKey;
import com.optics.psf.PsfImage;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Images retained by the last analysis, in configuration order. Owned by one orchestrator;
 * {@link #clear()} is called at the start of every recomputation.
 */
public class PsfImageCache {

    private final Map<ConfigurationKey, PsfImage> images = new LinkedHashMap<>();

    public void put(ConfigurationKey key, PsfImage image) {
        images.put(key, image);
    }

    public Optional<PsfImage> get(ConfigurationKey key) {
        return Optional.ofNullable(images.get(key));
    }

    /** Images keyed by off-axis angle; with several mirrors per angle the last one wins. */
    public Map<Double, PsfImage> byOffAxis() {
        Map<Double, PsfImage> result = new LinkedHashMap<>();
        images.forEach((key, image) -> result.put(key.offAxisAngle, image));
        return Collections.unmodifiableMap(result);
    }

    public Map<ConfigurationKey, PsfImage> asMap() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(images));
    }

    public int size() {
        return images.size();
    }

    public boolean isEmpty() {
        return images.isEmpty();
    }

    public void clear() {
        images.clear();
    }
}
