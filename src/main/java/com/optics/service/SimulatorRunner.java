package com.optics.service;

import com.optics.model.ConfigurationKey;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Produces the raw photon list of one ray-tracing configuration.
 */
public interface SimulatorRunner {

    /**
     * Runs the simulation for {@code key}. On success the photon list exists at
     * {@code photonFile}.
     *
     * @param test  use a cheaper simulation with fewer photons
     * @param force rerun even when the photon list already exists
     * @throws ExternalToolException if the simulator exits with an error
     */
    void run(ConfigurationKey key, Path photonFile, boolean test, boolean force) throws IOException;
}
