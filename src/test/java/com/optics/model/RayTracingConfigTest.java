package com.optics.model;

import com.optics.psf.SolverSettings;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class RayTracingConfigTest {

    private static final TelescopeOptics OPTICS = new TelescopeOptics("LST-1", "North", 2800.0, 2800.0, 4,
            TelescopeTransmission.constant(1.0));

    @Test
    void testFullTelescopeDefaults() {
        RayTracingConfig config = RayTracingConfig.builder(OPTICS, false).build();

        assertEquals(20.0, config.getZenithAngle());
        assertEquals(10.0, config.getSourceDistance());
        assertEquals(List.of(0.0, 0.5, 1.0, 1.5, 2.0, 2.5, 3.0), config.getOffAxisAngles());
        assertEquals(SolverSettings.defaults(), config.getSolverSettings());
        assertEquals(RayTracingConfig.ResultsFormat.ECSV, config.getResultsFormat());

        List<ConfigurationKey> keys = config.configurationMatrix();
        assertEquals(7, keys.size());
        assertTrue(keys.stream().noneMatch(ConfigurationKey::isSingleMirror));
    }

    @Test
    void testSingleMirrorDefaults() {
        RayTracingConfig config = RayTracingConfig.builder(OPTICS, true).build();

        assertEquals(0.0, config.getZenithAngle());
        assertEquals(0.056, config.getSourceDistance(), 1e-12);
        List<ConfigurationKey> keys = config.configurationMatrix();
        assertEquals(1, keys.size());
        assertEquals(1, keys.get(0).mirrorNumber);
        assertEquals(0.0, keys.get(0).offAxisAngle);
        assertEquals(config.getSourceDistance(), keys.get(0).sourceDistance);
    }

    @Test
    void testMatrixOrderOffAxisOutermost() {
        RayTracingConfig config = RayTracingConfig.builder(OPTICS, true)
                .offAxisAngles(List.of(0.0, 1.0))
                .allMirrors()
                .build();

        List<ConfigurationKey> keys = config.configurationMatrix();

        assertEquals(8, keys.size());
        assertEquals(0.0, keys.get(3).offAxisAngle);
        assertEquals(4, keys.get(3).mirrorNumber);
        assertEquals(1.0, keys.get(4).offAxisAngle);
        assertEquals(1, keys.get(4).mirrorNumber);
    }

    @Test
    void testKeysWorkAsMapKeys() {
        RayTracingConfig config = RayTracingConfig.builder(OPTICS, false).build();
        Set<ConfigurationKey> seen = new HashSet<>(config.configurationMatrix());

        assertEquals(7, seen.size());
        assertTrue(seen.contains(new ConfigurationKey(0.5, null, 20.0, 10.0)));
        assertNotEquals(new ConfigurationKey(0.5, 1, 20.0, 10.0), new ConfigurationKey(0.5, null, 20.0, 10.0));
    }

    @Test
    void testValidation() {
        RayTracingConfig.Builder full = RayTracingConfig.builder(OPTICS, false);

        assertThrows(IllegalStateException.class, () -> full.mirrorNumbers(List.of(1)));
        assertThrows(IllegalArgumentException.class, () -> full.offAxisAngles(List.of()));
        assertThrows(IllegalArgumentException.class, () -> full.sourceDistance(0));
        assertThrows(IllegalArgumentException.class, () -> full.workerThreads(0));
    }
}
