package com.optics.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class TelescopeTransmissionTest {

    @Test
    void testConstantWhenSecondParameterIsZero() {
        TelescopeTransmission transmission = TelescopeTransmission.parse("0.969 0 0 0 0");

        assertEquals(0.969, transmission.at(0.0));
        assertEquals(0.969, transmission.at(3.0));
    }

    @Test
    void testOffAxisDependence() {
        TelescopeTransmission transmission = new TelescopeTransmission(0.9, 1, 0.5, 2.0, 2.0);
        double theta = 2.0;
        double t = Math.sin(Math.toRadians(theta)) / (2.0 * Math.PI / 180.0);

        assertEquals(0.9, transmission.at(0.0), 1e-12);
        assertEquals(0.9 / (1 + 0.5 * t * t), transmission.at(theta), 1e-12);
        assertTrue(transmission.at(3.0) < transmission.at(1.0));
    }

    @Test
    void testShortFormOnlyForConstantTransmission() {
        assertEquals(0.8, TelescopeTransmission.parse("0.8 0").at(1.0));
        assertThrows(IllegalArgumentException.class, () -> TelescopeTransmission.parse("0.8 1"));
        assertThrows(NumberFormatException.class, () -> TelescopeTransmission.parse("0.8 x 0 0 0"));
    }

    @Test
    void testParametersAreCopied() {
        double[] pars = {1.0, 0, 0, 0, 0};
        TelescopeTransmission transmission = new TelescopeTransmission(pars);
        pars[0] = 0.1;

        assertEquals(1.0, transmission.at(0));
        assertArrayEquals(new double[] {1.0, 0, 0, 0, 0}, TelescopeTransmission.constant(1.0).parameters());
    }
}
