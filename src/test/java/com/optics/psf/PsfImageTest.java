package com.optics.psf;

import com.optics.model.PhotonFixtures;
import com.optics.model.PhotonSample;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

public class PsfImageTest {

    private static final double FOCAL_LENGTH = 2800.0;

    @Test
    void testDiskOfRadiusTen() {
        double area = Math.PI * 20 * 20;
        PsfImage image = PsfImage.fromPhotons(PhotonFixtures.spiralDisk(1000, 10.0, 0, 0, 1000, area),
                FOCAL_LENGTH, new ContainmentRadiusSolver());

        assertEquals(area, image.getEffectiveArea(), 1e-9);
        assertEquals(17.89, image.getPsf(0.8, PsfUnit.CM), 0.02 * 17.89);
        assertEquals(image.getPsf(0.8, PsfUnit.CM), image.getPsf());
    }

    @Test
    void testPsfIsMemoized() {
        ContainmentRadiusSolver solver = spy(new ContainmentRadiusSolver());
        PsfImage image = PsfImage.fromPhotons(PhotonFixtures.spiralDisk(2000, 5.0), FOCAL_LENGTH, solver);

        double first = image.getPsf(0.8, PsfUnit.CM);
        double second = image.getPsf(0.8, PsfUnit.CM);
        double inDeg = image.getPsf(0.8, PsfUnit.DEG);

        assertEquals(Double.doubleToLongBits(first), Double.doubleToLongBits(second));
        assertEquals(first * 180.0 / Math.PI / FOCAL_LENGTH, inDeg, 1e-15);
        verify(solver, times(1)).findDiameter(any(RadialProfile.class), eq(0.8));
    }

    @Test
    void testDegreesNeedFocalLength() {
        PsfImage image = PsfImage.fromPhotons(PhotonFixtures.spiralDisk(100, 5.0), null, new ContainmentRadiusSolver());

        assertFalse(image.hasFocalLength());
        assertThrows(UnitUnavailableException.class, () -> image.getPsf(0.8, PsfUnit.DEG));
        assertThrows(UnitUnavailableException.class, () -> image.setPsf(0.1, 0.8, PsfUnit.DEG));
        assertTrue(image.getPsf(0.8, PsfUnit.CM) > 0);
    }

    @Test
    void testZeroFocalLengthDoesNotConvert() {
        PsfImage image = PsfImage.fromPhotons(PhotonFixtures.spiralDisk(100, 5.0), 0.0, new ContainmentRadiusSolver());

        assertFalse(image.hasFocalLength());
        assertThrows(UnitUnavailableException.class, () -> image.getPsf(0.8, PsfUnit.DEG));
    }

    @Test
    void testFullContainment() {
        PhotonSample sample = PhotonFixtures.randomDisk(500, 3.0, 11L);
        PsfImage image = PsfImage.fromPhotons(sample, FOCAL_LENGTH, new ContainmentRadiusSolver());

        double maxRadius = RadialProfile.of(sample).maxRadius();
        assertEquals(2 * maxRadius, image.getPsf(1.0, PsfUnit.CM));
    }

    @Test
    void testCumulativeDataIsMonotoneAndBounded() {
        PsfImage image = PsfImage.fromPhotons(PhotonFixtures.randomDisk(3000, 4.0, 3L), FOCAL_LENGTH,
                new ContainmentRadiusSolver());

        CumulativeProfile curve = image.getCumulativeData();

        assertEquals(30, curve.size());
        assertEquals(0.0, curve.radii()[0]);
        assertEquals(1.6 * image.getPsf(), curve.radii()[29], 1e-9);
        double previous = 0;
        for (double fraction : curve.fractions()) {
            assertTrue(fraction >= previous, "cumulative fraction decreased");
            assertTrue(fraction >= 0 && fraction <= 1);
            previous = fraction;
        }
        assertEquals(1.0, curve.fractions()[29]);
    }

    @Test
    void testImageDoesNotShareCallerArrays() {
        double[] x = {1.0, -1.0, 0.0, 0.0};
        double[] y = {0.0, 0.0, 1.0, -1.0};
        PhotonSample sample = new PhotonSample(x, y, 4, 1.0);
        PsfImage image = PsfImage.fromPhotons(sample, FOCAL_LENGTH, new ContainmentRadiusSolver());

        x[0] = 500.0;
        sample.x()[1] = 500.0;
        double[] radii = {0.5, 2.0};
        CumulativeProfile curve = image.getCumulativeData(radii);
        radii[0] = 3.0;
        curve.fractions()[1] = 0.0;

        assertEquals(1.0, image.getImageData(false)[0][0]);
        assertEquals(-1.0, image.getImageData(false)[0][1]);
        assertEquals(0.5, curve.radii()[0]);
        assertEquals(1.0, curve.fractions()[1]);
    }

    @Test
    void testCumulativeDataAtGivenRadii() {
        PsfImage image = PsfImage.fromPhotons(PhotonFixtures.spiralDisk(1000, 10.0), FOCAL_LENGTH,
                new ContainmentRadiusSolver());

        CumulativeProfile curve = image.getCumulativeData(new double[] {0.0, 5.0, 20.0});

        assertEquals(0.0, curve.fractions()[0]);
        assertEquals(0.25, curve.fractions()[1], 0.01);
        assertEquals(1.0, curve.fractions()[2]);
    }

    @Test
    void testEffectiveAreaScalesWithDetectedFraction() {
        PhotonSample all = PhotonFixtures.spiralDisk(400, 5.0, 0, 0, 400, 1000.0);
        PhotonSample half = new PhotonSample(all.x(), all.y(), 800, 1000.0);
        ContainmentRadiusSolver solver = new ContainmentRadiusSolver();

        double full = PsfImage.fromPhotons(all, FOCAL_LENGTH, solver).getEffectiveArea();
        double halved = PsfImage.fromPhotons(half, FOCAL_LENGTH, solver).getEffectiveArea();

        assertEquals(1000.0, full, 1e-9);
        assertEquals(500.0, halved, 1e-9);
        assertEquals(450.0, PsfImage.fromPhotons(half, FOCAL_LENGTH, solver).getEffectiveArea(0.9), 1e-9);
    }

    @Test
    void testCentroid() {
        PsfImage image = PsfImage.fromPhotons(PhotonFixtures.spiralDisk(2000, 2.0, 30.0, -4.0, 2000, 1.0),
                FOCAL_LENGTH, new ContainmentRadiusSolver());

        assertEquals(30.0, image.getCentroidX(), 0.01);
        assertEquals(-4.0, image.getCentroidY(), 0.01);
    }

    @Test
    void testImageDataCentralized() {
        PsfImage image = PsfImage.fromPhotons(PhotonFixtures.spiralDisk(50, 1.0, 3.0, 3.0, 50, 1.0),
                FOCAL_LENGTH, new ContainmentRadiusSolver());

        double[][] raw = image.getImageData(false);
        double[][] centred = image.getImageData(true);

        assertEquals(raw[0][7] - image.getCentroidX(), centred[0][7], 1e-12);
        assertEquals(raw[1][7] - image.getCentroidY(), centred[1][7], 1e-12);
    }

    @Test
    void testSummaryImage() {
        PsfImage image = PsfImage.fromSummary(4.2, 0.8, 1.5, -0.5, 9.5e4, FOCAL_LENGTH);

        assertFalse(image.hasPhotons());
        assertEquals(4.2, image.getPsf());
        assertEquals(4.2 * 180.0 / Math.PI / FOCAL_LENGTH, image.getPsf(0.8, PsfUnit.DEG), 1e-15);
        assertEquals(1.5, image.getCentroidX());
        assertEquals(9.5e4, image.getEffectiveArea());
        assertEquals(0, image.getDetectedPhotons());
        assertThrows(IllegalStateException.class, () -> image.getPsf(0.5, PsfUnit.CM));
        assertThrows(IllegalStateException.class, () -> image.getImageData(false));
    }

    @Test
    void testSetPsfInDegrees() {
        PsfImage image = PsfImage.fromSummary(1.0, 0.8, 0, 0, 1.0, FOCAL_LENGTH);

        image.setPsf(0.1, 0.5, PsfUnit.DEG);
        image.setEffectiveArea(3.0);

        assertEquals(0.1, image.getPsf(0.5, PsfUnit.DEG), 1e-12);
        assertEquals(0.1 * Math.PI / 180.0 * FOCAL_LENGTH, image.getPsf(0.5, PsfUnit.CM), 1e-9);
        assertEquals(3.0, image.getEffectiveArea());
    }
}
