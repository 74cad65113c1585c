package tripod.rv.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LogWavelengthGridTest {

    @Test
    void units_shouldConvertBetweenKmsAndMs () {
        assertEquals(1500., Units.kmsToMs(1.5), 0.);
        assertEquals(1.5, Units.msToKms(1500.), 0.);
        assertEquals(-3.25, Units.msToKms(Units.kmsToMs(-3.25)), 1e-15);
        assertEquals(Units.lnDoppler(2.), Units.lnDopplerMs(2000.), 1e-18);
        assertEquals(Units.C_KMS * 1000., Units.C_MS, 0.);
    }

    @Test
    void create_shouldCoverRangeWithPadding () {
        LogWavelengthGrid grid = LogWavelengthGrid.create
            (5000., 5010., 200., 10);
        double step = Math.log1p(200. / Units.C_MS);
        assertEquals(step, grid.getStep(), 1e-18);
        assertEquals(.2, grid.getStepKms(), 1e-15);
        assertEquals(Math.log(5000.) - 10 * step, grid.get(0), 1e-12);
        assertTrue(grid.get(grid.size() - 1) >= Math.log(5010.) + 10 * step
                   - 1e-12);
        for (int i = 1; i < grid.size(); ++i)
            assertEquals(step, grid.get(i) - grid.get(i-1), 1e-12);
    }

    @Test
    void create_shouldRejectInvalidRange () {
        assertThrows(IllegalArgumentException.class,
                     () -> LogWavelengthGrid.create(5010., 5000., 200., 0));
        assertThrows(IllegalArgumentException.class,
                     () -> LogWavelengthGrid.create(0., 5000., 200., 0));
        assertThrows(IllegalArgumentException.class,
                     () -> LogWavelengthGrid.create(5000., 5010., 0., 0));
    }

    @Test
    void trimmed_shouldDropHalfSizeAtEachEnd () {
        LogWavelengthGrid grid = LogWavelengthGrid.create
            (5000., 5001., 200., 5);
        double[] t = grid.trimmed(3);
        assertEquals(grid.size() - 6, t.length);
        assertEquals(grid.get(3), t[0], 0.);
    }

    @Test
    void interp_shouldBeLinearAndClamped () {
        double[] xp = {0., 1., 3.};
        double[] fp = {1., 3., 7.};
        assertArrayEquals(new double[]{1., 1., 2., 5., 7.},
            LogWavelengthGrid.interp(new double[]{-1., 0., .5, 2., 4.},
                                     xp, fp), 1e-15);
        assertEquals(4., LogWavelengthGrid.interpUniform(1.5, 0., 1.,
                                                         new double[]{1., 3., 5., 7.}), 1e-15);
        assertEquals(7., LogWavelengthGrid.interpUniform(10., 0., 1.,
                                                         new double[]{1., 3., 5., 7.}), 0.);
        assertTrue(Double.isNaN(LogWavelengthGrid.interpUniform
                                (Double.NaN, 0., 1., fp)));
        assertEquals(3., LogWavelengthGrid.interpIndex(1., fp), 0.);
        assertEquals(5., LogWavelengthGrid.interpIndex(1.5, fp), 0.);
        assertEquals(1., LogWavelengthGrid.interpIndex(-.5, fp), 0.);
    }
}
