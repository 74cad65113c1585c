package tripod.rv.core;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AtmosphereTest {

    Atmosphere sample () {
        return new Atmosphere ()
            .add(Synthetic.lines("H2O", 4990., 5020., .005,
                                 new double[]{5003.}, .5, .05))
            .add(Synthetic.lines("CO2", 4990., 5020., .005,
                                 new double[]{5006.}, .3, .05));
    }

    @Test
    void flatCell_shouldBeExactlyOne () {
        double[] cell = Atmosphere.flatCell(1000);
        assertEquals(1000, cell.length);
        for (double c : cell)
            assertEquals(1., c, 0.);
    }

    @Test
    void select_shouldHonorAllAndIgnoreMissing () {
        Atmosphere atm = sample ();
        assertEquals(Arrays.asList("H2O", "CO2"), atm.select(null));
        assertEquals(Arrays.asList("H2O", "CO2"),
                     atm.select(Collections.singletonList(Atmosphere.ALL)));
        List<String> sel = atm.select(Arrays.asList("CO2", "CH4"));
        assertEquals(Collections.singletonList("CO2"), sel);
        assertThrows(IllegalArgumentException.class,
                     () -> atm.getMolecule("CH4"));
        assertTrue(Atmosphere.none().isEmpty());
    }

    @Test
    void resample_shouldFollowTheSeries () {
        Atmosphere atm = sample ();
        LogWavelengthGrid grid = LogWavelengthGrid.create
            (5000., 5010., 200., 10);
        double[] t = atm.resample("H2O", grid);
        int min = 0;
        for (int j = 1; j < t.length; ++j)
            if (t[j] < t[min])
                min = j;
        assertEquals(5003., Math.exp(grid.get(min)), .005);
        assertEquals(.5, t[min], .01);
        assertTrue(Atmosphere.stddev(t) > Atmosphere.stddev
                   (Atmosphere.flatCell(t.length)));
    }

    @Test
    void shift_shouldMoveFeaturesRedwardForPositiveVelocity () {
        Atmosphere atm = sample ();
        LogWavelengthGrid grid = LogWavelengthGrid.create
            (5000., 5010., 200., 10);
        double[] t = atm.resample("H2O", grid);
        // 10 samples of 200 m/s
        double[] s = Atmosphere.shift(grid, t, 2000.);
        int m0 = argmin (t), m1 = argmin (s);
        assertEquals(10, m1 - m0);
        assertEquals(t[m0], s[m1], 1e-6);

    }

    @Test
    void shift_shouldBeExactIdentityAtZeroVelocity () {
        LogWavelengthGrid grid = LogWavelengthGrid.create
            (5000., 5010., 200., 10);
        double[] t = sample ().resample("H2O", grid);
        assertArrayEquals(t, Atmosphere.shift(grid, t, 0.), 0.);
    }

    static int argmin (double[] x) {
        int m = 0;
        for (int j = 1; j < x.length; ++j)
            if (x[j] < x[m])
                m = j;
        return m;
    }
}
