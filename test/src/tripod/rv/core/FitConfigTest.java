package tripod.rv.core;

import java.io.InputStream;
import java.util.Arrays;
import java.util.Properties;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FitConfigTest {

    @Test
    void defaults_shouldBeValid () {
        FitConfig c = new FitConfig ().validate();
        assertNull(c.getOrders());
        assertSame(FitConfig.Telluric.ADD, c.getTelluric());
        assertSame(ProfileShape.GAUSSIAN, c.getIpShape());
        assertEquals(3, c.getDegNorm());
        assertEquals(3, c.getDegWave());
        assertEquals(50, c.getIpHalfSize());
        assertEquals(0., c.getKapsigLow(), 0.);
        assertEquals(3., c.getKapsigHigh(), 0.);
        assertEquals(5, c.getMaxClipIterations());
        assertEquals(200., c.getGridStepMs(), 0.);
        assertTrue(c.getPrefit());
        assertFalse(c.getTellShift());
    }

    @Test
    void load_shouldReadEveryKey () throws Exception {
        InputStream is = getClass().getResourceAsStream
            ("/tripod/rv/fit.properties");
        assertNotNull(is);
        FitConfig c;
        try {
            c = FitConfig.load(is);
        }
        finally {
            is.close();
        }

        assertEquals(Arrays.asList(5, 6), c.getOrders());
        assertSame(FitConfig.Telluric.ADD, c.getTelluric());
        assertEquals(Arrays.asList("H2O", "CO2"), c.getMolecules());
        assertTrue(c.getTellShift());
        assertEquals(2, c.getDegNorm());
        assertEquals(3, c.getDegWave());
        assertSame(ProfileShape.SUPER_GAUSSIAN, c.getIpShape());
        assertEquals(40, c.getIpHalfSize());
        assertEquals(-12.5, c.getRvGuess(), 0.);
        assertEquals(3.25, c.getBerv(), 0.);
        assertEquals(4., c.getKapsigLow(), 0.);
        assertEquals(3., c.getKapsigHigh(), 0.);
        assertSame(FitConfig.Weighting.ERROR, c.getWeighting());
        assertEquals(8, c.getMaxClipIterations());
        assertEquals(0., c.getPreclip(), 0.);
        assertEquals(80., c.getVcut(), 0.);
        assertEquals(250., c.getGridStepMs(), 0.);
        assertFalse(c.getPrefit());
        assertTrue(c.getAbsoluteSigma());
        assertEquals(200, c.getMaxIterations());
        assertEquals(5000, c.getMaxEvaluations());
    }

    @Test
    void fromProperties_shouldRejectInvalidValues () {
        Properties p = new Properties ();
        p.setProperty("ip", "band");
        assertThrows(UnknownShapeException.class,
                     () -> FitConfig.fromProperties(p));

        Properties q = new Properties ();
        q.setProperty("kapsig.high", "-1");
        assertThrows(IllegalArgumentException.class,
                     () -> FitConfig.fromProperties(q));

        Properties r = new Properties ();
        r.setProperty("deg.wave", "-1");
        assertThrows(IllegalArgumentException.class,
                     () -> FitConfig.fromProperties(r));
    }

    @Test
    void fromProperties_shouldIgnoreUnknownKeys () {
        Properties p = new Properties ();
        p.setProperty("no.such.key", "1");
        p.setProperty("telluric", "off");
        FitConfig c = FitConfig.fromProperties(p);
        assertSame(FitConfig.Telluric.OFF, c.getTelluric());
    }

    @Test
    void copy_shouldBeIndependent () {
        FitConfig c = new FitConfig ().setOrders(Arrays.asList(1, 2))
            .setKapsig(2., 4.);
        FitConfig d = c.copy();
        d.setKapsig(0., 0.).setIpShape("lor");
        assertEquals(2., c.getKapsigLow(), 0.);
        assertSame(ProfileShape.GAUSSIAN, c.getIpShape());
        assertSame(ProfileShape.LORENTZIAN, d.getIpShape());
        assertEquals(c.getOrders(), d.getOrders());
    }
}
