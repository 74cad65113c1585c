package tripod.rv.core;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ParameterSetTest {

    ParameterSet sample () {
        ParameterSet ps = new ParameterSet ();
        ps.add("rv", 1.5);
        ps.addFixed("o3:bkg", 0., "o3");
        ps.add("o3:ip0", 2., ProfileShape.MIN_WIDTH, null, false, "o3");
        ps.add("atm_H2O", 1., 0., null, false, null);
        return ps;
    }

    @Test
    void freeVector_shouldSkipFixedParameters () {
        ParameterSet ps = sample ();
        assertEquals(3, ps.getFreeCount());
        assertEquals(Arrays.asList("rv", "o3:ip0", "atm_H2O"), ps.freeNames());
        assertArrayEquals(new double[]{1.5, 2., 1.}, ps.toFreeVector(), 0.);

        ps.fromFreeVector(new double[]{-3., 4., .5});
        assertEquals(-3., ps.value("rv"), 0.);
        assertEquals(4., ps.value("o3:ip0"), 0.);
        assertEquals(.5, ps.value("atm_H2O"), 0.);
        assertEquals(0., ps.value("o3:bkg"), 0.);
    }

    @Test
    void fromFreeVector_shouldRoundTrip () {
        ParameterSet ps = sample ();
        double[] v = ps.toFreeVector();
        ps.fromFreeVector(v);
        assertArrayEquals(v, ps.toFreeVector(), 0.);
    }

    @Test
    void fromFreeVector_shouldRejectWrongLength () {
        ParameterSet ps = sample ();
        ShapeMismatchException ex = assertThrows
            (ShapeMismatchException.class,
             () -> ps.fromFreeVector(new double[2]));
        assertEquals(3, ex.getExpected());
        assertEquals(2, ex.getActual());
    }

    @Test
    void get_shouldThrowForUnknownName () {
        ParameterSet ps = sample ();
        ParameterNotFoundException ex = assertThrows
            (ParameterNotFoundException.class, () -> ps.get("o4:ip0"));
        assertEquals("o4:ip0", ex.getName());
        assertEquals(2., ps.get("o3", "ip0").getValue(), 0.);
    }

    @Test
    void setValue_shouldRejectOutOfBounds () {
        ParameterSet ps = sample ();
        assertThrows(IllegalArgumentException.class,
                     () -> ps.get("atm_H2O").setValue(-.1));
        assertThrows(IllegalArgumentException.class,
                     () -> ps.fromFreeVector(new double[]{0., 0., 1.}));
        assertThrows(IllegalArgumentException.class,
                     () -> ps.add("x", 5., 0., 1.));
    }

    @Test
    void add_shouldRejectDuplicates () {
        ParameterSet ps = sample ();
        assertThrows(IllegalArgumentException.class, () -> ps.add("rv", 0.));
    }

    @Test
    void bounds_shouldDefaultToInfinity () {
        ParameterSet ps = sample ();
        assertArrayEquals(new double[]{Double.NEGATIVE_INFINITY,
                                       ProfileShape.MIN_WIDTH, 0.},
            ps.lowerBounds(), 0.);
        for (double u : ps.upperBounds())
            assertEquals(Double.POSITIVE_INFINITY, u, 0.);
    }

    @Test
    void setErrors_shouldGiveZeroToFixed () {
        ParameterSet ps = sample ();
        ps.setErrors(new double[]{.1, .2, .3});
        assertEquals(.1, ps.get("rv").getStderr(), 0.);
        assertEquals(0., ps.get("o3:bkg").getStderr(), 0.);
        ps.clearErrors();
        assertNull(ps.get("rv").getStderr());
    }

    @Test
    void group_shouldSelectByTag () {
        ParameterSet ps = sample ();
        List<Parameter> o3 = ps.group("o3");
        assertEquals(2, o3.size());
        assertEquals("o3:bkg", o3.get(0).getName());
        assertTrue(o3.get(0).isFixed());
        assertEquals(2, ps.group(null).size());
        assertEquals("rv", ps.group(null).get(0).getName());
    }

    @Test
    void merge_shouldAddSharedParametersOnce () {
        ParameterSet a = sample ();
        ParameterSet b = new ParameterSet ();
        b.add("rv", 9.);
        b.add("o4:ip0", 1., ProfileShape.MIN_WIDTH, null, false, "o4");
        b.add("atm_H2O", 2., 0., null, false, null);
        a.merge(b);
        assertEquals(5, a.size());
        assertEquals(1.5, a.value("rv"), 0.);
        assertEquals(1., a.value("atm_H2O"), 0.);
        assertEquals(1., a.value("o4:ip0"), 0.);
    }

    @Test
    void copy_shouldBeIndependent () {
        ParameterSet ps = sample ();
        ParameterSet c = ps.copy();
        c.get("rv").setValue(7.);
        assertEquals(1.5, ps.value("rv"), 0.);

        ParameterSet f = ps.copyFixing(Collections.singleton("rv"));
        assertTrue(f.get("rv").isFixed());
        assertFalse(ps.get("rv").isFixed());
        assertEquals(2, f.getFreeCount());
    }

    @Test
    void assign_shouldSkipFixedAndUnknown () {
        ParameterSet ps = sample ();
        ParameterSet other = new ParameterSet ();
        other.add("rv", 3.);
        other.add("o3:bkg", 5.);
        other.add("foo", 1.);
        ps.assign(other);
        assertEquals(3., ps.value("rv"), 0.);
        assertEquals(0., ps.value("o3:bkg"), 0.);
        assertFalse(ps.contains("foo"));
    }
}
