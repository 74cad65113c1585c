package tripod.rv.io;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.junit.jupiter.api.Test;

import tripod.rv.core.OrderContext;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CsvOrderReaderTest {

    static InputStream stream (String s) {
        return new ByteArrayInputStream (s.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void readAll_shouldGroupRowsByOrder () throws Exception {
        InputStream is = getClass().getResourceAsStream("orders.csv");
        List<OrderContext> orders;
        try {
            orders = new CsvOrderReader (is).readAll();
        }
        finally {
            is.close();
        }

        assertEquals(2, orders.size());
        OrderContext o5 = orders.get(0);
        assertEquals(5, o5.getOrder());
        assertEquals(4, o5.size());
        assertArrayEquals(new double[]{0., 1., 2., 3.}, o5.getPixel(), 0.);
        assertEquals(5000.05, o5.getWave(1), 0.);
        assertTrue(Double.isNaN(o5.getFlux(2)));
        assertEquals(4, o5.getFlag(3));
        assertTrue(o5.hasBlaze());
        assertEquals(.95, o5.getBlaze(1), 0.);
        assertEquals("2021-03-04T05:06:07", o5.getDateObs());
        assertEquals(-12.345, o5.getBerv(), 0.);

        OrderContext o6 = orders.get(1);
        assertEquals(6, o6.getOrder());
        assertEquals(3, o6.size());
        assertTrue(Double.isNaN(o6.getFlux(1)));
        assertEquals(0, o6.getFlag(1));
        assertEquals(-12.345, o6.getBerv(), 0.);
    }

    @Test
    void read_shouldWorkWithoutBlazeAndMetadata () throws Exception {
        CsvOrderReader reader = new CsvOrderReader
            (stream ("Order,Pixel,Wave,Flux,Err,Flag\n"
                     +"1,0,5000,1,0.1,0\n"
                     +"1,1,5001,2,0.1,0\n"));
        OrderContext ctx = reader.read();
        assertFalse(ctx.hasBlaze());
        assertEquals(1., ctx.getBlaze(0), 0.);
        assertNull(ctx.getBerv());
        assertNull(ctx.getDateObs());
        assertNull(reader.read());
    }

    @Test
    void constructor_shouldRequireColumns () {
        assertThrows(IllegalArgumentException.class,
                     () -> new CsvOrderReader
                     (stream ("order,pixel,wave,flux\n1,0,5000,1\n")));
        assertThrows(IllegalArgumentException.class,
                     () -> new CsvOrderReader (stream ("# only comments\n")));
    }

    @Test
    void tokenizer_shouldHonorQuotesAndEmptyTokens () {
        String[] toks = CsvOrderReader.tokenizer("a,\"b,c\",,d,", ',');
        assertArrayEquals(new String[]{"a", "b,c", null, "d", null}, toks);
        assertTrue(Double.isNaN(CsvOrderReader.number(" NaN ")));
        assertTrue(Double.isNaN(CsvOrderReader.number("n/a")));
        assertEquals(2.5, CsvOrderReader.number("2.5"), 0.);
        assertThrows(NumberFormatException.class,
                     () -> CsvOrderReader.number("abc"));
    }
}
