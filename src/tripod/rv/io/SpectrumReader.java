package tripod.rv.io;

import java.io.IOException;

import tripod.rv.core.OrderContext;

public interface SpectrumReader {
    /**
     * the next order of the spectrum, null at the end of the input
     */
    OrderContext read () throws IOException;
}
