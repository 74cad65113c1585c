package tripod.rv.core;

/**
 * Free-parameter vector does not match the parameter set it is applied to.
 */
public class ShapeMismatchException extends IllegalArgumentException {
    private static final long serialVersionUID = 0x3c1f6a02b7d4e511l;

    private final int expected;
    private final int actual;

    public ShapeMismatchException (int expected, int actual) {
        super ("Free vector has "+actual+" element(s); expecting "+expected);
        this.expected = expected;
        this.actual = actual;
    }

    public int getExpected () { return expected; }
    public int getActual () { return actual; }
}
