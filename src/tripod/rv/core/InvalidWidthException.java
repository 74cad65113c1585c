package tripod.rv.core;

public class InvalidWidthException extends IllegalArgumentException {
    private static final long serialVersionUID = 0x52a90d3e81f7c6b4l;

    public InvalidWidthException (ProfileShape shape, int index, double width) {
        super (shape+": width parameter "+index+" must be positive; got "
               +width);
    }
}
