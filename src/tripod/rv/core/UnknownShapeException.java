package tripod.rv.core;

public class UnknownShapeException extends IllegalArgumentException {
    private static final long serialVersionUID = 0x1b8e27c45fa06d93l;

    public UnknownShapeException (String tag) {
        super ("Unknown instrumental profile shape: \""+tag+"\"");
    }
}
