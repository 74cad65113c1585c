package tripod.rv.core;

public class ParameterNotFoundException extends IllegalArgumentException {
    private static final long serialVersionUID = 0x6e0d95f2a4c3b017l;

    private final String name;

    public ParameterNotFoundException (String name) {
        super ("No such parameter: "+name);
        this.name = name;
    }

    public String getName () { return name; }
}
