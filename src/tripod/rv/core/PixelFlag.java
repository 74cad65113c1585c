package tripod.rv.core;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-pixel quality bits; a pixel is good when its flag is {@link #OK}.
 */
public final class PixelFlag {
    public static final int OK = 0;
    public static final int NAN = 1;
    public static final int NEG = 2;
    public static final int SAT = 4;
    public static final int ATM = 8;
    public static final int SKY = 16;
    public static final int OUT = 32;
    public static final int CLIP = 64;
    public static final int LOWQ = 128;
    public static final int BADT = 256;
    public static final int CHUNK = 512;

    static final String[] NAMES = {
        "nan", "neg", "sat", "atm", "sky", "out", 
        "clip", "lowQ", "badT", "chunk"
    };

    private PixelFlag () {}

    public static boolean isGood (int flag) { return flag == OK; }

    /**
     * names of the bits set in flag; "ok" for a good pixel
     */
    public static List<String> names (int flag) {
        List<String> names = new ArrayList<String>();
        if (flag == OK) {
            names.add("ok");
        }
        else {
            for (int i = 0; i < NAMES.length; ++i)
                if ((flag & (1 << i)) != 0)
                    names.add(NAMES[i]);
        }
        return names;
    }
}
