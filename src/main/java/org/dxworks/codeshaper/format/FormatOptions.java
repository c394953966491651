package org.dxworks.codeshaper.format;

public class FormatOptions {

    private static final FormatOptions DEFAULTS = new FormatOptions(true, false);

    private final boolean fix;
    private final boolean check;

    private FormatOptions(boolean fix, boolean check) {
        this.fix = fix;
        this.check = check;
    }

    public static FormatOptions defaults() {
        return DEFAULTS;
    }

    /**
     * Reports what would change without writing anything.
     */
    public static FormatOptions checkOnly() {
        return new FormatOptions(false, true);
    }

    public boolean shouldWrite() {
        return fix && !check;
    }
}
