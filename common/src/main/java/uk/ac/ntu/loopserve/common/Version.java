package uk.ac.ntu.loopserve.common;

public final class Version {
    private Version() {}

    public static final String NAME = "loopserve";
    public static final String VERSION = "1.0.0";
}
