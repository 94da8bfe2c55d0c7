package org.foxesworld.strider.engine;

public final class StriderVersion {

    public static final String NAME = "Strider";
    public static final String VERSION = resolveVersion();
    public static final String ASSETSDIR = System.getProperty("strider.assets", "assets");

    private static String resolveVersion() {
        String v = StriderVersion.class.getPackage().getImplementationVersion();
        return v != null ? v : "dev";
    }

    private StriderVersion() {}
}
