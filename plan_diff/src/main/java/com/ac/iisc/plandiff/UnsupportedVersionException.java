package com.ac.iisc.plandiff;

/** A version string or dialect tag that matches none of the supported report dialects. */
public class UnsupportedVersionException extends PlanParseException
{
    private final String version;

    public UnsupportedVersionException(String version) {
        super("unsupported TiDB version " + version);
        this.version = version;
    }

    public String getVersion() {
        return version;
    }
}
