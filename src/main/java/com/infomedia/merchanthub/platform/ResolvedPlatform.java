package com.infomedia.merchanthub.platform;

/**
 * The (version, platform) pair a unit of work is served with.
 */
public record ResolvedPlatform(int version, Platform platform) {

    public String versionSegment() {
        return "v" + version;
    }

    @Override
    public String toString() {
        return versionSegment() + "/" + platform.getTag();
    }
}
