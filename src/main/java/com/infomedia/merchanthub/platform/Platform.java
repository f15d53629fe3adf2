package com.infomedia.merchanthub.platform;

import lombok.Getter;

import java.util.Arrays;
import java.util.Optional;

/**
 * Client surfaces a request can come from. Used only as a routing key.
 */
@Getter
public enum Platform {

    WEB("web"),
    MOBILE("mobile");

    private final String tag;

    Platform(String tag) {
        this.tag = tag;
    }

    public static Optional<Platform> fromTag(String tag) {
        if (tag == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(platform -> platform.tag.equalsIgnoreCase(tag))
                .findFirst();
    }

    @Override
    public String toString() {
        return tag;
    }
}
