package com.infomedia.merchanthub.exception;

import lombok.Getter;

import java.util.List;

/**
 * The request path does not carry any configured API version. A deployment/routing defect.
 */
@Getter
public class InvalidVersionException extends RuntimeException {

    private final String path;

    public InvalidVersionException(String path, List<Integer> configuredVersions) {
        super("Path '" + path + "' does not match any configured API version " + configuredVersions);
        this.path = path;
    }
}
