package com.infomedia.merchanthub.exception;

public class UnknownPlatformException extends RuntimeException {

    public UnknownPlatformException(String header, String value, String validPlatforms) {
        super("Unknown platform '" + value + "' in header '" + header + "'. Valid values: " + validPlatforms);
    }
}
