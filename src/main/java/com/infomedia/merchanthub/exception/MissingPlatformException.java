package com.infomedia.merchanthub.exception;

public class MissingPlatformException extends RuntimeException {

    public MissingPlatformException(String header, String validPlatforms) {
        super("Missing required header '" + header + "'. Valid values: " + validPlatforms);
    }
}
