package com.infomedia.merchanthub.exception;

import lombok.Getter;

@Getter
public class InvalidSubdomainException extends RuntimeException {

    private final String subdomain;

    public InvalidSubdomainException(String subdomain, String reason) {
        super("Subdomain '" + subdomain + "' " + reason);
        this.subdomain = subdomain;
    }
}
