package com.infomedia.merchanthub.exception;

import lombok.Getter;

@Getter
public class DuplicateDomainException extends RuntimeException {

    private final String domain;

    public DuplicateDomainException(String domain) {
        super("Domain '" + domain + "' is already taken");
        this.domain = domain;
    }

    public DuplicateDomainException(String domain, Throwable cause) {
        super("Domain '" + domain + "' is already taken", cause);
        this.domain = domain;
    }
}
