package com.infomedia.merchanthub.multitenancy;

/**
 * The merchant user created inside a new tenant. The password arrives in plain text and is
 * hashed before it is stored.
 */
public record FirstUser(String name, String email, String password) {

    @Override
    public String toString() {
        return "FirstUser[name=" + name + ", email=" + email + "]";
    }
}
