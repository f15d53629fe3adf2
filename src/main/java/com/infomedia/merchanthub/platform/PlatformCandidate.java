package com.infomedia.merchanthub.platform;

/**
 * One concrete implementation of a contract and the platform it serves.
 */
public record PlatformCandidate<T>(Class<? extends T> implementation, Platform platform) {
}
