package com.infomedia.merchanthub.platform;

import com.infomedia.merchanthub.exception.InvalidVersionException;
import com.infomedia.merchanthub.exception.MissingPlatformException;
import com.infomedia.merchanthub.exception.UnknownPlatformException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Works out which API version and client platform a request is served with.
 * <p>
 * Console and administrative invocations have no request to inspect and get the first
 * configured version and platform. Real traffic never falls back: the path must name a
 * configured version and the selector header must name a configured platform.
 */
@Component
@RequiredArgsConstructor
public class PlatformDetector {

    private final PlatformProperties properties;

    public ResolvedPlatform detect(RequestDescriptor descriptor) {
        if (descriptor == null || descriptor.console()) {
            return fallback();
        }

        int version = detectVersion(descriptor.path());
        Platform platform = detectPlatform(descriptor);
        return new ResolvedPlatform(version, platform);
    }

    public ResolvedPlatform fallback() {
        List<Integer> versions = properties.getVersions();
        List<Platform> platforms = properties.getPlatforms();
        if (versions.isEmpty() || platforms.isEmpty()) {
            throw new IllegalStateException("At least one API version and one platform must be configured");
        }
        return new ResolvedPlatform(versions.get(0), platforms.get(0));
    }

    private int detectVersion(String path) {
        String normalized = path == null ? "" : path.replaceFirst("^/+", "");
        for (Integer version : properties.getVersions()) {
            if (normalized.startsWith("api/v" + version + "/")) {
                return version;
            }
        }
        throw new InvalidVersionException(path, properties.getVersions());
    }

    private Platform detectPlatform(RequestDescriptor descriptor) {
        String header = properties.getHeader();
        String value = descriptor.header(header);
        if (value == null || value.isBlank()) {
            throw new MissingPlatformException(header, validPlatforms());
        }

        Optional<Platform> platform = Platform.fromTag(value)
                .filter(properties.getPlatforms()::contains);
        return platform.orElseThrow(() -> new UnknownPlatformException(header, value, validPlatforms()));
    }

    private String validPlatforms() {
        return properties.getPlatforms().stream()
                .map(Platform::getTag)
                .collect(Collectors.joining(", ", "[", "]"));
    }
}
