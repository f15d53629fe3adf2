package com.infomedia.merchanthub.platform;

import com.infomedia.merchanthub.exception.InvalidVersionException;
import com.infomedia.merchanthub.exception.MissingPlatformException;
import com.infomedia.merchanthub.exception.UnknownPlatformException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PlatformDetectorTest {

    private PlatformProperties properties;
    private PlatformDetector detector;

    @BeforeEach
    void setUp() {
        properties = new PlatformProperties();
        detector = new PlatformDetector(properties);
    }

    @Test
    void detectsVersionFromPathAndPlatformFromHeader() {
        ResolvedPlatform resolved = detector.detect(
                RequestDescriptor.of("/api/v1/merchant/auth/sign-up", Map.of("X-Platform", "mobile")));

        assertThat(resolved.version()).isEqualTo(1);
        assertThat(resolved.platform()).isEqualTo(Platform.MOBILE);
        assertThat(resolved).hasToString("v1/mobile");
    }

    @Test
    void headerNameAndValueAreCaseInsensitive() {
        ResolvedPlatform resolved = detector.detect(
                RequestDescriptor.of("/api/v1/merchant/roles", Map.of("x-platform", "WEB")));

        assertThat(resolved.platform()).isEqualTo(Platform.WEB);
    }

    @Test
    void paddedPlatformValueIsUnknown() {
        RequestDescriptor descriptor = RequestDescriptor.of("/api/v1/merchant/roles", Map.of("X-Platform", " web "));

        assertThatThrownBy(() -> detector.detect(descriptor))
                .isInstanceOf(UnknownPlatformException.class)
                .hasMessageContaining("[web, mobile]");
    }

    @Test
    void consoleInvocationGetsFirstConfiguredVersionAndPlatform() {
        properties.setVersions(new ArrayList<>(List.of(2, 1)));
        properties.setPlatforms(new ArrayList<>(List.of(Platform.MOBILE, Platform.WEB)));

        assertThat(detector.detect(RequestDescriptor.forConsole())).isEqualTo(new ResolvedPlatform(2, Platform.MOBILE));
        assertThat(detector.detect(null)).isEqualTo(new ResolvedPlatform(2, Platform.MOBILE));
    }

    @Test
    void unknownVersionIsRejected() {
        RequestDescriptor descriptor = RequestDescriptor.of("/api/v9/merchant/roles", Map.of("X-Platform", "web"));

        assertThatThrownBy(() -> detector.detect(descriptor))
                .isInstanceOf(InvalidVersionException.class)
                .hasMessageContaining("/api/v9/merchant/roles");
    }

    @Test
    void versionMustBeAWholePathSegment() {
        properties.setVersions(new ArrayList<>(List.of(1)));
        RequestDescriptor descriptor = RequestDescriptor.of("/api/v10/merchant/roles", Map.of("X-Platform", "web"));

        assertThatThrownBy(() -> detector.detect(descriptor)).isInstanceOf(InvalidVersionException.class);
    }

    @Test
    void missingHeaderIsRejectedWithValidValues() {
        RequestDescriptor descriptor = RequestDescriptor.of("/api/v1/merchant/roles", Map.of());

        assertThatThrownBy(() -> detector.detect(descriptor))
                .isInstanceOf(MissingPlatformException.class)
                .hasMessageContaining("X-Platform")
                .hasMessageContaining("[web, mobile]");
    }

    @Test
    void blankHeaderCountsAsMissing() {
        RequestDescriptor descriptor = RequestDescriptor.of("/api/v1/merchant/roles", Map.of("X-Platform", "  "));

        assertThatThrownBy(() -> detector.detect(descriptor)).isInstanceOf(MissingPlatformException.class);
    }

    @Test
    void unknownPlatformIsRejectedWithoutFallback() {
        RequestDescriptor descriptor = RequestDescriptor.of("/api/v1/merchant/roles", Map.of("X-Platform", "desktop"));

        assertThatThrownBy(() -> detector.detect(descriptor))
                .isInstanceOf(UnknownPlatformException.class)
                .hasMessageContaining("desktop");
    }

    @Test
    void platformNotEnabledInConfigurationIsUnknown() {
        properties.setPlatforms(new ArrayList<>(List.of(Platform.WEB)));
        RequestDescriptor descriptor = RequestDescriptor.of("/api/v1/merchant/roles", Map.of("X-Platform", "mobile"));

        assertThatThrownBy(() -> detector.detect(descriptor)).isInstanceOf(UnknownPlatformException.class);
    }

    @Test
    void fallbackNeedsConfiguration() {
        properties.setVersions(new ArrayList<>());

        assertThatThrownBy(() -> detector.fallback()).isInstanceOf(IllegalStateException.class);
    }
}
