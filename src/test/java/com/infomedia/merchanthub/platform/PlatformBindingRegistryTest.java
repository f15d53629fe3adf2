package com.infomedia.merchanthub.platform;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PlatformBindingRegistryTest {

    interface Greeter {
        String greet();
    }

    static class WebGreeter implements Greeter {
        @Override
        public String greet() {
            return "web";
        }
    }

    static class MobileGreeter implements Greeter {
        @Override
        public String greet() {
            return "mobile";
        }
    }

    @Test
    void keepsRegistrationOrderPerVersionAndContract() {
        PlatformBindingRegistry registry = new PlatformBindingRegistry()
                .register(1, Greeter.class, WebGreeter.class, Platform.WEB)
                .register(1, Greeter.class, MobileGreeter.class, Platform.MOBILE);

        List<PlatformCandidate<Greeter>> candidates = registry.implementationsFor(1, Greeter.class);

        assertThat(candidates).extracting(PlatformCandidate::platform).containsExactly(Platform.WEB, Platform.MOBILE);
        assertThat(candidates).extracting(PlatformCandidate::implementation)
                .containsExactly(WebGreeter.class, MobileGreeter.class);
    }

    @Test
    void unknownPairYieldsEmptyList() {
        PlatformBindingRegistry registry = new PlatformBindingRegistry()
                .register(1, Greeter.class, WebGreeter.class, Platform.WEB);

        assertThat(registry.implementationsFor(2, Greeter.class)).isEmpty();
        assertThat(registry.implementationsFor(1, Runnable.class)).isEmpty();
    }

    @Test
    void secondImplementationForSamePlatformIsRejected() {
        PlatformBindingRegistry registry = new PlatformBindingRegistry()
                .register(1, Greeter.class, WebGreeter.class, Platform.WEB);

        assertThatThrownBy(() -> registry.register(1, Greeter.class, MobileGreeter.class, Platform.WEB))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("WebGreeter");
    }

    @Test
    void samePlatformMayServeAnotherVersion() {
        PlatformBindingRegistry registry = new PlatformBindingRegistry()
                .register(1, Greeter.class, WebGreeter.class, Platform.WEB)
                .register(2, Greeter.class, MobileGreeter.class, Platform.WEB);

        assertThat(registry.implementationsFor(2, Greeter.class))
                .singleElement()
                .extracting(PlatformCandidate::implementation)
                .isEqualTo(MobileGreeter.class);
    }

    @Test
    @SuppressWarnings({"unchecked", "rawtypes"})
    void implementationMustFulfilTheContract() {
        PlatformBindingRegistry registry = new PlatformBindingRegistry();
        Class contract = Runnable.class;

        assertThatThrownBy(() -> registry.register(1, contract, WebGreeter.class, Platform.WEB))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void returnedListIsReadOnly() {
        PlatformBindingRegistry registry = new PlatformBindingRegistry()
                .register(1, Greeter.class, WebGreeter.class, Platform.WEB);

        assertThatThrownBy(() -> registry.implementationsFor(1, Greeter.class).clear())
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
