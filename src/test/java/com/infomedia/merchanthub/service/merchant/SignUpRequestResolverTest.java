package com.infomedia.merchanthub.service.merchant;

import com.infomedia.merchanthub.dto.auth.SignUpRequest;
import com.infomedia.merchanthub.exception.DuplicateDomainException;
import com.infomedia.merchanthub.exception.InvalidSubdomainException;
import com.infomedia.merchanthub.multitenancy.FirstUser;
import com.infomedia.merchanthub.multitenancy.TenancyProperties;
import com.infomedia.merchanthub.multitenancy.TenantDirectoryService;
import com.infomedia.merchanthub.platform.Platform;
import com.infomedia.merchanthub.service.merchant.mobile.MobileSignUpRequestResolver;
import com.infomedia.merchanthub.service.merchant.web.WebSignUpRequestResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SignUpRequestResolverTest {

    private TenantDirectoryService directoryService;
    private TenancyProperties tenancyProperties;
    private SignUpRequestResolver resolver;

    @BeforeEach
    void setUp() {
        directoryService = mock(TenantDirectoryService.class);
        when(directoryService.isDomainUnique(anyString())).thenReturn(true);
        tenancyProperties = new TenancyProperties();
        resolver = new WebSignUpRequestResolver(directoryService, tenancyProperties);
    }

    @Test
    void buildsTheFullDomainAndTheOwner() {
        SignUpCommand command = resolver.resolve(request("store1"));

        assertThat(command.merchantDomain()).isEqualTo("store1.example.com");
        assertThat(command.merchantName()).isEqualTo("Store 1");
        assertThat(command.owner()).isEqualTo(new FirstUser("Store Owner", "owner@store1.example.com", "s3cret-pass"));
    }

    @Test
    void normalisesTheSubdomain() {
        assertThat(AbstractSignUpRequestResolver.normalizeSubdomain("  My  Store ")).isEqualTo("my-store");
        assertThat(AbstractSignUpRequestResolver.normalizeSubdomain("Shop.example.org")).isEqualTo("shop");
        assertThat(AbstractSignUpRequestResolver.normalizeSubdomain(null)).isEmpty();
    }

    @Test
    void baseDomainMayCarryAPort() {
        tenancyProperties.setBaseDomain("localhost:8080");

        assertThat(resolver.resolve(request("store1")).merchantDomain()).isEqualTo("store1.localhost");
    }

    @Test
    void rejectsEmptySubdomain() {
        assertThatThrownBy(() -> resolver.resolve(request("  ")))
                .isInstanceOf(InvalidSubdomainException.class)
                .hasMessageContaining("empty");
    }

    @Test
    void rejectsOuterHyphensAndSymbols() {
        assertThatThrownBy(() -> resolver.resolve(request("-store"))).isInstanceOf(InvalidSubdomainException.class);
        assertThatThrownBy(() -> resolver.resolve(request("store-"))).isInstanceOf(InvalidSubdomainException.class);
        assertThatThrownBy(() -> resolver.resolve(request("st@re"))).isInstanceOf(InvalidSubdomainException.class);
    }

    @Test
    void rejectsOverlongSubdomain() {
        String tooLong = "a".repeat(AbstractSignUpRequestResolver.MAX_SUBDOMAIN_LENGTH + 1);

        assertThatThrownBy(() -> resolver.resolve(request(tooLong))).isInstanceOf(InvalidSubdomainException.class);
    }

    @Test
    void rejectsTakenDomain() {
        when(directoryService.isDomainUnique("store1.example.com")).thenReturn(false);

        assertThatThrownBy(() -> resolver.resolve(request("Store1")))
                .isInstanceOf(DuplicateDomainException.class)
                .hasMessageContaining("store1.example.com");
    }

    @Test
    void eachPlatformHasItsOwnResolver() {
        assertThat(resolver.platform()).isEqualTo(Platform.WEB);
        assertThat(new MobileSignUpRequestResolver(directoryService, tenancyProperties).platform())
                .isEqualTo(Platform.MOBILE);
    }

    private static SignUpRequest request(String subdomain) {
        return new SignUpRequest("Store Owner", "owner@store1.example.com", "s3cret-pass",
                "Store 1", "First store", subdomain);
    }
}
