package com.yourcompany.entraid.tools;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.OffsetDateTime;

import org.identityconnectors.common.security.GuardedString;
import org.junit.jupiter.api.Test;

public class EntraIDCredentialProviderTest {

    @Test
    public void scopeFollowsGraphEndpoint() {
        assertThat(EntraIDCredentialProvider.defaultScope("https://graph.microsoft.com"))
                .isEqualTo("https://graph.microsoft.com/.default");
        assertThat(EntraIDCredentialProvider.defaultScope("https://graph.microsoft.us/"))
                .isEqualTo("https://graph.microsoft.us/.default");
    }

    @Test
    public void refusesIncompleteConfiguration() {
        EntraIDConfiguration configuration = new EntraIDConfiguration();
        configuration.setTenantId("tenant");
        configuration.setClientSecret(new GuardedString("secret".toCharArray()));

        assertThatThrownBy(() -> new EntraIDCredentialProvider(configuration))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void tokenNeverPrintsItsValue() {
        BearerToken token = new BearerToken("eyJ0eXAiOiJKV1Qi", OffsetDateTime.parse("2026-10-17T12:00:00Z"));

        assertThat(token.toString()).doesNotContain("eyJ0eXAiOiJKV1Qi").contains("2026-10-17T12:00Z");
    }

    @Test
    public void rejectsEmptyToken() {
        assertThatThrownBy(() -> new BearerToken("", null)).isInstanceOf(IllegalArgumentException.class);
    }
}
