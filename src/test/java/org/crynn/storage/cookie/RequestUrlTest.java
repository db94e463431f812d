package org.crynn.storage.cookie;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RequestUrlTest {

    @Test
    void lowercasesSchemeAndHostAndDefaultsPath() {
        RequestUrl url = RequestUrl.parse("HTTPS://WWW.Example.COM");

        assertEquals("https", url.scheme());
        assertEquals("www.example.com", url.host());
        assertEquals("/", url.path());
        assertTrue(url.isSecure());
    }

    @Test
    void wssIsSecureAndHttpIsNot() {
        assertTrue(RequestUrl.parse("wss://example.com/socket").isSecure());
        assertFalse(RequestUrl.parse("http://example.com/").isSecure());
    }

    @Test
    void candidateDomainsCoverHostAndParents() {
        assertEquals(List.of("a.b.example.com", ".a.b.example.com", ".b.example.com", ".example.com", ".com"),
                RequestUrl.parse("https://a.b.example.com/x").candidateDomains());
    }

    @Test
    void rejectsUrlsWithoutHost() {
        assertThrows(IllegalArgumentException.class, () -> RequestUrl.parse("mailto:someone@example.com"));
        assertThrows(IllegalArgumentException.class, () -> RequestUrl.parse(""));
    }

    @Test
    void policyDowngradesSameSiteNone() {
        assertEquals(SameSite.LAX, CookiePolicy.DEFAULT.effectiveSameSite(SameSite.NONE));
        assertEquals(SameSite.NONE, new CookiePolicy(true, false).effectiveSameSite(SameSite.NONE));
        assertEquals(SameSite.LAX, CookiePolicy.DEFAULT.effectiveSameSite(null));
    }
}
