package org.crynn.storage.cookie;

import org.crynn.storage.testsupport.MutableClock;
import org.crynn.storage.testsupport.TestIndexes;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CookieJarTest {

    private MutableClock clock;
    private CookieJar jar;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-05-01T10:00:00Z");
        jar = new CookieJar(TestIndexes.inMemory(), CookiePolicy.DEFAULT, clock);
    }

    @Test
    void setThenGet_roundTrip() {
        jar.set("sid=abc", "https://example.com/");

        assertThat(jar.get("https://example.com/")).containsExactly("sid=abc");
    }

    @Test
    void sameNameDomainPath_isUpsertedNotDuplicated() {
        jar.set("sid=1", "https://example.com/");
        clock.advanceSeconds(5);
        jar.set("sid=2", "https://example.com/");

        assertThat(jar.count()).isEqualTo(1);
        assertThat(jar.get("https://example.com/")).containsExactly("sid=2");
        Cookie stored = jar.find("sid", "example.com", "/").orElseThrow();
        assertThat(stored.createdAt()).isEqualTo(clock.instant().minusSeconds(5));
    }

    @Test
    void differentPathIsADifferentCookie() {
        jar.set("a=root; Path=/", "https://example.com/");
        jar.set("a=docs; Path=/docs", "https://example.com/");

        assertThat(jar.count()).isEqualTo(2);
    }

    // ----------------------------------------------------------------------
    // policy
    // ----------------------------------------------------------------------

    @Test
    void cookieSetOverHttpsIsUpgradedToSecure() {
        Cookie c = jar.set("sid=abc", "https://example.com/").orElseThrow();

        assertThat(c.secure()).isTrue();
        assertThat(jar.get("http://example.com/")).isEmpty();
        assertThat(jar.get("https://example.com/")).containsExactly("sid=abc");
    }

    @Test
    void secureUpgradeCanBeTurnedOff() {
        CookieJar lenient = new CookieJar(TestIndexes.inMemory(), new CookiePolicy(false, true), clock);
        Cookie c = lenient.set("sid=abc", "https://example.com/").orElseThrow();

        assertThat(c.secure()).isFalse();
        assertThat(lenient.get("http://example.com/")).containsExactly("sid=abc");
    }

    @Test
    void cookieSetOverHttpStaysInsecure() {
        Cookie c = jar.set("pref=1", "http://example.com/").orElseThrow();

        assertThat(c.secure()).isFalse();
        assertThat(jar.get("http://example.com/")).containsExactly("pref=1");
    }

    @Test
    void sameSiteNoneAndAbsentBecomeLax_strictIsKept() {
        assertThat(jar.set("a=1; SameSite=None", "https://example.com/").orElseThrow().sameSite()).isEqualTo(SameSite.LAX);
        assertThat(jar.set("b=1", "https://example.com/").orElseThrow().sameSite()).isEqualTo(SameSite.LAX);
        assertThat(jar.set("c=1; SameSite=Strict", "https://example.com/").orElseThrow().sameSite()).isEqualTo(SameSite.STRICT);
    }

    @Test
    void httpOnlyCookiesCanBeHiddenFromScripts() {
        jar.set("sid=1; HttpOnly", "https://example.com/");
        jar.set("ui=2", "https://example.com/");

        assertThat(jar.get("https://example.com/", false)).containsExactly("ui=2");
        assertThat(jar.get("https://example.com/", true)).containsExactlyInAnyOrder("sid=1", "ui=2");
    }

    // ----------------------------------------------------------------------
    // scoping
    // ----------------------------------------------------------------------

    @Test
    void hostOnlyCookieIsNotSentToSubdomainsOrParent() {
        jar.set("a=1", "https://www.example.com/");

        assertThat(jar.get("https://www.example.com/")).containsExactly("a=1");
        assertThat(jar.get("https://example.com/")).isEmpty();
        assertThat(jar.get("https://api.www.example.com/")).isEmpty();
    }

    @Test
    void domainCookieMatchesHostAndSubdomains() {
        Cookie c = jar.set("a=1; Domain=example.com", "https://www.example.com/").orElseThrow();

        assertThat(c.domain()).isEqualTo(".example.com");
        assertThat(jar.get("https://example.com/")).containsExactly("a=1");
        assertThat(jar.get("https://shop.example.com/cart")).containsExactly("a=1");
        assertThat(jar.get("https://notexample.com/")).isEmpty();
    }

    @Test
    void domainThatDoesNotCoverHostIsRejected() {
        assertThatThrownBy(() -> jar.set("a=1; Domain=evil.com", "https://example.com/"))
                .isInstanceOf(CookieParseException.class);
        assertThat(jar.count()).isZero();
    }

    @Test
    void pathIsAPrefixMatch() {
        jar.set("a=1; Path=/docs", "https://example.com/");

        assertThat(jar.get("https://example.com/docs/intro")).containsExactly("a=1");
        assertThat(jar.get("https://example.com/")).isEmpty();
    }

    @Test
    void pathDefaultsToRequestPath() {
        Cookie c = jar.set("a=1", "https://example.com/account").orElseThrow();
        assertThat(c.path()).isEqualTo("/account");

        Cookie root = jar.set("b=1", "https://example.com").orElseThrow();
        assertThat(root.path()).isEqualTo("/");
    }

    @Test
    void longerPathComesFirst_thenOlderCookie() {
        jar.set("root=1; Path=/", "https://example.com/");
        clock.advanceSeconds(1);
        jar.set("deep=1; Path=/a/b", "https://example.com/");
        clock.advanceSeconds(1);
        jar.set("mid=1; Path=/a", "https://example.com/");
        clock.advanceSeconds(1);
        jar.set("root2=1; Path=/", "https://example.com/");

        assertThat(jar.get("https://example.com/a/b/c"))
                .containsExactly("deep=1", "mid=1", "root=1", "root2=1");
    }

    @Test
    void getTouchesLastAccessed() {
        jar.set("a=1", "https://example.com/");
        clock.advanceSeconds(60);

        jar.get("https://example.com/");

        assertThat(jar.find("a", "example.com", "/").orElseThrow().lastAccessed()).isEqualTo(clock.instant());
    }

    // ----------------------------------------------------------------------
    // expiry
    // ----------------------------------------------------------------------

    @Test
    void expiredCookieIsNotReturned() {
        jar.set("a=1; Max-Age=60", "https://example.com/");
        clock.advanceSeconds(61);

        assertThat(jar.get("https://example.com/")).isEmpty();
    }

    @Test
    void alreadyExpiredSetCookieDeletesStoredCookie() {
        jar.set("a=1", "https://example.com/");

        assertThat(jar.set("a=; Max-Age=0", "https://example.com/")).isEmpty();

        assertThat(jar.count()).isZero();
    }

    @Test
    void cleanupRemovesExpiredButKeepsSessionCookies() {
        jar.set("session=1", "https://example.com/");
        jar.set("short=1; Max-Age=60", "https://example.com/");
        jar.set("long=1; Max-Age=86400", "https://example.com/");
        clock.advanceSeconds(120);

        assertThat(jar.cleanup()).isEqualTo(1);
        assertThat(jar.cleanup()).isZero();

        assertThat(jar.list()).extracting(Cookie::name).containsExactly("session", "long");
    }

    // ----------------------------------------------------------------------
    // bulk / admin
    // ----------------------------------------------------------------------

    @Test
    void setAllSkipsMalformedHeaders() {
        int accepted = jar.setAll(List.of("a=1", "garbage", "b=2; Path=/"), "https://example.com/");

        assertThat(accepted).isEqualTo(2);
        assertThat(jar.count()).isEqualTo(2);
    }

    @Test
    void setAllKeepsGoingPastOutOfRangeMaxAge() {
        int accepted = jar.setAll(List.of("a=1", "big=1; Max-Age=99999999999999999", "c=3"), "https://example.com/");

        assertThat(accepted).isEqualTo(3);
        assertThat(jar.get("https://example.com/")).containsExactly("a=1", "big=1", "c=3");
        assertThat(jar.find("big", "example.com", "/").orElseThrow().expiresAt())
                .isEqualTo(clock.instant().plus(SetCookieParser.MAX_LIFETIME));
    }

    @Test
    void concurrentSetsOnSameKeyLeaveOneRow() throws Exception {
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                int id = t;
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < 50; i++) {
                        jar.set("sid=" + id + "-" + i, "https://example.com/");
                        jar.get("https://example.com/");
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) f.get(30, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }

        assertThat(jar.count()).isEqualTo(1);
        assertThat(jar.get("https://example.com/")).hasSize(1);
    }

    @Test
    void malformedHeaderIsRejected() {
        assertThatThrownBy(() -> jar.set("no-equals-sign", "https://example.com/"))
                .isInstanceOf(CookieParseException.class);
    }

    @Test
    void invalidRequestUrlIsRejected() {
        assertThatThrownBy(() -> jar.set("a=1", "not a url"))
                .isInstanceOf(CookieParseException.class);
    }

    @Test
    void removeAndClear() {
        jar.set("a=1", "https://example.com/");
        jar.set("b=1", "https://example.com/");

        assertThat(jar.remove("a", "example.com", "/")).isTrue();
        assertThat(jar.remove("a", "example.com", "/")).isFalse();
        assertThat(jar.clear()).isEqualTo(1);
        assertThat(jar.count()).isZero();
    }
}
