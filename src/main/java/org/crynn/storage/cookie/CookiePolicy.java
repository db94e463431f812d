package org.crynn.storage.cookie;

/**
 * Hardening rules applied when a cookie is stored.
 *
 * @param upgradeSecureOnTls    force {@code secure=true} for cookies set over https, whatever the server asserted
 * @param downgradeSameSiteNone store {@code SameSite=None} as {@code Lax}
 */
public record CookiePolicy(boolean upgradeSecureOnTls, boolean downgradeSameSiteNone) {

    public static final boolean UPGRADE_SECURE_ON_TLS = true;
    public static final boolean DOWNGRADE_SAME_SITE_NONE = true;

    public static final CookiePolicy DEFAULT = new CookiePolicy(UPGRADE_SECURE_ON_TLS, DOWNGRADE_SAME_SITE_NONE);

    /** SameSite value to store for what the server asked for ({@code null} when absent). */
    public SameSite effectiveSameSite(SameSite requested) {
        if (requested == null) return SameSite.LAX;
        if (requested == SameSite.NONE && downgradeSameSiteNone) return SameSite.LAX;
        return requested;
    }

    public boolean effectiveSecure(boolean requested, RequestUrl request) {
        return requested || (upgradeSecureOnTls && request.isSecure());
    }
}
