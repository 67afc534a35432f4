package com.github.rudygunawan.gencache.policy;

/**
 * The single expiry predicate shared by the memory tier, the file tier and the cache façade.
 *
 * <p>An entry is expired strictly after its expiration instant: an entry read at exactly
 * {@code expiresAt} is still valid.
 */
public final class ExpirationPolicy {

    private ExpirationPolicy() {
    }

    /**
     * Returns true if {@code now} is past {@code expiresAtMillis}.
     *
     * @param expiresAtMillis the absolute expiration time, epoch milliseconds
     * @param nowMillis the time of the check, epoch milliseconds
     * @return true if the entry must no longer be served
     */
    public static boolean isExpired(long expiresAtMillis, long nowMillis) {
        return nowMillis > expiresAtMillis;
    }
}
