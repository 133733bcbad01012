package com.fintech.marketdata.fetch;

/**
 * Supplies the credentials for history calls. Acquiring and refreshing tokens
 * happens outside this service; implementations only read what is there.
 */
public interface CredentialsProvider {

    /**
     * Returns the value of the {@code Authorization} header.
     *
     * @throws AuthException if no usable credentials are available
     */
    String authorizationHeader();
}
