package com.fintech.marketdata.fetch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Credentials taken from configuration: an app id plus either an inline access
 * token or a token file written by an external login process. The file is
 * re-read on every call so a refreshed token is picked up without a restart.
 */
public class ConfiguredCredentialsProvider implements CredentialsProvider {

    private static final Logger log = LoggerFactory.getLogger(ConfiguredCredentialsProvider.class);

    private final String appId;
    private final String accessToken;
    private final Path tokenFile;

    public ConfiguredCredentialsProvider(String appId, String accessToken, Path tokenFile) {
        this.appId = appId;
        this.accessToken = accessToken;
        this.tokenFile = tokenFile;
    }

    @Override
    public String authorizationHeader() {
        if (appId == null || appId.isBlank()) {
            throw new AuthException("No app id configured (ingestion.fetch.app-id)");
        }
        String token = resolveToken();
        if (token == null || token.isBlank()) {
            throw new AuthException("No access token available for app id " + appId);
        }
        return appId + ":" + token.trim();
    }

    private String resolveToken() {
        if (accessToken != null && !accessToken.isBlank()) {
            return accessToken;
        }
        if (tokenFile == null) {
            return null;
        }
        try {
            return Files.readString(tokenFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.error("Cannot read access token file: path={}", tokenFile, e);
            throw new AuthException("Access token file unreadable: " + tokenFile);
        }
    }
}
