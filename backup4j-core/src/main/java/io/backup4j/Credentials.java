package io.backup4j;

import java.util.Objects;

/**
 * Decrypted connection details handed to an adapter constructor. Never persisted.
 *
 * @param url      backend location; its scheme and layout are adapter specific
 * @param login    optional user name / access key
 * @param password optional password / secret key
 * @param apiKey   optional token; some adapters read it as an endpoint override
 */
public record Credentials(String url, String login, String password, String apiKey) {

    public Credentials {
        Objects.requireNonNull(url, "url must not be null");
    }

    public static Credentials of(String url) {
        return new Credentials(url, null, null, null);
    }

    public boolean hasLogin() {
        return login != null && !login.isBlank() && password != null;
    }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public String toString() {
        return "Credentials[url=" + url + ", login=" + login
                + ", password=" + (password == null ? null : "***")
                + ", apiKey=" + (apiKey == null ? null : "***") + "]";
    }
}
