package com.migranet.config;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Collapses the credential key aliases people actually type
 * (username, uid, login, pwd, passwd, jdbc-url ...) into ConnectionCredentials.
 */
public final class CredentialNormalizer {

    private static final List<String> USER_KEYS     = List.of("user", "username", "uid", "login", "user_id", "user-id");
    private static final List<String> PASSWORD_KEYS = List.of("password", "pwd", "passwd", "pass");
    private static final List<String> URL_KEYS      = List.of("url", "jdbc-url", "jdbc_url", "jdbcurl", "connection-string", "connection_string");

    private CredentialNormalizer() {}

    /**
     * @param label   endpoint name used in error messages ("source", "target")
     * @param raw     key/value map as bound from configuration
     * @throws IllegalArgumentException when url or user is missing
     */
    public static ConnectionCredentials normalize(String label, Map<String, String> raw) {
        Map<String, String> lowered = new HashMap<>();
        if (raw != null) {
            raw.forEach((k, v) -> {
                if (k != null && v != null) {
                    lowered.put(k.trim().toLowerCase(Locale.ROOT), v.trim());
                }
            });
        }

        String url      = firstPresent(lowered, URL_KEYS);
        String user     = firstPresent(lowered, USER_KEYS);
        String password = firstPresent(lowered, PASSWORD_KEYS);

        if (url == null) {
            throw new IllegalArgumentException("Missing connection url for " + label + " (accepted keys: " + URL_KEYS + ")");
        }
        if (user == null) {
            throw new IllegalArgumentException("Missing user for " + label + " (accepted keys: " + USER_KEYS + ")");
        }
        return new ConnectionCredentials(url, user, password);
    }

    private static String firstPresent(Map<String, String> values, List<String> keys) {
        for (String key : keys) {
            String v = values.get(key);
            if (v != null && !v.isEmpty()) {
                return v;
            }
        }
        return null;
    }
}
