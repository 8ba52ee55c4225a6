package com.migranet.config;

import java.util.Objects;

/**
 * Canonical connection record for one database endpoint.
 * Built once by CredentialNormalizer; adapters never see the raw aliases.
 */
public final class ConnectionCredentials {

    private final String url;
    private final String user;
    private final String password;

    public ConnectionCredentials(String url, String user, String password) {
        this.url      = Objects.requireNonNull(url, "url");
        this.user     = Objects.requireNonNull(user, "user");
        this.password = password != null ? password : "";
    }

    public String getUrl()      { return url; }
    public String getUser()     { return user; }
    public String getPassword() { return password; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ConnectionCredentials)) return false;
        ConnectionCredentials that = (ConnectionCredentials) o;
        return url.equals(that.url) && user.equals(that.user) && password.equals(that.password);
    }

    @Override
    public int hashCode() {
        return Objects.hash(url, user, password);
    }

    @Override
    public String toString() {
        return "ConnectionCredentials{url=" + url + ", user=" + user + ", password=****}";
    }
}
