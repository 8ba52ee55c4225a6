package com.migranet.core.search;

import java.util.Objects;

/** One web search result. Only title, url and a content snippet are kept. */
public final class SearchHit {

    private final String title;
    private final String url;
    private final String snippet;

    public SearchHit(String title, String url, String snippet) {
        this.title   = title != null ? title : "";
        this.url     = url != null ? url : "";
        this.snippet = snippet != null ? snippet : "";
    }

    public String getTitle()   { return title; }
    public String getUrl()     { return url; }
    public String getSnippet() { return snippet; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SearchHit)) return false;
        SearchHit that = (SearchHit) o;
        return title.equals(that.title) && url.equals(that.url) && snippet.equals(that.snippet);
    }

    @Override
    public int hashCode() {
        return Objects.hash(title, url, snippet);
    }

    @Override
    public String toString() {
        return title + " <" + url + ">";
    }
}
