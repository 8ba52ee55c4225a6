package com.migranet.core.search;

import com.migranet.core.model.ObjectKind;

import java.util.List;

/**
 * Looks up fixes for a deployment error on the web.
 * Implementations return an empty list when search is unavailable.
 */
public interface WebSearchClient {

    List<SearchHit> search(String normalizedError, ObjectKind kind, int maxResults);
}
