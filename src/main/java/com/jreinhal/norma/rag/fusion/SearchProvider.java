package com.jreinhal.norma.rag.fusion;

import java.util.List;

/**
 * A black-box search engine behind one {@link SearchBackend}. Implementations may throw;
 * fusion treats a failure as an empty list for that channel.
 */
public interface SearchProvider {

    SearchBackend backend();

    List<SourceDocument> search(String query, int limit);

    default boolean isAvailable() {
        return true;
    }
}
