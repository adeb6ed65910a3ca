package dev.rosterwatch.source;

import dev.rosterwatch.model.SearchType;
import reactor.core.publisher.Mono;

/**
 * Fetches raw results pages from the roster site.
 */
public interface RosterSource {

    /**
     * Get the name of this source (e.g., "MCSO PAID")
     */
    String getName();

    /**
     * Run one search and return the untouched response body.
     * Errors surface as {@link RosterFetchException}.
     */
    Mono<String> search(SearchType searchType);
}
