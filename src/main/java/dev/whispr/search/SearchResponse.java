package dev.whispr.search;

import java.util.List;

/**
 * Result of one search.
 *
 * @param total number of scored candidates across all searched kinds, before pagination
 * @param results the requested page of the merged, sorted candidates
 * @param query the query text as the caller sent it
 * @param deep whether deep search was performed
 */
public record SearchResponse(int total, List<ScoredEntity> results, String query, boolean deep) {}
