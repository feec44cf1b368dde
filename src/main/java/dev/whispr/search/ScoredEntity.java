package dev.whispr.search;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.time.Instant;
import org.jspecify.annotations.Nullable;

/**
 * One search hit: the entity kind, its advisory relevance score and its kind-specific projection.
 *
 * @param entityType the kind of entity
 * @param relevanceScore combined relevance in [1, 100]; ordering data only, never stored
 * @param data the kind-specific projection ({@code CourseView}, {@code ReviewView}, ...)
 * @param createdAt creation time of the entity, used for timestamp ordering
 * @param updatedAt last update of the entity, {@code null} for kinds without one
 */
public record ScoredEntity(
    EntityType entityType,
    double relevanceScore,
    Object data,
    @JsonIgnore Instant createdAt,
    @JsonIgnore @Nullable Instant updatedAt) {}
