package dev.juridica.rag.knowledge;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

/**
 * Knowledge base query. {@code maxResults} defaults to 5.
 */
public record SearchRequest(@NotBlank String query, @Min(1) @Max(50) Integer maxResults) {

    static final int DEFAULT_MAX_RESULTS = 5;

    int effectiveMaxResults() {
        return maxResults == null ? DEFAULT_MAX_RESULTS : maxResults;
    }
}
