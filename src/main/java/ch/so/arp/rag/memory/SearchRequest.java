package ch.so.arp.rag.memory;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

/**
 * Incoming payload for searches. Missing values fall back to the configured
 * top K and to no score cutoff.
 */
public record SearchRequest(@NotBlank String query, @Positive Integer topK, Double scoreThreshold) {
}
