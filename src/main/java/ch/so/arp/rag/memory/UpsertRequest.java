package ch.so.arp.rag.memory;

import com.fasterxml.jackson.databind.node.ObjectNode;

import jakarta.validation.constraints.NotBlank;

/**
 * Incoming payload for storing a single document.
 */
public record UpsertRequest(@NotBlank String content, ObjectNode metadata) {
}
