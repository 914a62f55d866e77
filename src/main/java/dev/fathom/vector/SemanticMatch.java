package dev.fathom.vector;

import java.util.Map;

/**
 * A nearest-neighbour result.
 *
 * @param id snippet fingerprint
 * @param document stored document text
 * @param metadata stored snippet metadata
 * @param distance cosine distance {@code 1 - cos}, from 0 to 2, lower is closer
 */
public record SemanticMatch(
    String id, String document, Map<String, Object> metadata, double distance) {}
