package com.tigerwatch.monitor.dto;

/**
 * Gallery match for a query embedding, similarity in [0, 1]
 */
public record TigerMatch(
        String tigerId,
        String tigerName,
        String imageId,
        double similarity
) {
}
