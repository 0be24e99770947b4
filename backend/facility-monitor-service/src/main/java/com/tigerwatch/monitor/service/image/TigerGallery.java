package com.tigerwatch.monitor.service.image;

import com.tigerwatch.monitor.dto.TigerMatch;

import java.util.List;

/**
 * Nearest-neighbour index over embeddings of known tigers.
 */
public interface TigerGallery {

    /**
     * @return matches with similarity at or above {@code minSimilarity}, best first, at most {@code limit}
     */
    List<TigerMatch> findMatches(float[] embedding, double minSimilarity, int limit);
}
