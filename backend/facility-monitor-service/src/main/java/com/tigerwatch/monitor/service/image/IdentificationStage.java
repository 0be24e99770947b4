package com.tigerwatch.monitor.service.image;

import com.tigerwatch.monitor.config.MonitorProperties;
import com.tigerwatch.monitor.dto.IdentificationOptions;
import com.tigerwatch.monitor.dto.IdentificationResult;
import com.tigerwatch.monitor.dto.TigerMatch;
import com.tigerwatch.monitor.exception.IdentificationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Re-identification of a detected tiger against the known-tiger gallery.
 *
 * Model and thresholds travel with each call in {@link IdentificationOptions};
 * the stage itself holds no per-request state.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IdentificationStage {

    private final ReidModel reidModel;
    private final TigerGallery tigerGallery;
    private final MonitorProperties properties;

    public IdentificationResult identify(byte[] imageBytes) {
        return identify(imageBytes, defaultOptions());
    }

    public IdentificationResult identify(byte[] imageBytes, IdentificationOptions options) {
        String model = options.modelName();

        float[] embedding;
        try {
            embedding = reidModel.embed(imageBytes, model);
        } catch (Exception e) {
            return degrade(model, IdentificationException.embeddingFailed(e));
        }
        if (embedding == null || embedding.length == 0) {
            return degrade(model, IdentificationException.emptyEmbedding());
        }

        try {
            List<TigerMatch> matches = tigerGallery.findMatches(
                    embedding, options.similarityThreshold(), options.maxMatches());
            return IdentificationResult.of(matches, model);
        } catch (Exception e) {
            return degrade(model, IdentificationException.gallerySearchFailed(e));
        }
    }

    public IdentificationOptions defaultOptions() {
        MonitorProperties.Identification settings = properties.getIdentification();
        return new IdentificationOptions(settings.getModel(), settings.getSimilarityThreshold(), settings.getMaxMatches());
    }

    private IdentificationResult degrade(String model, IdentificationException failure) {
        log.warn("Identification degraded (model={}): {}", model, failure.getMessage());
        return IdentificationResult.failed(model, failure.getMessage());
    }
}
