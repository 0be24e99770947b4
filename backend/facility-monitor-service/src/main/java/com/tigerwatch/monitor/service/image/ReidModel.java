package com.tigerwatch.monitor.service.image;

/**
 * Re-identification capability: image to embedding vector. Throws on failure.
 */
public interface ReidModel {

    float[] embed(byte[] imageBytes, String modelName);
}
