package com.tigerwatch.monitor.service.image;

import com.tigerwatch.monitor.dto.Detection;

import java.util.List;

/**
 * Object-detection capability returning raw tiger boxes for one image. Throws on failure.
 */
public interface DetectionModel {

    List<Detection> detect(byte[] imageBytes);
}
