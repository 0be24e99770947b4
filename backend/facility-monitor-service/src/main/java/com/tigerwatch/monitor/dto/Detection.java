package com.tigerwatch.monitor.dto;

public record Detection(BoundingBox bbox, double confidence) {
}
