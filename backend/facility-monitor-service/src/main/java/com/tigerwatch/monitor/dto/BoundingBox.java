package com.tigerwatch.monitor.dto;

/**
 * Pixel-space box, top-left (x1, y1) to bottom-right (x2, y2)
 */
public record BoundingBox(double x1, double y1, double x2, double y2) {

    public double area() {
        return Math.max(0, x2 - x1) * Math.max(0, y2 - y1);
    }
}
