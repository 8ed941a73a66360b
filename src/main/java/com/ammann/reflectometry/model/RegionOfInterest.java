/* (C)2026 */
package com.ammann.reflectometry.model;

import java.util.Arrays;

/**
 * Rectangular pixel range of the area detector. All bounds are inclusive.
 *
 * @param yMin first row
 * @param yMax last row
 * @param xMin first column
 * @param xMax last column
 */
public record RegionOfInterest(int yMin, int yMax, int xMin, int xMax) {

    public RegionOfInterest {
        if (yMin < 0 || xMin < 0 || yMax < yMin || xMax < xMin) {
            throw new IllegalArgumentException(
                    String.format("Invalid region (%d, %d, %d, %d)", yMin, yMax, xMin, xMax));
        }
    }

    /**
     * Parses a region written as {@code "ymin,ymax,xmin,xmax"}, optionally wrapped in
     * brackets or parentheses.
     *
     * @param text textual region
     * @return parsed region
     * @throws IllegalArgumentException if the text does not hold four integers
     */
    public static RegionOfInterest parse(String text) {
        String[] parts = text.replaceAll("[\\[\\]()\\s]", "").split(",");
        if (parts.length != 4) {
            throw new IllegalArgumentException("Region needs four bounds, got '" + text + "'");
        }
        int[] bounds = Arrays.stream(parts).mapToInt(Integer::parseInt).toArray();
        return new RegionOfInterest(bounds[0], bounds[1], bounds[2], bounds[3]);
    }

    public int pixelCount() {
        return (yMax - yMin + 1) * (xMax - xMin + 1);
    }

    public boolean contains(int y, int x) {
        return y >= yMin && y <= yMax && x >= xMin && x <= xMax;
    }

    public boolean overlaps(RegionOfInterest other) {
        return !(other.yMax < yMin || other.yMin > yMax || other.xMax < xMin || other.xMin > xMax);
    }

    @Override
    public String toString() {
        return String.format("(%d, %d, %d, %d)", yMin, yMax, xMin, xMax);
    }
}
