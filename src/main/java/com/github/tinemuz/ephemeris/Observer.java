/*
 * MIT License
 *
 * Copyright (c) 2025 tinemuz
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */
package com.github.tinemuz.ephemeris;

/**
 * A location on or near the Earth's surface.
 *
 * <p>Latitude and longitude are geographic (WGS-84-like ellipsoid), in
 * degrees, north and east positive. Height is meters above sea level.</p>
 */
public final class Observer {
    public final double latitude;
    public final double longitude;
    public final double height;

    /**
     * @throws IllegalArgumentException if the latitude is outside [-90, 90]
     *         or any value is not finite
     */
    public Observer(double latitude, double longitude, double height) {
        if (!(latitude >= -90.0 && latitude <= 90.0)) {
            throw new IllegalArgumentException("Latitude out of range: " + latitude);
        }
        if (!Double.isFinite(longitude) || !Double.isFinite(height)) {
            throw new IllegalArgumentException(
                    "Longitude and height must be finite: " + longitude + ", " + height);
        }
        this.latitude = latitude;
        this.longitude = longitude;
        this.height = height;
    }

    @Override
    public String toString() {
        return String.format("Observer(lat=%.6f, lon=%.6f, height=%.1fm)", latitude, longitude, height);
    }
}
