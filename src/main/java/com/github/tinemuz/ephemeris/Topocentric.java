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
 * Horizontal coordinates seen by an observer, plus the equatorial
 * coordinates adjusted for refraction (equal to the inputs when no
 * refraction is applied).
 */
public final class Topocentric {
    /** Compass direction in degrees: 0 north, 90 east, 180 south, 270 west. */
    public final double azimuth;

    /** Degrees above (positive) or below (negative) the horizon. */
    public final double altitude;

    /** Right ascension of date in hours, refracted. */
    public final double ra;

    /** Declination of date in degrees, refracted. */
    public final double dec;

    Topocentric(double azimuth, double altitude, double ra, double dec) {
        this.azimuth = azimuth;
        this.altitude = altitude;
        this.ra = ra;
        this.dec = dec;
    }
}
