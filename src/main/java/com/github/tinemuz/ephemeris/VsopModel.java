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

import java.util.EnumMap;
import java.util.Map;

/**
 * Heliocentric planet positions from the truncated VSOP87 series.
 */
final class VsopModel {
    private static final double DAYS_PER_MILLENNIUM = 365250.0;
    private static final Map<Body, Series> SERIES = new EnumMap<>(Body.class);

    static {
        SERIES.put(Body.MERCURY, new Series(
                VsopTables.MERCURY_LONGITUDE, VsopTables.MERCURY_LATITUDE, VsopTables.MERCURY_RADIUS));
        SERIES.put(Body.VENUS, new Series(
                VsopTables.VENUS_LONGITUDE, VsopTables.VENUS_LATITUDE, VsopTables.VENUS_RADIUS));
        SERIES.put(Body.EARTH, new Series(
                VsopTables.EARTH_LONGITUDE, VsopTables.EARTH_LATITUDE, VsopTables.EARTH_RADIUS));
        SERIES.put(Body.MARS, new Series(
                VsopTables.MARS_LONGITUDE, VsopTables.MARS_LATITUDE, VsopTables.MARS_RADIUS));
        SERIES.put(Body.JUPITER, new Series(
                VsopTables.JUPITER_LONGITUDE, VsopTables.JUPITER_LATITUDE, VsopTables.JUPITER_RADIUS));
        SERIES.put(Body.SATURN, new Series(
                VsopTables.SATURN_LONGITUDE, VsopTables.SATURN_LATITUDE, VsopTables.SATURN_RADIUS));
        SERIES.put(Body.URANUS, new Series(
                VsopTables.URANUS_LONGITUDE, VsopTables.URANUS_LATITUDE, VsopTables.URANUS_RADIUS));
        SERIES.put(Body.NEPTUNE, new Series(
                VsopTables.NEPTUNE_LONGITUDE, VsopTables.NEPTUNE_LATITUDE, VsopTables.NEPTUNE_RADIUS));
    }

    private VsopModel() {}

    /** True when the body has a VSOP series (Mercury through Neptune). */
    static boolean covers(Body body) {
        return SERIES.containsKey(body);
    }

    /**
     * Heliocentric position of a planet in J2000 mean equatorial coordinates.
     *
     * @throws IllegalArgumentException if the body has no VSOP series
     */
    static AstroVector helio(Body body, AstroTime time) {
        Series series = SERIES.get(body);
        if (series == null) {
            throw new IllegalArgumentException("No VSOP series for " + body);
        }
        double t = time.tt / DAYS_PER_MILLENNIUM;

        // STEP 1: Evaluate spherical ecliptic coordinates of J2000
        double lon = evaluate(series.longitude, t);
        double lat = evaluate(series.latitude, t);
        double rad = evaluate(series.radius, t);

        // STEP 2: Spherical to Cartesian, still in the ecliptic frame
        double rCosLat = rad * Math.cos(lat);
        double ex = rCosLat * Math.cos(lon);
        double ey = rCosLat * Math.sin(lon);
        double ez = rad * Math.sin(lat);

        // STEP 3: Fixed rotation from the VSOP dynamical ecliptic into the J2000 equator
        return new AstroVector(
                ex + 0.000000440360 * ey - 0.000000190919 * ez,
                -0.000000479966 * ex + 0.917482137087 * ey - 0.397776982902 * ez,
                0.397776982902 * ey + 0.917482137087 * ez,
                time);
    }

    /**
     * Sum the series for one coordinate: each group of terms is scaled by
     * successive powers of t.
     */
    private static double evaluate(double[][][] formula, double t) {
        double coord = 0.0;
        double tpower = 1.0;
        for (double[][] group : formula) {
            double sum = 0.0;
            for (double[] term : group) {
                sum += term[0] * Math.cos(term[1] + t * term[2]);
            }
            coord += tpower * sum;
            tpower *= t;
        }
        return coord;
    }

    // The three coordinate formulas of one planet
    private record Series(double[][][] longitude, double[][][] latitude, double[][][] radius) {}
}
