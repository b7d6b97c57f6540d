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
 * Visual magnitude models.
 *
 * <p>Mercury and Venus use the phase curves of Mallama (2006); Saturn
 * includes the brightening from its ring system as seen from the Earth.</p>
 */
final class Photometry {
    // Astronomical units per parsec
    static final double AU_PER_PARSEC = 3600.0 * 180.0 / Math.PI;
    private static final double MOON_MEAN_DISTANCE_AU = 385000.6 / Astronomy.KM_PER_AU;
    // Inclination of Saturn's rings to the ecliptic, degrees
    private static final double SATURN_RING_INCLINATION = 28.06;

    private Photometry() {}

    static double sunMagnitude(double geoDist) {
        return -0.17 + 5.0 * Math.log10(geoDist / AU_PER_PARSEC);
    }

    /**
     * @param phase phase angle in degrees
     */
    static double moonMagnitude(double phase, double helioDist, double geoDist) {
        double rad = Math.toRadians(phase);
        double rad2 = rad * rad;
        double rad4 = rad2 * rad2;
        double mag = -12.717 + 1.49 * Math.abs(rad) + 0.0431 * rad4;
        double geoAu = geoDist / MOON_MEAN_DISTANCE_AU;
        mag += 5.0 * Math.log10(helioDist * geoAu);
        return mag;
    }

    /**
     * Magnitude of a planet other than Saturn from a cubic phase law.
     *
     * @throws IllegalArgumentException for bodies without a phase law
     */
    static double visualMagnitude(Body body, double phase, double helioDist, double geoDist) {
        double c0;
        double c1 = 0.0;
        double c2 = 0.0;
        double c3 = 0.0;
        switch (body) {
            case MERCURY:
                c0 = -0.60;
                c1 = +4.98;
                c2 = -4.88;
                c3 = +3.02;
                break;
            case VENUS:
                if (phase < 163.6) {
                    c0 = -4.47;
                    c1 = +1.03;
                    c2 = +0.57;
                    c3 = +0.13;
                } else {
                    c0 = 0.98;
                    c1 = -1.02;
                }
                break;
            case MARS:
                c0 = -1.52;
                c1 = +1.60;
                break;
            case JUPITER:
                c0 = -9.40;
                c1 = +0.50;
                break;
            case URANUS:
                c0 = -7.19;
                c1 = +0.25;
                break;
            case NEPTUNE:
                c0 = -6.87;
                break;
            case PLUTO:
                c0 = -1.00;
                c1 = +4.00;
                break;
            default:
                throw new IllegalArgumentException("Unsupported body " + body);
        }

        double x = phase / 100.0;
        double mag = c0 + x * (c1 + x * (c2 + x * c3));
        mag += 5.0 * Math.log10(helioDist * geoDist);
        return mag;
    }

    /**
     * Magnitude of Saturn including its rings.
     *
     * @param gc geocentric J2000 equatorial vector of Saturn
     */
    static SaturnBrightness saturnMagnitude(double phase, double helioDist, double geoDist, AstroVector gc) {
        Ecliptic eclip = Coordinates.rotateEquatorialToEcliptic(gc, Coordinates.OBLIQUITY_J2000_RAD);

        double ir = Math.toRadians(SATURN_RING_INCLINATION);
        // Ascending node of the rings drifts slowly
        double nr = Math.toRadians(169.51 + 3.82e-5 * gc.t.tt);

        double lat = Math.toRadians(eclip.elat);
        double lon = Math.toRadians(eclip.elon);
        double tilt = Math.asin(Math.sin(lat) * Math.cos(ir) - Math.cos(lat) * Math.sin(ir) * Math.sin(lon - nr));
        double sinTilt = Math.sin(Math.abs(tilt));

        double mag = -9.0 + 0.044 * phase;
        mag += sinTilt * (-2.6 + 1.2 * sinTilt);
        mag += 5.0 * Math.log10(helioDist * geoDist);
        return new SaturnBrightness(mag, Math.toDegrees(tilt));
    }

    // Saturn's magnitude and the ring tilt (degrees) that produced it
    record SaturnBrightness(double mag, double ringTilt) {}
}
