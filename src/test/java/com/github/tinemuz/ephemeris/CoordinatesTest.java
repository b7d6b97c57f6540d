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

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class CoordinatesTest {

    private static final AstroTime J2000 = new AstroTime(0.0);

    @Nested
    @DisplayName("Vector and angle conversions")
    class ConversionTests {

        @Test
        @DisplayName("Zero vector cannot be converted to angles")
        void zeroVectorThrows() {
            AstroVector zero = new AstroVector(0.0, 0.0, 0.0, J2000);
            assertThrows(IllegalArgumentException.class, () -> Coordinates.vectorToEquatorial(zero));
        }

        @Test
        @DisplayName("Polar vectors map to ra 0 and dec +/-90")
        void polarVectors() {
            Equatorial north = Coordinates.vectorToEquatorial(new AstroVector(0.0, 0.0, 2.5, J2000));
            Equatorial south = Coordinates.vectorToEquatorial(new AstroVector(0.0, 0.0, -0.1, J2000));
            assertAll(
                    () -> assertEquals(0.0, north.ra),
                    () -> assertEquals(90.0, north.dec),
                    () -> assertEquals(2.5, north.dist),
                    () -> assertEquals(0.0, south.ra),
                    () -> assertEquals(-90.0, south.dec));
        }

        @Test
        @DisplayName("Right ascension is reported in [0, 24) hours")
        void rightAscensionRange() {
            Equatorial west = Coordinates.vectorToEquatorial(new AstroVector(0.0, -1.0, 0.0, J2000));
            assertEquals(18.0, west.ra, 1e-12);
            assertEquals(0.0, west.dec, 1e-12);

            Equatorial diag = Coordinates.vectorToEquatorial(new AstroVector(1.0, 1.0, Math.sqrt(2.0), J2000));
            assertEquals(3.0, diag.ra, 1e-12);
            assertEquals(45.0, diag.dec, 1e-12);
            assertEquals(2.0, diag.dist, 1e-12);
        }

        @Test
        @DisplayName("Heliocentric vectors survive the ecliptic round trip from 1700 to 2199")
        void eclipticRoundTrip() {
            double worst = 0.0;
            for (int year = 1700; year < 2200; year += 7) {
                AstroTime t = new AstroTime(year, 6, 1, 0, 0, 0.0);
                for (Body body : Body.values()) {
                    if (body == Body.SUN) {
                        continue;  // zero vector
                    }
                    AstroVector v = Astronomy.helioVector(body, t);
                    Ecliptic ecl = Astronomy.equatorialToEcliptic(v);
                    AstroVector back = Astronomy.eclipticToEquatorial(ecl, t);
                    assertTrue(ecl.elon >= 0.0 && ecl.elon < 360.0, body + " longitude " + ecl.elon);
                    worst = Math.max(worst, Math.abs(v.x - back.x));
                    worst = Math.max(worst, Math.abs(v.y - back.y));
                    worst = Math.max(worst, Math.abs(v.z - back.z));
                }
            }
            assertTrue(worst < 1e-9, "worst round trip error " + worst + " AU");
        }

        @Test
        @DisplayName("The equinox direction has ecliptic longitude and latitude zero")
        void equinoxOnEcliptic() {
            Ecliptic ecl = Astronomy.equatorialToEcliptic(new AstroVector(1.0, 0.0, 0.0, J2000));
            assertEquals(0.0, ecl.elon, 1e-12);
            assertEquals(0.0, ecl.elat, 1e-12);
        }

        @Test
        @DisplayName("The celestial pole sits at ecliptic latitude 90 - obliquity")
        void poleLatitude() {
            Ecliptic ecl = Astronomy.equatorialToEcliptic(new AstroVector(0.0, 0.0, 1.0, J2000));
            double expected = 90.0 - Math.toDegrees(Coordinates.OBLIQUITY_J2000_RAD);
            assertEquals(expected, ecl.elat, 1e-9);
            assertEquals(90.0, ecl.elon, 1e-9);
        }
    }

    @Nested
    @DisplayName("Angle helpers")
    class AngleTests {

        @Test
        @DisplayName("longitudeOffset wraps into (-180, 180]")
        void longitudeOffset() {
            assertEquals(180.0, Coordinates.longitudeOffset(180.0));
            assertEquals(180.0, Coordinates.longitudeOffset(-180.0));
            assertEquals(-90.0, Coordinates.longitudeOffset(270.0));
            assertEquals(10.0, Coordinates.longitudeOffset(730.0), 1e-12);
            assertEquals(-10.0, Coordinates.longitudeOffset(-370.0), 1e-12);
        }

        @Test
        @DisplayName("normalizeLongitude wraps into [0, 360)")
        void normalizeLongitude() {
            assertEquals(0.0, Coordinates.normalizeLongitude(360.0));
            assertEquals(350.0, Coordinates.normalizeLongitude(-10.0));
            assertEquals(45.0, Coordinates.normalizeLongitude(765.0), 1e-12);
        }

        @Test
        @DisplayName("angleBetween covers 0 to 180 degrees")
        void angleBetween() {
            AstroVector x = new AstroVector(2.0, 0.0, 0.0, J2000);
            AstroVector y = new AstroVector(0.0, 3.0, 0.0, J2000);
            AstroVector minusX = new AstroVector(-1.0, 0.0, 0.0, J2000);
            assertEquals(90.0, Coordinates.angleBetween(x, y), 1e-12);
            assertEquals(180.0, Coordinates.angleBetween(x, minusX), 1e-12);
            assertEquals(0.0, Coordinates.angleBetween(x, x), 1e-12);
        }

        @Test
        @DisplayName("angleBetween rejects zero vectors")
        void angleBetweenZero() {
            AstroVector x = new AstroVector(1.0, 0.0, 0.0, J2000);
            AstroVector zero = new AstroVector(0.0, 0.0, 0.0, J2000);
            assertThrows(IllegalArgumentException.class, () -> Coordinates.angleBetween(x, zero));
        }

        @Test
        @DisplayName("spin by 90 degrees moves +y onto +x")
        void spin() {
            AstroVector v = Coordinates.spin(90.0, new AstroVector(0.0, 1.0, 0.5, J2000));
            assertEquals(1.0, v.x, 1e-15);
            assertEquals(0.0, v.y, 1e-15);
            assertEquals(0.5, v.z);
        }
    }

    @Nested
    @DisplayName("Horizontal coordinates")
    class HorizonTests {

        private final AstroTime time = new AstroTime(2020, 3, 1, 6, 0, 0.0);
        private final Observer origin = new Observer(0.0, 0.0, 0.0);
        private final double gast = EarthOrientation.siderealTime(time);

        private double wrapHours(double ra) {
            double h = ra % 24.0;
            return h < 0.0 ? h + 24.0 : h;
        }

        @Test
        @DisplayName("Point on the meridian at the observer's latitude is at the zenith")
        void zenith() {
            Topocentric hor = Astronomy.horizon(time, origin, gast, 0.0, Refraction.NONE);
            assertEquals(90.0, hor.altitude, 1e-9);
        }

        @Test
        @DisplayName("Celestial pole from latitude 40 stands 40 degrees above due north")
        void poleAltitude() {
            Observer observer = new Observer(40.0, 12.0, 0.0);
            Topocentric hor = Astronomy.horizon(time, observer, 0.0, 90.0, Refraction.NONE);
            assertEquals(40.0, hor.altitude, 1e-9);
            double az = hor.azimuth > 180.0 ? hor.azimuth - 360.0 : hor.azimuth;
            assertEquals(0.0, az, 1e-9);
        }

        @Test
        @DisplayName("Refraction lifts a point on the horizon by about half a degree")
        void horizonRefraction() {
            double ra = wrapHours(gast - 6.0);
            Topocentric plain = Astronomy.horizon(time, origin, ra, 0.0, Refraction.NONE);
            Topocentric normal = Astronomy.horizon(time, origin, ra, 0.0, Refraction.NORMAL);
            Topocentric jpl = Astronomy.horizon(time, origin, ra, 0.0, Refraction.JPL_HOR);

            assertEquals(0.0, plain.altitude, 1e-9);
            assertEquals(270.0, plain.azimuth, 1e-9);
            assertTrue(isBetween(normal.altitude, 0.4, 0.6), "refracted altitude " + normal.altitude);
            assertEquals(normal.altitude, jpl.altitude, 1e-12);
            // Lifted toward the zenith along the equator, so only the right ascension moves
            assertEquals(0.0, normal.dec, 1e-9);
            assertEquals(normal.altitude, Coordinates.longitudeOffset(15.0 * (normal.ra - ra)), 1e-6);
            assertEquals(ra, plain.ra);
            assertEquals(0.0, plain.dec);
        }

        @Test
        @DisplayName("Normal refraction tapers to nothing at the nadir")
        void nadirRefraction() {
            double ra = wrapHours(gast + 12.0);
            Topocentric normal = Astronomy.horizon(time, origin, ra, 0.0, Refraction.NORMAL);
            Topocentric jpl = Astronomy.horizon(time, origin, ra, 0.0, Refraction.JPL_HOR);
            assertEquals(-90.0, normal.altitude, 1e-6);
            assertTrue(normal.altitude >= -90.0 - 1e-9);
            assertTrue(jpl.altitude > -90.0, "no taper for the JPL horizons model");
        }

        @Test
        @DisplayName("Null refraction option is rejected")
        void nullRefraction() {
            assertThrows(IllegalArgumentException.class,
                    () -> Astronomy.horizon(time, origin, 0.0, 0.0, null));
        }
    }

    private static boolean isBetween(double value, double min, double max) {
        return value >= min && value <= max;
    }
}
