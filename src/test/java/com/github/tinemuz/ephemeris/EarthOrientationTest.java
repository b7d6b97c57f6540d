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

import com.github.tinemuz.ephemeris.EarthOrientation.EarthTilt;
import com.github.tinemuz.ephemeris.EarthOrientation.Rotation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class EarthOrientationTest {

    @Nested
    @DisplayName("Obliquity and nutation")
    class TiltTests {

        @Test
        @DisplayName("Mean obliquity at J2000 is 23.4393 degrees")
        void meanObliquityJ2000() {
            assertEquals(84381.406 / 3600.0, EarthOrientation.meanObliquity(0.0), 1e-12);
            assertEquals(23.4393, EarthOrientation.meanObliquity(0.0), 1e-4);
        }

        @Test
        @DisplayName("Obliquity decreases over the centuries")
        void obliquityDecreases() {
            assertTrue(EarthOrientation.meanObliquity(36525.0) < EarthOrientation.meanObliquity(0.0));
        }

        @Test
        @DisplayName("Nutation angles stay within their physical amplitude")
        void nutationBounds() {
            for (int day = 0; day < 6800; day += 97) {
                EarthTilt tilt = EarthOrientation.tilt(new AstroTime(day));
                assertTrue(Math.abs(tilt.dpsi()) < 20.0, "dpsi arcsec " + tilt.dpsi());
                assertTrue(Math.abs(tilt.deps()) < 11.0, "deps arcsec " + tilt.deps());
                assertEquals(tilt.mobl() + tilt.deps() / 3600.0, tilt.tobl(), 1e-12);
            }
        }

        @Test
        @DisplayName("Tilt is a pure function of time")
        void tiltRepeatable() {
            AstroTime t = new AstroTime(2020, 5, 17, 3, 0, 0.0);
            EarthTilt a = EarthOrientation.tilt(t);
            EarthTilt b = EarthOrientation.tilt(t);
            assertEquals(a, b);
        }
    }

    @Nested
    @DisplayName("Frame rotations")
    class RotationTests {

        @Test
        @DisplayName("Precession forward then back restores the vector")
        void precessionRoundTrip() {
            AstroTime t = new AstroTime(2150, 7, 4, 0, 0, 0.0);
            AstroVector v = new AstroVector(0.3, -1.2, 0.45, t);
            AstroVector ofDate = EarthOrientation.precession(0.0, v, t.tt);
            AstroVector back = EarthOrientation.precession(t.tt, ofDate, 0.0);
            assertEquals(v.x, back.x, 1e-12);
            assertEquals(v.y, back.y, 1e-12);
            assertEquals(v.z, back.z, 1e-12);
            assertEquals(v.length(), ofDate.length(), 1e-12, "rotation preserves length");
        }

        @Test
        @DisplayName("Precession requires one J2000 endpoint")
        void precessionNeedsJ2000() {
            AstroVector v = new AstroVector(1.0, 0.0, 0.0, new AstroTime(0.0));
            assertThrows(IllegalArgumentException.class, () -> EarthOrientation.precession(100.0, v, 200.0));
        }

        @Test
        @DisplayName("Precession moves the equinox about 50 arcsec per year")
        void precessionRate() {
            AstroTime t = new AstroTime(36525.0);
            AstroVector equinox = new AstroVector(1.0, 0.0, 0.0, t);
            AstroVector ofDate = EarthOrientation.precession(0.0, equinox, t.tt);
            double shiftDeg = Math.toDegrees(Math.atan2(Math.hypot(ofDate.y, ofDate.z), ofDate.x));
            assertEquals(5029.0 / 3600.0, shiftDeg, 0.1);
        }

        @Test
        @DisplayName("Nutation forward then inverse restores the vector")
        void nutationRoundTrip() {
            AstroTime t = new AstroTime(2020, 1, 1, 0, 0, 0.0);
            EarthTilt tilt = EarthOrientation.tilt(t);
            AstroVector v = new AstroVector(-0.17, 0.9, 0.39, t);
            AstroVector there = EarthOrientation.nutation(v, tilt, Rotation.INTO_DATE);
            AstroVector back = EarthOrientation.nutation(there, tilt, Rotation.FROM_DATE);
            assertEquals(v.x, back.x, 1e-13);
            assertEquals(v.y, back.y, 1e-13);
            assertEquals(v.z, back.z, 1e-13);
        }
    }

    @Nested
    @DisplayName("Sidereal time and observer position")
    class SiderealTests {

        @Test
        @DisplayName("GAST at J2000 is about 18.697 hours")
        void siderealTimeJ2000() {
            double gast = EarthOrientation.siderealTime(new AstroTime(0.0));
            assertEquals(18.697, gast, 0.001);
        }

        @Test
        @DisplayName("Sidereal time stays in [0, 24)")
        void siderealRange() {
            for (double ut = -5000.0; ut < 5000.0; ut += 13.37) {
                double gast = EarthOrientation.siderealTime(new AstroTime(ut));
                assertTrue(gast >= 0.0 && gast < 24.0, "GAST " + gast);
            }
        }

        @Test
        @DisplayName("Earth rotation angle advances one turn per sidereal day")
        void earthRotationAngle() {
            double era0 = EarthOrientation.earthRotationAngle(1000.0);
            double era1 = EarthOrientation.earthRotationAngle(1000.0 + Astronomy.SOLAR_DAYS_PER_SIDEREAL_DAY);
            assertEquals(0.0, Coordinates.longitudeOffset(era1 - era0), 1e-4);
        }

        @Test
        @DisplayName("Observer vector lies on the oblate Earth")
        void observerOnEllipsoid() {
            AstroTime t = new AstroTime(0.0);
            double equatorKm = EarthOrientation.observerVector(new Observer(0.0, 0.0, 0.0), 0.0, t).length()
                    * Astronomy.KM_PER_AU;
            double poleKm = EarthOrientation.observerVector(new Observer(90.0, 0.0, 0.0), 0.0, t).length()
                    * Astronomy.KM_PER_AU;
            assertEquals(6378.1366, equatorKm, 1e-6);
            assertEquals(6356.75, poleKm, 0.05);

            double highKm = EarthOrientation.observerVector(new Observer(0.0, 0.0, 1000.0), 0.0, t).length()
                    * Astronomy.KM_PER_AU;
            assertEquals(1.0, highKm - equatorKm, 1e-6);
        }
    }
}
