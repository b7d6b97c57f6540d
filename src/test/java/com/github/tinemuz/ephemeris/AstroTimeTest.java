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

import java.time.DateTimeException;
import java.time.Instant;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class AstroTimeTest {

    private static final double MILLISECOND_IN_DAYS = 1.0 / 86_400_000.0;

    @Nested
    @DisplayName("Construction")
    class ConstructionTests {

        @Test
        @DisplayName("Noon on 2000-01-01 UTC is day zero")
        void originIsZero() {
            AstroTime t = new AstroTime(2000, 1, 1, 12, 0, 0.0);
            assertEquals(0.0, t.ut, 1e-12);
            assertEquals("2000-01-01T12:00:00.000Z", t.toString());
        }

        @Test
        @DisplayName("Fractional seconds are kept")
        void fractionalSeconds() {
            AstroTime t = new AstroTime(2019, 8, 30, 17, 45, 22.763);
            assertEquals("2019-08-30T17:45:22.763Z", t.toString());
        }

        @Test
        @DisplayName("Instant round trip to the millisecond")
        void instantRoundTrip() {
            Instant instant = Instant.parse("2021-03-14T01:59:26.535Z");
            AstroTime t = new AstroTime(instant);
            assertEquals(instant, t.toInstant());
            assertEquals("2021-03-14T01:59:26.535Z", t.toString());
        }

        @Test
        @DisplayName("Dates before the origin are negative")
        void beforeOrigin() {
            AstroTime t = new AstroTime(1999, 12, 31, 12, 0, 0.0);
            assertEquals(-1.0, t.ut, MILLISECOND_IN_DAYS);
        }

        @Test
        @DisplayName("Invalid calendar fields are rejected")
        void invalidFields() {
            assertThrows(DateTimeException.class, () -> new AstroTime(2020, 13, 1, 0, 0, 0.0));
            assertThrows(DateTimeException.class, () -> new AstroTime(2021, 2, 29, 0, 0, 0.0));
        }
    }

    @Nested
    @DisplayName("Time scales")
    class TimeScaleTests {

        @Test
        @DisplayName("TT leads UT by Delta-T at J2000")
        void terrestrialTimeAtJ2000() {
            AstroTime t = new AstroTime(0.0);
            assertEquals(63.82885833333333, (t.tt - t.ut) * 86400.0, 1e-6);
        }

        @Test
        @DisplayName("addDays shifts UT and recomputes TT")
        void addDays() {
            AstroTime t = new AstroTime(100.0);
            AstroTime later = t.addDays(2.5);
            assertEquals(102.5, later.ut, 1e-12);
            assertEquals(later.tt, new AstroTime(102.5).tt, 0.0);
            assertEquals(100.0, t.ut, 0.0, "original is unchanged");
        }

        @Test
        @DisplayName("Delta-T is clamped outside the table")
        void deltaTClamped() {
            assertEquals(38.0, DeltaT.seconds(-100000.0), 0.0);
            assertEquals(73.66, DeltaT.seconds(100000.0), 0.0);
            assertEquals(38.0, DeltaT.seconds(-72638.0), 0.0);
        }

        @Test
        @DisplayName("Delta-T interpolates linearly between samples")
        void deltaTInterpolates() {
            double mid = DeltaT.seconds((51544.0 + 51910.0) / 2.0);
            assertEquals((63.8285 + 64.0908) / 2.0, mid, 1e-9);
            assertEquals(63.8285, DeltaT.seconds(51544.0), 1e-9);
        }

        @Test
        @DisplayName("Delta-T is continuous across the table")
        void deltaTContinuous() {
            double prev = DeltaT.seconds(-72638.0);
            for (double mjd = -72638.0; mjd <= 61680.0; mjd += 10.0) {
                double dt = DeltaT.seconds(mjd);
                assertTrue(Math.abs(dt - prev) < 0.1, "Jump in Delta-T at MJD " + mjd);
                prev = dt;
            }
        }
    }
}
