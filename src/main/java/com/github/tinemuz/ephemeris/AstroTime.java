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

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * An instant of time with both Universal Time and Terrestrial Time scales.
 *
 * <p>{@link #ut} counts days since 2000-01-01T12:00:00Z and follows the
 * Earth's rotation. {@link #tt} is the uniform time scale used by the
 * orbital models; it is derived from {@code ut} once, at construction, by
 * adding the tabulated Delta-T.</p>
 *
 * <p>Instances are immutable and safe to share between threads.</p>
 */
public final class AstroTime {
    private static final long ORIGIN_EPOCH_MILLIS = 946_728_000_000L;
    private static final double MILLIS_PER_DAY = 86_400_000.0;
    private static final DateTimeFormatter FORMAT =
            DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

    /** UT1/UTC days since noon UTC on January 1, 2000. */
    public final double ut;

    /** Terrestrial Time days since noon TT on January 1, 2000. */
    public final double tt;

    /**
     * @param ut days since 2000-01-01T12:00:00Z, fractional
     */
    public AstroTime(double ut) {
        this.ut = ut;
        this.tt = DeltaT.terrestrialTime(ut);
    }

    /**
     * Create a time from UTC calendar fields.
     *
     * @throws java.time.DateTimeException if any field is out of range
     */
    public AstroTime(int year, int month, int day, int hour, int minute, double second) {
        this(daysSinceOrigin(LocalDateTime.of(year, month, day, hour, minute)
                        .toInstant(ZoneOffset.UTC).toEpochMilli())
                + second / 86400.0);
    }

    public AstroTime(Instant instant) {
        this(daysSinceOrigin(instant.toEpochMilli()));
    }

    /** A new time offset by a number of (possibly fractional or negative) days of UT. */
    public AstroTime addDays(double days) {
        return new AstroTime(ut + days);
    }

    /** Convert to a {@link Instant}, rounded to the nearest millisecond. */
    public Instant toInstant() {
        return Instant.ofEpochMilli(ORIGIN_EPOCH_MILLIS + Math.round(ut * MILLIS_PER_DAY));
    }

    /** ISO-8601 UTC with millisecond resolution, e.g. {@code 2019-08-30T17:45:22.763Z}. */
    @Override
    public String toString() {
        return FORMAT.format(toInstant());
    }

    private static double daysSinceOrigin(long epochMillis) {
        return (epochMillis - ORIGIN_EPOCH_MILLIS) / MILLIS_PER_DAY;
    }
}
