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
 * Celestial bodies known to the ephemeris.
 *
 * <p>Planets carry their sidereal orbital period in days, used to estimate
 * synodic periods when searching for relative longitude events.</p>
 */
public enum Body {
    MERCURY(87.969),
    VENUS(224.701),
    EARTH(365.256),
    MARS(686.980),
    JUPITER(4332.589),
    SATURN(10759.22),
    URANUS(30685.4),
    NEPTUNE(60189.0),
    PLUTO(90560.0),
    SUN(Double.NaN),
    MOON(Double.NaN);

    private final double orbitalPeriodDays;

    Body(double orbitalPeriodDays) {
        this.orbitalPeriodDays = orbitalPeriodDays;
    }

    /** True for Mercury through Pluto, including Earth. */
    public boolean isPlanet() {
        return !Double.isNaN(orbitalPeriodDays);
    }

    /** True for planets whose orbit lies outside the Earth's. */
    public boolean isSuperiorPlanet() {
        return isPlanet() && ordinal() > EARTH.ordinal();
    }

    /**
     * Mean sidereal orbital period around the Sun.
     *
     * @return period in days
     * @throws IllegalArgumentException for the Sun and the Moon
     */
    public double orbitalPeriod() {
        if (!isPlanet()) {
            throw new IllegalArgumentException("No heliocentric orbital period for " + this);
        }
        return orbitalPeriodDays;
    }
}
