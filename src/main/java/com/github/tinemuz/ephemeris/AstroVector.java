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
 * A Cartesian position in astronomical units, tagged with the time at which
 * it is valid. The frame depends on the producer; most methods return J2000
 * mean equator coordinates.
 */
public final class AstroVector {
    /** Cartesian x-coordinate in AU. */
    public final double x;

    /** Cartesian y-coordinate in AU. */
    public final double y;

    /** Cartesian z-coordinate in AU. */
    public final double z;

    /** Time at which the position is valid. */
    public final AstroTime t;

    public AstroVector(double x, double y, double z, AstroTime t) {
        this.x = x;
        this.y = y;
        this.z = z;
        this.t = t;
    }

    /** Distance from the origin in AU. */
    public double length() {
        return Math.sqrt(x * x + y * y + z * z);
    }

    @Override
    public String toString() {
        return String.format("(%.9f, %.9f, %.9f) @ %s", x, y, z, t);
    }
}
