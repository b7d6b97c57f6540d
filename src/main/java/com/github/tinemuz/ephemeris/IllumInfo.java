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
 * Brightness and lighting geometry of a body seen from the Earth.
 */
public final class IllumInfo {
    public final AstroTime time;

    /** Visual magnitude; smaller is brighter. */
    public final double mag;

    /** Sun-body-Earth angle in degrees. 0 is fully lit, 180 is unlit. */
    public final double phaseAngle;

    /** Distance from the Sun in AU. */
    public final double helioDist;

    /** Tilt of Saturn's rings toward the Earth in degrees; 0 for other bodies. */
    public final double ringTilt;

    IllumInfo(AstroTime time, double mag, double phaseAngle, double helioDist, double ringTilt) {
        this.time = time;
        this.mag = mag;
        this.phaseAngle = phaseAngle;
        this.helioDist = helioDist;
        this.ringTilt = ringTilt;
    }
}
