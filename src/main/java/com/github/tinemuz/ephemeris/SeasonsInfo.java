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

/** Equinox and solstice times for one calendar year. */
public final class SeasonsInfo {
    /** Sun reaches apparent ecliptic longitude 0 (March equinox). */
    public final AstroTime marEquinox;
    /** Longitude 90 (June solstice). */
    public final AstroTime junSolstice;
    /** Longitude 180 (September equinox). */
    public final AstroTime sepEquinox;
    /** Longitude 270 (December solstice). */
    public final AstroTime decSolstice;

    SeasonsInfo(AstroTime marEquinox, AstroTime junSolstice, AstroTime sepEquinox, AstroTime decSolstice) {
        this.marEquinox = marEquinox;
        this.junSolstice = junSolstice;
        this.sepEquinox = sepEquinox;
        this.decSolstice = decSolstice;
    }
}
