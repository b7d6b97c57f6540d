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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Root finder for ascending zero crossings of a {@link SearchContext}.
 *
 * <p>Each iteration fits a parabola through the two bracket ends and the
 * midpoint. When the parabola has exactly one root inside the bracket, the
 * function is evaluated there; a small enough error estimate ends the
 * search, otherwise the bracket is narrowed around the estimate. If that
 * fails the bracket is bisected. The search gives up (returns null) as soon
 * as no half of the bracket holds an ascending crossing.</p>
 *
 * <p>The error-estimate exit does not look at the slope's sign, so a
 * bracket that only holds a descending root may still return it.</p>
 */
final class Search {
    private static final Logger log = LoggerFactory.getLogger(Search.class);
    static final int ITERATION_LIMIT = 20;
    private static final double SECONDS_PER_DAY = 86400.0;

    private Search() {}

    /**
     * @param toleranceSeconds stop when the root is known to this precision
     * @return time of the crossing, or null if none was found
     * @throws SearchNonConvergenceException after {@value #ITERATION_LIMIT} iterations
     */
    static AstroTime search(SearchContext func, AstroTime t1, AstroTime t2, double toleranceSeconds) {
        double dtDays = Math.abs(toleranceSeconds / SECONDS_PER_DAY);
        double f1 = func.eval(t1);
        double f2 = func.eval(t2);
        int iter = 0;
        boolean calcFmid = true;
        double fmid = 0.0;
        for (;;) {
            if (++iter > ITERATION_LIMIT) {
                log.error("Search between {} and {} did not converge within {} iterations",
                        t1, t2, ITERATION_LIMIT);
                throw new SearchNonConvergenceException(
                        "Search did not converge within " + ITERATION_LIMIT + " iterations.");
            }

            double dt = (t2.tt - t1.tt) / 2.0;
            AstroTime tmid = t1.addDays(dt);
            if (Math.abs(dt) < dtDays) {
                return tmid;
            }

            if (calcFmid) {
                fmid = func.eval(tmid);
            } else {
                calcFmid = true;  // fmid carried over from the narrowed bracket
            }

            // STEP 1: Parabola through (t1, f1), (tmid, fmid), (t2, f2)
            QuadRoot q = quadInterp(tmid.ut, t2.ut - tmid.ut, f1, fmid, f2);
            if (q != null) {
                AstroTime tq = new AstroTime(q.t());
                double fq = func.eval(tq);
                if (q.dfdt() != 0.0) {
                    double dtGuess = Math.abs(fq / q.dfdt());
                    if (dtGuess < dtDays) {
                        return tq;
                    }

                    // STEP 2: Try a tighter bracket centered on the interpolated root
                    dtGuess *= 1.2;
                    if (dtGuess < dt / 10.0) {
                        AstroTime tleft = tq.addDays(-dtGuess);
                        AstroTime tright = tq.addDays(+dtGuess);
                        if ((tleft.ut - t1.ut) * (tleft.ut - t2.ut) < 0.0
                                && (tright.ut - t1.ut) * (tright.ut - t2.ut) < 0.0) {
                            double fleft = func.eval(tleft);
                            double fright = func.eval(tright);
                            if (fleft < 0.0 && fright >= 0.0) {
                                f1 = fleft;
                                f2 = fright;
                                t1 = tleft;
                                t2 = tright;
                                fmid = fq;
                                calcFmid = false;
                                continue;
                            }
                        }
                    }
                }
            }

            // STEP 3: Bisect, keeping the half with the ascending crossing
            if (f1 < 0.0 && fmid >= 0.0) {
                t2 = tmid;
                f2 = fmid;
                continue;
            }
            if (fmid < 0.0 && f2 >= 0.0) {
                t1 = tmid;
                f1 = fmid;
                continue;
            }

            log.debug("No ascending zero crossing between {} and {}", t1, t2);
            return null;
        }
    }

    /**
     * Find the unique root in [-1, +1] of the parabola through
     * (-1, fa), (0, fm), (+1, fb), mapped to time as {@code tm + x * dt}.
     *
     * @return the root with its time and slope, or null if there is no
     *         unique root in range
     */
    static QuadRoot quadInterp(double tm, double dt, double fa, double fm, double fb) {
        double qa = (fb + fa) / 2.0 - fm;
        double qb = (fb - fa) / 2.0;
        double qc = fm;
        double x;

        if (qa == 0.0) {
            // A line, not a parabola
            if (qb == 0.0) {
                return null;
            }
            x = -qc / qb;
            if (x < -1.0 || x > +1.0) {
                return null;
            }
        } else {
            double u = qb * qb - 4.0 * qa * qc;
            if (u <= 0.0) {
                return null;
            }
            double ru = Math.sqrt(u);
            double x1 = (-qb + ru) / (2.0 * qa);
            double x2 = (-qb - ru) / (2.0 * qa);
            boolean in1 = -1.0 <= x1 && x1 <= +1.0;
            boolean in2 = -1.0 <= x2 && x2 <= +1.0;
            if (in1 == in2) {
                return null;  // no root, or two roots, inside the interval
            }
            x = in1 ? x1 : x2;
        }
        return new QuadRoot(x, tm + x * dt, (2.0 * qa * x + qb) / dt);
    }

    // Normalized root, its UT, and the slope of the parabola there (per day)
    record QuadRoot(double x, double t, double dfdt) {}
}
