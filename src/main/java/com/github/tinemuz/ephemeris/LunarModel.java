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
 *
 * This file contains derivative works. See the NOTICE file for attribution and
 * original license information.
 */
package com.github.tinemuz.ephemeris;

/**
 * Geocentric position of the Moon from a truncated lunar theory.
 *
 * <p>The Moon's ecliptic longitude, latitude and parallax are built from
 * the mean arguments L (Moon's mean anomaly), L' (Sun's mean anomaly),
 * F (argument of latitude) and D (mean elongation), plus periodic
 * perturbations by the Sun and the planets. Multiples of the four
 * arguments are formed once per evaluation by angle addition, then each
 * perturbation term combines up to four of them.</p>
 *
 * <p>All intermediate state lives in a {@link Context} created for a single
 * evaluation, so concurrent calls never share anything mutable.</p>
 */
final class LunarModel {
    private static final double PI2 = 2.0 * Math.PI;
    // Arcseconds per radian
    private static final double ARC = 3600.0 * 180.0 / Math.PI;
    // Largest multiple of any argument used by the perturbation terms
    private static final int MAX_MULTIPLE = 6;

    /**
     * Perturbations of longitude, argument of latitude, latitude factor
     * and parallax, with the multiples of L, L', F, D they depend on.
     */
    private static final SolarTerm[] SOLAR_TERMS = {
        new SolarTerm(    13.9020,     14.0600,     -0.0010,      0.2607,  0,  0,  0,  4),
        new SolarTerm(     0.4030,     -4.0100,      0.3940,      0.0023,  0,  0,  0,  3),
        new SolarTerm(  2369.9120,   2373.3600,      0.6010,     28.2333,  0,  0,  0,  2),
        new SolarTerm(  -125.1540,   -112.7900,     -0.7250,     -0.9781,  0,  0,  0,  1),
        new SolarTerm(     1.9790,      6.9800,     -0.4450,      0.0433,  1,  0,  0,  4),
        new SolarTerm(   191.9530,    192.7200,      0.0290,      3.0861,  1,  0,  0,  2),
        new SolarTerm(    -8.4660,    -13.5100,      0.4550,     -0.1093,  1,  0,  0,  1),
        new SolarTerm( 22639.5000,  22609.0700,      0.0790,    186.5398,  1,  0,  0,  0),
        new SolarTerm(    18.6090,      3.5900,     -0.0940,      0.0118,  1,  0,  0, -1),
        new SolarTerm( -4586.4650,  -4578.1300,     -0.0770,     34.3117,  1,  0,  0, -2),
        new SolarTerm(     3.2150,      5.4400,      0.1920,     -0.0386,  1,  0,  0, -3),
        new SolarTerm(   -38.4280,    -38.6400,      0.0010,      0.6008,  1,  0,  0, -4),
        new SolarTerm(    -0.3930,     -1.4300,     -0.0920,      0.0086,  1,  0,  0, -6),
        new SolarTerm(    -0.2890,     -1.5900,      0.1230,     -0.0053,  0,  1,  0,  4),
        new SolarTerm(   -24.4200,    -25.1000,      0.0400,     -0.3000,  0,  1,  0,  2),
        new SolarTerm(    18.0230,     17.9300,      0.0070,      0.1494,  0,  1,  0,  1),
        new SolarTerm(  -668.1460,   -126.9800,     -1.3020,     -0.3997,  0,  1,  0,  0),
        new SolarTerm(     0.5600,      0.3200,     -0.0010,     -0.0037,  0,  1,  0, -1),
        new SolarTerm(  -165.1450,   -165.0600,      0.0540,      1.9178,  0,  1,  0, -2),
        new SolarTerm(    -1.8770,     -6.4600,     -0.4160,      0.0339,  0,  1,  0, -4),
        new SolarTerm(     0.2130,      1.0200,     -0.0740,      0.0054,  2,  0,  0,  4),
        new SolarTerm(    14.3870,     14.7800,     -0.0170,      0.2833,  2,  0,  0,  2),
        new SolarTerm(    -0.5860,     -1.2000,      0.0540,     -0.0100,  2,  0,  0,  1),
        new SolarTerm(   769.0160,    767.9600,      0.1070,     10.1657,  2,  0,  0,  0),
        new SolarTerm(     1.7500,      2.0100,     -0.0180,      0.0155,  2,  0,  0, -1),
        new SolarTerm(  -211.6560,   -152.5300,      5.6790,     -0.3039,  2,  0,  0, -2),
        new SolarTerm(     1.2250,      0.9100,     -0.0300,     -0.0088,  2,  0,  0, -3),
        new SolarTerm(   -30.7730,    -34.0700,     -0.3080,      0.3722,  2,  0,  0, -4),
        new SolarTerm(    -0.5700,     -1.4000,     -0.0740,      0.0109,  2,  0,  0, -6),
        new SolarTerm(    -2.9210,    -11.7500,      0.7870,     -0.0484,  1,  1,  0,  2),
        new SolarTerm(     1.2670,      1.5200,     -0.0220,      0.0164,  1,  1,  0,  1),
        new SolarTerm(  -109.6730,   -115.1800,      0.4610,     -0.9490,  1,  1,  0,  0),
        new SolarTerm(  -205.9620,   -182.3600,      2.0560,      1.4437,  1,  1,  0, -2),
        new SolarTerm(     0.2330,      0.3600,      0.0120,     -0.0025,  1,  1,  0, -3),
        new SolarTerm(    -4.3910,     -9.6600,     -0.4710,      0.0673,  1,  1,  0, -4),
        new SolarTerm(     0.2830,      1.5300,     -0.1110,      0.0060,  1, -1,  0,  4),
        new SolarTerm(    14.5770,     31.7000,     -1.5400,      0.2302,  1, -1,  0,  2),
        new SolarTerm(   147.6870,    138.7600,      0.6790,      1.1528,  1, -1,  0,  0),
        new SolarTerm(    -1.0890,      0.5500,      0.0210,      0.0000,  1, -1,  0, -1),
        new SolarTerm(    28.4750,     23.5900,     -0.4430,     -0.2257,  1, -1,  0, -2),
        new SolarTerm(    -0.2760,     -0.3800,     -0.0060,     -0.0036,  1, -1,  0, -3),
        new SolarTerm(     0.6360,      2.2700,      0.1460,     -0.0102,  1, -1,  0, -4),
        new SolarTerm(    -0.1890,     -1.6800,      0.1310,     -0.0028,  0,  2,  0,  2),
        new SolarTerm(    -7.4860,     -0.6600,     -0.0370,     -0.0086,  0,  2,  0,  0),
        new SolarTerm(    -8.0960,    -16.3500,     -0.7400,      0.0918,  0,  2,  0, -2),
        new SolarTerm(    -5.7410,     -0.0400,      0.0000,     -0.0009,  0,  0,  2,  2),
        new SolarTerm(     0.2550,      0.0000,      0.0000,      0.0000,  0,  0,  2,  1),
        new SolarTerm(  -411.6080,     -0.2000,      0.0000,     -0.0124,  0,  0,  2,  0),
        new SolarTerm(     0.5840,      0.8400,      0.0000,      0.0071,  0,  0,  2, -1),
        new SolarTerm(   -55.1730,    -52.1400,      0.0000,     -0.1052,  0,  0,  2, -2),
        new SolarTerm(     0.2540,      0.2500,      0.0000,     -0.0017,  0,  0,  2, -3),
        new SolarTerm(     0.0250,     -1.6700,      0.0000,      0.0031,  0,  0,  2, -4),
        new SolarTerm(     1.0600,      2.9600,     -0.1660,      0.0243,  3,  0,  0,  2),
        new SolarTerm(    36.1240,     50.6400,     -1.3000,      0.6215,  3,  0,  0,  0),
        new SolarTerm(   -13.1930,    -16.4000,      0.2580,     -0.1187,  3,  0,  0, -2),
        new SolarTerm(    -1.1870,     -0.7400,      0.0420,      0.0074,  3,  0,  0, -4),
        new SolarTerm(    -0.2930,     -0.3100,     -0.0020,      0.0046,  3,  0,  0, -6),
        new SolarTerm(    -0.2900,     -1.4500,      0.1160,     -0.0051,  2,  1,  0,  2),
        new SolarTerm(    -7.6490,    -10.5600,      0.2590,     -0.1038,  2,  1,  0,  0),
        new SolarTerm(    -8.6270,     -7.5900,      0.0780,     -0.0192,  2,  1,  0, -2),
        new SolarTerm(    -2.7400,     -2.5400,      0.0220,      0.0324,  2,  1,  0, -4),
        new SolarTerm(     1.1810,      3.3200,     -0.2120,      0.0213,  2, -1,  0,  2),
        new SolarTerm(     9.7030,     11.6700,     -0.1510,      0.1268,  2, -1,  0,  0),
        new SolarTerm(    -0.3520,     -0.3700,      0.0010,     -0.0028,  2, -1,  0, -1),
        new SolarTerm(    -2.4940,     -1.1700,     -0.0030,     -0.0017,  2, -1,  0, -2),
        new SolarTerm(     0.3600,      0.2000,     -0.0120,     -0.0043,  2, -1,  0, -4),
        new SolarTerm(    -1.1670,     -1.2500,      0.0080,     -0.0106,  1,  2,  0,  0),
        new SolarTerm(    -7.4120,     -6.1200,      0.1170,      0.0484,  1,  2,  0, -2),
        new SolarTerm(    -0.3110,     -0.6500,     -0.0320,      0.0044,  1,  2,  0, -4),
        new SolarTerm(     0.7570,      1.8200,     -0.1050,      0.0112,  1, -2,  0,  2),
        new SolarTerm(     2.5800,      2.3200,      0.0270,      0.0196,  1, -2,  0,  0),
        new SolarTerm(     2.5330,      2.4000,     -0.0140,     -0.0212,  1, -2,  0, -2),
        new SolarTerm(    -0.3440,     -0.5700,     -0.0250,      0.0036,  0,  3,  0, -2),
        new SolarTerm(    -0.9920,     -0.0200,      0.0000,      0.0000,  1,  0,  2,  2),
        new SolarTerm(   -45.0990,     -0.0200,      0.0000,     -0.0010,  1,  0,  2,  0),
        new SolarTerm(    -0.1790,     -9.5200,      0.0000,     -0.0833,  1,  0,  2, -2),
        new SolarTerm(    -0.3010,     -0.3300,      0.0000,      0.0014,  1,  0,  2, -4),
        new SolarTerm(    -6.3820,     -3.3700,      0.0000,     -0.0481,  1,  0, -2,  2),
        new SolarTerm(    39.5280,     85.1300,      0.0000,     -0.7136,  1,  0, -2,  0),
        new SolarTerm(     9.3660,      0.7100,      0.0000,     -0.0112,  1,  0, -2, -2),
        new SolarTerm(     0.2020,      0.0200,      0.0000,      0.0000,  1,  0, -2, -4),
        new SolarTerm(     0.4150,      0.1000,      0.0000,      0.0013,  0,  1,  2,  0),
        new SolarTerm(    -2.1520,     -2.2600,      0.0000,     -0.0066,  0,  1,  2, -2),
        new SolarTerm(    -1.4400,     -1.3000,      0.0000,      0.0014,  0,  1, -2,  2),
        new SolarTerm(     0.3840,     -0.0400,      0.0000,      0.0000,  0,  1, -2, -2),
        new SolarTerm(     1.9380,      3.6000,     -0.1450,      0.0401,  4,  0,  0,  0),
        new SolarTerm(    -0.9520,     -1.5800,      0.0520,     -0.0130,  4,  0,  0, -2),
        new SolarTerm(    -0.5510,     -0.9400,      0.0320,     -0.0097,  3,  1,  0,  0),
        new SolarTerm(    -0.4820,     -0.5700,      0.0050,     -0.0045,  3,  1,  0, -2),
        new SolarTerm(     0.6810,      0.9600,     -0.0260,      0.0115,  3, -1,  0,  0),
        new SolarTerm(    -0.2970,     -0.2700,      0.0020,     -0.0009,  2,  2,  0, -2),
        new SolarTerm(     0.2540,      0.2100,     -0.0030,      0.0000,  2, -2,  0, -2),
        new SolarTerm(    -0.2500,     -0.2200,      0.0040,      0.0014,  1,  3,  0, -2),
        new SolarTerm(    -3.9960,      0.0000,      0.0000,      0.0004,  2,  0,  2,  0),
        new SolarTerm(     0.5570,     -0.7500,      0.0000,     -0.0090,  2,  0,  2, -2),
        new SolarTerm(    -0.4590,     -0.3800,      0.0000,     -0.0053,  2,  0, -2,  2),
        new SolarTerm(    -1.2980,      0.7400,      0.0000,      0.0004,  2,  0, -2,  0),
        new SolarTerm(     0.5380,      1.1400,      0.0000,     -0.0141,  2,  0, -2, -2),
        new SolarTerm(     0.2630,      0.0200,      0.0000,      0.0000,  1,  1,  2,  0),
        new SolarTerm(     0.4260,      0.0700,      0.0000,     -0.0006,  1,  1, -2, -2),
        new SolarTerm(    -0.3040,      0.0300,      0.0000,      0.0003,  1, -1,  2,  0),
        new SolarTerm(    -0.3720,     -0.1900,      0.0000,     -0.0027,  1, -1, -2,  2),
        new SolarTerm(     0.4180,      0.0000,      0.0000,      0.0000,  0,  0,  4,  0),
        new SolarTerm(    -0.3300,     -0.0400,      0.0000,      0.0000,  3,  0,  2,  0)
    };

    // Latitude perturbations through the node of the lunar orbit
    private static final NodeTerm[] NODE_TERMS = {
        new NodeTerm(-526.069, 0, 0, 1, -2),
        new NodeTerm(-3.352, 0, 0, 1, -4),
        new NodeTerm(+44.297, +1, 0, 1, -2),
        new NodeTerm(-6.000, +1, 0, 1, -4),
        new NodeTerm(+20.599, -1, 0, 1, 0),
        new NodeTerm(-30.598, -1, 0, 1, -2),
        new NodeTerm(-24.649, -2, 0, 1, 0),
        new NodeTerm(-2.000, -2, 0, 1, -2),
        new NodeTerm(-22.571, 0, +1, 1, -2),
        new NodeTerm(+10.985, 0, -1, 1, -2)
    };

    private LunarModel() {}

    /**
     * Ecliptic coordinates of date and distance of the Moon.
     *
     * @param geoEclipLon longitude in radians, [0, 2pi)
     * @param geoEclipLat latitude in radians
     * @param distanceAu  center-to-center distance in AU
     */
    record MoonPosition(double geoEclipLon, double geoEclipLat, double distanceAu) {}

    /**
     * Evaluate the lunar theory.
     *
     * @param centuries Julian centuries of TT since J2000
     */
    static MoonPosition calcMoon(double centuries) {
        return new Context(centuries).calcMoon();
    }

    /**
     * Geocentric position of the Moon in J2000 mean equatorial coordinates.
     */
    static AstroVector geoMoon(AstroTime time) {
        MoonPosition moon = calcMoon(time.tt / 36525.0);

        // Spherical ecliptic of date to Cartesian
        double distCosLat = moon.distanceAu() * Math.cos(moon.geoEclipLat());
        AstroVector ofDate = Coordinates.eclipticToEquatorialOfDate(
                distCosLat * Math.cos(moon.geoEclipLon()),
                distCosLat * Math.sin(moon.geoEclipLon()),
                moon.distanceAu() * Math.sin(moon.geoEclipLat()),
                time);

        return EarthOrientation.precession(time.tt, ofDate, 0.0);
    }

    private static double frac(double x) {
        return x - Math.floor(x);
    }

    // Sine of an angle given in revolutions
    private static double sine(double phi) {
        return Math.sin(PI2 * phi);
    }

    private record SolarTerm(
            double coeffL, double coeffS, double coeffG, double coeffP, int p, int q, int r, int s) {}

    private record NodeTerm(double coeffN, int p, int q, int r, int s) {}

    /**
     * Working state of one evaluation.
     */
    private static final class Context {
        final double t;
        // cos/sin of j * argument, indexed [j + MAX_MULTIPLE][argument 1..4]
        final double[][] co = new double[2 * MAX_MULTIPLE + 1][5];
        final double[][] si = new double[2 * MAX_MULTIPLE + 1][5];
        double dgam;
        double dlam;
        double n;
        double gam1c;
        double sinpi;
        double l0;
        double l;
        double ls;
        double f;
        double d;
        double dl0;
        double dl;
        double dls;
        double df;
        double dd;
        double ds;
        // Result of the last term() call
        double termX;
        double termY;

        Context(double centuries) {
            t = centuries;
            double t2 = t * t;
            sinpi = 3422.7000;
            longPeriodic();

            // Mean arguments with long-periodic corrections
            l0 = PI2 * frac(0.60643382 + 1336.85522467 * t - 0.00000313 * t2) + dl0 / ARC;
            l = PI2 * frac(0.37489701 + 1325.55240982 * t + 0.00002565 * t2) + dl / ARC;
            ls = PI2 * frac(0.99312619 + 99.99735956 * t - 0.00000044 * t2) + dls / ARC;
            f = PI2 * frac(0.25909118 + 1342.22782980 * t - 0.00000892 * t2) + df / ARC;
            d = PI2 * frac(0.82736186 + 1236.85308708 * t - 0.00000397 * t2) + dd / ARC;

            fillMultiples(1, l, 4, 1.000002208);
            fillMultiples(2, ls, 3, 0.997504612 - 0.002495388 * t);
            fillMultiples(3, f, 4, 1.000002708 + 139.978 * dgam);
            fillMultiples(4, d, 6, 1.0);
        }

        /**
         * cos/sin of j * arg for j in [-max, max], built by repeated angle
         * addition from the scaled fundamental.
         */
        private void fillMultiples(int index, double arg, int max, double fac) {
            co[MAX_MULTIPLE][index] = 1.0;
            si[MAX_MULTIPLE][index] = 0.0;
            co[MAX_MULTIPLE + 1][index] = Math.cos(arg) * fac;
            si[MAX_MULTIPLE + 1][index] = Math.sin(arg) * fac;
            for (int j = 2; j <= max; j++) {
                double cp = co[MAX_MULTIPLE + j - 1][index];
                double sp = si[MAX_MULTIPLE + j - 1][index];
                double c1 = co[MAX_MULTIPLE + 1][index];
                double s1 = si[MAX_MULTIPLE + 1][index];
                co[MAX_MULTIPLE + j][index] = cp * c1 - sp * s1;
                si[MAX_MULTIPLE + j][index] = sp * c1 + cp * s1;
            }
            for (int j = 1; j <= max; j++) {
                co[MAX_MULTIPLE - j][index] = co[MAX_MULTIPLE + j][index];
                si[MAX_MULTIPLE - j][index] = -si[MAX_MULTIPLE + j][index];
            }
        }

        private void longPeriodic() {
            double s1 = sine(0.19833 + 0.05611 * t);
            double s2 = sine(0.27869 + 0.04508 * t);
            double s3 = sine(0.16827 - 0.36903 * t);
            double s4 = sine(0.34734 - 5.37261 * t);
            double s5 = sine(0.10498 - 5.37899 * t);
            double s6 = sine(0.42681 - 0.41855 * t);
            double s7 = sine(0.14943 - 5.37511 * t);

            dl0 = 0.84 * s1 + 0.31 * s2 + 14.27 * s3 + 7.26 * s4 + 0.28 * s5 + 0.24 * s6;
            dl = 2.94 * s1 + 0.31 * s2 + 14.27 * s3 + 9.34 * s4 + 1.12 * s5 + 0.83 * s6;
            dls = -6.40 * s1 - 1.89 * s6;
            df = 0.21 * s1 + 0.31 * s2 + 14.27 * s3 - 88.70 * s4 - 15.30 * s5 + 0.24 * s6 - 1.86 * s7;
            dd = dl0 - dls;
            dgam = -3332E-9 * sine(0.59734 - 5.37261 * t)
                    - 539E-9 * sine(0.35498 - 5.37899 * t)
                    - 64E-9 * sine(0.39943 - 5.37511 * t);
        }

        /**
         * Combine p*L + q*L' + r*F + s*D into (cos, sin) in termX/termY.
         */
        private void term(int p, int q, int r, int s) {
            double x = 1.0;
            double y = 0.0;
            int[] multiples = {p, q, r, s};
            for (int k = 1; k <= 4; k++) {
                int j = multiples[k - 1];
                if (j != 0) {
                    double c2 = co[MAX_MULTIPLE + j][k];
                    double s2 = si[MAX_MULTIPLE + j][k];
                    double c = x * c2 - y * s2;
                    y = y * c2 + x * s2;
                    x = c;
                }
            }
            termX = x;
            termY = y;
        }

        private void planetary() {
            dlam += +0.82 * sine(0.7736 - 62.5512 * t) + 0.31 * sine(0.0466 - 125.1025 * t)
                    + 0.35 * sine(0.5785 - 25.1042 * t) + 0.66 * sine(0.4591 + 1335.8075 * t)
                    + 0.64 * sine(0.3130 - 91.5680 * t) + 1.14 * sine(0.1480 + 1331.2898 * t)
                    + 0.21 * sine(0.5918 + 1056.5859 * t) + 0.44 * sine(0.5784 + 1322.8595 * t)
                    + 0.24 * sine(0.2275 - 5.7374 * t) + 0.28 * sine(0.2965 + 2.6929 * t)
                    + 0.33 * sine(0.3132 + 6.3368 * t);
        }

        MoonPosition calcMoon() {
            // STEP 1: Solar perturbations
            for (SolarTerm st : SOLAR_TERMS) {
                term(st.p(), st.q(), st.r(), st.s());
                dlam += st.coeffL() * termY;
                ds += st.coeffS() * termY;
                gam1c += st.coeffG() * termX;
                sinpi += st.coeffP() * termX;
            }

            // STEP 2: Latitude terms through the node, then planetary terms in longitude
            n = 0.0;
            for (NodeTerm nt : NODE_TERMS) {
                term(nt.p(), nt.q(), nt.r(), nt.s());
                n += nt.coeffN() * termY;
            }
            planetary();

            // STEP 3: Assemble latitude (arcseconds), longitude and distance
            double s = f + ds / ARC;
            double latSeconds = (1.000002708 + 139.978 * dgam) * (18518.511 + 1.189 + gam1c) * Math.sin(s)
                    - 6.24 * Math.sin(3 * s) + n;

            return new MoonPosition(
                    PI2 * frac((l0 + dlam / ARC) / PI2),
                    Math.toRadians(latSeconds / 3600.0),
                    (ARC * (Astronomy.EARTH_EQUATORIAL_RADIUS_KM / Astronomy.KM_PER_AU)) / (0.999953253 * sinpi));
        }
    }
}
