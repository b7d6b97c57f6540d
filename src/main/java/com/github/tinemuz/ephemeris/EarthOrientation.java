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
 * Orientation of the Earth in space: precession, nutation, obliquity of the
 * ecliptic and sidereal time, plus the geocentric position of an observer.
 *
 * <p>Nutation uses the truncated IAU 2000B series. Precession uses the
 * IAU 2006 angles psi_A, omega_A and chi_A, and rotates between the mean
 * equator of J2000 and the mean equator of date.</p>
 *
 * <p>The nutation angles are returned as an immutable {@link EarthTilt};
 * callers that need them more than once for the same time pass the tilt
 * along instead of recomputing it.</p>
 */
final class EarthOrientation {
    static final double ASEC360 = 1296000.0;
    static final double ASEC2RAD = 4.848136811095359935899141e-6;
    private static final double PI2 = 2.0 * Math.PI;
    private static final double DAYS_PER_CENTURY = 36525.0;
    // Obliquity of the ecliptic at J2000 in arcseconds
    private static final double EPS0 = 84381.406;
    private static final double EARTH_FLATTENING = 0.003352819697896;

    /** Direction of a frame rotation. */
    enum Rotation {
        /** Mean equator of date into true equator of date. */
        INTO_DATE,
        /** True equator of date back into mean equator of date. */
        FROM_DATE
    }

    private static final NutationTerm[] NUTATION = {
        new NutationTerm( 0,  0,  0,  0,  1, -172064161,    -174666,      33386,   92052331,       9086,      15377),
        new NutationTerm( 0,  0,  2, -2,  2,  -13170906,      -1675,     -13696,    5730336,      -3015,      -4587),
        new NutationTerm( 0,  0,  2,  0,  2,   -2276413,       -234,       2796,     978459,       -485,       1374),
        new NutationTerm( 0,  0,  0,  0,  2,    2074554,        207,       -698,    -897492,        470,       -291),
        new NutationTerm( 0,  1,  0,  0,  0,    1475877,      -3633,      11817,      73871,       -184,      -1924),
        new NutationTerm( 0,  1,  2, -2,  2,    -516821,       1226,       -524,     224386,       -677,       -174),
        new NutationTerm( 1,  0,  0,  0,  0,     711159,         73,       -872,      -6750,          0,        358),
        new NutationTerm( 0,  0,  2,  0,  1,    -387298,       -367,        380,     200728,         18,        318),
        new NutationTerm( 1,  0,  2,  0,  2,    -301461,        -36,        816,     129025,        -63,        367),
        new NutationTerm( 0, -1,  2, -2,  2,     215829,       -494,        111,     -95929,        299,        132),
        new NutationTerm( 0,  0,  2, -2,  1,     128227,        137,        181,     -68982,         -9,         39),
        new NutationTerm(-1,  0,  2,  0,  2,     123457,         11,         19,     -53311,         32,         -4),
        new NutationTerm(-1,  0,  0,  2,  0,     156994,         10,       -168,      -1235,          0,         82),
        new NutationTerm( 1,  0,  0,  0,  1,      63110,         63,         27,     -33228,          0,         -9),
        new NutationTerm(-1,  0,  0,  0,  1,     -57976,        -63,       -189,      31429,          0,        -75),
        new NutationTerm(-1,  0,  2,  2,  2,     -59641,        -11,        149,      25543,        -11,         66),
        new NutationTerm( 1,  0,  2,  0,  1,     -51613,        -42,        129,      26366,          0,         78),
        new NutationTerm(-2,  0,  2,  0,  1,      45893,         50,         31,     -24236,        -10,         20),
        new NutationTerm( 0,  0,  0,  2,  0,      63384,         11,       -150,      -1220,          0,         29),
        new NutationTerm( 0,  0,  2,  2,  2,     -38571,         -1,        158,      16452,        -11,         68),
        new NutationTerm( 0, -2,  2, -2,  2,      32481,          0,          0,     -13870,          0,          0),
        new NutationTerm(-2,  0,  0,  2,  0,     -47722,          0,        -18,        477,          0,        -25),
        new NutationTerm( 2,  0,  2,  0,  2,     -31046,         -1,        131,      13238,        -11,         59),
        new NutationTerm( 1,  0,  2, -2,  2,      28593,          0,         -1,     -12338,         10,         -3),
        new NutationTerm(-1,  0,  2,  0,  1,      20441,         21,         10,     -10758,          0,         -3),
        new NutationTerm( 2,  0,  0,  0,  0,      29243,          0,        -74,       -609,          0,         13),
        new NutationTerm( 0,  0,  2,  0,  0,      25887,          0,        -66,       -550,          0,         11),
        new NutationTerm( 0,  1,  0,  0,  1,     -14053,        -25,         79,       8551,         -2,        -45),
        new NutationTerm(-1,  0,  0,  2,  1,      15164,         10,         11,      -8001,          0,         -1),
        new NutationTerm( 0,  2,  2, -2,  2,     -15794,         72,        -16,       6850,        -42,         -5),
        new NutationTerm( 0,  0, -2,  2,  0,      21783,          0,         13,       -167,          0,         13),
        new NutationTerm( 1,  0,  0, -2,  1,     -12873,        -10,        -37,       6953,          0,        -14),
        new NutationTerm( 0, -1,  0,  0,  1,     -12654,         11,         63,       6415,          0,         26),
        new NutationTerm(-1,  0,  2,  2,  1,     -10204,          0,         25,       5222,          0,         15),
        new NutationTerm( 0,  2,  0,  0,  0,      16707,        -85,        -10,        168,         -1,         10),
        new NutationTerm( 1,  0,  2,  2,  2,      -7691,          0,         44,       3268,          0,         19),
        new NutationTerm(-2,  0,  2,  0,  0,     -11024,          0,        -14,        104,          0,          2),
        new NutationTerm( 0,  1,  2,  0,  2,       7566,        -21,        -11,      -3250,          0,         -5),
        new NutationTerm( 0,  0,  2,  2,  1,      -6637,        -11,         25,       3353,          0,         14),
        new NutationTerm( 0, -1,  2,  0,  2,      -7141,         21,          8,       3070,          0,          4),
        new NutationTerm( 0,  0,  0,  2,  1,      -6302,        -11,          2,       3272,          0,          4),
        new NutationTerm( 1,  0,  2, -2,  1,       5800,         10,          2,      -3045,          0,         -1),
        new NutationTerm( 2,  0,  2, -2,  2,       6443,          0,         -7,      -2768,          0,         -4),
        new NutationTerm(-2,  0,  0,  2,  1,      -5774,        -11,        -15,       3041,          0,         -5),
        new NutationTerm( 2,  0,  2,  0,  1,      -5350,          0,         21,       2695,          0,         12),
        new NutationTerm( 0, -1,  2, -2,  1,      -4752,        -11,         -3,       2719,          0,         -3),
        new NutationTerm( 0,  0,  0, -2,  1,      -4940,        -11,        -21,       2720,          0,         -9),
        new NutationTerm(-1, -1,  0,  2,  0,       7350,          0,         -8,        -51,          0,          4),
        new NutationTerm( 2,  0,  0, -2,  1,       4065,          0,          6,      -2206,          0,          1),
        new NutationTerm( 1,  0,  0,  2,  0,       6579,          0,        -24,       -199,          0,          2),
        new NutationTerm( 0,  1,  2, -2,  1,       3579,          0,          5,      -1900,          0,          1),
        new NutationTerm( 1, -1,  0,  0,  0,       4725,          0,         -6,        -41,          0,          3),
        new NutationTerm(-2,  0,  2,  0,  2,      -3075,          0,         -2,       1313,          0,         -1),
        new NutationTerm( 3,  0,  2,  0,  2,      -2904,          0,         15,       1233,          0,          7),
        new NutationTerm( 0, -1,  0,  2,  0,       4348,          0,        -10,        -81,          0,          2),
        new NutationTerm( 1, -1,  2,  0,  2,      -2878,          0,          8,       1232,          0,          4),
        new NutationTerm( 0,  0,  0,  1,  0,      -4230,          0,          5,        -20,          0,         -2),
        new NutationTerm(-1, -1,  2,  2,  2,      -2819,          0,          7,       1207,          0,          3),
        new NutationTerm(-1,  0,  2,  0,  0,      -4056,          0,          5,         40,          0,         -2),
        new NutationTerm( 0, -1,  2,  2,  2,      -2647,          0,         11,       1129,          0,          5),
        new NutationTerm(-2,  0,  0,  0,  1,      -2294,          0,        -10,       1266,          0,         -4),
        new NutationTerm( 1,  1,  2,  0,  2,       2481,          0,         -7,      -1062,          0,         -3),
        new NutationTerm( 2,  0,  0,  0,  1,       2179,          0,         -2,      -1129,          0,         -2),
        new NutationTerm(-1,  1,  0,  1,  0,       3276,          0,          1,         -9,          0,          0),
        new NutationTerm( 1,  1,  0,  0,  0,      -3389,          0,          5,         35,          0,         -2),
        new NutationTerm( 1,  0,  2,  0,  0,       3339,          0,        -13,       -107,          0,          1),
        new NutationTerm(-1,  0,  2, -2,  1,      -1987,          0,         -6,       1073,          0,         -2),
        new NutationTerm( 1,  0,  0,  0,  2,      -1981,          0,          0,        854,          0,          0),
        new NutationTerm(-1,  0,  0,  1,  0,       4026,          0,       -353,       -553,          0,       -139),
        new NutationTerm( 0,  0,  2,  1,  2,       1660,          0,         -5,       -710,          0,         -2),
        new NutationTerm(-1,  0,  2,  4,  2,      -1521,          0,          9,        647,          0,          4),
        new NutationTerm(-1,  1,  0,  1,  1,       1314,          0,          0,       -700,          0,          0),
        new NutationTerm( 0, -2,  2, -2,  1,      -1283,          0,          0,        672,          0,          0),
        new NutationTerm( 1,  0,  2,  2,  1,      -1331,          0,          8,        663,          0,          4),
        new NutationTerm(-2,  0,  2,  2,  2,       1383,          0,         -2,       -594,          0,         -2),
        new NutationTerm(-1,  0,  0,  0,  2,       1405,          0,          4,       -610,          0,          2),
        new NutationTerm( 1,  1,  2, -2,  2,       1290,          0,          0,       -556,          0,          0)
    };

    private EarthOrientation() {}

    /**
     * Nutation in longitude and obliquity, plus the obliquity of the
     * ecliptic, for one instant.
     *
     * @param tt   Terrestrial Time the values were computed for
     * @param dpsi nutation in longitude, arcseconds
     * @param deps nutation in obliquity, arcseconds
     * @param ee   equation of the equinoxes, seconds of time
     * @param mobl mean obliquity, degrees
     * @param tobl true obliquity, degrees
     */
    record EarthTilt(double tt, double dpsi, double deps, double ee, double mobl, double tobl) {}

    // Multipliers of (l, l', F, D, Omega) and the six amplitude coefficients in 0.1 microarcsec
    private record NutationTerm(
            int nl, int nlp, int nf, int nd, int nom,
            double sp, double spt, double cp, double ce, double cet, double se) {}

    /** Mean obliquity of the ecliptic in degrees. */
    static double meanObliquity(double tt) {
        double t = tt / DAYS_PER_CENTURY;
        double asec =
                ((((-0.0000000434 * t
                        - 0.000000576) * t
                        + 0.00200340) * t
                        - 0.0001831) * t
                        - 46.836769) * t + EPS0;
        return asec / 3600.0;
    }

    /**
     * Evaluate nutation angles and obliquity for the given time.
     */
    static EarthTilt tilt(AstroTime time) {
        double t = time.tt / DAYS_PER_CENTURY;

        // Fundamental arguments (Delaunay), reduced to one revolution before scaling
        double el = ((485868.249036 + t * 1717915923.2178) % ASEC360) * ASEC2RAD;
        double elp = ((1287104.79305 + t * 129596581.0481) % ASEC360) * ASEC2RAD;
        double f = ((335779.526232 + t * 1739527262.8478) % ASEC360) * ASEC2RAD;
        double d = ((1072260.70369 + t * 1602961601.2090) % ASEC360) * ASEC2RAD;
        double om = ((450160.398036 - t * 6962890.5431) % ASEC360) * ASEC2RAD;

        // Smallest terms first
        double dp = 0.0;
        double de = 0.0;
        for (int i = NUTATION.length - 1; i >= 0; i--) {
            NutationTerm row = NUTATION[i];
            double arg = (row.nl * el + row.nlp * elp + row.nf * f + row.nd * d + row.nom * om) % PI2;
            double sarg = Math.sin(arg);
            double carg = Math.cos(arg);
            dp += (row.sp + row.spt * t) * sarg + row.cp * carg;
            de += (row.ce + row.cet * t) * carg + row.se * sarg;
        }

        // Fixed offsets stand in for the planetary nutation terms
        double dpsi = -0.000135 + dp * 1.0e-7;
        double deps = +0.000388 + de * 1.0e-7;

        double mobl = meanObliquity(time.tt);
        double tobl = mobl + deps / 3600.0;
        double ee = dpsi * Math.cos(Math.toRadians(mobl)) / 15.0;
        return new EarthTilt(time.tt, dpsi, deps, ee, mobl, tobl);
    }

    /**
     * Rotate a vector between the mean equator of J2000 and the mean equator
     * of another date. Exactly one of the two times must be zero (J2000).
     *
     * @param tt1 Terrestrial Time of the input frame
     * @param pos input position
     * @param tt2 Terrestrial Time of the output frame
     * @return position in the output frame, tagged with {@code pos.t}
     * @throws IllegalArgumentException if neither or both times are J2000
     */
    static AstroVector precession(double tt1, AstroVector pos, double tt2) {
        if (tt1 != 0.0 && tt2 != 0.0) {
            throw new IllegalArgumentException("One of (tt1, tt2) must be zero.");
        }

        double t = (tt2 - tt1) / DAYS_PER_CENTURY;
        if (tt2 == 0.0) {
            t = -t;
        }

        double psia = (((((-0.0000000951 * t
                + 0.000132851) * t
                - 0.00114045) * t
                - 1.0790069) * t
                + 5038.481507) * t);

        double omegaa = (((((+0.0000003337 * t
                - 0.000000467) * t
                - 0.00772503) * t
                + 0.0512623) * t
                - 0.025754) * t + EPS0);

        double chia = (((((-0.0000000560 * t
                + 0.000170663) * t
                - 0.00121197) * t
                - 2.3814292) * t
                + 10.556403) * t);

        double eps0 = EPS0 * ASEC2RAD;
        psia *= ASEC2RAD;
        omegaa *= ASEC2RAD;
        chia *= ASEC2RAD;

        double sa = Math.sin(eps0);
        double ca = Math.cos(eps0);
        double sb = Math.sin(-psia);
        double cb = Math.cos(-psia);
        double sc = Math.sin(-omegaa);
        double cc = Math.cos(-omegaa);
        double sd = Math.sin(chia);
        double cd = Math.cos(chia);

        double xx = cd * cb - sb * sd * cc;
        double yx = cd * sb * ca + sd * cc * cb * ca - sa * sd * sc;
        double zx = cd * sb * sa + sd * cc * cb * sa + ca * sd * sc;
        double xy = -sd * cb - sb * cd * cc;
        double yy = -sd * sb * ca + cd * cc * cb * ca - sa * cd * sc;
        double zy = -sd * sb * sa + cd * cc * cb * sa + ca * cd * sc;
        double xz = sb * sc;
        double yz = -sc * cb * ca - sa * cc;
        double zz = -sc * cb * sa + cc * ca;

        if (tt2 == 0.0) {
            // Date to J2000
            return new AstroVector(
                    xx * pos.x + xy * pos.y + xz * pos.z,
                    yx * pos.x + yy * pos.y + yz * pos.z,
                    zx * pos.x + zy * pos.y + zz * pos.z,
                    pos.t);
        }
        // J2000 to date
        return new AstroVector(
                xx * pos.x + yx * pos.y + zx * pos.z,
                xy * pos.x + yy * pos.y + zy * pos.z,
                xz * pos.x + yz * pos.y + zz * pos.z,
                pos.t);
    }

    /**
     * Apply or remove nutation.
     *
     * @return rotated vector, tagged with the tilt's time
     */
    static AstroVector nutation(AstroVector pos, EarthTilt tilt, Rotation direction) {
        double oblm = Math.toRadians(tilt.mobl());
        double oblt = Math.toRadians(tilt.tobl());
        double psi = tilt.dpsi() * ASEC2RAD;
        double cobm = Math.cos(oblm);
        double sobm = Math.sin(oblm);
        double cobt = Math.cos(oblt);
        double sobt = Math.sin(oblt);
        double cpsi = Math.cos(psi);
        double spsi = Math.sin(psi);

        double xx = cpsi;
        double yx = -spsi * cobm;
        double zx = -spsi * sobm;
        double xy = spsi * cobt;
        double yy = cpsi * cobm * cobt + sobm * sobt;
        double zy = cpsi * sobm * cobt - cobm * sobt;
        double xz = spsi * sobt;
        double yz = cpsi * cobm * sobt - sobm * cobt;
        double zz = cpsi * sobm * sobt + cobm * cobt;

        if (direction == Rotation.INTO_DATE) {
            return new AstroVector(
                    xx * pos.x + yx * pos.y + zx * pos.z,
                    xy * pos.x + yy * pos.y + zy * pos.z,
                    xz * pos.x + yz * pos.y + zz * pos.z,
                    pos.t);
        }
        return new AstroVector(
                xx * pos.x + xy * pos.y + xz * pos.z,
                yx * pos.x + yy * pos.y + yz * pos.z,
                zx * pos.x + zy * pos.y + zz * pos.z,
                pos.t);
    }

    /** Earth Rotation Angle in degrees, [0, 360). */
    static double earthRotationAngle(double ut) {
        double thet1 = 0.7790572732640 + 0.00273781191135448 * ut;
        double thet3 = ut % 1.0;
        double theta = 360.0 * ((thet1 + thet3) % 1.0);
        if (theta < 0.0) {
            theta += 360.0;
        }
        return theta;
    }

    /**
     * Greenwich apparent sidereal time in hours, [0, 24).
     */
    static double siderealTime(AstroTime time, EarthTilt tilt) {
        double t = time.tt / DAYS_PER_CENTURY;
        double eqeq = 15.0 * tilt.ee();
        double theta = earthRotationAngle(time.ut);
        double st = (eqeq + 0.014506
                + (((((-0.0000000368 * t
                        - 0.000029956) * t
                        - 0.00000044) * t
                        + 1.3915817) * t
                        + 4612.156534) * t));

        double gst = ((st / 3600.0 + theta) % 360.0) / 15.0;
        if (gst < 0.0) {
            gst += 24.0;
        }
        return gst;
    }

    static double siderealTime(AstroTime time) {
        return siderealTime(time, tilt(time));
    }

    /**
     * Position of an observer relative to the Earth's center in the true
     * equator of date, accounting for the Earth's oblateness.
     *
     * @param st Greenwich apparent sidereal time, hours
     * @return position in AU
     */
    static AstroVector observerVector(Observer observer, double st, AstroTime time) {
        double eradKm = Astronomy.EARTH_EQUATORIAL_RADIUS_KM;
        double df = 1.0 - EARTH_FLATTENING;
        double df2 = df * df;
        double phi = Math.toRadians(observer.latitude);
        double sinphi = Math.sin(phi);
        double cosphi = Math.cos(phi);
        double c = 1.0 / Math.sqrt(cosphi * cosphi + df2 * sinphi * sinphi);
        double s = df2 * c;
        double htKm = observer.height / 1000.0;
        double ach = eradKm * c + htKm;
        double ash = eradKm * s + htKm;
        double stlocl = Math.toRadians(15.0 * st + observer.longitude);
        return new AstroVector(
                ach * cosphi * Math.cos(stlocl) / Astronomy.KM_PER_AU,
                ach * cosphi * Math.sin(stlocl) / Astronomy.KM_PER_AU,
                ash * sinphi / Astronomy.KM_PER_AU,
                time);
    }

    /**
     * Geocentric position of an observer in J2000 mean equatorial coordinates.
     */
    static AstroVector observerPosition(AstroTime time, Observer observer) {
        EarthTilt tilt = tilt(time);
        double gast = siderealTime(time, tilt);
        AstroVector ofDate = observerVector(observer, gast, time);
        AstroVector mean = nutation(ofDate, tilt, Rotation.FROM_DATE);
        return precession(time.tt, mean, 0.0);
    }
}
