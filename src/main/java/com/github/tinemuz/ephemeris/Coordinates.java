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
 * Frame rotations and vector/angle conversions shared by the query code.
 */
final class Coordinates {
    /** Obliquity of the ecliptic at J2000 in radians. */
    static final double OBLIQUITY_J2000_RAD = 0.40909260059599012;

    private Coordinates() {}

    /**
     * Convert a Cartesian equatorial vector to right ascension, declination
     * and distance. A vector along the polar axis gets ra = 0 and dec = +/-90.
     *
     * @throws IllegalArgumentException if the vector has zero length
     */
    static Equatorial vectorToEquatorial(AstroVector pos) {
        double xyproj = pos.x * pos.x + pos.y * pos.y;
        double dist = Math.sqrt(xyproj + pos.z * pos.z);
        if (xyproj == 0.0) {
            if (pos.z == 0.0) {
                throw new IllegalArgumentException("Cannot convert a zero-length vector to angles");
            }
            return new Equatorial(0.0, pos.z < 0.0 ? -90.0 : +90.0, dist);
        }
        double ra = Math.toDegrees(Math.atan2(pos.y, pos.x)) / 15.0;
        if (ra < 0.0) {
            ra += 24.0;
        }
        double dec = Math.toDegrees(Math.atan2(pos.z, Math.sqrt(xyproj)));
        return new Equatorial(ra, dec, dist);
    }

    /** Rotate a vector about the z-axis by {@code angle} degrees. */
    static AstroVector spin(double angle, AstroVector pos) {
        double angr = Math.toRadians(angle);
        double cosang = Math.cos(angr);
        double sinang = Math.sin(angr);
        return new AstroVector(
                +cosang * pos.x + sinang * pos.y,
                -sinang * pos.x + cosang * pos.y,
                pos.z,
                pos.t);
    }

    /**
     * Ecliptic of date to mean equator of date, using the mean obliquity.
     */
    static AstroVector eclipticToEquatorialOfDate(double x, double y, double z, AstroTime time) {
        double obl = Math.toRadians(EarthOrientation.meanObliquity(time.tt));
        double cosObl = Math.cos(obl);
        double sinObl = Math.sin(obl);
        return new AstroVector(x, y * cosObl - z * sinObl, y * sinObl + z * cosObl, time);
    }

    /**
     * Rotate an equatorial vector about the x-axis onto the ecliptic plane
     * tilted by {@code obliquityRad}, and express it in spherical form.
     */
    static Ecliptic rotateEquatorialToEcliptic(AstroVector pos, double obliquityRad) {
        double cosOb = Math.cos(obliquityRad);
        double sinOb = Math.sin(obliquityRad);
        double ex = +pos.x;
        double ey = +pos.y * cosOb + pos.z * sinOb;
        double ez = -pos.y * sinOb + pos.z * cosOb;

        double xyproj = Math.sqrt(ex * ex + ey * ey);
        double elon = 0.0;
        if (xyproj > 0.0) {
            elon = Math.toDegrees(Math.atan2(ey, ex));
            if (elon < 0.0) {
                elon += 360.0;
            }
        }
        double elat = Math.toDegrees(Math.atan2(ez, xyproj));
        return new Ecliptic(ex, ey, ez, elat, elon);
    }

    /** Inverse of {@link #rotateEquatorialToEcliptic}. */
    static AstroVector rotateEclipticToEquatorial(Ecliptic ecl, double obliquityRad, AstroTime time) {
        double cosOb = Math.cos(obliquityRad);
        double sinOb = Math.sin(obliquityRad);
        return new AstroVector(
                ecl.ex,
                ecl.ey * cosOb - ecl.ez * sinOb,
                ecl.ey * sinOb + ecl.ez * cosOb,
                time);
    }

    /**
     * Angle in degrees between two vectors, [0, 180].
     *
     * @throws IllegalArgumentException if either vector is (nearly) zero
     */
    static double angleBetween(AstroVector a, AstroVector b) {
        double r = a.length() * b.length();
        if (r < 1.0e-8) {
            throw new IllegalArgumentException("Cannot find angle between vectors because they are too short.");
        }
        double dot = (a.x * b.x + a.y * b.y + a.z * b.z) / r;
        if (dot <= -1.0) {
            return 180.0;
        }
        if (dot >= +1.0) {
            return 0.0;
        }
        return Math.toDegrees(Math.acos(dot));
    }

    /** Wrap an angle in degrees into (-180, +180]. */
    static double longitudeOffset(double diff) {
        double offset = diff;
        while (offset <= -180.0) {
            offset += 360.0;
        }
        while (offset > 180.0) {
            offset -= 360.0;
        }
        return offset;
    }

    /** Wrap an angle in degrees into [0, 360). */
    static double normalizeLongitude(double lon) {
        while (lon < 0.0) {
            lon += 360.0;
        }
        while (lon >= 360.0) {
            lon -= 360.0;
        }
        return lon;
    }

    /**
     * Horizontal coordinates of a point with the given equator-of-date
     * right ascension and declination, as seen by an observer.
     *
     * <p>Refraction follows Saemundsson's formula with the apparent altitude
     * clamped at -1 degree. In {@link Refraction#NORMAL} mode the correction
     * shrinks linearly from full strength at zenith distance 91 degrees to
     * zero at the nadir, so the altitude never drops below -90.</p>
     *
     * @throws IllegalArgumentException if {@code refraction} is null
     */
    static Topocentric horizon(AstroTime time, Observer observer, double ra, double dec, Refraction refraction) {
        double sinlat = Math.sin(Math.toRadians(observer.latitude));
        double coslat = Math.cos(Math.toRadians(observer.latitude));
        double sinlon = Math.sin(Math.toRadians(observer.longitude));
        double coslon = Math.cos(Math.toRadians(observer.longitude));
        double sindc = Math.sin(Math.toRadians(dec));
        double cosdc = Math.cos(Math.toRadians(dec));
        double sinra = Math.sin(Math.toRadians(ra * 15.0));
        double cosra = Math.cos(Math.toRadians(ra * 15.0));

        // STEP 1: Zenith, north and west unit vectors in the Earth-fixed frame,
        // then rotated by sidereal time into the equator of date
        AstroVector uze = new AstroVector(coslat * coslon, coslat * sinlon, sinlat, time);
        AstroVector une = new AstroVector(-sinlat * coslon, -sinlat * sinlon, coslat, time);
        AstroVector uwe = new AstroVector(sinlon, -coslon, 0.0, time);

        double spinAngle = -15.0 * EarthOrientation.siderealTime(time);
        AstroVector uz = spin(spinAngle, uze);
        AstroVector un = spin(spinAngle, une);
        AstroVector uw = spin(spinAngle, uwe);

        // STEP 2: Project the direction of the target onto those vectors
        double px = cosdc * cosra;
        double py = cosdc * sinra;
        double pz = sindc;
        double projZ = px * uz.x + py * uz.y + pz * uz.z;
        double projN = px * un.x + py * un.y + pz * un.z;
        double projW = px * uw.x + py * uw.y + pz * uw.z;

        double proj = Math.sqrt(projN * projN + projW * projW);
        double az = 0.0;
        if (proj > 0.0) {
            az = -Math.toDegrees(Math.atan2(projW, projN));
            if (az < 0.0) {
                az += 360.0;
            } else if (az >= 360.0) {
                az -= 360.0;
            }
        }
        double zd = Math.toDegrees(Math.atan2(proj, projZ));
        double horRa = ra;
        double horDec = dec;

        // STEP 3: Optional refraction, which also lifts the apparent ra/dec
        if (refraction == Refraction.NORMAL || refraction == Refraction.JPL_HOR) {
            double zd0 = zd;
            double hd = 90.0 - zd;
            if (hd < -1.0) {
                hd = -1.0;  // formula diverges near hd = -5.11
            }
            double refr = (1.02 / Math.tan(Math.toRadians(hd + 10.3 / (hd + 5.11)))) / 60.0;
            if (refraction == Refraction.NORMAL && zd > 91.0) {
                refr *= (180.0 - zd) / 89.0;
            }
            zd -= refr;

            if (refr > 0.0 && zd > 3.0e-4) {
                double sinzd = Math.sin(Math.toRadians(zd));
                double coszd = Math.cos(Math.toRadians(zd));
                double sinzd0 = Math.sin(Math.toRadians(zd0));
                double coszd0 = Math.cos(Math.toRadians(zd0));

                double prx = ((px - coszd0 * uz.x) / sinzd0) * sinzd + uz.x * coszd;
                double pry = ((py - coszd0 * uz.y) / sinzd0) * sinzd + uz.y * coszd;
                double prz = ((pz - coszd0 * uz.z) / sinzd0) * sinzd + uz.z * coszd;

                proj = Math.sqrt(prx * prx + pry * pry);
                if (proj > 0.0) {
                    horRa = Math.toDegrees(Math.atan2(pry, prx)) / 15.0;
                    if (horRa < 0.0) {
                        horRa += 24.0;
                    } else if (horRa >= 24.0) {
                        horRa -= 24.0;
                    }
                } else {
                    horRa = 0.0;
                }
                horDec = Math.toDegrees(Math.atan2(prz, proj));
            }
        } else if (refraction != Refraction.NONE) {
            throw new IllegalArgumentException("Unsupported refraction option " + refraction);
        }

        return new Topocentric(az, 90.0 - zd, horRa, horDec);
    }
}
