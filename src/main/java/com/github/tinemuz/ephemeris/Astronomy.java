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
 * Positions, rise and set times, phases and brightness of the Sun, Moon and
 * planets.
 *
 * <p>This is the public entry point of the library. Planet positions come
 * from truncated VSOP87 series, Pluto from a Chebyshev fit covering the
 * years {@value #MIN_YEAR} to {@value #MAX_YEAR}, and the Moon from an
 * analytic lunar theory. Events (equinoxes, moon phases, rises and sets,
 * elongations, apsides) are found by wrapping a scalar function of time in
 * a {@link SearchContext} and locating its ascending zero crossing with
 * {@link #search}.</p>
 *
 * <p>All methods are static, pure and thread-safe. An event query that
 * legitimately finds nothing in its window returns {@code null}; invalid
 * arguments raise {@link IllegalArgumentException} (or one of its
 * subclasses) and solver failures raise {@link IllegalStateException}.</p>
 */
public final class Astronomy {
    private static final Logger log = LoggerFactory.getLogger(Astronomy.class);

    /** Kilometers per astronomical unit. */
    public static final double KM_PER_AU = 1.4959787069098932e+8;
    /** Equatorial radius of the Earth in kilometers. */
    public static final double EARTH_EQUATORIAL_RADIUS_KM = 6378.1366;
    /** Speed of light in AU per day. */
    public static final double C_AUDAY = 173.1446326846693;
    /** Average time between two new moons, in days. */
    public static final double MEAN_SYNODIC_MONTH = 29.530588;
    /** Earliest year covered by all models. */
    public static final int MIN_YEAR = 1700;
    /** Latest year covered by all models. */
    public static final int MAX_YEAR = 2200;

    static final double SUN_RADIUS_AU = 4.6505e-3;
    static final double MOON_RADIUS_AU = 1.15717e-5;
    // Refraction of a body at the horizon, degrees
    static final double REFRACTION_NEAR_HORIZON = 34.0 / 60.0;
    static final double SOLAR_DAYS_PER_SIDEREAL_DAY = 0.9972695717592592;
    private static final double EARTH_ORBITAL_PERIOD = 365.256;
    private static final int LIGHT_TIME_ITERATIONS = 10;
    private static final int HOUR_ANGLE_ITERATIONS = 20;
    private static final int RELATIVE_LONGITUDE_ITERATIONS = 100;

    private Astronomy() {}

    // ---------------------------------------------------------------------
    // Positions
    // ---------------------------------------------------------------------

    /**
     * Position of a body relative to the center of the Sun, in J2000 mean
     * equatorial coordinates. The Moon's position is its geocentric position
     * added to the Earth's.
     *
     * @throws TimeOutOfRangeException for Pluto outside the fitted span
     */
    public static AstroVector helioVector(Body body, AstroTime time) {
        if (body == Body.SUN) {
            return new AstroVector(0.0, 0.0, 0.0, time);
        }
        if (body == Body.PLUTO) {
            return PlutoModel.helio(time);
        }
        if (body == Body.MOON) {
            AstroVector earth = VsopModel.helio(Body.EARTH, time);
            AstroVector moon = LunarModel.geoMoon(time);
            return new AstroVector(earth.x + moon.x, earth.y + moon.y, earth.z + moon.z, time);
        }
        if (VsopModel.covers(body)) {
            return VsopModel.helio(body, time);
        }
        throw new IllegalArgumentException("Invalid body: " + body);
    }

    /**
     * Position of a body relative to the center of the Earth, in J2000 mean
     * equatorial coordinates, as seen at {@code time}.
     *
     * <p>For planets and Pluto the body is evaluated at the time its light
     * left it. With {@link Aberration#CORRECTED} the Earth's position is
     * also backdated, which approximates aberration from the Earth's
     * motion.</p>
     *
     * @throws SearchNonConvergenceException if the light-time iteration
     *         does not settle
     */
    public static AstroVector geoVector(Body body, AstroTime time, Aberration aberration) {
        if (aberration != Aberration.CORRECTED && aberration != Aberration.NONE) {
            throw new IllegalArgumentException("Unsupported aberration option " + aberration);
        }

        switch (body) {
            case EARTH:
                return new AstroVector(0.0, 0.0, 0.0, time);
            case SUN: {
                AstroVector earth = VsopModel.helio(Body.EARTH, time);
                return new AstroVector(-earth.x, -earth.y, -earth.z, time);
            }
            case MOON:
                return LunarModel.geoMoon(time);
            default:
                break;
        }

        AstroVector earth = null;
        if (aberration == Aberration.NONE) {
            earth = VsopModel.helio(Body.EARTH, time);
        }

        // Iterate on the light travel time until the emission time stops moving
        AstroTime ltime = time;
        for (int iter = 0; iter < LIGHT_TIME_ITERATIONS; iter++) {
            AstroVector helio = helioVector(body, ltime);
            if (aberration == Aberration.CORRECTED) {
                earth = VsopModel.helio(Body.EARTH, ltime);
            }
            AstroVector vector = new AstroVector(helio.x - earth.x, helio.y - earth.y, helio.z - earth.z, time);
            AstroTime ltime2 = time.addDays(-vector.length() / C_AUDAY);
            if (Math.abs(ltime2.tt - ltime.tt) < 1.0e-9) {
                return vector;
            }
            ltime = ltime2;
        }
        log.error("Light travel time correction for {} at {} did not converge", body, time);
        throw new SearchNonConvergenceException("Light travel time correction did not converge");
    }

    /**
     * Geocentric position of the Moon in J2000 mean equatorial coordinates.
     */
    public static AstroVector geoMoon(AstroTime time) {
        return LunarModel.geoMoon(time);
    }

    /**
     * Topocentric equatorial coordinates of a body.
     *
     * @param epoch      J2000 mean equator, or true equator of date
     * @param aberration see {@link #geoVector}
     */
    public static Equatorial equator(
            Body body, AstroTime time, Observer observer, EquatorEpoch epoch, Aberration aberration) {
        AstroVector gcObserver = EarthOrientation.observerPosition(time, observer);
        AstroVector gc = geoVector(body, time, aberration);
        AstroVector j2000 = new AstroVector(
                gc.x - gcObserver.x, gc.y - gcObserver.y, gc.z - gcObserver.z, time);

        if (epoch == EquatorEpoch.J2000) {
            return Coordinates.vectorToEquatorial(j2000);
        }
        if (epoch == EquatorEpoch.OF_DATE) {
            AstroVector temp = EarthOrientation.precession(0.0, j2000, time.tt);
            AstroVector ofDate = EarthOrientation.nutation(
                    temp, EarthOrientation.tilt(time), EarthOrientation.Rotation.INTO_DATE);
            return Coordinates.vectorToEquatorial(ofDate);
        }
        throw new IllegalArgumentException("Unsupported equator epoch " + epoch);
    }

    /**
     * Azimuth and altitude of a point given by its right ascension and
     * declination of date.
     *
     * @param ra  right ascension of date, hours
     * @param dec declination of date, degrees
     */
    public static Topocentric horizon(
            AstroTime time, Observer observer, double ra, double dec, Refraction refraction) {
        return Coordinates.horizon(time, observer, ra, dec, refraction);
    }

    /** Greenwich apparent sidereal time in hours, [0, 24). */
    public static double siderealTime(AstroTime time) {
        return EarthOrientation.siderealTime(time);
    }

    /**
     * Apparent geocentric ecliptic coordinates of the Sun, referred to the
     * true equinox of date and corrected for light travel time.
     */
    public static Ecliptic sunPosition(AstroTime time) {
        AstroTime adjusted = time.addDays(-1.0 / C_AUDAY);
        AstroVector earth2000 = VsopModel.helio(Body.EARTH, adjusted);
        AstroVector sun2000 = new AstroVector(-earth2000.x, -earth2000.y, -earth2000.z, adjusted);

        EarthOrientation.EarthTilt tilt = EarthOrientation.tilt(adjusted);
        AstroVector temp = EarthOrientation.precession(0.0, sun2000, adjusted.tt);
        AstroVector ofDate = EarthOrientation.nutation(temp, tilt, EarthOrientation.Rotation.INTO_DATE);
        return Coordinates.rotateEquatorialToEcliptic(ofDate, Math.toRadians(tilt.tobl()));
    }

    /** J2000 mean equatorial vector to J2000 ecliptic coordinates. */
    public static Ecliptic equatorialToEcliptic(AstroVector equ) {
        return Coordinates.rotateEquatorialToEcliptic(equ, Coordinates.OBLIQUITY_J2000_RAD);
    }

    /** J2000 ecliptic coordinates back to a J2000 mean equatorial vector. */
    public static AstroVector eclipticToEquatorial(Ecliptic ecl, AstroTime time) {
        return Coordinates.rotateEclipticToEquatorial(ecl, Coordinates.OBLIQUITY_J2000_RAD, time);
    }

    // ---------------------------------------------------------------------
    // Searching
    // ---------------------------------------------------------------------

    /**
     * Find the time in {@code [t1, t2]} when {@code func} crosses zero from
     * negative to positive.
     *
     * <p>The window should be small enough to hold exactly one crossing,
     * ascending, and the function must be continuous over it. Other windows
     * are not rejected up front: with two crossings the ascending one is
     * returned, and a descending root can be returned when the
     * interpolated estimate lands on it within the tolerance. Callers that
     * cannot guarantee a single ascending crossing should check the signs
     * of {@code func} at both ends first.</p>
     *
     * @param toleranceSeconds precision of the result
     * @return a time within {@code [t1, t2]}, or null if no crossing is evident
     * @throws SearchNonConvergenceException if the solver runs out of iterations
     */
    public static AstroTime search(SearchContext func, AstroTime t1, AstroTime t2, double toleranceSeconds) {
        return Search.search(func, t1, t2, toleranceSeconds);
    }

    /**
     * Equinox and solstice times for a year.
     *
     * @throws IllegalStateException if one of the four events is not found
     */
    public static SeasonsInfo seasons(int year) {
        return new SeasonsInfo(
                findSeasonChange(0.0, year, 3, 19),
                findSeasonChange(90.0, year, 6, 19),
                findSeasonChange(180.0, year, 9, 21),
                findSeasonChange(270.0, year, 12, 20));
    }

    private static AstroTime findSeasonChange(double targetLon, int year, int month, int day) {
        AstroTime start = new AstroTime(year, month, day, 0, 0, 0.0);
        AstroTime time = searchSunLongitude(targetLon, start, 4.0);
        if (time == null) {
            log.error("Sun did not reach longitude {} within 4 days of {}", targetLon, start);
            throw new IllegalStateException(
                    "Cannot find season change for longitude " + targetLon + " in year " + year);
        }
        return time;
    }

    /**
     * Time when the Sun's apparent ecliptic longitude of date reaches
     * {@code targetLon} degrees.
     *
     * @return the time, or null if it does not happen within {@code limitDays}
     */
    public static AstroTime searchSunLongitude(double targetLon, AstroTime startTime, double limitDays) {
        SearchContext sunOffset = time -> Coordinates.longitudeOffset(sunPosition(time).elon - targetLon);
        return search(sunOffset, startTime, startTime.addDays(limitDays), 1.0);
    }

    // ---------------------------------------------------------------------
    // Moon phases
    // ---------------------------------------------------------------------

    /**
     * Difference in geocentric ecliptic longitude between a body and the
     * Sun, degrees in [0, 360).
     */
    public static double longitudeFromSun(Body body, AstroTime time) {
        if (body == Body.EARTH) {
            throw new EarthNotAllowedException();
        }
        Ecliptic se = equatorialToEcliptic(geoVector(Body.SUN, time, Aberration.CORRECTED));
        Ecliptic be = equatorialToEcliptic(geoVector(body, time, Aberration.CORRECTED));
        return Coordinates.normalizeLongitude(be.elon - se.elon);
    }

    /**
     * Lunar phase angle: 0 new moon, 90 first quarter, 180 full moon,
     * 270 third quarter.
     */
    public static double moonPhase(AstroTime time) {
        return longitudeFromSun(Body.MOON, time);
    }

    /**
     * Time when the Moon reaches a given phase angle.
     *
     * @param targetLon phase angle in degrees
     * @return the time, or null if it does not happen within {@code limitDays}
     */
    public static AstroTime searchMoonPhase(double targetLon, AstroTime startTime, double limitDays) {
        // The phase repeats every synodic month, but the Moon's eccentric orbit
        // moves events up to about 0.83 days from the mean prediction
        final double uncertainty = 0.9;
        SearchContext moonOffset = time -> Coordinates.longitudeOffset(moonPhase(time) - targetLon);

        double ya = moonOffset.eval(startTime);
        if (ya > 0.0) {
            ya -= 360.0;  // search forward in time
        }
        double estDt = -(MEAN_SYNODIC_MONTH * ya) / 360.0;
        double dt1 = estDt - uncertainty;
        if (dt1 > limitDays) {
            return null;
        }
        double dt2 = Math.min(estDt + uncertainty, limitDays);
        return search(moonOffset, startTime.addDays(dt1), startTime.addDays(dt2), 1.0);
    }

    /**
     * First lunar quarter after {@code startTime}.
     */
    public static MoonQuarterInfo searchMoonQuarter(AstroTime startTime) {
        double angle = moonPhase(startTime);
        int quarter = (1 + (int) Math.floor(angle / 90.0)) % 4;
        AstroTime qtime = searchMoonPhase(90.0 * quarter, startTime, 10.0);
        if (qtime == null) {
            log.error("Could not find moon quarter {} after {}", quarter, startTime);
            throw new IllegalStateException("Could not find moon quarter " + quarter + " after " + startTime);
        }
        return new MoonQuarterInfo(quarter, qtime);
    }

    /** Lunar quarter following a previously found one. */
    public static MoonQuarterInfo nextMoonQuarter(MoonQuarterInfo mq) {
        // Quarters are at least 6.5 days apart
        MoonQuarterInfo next = searchMoonQuarter(mq.time.addDays(6.0));
        if (next.quarter != (1 + mq.quarter) % 4) {
            log.error("Expected moon quarter {} after {} but found {}", (1 + mq.quarter) % 4, mq.time, next.quarter);
            throw new IllegalStateException("Found the wrong moon quarter after " + mq.time);
        }
        return next;
    }

    // ---------------------------------------------------------------------
    // Rise, set and hour angle
    // ---------------------------------------------------------------------

    /**
     * Next time a body rises or sets for an observer.
     *
     * <p>Rise and set refer to the top of the body's disc crossing the
     * horizon, with a fixed allowance for refraction.</p>
     *
     * @param limitDays how far past {@code startTime} to look
     * @return the event time, or null if the body does not rise (or set)
     *         within the window, e.g. during polar night
     */
    public static AstroTime searchRiseSet(
            Body body, Observer observer, Direction direction, AstroTime startTime, double limitDays) {
        if (body == Body.EARTH) {
            throw new EarthNotAllowedException();
        }

        // Lowest point before a rise and highest point after it; reversed for a set
        double haBefore;
        double haAfter;
        if (direction == Direction.RISE) {
            haBefore = 12.0;
            haAfter = 0.0;
        } else if (direction == Direction.SET) {
            haBefore = 0.0;
            haAfter = 12.0;
        } else {
            throw new IllegalArgumentException("Unsupported direction value " + direction);
        }

        PeakAltitude peakAltitude = new PeakAltitude(body, direction, observer);

        // If the body is already past the event, wait for the next culmination or bottom
        AstroTime timeBefore;
        double altBefore = peakAltitude.eval(startTime);
        if (altBefore > 0.0) {
            HourAngleInfo evtBefore = searchHourAngle(body, observer, haBefore, startTime);
            timeBefore = evtBefore.time;
            altBefore = peakAltitude.eval(timeBefore);
        } else {
            timeBefore = startTime;
        }

        HourAngleInfo evtAfter = searchHourAngle(body, observer, haAfter, timeBefore);
        double altAfter = peakAltitude.eval(evtAfter.time);

        for (;;) {
            if (altBefore <= 0.0 && altAfter > 0.0) {
                AstroTime result = search(peakAltitude, timeBefore, evtAfter.time, 1.0);
                if (result != null) {
                    return result;
                }
            }

            // Step forward one half-day window at a time
            HourAngleInfo evtBefore = searchHourAngle(body, observer, haBefore, evtAfter.time);
            evtAfter = searchHourAngle(body, observer, haAfter, evtBefore.time);
            if (evtBefore.time.ut >= startTime.ut + limitDays) {
                log.debug("No {} of {} within {} days of {}", direction, body, limitDays, startTime);
                return null;
            }

            timeBefore = evtBefore.time;
            altBefore = peakAltitude.eval(evtBefore.time);
            altAfter = peakAltitude.eval(evtAfter.time);
        }
    }

    /**
     * Next time a body reaches a given hour angle for an observer.
     *
     * <p>Hour angle 0 is the upper culmination (the body crosses the
     * meridian at its highest), 12 the lower culmination.</p>
     *
     * @param hourAngle sidereal hours, [0, 24)
     * @return the time and the body's refracted horizontal coordinates then
     * @throws SearchNonConvergenceException if the iteration does not settle
     */
    public static HourAngleInfo searchHourAngle(
            Body body, Observer observer, double hourAngle, AstroTime startTime) {
        if (body == Body.EARTH) {
            throw new EarthNotAllowedException();
        }
        if (hourAngle < 0.0 || hourAngle >= 24.0) {
            throw new IllegalArgumentException("hourAngle is out of the allowed range [0, 24): " + hourAngle);
        }

        AstroTime time = startTime;
        for (int iter = 1; iter <= HOUR_ANGLE_ITERATIONS; iter++) {
            double gast = siderealTime(time);
            Equatorial ofDate = equator(body, time, observer, EquatorEpoch.OF_DATE, Aberration.CORRECTED);

            double deltaSiderealHours = ((hourAngle + ofDate.ra - observer.longitude / 15.0) - gast) % 24.0;
            if (iter == 1) {
                // First step always moves forward in time
                if (deltaSiderealHours < 0.0) {
                    deltaSiderealHours += 24.0;
                }
            } else if (deltaSiderealHours < -12.0) {
                deltaSiderealHours += 24.0;
            } else if (deltaSiderealHours > +12.0) {
                deltaSiderealHours -= 24.0;
            }

            if (Math.abs(deltaSiderealHours) * 3600.0 < 0.1) {
                Topocentric hor = horizon(time, observer, ofDate.ra, ofDate.dec, Refraction.NORMAL);
                return new HourAngleInfo(time, hor);
            }

            time = time.addDays((deltaSiderealHours / 24.0) * SOLAR_DAYS_PER_SIDEREAL_DAY);
        }
        log.error("Hour angle {} of {} did not converge after {} iterations from {}",
                hourAngle, body, HOUR_ANGLE_ITERATIONS, startTime);
        throw new SearchNonConvergenceException("Hour angle search did not converge");
    }

    // ---------------------------------------------------------------------
    // Planetary geometry
    // ---------------------------------------------------------------------

    /**
     * Heliocentric J2000 ecliptic longitude of a body, degrees in [0, 360).
     *
     * <p>The Moon is accepted, since {@link #helioVector} supports it; its
     * value stays within about 0.16 degrees of the Earth's.</p>
     *
     * @throws IllegalArgumentException for the Sun
     */
    public static double eclipticLongitude(Body body, AstroTime time) {
        if (body == Body.SUN) {
            throw new IllegalArgumentException("Cannot calculate heliocentric longitude of the Sun.");
        }
        return equatorialToEcliptic(helioVector(body, time)).elon;
    }

    /**
     * Next time a planet reaches a given heliocentric longitude relative to
     * the Earth.
     *
     * <p>Relative longitude 0 is an opposition for a superior planet and an
     * inferior conjunction for Mercury or Venus; 180 is a conjunction or a
     * superior conjunction respectively.</p>
     *
     * @param targetRelLon degrees, [0, 360)
     * @throws SearchNonConvergenceException if the iteration does not settle
     */
    public static AstroTime searchRelativeLongitude(Body body, double targetRelLon, AstroTime startTime) {
        if (body == Body.EARTH || body == Body.SUN || body == Body.MOON) {
            throw new IllegalArgumentException(body + " is not a valid body. Must be a planet other than the Earth.");
        }

        double syn = synodicPeriod(body);
        int direction = body.isSuperiorPlanet() ? +1 : -1;

        // A negative error angle means the planet is behind the target
        double errorAngle = relativeLongitudeOffset(body, startTime, direction, targetRelLon);
        if (errorAngle > 0.0) {
            errorAngle -= 360.0;
        }

        AstroTime time = startTime;
        for (int iter = 0; iter < RELATIVE_LONGITUDE_ITERATIONS; iter++) {
            double dayAdjust = (-errorAngle / 360.0) * syn;
            time = time.addDays(dayAdjust);
            if (Math.abs(dayAdjust) * 86400.0 < 1.0) {
                return time;
            }

            double prevAngle = errorAngle;
            errorAngle = relativeLongitudeOffset(body, time, direction, targetRelLon);
            if (Math.abs(prevAngle) < 30.0 && prevAngle != errorAngle) {
                // Scale the period to the planets' current speeds (matters for eccentric orbits)
                double ratio = prevAngle / (prevAngle - errorAngle);
                if (ratio > 0.5 && ratio < 2.0) {
                    syn *= ratio;
                }
            }
        }
        log.error("Relative longitude {} of {} did not converge from {}", targetRelLon, body, startTime);
        throw new SearchNonConvergenceException("Relative longitude search did not converge");
    }

    private static double relativeLongitudeOffset(Body body, AstroTime time, int direction, double targetRelLon) {
        double plon = eclipticLongitude(body, time);
        double elon = eclipticLongitude(Body.EARTH, time);
        double diff = direction * (elon - plon);
        return Coordinates.longitudeOffset(diff - targetRelLon);
    }

    /**
     * Mean time between successive identical Sun-Earth-body alignments, in days.
     */
    static double synodicPeriod(Body body) {
        if (body == Body.EARTH) {
            throw new EarthNotAllowedException();
        }
        if (body == Body.MOON) {
            return MEAN_SYNODIC_MONTH;
        }
        double tp = body.orbitalPeriod();
        return Math.abs(EARTH_ORBITAL_PERIOD / (EARTH_ORBITAL_PERIOD / tp - 1.0));
    }

    /**
     * Angle between a body and the Sun as seen from the Earth, degrees.
     */
    public static double angleFromSun(Body body, AstroTime time) {
        if (body == Body.EARTH) {
            throw new EarthNotAllowedException();
        }
        AstroVector sv = geoVector(Body.SUN, time, Aberration.CORRECTED);
        AstroVector bv = geoVector(body, time, Aberration.CORRECTED);
        return Coordinates.angleBetween(sv, bv);
    }

    /**
     * Angular separation of a body from the Sun and whether it is a morning
     * or evening object.
     */
    public static ElongationInfo elongation(Body body, AstroTime time) {
        Visibility visibility;
        double separation = longitudeFromSun(body, time);
        if (separation > 180.0) {
            visibility = Visibility.MORNING;
            separation = 360.0 - separation;
        } else {
            visibility = Visibility.EVENING;
        }
        return new ElongationInfo(time, visibility, angleFromSun(body, time), separation);
    }

    /**
     * Next greatest elongation of Mercury or Venus.
     *
     * @throws IllegalArgumentException for any other body
     */
    public static ElongationInfo searchMaxElongation(Body body, AstroTime startTime) {
        // Relative longitudes between which the maximum can occur
        double s1;
        double s2;
        if (body == Body.MERCURY) {
            s1 = 50.0;
            s2 = 85.0;
        } else if (body == Body.VENUS) {
            s1 = 40.0;
            s2 = 50.0;
        } else {
            throw new IllegalArgumentException("Invalid body " + body + ". Must be either Mercury or Venus.");
        }

        SearchContext negElongSlope = time -> {
            final double dt = 0.1;
            double e1 = angleFromSun(body, time.addDays(-dt / 2.0));
            double e2 = angleFromSun(body, time.addDays(+dt / 2.0));
            return (e1 - e2) / dt;
        };

        AstroTime start = startTime;
        for (int iter = 0; iter < 2; iter++) {
            Bracket bracket = bracketInferiorPlanet(body, start, s1, s2, false);
            requireBracket(negElongSlope, bracket, "maximum elongation");

            AstroTime tx = search(negElongSlope, bracket.t1(), bracket.t2(), 10.0);
            if (tx == null) {
                log.error("Maximum elongation of {} not found between {} and {}", body, bracket.t1(), bracket.t2());
                throw new IllegalStateException("Maximum elongation search failed.");
            }
            if (tx.tt >= startTime.tt) {
                return elongation(body, tx);
            }
            // Event was before the start; try the next window
            start = bracket.t2().addDays(1.0);
        }
        throw new IllegalStateException("Maximum elongation search iterated too many times.");
    }

    // A window [t1, t2] of relative longitude that holds one extremum
    private record Bracket(AstroTime t1, AstroTime t2) {}

    /**
     * Find the next window of relative longitude [s1, s2] or [-s2, -s1]
     * for an inferior planet, stepping back a quarter synodic period when
     * the start lies inside a window.
     */
    private static Bracket bracketInferiorPlanet(
            Body body, AstroTime startTime, double s1, double s2, boolean upperInclusive) {
        double plon = eclipticLongitude(body, startTime);
        double elon = eclipticLongitude(Body.EARTH, startTime);
        double rlon = Coordinates.longitudeOffset(plon - elon);

        // The slope functions have cusps near 0 and 180 degrees; keep away from them
        double adjustDays;
        double rlonLo;
        double rlonHi;
        boolean beyondUpper = upperInclusive ? rlon >= +s2 : rlon > +s2;
        if (rlon >= -s1 && rlon < +s1) {
            adjustDays = 0.0;
            rlonLo = +s1;
            rlonHi = +s2;
        } else if (beyondUpper || rlon < -s2) {
            adjustDays = 0.0;
            rlonLo = -s2;
            rlonHi = -s1;
        } else if (rlon >= 0.0) {
            adjustDays = -synodicPeriod(body) / 4.0;
            rlonLo = +s1;
            rlonHi = +s2;
        } else {
            adjustDays = -synodicPeriod(body) / 4.0;
            rlonLo = -s2;
            rlonHi = -s1;
        }

        AstroTime t1 = searchRelativeLongitude(body, rlonLo, startTime.addDays(adjustDays));
        AstroTime t2 = searchRelativeLongitude(body, rlonHi, t1);
        return new Bracket(t1, t2);
    }

    private static void requireBracket(SearchContext slope, Bracket bracket, String what) {
        double m1 = slope.eval(bracket.t1());
        double m2 = slope.eval(bracket.t2());
        if (m1 >= 0.0 || m2 <= 0.0) {
            log.error("Bad {} bracket [{}, {}]: slopes {} and {}", what, bracket.t1(), bracket.t2(), m1, m2);
            throw new IllegalStateException("Failed to bracket " + what + ": m1 = " + m1 + ", m2 = " + m2);
        }
    }

    // ---------------------------------------------------------------------
    // Lunar apsides
    // ---------------------------------------------------------------------

    /**
     * Next perigee or apogee of the Moon after {@code startTime}.
     */
    public static ApsisInfo searchLunarApsis(AstroTime startTime) {
        final double increment = 5.0;
        SearchContext positiveSlope = time -> moonDistanceSlope(+1, time);
        SearchContext negativeSlope = time -> moonDistanceSlope(-1, time);

        // A change in sign of dr/dt between t1 and t2 marks an apsis
        AstroTime t1 = startTime;
        double m1 = positiveSlope.eval(t1);
        for (int iter = 0; iter * increment < 2.0 * MEAN_SYNODIC_MONTH; iter++) {
            AstroTime t2 = t1.addDays(increment);
            double m2 = positiveSlope.eval(t2);
            if (m1 * m2 <= 0.0) {
                AstroTime found;
                ApsisKind kind;
                if (m1 < 0.0 || m2 > 0.0) {
                    found = search(positiveSlope, t1, t2, 1.0);
                    kind = ApsisKind.PERICENTER;
                } else if (m1 > 0.0 || m2 < 0.0) {
                    found = search(negativeSlope, t1, t2, 1.0);
                    kind = ApsisKind.APOCENTER;
                } else {
                    throw new IllegalStateException("Both lunar distance slopes are zero");
                }

                if (found == null) {
                    log.error("Lunar apsis slope transition not found between {} and {}", t1, t2);
                    throw new IllegalStateException("Failed to find slope transition in lunar apsis search.");
                }
                return new ApsisInfo(found, kind, moonDistance(found));
            }
            t1 = t2;
            m1 = m2;
        }
        throw new IllegalStateException("No lunar apsis found within 2 synodic months of " + startTime);
    }

    /**
     * The apsis following a previously found one; perigees and apogees alternate.
     */
    public static ApsisInfo nextLunarApsis(ApsisInfo apsis) {
        final double skip = 11.0;
        ApsisInfo next = searchLunarApsis(apsis.time.addDays(skip));
        if (next.kind == apsis.kind) {
            log.error("Previous apsis was {} at {}, found {} next", apsis.kind, apsis.time, next.kind);
            throw new IllegalStateException(
                    "Previous apsis was " + apsis.kind + ", but found " + next.kind + " for next apsis.");
        }
        return next;
    }

    private static double moonDistance(AstroTime time) {
        return LunarModel.calcMoon(time.tt / 36525.0).distanceAu();
    }

    private static double moonDistanceSlope(int direction, AstroTime time) {
        final double dt = 0.001;
        double dist1 = moonDistance(time.addDays(-dt / 2.0));
        double dist2 = moonDistance(time.addDays(+dt / 2.0));
        return direction * (dist2 - dist1) / dt;
    }

    // ---------------------------------------------------------------------
    // Brightness
    // ---------------------------------------------------------------------

    /**
     * Visual magnitude and phase angle of a body seen from the Earth.
     */
    public static IllumInfo illumination(Body body, AstroTime time) {
        if (body == Body.EARTH) {
            throw new EarthNotAllowedException();
        }

        AstroVector earth = VsopModel.helio(Body.EARTH, time);
        AstroVector gc;
        AstroVector hc;
        double phaseAngle;
        if (body == Body.SUN) {
            gc = new AstroVector(-earth.x, -earth.y, -earth.z, time);
            hc = new AstroVector(0.0, 0.0, 0.0, time);
            phaseAngle = 0.0;  // the Sun is self-luminous
        } else {
            if (body == Body.MOON) {
                gc = LunarModel.geoMoon(time);
                hc = new AstroVector(earth.x + gc.x, earth.y + gc.y, earth.z + gc.z, time);
            } else {
                hc = helioVector(body, time);
                gc = new AstroVector(hc.x - earth.x, hc.y - earth.y, hc.z - earth.z, time);
            }
            phaseAngle = Coordinates.angleBetween(gc, hc);
        }

        double geoDist = gc.length();
        double helioDist = hc.length();
        double ringTilt = 0.0;
        double mag;
        switch (body) {
            case SUN:
                mag = Photometry.sunMagnitude(geoDist);
                break;
            case MOON:
                mag = Photometry.moonMagnitude(phaseAngle, helioDist, geoDist);
                break;
            case SATURN: {
                Photometry.SaturnBrightness saturn = Photometry.saturnMagnitude(phaseAngle, helioDist, geoDist, gc);
                mag = saturn.mag();
                ringTilt = saturn.ringTilt();
                break;
            }
            default:
                mag = Photometry.visualMagnitude(body, phaseAngle, helioDist, geoDist);
                break;
        }
        return new IllumInfo(time, mag, phaseAngle, helioDist, ringTilt);
    }

    /**
     * Next time Venus reaches its greatest brightness.
     *
     * @throws IllegalArgumentException for any body other than Venus
     */
    public static IllumInfo searchPeakMagnitude(Body body, AstroTime startTime) {
        // Relative longitudes between which the peak can occur
        final double s1 = 10.0;
        final double s2 = 30.0;
        if (body != Body.VENUS) {
            throw new IllegalArgumentException("Peak magnitude currently is supported for Venus only.");
        }

        // Magnitude decreases while brightening, so the peak is an ascending zero of the slope
        SearchContext magSlope = time -> {
            final double dt = 0.01;
            IllumInfo y1 = illumination(body, time.addDays(-dt / 2.0));
            IllumInfo y2 = illumination(body, time.addDays(+dt / 2.0));
            return (y2.mag - y1.mag) / dt;
        };

        AstroTime start = startTime;
        for (int iter = 0; iter < 2; iter++) {
            Bracket bracket = bracketInferiorPlanet(body, start, s1, s2, true);
            requireBracket(magSlope, bracket, "peak magnitude");

            AstroTime tx = search(magSlope, bracket.t1(), bracket.t2(), 10.0);
            if (tx == null) {
                log.error("Peak magnitude of {} not found between {} and {}", body, bracket.t1(), bracket.t2());
                throw new IllegalStateException("Failed to find magnitude slope transition.");
            }
            if (tx.tt >= startTime.tt) {
                return illumination(body, tx);
            }
            start = bracket.t2().addDays(1.0);
        }
        throw new IllegalStateException("Peak magnitude search failed.");
    }

    /**
     * Altitude of the top of a body's disc, including standard horizon
     * refraction, signed so that the sought rise or set is an ascending
     * zero crossing.
     */
    private static final class PeakAltitude implements SearchContext {
        private final Body body;
        private final int direction;
        private final Observer observer;
        private final double bodyRadiusAu;

        PeakAltitude(Body body, Direction direction, Observer observer) {
            this.body = body;
            this.direction = direction.sign;
            this.observer = observer;
            if (body == Body.SUN) {
                this.bodyRadiusAu = SUN_RADIUS_AU;
            } else if (body == Body.MOON) {
                this.bodyRadiusAu = MOON_RADIUS_AU;
            } else {
                this.bodyRadiusAu = 0.0;
            }
        }

        @Override
        public double eval(AstroTime time) {
            Equatorial ofDate = equator(body, time, observer, EquatorEpoch.OF_DATE, Aberration.CORRECTED);
            Topocentric hor = horizon(time, observer, ofDate.ra, ofDate.dec, Refraction.NONE);
            return direction * (hor.altitude + Math.toDegrees(bodyRadiusAu / ofDate.dist) + REFRACTION_NEAR_HORIZON);
        }
    }
}
