// ******************************************************************************
//
// Title:       Trojan X.
// Description: Trojan X - Resonance Stability of Trojan Bodies.
// Copyright:   Copyright (c) Michael J. Schnieders 2001-2024.
//
// This file is part of Trojan X.
//
// Trojan X is free software; you can redistribute it and/or modify it
// under the terms of the GNU General Public License version 3 as published by
// the Free Software Foundation.
//
// Trojan X is distributed in the hope that it will be useful, but WITHOUT
// ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or FITNESS
// FOR A PARTICULAR PURPOSE. See the GNU General Public License for more
// details.
//
// You should have received a copy of the GNU General Public License along with
// Trojan X; if not, write to the Free Software Foundation, Inc., 59 Temple
// Place, Suite 330, Boston, MA 02111-1307 USA
//
// Linking this library statically or dynamically with other modules is making a
// combined work based on this library. Thus, the terms and conditions of the
// GNU General Public License cover the whole combination.
//
// As a special exception, the copyright holders of this library give you
// permission to link this library with independent modules to produce an
// executable, regardless of the license terms of these independent modules, and
// to copy and distribute the resulting executable under terms of your choice,
// provided that you also meet, for each linked independent module, the terms
// and conditions of the license of that module. An independent module is a
// module which is not derived from or based on this library. If you modify this
// library, you may extend this exception to your version of the library, but
// you are not obligated to do so. If you do not wish to do so, delete this
// exception statement from your version.
//
// ******************************************************************************
package trojanx.algorithms.dynamics;

import static org.apache.commons.math3.util.FastMath.PI;
import static org.apache.commons.math3.util.FastMath.abs;
import static org.apache.commons.math3.util.FastMath.atan2;
import static org.apache.commons.math3.util.FastMath.sqrt;
import static trojanx.utilities.Constants.GRAVITATIONAL_CONSTANT;

import trojanx.numerics.math.Vector3;
import trojanx.potential.Body;
import trojanx.potential.PlanetarySystem;

/**
 * Two-body orbital quantities of a body relative to the primary of its planetary system.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class OrbitalElements {

  private static final double TWO_PI = 2.0 * PI;

  // Library class: make the default constructor private to ensure it's never constructed.
  private OrbitalElements() {}

  /**
   * Planar angle of a body about the primary.
   *
   * @param body    the body.
   * @param primary position of the primary (m).
   * @return atan2(y - y_p, x - x_p) in (-PI, PI].
   */
  public static double angle(Body body, Vector3 primary) {
    Vector3 r = body.getPosition().sub(primary);
    return atan2(r.y(), r.x());
  }

  /**
   * Unwrap an angle difference into (-PI, PI].
   *
   * @param delta the raw difference of two angles.
   * @return the equivalent difference in (-PI, PI].
   */
  public static double unwrap(double delta) {
    while (delta > PI) {
      delta -= TWO_PI;
    }
    while (delta <= -PI) {
      delta += TWO_PI;
    }
    return delta;
  }

  /**
   * Osculating semi-major axis from the vis-viva equation, a = 1 / (2/r - v^2/mu).
   *
   * @param r  relative position (m).
   * @param v  relative velocity (m/s).
   * @param mu gravitational parameter G (M + m) (m^3/s^2).
   * @return the semi-major axis (m); zero or negative for an unbound orbit.
   */
  public static double semiMajorAxis(Vector3 r, Vector3 v, double mu) {
    double distance = r.length();
    if (distance == 0.0 || mu <= 0.0) {
      return 0.0;
    }
    return 1.0 / (2.0 / distance - v.length2() / mu);
  }

  /**
   * Osculating Keplerian period, P = 2 PI sqrt(a^3 / mu).
   *
   * @param r  relative position (m).
   * @param v  relative velocity (m/s).
   * @param mu gravitational parameter G (M + m) (m^3/s^2).
   * @return the period (sec), or positive infinity for an unbound orbit.
   */
  public static double period(Vector3 r, Vector3 v, double mu) {
    double a = semiMajorAxis(r, v, mu);
    if (!(a > 0.0) || Double.isInfinite(a)) {
      return Double.POSITIVE_INFINITY;
    }
    return TWO_PI * sqrt(a * a * a / mu);
  }

  /**
   * Gravitational parameter of the two-body orbit of a body about the primary. The mass of a body
   * that is itself part of the primary is counted once.
   *
   * @param body   the body.
   * @param system the planetary system.
   * @return G (M_primary + m) (m^3/s^2).
   */
  public static double gravitationalParameter(Body body, PlanetarySystem system) {
    double mass = system.getPrimaryMass();
    if (!system.isPartOfPrimary(body)) {
      mass += body.getMass();
    }
    return GRAVITATIONAL_CONSTANT * mass;
  }

  /**
   * Check whether a body can orbit the primary: it must be displaced from the primary and feel a
   * positive gravitational parameter.
   *
   * @param body   the body.
   * @param system the planetary system.
   * @return false if the body sits at the primary or the gravitational parameter is not positive.
   */
  public static boolean canOrbit(Body body, PlanetarySystem system) {
    Vector3 r = body.getPosition().sub(system.getPrimaryPosition());
    return r.length() > 0.0 && gravitationalParameter(body, system) > 0.0;
  }

  /**
   * Osculating Keplerian period of a body about the primary of its planetary system.
   *
   * @param body   the body.
   * @param system the planetary system.
   * @return the period (sec), or positive infinity for an unbound orbit.
   */
  public static double period(Body body, PlanetarySystem system) {
    Vector3 r = body.getPosition().sub(system.getPrimaryPosition());
    Vector3 v = body.getVelocity().sub(system.getPrimaryVelocity());
    return period(r, v, gravitationalParameter(body, system));
  }

  /**
   * Percent difference of two periods relative to their mean.
   *
   * @param p1 the first period.
   * @param p2 the second period.
   * @return |p1 - p2| / ((p1 + p2) / 2) * 100, or positive infinity if either period is infinite.
   */
  public static double percentDifference(double p1, double p2) {
    if (Double.isInfinite(p1) || Double.isInfinite(p2)) {
      return Double.POSITIVE_INFINITY;
    }
    double mean = 0.5 * (p1 + p2);
    if (mean == 0.0) {
      return 0.0;
    }
    return abs(p1 - p2) / mean * 100.0;
  }
}
