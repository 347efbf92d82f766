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
package trojanx.potential;

import static java.lang.String.format;
import static trojanx.utilities.Constants.GRAVITATIONAL_CONSTANT;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;
import trojanx.numerics.math.Vector3;

/**
 * Pairwise Newtonian gravitation between all bodies of a planetary system.
 *
 * <p>Accelerations are accumulated directly (a_i = G m_j r_ij / d^3), which equals net force over
 * mass for massive bodies and remains defined for zero-mass tracers. Pairs closer than the
 * degeneracy threshold are skipped and recorded.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class GravitationalForce {

  private static final Logger logger = Logger.getLogger(GravitationalForce.class.getName());

  /** Default separation (m) below which a pair is considered coincident. */
  public static final double DEFAULT_DEGENERATE_EPSILON = 1.0;

  private final PlanetarySystem system;
  private final double degenerateEpsilon;
  private final List<DegenerateGeometryWarning> warnings = new ArrayList<>();
  private final Set<Long> warnedPairs = new HashSet<>();
  private long skippedPairSteps = 0;

  /**
   * Constructor for GravitationalForce.
   *
   * @param system            the planetary system.
   * @param degenerateEpsilon separation (m) below which a pair force is skipped.
   */
  public GravitationalForce(PlanetarySystem system, double degenerateEpsilon) {
    if (!Double.isFinite(degenerateEpsilon) || degenerateEpsilon <= 0.0) {
      throw new IllegalArgumentException(
          format(" The degeneracy threshold must be a positive finite value (%s).", degenerateEpsilon));
    }
    this.system = system;
    this.degenerateEpsilon = degenerateEpsilon;
  }

  /**
   * Constructor for GravitationalForce using the default degeneracy threshold.
   *
   * @param system the planetary system.
   */
  public GravitationalForce(PlanetarySystem system) {
    this(system, DEFAULT_DEGENERATE_EPSILON);
  }

  /**
   * Compute the acceleration of every body from the current positions.
   *
   * @param step          the current step index (used to label degeneracy warnings).
   * @param accelerations array of length n that receives the accelerations (m/s^2).
   * @return the number of pairs skipped because of degenerate geometry.
   */
  public int computeAccelerations(long step, Vector3[] accelerations) {
    return evaluate(step, accelerations, true);
  }

  /**
   * Compute the acceleration of every body before the first time step. Degenerate pairs are skipped
   * but neither counted nor logged; the first step records them.
   *
   * @param accelerations array of length n that receives the accelerations (m/s^2).
   * @return the number of pairs skipped because of degenerate geometry.
   */
  public int computeInitialAccelerations(Vector3[] accelerations) {
    return evaluate(0, accelerations, false);
  }

  private int evaluate(long step, Vector3[] accelerations, boolean record) {
    List<Body> bodies = system.getBodies();
    int n = bodies.size();
    double[][] a = new double[n][3];
    int skipped = 0;
    for (int i = 0; i < n - 1; i++) {
      Body bi = bodies.get(i);
      Vector3 xi = bi.getPosition();
      for (int j = i + 1; j < n; j++) {
        Body bj = bodies.get(j);
        Vector3 rij = bj.getPosition().sub(xi);
        double d = rij.length();
        if (d < degenerateEpsilon) {
          skipped++;
          if (record) {
            recordWarning(step, i, j, d);
          }
          continue;
        }
        double d3 = d * d * d;
        double gi = GRAVITATIONAL_CONSTANT * bj.getMass() / d3;
        double gj = GRAVITATIONAL_CONSTANT * bi.getMass() / d3;
        a[i][0] += gi * rij.x();
        a[i][1] += gi * rij.y();
        a[i][2] += gi * rij.z();
        a[j][0] -= gj * rij.x();
        a[j][1] -= gj * rij.y();
        a[j][2] -= gj * rij.z();
      }
    }
    for (int i = 0; i < n; i++) {
      accelerations[i] = Vector3.of(a[i]);
    }
    return skipped;
  }

  /**
   * Record a degenerate pair. Only the first occurrence of each pair is kept and logged.
   */
  private void recordWarning(long step, int i, int j, double d) {
    skippedPairSteps++;
    long key = ((long) i << 32) | j;
    if (warnedPairs.add(key)) {
      DegenerateGeometryWarning warning = new DegenerateGeometryWarning(step, i, j, d);
      warnings.add(warning);
      logger.warning(warning.describe(system));
    }
  }

  /**
   * The first occurrence of each degenerate pair encountered so far.
   *
   * @return an unmodifiable view of the warnings.
   */
  public List<DegenerateGeometryWarning> getWarnings() {
    return Collections.unmodifiableList(warnings);
  }

  /**
   * The number of pair force evaluations skipped so far, counting a pair once per step.
   *
   * @return the number of skipped pair evaluations.
   */
  public long getSkippedPairSteps() {
    return skippedPairSteps;
  }

  public double getDegenerateEpsilon() {
    return degenerateEpsilon;
  }

  public PlanetarySystem getPlanetarySystem() {
    return system;
  }
}
