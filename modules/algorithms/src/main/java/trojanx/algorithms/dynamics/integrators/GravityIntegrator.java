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
package trojanx.algorithms.dynamics.integrators;

import static java.lang.String.format;

import java.util.List;
import trojanx.algorithms.dynamics.InvalidConfigurationException;
import trojanx.algorithms.dynamics.NumericalInstabilityException;
import trojanx.numerics.math.Vector3;
import trojanx.potential.Body;
import trojanx.potential.GravitationalForce;
import trojanx.potential.PlanetarySystem;

/**
 * The GravityIntegrator class is responsible for propagation of the bodies of a planetary system
 * through time. Implementations must define their behavior at pre-force and post-force evaluation
 * time points.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public abstract class GravityIntegrator {

  /** The bodies being integrated. */
  protected final List<Body> bodies;
  /** Number of bodies. */
  protected final int nBodies;
  /** Accelerations (m/s^2) at the current positions once forces have been evaluated. */
  protected final Vector3[] a;
  /** Time step (sec). */
  protected double dt;
  /** Half the time step (sec). */
  protected double dt_2;

  private final PlanetarySystem system;
  private final GravitationalForce force;
  private long step = 0;
  private boolean initialized = false;

  /**
   * Constructor for GravityIntegrator.
   *
   * @param system the planetary system.
   * @param force  the gravitational force evaluator.
   */
  public GravityIntegrator(PlanetarySystem system, GravitationalForce force) {
    this.system = system;
    this.force = force;
    bodies = system.getBodies();
    nBodies = bodies.size();
    a = new Vector3[nBodies];
    for (int i = 0; i < nBodies; i++) {
      a[i] = Vector3.ZERO;
    }
    dt = 1.0;
    dt_2 = dt / 2.0;
  }

  /**
   * Create an integrator.
   *
   * @param integrator the integration scheme.
   * @param system     the planetary system.
   * @param force      the gravitational force evaluator.
   * @return the integrator.
   */
  public static GravityIntegrator create(IntegratorEnum integrator, PlanetarySystem system,
      GravitationalForce force) {
    return switch (integrator) {
      case SEMI_IMPLICIT_EULER -> new SemiImplicitEuler(system, force);
      case VELOCITY_VERLET -> new VelocityVerlet(system, force);
    };
  }

  /**
   * Get the time step.
   *
   * @return the time step (sec).
   */
  public double getTimeStep() {
    return dt;
  }

  /**
   * Set the time step.
   *
   * @param dt the time step (sec).
   * @throws InvalidConfigurationException if dt is not a positive finite value.
   */
  public void setTimeStep(double dt) {
    if (!Double.isFinite(dt) || dt <= 0.0) {
      throw new InvalidConfigurationException(
          format(" The time step must be a positive finite value in seconds, was %s.", dt));
    }
    this.dt = dt;
    dt_2 = dt / 2.0;
  }

  /**
   * Number of steps completed.
   *
   * @return the step count.
   */
  public long getStep() {
    return step;
  }

  /**
   * Advance every body by one time step.
   *
   * @return the number of pairs skipped because of degenerate geometry.
   * @throws NumericalInstabilityException if a position or velocity becomes non-finite.
   */
  public int step() {
    if (!initialized) {
      initialize();
      initialized = true;
    }
    preForce();
    int skipped = computeAccelerations(step + 1);
    postForce();
    for (Body body : bodies) {
      if (!body.isFinite()) {
        throw new NumericalInstabilityException(body.getName(), step);
      }
    }
    step++;
    return skipped;
  }

  /**
   * Evaluate accelerations at the current positions into {@link #a}.
   *
   * @param stepLabel the step used to label degeneracy warnings.
   * @return the number of pairs skipped because of degenerate geometry.
   */
  protected int computeAccelerations(long stepLabel) {
    return force.computeAccelerations(stepLabel, a);
  }

  /** Evaluate accelerations at the initial positions into {@link #a} without recording warnings. */
  protected void computeInitialAccelerations() {
    force.computeInitialAccelerations(a);
  }

  /** Operations required once before the first step. */
  protected void initialize() {
    // Nothing by default.
  }

  /** Integrator pre-force evaluation operation. */
  public abstract void preForce();

  /** Integrator post-force evaluation operation, using the accelerations in {@link #a}. */
  public abstract void postForce();

  public PlanetarySystem getPlanetarySystem() {
    return system;
  }

  public GravitationalForce getGravitationalForce() {
    return force;
  }
}
