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

import trojanx.potential.Body;
import trojanx.potential.GravitationalForce;
import trojanx.potential.PlanetarySystem;

/**
 * Integrate Newton's equations of motion with the semi-implicit (symplectic) Euler method: the
 * velocity is advanced with accelerations at the current positions, then the position is advanced
 * with the new velocity.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class SemiImplicitEuler extends GravityIntegrator {

  /**
   * Constructor for SemiImplicitEuler.
   *
   * @param system the planetary system.
   * @param force  the gravitational force evaluator.
   */
  public SemiImplicitEuler(PlanetarySystem system, GravitationalForce force) {
    super(system, force);
  }

  /** Forces are evaluated at the current positions, so nothing moves before them. */
  @Override
  public void preForce() {
    // No pre-force operations.
  }

  /** Find full-step velocities, then full-step positions from the new velocities. */
  @Override
  public void postForce() {
    for (int i = 0; i < nBodies; i++) {
      Body body = bodies.get(i);
      body.setVelocity(body.getVelocity().addScaled(a[i], dt));
      body.setPosition(body.getPosition().addScaled(body.getVelocity(), dt));
    }
  }

  @Override
  public String toString() {
    return "Semi-Implicit Euler";
  }
}
