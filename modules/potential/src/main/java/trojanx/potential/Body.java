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

import trojanx.numerics.math.Vector3;

/**
 * The physical state of one celestial body.
 *
 * <p>The type, Trojan flag, mass and radius are fixed at creation. An empty name is replaced once by
 * the planetary system that owns the body. Position and velocity are replaced every time step by the
 * integrator.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class Body {

  /** The kind of body. */
  private final BodyType type;
  /** True if this body was flagged as a Trojan in the input. */
  private final boolean trojan;
  /** Name of the body; may be empty until the body joins a planetary system. */
  private String name;
  /** Mass (kg). */
  private final double mass;
  /** Radius (m); informational only. */
  private final double radius;
  /** Position (m). */
  private Vector3 position;
  /** Velocity (m/s). */
  private Vector3 velocity;

  /**
   * Constructor for Body.
   *
   * @param type     the kind of body.
   * @param trojan   true if the body is flagged as a Trojan.
   * @param name     the name of the body (null is treated as empty).
   * @param mass     mass in kilograms (&gt;= 0).
   * @param radius   radius in meters (&gt;= 0).
   * @param position initial position in meters.
   * @param velocity initial velocity in meters per second.
   * @throws IllegalArgumentException if mass or radius is negative or not finite.
   */
  public Body(BodyType type, boolean trojan, String name, double mass, double radius,
              Vector3 position, Vector3 velocity) {
    if (type == null) {
      throw new IllegalArgumentException(" A body requires a type.");
    }
    if (!Double.isFinite(mass) || mass < 0.0) {
      throw new IllegalArgumentException(format(" Mass must be a finite value >= 0 (%s).", mass));
    }
    if (!Double.isFinite(radius) || radius < 0.0) {
      throw new IllegalArgumentException(format(" Radius must be a finite value >= 0 (%s).", radius));
    }
    this.type = type;
    this.trojan = trojan;
    this.name = (name == null) ? "" : name;
    this.mass = mass;
    this.radius = radius;
    this.position = (position == null) ? Vector3.ZERO : position;
    this.velocity = (velocity == null) ? Vector3.ZERO : velocity;
  }

  /**
   * Assign a placeholder name.
   *
   * @param name the placeholder name.
   */
  void setName(String name) {
    this.name = name;
  }

  public BodyType getType() {
    return type;
  }

  public boolean isTrojan() {
    return trojan;
  }

  public String getName() {
    return name;
  }

  public double getMass() {
    return mass;
  }

  public double getRadius() {
    return radius;
  }

  public Vector3 getPosition() {
    return position;
  }

  public void setPosition(Vector3 position) {
    this.position = position;
  }

  public Vector3 getVelocity() {
    return velocity;
  }

  public void setVelocity(Vector3 velocity) {
    this.velocity = velocity;
  }

  /**
   * Momentum of this body (kg m/s).
   *
   * @return mass times velocity.
   */
  public Vector3 getMomentum() {
    return velocity.scale(mass);
  }

  /**
   * Kinetic energy of this body (J).
   *
   * @return 1/2 m v^2.
   */
  public double getKineticEnergy() {
    return 0.5 * mass * velocity.length2();
  }

  /**
   * Check that the kinematic state is finite.
   *
   * @return true if position and velocity contain no NaN or infinite components.
   */
  public boolean isFinite() {
    return position.isFinite() && velocity.isFinite();
  }

  @Override
  public String toString() {
    return format("%s %s (mass %10.4e kg)", type, name, mass);
  }
}
