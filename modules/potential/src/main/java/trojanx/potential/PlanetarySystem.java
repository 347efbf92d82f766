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
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;
import trojanx.numerics.math.Vector3;

/**
 * An ordered collection of celestial bodies and the Trojan pair whose resonance is monitored.
 *
 * <p>The list of bodies never changes after construction; only positions and velocities evolve.
 *
 * <p>The Trojan is the first body flagged as a Trojan. Its companion is the nearest preceding GIANT,
 * or the nearest preceding STAR if no GIANT precedes it. Additional Trojan flags are ignored (those
 * bodies remain ordinary gravitational sources) and a warning is logged.
 *
 * <p>The primary, about which orbital angles are measured, is the STAR if there is exactly one, the
 * mass-weighted barycenter of all STARs if there are several, and the barycenter of the whole system
 * if there are none.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class PlanetarySystem {

  private static final Logger logger = Logger.getLogger(PlanetarySystem.class.getName());

  private final List<Body> bodies;
  private final TrojanPair trojanPair;
  private final List<Body> ignoredTrojans;
  private final boolean trojanWithoutCompanion;
  private final List<Body> stars;

  /**
   * Constructor for PlanetarySystem.
   *
   * @param bodies the bodies in input order.
   */
  public PlanetarySystem(List<Body> bodies) {
    this.bodies = List.copyOf(bodies);
    for (int i = 0; i < this.bodies.size(); i++) {
      Body body = this.bodies.get(i);
      if (body.getName().isBlank()) {
        body.setName(body.getType() + "-" + (i + 1));
      }
    }

    // Locate the Trojan pair.
    TrojanPair pair = null;
    boolean noCompanion = false;
    List<Body> ignored = new ArrayList<>();
    int n = this.bodies.size();
    for (int i = 0; i < n; i++) {
      Body body = this.bodies.get(i);
      if (!body.isTrojan()) {
        continue;
      }
      if (pair != null || noCompanion) {
        ignored.add(body);
        continue;
      }
      int companion = findCompanion(i);
      if (companion < 0) {
        noCompanion = true;
        logger.warning(format(" Trojan %s has no preceding GIANT or STAR to serve as its companion.",
            body.getName()));
      } else {
        pair = new TrojanPair(i, body, companion, this.bodies.get(companion));
      }
    }
    trojanPair = pair;
    trojanWithoutCompanion = noCompanion;
    ignoredTrojans = Collections.unmodifiableList(ignored);
    for (Body body : ignoredTrojans) {
      logger.warning(format(" Only the first Trojan is monitored; %s is treated as an ordinary body.",
          body.getName()));
    }

    List<Body> starList = new ArrayList<>();
    for (Body body : this.bodies) {
      if (body.getType() == BodyType.STAR) {
        starList.add(body);
      }
    }
    stars = Collections.unmodifiableList(starList);
  }

  /**
   * Find the nearest GIANT preceding the Trojan, falling back to the nearest preceding STAR.
   *
   * @param trojanIndex index of the Trojan.
   * @return the companion index, or -1 if there is none.
   */
  private int findCompanion(int trojanIndex) {
    int star = -1;
    for (int j = trojanIndex - 1; j >= 0; j--) {
      BodyType type = bodies.get(j).getType();
      switch (type) {
        case GIANT -> {
          return j;
        }
        case STAR -> {
          if (star < 0) {
            star = j;
          }
        }
        case TERRESTRIAL -> {
          // Terrestrial bodies are never companions.
        }
      }
    }
    return star;
  }

  /**
   * Get the bodies in input order.
   *
   * @return an unmodifiable list of bodies.
   */
  public List<Body> getBodies() {
    return bodies;
  }

  public Body getBody(int i) {
    return bodies.get(i);
  }

  public int getNumberOfBodies() {
    return bodies.size();
  }

  /**
   * Get the monitored Trojan pair.
   *
   * @return the Trojan pair, or empty if no Trojan with a companion is present.
   */
  public Optional<TrojanPair> getTrojanPair() {
    return Optional.ofNullable(trojanPair);
  }

  /**
   * True if a Trojan was flagged but no GIANT or STAR precedes it.
   *
   * @return true if the first Trojan lacks a companion.
   */
  public boolean isTrojanWithoutCompanion() {
    return trojanWithoutCompanion;
  }

  /**
   * Trojan-flagged bodies after the first, which are not monitored.
   *
   * @return an unmodifiable list of bodies.
   */
  public List<Body> getIgnoredTrojans() {
    return ignoredTrojans;
  }

  /**
   * The bodies that define the primary.
   *
   * @return the STARs, or every body if there are none.
   */
  private List<Body> primaryBodies() {
    return stars.isEmpty() ? bodies : stars;
  }

  /**
   * Check if a body contributes to the primary.
   *
   * @param body the body.
   * @return true if the body is a STAR, or any body when the system has no STAR.
   */
  public boolean isPartOfPrimary(Body body) {
    for (Body primary : primaryBodies()) {
      if (primary == body) {
        return true;
      }
    }
    return false;
  }

  /**
   * Mass of the primary (kg).
   *
   * @return the total mass of the bodies that define the primary.
   */
  public double getPrimaryMass() {
    double mass = 0.0;
    for (Body body : primaryBodies()) {
      mass += body.getMass();
    }
    return mass;
  }

  /**
   * Position of the primary (m).
   *
   * @return the mass-weighted mean position of the bodies that define the primary.
   */
  public Vector3 getPrimaryPosition() {
    List<Body> primary = primaryBodies();
    if (primary.size() == 1) {
      return primary.get(0).getPosition();
    }
    double mass = getPrimaryMass();
    Vector3 sum = Vector3.ZERO;
    if (mass > 0.0) {
      for (Body body : primary) {
        sum = sum.addScaled(body.getPosition(), body.getMass());
      }
      return sum.scale(1.0 / mass);
    }
    for (Body body : primary) {
      sum = sum.add(body.getPosition());
    }
    return sum.scale(1.0 / primary.size());
  }

  /**
   * Velocity of the primary (m/s).
   *
   * @return the mass-weighted mean velocity of the bodies that define the primary.
   */
  public Vector3 getPrimaryVelocity() {
    List<Body> primary = primaryBodies();
    if (primary.size() == 1) {
      return primary.get(0).getVelocity();
    }
    double mass = getPrimaryMass();
    Vector3 sum = Vector3.ZERO;
    if (mass > 0.0) {
      for (Body body : primary) {
        sum = sum.addScaled(body.getVelocity(), body.getMass());
      }
      return sum.scale(1.0 / mass);
    }
    for (Body body : primary) {
      sum = sum.add(body.getVelocity());
    }
    return sum.scale(1.0 / primary.size());
  }

  /**
   * Total linear momentum (kg m/s).
   *
   * @return the sum of body momenta.
   */
  public Vector3 getTotalMomentum() {
    Vector3 momentum = Vector3.ZERO;
    for (Body body : bodies) {
      momentum = momentum.add(body.getMomentum());
    }
    return momentum;
  }

  /**
   * Total kinetic energy (J).
   *
   * @return the sum of body kinetic energies.
   */
  public double getKineticEnergy() {
    double kineticEnergy = 0.0;
    for (Body body : bodies) {
      kineticEnergy += body.getKineticEnergy();
    }
    return kineticEnergy;
  }

  /**
   * Total gravitational potential energy (J). Coincident pairs are skipped.
   *
   * @return -G sum m_i m_j / r_ij over unordered pairs.
   */
  public double getPotentialEnergy() {
    double potentialEnergy = 0.0;
    int n = bodies.size();
    for (int i = 0; i < n - 1; i++) {
      Body bi = bodies.get(i);
      for (int j = i + 1; j < n; j++) {
        Body bj = bodies.get(j);
        double r = bi.getPosition().dist(bj.getPosition());
        if (r > 0.0) {
          potentialEnergy -= GRAVITATIONAL_CONSTANT * bi.getMass() * bj.getMass() / r;
        }
      }
    }
    return potentialEnergy;
  }

  /**
   * Total energy (J).
   *
   * @return kinetic plus potential energy.
   */
  public double getTotalEnergy() {
    return getKineticEnergy() + getPotentialEnergy();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(format(" Planetary system with %d bodies", bodies.size()));
    for (Body body : bodies) {
      sb.append("\n  ").append(body);
    }
    return sb.toString();
  }
}
