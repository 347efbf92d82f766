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

import static org.apache.commons.math3.util.FastMath.abs;
import static org.apache.commons.math3.util.FastMath.sqrt;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static trojanx.utilities.Constants.GRAVITATIONAL_CONSTANT;
import static trojanx.utilities.Constants.JUPITER_MASS;
import static trojanx.utilities.Constants.SECONDS_PER_DAY;
import static trojanx.utilities.Constants.SOLAR_MASS;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;
import trojanx.algorithms.dynamics.InvalidConfigurationException;
import trojanx.algorithms.dynamics.NumericalInstabilityException;
import trojanx.numerics.math.Vector3;
import trojanx.potential.Body;
import trojanx.potential.BodyType;
import trojanx.potential.GravitationalForce;
import trojanx.potential.PlanetarySystem;
import trojanx.utilities.TrojanTest;

/**
 * Test the gravity integrators on small systems with known behavior.
 *
 * @author Michael J. Schnieders
 */
@RunWith(Parameterized.class)
public class GravityIntegratorTest extends TrojanTest {

  private static final double JUPITER_RADIUS = 7.785e11;

  private final String info;
  private final IntegratorEnum integratorEnum;
  private final double energyTolerance;

  public GravityIntegratorTest(String info, IntegratorEnum integratorEnum, double energyTolerance) {
    this.info = info;
    this.integratorEnum = integratorEnum;
    this.energyTolerance = energyTolerance;
  }

  @Parameters
  public static Collection<Object[]> data() {
    return Arrays.asList(new Object[][] {
        {"Semi-Implicit Euler", IntegratorEnum.SEMI_IMPLICIT_EULER, 1.0e-2},
        {"Velocity Verlet", IntegratorEnum.VELOCITY_VERLET, 1.0e-5}
    });
  }

  private GravityIntegrator create(PlanetarySystem system, double dt) {
    GravityIntegrator integrator = GravityIntegrator.create(integratorEnum, system,
        new GravitationalForce(system));
    integrator.setTimeStep(dt);
    return integrator;
  }

  /** Sun and Jupiter on circular orbits about their barycenter with zero total momentum. */
  private static PlanetarySystem sunJupiter() {
    double v = sqrt(GRAVITATIONAL_CONSTANT * SOLAR_MASS / JUPITER_RADIUS);
    Body jupiter = new Body(BodyType.GIANT, false, "Jupiter", JUPITER_MASS, 0.0,
        new Vector3(JUPITER_RADIUS, 0.0, 0.0), new Vector3(0.0, v, 0.0));
    Body sun = new Body(BodyType.STAR, false, "Sun", SOLAR_MASS, 0.0, Vector3.ZERO,
        new Vector3(0.0, -v * JUPITER_MASS / SOLAR_MASS, 0.0));
    return new PlanetarySystem(List.of(sun, jupiter));
  }

  @Test
  public void testSingleBodyMovesLinearly() {
    Vector3 x0 = new Vector3(1.0, 2.0, 3.0);
    Vector3 v0 = new Vector3(0.5, -0.25, 2.0);
    Body body = new Body(BodyType.GIANT, false, "Alone", 1.0e27, 0.0, x0, v0);
    PlanetarySystem system = new PlanetarySystem(List.of(body));
    double dt = 10.0;
    GravityIntegrator integrator = create(system, dt);

    int nSteps = 100;
    for (int i = 0; i < nSteps; i++) {
      assertEquals(0, integrator.step());
    }
    Vector3 expected = x0.addScaled(v0, nSteps * dt);
    assertEquals(info, 0.0, body.getPosition().dist(expected), 1.0e-9);
    assertEquals(info, v0, body.getVelocity());
    assertEquals(nSteps, integrator.getStep());
  }

  @Test
  public void testMomentumConservation() {
    PlanetarySystem system = sunJupiter();
    GravityIntegrator integrator = create(system, SECONDS_PER_DAY);
    double scale = system.getBody(1).getMomentum().length();
    Vector3 p0 = system.getTotalMomentum();

    for (int i = 0; i < 1000; i++) {
      integrator.step();
    }
    Vector3 p = system.getTotalMomentum();
    assertEquals(info, 0.0, p.sub(p0).length() / scale, 1.0e-10);
  }

  @Test
  public void testEnergyConservation() {
    PlanetarySystem system = sunJupiter();
    GravityIntegrator integrator = create(system, SECONDS_PER_DAY);
    double e0 = system.getTotalEnergy();

    // One year of daily steps.
    for (int i = 0; i < 365; i++) {
      integrator.step();
    }
    double drift = abs((system.getTotalEnergy() - e0) / e0);
    assertTrue(info + " energy drift " + drift, drift < energyTolerance);
  }

  @Test
  public void testCoincidentPairIsSkipped() {
    Vector3 p = new Vector3(JUPITER_RADIUS, 0.0, 0.0);
    Vector3 v = new Vector3(0.0, 13058.0, 0.0);
    PlanetarySystem system = new PlanetarySystem(List.of(
        new Body(BodyType.STAR, false, "Sun", SOLAR_MASS, 0.0, Vector3.ZERO, Vector3.ZERO),
        new Body(BodyType.GIANT, false, "A", JUPITER_MASS, 0.0, p, v),
        new Body(BodyType.GIANT, false, "B", JUPITER_MASS, 0.0, p, v)));
    GravitationalForce force = new GravitationalForce(system);
    GravityIntegrator integrator = GravityIntegrator.create(integratorEnum, system, force);
    integrator.setTimeStep(SECONDS_PER_DAY);

    for (int i = 0; i < 3; i++) {
      assertEquals(info, 1, integrator.step());
    }
    for (Body body : system.getBodies()) {
      assertTrue(body.isFinite());
    }
    // One skipped evaluation per step taken, first seen at step 1.
    assertEquals(info, 3, force.getSkippedPairSteps());
    assertEquals(info, 1, force.getWarnings().size());
    assertEquals(info, 1, force.getWarnings().get(0).step());
  }

  @Test
  public void testNonPositiveTimeStep() {
    PlanetarySystem system = sunJupiter();
    GravityIntegrator integrator = create(system, SECONDS_PER_DAY);
    for (double dt : new double[] {0.0, -1.0, Double.NaN, Double.POSITIVE_INFINITY}) {
      try {
        integrator.setTimeStep(dt);
        fail(" Expected a time step of " + dt + " to be rejected.");
      } catch (InvalidConfigurationException e) {
        assertEquals(SECONDS_PER_DAY, integrator.getTimeStep(), 0.0);
      }
    }
  }

  @Test
  public void testNumericalInstability() {
    PlanetarySystem system = new PlanetarySystem(List.of(
        new Body(BodyType.STAR, false, "A", 1.0e300, 0.0, Vector3.ZERO, Vector3.ZERO),
        new Body(BodyType.STAR, false, "B", 1.0e300, 0.0, new Vector3(2.0, 0.0, 0.0),
            Vector3.ZERO)));
    GravityIntegrator integrator = create(system, 1.0e30);
    try {
      integrator.step();
      fail(" Expected a numerical instability.");
    } catch (NumericalInstabilityException e) {
      assertEquals(info, "A", e.getBodyName());
      assertEquals(info, 0, e.getLastValidStep());
    }
  }

  @Test
  public void testParse() {
    assertEquals(IntegratorEnum.SEMI_IMPLICIT_EULER, IntegratorEnum.parse("euler"));
    assertEquals(IntegratorEnum.SEMI_IMPLICIT_EULER, IntegratorEnum.parse("Semi-Implicit-Euler"));
    assertEquals(IntegratorEnum.VELOCITY_VERLET, IntegratorEnum.parse("Verlet"));
    assertEquals(IntegratorEnum.VELOCITY_VERLET, IntegratorEnum.parse("velocity_verlet"));
    try {
      IntegratorEnum.parse("Beeman");
      fail(" Expected an unknown integrator to be rejected.");
    } catch (InvalidConfigurationException e) {
      assertTrue(e.getMessage().contains("Beeman"));
    }
  }
}
