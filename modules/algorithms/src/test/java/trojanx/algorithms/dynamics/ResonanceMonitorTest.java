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
import static org.apache.commons.math3.util.FastMath.cos;
import static org.apache.commons.math3.util.FastMath.sin;
import static org.apache.commons.math3.util.FastMath.sqrt;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static trojanx.utilities.Constants.GRAVITATIONAL_CONSTANT;
import static trojanx.utilities.Constants.SECONDS_PER_YEAR;
import static trojanx.utilities.Constants.SOLAR_MASS;

import java.util.List;
import org.junit.Test;
import trojanx.numerics.math.Vector3;
import trojanx.potential.Body;
import trojanx.potential.BodyType;
import trojanx.potential.PlanetarySystem;
import trojanx.utilities.TrojanTest;

/**
 * Test the resonance state machine by placing the Trojan pair by hand.
 *
 * @author Michael J. Schnieders
 */
public class ResonanceMonitorTest extends TrojanTest {

  private static final double RADIUS = 7.785e11;
  private static final double DT = 86400.0;
  private static final double STEP_ANGLE = 1.0e-3;

  private final Body sun = new Body(BodyType.STAR, false, "Sun", SOLAR_MASS, 0.0, Vector3.ZERO,
      Vector3.ZERO);
  private final Body jupiter = new Body(BodyType.GIANT, false, "Jupiter", 0.0, 0.0,
      Vector3.ZERO, Vector3.ZERO);
  private final Body trojan = new Body(BodyType.TERRESTRIAL, true, "Achilles", 0.0, 0.0,
      Vector3.ZERO, Vector3.ZERO);

  private static void place(Body body, double angle) {
    body.setPosition(new Vector3(RADIUS * cos(angle), RADIUS * sin(angle), 0.0));
  }

  /** Place a body on a circular orbit at the given angle. */
  private static void placeOnCircularOrbit(Body body, double angle) {
    place(body, angle);
    double v = sqrt(GRAVITATIONAL_CONSTANT * SOLAR_MASS / RADIUS);
    body.setVelocity(new Vector3(-v * sin(angle), v * cos(angle), 0.0));
  }

  private ResonanceMonitor angularRateMonitor(double margin, int undeterminedSteps) {
    PlanetarySystem system = new PlanetarySystem(List.of(sun, jupiter, trojan));
    return new ResonanceMonitor(system, ResonanceCriterion.ANGULAR_RATE, margin, SECONDS_PER_YEAR,
        SECONDS_PER_YEAR, undeterminedSteps);
  }

  @Test
  public void testEqualRatesAreStable() {
    double offset = PI / 3.0;
    place(jupiter, 0.0);
    place(trojan, offset);
    ResonanceMonitor monitor = angularRateMonitor(1.0e-6, 10);

    for (int i = 1; i <= 100; i++) {
      place(jupiter, i * STEP_ANGLE);
      place(trojan, offset + i * STEP_ANGLE);
      ResonanceUpdate update = monitor.update(DT);
      assertEquals(ResonanceState.STABLE, update.state());
      assertEquals(0.0, update.deviation(), 1.0e-6);
      assertEquals(i, update.step());
      assertFalse(update.hasTransition());
    }
    assertEquals(100, monitor.getDeviationStatistics().getCount());
    assertEquals(100 * DT, monitor.getCurrentUpdate().elapsedTime(), 0.0);
  }

  @Test
  public void testBrokenNeverReverts() {
    place(jupiter, 0.0);
    place(trojan, 1.0);
    ResonanceMonitor monitor = angularRateMonitor(1.0, 10);

    // In resonance.
    place(jupiter, STEP_ANGLE);
    place(trojan, 1.0 + STEP_ANGLE);
    assertEquals(ResonanceState.STABLE, monitor.update(DT).state());

    // The Trojan moves twice as far as its companion.
    place(jupiter, 2.0 * STEP_ANGLE);
    place(trojan, 1.0 + 3.0 * STEP_ANGLE);
    ResonanceUpdate broken = monitor.update(DT);
    assertEquals(ResonanceState.BROKEN, broken.state());
    assertEquals(100.0, broken.deviation(), 1.0e-6);
    assertEquals(2, broken.transitionStep());
    assertEquals(2.0 * DT, broken.transitionTime(), 0.0);

    // Back in resonance, but the verdict stands.
    for (int i = 1; i <= 5; i++) {
      place(jupiter, (2.0 + i) * STEP_ANGLE);
      place(trojan, 1.0 + (3.0 + i) * STEP_ANGLE);
      ResonanceUpdate update = monitor.update(DT);
      assertTrue(update.deviation() <= 1.0);
      assertEquals(ResonanceState.BROKEN, update.state());
      assertEquals(2, update.transitionStep());
      assertEquals(100.0, update.transitionDeviation(), 1.0e-6);
    }
  }

  @Test
  public void testAngleUnwrapping() {
    // Both bodies cross the -PI / PI boundary during the step.
    double start = PI - 0.5 * STEP_ANGLE;
    place(jupiter, start);
    trojan.setPosition(new Vector3(2.0 * RADIUS * cos(start), 2.0 * RADIUS * sin(start), 0.0));
    ResonanceMonitor monitor = angularRateMonitor(1.0e-3, 10);

    double end = -PI + 0.5 * STEP_ANGLE;
    place(jupiter, end);
    trojan.setPosition(new Vector3(2.0 * RADIUS * cos(end), 2.0 * RADIUS * sin(end), 0.0));
    ResonanceUpdate update = monitor.update(DT);
    assertEquals(ResonanceState.STABLE, update.state());
    assertEquals(0.0, update.deviation(), 1.0e-3);
  }

  @Test
  public void testPersistentZeroCompanionRate() {
    place(jupiter, 0.0);
    place(trojan, 1.0);
    ResonanceMonitor monitor = angularRateMonitor(1.0, 3);

    for (int i = 1; i <= 2; i++) {
      place(trojan, 1.0 + i * STEP_ANGLE);
      ResonanceUpdate update = monitor.update(DT);
      assertEquals(ResonanceState.STABLE, update.state());
      assertFalse(update.isEvaluated());
    }
    place(trojan, 1.0 + 3.0 * STEP_ANGLE);
    ResonanceUpdate update = monitor.update(DT);
    assertEquals(ResonanceState.UNDETERMINED, update.state());
    assertEquals(UndeterminedReason.COMPANION_NOT_ORBITING, update.reason());
    assertEquals(3, update.transitionStep());
  }

  @Test
  public void testOrbitingCompanionResetsZeroRateCount() {
    place(jupiter, 0.0);
    place(trojan, 1.0);
    ResonanceMonitor monitor = angularRateMonitor(1.0, 3);

    double[] companionAngles = {0.0, 0.0, STEP_ANGLE, STEP_ANGLE, STEP_ANGLE};
    double trojanAngle = 1.0;
    for (double companionAngle : companionAngles) {
      place(jupiter, companionAngle);
      trojanAngle += STEP_ANGLE;
      place(trojan, trojanAngle);
      ResonanceUpdate update = monitor.update(DT);
      assertTrue(update.state() != ResonanceState.UNDETERMINED);
    }
  }

  @Test
  public void testNoTrojan() {
    Body rock = new Body(BodyType.TERRESTRIAL, false, "Rock", 0.0, 0.0, Vector3.ZERO,
        Vector3.ZERO);
    PlanetarySystem system = new PlanetarySystem(List.of(sun, jupiter, rock));
    ResonanceMonitor monitor = new ResonanceMonitor(system, ResonanceCriterion.ANGULAR_RATE, 1.0,
        SECONDS_PER_YEAR, SECONDS_PER_YEAR, 10);
    assertEquals(ResonanceState.UNDETERMINED, monitor.getState());
    assertEquals(UndeterminedReason.NO_TROJAN, monitor.getUndeterminedReason());
    assertNull(monitor.getTrojanPair());

    ResonanceUpdate update = monitor.update(DT);
    assertEquals(ResonanceState.UNDETERMINED, update.state());
    assertFalse(update.isEvaluated());
    assertEquals(1, update.step());
  }

  @Test
  public void testNoCompanion() {
    PlanetarySystem system = new PlanetarySystem(List.of(trojan, sun));
    ResonanceMonitor monitor = new ResonanceMonitor(system, ResonanceCriterion.ANGULAR_RATE, 1.0,
        SECONDS_PER_YEAR, SECONDS_PER_YEAR, 10);
    assertEquals(ResonanceState.UNDETERMINED, monitor.getState());
    assertEquals(UndeterminedReason.NO_COMPANION, monitor.getUndeterminedReason());
  }

  @Test
  public void testEqualPeriodsAreStable() {
    placeOnCircularOrbit(jupiter, 0.0);
    placeOnCircularOrbit(trojan, PI / 3.0);
    PlanetarySystem system = new PlanetarySystem(List.of(sun, jupiter, trojan));
    double interval = 10.0 * DT;
    ResonanceMonitor monitor = new ResonanceMonitor(system, ResonanceCriterion.ORBITAL_PERIOD,
        1.0e-6, interval, interval, 10);

    // Periods are only checked once per interval.
    for (int i = 0; i < 9; i++) {
      assertFalse(monitor.update(DT).isEvaluated());
    }
    ResonanceUpdate update = monitor.update(DT);
    assertTrue(update.isEvaluated());
    assertEquals(ResonanceState.STABLE, update.state());
    assertEquals(0.0, update.deviation(), 1.0e-6);

    assertEquals(1, monitor.getPeriodSamples().size());
    PeriodSample sample = monitor.getPeriodSamples().get(0);
    assertEquals(interval, sample.elapsedTime(), 0.0);
    double expected = 2.0 * PI * sqrt(RADIUS * RADIUS * RADIUS / (GRAVITATIONAL_CONSTANT * SOLAR_MASS));
    assertEquals(expected, sample.companionPeriod(), expected * 1.0e-9);
    assertEquals(expected, sample.trojanPeriod(), expected * 1.0e-9);
  }

  @Test
  public void testUnboundTrojanBreaksPeriodResonance() {
    placeOnCircularOrbit(jupiter, 0.0);
    place(trojan, PI / 3.0);
    // Well above escape speed.
    trojan.setVelocity(new Vector3(0.0, 1.0e5, 0.0));
    PlanetarySystem system = new PlanetarySystem(List.of(sun, jupiter, trojan));
    ResonanceMonitor monitor = new ResonanceMonitor(system, ResonanceCriterion.ORBITAL_PERIOD,
        5.0, DT, DT, 10);

    ResonanceUpdate update = monitor.update(DT);
    assertEquals(ResonanceState.BROKEN, update.state());
    assertTrue(Double.isInfinite(update.transitionDeviation()));
    assertTrue(Double.isInfinite(monitor.getPeriodSamples().get(0).trojanPeriod()));
    // Infinite deviations are not accumulated.
    assertEquals(0, monitor.getDeviationStatistics().getCount());
  }

  @Test
  public void testCompanionAtPrimaryHasNoPeriod() {
    // Without a preceding GIANT the Sun is the companion.
    placeOnCircularOrbit(trojan, 0.0);
    PlanetarySystem system = new PlanetarySystem(List.of(sun, trojan));
    ResonanceMonitor monitor = new ResonanceMonitor(system, ResonanceCriterion.ORBITAL_PERIOD,
        5.0, SECONDS_PER_YEAR, SECONDS_PER_YEAR, 3);

    // The count advances every step, not only at period checks.
    assertEquals(ResonanceState.STABLE, monitor.update(DT).state());
    assertEquals(ResonanceState.STABLE, monitor.update(DT).state());
    ResonanceUpdate update = monitor.update(DT);
    assertEquals(ResonanceState.UNDETERMINED, update.state());
    assertEquals(UndeterminedReason.COMPANION_NOT_ORBITING, update.reason());
    assertEquals(3, update.transitionStep());
    assertFalse(update.isEvaluated());
  }

  @Test
  public void testParseCriterion() {
    assertEquals(ResonanceCriterion.ANGULAR_RATE, ResonanceCriterion.parse("rate"));
    assertEquals(ResonanceCriterion.ANGULAR_RATE, ResonanceCriterion.parse("Angular-Rate"));
    assertEquals(ResonanceCriterion.ORBITAL_PERIOD, ResonanceCriterion.parse("PERIOD"));
  }

  @Test(expected = InvalidConfigurationException.class)
  public void testUnknownCriterion() {
    ResonanceCriterion.parse("libration");
  }
}
