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

import static java.lang.String.format;
import static org.apache.commons.math3.util.FastMath.abs;
import static trojanx.utilities.Constants.SECONDS_PER_YEAR;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;
import trojanx.numerics.math.RunningStatistics;
import trojanx.numerics.math.Vector3;
import trojanx.potential.PlanetarySystem;
import trojanx.potential.TrojanPair;

/**
 * The ResonanceMonitor decides whether the Trojan pair of a planetary system stays in 1:1 resonance
 * within a percent margin.
 *
 * <p>With the {@link ResonanceCriterion#ANGULAR_RATE} criterion the angle of each body about the
 * primary is compared to its value at the previous update, giving the angular rates w = dTheta / dt.
 * The deviation is |w_trojan / w_companion - 1| * 100. A step where the companion rate is exactly
 * zero is not evaluated; after too many such steps in a row the verdict becomes UNDETERMINED.
 *
 * <p>With the {@link ResonanceCriterion#ORBITAL_PERIOD} criterion the osculating Keplerian periods
 * are compared once per check interval; the deviation is their percent difference relative to their
 * mean. A companion that sits at the primary, or feels no gravitational parameter, has no period;
 * such steps are counted like zero companion rates.
 *
 * <p>The first deviation above the margin moves the state from STABLE to BROKEN. BROKEN and
 * UNDETERMINED are terminal.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class ResonanceMonitor {

  private static final Logger logger = Logger.getLogger(ResonanceMonitor.class.getName());

  private final PlanetarySystem system;
  private final TrojanPair pair;
  private final ResonanceCriterion criterion;
  private final double margin;
  private final double checkInterval;
  private final double periodSampleInterval;
  private final int undeterminedSteps;

  private ResonanceState state = ResonanceState.STABLE;
  private UndeterminedReason reason = null;
  private long step = 0;
  private double elapsedTime = 0.0;
  private double trojanAngle;
  private double companionAngle;
  private int zeroRateSteps = 0;
  private double nextCheckTime;
  private double nextSampleTime;
  private long transitionStep = -1;
  private double transitionTime = Double.NaN;
  private double transitionDeviation = Double.NaN;
  private final RunningStatistics deviationStats = new RunningStatistics();
  private final List<PeriodSample> periodSamples = new ArrayList<>();

  /**
   * Constructor for ResonanceMonitor. The current angles of the pair are captured as the reference
   * for the first update.
   *
   * @param system               the planetary system.
   * @param criterion            the resonance criterion.
   * @param margin               the tolerance (percent).
   * @param checkInterval        simulated time between period checks (sec).
   * @param periodSampleInterval simulated time between period samples (sec).
   * @param undeterminedSteps    consecutive zero companion rates before the verdict is UNDETERMINED.
   */
  public ResonanceMonitor(PlanetarySystem system, ResonanceCriterion criterion, double margin,
      double checkInterval, double periodSampleInterval, int undeterminedSteps) {
    this.system = system;
    this.criterion = criterion;
    this.margin = margin;
    this.checkInterval = checkInterval;
    this.periodSampleInterval = periodSampleInterval;
    this.undeterminedSteps = undeterminedSteps;
    nextCheckTime = checkInterval;
    nextSampleTime = periodSampleInterval;

    pair = system.getTrojanPair().orElse(null);
    if (pair == null) {
      state = ResonanceState.UNDETERMINED;
      reason = system.isTrojanWithoutCompanion() ? UndeterminedReason.NO_COMPANION
          : UndeterminedReason.NO_TROJAN;
      logger.info(format(" Resonance will not be evaluated: %s.", reason.getDescription()));
    } else {
      Vector3 primary = system.getPrimaryPosition();
      trojanAngle = OrbitalElements.angle(pair.trojan(), primary);
      companionAngle = OrbitalElements.angle(pair.companion(), primary);
    }
  }

  /**
   * Constructor for ResonanceMonitor.
   *
   * @param system the planetary system.
   * @param config the simulation parameters.
   */
  public ResonanceMonitor(PlanetarySystem system, SimulationConfig config) {
    this(system, config.criterion(), config.margin(), config.checkInterval(),
        config.periodSampleInterval(), config.undeterminedSteps());
  }

  /**
   * Consume the current state of the planetary system after a time step.
   *
   * @param dt the simulated time (sec) since the previous update.
   * @return the resonance state after this update.
   */
  public ResonanceUpdate update(double dt) {
    step++;
    elapsedTime += dt;
    if (pair == null) {
      return current(Double.NaN);
    }

    if (elapsedTime >= nextSampleTime) {
      nextSampleTime += periodSampleInterval;
      periodSamples.add(new PeriodSample(elapsedTime,
          OrbitalElements.period(pair.trojan(), system),
          OrbitalElements.period(pair.companion(), system)));
    }

    double deviation = switch (criterion) {
      case ANGULAR_RATE -> angularRateDeviation(dt);
      case ORBITAL_PERIOD -> orbitalPeriodDeviation();
    };

    if (!Double.isNaN(deviation)) {
      if (Double.isFinite(deviation)) {
        deviationStats.addValue(deviation);
      }
      if (state == ResonanceState.STABLE && deviation > margin) {
        state = ResonanceState.BROKEN;
        transitionStep = step;
        transitionTime = elapsedTime;
        transitionDeviation = deviation;
        logger.info(format(" Resonance broke at step %d (%.3f years): deviation %.6f%% > %.6f%%.",
            step, elapsedTime / SECONDS_PER_YEAR, deviation, margin));
      }
    }
    return current(deviation);
  }

  /**
   * Angular rate deviation for this step.
   *
   * @param dt the time step (sec).
   * @return the percent deviation, or NaN if the companion rate is zero.
   */
  private double angularRateDeviation(double dt) {
    Vector3 primary = system.getPrimaryPosition();
    double newTrojanAngle = OrbitalElements.angle(pair.trojan(), primary);
    double newCompanionAngle = OrbitalElements.angle(pair.companion(), primary);
    double trojanRate = OrbitalElements.unwrap(newTrojanAngle - trojanAngle) / dt;
    double companionRate = OrbitalElements.unwrap(newCompanionAngle - companionAngle) / dt;
    trojanAngle = newTrojanAngle;
    companionAngle = newCompanionAngle;

    if (companionRate == 0.0) {
      companionNotOrbiting();
      return Double.NaN;
    }
    zeroRateSteps = 0;
    return abs(trojanRate / companionRate - 1.0) * 100.0;
  }

  /** Count a step where the companion does not orbit the primary. */
  private void companionNotOrbiting() {
    zeroRateSteps++;
    if (zeroRateSteps >= undeterminedSteps && state == ResonanceState.STABLE) {
      state = ResonanceState.UNDETERMINED;
      reason = UndeterminedReason.COMPANION_NOT_ORBITING;
      transitionStep = step;
      transitionTime = elapsedTime;
      logger.info(format(" The companion %s has not moved about the primary for %d steps.",
          pair.companion().getName(), zeroRateSteps));
    }
  }

  /**
   * Orbital period deviation, evaluated once per check interval.
   *
   * @return the percent deviation, or NaN between checks or if the companion cannot orbit.
   */
  private double orbitalPeriodDeviation() {
    boolean due = elapsedTime >= nextCheckTime;
    if (due) {
      nextCheckTime += checkInterval;
    }
    if (!OrbitalElements.canOrbit(pair.companion(), system)) {
      companionNotOrbiting();
      return Double.NaN;
    }
    zeroRateSteps = 0;
    if (!due) {
      return Double.NaN;
    }
    double trojanPeriod = OrbitalElements.period(pair.trojan(), system);
    double companionPeriod = OrbitalElements.period(pair.companion(), system);
    return OrbitalElements.percentDifference(trojanPeriod, companionPeriod);
  }

  private ResonanceUpdate current(double deviation) {
    return new ResonanceUpdate(state, reason, deviation, step, elapsedTime, transitionStep,
        transitionTime, transitionDeviation);
  }

  /**
   * The state before any update, or after the most recent one, with no deviation.
   *
   * @return the current resonance state.
   */
  public ResonanceUpdate getCurrentUpdate() {
    return current(Double.NaN);
  }

  public ResonanceState getState() {
    return state;
  }

  /**
   * Why the verdict is UNDETERMINED.
   *
   * @return the reason, or null if the state is not UNDETERMINED.
   */
  public UndeterminedReason getUndeterminedReason() {
    return reason;
  }

  public ResonanceCriterion getCriterion() {
    return criterion;
  }

  public double getMargin() {
    return margin;
  }

  /**
   * Statistics of every finite deviation evaluated so far, including those after a transition.
   *
   * @return the deviation statistics.
   */
  public RunningStatistics getDeviationStatistics() {
    return deviationStats;
  }

  /**
   * Osculating periods of the pair sampled once per sample interval.
   *
   * @return an unmodifiable view of the samples.
   */
  public List<PeriodSample> getPeriodSamples() {
    return Collections.unmodifiableList(periodSamples);
  }

  /**
   * Get the monitored Trojan pair.
   *
   * @return the pair, or null if there is none.
   */
  public TrojanPair getTrojanPair() {
    return pair;
  }
}
