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
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.apache.commons.lang3.time.StopWatch;
import trojanx.algorithms.AlgorithmListener;
import trojanx.algorithms.dynamics.integrators.GravityIntegrator;
import trojanx.numerics.math.RunningStatistics;
import trojanx.potential.Body;
import trojanx.potential.GravitationalForce;
import trojanx.potential.PlanetarySystem;

/**
 * Run gravitational dynamics on a planetary system while monitoring the resonance of its Trojan
 * pair.
 *
 * <p>Each step fully completes (force evaluation, integration, resonance update) before the next
 * begins. The run ends when resonance breaks, when no verdict is possible, or when the horizon is
 * reached. Without a Trojan the system is still integrated up to the horizon.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class SimulationDriver {

  private static final Logger logger = Logger.getLogger(SimulationDriver.class.getName());

  private final PlanetarySystem system;
  private final SimulationConfig config;
  private final GravitationalForce force;
  private final GravityIntegrator integrator;
  private final ResonanceMonitor monitor;
  private final AlgorithmListener algorithmListener;
  /** Logging level for progress output. */
  private final Level basicLogging;
  /** Number of steps between progress lines. */
  private final long logFrequency;
  private final StopWatch stopWatch = new StopWatch();

  private long step = 0;
  private double elapsedTime = 0.0;
  private double initialEnergy;
  private boolean done = false;

  /**
   * Constructor for SimulationDriver.
   *
   * @param system the planetary system, which is owned by this driver for the run.
   * @param config the simulation parameters.
   * @throws InvalidConfigurationException if the system has fewer than two bodies.
   */
  public SimulationDriver(PlanetarySystem system, SimulationConfig config) {
    this(system, config, null);
  }

  /**
   * Constructor for SimulationDriver.
   *
   * @param system            the planetary system, which is owned by this driver for the run.
   * @param config            the simulation parameters.
   * @param algorithmListener notified at each reporting interval; may be null.
   * @throws InvalidConfigurationException if the system has fewer than two bodies.
   */
  public SimulationDriver(PlanetarySystem system, SimulationConfig config,
      AlgorithmListener algorithmListener) {
    if (system == null || system.getNumberOfBodies() < 2) {
      throw new InvalidConfigurationException(format(
          " At least two bodies are required for gravitational dynamics (found %d).",
          system == null ? 0 : system.getNumberOfBodies()));
    }
    this.system = system;
    this.config = config;
    this.algorithmListener = algorithmListener;
    basicLogging = config.verbosity().isQuiet() ? Level.FINE : Level.INFO;

    force = new GravitationalForce(system, config.degenerateEpsilon());
    integrator = GravityIntegrator.create(config.integrator(), system, force);
    integrator.setTimeStep(config.timeStep());
    monitor = new ResonanceMonitor(system, config);
    logFrequency = intervalToFreq(config.logInterval(), "Reporting interval");
  }

  /**
   * Converts an interval in seconds to a frequency in time steps.
   *
   * @param interval Interval between events (sec).
   * @param describe Description of the event.
   * @return Frequency of event in time steps per event.
   */
  private long intervalToFreq(double interval, String describe) {
    double dt = config.timeStep();
    if (interval >= dt) {
      return (long) (interval / dt);
    }
    logger.warning(format(" Specified %s of %.3f sec < time step %.3f sec; "
        + "interval is set to once per time step!", describe, interval, dt));
    return 1;
  }

  /**
   * Run the simulation.
   *
   * @return the report.
   * @throws NumericalInstabilityException if a body's state becomes non-finite.
   * @throws IllegalStateException         if the driver has already been run.
   */
  public SimulationReport run() {
    if (done) {
      throw new IllegalStateException(" A SimulationDriver can only be run once.");
    }
    done = true;
    preRunOps();
    ResonanceUpdate update = mainLoop();
    return postRun(update);
  }

  /** Log the run parameters and initial energies. */
  private void preRunOps() {
    stopWatch.start();
    initialEnergy = system.getTotalEnergy();

    logger.log(basicLogging, "\n Gravitational dynamics with resonance monitoring");
    logger.log(basicLogging, format("  Integrator:          %20s", integrator));
    logger.log(basicLogging, format("  Resonance criterion: %20s", config.criterion()));
    logger.log(basicLogging, format("  Number of bodies:    %20d", system.getNumberOfBodies()));
    logger.log(basicLogging, format("  Time step:           %20.3f (sec)", config.timeStep()));
    logger.log(basicLogging, format("  Margin:              %20.6f (%%)", config.margin()));
    logger.log(basicLogging, format("  Horizon:             %20.3f (years)",
        config.horizon() / SECONDS_PER_YEAR));
    logger.log(basicLogging, format("  Print interval:      %20.3f (years)",
        config.logInterval() / SECONDS_PER_YEAR));

    logger.log(basicLogging, format("\n  %10s %14s %14s %14s %12s %8s", "Time", "Kinetic",
        "Potential", "Total", "Deviation", "CPU"));
    logger.log(basicLogging, format("  %10s %14s %14s %14s %12s %8s", "years", "J", "J", "J", "%",
        "sec"));
    logger.log(basicLogging, format("  %10s %14.6e %14.6e %14.6e", "", system.getKineticEnergy(),
        system.getPotentialEnergy(), initialEnergy));
  }

  /**
   * Main loop of the run method.
   *
   * @return the last resonance update.
   */
  private ResonanceUpdate mainLoop() {
    double dt = config.timeStep();
    double horizon = config.horizon();
    ResonanceUpdate update = monitor.getCurrentUpdate();
    long lastLogTime = 0;
    while (continueRun(update) && elapsedTime < horizon) {
      integrator.step();
      update = monitor.update(dt);
      step++;
      elapsedTime = step * dt;

      if (step % logFrequency == 0) {
        lastLogTime = logProgress(update, lastLogTime);
        if (algorithmListener != null) {
          algorithmListener.algorithmUpdate(system, update);
        }
      }
    }
    return update;
  }

  /**
   * The loop continues while the pair is STABLE, or when there is no Trojan to evaluate.
   */
  private static boolean continueRun(ResonanceUpdate update) {
    if (!update.state().isTerminal()) {
      return true;
    }
    return update.reason() == UndeterminedReason.NO_TROJAN;
  }

  /**
   * Log a progress line.
   *
   * @param update      the most recent resonance update.
   * @param lastLogTime wall clock time (msec) of the previous progress line.
   * @return the current wall clock time (msec).
   */
  private long logProgress(ResonanceUpdate update, long lastLogTime) {
    long time = stopWatch.getTime();
    String deviation = update.isEvaluated() ? format("%12.6f", update.deviation())
        : format("%12s", "-");
    logger.log(basicLogging, format("  %10.3f %14.6e %14.6e %14.6e %s %8.3f",
        elapsedTime / SECONDS_PER_YEAR, system.getKineticEnergy(), system.getPotentialEnergy(),
        system.getTotalEnergy(), deviation, (time - lastLogTime) * 1.0e-3));
    return time;
  }

  /**
   * Post-run operations: log completion and assemble the report.
   *
   * @param update the last resonance update.
   * @return the report.
   */
  private SimulationReport postRun(ResonanceUpdate update) {
    stopWatch.stop();
    logger.log(basicLogging, format(" Completed %d time steps in %.3f sec.", step,
        stopWatch.getTime() * 1.0e-3));

    double finalEnergy = system.getTotalEnergy();
    double energyDrift = abs(finalEnergy - initialEnergy);
    if (initialEnergy != 0.0) {
      energyDrift /= abs(initialEnergy);
    }

    List<String> caveats = new ArrayList<>();
    for (Body body : system.getIgnoredTrojans()) {
      caveats.add(format("%s is flagged as a Trojan but only the first Trojan is monitored.",
          body.getName()));
    }
    if (force.getSkippedPairSteps() > 0) {
      caveats.add("forces between near-coincident bodies were skipped; results near those steps"
          + " are approximate.");
    }

    RunningStatistics stats = monitor.getDeviationStatistics();
    return new SimulationReport(update.state(), update.reason(), step, elapsedTime,
        update.transitionStep(), update.transitionTime(), update.transitionDeviation(),
        stats.getCount(), stats.getMean(), stats.getMax(), force.getSkippedPairSteps(),
        force.getWarnings(), caveats, monitor.getPeriodSamples(), energyDrift,
        config.integrator(), config.criterion(), config.margin());
  }

  public PlanetarySystem getPlanetarySystem() {
    return system;
  }

  public SimulationConfig getConfig() {
    return config;
  }

  public ResonanceMonitor getResonanceMonitor() {
    return monitor;
  }

  public GravityIntegrator getIntegrator() {
    return integrator;
  }
}
