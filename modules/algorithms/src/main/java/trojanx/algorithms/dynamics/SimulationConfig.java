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
import static trojanx.utilities.Constants.SECONDS_PER_YEAR;

import org.apache.commons.configuration2.CompositeConfiguration;
import org.apache.commons.configuration2.ex.ConversionException;
import trojanx.algorithms.dynamics.integrators.IntegratorEnum;
import trojanx.potential.GravitationalForce;

/**
 * Immutable parameters of one simulation run. All times are in seconds.
 *
 * @param integrator           the integration scheme.
 * @param criterion            the resonance criterion.
 * @param timeStep             the fixed time step (sec, &gt; 0).
 * @param margin               the resonance tolerance (percent, &gt;= 0).
 * @param horizon              the maximum simulated time (sec, finite and &gt; 0).
 * @param degenerateEpsilon    separation (m) below which a pair force is skipped.
 * @param logInterval          simulated time between progress lines (sec).
 * @param checkInterval        simulated time between period checks (sec).
 * @param periodSampleInterval simulated time between period samples (sec).
 * @param undeterminedSteps    consecutive non-orbiting companion steps before UNDETERMINED.
 * @param verbosity            logging verbosity.
 * @author Michael J. Schnieders
 * @since 1.0
 */
public record SimulationConfig(IntegratorEnum integrator, ResonanceCriterion criterion,
                               double timeStep, double margin, double horizon,
                               double degenerateEpsilon, double logInterval, double checkInterval,
                               double periodSampleInterval, int undeterminedSteps,
                               DynamicsVerbosity verbosity) {

  /** Default horizon of 1000 years. */
  public static final double DEFAULT_HORIZON_YEARS = 1000.0;
  /** Default progress interval of 100 years. */
  public static final double DEFAULT_LOG_INTERVAL_YEARS = 100.0;
  /** Default period check interval of one year. */
  public static final double DEFAULT_CHECK_INTERVAL_YEARS = 1.0;
  /** Default period sample interval of one year. */
  public static final double DEFAULT_PERIOD_SAMPLE_INTERVAL_YEARS = 1.0;
  /** Default number of consecutive zero companion rates tolerated. */
  public static final int DEFAULT_UNDETERMINED_STEPS = 10;

  /**
   * Validates every parameter.
   *
   * @throws InvalidConfigurationException if a parameter is out of range.
   */
  public SimulationConfig {
    if (integrator == null || criterion == null || verbosity == null) {
      throw new InvalidConfigurationException(
          " The integrator, resonance criterion and verbosity must be specified.");
    }
    if (!Double.isFinite(timeStep) || timeStep <= 0.0) {
      throw new InvalidConfigurationException(
          format(" The time step must be a positive finite value in seconds, was %s.", timeStep));
    }
    if (Double.isNaN(margin) || margin < 0.0) {
      throw new InvalidConfigurationException(
          format(" The margin must be a percentage >= 0, was %s.", margin));
    }
    requirePositive(horizon, "horizon");
    requirePositive(degenerateEpsilon, "degeneracy threshold");
    requirePositive(logInterval, "reporting interval");
    requirePositive(checkInterval, "period check interval");
    requirePositive(periodSampleInterval, "period sample interval");
    if (undeterminedSteps < 1) {
      throw new InvalidConfigurationException(
          format(" The number of undetermined steps must be at least 1, was %d.", undeterminedSteps));
    }
  }

  private static void requirePositive(double value, String describe) {
    if (!Double.isFinite(value) || value <= 0.0) {
      throw new InvalidConfigurationException(
          format(" The %s must be a positive finite value, was %s.", describe, value));
    }
  }

  /**
   * Create a Builder with default values for everything but the time step and margin.
   *
   * @param timeStep the time step (sec).
   * @param margin   the resonance tolerance (percent).
   * @return a new Builder.
   */
  public static Builder builder(double timeStep, double margin) {
    return new Builder(timeStep, margin);
  }

  /**
   * Builds a SimulationConfig from defaults, then properties, then explicit values.
   */
  public static class Builder {

    private IntegratorEnum integrator = IntegratorEnum.SEMI_IMPLICIT_EULER;
    private ResonanceCriterion criterion = ResonanceCriterion.ANGULAR_RATE;
    private double timeStep;
    private double margin;
    private double horizon = DEFAULT_HORIZON_YEARS * SECONDS_PER_YEAR;
    private double degenerateEpsilon = GravitationalForce.DEFAULT_DEGENERATE_EPSILON;
    private double logInterval = DEFAULT_LOG_INTERVAL_YEARS * SECONDS_PER_YEAR;
    private double checkInterval = DEFAULT_CHECK_INTERVAL_YEARS * SECONDS_PER_YEAR;
    private double periodSampleInterval = DEFAULT_PERIOD_SAMPLE_INTERVAL_YEARS * SECONDS_PER_YEAR;
    private int undeterminedSteps = DEFAULT_UNDETERMINED_STEPS;
    private DynamicsVerbosity verbosity = DynamicsVerbosity.VERBOSE;

    private Builder(double timeStep, double margin) {
      this.timeStep = timeStep;
      this.margin = margin;
    }

    /**
     * Apply run properties. Recognized keys are integrate, resonance-criterion, horizon-years,
     * degenerate-epsilon, log-interval-years, check-interval-years, period-sample-interval-years
     * and undetermined-steps.
     *
     * @param properties the properties.
     * @return this Builder.
     * @throws InvalidConfigurationException if a property value cannot be converted.
     */
    public Builder properties(CompositeConfiguration properties) {
      try {
        if (properties.containsKey("integrate")) {
          integrator = IntegratorEnum.parse(properties.getString("integrate"));
        }
        if (properties.containsKey("resonance-criterion")) {
          criterion = ResonanceCriterion.parse(properties.getString("resonance-criterion"));
        }
        if (properties.containsKey("horizon-years")) {
          horizon = properties.getDouble("horizon-years") * SECONDS_PER_YEAR;
        }
        if (properties.containsKey("degenerate-epsilon")) {
          degenerateEpsilon = properties.getDouble("degenerate-epsilon");
        }
        if (properties.containsKey("log-interval-years")) {
          logInterval = properties.getDouble("log-interval-years") * SECONDS_PER_YEAR;
        }
        if (properties.containsKey("check-interval-years")) {
          checkInterval = properties.getDouble("check-interval-years") * SECONDS_PER_YEAR;
        }
        if (properties.containsKey("period-sample-interval-years")) {
          periodSampleInterval =
              properties.getDouble("period-sample-interval-years") * SECONDS_PER_YEAR;
        }
        if (properties.containsKey("undetermined-steps")) {
          undeterminedSteps = properties.getInt("undetermined-steps");
        }
      } catch (ConversionException e) {
        throw new InvalidConfigurationException(" Could not convert a simulation property.", e);
      }
      return this;
    }

    public Builder integrator(IntegratorEnum integrator) {
      this.integrator = integrator;
      return this;
    }

    public Builder criterion(ResonanceCriterion criterion) {
      this.criterion = criterion;
      return this;
    }

    public Builder timeStep(double timeStep) {
      this.timeStep = timeStep;
      return this;
    }

    public Builder margin(double margin) {
      this.margin = margin;
      return this;
    }

    /**
     * Set the horizon.
     *
     * @param horizon maximum simulated time (sec).
     * @return this Builder.
     */
    public Builder horizon(double horizon) {
      this.horizon = horizon;
      return this;
    }

    /**
     * Set the horizon.
     *
     * @param years maximum simulated time (years).
     * @return this Builder.
     */
    public Builder horizonYears(double years) {
      this.horizon = years * SECONDS_PER_YEAR;
      return this;
    }

    public Builder degenerateEpsilon(double degenerateEpsilon) {
      this.degenerateEpsilon = degenerateEpsilon;
      return this;
    }

    public Builder logInterval(double logInterval) {
      this.logInterval = logInterval;
      return this;
    }

    public Builder logIntervalYears(double years) {
      this.logInterval = years * SECONDS_PER_YEAR;
      return this;
    }

    public Builder checkInterval(double checkInterval) {
      this.checkInterval = checkInterval;
      return this;
    }

    public Builder periodSampleInterval(double periodSampleInterval) {
      this.periodSampleInterval = periodSampleInterval;
      return this;
    }

    public Builder undeterminedSteps(int undeterminedSteps) {
      this.undeterminedSteps = undeterminedSteps;
      return this;
    }

    public Builder verbosity(DynamicsVerbosity verbosity) {
      this.verbosity = verbosity;
      return this;
    }

    /**
     * Create the SimulationConfig.
     *
     * @return the validated SimulationConfig.
     * @throws InvalidConfigurationException if a parameter is out of range.
     */
    public SimulationConfig build() {
      return new SimulationConfig(integrator, criterion, timeStep, margin, horizon,
          degenerateEpsilon, logInterval, checkInterval, periodSampleInterval, undeterminedSteps,
          verbosity);
    }
  }
}
