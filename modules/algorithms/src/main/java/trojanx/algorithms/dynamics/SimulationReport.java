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
import static org.apache.commons.math3.util.FastMath.floor;
import static trojanx.utilities.Constants.SECONDS_PER_YEAR;

import java.util.List;
import trojanx.algorithms.dynamics.integrators.IntegratorEnum;
import trojanx.potential.DegenerateGeometryWarning;

/**
 * The outcome of a simulation run.
 *
 * @param state                   the final resonance state.
 * @param undeterminedReason      why the state is UNDETERMINED, or null.
 * @param steps                   the number of time steps taken.
 * @param elapsedTime             the simulated time (sec).
 * @param transitionStep          the step at which the state left STABLE, or -1.
 * @param transitionTime          the simulated time (sec) of the transition, or NaN.
 * @param transitionDeviation     the deviation (percent) that broke resonance, or NaN.
 * @param evaluatedSteps          the number of finite deviations evaluated.
 * @param meanDeviation           the mean deviation (percent), or NaN.
 * @param maxDeviation            the largest finite deviation (percent), or NaN.
 * @param skippedPairSteps        pair force evaluations skipped for degenerate geometry.
 * @param degeneratePairs         the first degenerate-geometry warning of each pair.
 * @param caveats                 limitations that qualify the verdict.
 * @param periodSamples           osculating periods of the pair over time.
 * @param energyDrift             relative change of the total energy over the run.
 * @param integrator              the integration scheme.
 * @param criterion               the resonance criterion.
 * @param margin                  the tolerance (percent).
 * @author Michael J. Schnieders
 * @since 1.0
 */
public record SimulationReport(ResonanceState state, UndeterminedReason undeterminedReason,
                               long steps, double elapsedTime, long transitionStep,
                               double transitionTime, double transitionDeviation,
                               long evaluatedSteps, double meanDeviation, double maxDeviation,
                               long skippedPairSteps,
                               List<DegenerateGeometryWarning> degeneratePairs,
                               List<String> caveats, List<PeriodSample> periodSamples,
                               double energyDrift, IntegratorEnum integrator,
                               ResonanceCriterion criterion, double margin) {

  /** The lists are copied into unmodifiable lists. */
  public SimulationReport {
    degeneratePairs = List.copyOf(degeneratePairs);
    caveats = List.copyOf(caveats);
    periodSamples = List.copyOf(periodSamples);
  }

  public double getElapsedYears() {
    return elapsedTime / SECONDS_PER_YEAR;
  }

  /**
   * Simulated time during which the pair was observed to be in resonance.
   *
   * @return the time (sec) until the transition if BROKEN, otherwise the elapsed time.
   */
  public double getStableTime() {
    return state == ResonanceState.BROKEN ? transitionTime : elapsedTime;
  }

  /**
   * Render the report as text.
   *
   * @return a multi-line description.
   */
  public String describe() {
    StringBuilder sb = new StringBuilder("\n Simulation Report\n");
    sb.append(format("  Integrator:           %20s\n", integrator));
    sb.append(format("  Resonance criterion:  %20s\n", criterion));
    sb.append(format("  Margin:               %20.6f %%\n", margin));
    sb.append(format("  Time steps:           %20d\n", steps));
    sb.append(format("  Simulated time:       %20.4f years\n", getElapsedYears()));
    sb.append(format("  Resonance state:      %20s\n", state));
    if (evaluatedSteps > 0) {
      sb.append(format("  Mean deviation:       %20.6f %% (%d evaluations)\n", meanDeviation,
          evaluatedSteps));
      sb.append(format("  Max deviation:        %20.6f %%\n", maxDeviation));
    }
    if (Double.isFinite(energyDrift)) {
      sb.append(format("  Relative energy drift: %19.4e\n", energyDrift));
    }
    switch (state) {
      case STABLE -> sb.append(format("\n The Trojan pair remained stable for %d years.\n",
          (long) floor(getElapsedYears())));
      case BROKEN -> {
        sb.append(format("\n Resonance broke at step %d after %.4f years (deviation %.6f %% > %.6f %%).\n",
            transitionStep, transitionTime / SECONDS_PER_YEAR, transitionDeviation, margin));
        sb.append(format(" The Trojan pair remained stable for %d years.\n",
            (long) floor(transitionTime / SECONDS_PER_YEAR)));
      }
      case UNDETERMINED -> sb.append(format("\n No resonance verdict: %s.\n",
          undeterminedReason.getDescription()));
    }
    if (skippedPairSteps > 0) {
      sb.append(format(" %d pair force evaluations were skipped for near-coincident bodies:\n",
          skippedPairSteps));
      for (DegenerateGeometryWarning warning : degeneratePairs) {
        sb.append(format("  bodies %d and %d first at step %d (%10.4e m)\n", warning.first() + 1,
            warning.second() + 1, warning.step(), warning.distance()));
      }
    }
    for (String caveat : caveats) {
      sb.append(" Caveat: ").append(caveat).append("\n");
    }
    return sb.toString();
  }
}
