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
package trojanx.algorithms.cli;

import picocli.CommandLine.Option;
import trojanx.algorithms.dynamics.DynamicsVerbosity;
import trojanx.algorithms.dynamics.SimulationConfig;
import trojanx.algorithms.dynamics.integrators.IntegratorEnum;

/**
 * Represents command line options for scripts that run gravitational dynamics.
 *
 * <p>Options left unset keep the value from the run properties or the built-in default.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class DynamicsOptions {

  /**
   * -i or --integrator sets the desired integrator: current choices are Euler (semi-implicit) or
   * Verlet.
   */
  @Option(
      names = {"-i", "--integrator"},
      paramLabel = "Euler",
      description = "Integrator: [Euler / Verlet].")
  private String integratorString;

  /** --horizon sets the maximum simulated time in years (1000 years default). */
  @Option(
      names = {"--horizon"},
      paramLabel = "1000",
      description = "Maximum simulated time (years).")
  private Double horizon;

  /** -r or --report sets the progress reporting interval in years (100 years default). */
  @Option(
      names = {"-r", "--report"},
      paramLabel = "100",
      description = "Interval in years to report energies and resonance deviation (years).")
  private Double report;

  /** -q or --quiet logs progress at the FINE level. */
  @Option(
      names = {"-q", "--quiet"},
      defaultValue = "false",
      description = "Reduce logging of simulation progress.")
  private boolean quiet;

  /**
   * Apply the options that were set on the command line.
   *
   * @param builder the SimulationConfig builder.
   */
  public void apply(SimulationConfig.Builder builder) {
    if (integratorString != null) {
      builder.integrator(IntegratorEnum.parse(integratorString));
    }
    if (horizon != null) {
      builder.horizonYears(horizon);
    }
    if (report != null) {
      builder.logIntervalYears(report);
    }
    if (quiet) {
      builder.verbosity(DynamicsVerbosity.QUIET);
    }
  }

  public boolean isQuiet() {
    return quiet;
  }
}
