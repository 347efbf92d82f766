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
package trojanx.algorithms.commands;

import static java.lang.String.format;
import static trojanx.utilities.Constants.SECONDS_PER_DAY;
import static trojanx.utilities.Constants.SECONDS_PER_YEAR;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import org.apache.commons.configuration2.CompositeConfiguration;
import org.apache.commons.io.FileUtils;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Parameters;
import trojanx.algorithms.cli.DynamicsOptions;
import trojanx.algorithms.cli.ResonanceOptions;
import trojanx.algorithms.dynamics.InvalidConfigurationException;
import trojanx.algorithms.dynamics.NumericalInstabilityException;
import trojanx.algorithms.dynamics.PeriodSample;
import trojanx.algorithms.dynamics.SimulationConfig;
import trojanx.algorithms.dynamics.SimulationDriver;
import trojanx.algorithms.dynamics.SimulationReport;
import trojanx.potential.PlanetarySystem;
import trojanx.potential.parsers.SystemFilter;
import trojanx.potential.parsers.SystemParseException;
import trojanx.utilities.TrojanBinding;
import trojanx.utilities.TrojanCommand;
import trojanx.utilities.TrojanProperties;

/**
 * The Trojan command simulates a planetary system and reports whether its Trojan body stays in
 * 1:1 resonance with its companion.
 * <br>
 * Usage:
 * <br>
 * Trojan [options] &lt;file&gt; &lt;step&gt; &lt;margin&gt;
 */
@Command(description = " Test whether a Trojan body stays in 1:1 resonance with its companion.",
    name = "Trojan")
public class Trojan extends TrojanCommand {

  @Mixin
  private DynamicsOptions dynamicsOptions;

  @Mixin
  private ResonanceOptions resonanceOptions;

  /** The planetary system file. */
  @Parameters(index = "0", paramLabel = "file", description = "Planetary system file.")
  private String filename = null;

  /** The time step in seconds. */
  @Parameters(index = "1", paramLabel = "step", description = "Time step (sec).")
  private double timeStep;

  /** The resonance margin in percent. */
  @Parameters(index = "2", paramLabel = "margin",
      description = "Allowed deviation from 1:1 resonance (percent).")
  private double margin;

  private SimulationReport report = null;

  private int exitCode = 0;

  /** Trojan Constructor. */
  public Trojan() {
    super();
  }

  /**
   * Trojan Constructor.
   *
   * @param binding The Binding to use.
   */
  public Trojan(TrojanBinding binding) {
    super(binding);
  }

  /**
   * Trojan constructor that sets the command line arguments.
   *
   * @param args Command line arguments.
   */
  public Trojan(String[] args) {
    super(args);
  }

  /** {@inheritDoc} */
  @Override
  public Trojan run() {

    if (!init()) {
      return this;
    }

    File file = new File(filename);
    try {
      PlanetarySystem system = SystemFilter.readFile(file);

      CompositeConfiguration properties = TrojanProperties.loadProperties(file);
      SimulationConfig.Builder builder = SimulationConfig.builder(timeStep, margin)
          .properties(properties);
      dynamicsOptions.apply(builder);
      resonanceOptions.apply(builder);
      SimulationConfig config = builder.build();

      SimulationDriver driver = new SimulationDriver(system, config);
      report = driver.run();
      logger.info(report.describe());

      File periodsFile = resonanceOptions.getPeriodsFile();
      if (periodsFile != null) {
        writePeriods(periodsFile, report.periodSamples());
      }
    } catch (SystemParseException e) {
      logger.severe(format(" Could not read %s:%s", filename, e.getMessage()));
      exitCode = 1;
    } catch (InvalidConfigurationException e) {
      logger.severe(format(" Invalid configuration:%s", e.getMessage()));
      exitCode = 1;
    } catch (NumericalInstabilityException e) {
      logger.log(Level.SEVERE, " The simulation became numerically unstable.", e);
      exitCode = 1;
    } catch (IOException e) {
      logger.log(Level.SEVERE, format(" Could not write %s.", resonanceOptions.getPeriodsFile()), e);
      exitCode = 1;
    }

    return this;
  }

  /**
   * Write period samples as whitespace separated columns: years, Trojan period (days) and
   * companion period (days).
   *
   * @param file    the output file.
   * @param samples the period samples.
   * @throws IOException if the file cannot be written.
   */
  private void writePeriods(File file, List<PeriodSample> samples) throws IOException {
    List<String> lines = new ArrayList<>(samples.size() + 1);
    lines.add(format("# %10s %18s %18s", "years", "trojan (days)", "companion (days)"));
    for (PeriodSample sample : samples) {
      lines.add(format("  %10.3f %18.6f %18.6f", sample.elapsedTime() / SECONDS_PER_YEAR,
          sample.trojanPeriod() / SECONDS_PER_DAY, sample.companionPeriod() / SECONDS_PER_DAY));
    }
    FileUtils.writeLines(file, StandardCharsets.UTF_8.name(), lines);
    logger.info(format(" Wrote %d period samples to %s.", samples.size(), file.getPath()));
  }

  /**
   * The report of the last run.
   *
   * @return the report, or null if no simulation completed.
   */
  public SimulationReport getReport() {
    return report;
  }

  /**
   * Process exit code: 0 for any resonance verdict, 1 for parse, configuration or numerical errors.
   *
   * @return the exit code.
   */
  public int getExitCode() {
    return exitCode;
  }
}
