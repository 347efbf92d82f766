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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import org.apache.commons.io.FileUtils;
import org.junit.Test;
import trojanx.algorithms.dynamics.ResonanceCriterion;
import trojanx.algorithms.dynamics.ResonanceState;
import trojanx.algorithms.dynamics.SimulationReport;
import trojanx.algorithms.dynamics.integrators.IntegratorEnum;
import trojanx.utilities.TrojanBinding;
import trojanx.utilities.TrojanTest;

/**
 * Test the Trojan command on the Sun, Jupiter and Achilles.
 *
 * @author Michael J. Schnieders
 */
public class TrojanCommandTest extends TrojanTest {

  private static final String STRUCTURE = "trojanx/algorithms/structures/sun-jupiter-achilles.txt";

  /** Copy the test structure into a temporary directory. */
  private File copyStructure(Path directory) throws IOException {
    File file = directory.resolve("sun-jupiter-achilles.txt").toFile();
    try (InputStream inputStream = getClass().getClassLoader().getResourceAsStream(STRUCTURE)) {
      assertNotNull(inputStream);
      FileUtils.copyInputStreamToFile(inputStream, file);
    }
    return file;
  }

  @Test
  public void testHelp() {
    TrojanBinding binding = new TrojanBinding();
    binding.setVariable("args", new String[] {"-h"});
    Trojan trojan = new Trojan(binding);
    trojan.run();
    assertNull(trojan.getReport());
    assertEquals(0, trojan.getExitCode());
    assertTrue(trojan.helpString().contains("margin"));
  }

  @Test
  public void testAchillesStaysInResonance() throws IOException {
    Path directory = registerTemporaryDirectory();
    File file = copyStructure(directory);
    File periods = directory.resolve("periods.txt").toFile();

    String[] args = {"--horizon", "1", "-r", "0.5", "--periods", periods.getPath(),
        file.getPath(), "86400", "5"};
    Trojan trojan = new Trojan(args);
    trojan.run();

    assertEquals(0, trojan.getExitCode());
    SimulationReport report = trojan.getReport();
    assertNotNull(report);
    assertEquals(ResonanceState.STABLE, report.state());
    assertEquals(IntegratorEnum.SEMI_IMPLICIT_EULER, report.integrator());
    assertEquals(366, report.steps());
    assertTrue(report.maxDeviation() < 5.0);

    List<String> lines = FileUtils.readLines(periods, StandardCharsets.UTF_8);
    assertEquals(2, lines.size());
    assertTrue(lines.get(0).startsWith("#"));
    String[] columns = lines.get(1).trim().split("\\s+");
    assertEquals(3, columns.length);
    // Jupiter's period is close to 11.86 years.
    double companionYears = Double.parseDouble(columns[2]) / 365.25;
    assertEquals(11.86, companionYears, 0.1);
  }

  @Test
  public void testPeriodCriterionWithVerlet() throws IOException {
    File file = copyStructure(registerTemporaryDirectory());
    String[] args = {"-i", "Verlet", "-c", "Period", "--horizon", "2", "-q",
        file.getPath(), "86400", "5"};
    Trojan trojan = new Trojan(args);
    trojan.run();

    SimulationReport report = trojan.getReport();
    assertEquals(ResonanceState.STABLE, report.state());
    assertEquals(IntegratorEnum.VELOCITY_VERLET, report.integrator());
    assertEquals(ResonanceCriterion.ORBITAL_PERIOD, report.criterion());
    assertEquals(2, report.evaluatedSteps());
  }

  @Test
  public void testPropertyFileNextToSystemFile() throws IOException {
    Path directory = registerTemporaryDirectory();
    File file = copyStructure(directory);
    FileUtils.writeStringToFile(directory.resolve("sun-jupiter-achilles.properties").toFile(),
        "horizon-years = 0.1\n", StandardCharsets.UTF_8);

    Trojan trojan = new Trojan(new String[] {file.getPath(), "86400", "5"});
    trojan.run();
    // 0.1 years is 36.525 days.
    assertEquals(37, trojan.getReport().steps());
  }

  @Test
  public void testMissingFile() {
    Path directory = registerTemporaryDirectory();
    String missing = directory.resolve("missing.txt").toString();
    Trojan trojan = new Trojan(new String[] {missing, "86400", "5"});
    trojan.run();
    assertNull(trojan.getReport());
    assertEquals(1, trojan.getExitCode());
  }

  @Test
  public void testNonPositiveTimeStep() throws IOException {
    File file = copyStructure(registerTemporaryDirectory());
    Trojan trojan = new Trojan(new String[] {file.getPath(), "0", "5"});
    trojan.run();
    assertNull(trojan.getReport());
    assertEquals(1, trojan.getExitCode());
  }
}
