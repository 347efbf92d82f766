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
package trojanx.potential.parsers;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.apache.commons.io.FileUtils;
import org.junit.Test;
import trojanx.numerics.math.Vector3;
import trojanx.potential.Body;
import trojanx.potential.BodyType;
import trojanx.potential.PlanetarySystem;
import trojanx.utilities.TrojanTest;

/**
 * Test parsing of planetary system files.
 *
 * @author Michael J. Schnieders
 */
public class SystemFilterTest extends TrojanTest {

  @Test
  public void testDefaults() throws SystemParseException {
    Body body = SystemFilter.parseLine("terrestrial", 1);
    assertEquals(BodyType.TERRESTRIAL, body.getType());
    assertFalse(body.isTrojan());
    assertEquals("", body.getName());
    assertEquals(0.0, body.getMass(), 0.0);
    assertEquals(0.0, body.getRadius(), 0.0);
    assertEquals(Vector3.ZERO, body.getPosition());
    assertEquals(Vector3.ZERO, body.getVelocity());
  }

  @Test
  public void testParametersInAnyOrder() throws SystemParseException {
    Body body = SystemFilter.parseLine(
        "Giant velocity=0,13070,0 trojan=TRUE name=Jupiter position=7.785e11,0,0 mass=1.898e27 radius=6.9911e7",
        3);
    assertEquals(BodyType.GIANT, body.getType());
    assertTrue(body.isTrojan());
    assertEquals("Jupiter", body.getName());
    assertEquals(1.898e27, body.getMass(), 0.0);
    assertEquals(6.9911e7, body.getRadius(), 0.0);
    assertEquals(new Vector3(7.785e11, 0.0, 0.0), body.getPosition());
    assertEquals(new Vector3(0.0, 13070.0, 0.0), body.getVelocity());
  }

  @Test
  public void testCommentsAndBlankLines() throws SystemParseException {
    PlanetarySystem system = SystemFilter.parseLines(List.of(
        "# Sun and Jupiter",
        "",
        "STAR name=Sun mass=1.989e30",
        "   ",
        "GIANT name=Jupiter mass=1.898e27 position=7.785e11,0,0"));
    assertEquals(2, system.getNumberOfBodies());
    assertEquals("Jupiter", system.getBody(1).getName());
  }

  @Test
  public void testErrorsCarryLineNumber() {
    String[] badLines = {
        "PLANET mass=1",
        "GIANT mass=abc",
        "GIANT mass=-1",
        "GIANT radius=-1",
        "GIANT position=1,2",
        "GIANT velocity=1,2,3,4",
        "GIANT colour=red",
        "GIANT mass=1 mass=2",
        "GIANT mass",
        "GIANT trojan=maybe"
    };
    for (String badLine : badLines) {
      try {
        SystemFilter.parseLines(List.of("STAR name=Sun", "# comment", badLine));
        fail(" Expected a parse error for: " + badLine);
      } catch (SystemParseException e) {
        assertEquals(badLine, 3, e.getLineNumber());
      }
    }
  }

  @Test
  public void testReadFile() throws IOException, SystemParseException {
    File file = registerTemporaryDirectory().resolve("sun-jupiter.txt").toFile();
    FileUtils.writeLines(file, StandardCharsets.UTF_8.name(), List.of(
        "STAR name=Sun mass=1.989e30",
        "GIANT name=Jupiter mass=1.898e27 position=7.785e11,0,0 velocity=0,13070,0",
        "TERRESTRIAL trojan=true name=Achilles position=3.8925e11,6.742e11,0"));
    PlanetarySystem system = SystemFilter.readFile(file);
    assertEquals(3, system.getNumberOfBodies());
    assertEquals("Achilles", system.getTrojanPair().orElseThrow().trojan().getName());
  }

  @Test
  public void testMissingFile() {
    File file = registerTemporaryDirectory().resolve("missing.txt").toFile();
    try {
      SystemFilter.readFile(file);
      fail(" Expected a parse error for a missing file.");
    } catch (SystemParseException e) {
      assertEquals(0, e.getLineNumber());
    }
  }
}
