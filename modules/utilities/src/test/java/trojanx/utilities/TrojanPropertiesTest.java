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
package trojanx.utilities;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import org.apache.commons.configuration2.CompositeConfiguration;
import org.apache.commons.io.FileUtils;
import org.junit.Test;

/**
 * Tests the precedence of the layered run properties.
 *
 * @author Michael J. Schnieders
 */
public class TrojanPropertiesTest extends TrojanTest {

  @Test
  public void testSystemPropertyFile() throws IOException {
    Path dir = registerTemporaryDirectory();
    File systemFile = dir.resolve("jupiter.txt").toFile();
    FileUtils.writeStringToFile(systemFile, "STAR name=Sun mass=1.989e30\n", StandardCharsets.UTF_8);
    File propertyFile = dir.resolve("jupiter.properties").toFile();
    FileUtils.writeStringToFile(propertyFile, "integrate=VELOCITY_VERLET\nhorizon-years=25\n",
        StandardCharsets.UTF_8);

    CompositeConfiguration properties = TrojanProperties.loadProperties(systemFile);
    assertEquals("VELOCITY_VERLET", properties.getString("integrate"));
    assertEquals(25.0, properties.getDouble("horizon-years"), 0.0);
  }

  @Test
  public void testSystemPropertiesTakePrecedence() throws IOException {
    Path dir = registerTemporaryDirectory();
    File systemFile = dir.resolve("trojan.txt").toFile();
    FileUtils.writeStringToFile(systemFile, "STAR name=Sun\n", StandardCharsets.UTF_8);
    FileUtils.writeStringToFile(dir.resolve("trojan.properties").toFile(), "horizon-years=25\n",
        StandardCharsets.UTF_8);

    System.setProperty("horizon-years", "50");
    CompositeConfiguration properties = TrojanProperties.loadProperties(systemFile);
    assertEquals(50.0, properties.getDouble("horizon-years"), 0.0);
  }

  @Test
  public void testMissingFile() {
    CompositeConfiguration properties = TrojanProperties.loadProperties(null);
    assertFalse(properties.containsKey("resonance-criterion-that-does-not-exist"));
  }
}
