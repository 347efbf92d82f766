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

import static java.lang.String.format;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.apache.commons.io.FileUtils;
import trojanx.numerics.math.Vector3;
import trojanx.potential.Body;
import trojanx.potential.BodyType;
import trojanx.potential.PlanetarySystem;

/**
 * The SystemFilter class parses planetary system files.
 *
 * <p>Each non-empty line describes one body. The first token is the body type (STAR, GIANT or
 * TERRESTRIAL), followed by whitespace separated key=value parameters in any order:
 * <br>
 * trojan=true|false (default false)
 * <br>
 * name=Jupiter (default empty)
 * <br>
 * mass=1.898e27 in kg (default 0)
 * <br>
 * radius=6.9911e7 in m (default 0)
 * <br>
 * position=x,y,z in m (default 0,0,0)
 * <br>
 * velocity=vx,vy,vz in m/s (default 0,0,0)
 * <br>
 * Lines starting with '#' are comments.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class SystemFilter {

  private static final Logger logger = Logger.getLogger(SystemFilter.class.getName());

  // Library class: make the default constructor private to ensure it's never constructed.
  private SystemFilter() {}

  /**
   * Read a planetary system file.
   *
   * @param file the system file.
   * @return the parsed PlanetarySystem.
   * @throws SystemParseException if the file cannot be read or a line is malformed.
   */
  public static PlanetarySystem readFile(File file) throws SystemParseException {
    List<String> lines;
    try {
      lines = FileUtils.readLines(file, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new SystemParseException(0, format(" Could not read %s.", file.getPath()), e);
    }
    PlanetarySystem system = parseLines(lines);
    logger.info(format(" Read %d bodies from %s.", system.getNumberOfBodies(), file.getName()));
    return system;
  }

  /**
   * Parse the lines of a planetary system file.
   *
   * @param lines the lines of the file.
   * @return the parsed PlanetarySystem.
   * @throws SystemParseException if a line is malformed.
   */
  public static PlanetarySystem parseLines(List<String> lines) throws SystemParseException {
    List<Body> bodies = new ArrayList<>();
    for (int i = 0; i < lines.size(); i++) {
      String line = lines.get(i).trim();
      if (line.isEmpty() || line.startsWith("#")) {
        continue;
      }
      bodies.add(parseLine(line, i + 1));
    }
    if (logger.isLoggable(Level.FINE)) {
      for (Body body : bodies) {
        logger.fine(format("  %s", body));
      }
    }
    return new PlanetarySystem(bodies);
  }

  /**
   * Parse a single line into a Body.
   *
   * @param line       the trimmed line.
   * @param lineNumber the 1-based line number.
   * @return the Body described by the line.
   * @throws SystemParseException if the line is malformed.
   */
  public static Body parseLine(String line, int lineNumber) throws SystemParseException {
    String[] tokens = line.trim().split("\\s+");

    BodyType type;
    try {
      type = BodyType.parse(tokens[0]);
    } catch (IllegalArgumentException e) {
      throw new SystemParseException(lineNumber,
          format(" Each line must start with a body type (STAR, GIANT or TERRESTRIAL), found \"%s\".",
              tokens[0]));
    }

    boolean trojan = false;
    String name = "";
    double mass = 0.0;
    double radius = 0.0;
    Vector3 position = Vector3.ZERO;
    Vector3 velocity = Vector3.ZERO;

    Set<String> seen = new HashSet<>();
    for (int i = 1; i < tokens.length; i++) {
      String token = tokens[i];
      int equals = token.indexOf('=');
      if (equals <= 0) {
        throw new SystemParseException(lineNumber,
            format(" Expected a key=value parameter, found \"%s\".", token));
      }
      String key = token.substring(0, equals).toLowerCase(Locale.ROOT);
      String value = token.substring(equals + 1);
      if (!seen.add(key)) {
        throw new SystemParseException(lineNumber, format(" Duplicate parameter \"%s\".", key));
      }
      switch (key) {
        case "trojan" -> trojan = parseBoolean(value, lineNumber);
        case "name" -> name = value;
        case "mass" -> mass = parseNonNegative(key, value, lineNumber);
        case "radius" -> radius = parseNonNegative(key, value, lineNumber);
        case "position" -> position = parseVector(key, value, lineNumber);
        case "velocity" -> velocity = parseVector(key, value, lineNumber);
        default -> throw new SystemParseException(lineNumber,
            format(" Unrecognized parameter \"%s\".", key));
      }
    }

    return new Body(type, trojan, name, mass, radius, position, velocity);
  }

  private static boolean parseBoolean(String value, int lineNumber) throws SystemParseException {
    if (value.equalsIgnoreCase("true")) {
      return true;
    } else if (value.equalsIgnoreCase("false")) {
      return false;
    }
    throw new SystemParseException(lineNumber,
        format(" The trojan parameter must be true or false, found \"%s\".", value));
  }

  private static double parseDouble(String key, String value, int lineNumber)
      throws SystemParseException {
    try {
      double d = Double.parseDouble(value);
      if (!Double.isFinite(d)) {
        throw new SystemParseException(lineNumber, format(" The %s value %s is not finite.", key, value));
      }
      return d;
    } catch (NumberFormatException e) {
      throw new SystemParseException(lineNumber,
          format(" Could not parse \"%s\" as a number for %s.", value, key), e);
    }
  }

  private static double parseNonNegative(String key, String value, int lineNumber)
      throws SystemParseException {
    double d = parseDouble(key, value, lineNumber);
    if (d < 0.0) {
      throw new SystemParseException(lineNumber, format(" The %s must be >= 0, found %s.", key, value));
    }
    return d;
  }

  private static Vector3 parseVector(String key, String value, int lineNumber)
      throws SystemParseException {
    String[] components = value.split(",", -1);
    if (components.length != 3) {
      throw new SystemParseException(lineNumber,
          format(" The %s must be specified by three comma-separated numbers, found \"%s\".", key, value));
    }
    return new Vector3(parseDouble(key, components[0], lineNumber),
        parseDouble(key, components[1], lineNumber),
        parseDouble(key, components[2], lineNumber));
  }
}
