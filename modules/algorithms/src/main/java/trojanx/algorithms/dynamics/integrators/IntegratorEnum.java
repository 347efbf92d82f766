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
package trojanx.algorithms.dynamics.integrators;

import static java.lang.String.format;

import java.util.Arrays;
import java.util.Locale;
import trojanx.algorithms.dynamics.InvalidConfigurationException;

/**
 * Integrators available for gravitational dynamics.
 */
public enum IntegratorEnum {
  SEMI_IMPLICIT_EULER,
  VELOCITY_VERLET;

  /**
   * Parse an integrator String into an instance of the IntegratorEnum. Case is ignored, '-' may be
   * used in place of '_', and "EULER" and "VERLET" are accepted as short forms.
   *
   * @param str Integrator string.
   * @return Integrator enum.
   * @throws InvalidConfigurationException if the name is not recognized.
   */
  public static IntegratorEnum parse(String str) {
    String name = str.trim().toUpperCase(Locale.ROOT).replace('-', '_');
    return switch (name) {
      case "EULER" -> SEMI_IMPLICIT_EULER;
      case "VERLET", "VELOCITYVERLET" -> VELOCITY_VERLET;
      default -> {
        try {
          yield valueOf(name);
        } catch (IllegalArgumentException e) {
          throw new InvalidConfigurationException(format(
              " Could not parse %s as an integrator; choose from %s.", str,
              Arrays.toString(values())), e);
        }
      }
    };
  }
}
