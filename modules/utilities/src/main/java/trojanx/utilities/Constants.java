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

/**
 * Library class containing physical constants and unit conversions used by Trojan X.
 *
 * <p>All quantities are SI: kilograms, meters and seconds.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class Constants {

  /**
   * Newtonian constant of gravitation in N*m^2/kg^2. <code>GRAVITATIONAL_CONSTANT=6.674E-11</code>
   */
  public static final double GRAVITATIONAL_CONSTANT = 6.674E-11;
  /** Seconds per day. <code>SECONDS_PER_DAY=86400</code> */
  public static final double SECONDS_PER_DAY = 60.0 * 60.0 * 24.0;
  /** Seconds per Julian year. <code>SECONDS_PER_YEAR=365.25 * SECONDS_PER_DAY</code> */
  public static final double SECONDS_PER_YEAR = 365.25 * SECONDS_PER_DAY;
  /** Mass of the Sun in kg. <code>SOLAR_MASS=1.989E30</code> */
  public static final double SOLAR_MASS = 1.989E30;
  /** Mass of Jupiter in kg. <code>JUPITER_MASS=1.898E27</code> */
  public static final double JUPITER_MASS = 1.898E27;

  // Library class: make the default constructor private to ensure it's never constructed.
  private Constants() {}
}
