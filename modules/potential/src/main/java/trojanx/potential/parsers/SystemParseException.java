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

/**
 * A planetary system file could not be parsed.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class SystemParseException extends Exception {

  /** 1-based line number of the offending line, or 0 if the error is not tied to a line. */
  private final int lineNumber;

  /**
   * Constructor for SystemParseException.
   *
   * @param lineNumber the 1-based line number.
   * @param message    a description of the problem.
   */
  public SystemParseException(int lineNumber, String message) {
    super(lineNumber > 0 ? " Line " + lineNumber + ":" + message : message);
    this.lineNumber = lineNumber;
  }

  /**
   * Constructor for SystemParseException.
   *
   * @param lineNumber the 1-based line number.
   * @param message    a description of the problem.
   * @param cause      the underlying exception.
   */
  public SystemParseException(int lineNumber, String message, Throwable cause) {
    super(lineNumber > 0 ? " Line " + lineNumber + ":" + message : message, cause);
    this.lineNumber = lineNumber;
  }

  public int getLineNumber() {
    return lineNumber;
  }
}
