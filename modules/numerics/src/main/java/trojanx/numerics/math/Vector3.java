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
package trojanx.numerics.math;

import static java.lang.String.format;
import static org.apache.commons.math3.util.FastMath.sqrt;

/**
 * Immutable 3D double vector. Arithmetic operations return a new Vector3.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class Vector3 {

  /** The zero vector. */
  public static final Vector3 ZERO = new Vector3(0.0, 0.0, 0.0);

  private final double x;
  private final double y;
  private final double z;

  /**
   * Construct a Vector3 at (x, y, z).
   *
   * @param x X value.
   * @param y Y value.
   * @param z Z value.
   */
  public Vector3(double x, double y, double z) {
    this.x = x;
    this.y = y;
    this.z = z;
  }

  /**
   * Construct a Vector3 from the first three entries of an array (the data is copied).
   *
   * @param a the array.
   * @return a new Vector3.
   */
  public static Vector3 of(double[] a) {
    return new Vector3(a[0], a[1], a[2]);
  }

  /**
   * Finds the sum of this Vector3 with b.
   *
   * @param b Second Vector3.
   * @return Returns the sum in a new Vector3.
   */
  public Vector3 add(Vector3 b) {
    return new Vector3(x + b.x, y + b.y, z + b.z);
  }

  /**
   * Finds the difference between two vectors.
   *
   * @param b Second vector
   * @return Returns this - b in a new Vector3.
   */
  public Vector3 sub(Vector3 b) {
    return new Vector3(x - b.x, y - b.y, z - b.z);
  }

  /**
   * Scales a Vector3.
   *
   * @param d A scalar value.
   * @return Returns a new scaled Vector3.
   */
  public Vector3 scale(double d) {
    return new Vector3(x * d, y * d, z * d);
  }

  /**
   * Returns this + b * d in a new Vector3 without the intermediate scaled copy.
   *
   * @param b the vector to scale and add.
   * @param d the scale factor.
   * @return a new Vector3.
   */
  public Vector3 addScaled(Vector3 b, double d) {
    return new Vector3(x + b.x * d, y + b.y * d, z + b.z * d);
  }

  /**
   * Finds the dot product between two vectors.
   *
   * @param b Second vector.
   * @return Returns the dot product of this Vector3 and b.
   */
  public double dot(Vector3 b) {
    return x * b.x + y * b.y + z * b.z;
  }

  /**
   * Finds the length of this Vector3.
   *
   * @return Length of this Vector3.
   */
  public double length() {
    return sqrt(length2());
  }

  /**
   * Finds the length of this Vector3 squared.
   *
   * @return Length of this Vector3 squared.
   */
  public double length2() {
    return x * x + y * y + z * z;
  }

  /**
   * Finds the Euclidean distance between two positions.
   *
   * @param b Second vector.
   * @return Returns the distance between this Vector3 and b.
   */
  public double dist(Vector3 b) {
    return sub(b).length();
  }

  /**
   * Check that every component is finite.
   *
   * @return true if no component is NaN or infinite.
   */
  public boolean isFinite() {
    return Double.isFinite(x) && Double.isFinite(y) && Double.isFinite(z);
  }

  /**
   * Get the value of x.
   *
   * @return Returns x.
   */
  public double x() {
    return x;
  }

  /**
   * Get the value of y.
   *
   * @return Returns y.
   */
  public double y() {
    return y;
  }

  /**
   * Get the value of z.
   *
   * @return Returns z.
   */
  public double z() {
    return z;
  }

  /**
   * Copy this Vector3 into a new array.
   *
   * @return a new array {x, y, z}.
   */
  public double[] toArray() {
    return new double[] {x, y, z};
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Vector3 other)) {
      return false;
    }
    return Double.compare(x, other.x) == 0
        && Double.compare(y, other.y) == 0
        && Double.compare(z, other.z) == 0;
  }

  @Override
  public int hashCode() {
    int result = Double.hashCode(x);
    result = 31 * result + Double.hashCode(y);
    return 31 * result + Double.hashCode(z);
  }

  /**
   * Describe this Vector3 in a String.
   *
   * @return Returns a String description.
   */
  @Override
  public String toString() {
    return format("( %14.6e, %14.6e, %14.6e )", x, y, z);
  }
}
