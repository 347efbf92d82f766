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

import static java.lang.Double.isFinite;
import static java.lang.Double.isNaN;
import static java.lang.String.format;
import static org.apache.commons.math3.util.FastMath.max;
import static org.apache.commons.math3.util.FastMath.min;
import static org.apache.commons.math3.util.FastMath.sqrt;

/**
 * The RunningStatistics class uses online, stable algorithms to calculate summary statistics from a
 * source of doubles, including mean, variance, standard deviation, max, min, sum, and count.
 *
 * <p>Sums use Kahan compensation. The resonance monitor feeds it one deviation per evaluated step,
 * so it must not retain the values.
 *
 * @author Michael J. Schnieders
 * @author Jacob M. Litman
 * @since 1.0
 */
public class RunningStatistics {

  private double mean = 0;
  private double var = 0;
  private double min = Double.POSITIVE_INFINITY;
  private double max = Double.NEGATIVE_INFINITY;
  private long count = 0;
  private double sum = 0;
  private double comp = 0;

  /** Constructs new running statistics accumulator. */
  public RunningStatistics() {
    // Empty constructor; all variables are initialized at definition.
  }

  /**
   * Add a value and update key variables.
   *
   * @param val Value to add; must be finite.
   * @throws IllegalArgumentException if the value is not finite.
   */
  public void addValue(double val) {
    if (!isFinite(val)) {
      throw new IllegalArgumentException(format(" Value %s is not finite.", val));
    }
    ++count;
    double priorMean = mean;
    double y = val - comp;
    double t = sum + y;
    comp = (t - sum) - y;
    sum = t;

    min = min(min, val);
    max = max(max, val);
    mean += (val - mean) / count;
    var += (val - priorMean) * (val - mean);
    if (isNaN(var)) {
      throw new IllegalArgumentException(
          format(" Val %.5f resulted in NaN varAcc; current state %s", val, describe()));
    }
  }

  /**
   * Get the count.
   *
   * @return Returns the count.
   */
  public long getCount() {
    return count;
  }

  /**
   * Get the max.
   *
   * @return Returns the max, or NaN if no values were added.
   */
  public double getMax() {
    return count == 0 ? Double.NaN : max;
  }

  /**
   * Gets the mean as of the last value added.
   *
   * @return Current running mean, or NaN if no values were added.
   */
  public double getMean() {
    return count == 0 ? Double.NaN : mean;
  }

  /**
   * Get the min.
   *
   * @return Returns the min, or NaN if no values were added.
   */
  public double getMin() {
    return count == 0 ? Double.NaN : min;
  }

  /**
   * Get the standard deviation.
   *
   * @return Returns the sample standard deviation.
   */
  public double getStandardDeviation() {
    return sqrt(getVariance());
  }

  /**
   * Get the sum.
   *
   * @return Returns the sum.
   */
  public double getSum() {
    return sum;
  }

  /**
   * Get the variance.
   *
   * @return Returns the sample variance, or NaN with fewer than two values.
   */
  public double getVariance() {
    return count < 2 ? Double.NaN : var / (count - 1);
  }

  /** Reset the accumulator to its initial state. */
  public void reset() {
    mean = 0;
    var = 0;
    min = Double.POSITIVE_INFINITY;
    max = Double.NEGATIVE_INFINITY;
    count = 0;
    sum = 0;
    comp = 0;
  }

  /**
   * Describe the Summary Statistics.
   *
   * @return Return the description.
   */
  public String describe() {
    return format(" Mean: %12.6f +/-%12.6f, Min/Max: %12.6f/%12.6f", getMean(),
        getStandardDeviation(), getMin(), getMax());
  }
}
