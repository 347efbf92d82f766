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

import static java.lang.String.format;

import java.io.File;
import java.util.Arrays;
import java.util.Iterator;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.apache.commons.configuration2.CompositeConfiguration;
import org.apache.commons.configuration2.PropertiesConfiguration;
import org.apache.commons.configuration2.SystemConfiguration;
import org.apache.commons.configuration2.builder.FileBasedConfigurationBuilder;
import org.apache.commons.configuration2.builder.fluent.Parameters;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.apache.commons.io.FilenameUtils;

/**
 * Loads the layered run properties of a Trojan X simulation.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class TrojanProperties {

  private static final Logger logger = Logger.getLogger(TrojanProperties.class.getName());

  /** Environment variable naming a system wide property file. */
  public static final String ENVIRONMENT_VARIABLE = "TROJANX_PROPERTIES";

  // Library class: make the default constructor private to ensure it's never constructed.
  private TrojanProperties() {}

  /**
   * This method sets up configuration properties in the following precedence order:
   *
   * <p>1.) Java system properties a.) -Dkey=value from the Java command line b.)
   * System.setProperty("key","value") within Java code.
   *
   * <p>2.) System specific properties (for example jupiter.properties next to jupiter.txt)
   *
   * <p>3.) User specific properties (~/.trojanx/trojanx.properties)
   *
   * <p>4.) System wide properties (file defined by environment variable TROJANX_PROPERTIES)
   *
   * @param file the planetary system file, or null.
   * @return a {@link org.apache.commons.configuration2.CompositeConfiguration} object.
   */
  public static CompositeConfiguration loadProperties(File file) {
    // Earlier configurations take precedence.
    CompositeConfiguration properties = new CompositeConfiguration();

    PropertiesConfiguration systemConfiguration = new PropertiesConfiguration();
    systemConfiguration.append(new SystemConfiguration());
    systemConfiguration.setHeader("JVM system properties (i.e. command line -Dkey=value pairs).");
    properties.addConfiguration(systemConfiguration);

    if (file != null) {
      String basename = FilenameUtils.removeExtension(file.getAbsolutePath());
      File systemPropFile = new File(basename + ".properties");
      addPropertyFile(properties, systemPropFile,
          "System properties (" + systemPropFile.getPath() + ").");
    }

    String filename = System.getProperty("user.home") + File.separator + ".trojanx"
        + File.separator + "trojanx.properties";
    addPropertyFile(properties, new File(filename), "User property file (" + filename + ").");

    filename = System.getenv(ENVIRONMENT_VARIABLE);
    if (filename != null) {
      addPropertyFile(properties, new File(filename),
          "Environment variable " + ENVIRONMENT_VARIABLE + " (" + filename + ").");
    }

    // Echo the interpolated configuration.
    if (logger.isLoggable(Level.FINE)) {
      Iterator<String> i = properties.getKeys();
      StringBuilder sb = new StringBuilder();
      sb.append(format("\n %-30s %s\n", "Property", "Value"));
      while (i.hasNext()) {
        String s = i.next();
        sb.append(format(" %-30s %s\n", s, Arrays.toString(properties.getList(s).toArray())));
      }
      logger.fine(sb.toString());
    }

    return properties;
  }

  /**
   * Append a property file to the composite configuration if it exists and can be read.
   *
   * @param properties the composite configuration.
   * @param propFile the property file.
   * @param header a header describing the source of the properties.
   */
  private static void addPropertyFile(CompositeConfiguration properties, File propFile,
      String header) {
    if (!propFile.exists() || !propFile.canRead()) {
      return;
    }
    try {
      FileBasedConfigurationBuilder<PropertiesConfiguration> builder =
          new FileBasedConfigurationBuilder<>(PropertiesConfiguration.class)
              .configure(new Parameters().properties()
                  .setFile(propFile)
                  .setThrowExceptionOnMissing(true)
                  .setIncludesAllowed(false));
      PropertiesConfiguration configuration = builder.getConfiguration();
      configuration.setHeader(header);
      properties.addConfiguration(configuration);
    } catch (ConfigurationException e) {
      logger.log(Level.INFO, " Error loading {0}.", propFile.getPath());
    }
  }
}
