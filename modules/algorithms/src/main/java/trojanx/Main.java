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
package trojanx;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import picocli.CommandLine.ParameterException;
import trojanx.algorithms.commands.Trojan;
import trojanx.utilities.LogFormatter;

/**
 * The Main class is the command line entry point of Trojan X.
 *
 * <p>Arguments of the form -Dkey=value are set as system properties before the Trojan command
 * parses the rest. The trojanx.log property sets the logging level (default INFO).
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class Main {

  private static final Logger logger = Logger.getLogger(Main.class.getName());

  private Main() {}

  /**
   * Run the Trojan command and exit with its status code.
   *
   * @param args an array of {@link java.lang.String} objects.
   */
  public static void main(String[] args) {
    int statusCode;
    try {
      statusCode = run(args);
    } catch (RuntimeException e) {
      statusCode = 1;
      logger.log(Level.SEVERE, " Uncaught exception: exiting with status code " + statusCode, e);
    }
    System.exit(statusCode);
  }

  /**
   * Configure logging and run the Trojan command.
   *
   * @param args the command line arguments.
   * @return the exit code.
   */
  static int run(String[] args) {
    args = processProperties(args);
    startLogging();

    Trojan trojan = new Trojan(args);
    try {
      trojan.run();
    } catch (ParameterException e) {
      logger.severe(" " + e.getMessage());
      logger.info(trojan.helpString());
      return 1;
    }
    return trojan.getExitCode();
  }

  /**
   * Set system properties from "-Dkey=value" arguments.
   *
   * @param args the command line arguments.
   * @return the remaining arguments.
   */
  private static String[] processProperties(String[] args) {
    List<String> newArgs = new ArrayList<>();
    for (String arg : args) {
      arg = arg.trim();
      if (arg.startsWith("-D")) {
        // Remove -D from the front of String.
        arg = arg.substring(2);
        // Split at the first equals if it exists.
        int equalsPosition = arg.indexOf("=");
        if (equalsPosition > 0) {
          System.setProperty(arg.substring(0, equalsPosition), arg.substring(equalsPosition + 1));
        } else if (!arg.isEmpty()) {
          System.setProperty(arg, "");
        }
      } else {
        // Collect non "-D" arguments.
        newArgs.add(arg);
      }
    }
    return newArgs.toArray(new String[0]);
  }

  /** Replace the default console handler with one that uses the LogFormatter. */
  private static void startLogging() {
    // Remove all log handlers from the default logger.
    Logger defaultLogger = LogManager.getLogManager().getLogger("");
    for (Handler h : defaultLogger.getHandlers()) {
      defaultLogger.removeHandler(h);
    }

    // Retrieve the log level from the trojanx.log system property.
    String logLevel = System.getProperty("trojanx.log", "info");
    Level level;
    try {
      level = Level.parse(logLevel.toUpperCase());
    } catch (IllegalArgumentException e) {
      level = Level.INFO;
    }

    ConsoleHandler handler = new ConsoleHandler();
    handler.setFormatter(new LogFormatter(level.intValue() < Level.INFO.intValue()));
    handler.setLevel(level);
    defaultLogger.addHandler(handler);

    Logger trojanLogger = Logger.getLogger("trojanx");
    trojanLogger.setLevel(level);
  }
}
