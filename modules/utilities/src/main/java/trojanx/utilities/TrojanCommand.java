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

import static picocli.CommandLine.usage;

import java.awt.GraphicsEnvironment;
import java.io.ByteArrayOutputStream;
import java.io.UnsupportedEncodingException;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import picocli.CommandLine;
import picocli.CommandLine.Help.Ansi;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParseResult;

/**
 * Base Trojan X Command class.
 *
 * @author Michael J. Schnieders
 */
public abstract class TrojanCommand {

  /** The logger for this class. */
  public static final Logger logger = Logger.getLogger(TrojanCommand.class.getName());

  /**
   * Unix shells are able to evaluate PicoCLI ANSI color codes, but other consoles may not.
   *
   * <p>In a headless environment, color will be ON for command line help.
   */
  public final Ansi color;

  /** The array of args passed into the Command. */
  public String[] args;

  /** Parse Result. */
  public ParseResult parseResult = null;

  /** -V or --version Prints the version and exits. */
  @Option(
      names = {"-V", "--version"},
      versionHelp = true,
      defaultValue = "false",
      description = "Print the Trojan X version and exit.")
  public boolean version;

  /** -h or --help Prints a help message. */
  @Option(
      names = {"-h", "--help"},
      usageHelp = true,
      defaultValue = "false",
      description = "Print command help and exit.")
  public boolean help;

  /** The Binding that provides variables to this Command. */
  public TrojanBinding binding;

  /** Default constructor for a Command. */
  public TrojanCommand() {
    this(new TrojanBinding());
  }

  /**
   * Create a Command using the supplied command line arguments.
   *
   * @param args The command line arguments.
   */
  public TrojanCommand(String[] args) {
    this(new TrojanBinding());
    binding.setVariable("args", Arrays.asList(args));
  }

  /**
   * Create a Command using the supplied Binding.
   *
   * @param binding the Binding that provides variables to this Command.
   */
  public TrojanCommand(TrojanBinding binding) {
    this.binding = binding;
    if (GraphicsEnvironment.isHeadless()) {
      color = Ansi.ON;
    } else {
      color = Ansi.OFF;
    }
  }

  /**
   * Default help information.
   *
   * @return String describing how to use this command.
   */
  public String helpString() {
    try {
      StringOutputStream sos = new StringOutputStream(new ByteArrayOutputStream());
      usage(this, sos, color);
      return " " + sos;
    } catch (UnsupportedEncodingException e) {
      logger.log(Level.WARNING, e.toString());
      return null;
    }
  }

  /**
   * Initialize this Command based on the specified command line arguments.
   *
   * @return boolean Returns true if the command should continue and false to exit.
   */
  public boolean init() {
    // The args property could either be a list or an array of String arguments.
    Object arguments = binding.getVariable("args");

    if (arguments instanceof List<?> list) {
      int numArgs = list.size();
      args = new String[numArgs];
      for (int i = 0; i < numArgs; i++) {
        args[i] = (String) list.get(i);
      }
    } else if (arguments instanceof String[] array) {
      args = array;
    } else if (arguments instanceof String string) {
      args = new String[] {string};
    } else {
      args = new String[0];
    }

    CommandLine commandLine = new CommandLine(this);
    try {
      parseResult = commandLine.parseArgs(args);
    } catch (CommandLine.UnmatchedArgumentException uae) {
      logger.warning(
          " The usual source of this exception is when long-form arguments (such as --horizon) are only preceded by one dash.");
      throw uae;
    }

    // Print help info exit.
    if (help) {
      logger.info(helpString());
      return false;
    }

    if (version) {
      String implementationVersion = TrojanCommand.class.getPackage().getImplementationVersion();
      logger.info(" Trojan X " + (implementationVersion == null ? "1.0" : implementationVersion));
      return false;
    }
    return true;
  }

  /**
   * Execute this Command.
   *
   * @return The current TrojanCommand.
   */
  public TrojanCommand run() {
    logger.info(helpString());
    return this;
  }
}
