// ******************************************************************************
//
// Title:       X-Ray Lines.
// Description: X-Ray Lines - Reference Data for X-ray Spectroscopy.
// Copyright:   Copyright (c) Michael J. Schnieders 2001-2024.
//
// This file is part of X-Ray Lines.
//
// X-Ray Lines is free software; you can redistribute it and/or modify it
// under the terms of the GNU General Public License version 3 as published by
// the Free Software Foundation.
//
// X-Ray Lines is distributed in the hope that it will be useful, but WITHOUT
// ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or FITNESS
// FOR A PARTICULAR PURPOSE. See the GNU General Public License for more
// details.
//
// You should have received a copy of the GNU General Public License along with
// X-Ray Lines; if not, write to the Free Software Foundation, Inc., 59 Temple
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
package xlines.utilities;

import static java.lang.String.format;

import java.io.File;
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
 * The XLinesProperties class assembles the layered configuration of X-Ray Lines.
 * <p>
 * Sources are consulted in the following order (earlier sources take precedence):
 * <br>
 * 1) JVM system properties (i.e. -Dkey=value pairs).
 * <br>
 * 2) A property file supplied by the caller.
 * <br>
 * 3) The user property file ~/.xlines/xlines.properties.
 * <br>
 * 4) The property file named by the XLINES_PROPERTIES environment variable.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class XLinesProperties {

  private static final Logger logger = Logger.getLogger(XLinesProperties.class.getName());

  /** Property listing the preferred reference BibTeX keys, highest priority first. */
  public static final String REFERENCE_PRIORITY = "xlines.reference.priority";

  /** Environment variable that names a system wide property file. */
  public static final String XLINES_PROPERTIES = "XLINES_PROPERTIES";

  // Library class: make the default constructor private to ensure it's never constructed.
  private XLinesProperties() {}

  /**
   * Load the system, user and environment properties.
   *
   * @return a {@link org.apache.commons.configuration2.CompositeConfiguration} object.
   */
  public static CompositeConfiguration loadProperties() {
    return loadProperties(null);
  }

  /**
   * Load the system, user and environment properties, plus an optional property file.
   *
   * @param file a property file (may be null).
   * @return a {@link org.apache.commons.configuration2.CompositeConfiguration} object.
   */
  public static CompositeConfiguration loadProperties(File file) {
    CompositeConfiguration properties = new CompositeConfiguration();

    // JVM system properties are read first.
    PropertiesConfiguration systemConfiguration = new PropertiesConfiguration();
    systemConfiguration.append(new SystemConfiguration());
    systemConfiguration.setHeader("JVM system properties (i.e. command line -Dkey=value pairs).");
    properties.addConfiguration(systemConfiguration);

    // Caller supplied options are 2nd.
    if (file != null) {
      addPropertyFile(properties, file, "Property file (" + file.getPath() + ").");
    }

    // User specific options are 3rd.
    String userHome = System.getProperty("user.home");
    if (userHome != null) {
      String filename =
          FilenameUtils.concat(userHome, ".xlines" + File.separator + "xlines.properties");
      if (filename != null) {
        addPropertyFile(properties, new File(filename), "User property file (" + filename + ").");
      }
    }

    // System wide options are last.
    String filename = System.getenv(XLINES_PROPERTIES);
    if (filename != null) {
      addPropertyFile(properties, new File(filename),
          "Environment variable " + XLINES_PROPERTIES + " (" + filename + ").");
    }

    if (logger.isLoggable(Level.FINE)) {
      logger.fine(format(" %s = %s", REFERENCE_PRIORITY,
          properties.getList(String.class, REFERENCE_PRIORITY, null)));
    }

    return properties;
  }

  /**
   * Append a readable property file to the composite configuration.
   *
   * @param properties the CompositeConfiguration to append to.
   * @param file       the property file.
   * @param header     a description of the source.
   * @return true if the file was appended.
   */
  private static boolean addPropertyFile(CompositeConfiguration properties, File file,
      String header) {
    if (!file.exists() || !file.canRead()) {
      return false;
    }
    try {
      FileBasedConfigurationBuilder<PropertiesConfiguration> builder =
          new FileBasedConfigurationBuilder<>(PropertiesConfiguration.class)
              .configure(new Parameters().properties()
                  .setFile(file)
                  .setThrowExceptionOnMissing(true)
                  .setIncludesAllowed(false));
      PropertiesConfiguration configuration = builder.getConfiguration();
      configuration.setHeader(header);
      properties.addConfiguration(configuration);
      return true;
    } catch (ConfigurationException e) {
      logger.log(Level.INFO, " Error loading {0}.", file.getPath());
      return false;
    }
  }
}
