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

import java.util.Properties;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.junit.After;
import org.junit.AfterClass;
import org.junit.Before;
import org.junit.BeforeClass;

/**
 * Base class for X-Ray Lines tests.
 * <p>
 * The "xlines" logger runs at the level named by the xlines.test.log System property (WARNING
 * when unset or unparseable) for the duration of each test class. System properties changed by a
 * test are restored afterward, since several tests drive configuration through them.
 *
 * @author Michael J. Schnieders
 */
public abstract class XLinesTest {

  private static final Logger xlinesLogger = Logger.getLogger("xlines");

  private static Level savedLevel;
  private Properties savedProperties;

  @BeforeClass
  public static void setLogLevel() {
    savedLevel = xlinesLogger.getLevel();
    Level level = Level.WARNING;
    String value = System.getProperty("xlines.test.log");
    if (value != null) {
      try {
        level = Level.parse(value.trim().toUpperCase());
      } catch (IllegalArgumentException e) {
        xlinesLogger.warning(" Ignoring unknown xlines.test.log level: " + value);
      }
    }
    xlinesLogger.setLevel(level);
  }

  @AfterClass
  public static void restoreLogLevel() {
    xlinesLogger.setLevel(savedLevel);
  }

  @Before
  public void saveSystemProperties() {
    savedProperties = (Properties) System.getProperties().clone();
  }

  @After
  public void restoreSystemProperties() {
    System.setProperties(savedProperties);
  }
}
