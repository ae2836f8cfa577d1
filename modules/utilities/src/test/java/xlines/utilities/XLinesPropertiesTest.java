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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.configuration2.CompositeConfiguration;
import org.junit.Test;

/**
 * @author Michael J. Schnieders
 */
public class XLinesPropertiesTest extends XLinesTest {

  @Test
  public void testSystemPropertiesAreLoaded() {
    System.setProperty("xlines.test.key", "value");
    CompositeConfiguration properties = XLinesProperties.loadProperties();
    assertEquals("value", properties.getString("xlines.test.key"));
  }

  @Test
  public void testSystemPropertiesTakePrecedence() throws IOException {
    Path path = Files.createTempFile("xlines", ".properties");
    try {
      Files.write(path, "xlines.reference.priority=ref1\nxlines.file.only=yes\n"
          .getBytes(StandardCharsets.UTF_8));
      System.setProperty(XLinesProperties.REFERENCE_PRIORITY, "ref2");
      CompositeConfiguration properties = XLinesProperties.loadProperties(path.toFile());
      assertEquals("ref2", properties.getString(XLinesProperties.REFERENCE_PRIORITY));
      assertEquals("yes", properties.getString("xlines.file.only"));
    } finally {
      Files.deleteIfExists(path);
    }
  }

  @Test
  public void testMissingFileIsIgnored() {
    CompositeConfiguration properties =
        XLinesProperties.loadProperties(new File("does-not-exist.properties"));
    assertFalse(properties.containsKey("xlines.file.only"));
  }

  @Test
  public void testWavelengthConstant() {
    // Cu Ka1 at 8047.8 eV has a wavelength of about 1.5406 Angstrom.
    double wavelength = Constants.HC_EV_M / 8047.8 * Constants.METERS_TO_ANG;
    assertEquals(1.5406, wavelength, 1.0e-3);
    assertTrue(Constants.PLANCK_CONSTANT_EV > 4.1356e-15);
  }
}
