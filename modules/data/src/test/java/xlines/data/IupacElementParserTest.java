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
package xlines.data;

import static org.junit.Assert.assertEquals;

import org.junit.BeforeClass;
import org.junit.Test;
import xlines.utilities.XLinesTest;

/**
 * @author Michael J. Schnieders
 */
public class IupacElementParserTest extends XLinesTest {

  private static XRayDatabase database;

  @BeforeClass
  public static void setUpDatabase() {
    MemoryPropertyStore store = new MemoryPropertyStore();
    store.addAll(new IupacElementParser());
    database = new XRayDatabase(new PropertyResolver(store));
  }

  @Test
  public void testRowCount() {
    MemoryPropertyStore store = new MemoryPropertyStore();
    assertEquals(3 * 118, store.addAll(new IupacElementParser()));
    assertEquals(118, store.getRows(PropertyKind.ELEMENT_SYMBOL).size());
  }

  @Test
  public void testElements() {
    assertEquals("H", database.symbol(1));
    assertEquals("Fe", database.symbol(26));
    assertEquals("Og", database.symbol(118));
    assertEquals(29, database.atomicNumber("cu"));
    assertEquals("Iron", database.name(26));
    assertEquals("Tungsten", database.name("W"));
    assertEquals(55.845, database.atomicWeight(26), 1.0e-9);
    assertEquals(55.845, database.atomicWeight(26, IupacElementParser.BIBTEXKEY), 1.0e-9);
  }

  @Test(expected = PropertyNotFoundException.class)
  public void testUnknownSymbol() {
    database.atomicNumber("Xx");
  }

  @Test
  public void testSymbolsRoundTrip() {
    for (int z = 1; z <= 118; z++) {
      assertEquals(z, database.atomicNumber(database.symbol(z)));
    }
  }
}
