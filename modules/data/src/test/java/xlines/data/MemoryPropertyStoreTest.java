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
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.Before;
import org.junit.Test;
import xlines.descriptor.AtomicSubshell;
import xlines.descriptor.Element;
import xlines.descriptor.Language;
import xlines.descriptor.Reference;
import xlines.utilities.XLinesTest;

/**
 * @author Michael J. Schnieders
 */
public class MemoryPropertyStoreTest extends XLinesTest {

  private MemoryPropertyStore store;
  private PropertySubject iron;
  private Reference ref1;
  private Reference ref2;

  @Before
  public void setUp() {
    store = new MemoryPropertyStore();
    iron = new PropertySubject(Element.of(26));
    ref1 = Reference.of("ref1");
    ref2 = Reference.of("ref2");
  }

  @Test
  public void testInsertionOrder() {
    store.add(new PropertyRow(PropertyKind.ELEMENT_MASS_DENSITY, iron, ref2, 9000.0));
    store.add(new PropertyRow(PropertyKind.ELEMENT_MASS_DENSITY, iron, ref1, 7874.0));
    assertEquals(Arrays.asList(ref2, ref1),
        store.getReferences(PropertyKind.ELEMENT_MASS_DENSITY, iron));
    List<PropertyRow> rows = store.getRows(PropertyKind.ELEMENT_MASS_DENSITY);
    assertEquals(2, rows.size());
    assertEquals(9000.0, (Double) rows.get(0).getValue(), 0.0);
    assertEquals(2, store.size());
  }

  @Test
  public void testDuplicateRowIsIgnored() {
    assertTrue(store.add(new PropertyRow(PropertyKind.ELEMENT_SYMBOL, iron, ref1, "Fe")));
    assertFalse(store.add(new PropertyRow(PropertyKind.ELEMENT_SYMBOL, iron, ref1, "Fx")));
    assertEquals("Fe", store.getProperty(PropertyKind.ELEMENT_SYMBOL, iron, ref1));
    assertEquals(1, store.size());
  }

  @Test
  public void testMissingProperty() {
    assertFalse(store.hasProperty(PropertyKind.ELEMENT_SYMBOL, iron, ref1));
    assertNull(store.getProperty(PropertyKind.ELEMENT_SYMBOL, iron, ref1));
    assertEquals(Collections.emptyList(), store.getReferences(PropertyKind.ELEMENT_SYMBOL, iron));
    assertTrue(store.getRows(PropertyKind.TRANSITION_ENERGY).isEmpty());
  }

  @Test
  public void testQualifiedSubjects() {
    PropertySubject english = new PropertySubject(iron.getElement(), Language.of("en"));
    PropertySubject german = new PropertySubject(iron.getElement(), Language.of("de"));
    store.add(new PropertyRow(PropertyKind.ELEMENT_NAME, english, ref1, "Iron"));
    store.add(new PropertyRow(PropertyKind.ELEMENT_NAME, german, ref1, "Eisen"));
    assertEquals("Eisen", store.getProperty(PropertyKind.ELEMENT_NAME,
        new PropertySubject(Element.of(26), Language.of("DE")), ref1));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testRowRequiresQualifier() {
    new PropertyRow(PropertyKind.SUBSHELL_ENERGY, iron, ref1, 7112.0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testRowRejectsWrongQualifier() {
    new PropertyRow(PropertyKind.TRANSITION_ENERGY,
        new PropertySubject(Element.of(26), AtomicSubshell.of(1, 0, 1)), ref1, 7112.0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testRowRejectsWrongValueType() {
    new PropertyRow(PropertyKind.ELEMENT_ATOMIC_WEIGHT, iron, ref1, "55.845");
  }

  @Test
  public void testKindKeywords() {
    assertEquals("transition_energy", PropertyKind.TRANSITION_ENERGY.getKeyword());
    assertEquals(PropertyKind.SUBSHELL_WIDTH, PropertyKind.fromKeyword("SUBSHELL_WIDTH"));
    assertNull(PropertyKind.fromKeyword("boiling_point"));
    assertFalse(PropertyKind.ELEMENT_SYMBOL.isQualified());
    assertEquals(Language.class, PropertyKind.ELEMENT_NAME.getQualifierType());
  }
}
