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
package xlines.transition;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.HashSet;
import java.util.Set;
import org.junit.Test;
import xlines.descriptor.AtomicSubshell;
import xlines.descriptor.Transition;
import xlines.utilities.XLinesTest;

/**
 * @author Michael J. Schnieders
 */
public class TransitionCatalogTest extends XLinesTest {

  @Test
  public void testSize() {
    assertEquals(79, TransitionCatalog.size());
  }

  @Test
  public void testEntries() {
    AtomicSubshell k = AtomicSubshell.fromIupac("K");
    AtomicSubshell l3 = AtomicSubshell.fromIupac("L3");
    assertEquals("Kα1", TransitionCatalog.getSiegbahn(0));
    assertEquals(Transition.of(l3, k), TransitionCatalog.getTransition(0));
    assertEquals(0, TransitionCatalog.indexOf("Kα1"));
    assertEquals(0, TransitionCatalog.indexOf(Transition.of(l3, k)));
    assertEquals(12, TransitionCatalog.indexOf("Lα1"));
    assertEquals(19, TransitionCatalog.indexOf("Lℓ"));
    assertEquals(46, TransitionCatalog.indexOf("Lβ4"));
    assertEquals(52, TransitionCatalog.indexOf("Lγ4p"));
    assertEquals(76, TransitionCatalog.indexOf("N5N6"));
    assertEquals(Transition.fromIupac("N5-N6"), TransitionCatalog.getTransition(76));
    assertEquals(-1, TransitionCatalog.indexOf("Ka1"));
    assertEquals(-1, TransitionCatalog.indexOf(Transition.fromIupac("K-K")));
  }

  @Test
  public void testSatellites() {
    assertEquals(77, TransitionCatalog.indexOf("Kα3"));
    assertEquals(78, TransitionCatalog.indexOf("Kα4"));
    assertEquals(1, TransitionCatalog.getTransition(77).getSatellite());
    assertEquals(2, TransitionCatalog.getTransition(78).getSatellite());
    for (int i = 0; i < 77; i++) {
      assertTrue(TransitionCatalog.getTransition(i).isDiagramLine());
    }
  }

  @Test
  public void testEntriesAreUnique() {
    Set<String> names = new HashSet<>();
    Set<Transition> transitions = new HashSet<>();
    for (int i = 0; i < TransitionCatalog.size(); i++) {
      assertTrue(names.add(TransitionCatalog.getSiegbahn(i)));
      assertTrue(transitions.add(TransitionCatalog.getTransition(i)));
      assertEquals(i, TransitionCatalog.indexOf(TransitionCatalog.getSiegbahn(i)));
      assertEquals(i, TransitionCatalog.indexOf(TransitionCatalog.getTransition(i)));
      // Electrons fill a hole in a more tightly bound subshell.
      Transition transition = TransitionCatalog.getTransition(i);
      assertTrue(transition.getSourceSubshell().compareTo(transition.getDestinationSubshell()) > 0);
      assertFalse(transition.isNonradiative());
    }
  }

  @Test
  public void testSubshellIndex() {
    assertEquals(AtomicSubshell.fromIupac("K"), TransitionCatalog.getSubshell(1));
    assertEquals(AtomicSubshell.fromIupac("L1"), TransitionCatalog.getSubshell(2));
    assertEquals(AtomicSubshell.fromIupac("L3"), TransitionCatalog.getSubshell(4));
    assertEquals(AtomicSubshell.fromIupac("M5"), TransitionCatalog.getSubshell(9));
    assertEquals(AtomicSubshell.fromIupac("N7"), TransitionCatalog.getSubshell(16));
    assertEquals(AtomicSubshell.fromIupac("O1"), TransitionCatalog.getSubshell(17));
    assertEquals(AtomicSubshell.fromIupac("P5"), TransitionCatalog.getSubshell(28));
    assertEquals(AtomicSubshell.fromIupac("Q1"), TransitionCatalog.getSubshell(29));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testSubshellIndexTooLarge() {
    TransitionCatalog.getSubshell(30);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testSubshellIndexTooSmall() {
    TransitionCatalog.getSubshell(0);
  }

  @Test
  public void testGroups() {
    assertEquals(TransitionGroup.KA, TransitionGroup.fromSiegbahn("Kα"));
    assertEquals(TransitionGroup.LIII, TransitionGroup.fromSiegbahn("LIII"));
    assertNull(TransitionGroup.fromSiegbahn("Ka"));
    assertTrue(TransitionGroup.KA.contains(0));
    assertTrue(TransitionGroup.KA.contains(77));
    assertFalse(TransitionGroup.KA.contains(2));
    assertTrue(TransitionGroup.LIII.contains(12));
    assertFalse(TransitionGroup.LIII.contains(31));
    assertTrue(TransitionGroup.N.contains(76));
    assertTrue(TransitionGroup.L.contains(7));
    assertEquals(TransitionGroup.Type.SHELL, TransitionGroup.MV.getType());
    assertEquals("M5", TransitionGroup.MV.getIupac());
  }
}
