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
package xlines.descriptor;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import org.junit.Test;
import xlines.utilities.XLinesTest;

/**
 * Tests creation, validation and interning of the descriptor types.
 *
 * @author Michael J. Schnieders
 */
public class DescriptorTest extends XLinesTest {

  private final AtomicSubshell K = AtomicSubshell.of(1, 0, 1);
  private final AtomicSubshell L1 = AtomicSubshell.of(2, 0, 1);
  private final AtomicSubshell L2 = AtomicSubshell.of(2, 1, 1);
  private final AtomicSubshell L3 = AtomicSubshell.of(2, 1, 3);
  private final AtomicSubshell M3 = AtomicSubshell.of(3, 1, 3);

  @Test
  public void testElement() {
    Element iron = Element.of(26);
    assertEquals(26, iron.getAtomicNumber());
    assertEquals(26, iron.getZ());
    assertSame(iron, Element.of(26));
    assertEquals("Element(z=26)", iron.toString());
    assertTrue(Element.of(8).compareTo(iron) < 0);
  }

  @Test
  public void testElementRange() {
    assertEquals(1, Element.of(1).getZ());
    assertEquals(118, Element.of(118).getZ());
    for (int z : new int[] {0, -1, 119}) {
      try {
        Element.of(z);
        fail("Expected an InvalidDescriptorException for z = " + z);
      } catch (InvalidDescriptorException e) {
        assertEquals("Element", e.descriptor);
        assertEquals(z, e.value);
        assertTrue(e.getMessage().contains("[1, 118]"));
      }
    }
  }

  @Test
  public void testAtomicShell() {
    AtomicShell l = AtomicShell.of(2);
    assertEquals(2, l.getN());
    assertEquals("L", l.getIupac());
    assertEquals("L", l.getSiegbahn());
    assertSame(l, AtomicShell.fromLetter('L'));
    assertSame(AtomicShell.of(7), AtomicShell.fromLetter('Q'));
    assertTrue(AtomicShell.of(1).compareTo(l) < 0);
  }

  @Test(expected = InvalidDescriptorException.class)
  public void testAtomicShellInvalid() {
    AtomicShell.of(0);
  }

  @Test(expected = InvalidDescriptorException.class)
  public void testAtomicShellUnknownLetter() {
    AtomicShell.fromLetter('Z');
  }

  @Test
  public void testAtomicSubshellInvalid() {
    int[][] invalid = {{1, 1, 1}, {2, 0, 3}, {2, 1, 2}, {2, 1, 5}, {3, 3, 5}, {0, 0, 1}};
    for (int[] q : invalid) {
      try {
        AtomicSubshell.of(q[0], q[1], q[2]);
        fail("Expected an InvalidDescriptorException for " + Arrays.toString(q));
      } catch (InvalidDescriptorException e) {
        // Expected.
      }
    }
  }

  @Test
  public void testAtomicSubshellParseErrors() {
    for (String name : new String[] {"", "L", "L0", "L4", "k", "K2", "X1", "L99999999999"}) {
      try {
        AtomicSubshell.fromIupac(name);
        fail("Expected an InvalidDescriptorException for " + name);
      } catch (InvalidDescriptorException e) {
        // Expected.
      }
    }
    for (String name : new String[] {"", "L", "LIV", "L3", "MVI"}) {
      try {
        AtomicSubshell.fromSiegbahn(name);
        fail("Expected an InvalidDescriptorException for " + name);
      } catch (InvalidDescriptorException e) {
        // Expected.
      }
    }
  }

  @Test
  public void testAtomicSubshellOrder() {
    Set<AtomicSubshell> sorted = new TreeSet<>(Arrays.asList(M3, L3, K, L2, L1));
    assertEquals(Arrays.asList(K, L1, L2, L3, M3), new ArrayList<>(sorted));
  }

  @Test
  public void testAtomicSubshellInterning() {
    assertSame(L3, AtomicSubshell.of(AtomicShell.of(2), 1, 3));
    assertSame(L3, AtomicSubshell.fromIupac("L3"));
    assertSame(L3.getAtomicShell(), AtomicShell.of(2));
  }

  @Test
  public void testRadiativeTransition() {
    Transition ka1 = Transition.of(L3, K);
    assertSame(L3, ka1.getSourceSubshell());
    assertSame(K, ka1.getDestinationSubshell());
    assertNull(ka1.getSecondaryDestinationSubshell());
    assertTrue(ka1.isRadiative());
    assertFalse(ka1.isNonradiative());
    assertFalse(ka1.isCosterKronig());
    assertTrue(ka1.isDiagramLine());
    assertFalse(ka1.isSatellite());
    assertEquals("K-L3", ka1.getIupac());
    assertSame(ka1, Transition.of(AtomicSubshell.fromIupac("L3"), AtomicSubshell.fromIupac("K")));
  }

  @Test
  public void testNonradiativeTransition() {
    Transition auger = Transition.of(L2, K, L3);
    assertTrue(auger.isNonradiative());
    assertFalse(auger.isCosterKronig());
    assertEquals("K-L2L3", auger.getIupac());

    Transition costerKronig = Transition.of(L3, L1, M3);
    assertTrue(costerKronig.isCosterKronig());
  }

  @Test
  public void testTransitionFromIupac() {
    assertEquals(Transition.of(L3, K), Transition.fromIupac("K-L3"));
    assertEquals(Transition.of(L2, K, L3), Transition.fromIupac("K-L2L3"));
    assertEquals(Transition.of(L3, K), Transition.fromIupac(Transition.of(L3, K).getIupac()));
    assertEquals(Transition.of(L3, K, 1), Transition.fromIupac("K-L3[1]"));
    assertEquals("K-L3[1]", Transition.of(L3, K, 1).getIupac());
    String[] invalid = {"KL3", "K-", "-L3", "K-L3X", "K-L2L3M1", "K-L3-M1", "K-L3[x]",
        "K-L3[99999999999]"};
    for (String name : invalid) {
      try {
        Transition.fromIupac(name);
        fail("Expected an InvalidDescriptorException for " + name);
      } catch (InvalidDescriptorException e) {
        // Expected.
      }
    }
  }

  @Test
  public void testSatelliteTransition() {
    Transition diagram = Transition.of(L3, K);
    Transition satellite = Transition.of(L3, K, 1);
    assertTrue(satellite.isSatellite());
    assertFalse(satellite.isDiagramLine());
    assertEquals(1, satellite.getSatellite());
    assertNotEquals(diagram, satellite);
    assertSame(diagram, Transition.of(L3, K, 0));
  }

  @Test
  public void testTransitionInvalid() {
    try {
      Transition.of(L3, K, -1);
      fail("Expected an InvalidDescriptorException for a negative satellite index");
    } catch (InvalidDescriptorException e) {
      assertEquals("Transition", e.descriptor);
    }
    try {
      Transition.of(null, K);
      fail("Expected an InvalidDescriptorException for a missing source subshell");
    } catch (InvalidDescriptorException e) {
      assertEquals("Transition", e.descriptor);
    }
  }

  @Test
  public void testTransitionSet() {
    Transition ka1 = Transition.of(L3, K);
    Transition ka2 = Transition.of(L2, K);
    TransitionSet ka = TransitionSet.of(ka1, ka2, ka1);
    assertEquals(2, ka.size());
    assertTrue(ka.contains(ka1));
    assertSame(ka, TransitionSet.of(ka2, ka1));
    assertEquals(ka, TransitionSet.of(Arrays.asList(ka1, ka2)));

    List<Transition> members = new ArrayList<>();
    Iterator<Transition> iterator = ka.iterator();
    while (iterator.hasNext()) {
      members.add(iterator.next());
    }
    assertEquals(2, members.size());
  }

  @Test(expected = UnsupportedOperationException.class)
  public void testTransitionSetIsUnmodifiable() {
    TransitionSet.of(Transition.of(L3, K)).getTransitions().clear();
  }

  @Test(expected = InvalidDescriptorException.class)
  public void testTransitionSetEmpty() {
    TransitionSet.of(new ArrayList<>());
  }

  @Test
  public void testReference() {
    Reference reference = Reference.builder("doe2016")
        .author("John Doe")
        .year(2016)
        .title("Atomic data")
        .journal("J. Phys.")
        .doi("10.0000/example")
        .build();
    assertEquals("doe2016", reference.getBibtexkey());
    assertEquals(Integer.valueOf(2016), reference.getYear());
    assertEquals("John Doe", reference.getAuthor());
    assertNull(reference.getPublisher());
    assertEquals("Reference(doe2016)", reference.toString());

    Reference same = Reference.builder("doe2016")
        .author("John Doe").year(2016).title("Atomic data").journal("J. Phys.")
        .doi("10.0000/example").build();
    assertSame(reference, same);
    assertNotEquals(reference, Reference.of("doe2016"));
    assertSame(Reference.of("doe2016"), Reference.of("doe2016"));
  }

  @Test(expected = InvalidDescriptorException.class)
  public void testReferenceRequiresKey() {
    Reference.of(" ");
  }

  @Test
  public void testLanguage() {
    Language english = Language.of("EN");
    assertEquals("en", english.getCode());
    assertSame(english, Language.of("en"));
    assertEquals(Language.ENGLISH, english);
    assertEquals("deu", Language.of("deu").getCode());
    assertSame(english, Language.of(" en "));
    for (String code : new String[] {"e", "engl", "", " e ", "  "}) {
      try {
        Language.of(code);
        fail("Expected an InvalidDescriptorException for " + code);
      } catch (InvalidDescriptorException e) {
        assertEquals("Language", e.descriptor);
      }
    }
  }

  @Test
  public void testNotation() {
    Notation siegbahn = Notation.of("Siegbahn");
    assertEquals("siegbahn", siegbahn.getName());
    assertSame(siegbahn, Notation.of("siegbahn"));
    assertNotEquals(siegbahn, Notation.of("iupac"));
  }

  @Test(expected = InvalidDescriptorException.class)
  public void testNotationRequiresName() {
    Notation.of("");
  }
}
