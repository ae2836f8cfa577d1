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
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;
import static xlines.utilities.Constants.METERS_TO_ANG;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.Before;
import org.junit.Test;
import xlines.data.AmbiguousReferenceException;
import xlines.data.PropertyNotFoundException;
import xlines.descriptor.AtomicSubshell;
import xlines.descriptor.Transition;
import xlines.descriptor.TransitionSet;
import xlines.utilities.XLinesTest;

/**
 * Tests values, identity and ordering of transitions and transition sets.
 *
 * @author Michael J. Schnieders
 */
public class XRayTransitionTest extends XLinesTest {

  private static final double tolerance = 1.0e-9;

  private XRayTransitions xrays;

  @Before
  public void setUp() {
    xrays = XRayTransitionsTest.loadLines();
  }

  @Test
  public void testDescriptors() {
    XRayTransition ka1 = xrays.transition(26, "Ka1");
    assertEquals(AtomicSubshell.fromIupac("L3"), ka1.getSource());
    assertEquals(AtomicSubshell.fromIupac("K"), ka1.getDestination());
    assertEquals(Transition.fromIupac("K-L3"), ka1.getTransition());
    assertTrue(ka1.isDiagramLine());
    assertEquals(0, ka1.getSatellite());

    XRayTransition ka3 = xrays.transition(26, "Ka3");
    assertTrue(ka3.isSatellite());
    assertEquals(1, ka3.getSatellite());
    assertEquals("K-L3[1]", ka3.getIupac());
  }

  @Test
  public void testValues() {
    XRayTransition ka1 = xrays.transition(26, "Ka1");
    assertEquals(6403.84, ka1.getEnergy(), tolerance);
    assertEquals(6404.148, ka1.getEnergy("deslattes2003"), tolerance);
    assertEquals(0.58, ka1.getProbability(), tolerance);
    assertEquals(2.55, ka1.getWidth(), tolerance);
  }

  @Test
  public void testReferencePriority() {
    XRayTransition ka1 = xrays.transition(26, "Ka1");
    XRayTransition ka2 = xrays.transition(26, "Ka2");
    xrays.getDatabase().getResolver().setReferencePriority("deslattes2003", "bearden1967");
    assertEquals(6404.148, ka1.getEnergy(), tolerance);
    // Only one reference reports Ka2.
    assertEquals(6390.84, ka2.getEnergy(), tolerance);
  }

  @Test(expected = AmbiguousReferenceException.class)
  public void testMissingReference() {
    xrays.transition(26, "Ka2").getEnergy("deslattes2003");
  }

  @Test(expected = PropertyNotFoundException.class)
  public void testMissingWidth() {
    xrays.transition(26, "Ka2").getWidth();
  }

  @Test
  public void testWavelength() {
    XRayTransition cuKa1 = xrays.transition(29, "Ka1");
    assertEquals(1.5406, cuKa1.getWavelength() * METERS_TO_ANG, 1.0e-3);
  }

  @Test
  public void testIdentity() {
    XRayTransition ka1 = xrays.transition(26, "Ka1");
    XRayTransition other = (XRayTransition) xrays.fromString("Fe K-L3");
    assertEquals(ka1, other);
    assertEquals(ka1.hashCode(), other.hashCode());
    assertNotEquals(ka1, xrays.transition(29, "Ka1"));
    assertNotEquals(ka1, xrays.transition(26, "Ka3"));
  }

  @Test
  public void testOrdering() {
    XRayTransition feKa1 = xrays.transition(26, "Ka1");
    XRayTransition feKb1 = xrays.transition(26, "Kb1");
    XRayTransition feLa1 = xrays.transition(26, "La1");
    XRayTransition cuKa1 = xrays.transition(29, "Ka1");
    assertTrue(feKa1.compareTo(cuKa1) < 0);
    assertTrue(feKa1.compareTo(feKb1) > 0);
    assertEquals(0, feKa1.compareTo(xrays.transition(26, "Ka1")));

    List<XRayTransition> sorted = Arrays.asList(cuKa1, feKa1, feLa1, feKb1);
    Collections.sort(sorted);
    assertEquals(Arrays.asList(feLa1, feKb1, feKa1, cuKa1), sorted);
  }

  @Test
  public void testMostProbable() {
    assertEquals(xrays.transition(26, "Ka1"),
        xrays.group(26, TransitionGroup.KA).getMostProbable());
    assertEquals(xrays.transition(26, "Kb1"),
        xrays.group(26, TransitionGroup.KB).getMostProbable());
    assertEquals(xrays.transition(26, "La1"), xrays.group(26, TransitionGroup.L).getMostProbable());
    assertEquals(xrays.transition(8, "Ka1"), xrays.group(8, TransitionGroup.K).getMostProbable());
  }

  @Test
  public void testSetEquality() {
    XRayTransitionSet ka = xrays.group(26, TransitionGroup.KA);
    XRayTransitionSet same = new XRayTransitionSet(26, "Fe", "Kα", "K-L(2,3)",
        Arrays.asList(xrays.transition(26, "Ka2"), xrays.transition(26, "Ka1")));
    assertEquals(ka, same);
    assertEquals(ka.hashCode(), same.hashCode());
    assertEquals(0, ka.compareTo(same));
    assertNotEquals(ka, xrays.group(29, TransitionGroup.KA));
  }

  @Test
  public void testSetOrdering() {
    XRayTransitionSet ka = xrays.group(26, TransitionGroup.KA);
    XRayTransitionSet kb = xrays.group(26, TransitionGroup.KB);
    XRayTransitionSet ka1 = new XRayTransitionSet(26, "Fe", "Kα1", "K-L3",
        Collections.singletonList(xrays.transition(26, "Ka1")));
    assertTrue(ka.compareTo(kb) > 0);
    assertTrue(kb.compareTo(ka) < 0);
    // A shorter index sequence is padded with a value larger than any index.
    assertTrue(ka1.compareTo(ka) < 0);
    assertTrue(ka.compareTo(ka1) > 0);
    assertTrue(ka.compareTo(xrays.group(29, TransitionGroup.KA)) < 0);
  }

  @Test
  public void testTransitionSetDescriptor() {
    TransitionSet expected = TransitionSet.of(Transition.fromIupac("K-L3"),
        Transition.fromIupac("K-L2"));
    assertEquals(expected, xrays.group(26, TransitionGroup.KA).getTransitionSet());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testEmptySet() {
    new XRayTransitionSet(26, "Fe", "Kα", "K-L(2,3)", Collections.emptyList());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testMixedElements() {
    new XRayTransitionSet(26, "Fe", "Kα1", "K-L3",
        Arrays.asList(xrays.transition(26, "Ka1"), xrays.transition(29, "Ka1")));
  }

  @Test(expected = UnsupportedOperationException.class)
  public void testSetIsUnmodifiable() {
    xrays.group(26, TransitionGroup.KA).getTransitions().clear();
  }

  @Test
  public void testSetIsIterable() {
    int count = 0;
    for (XRayTransition transition : xrays.group(26, TransitionGroup.LIII)) {
      assertFalse(transition.isSatellite());
      count++;
    }
    assertEquals(3, count);
  }
}
