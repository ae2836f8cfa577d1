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

import static java.lang.String.format;
import static org.apache.commons.math3.util.FastMath.max;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import xlines.descriptor.Transition;
import xlines.descriptor.TransitionSet;

/**
 * The XRayTransitionSet class is an immutable set of X-ray transitions of one element, e.g. the
 * members of the Fe Kα group. Iteration follows the transition ordering.
 * <p>
 * Two sets are equal if they have the same members. Sets are ordered by atomic number, then by
 * their sorted catalog indices compared one by one (a missing index counts as larger than any
 * index), in decreasing order.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class XRayTransitionSet extends AbstractXRayTransition
    implements Iterable<XRayTransition>, Comparable<XRayTransitionSet> {

  private final Set<XRayTransition> transitions;
  private XRayTransition mostProbable = null;

  /**
   * Constructor for XRayTransitionSet.
   *
   * @param z           the atomic number of all transitions.
   * @param symbol      the chemical symbol.
   * @param siegbahn    the Siegbahn label (e.g. Kα).
   * @param iupac       the IUPAC label (e.g. K-L(2,3)).
   * @param transitions the member transitions.
   * @throws IllegalArgumentException if there are no transitions or they belong to other elements.
   */
  public XRayTransitionSet(int z, String symbol, String siegbahn, String iupac,
      Collection<XRayTransition> transitions) {
    super(z, symbol, siegbahn, iupac);
    if (transitions == null || transitions.isEmpty()) {
      throw new IllegalArgumentException(" A transition set must contain at least one transition.");
    }
    for (XRayTransition transition : transitions) {
      if (transition.getZ() != z) {
        throw new IllegalArgumentException(
            format(" All transitions of a set must have atomic number %d (found %s).", z,
                transition));
      }
    }
    this.transitions = Collections.unmodifiableSet(new TreeSet<>(transitions));
  }

  /**
   * Member transitions, in transition order.
   *
   * @return an unmodifiable Set.
   */
  public Set<XRayTransition> getTransitions() {
    return transitions;
  }

  public int size() {
    return transitions.size();
  }

  public boolean contains(XRayTransition transition) {
    return transitions.contains(transition);
  }

  /**
   * Member with the largest probability. Ties go to the first member in transition order.
   *
   * @return the most probable transition.
   */
  public synchronized XRayTransition getMostProbable() {
    if (mostProbable == null) {
      double maxProbability = Double.NEGATIVE_INFINITY;
      for (XRayTransition transition : transitions) {
        double probability = transition.getProbability();
        if (probability > maxProbability) {
          maxProbability = probability;
          mostProbable = transition;
        }
      }
    }
    return mostProbable;
  }

  /**
   * Transition descriptors of the members.
   *
   * @return the interned TransitionSet.
   */
  public TransitionSet getTransitionSet() {
    List<Transition> descriptors = new ArrayList<>(transitions.size());
    for (XRayTransition transition : transitions) {
      descriptors.add(transition.getTransition());
    }
    return TransitionSet.of(descriptors);
  }

  /** {@inheritDoc} */
  @Override
  public Iterator<XRayTransition> iterator() {
    return transitions.iterator();
  }

  /** {@inheritDoc} */
  @Override
  public int compareTo(XRayTransitionSet other) {
    int c = Integer.compare(z, other.z);
    if (c != 0) {
      return c;
    }
    int[] indices = sortedIndices();
    int[] otherIndices = other.sortedIndices();
    int sentinel = TransitionCatalog.size();
    int n = max(indices.length, otherIndices.length);
    for (int i = 0; i < n; i++) {
      int index = (i < indices.length) ? indices[i] : sentinel;
      int otherIndex = (i < otherIndices.length) ? otherIndices[i] : sentinel;
      c = Integer.compare(index, otherIndex);
      if (c != 0) {
        return -c;
      }
    }
    return 0;
  }

  private int[] sortedIndices() {
    // Members iterate by decreasing index.
    int[] indices = new int[transitions.size()];
    int i = indices.length;
    for (XRayTransition transition : transitions) {
      indices[--i] = transition.getIndex();
    }
    return indices;
  }

  /** {@inheritDoc} */
  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    return transitions.equals(((XRayTransitionSet) o).transitions);
  }

  /** {@inheritDoc} */
  @Override
  public int hashCode() {
    return transitions.hashCode();
  }
}
