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

import static java.lang.String.format;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * The TransitionSet class is an unordered, deduplicated group of transitions, e.g. the members of a
 * Siegbahn line group.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class TransitionSet implements Descriptor, Iterable<Transition> {

  private final Set<Transition> transitions;

  private TransitionSet(Set<Transition> transitions) {
    this.transitions = transitions;
  }

  /**
   * Returns the interned TransitionSet.
   *
   * @param transitions the member transitions.
   * @return the TransitionSet.
   */
  public static TransitionSet of(Transition... transitions) {
    return of(Arrays.asList(transitions));
  }

  /**
   * Returns the interned TransitionSet. Duplicate members are removed.
   *
   * @param transitions the member transitions.
   * @return the TransitionSet.
   * @throws InvalidDescriptorException if the collection is empty or contains null.
   */
  public static TransitionSet of(Collection<Transition> transitions) {
    Set<Transition> members = new LinkedHashSet<>(transitions);
    return DescriptorCache.intern(TransitionSet.class, new Object[] {members}, () -> {
      if (members.isEmpty()) {
        throw new InvalidDescriptorException(TransitionSet.class, members,
            "A transition set must contain at least one transition");
      }
      if (members.contains(null)) {
        throw new InvalidDescriptorException(TransitionSet.class, members,
            "A transition set cannot contain null");
      }
      return new TransitionSet(Collections.unmodifiableSet(members));
    });
  }

  /**
   * Getter for the field <code>transitions</code>.
   *
   * @return an unmodifiable Set of the member transitions.
   */
  public Set<Transition> getTransitions() {
    return transitions;
  }

  public int size() {
    return transitions.size();
  }

  public boolean contains(Transition transition) {
    return transitions.contains(transition);
  }

  /** {@inheritDoc} */
  @Override
  public Iterator<Transition> iterator() {
    return transitions.iterator();
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
    return transitions.equals(((TransitionSet) o).transitions);
  }

  /** {@inheritDoc} */
  @Override
  public int hashCode() {
    return transitions.hashCode();
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return format("TransitionSet(%d transitions)", transitions.size());
  }
}
