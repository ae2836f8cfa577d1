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

/**
 * The Element class identifies a chemical element by its atomic number.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class Element implements Descriptor, Comparable<Element> {

  /** Smallest valid atomic number. */
  public static final int MIN_ATOMIC_NUMBER = 1;
  /** Largest valid atomic number. */
  public static final int MAX_ATOMIC_NUMBER = 118;

  private final int atomicNumber;

  private Element(int atomicNumber) {
    this.atomicNumber = atomicNumber;
  }

  /**
   * Returns the interned Element with the given atomic number.
   *
   * @param atomicNumber the atomic number in [1, 118].
   * @return the Element.
   * @throws InvalidDescriptorException if the atomic number is out of range.
   */
  public static Element of(int atomicNumber) {
    return DescriptorCache.intern(Element.class, new Object[] {atomicNumber}, () -> {
      if (atomicNumber < MIN_ATOMIC_NUMBER || atomicNumber > MAX_ATOMIC_NUMBER) {
        throw new InvalidDescriptorException(Element.class, atomicNumber,
            format("Atomic number (%d) must be [%d, %d]", atomicNumber, MIN_ATOMIC_NUMBER,
                MAX_ATOMIC_NUMBER));
      }
      return new Element(atomicNumber);
    });
  }

  /**
   * Getter for the field <code>atomicNumber</code>.
   *
   * @return the atomic number.
   */
  public int getAtomicNumber() {
    return atomicNumber;
  }

  /**
   * Short form of {@link #getAtomicNumber()}.
   *
   * @return the atomic number.
   */
  public int getZ() {
    return atomicNumber;
  }

  /** {@inheritDoc} */
  @Override
  public int compareTo(Element other) {
    return Integer.compare(atomicNumber, other.atomicNumber);
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
    return atomicNumber == ((Element) o).atomicNumber;
  }

  /** {@inheritDoc} */
  @Override
  public int hashCode() {
    return Integer.hashCode(atomicNumber);
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return format("Element(z=%d)", atomicNumber);
  }
}
