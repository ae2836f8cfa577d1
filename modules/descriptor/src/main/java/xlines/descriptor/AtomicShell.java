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
 * The AtomicShell class identifies an electron shell by its principal quantum number.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class AtomicShell implements Descriptor, Comparable<AtomicShell> {

  /** Shell letters for n = 1 to 7. */
  private static final String LETTERS = "KLMNOPQ";

  private final int principalQuantumNumber;

  private AtomicShell(int principalQuantumNumber) {
    this.principalQuantumNumber = principalQuantumNumber;
  }

  /**
   * Returns the interned AtomicShell with the given principal quantum number.
   *
   * @param principalQuantumNumber n, at least 1.
   * @return the AtomicShell.
   * @throws InvalidDescriptorException if n is smaller than 1.
   */
  public static AtomicShell of(int principalQuantumNumber) {
    return DescriptorCache.intern(AtomicShell.class, new Object[] {principalQuantumNumber}, () -> {
      if (principalQuantumNumber < 1) {
        throw new InvalidDescriptorException(AtomicShell.class, principalQuantumNumber,
            format("Principal quantum number (%d) must be [1, inf[", principalQuantumNumber));
      }
      return new AtomicShell(principalQuantumNumber);
    });
  }

  /**
   * Returns the shell whose letter (K, L, M, ...) is given.
   *
   * @param letter the shell letter.
   * @return the AtomicShell.
   * @throws InvalidDescriptorException if the letter is unknown.
   */
  public static AtomicShell fromLetter(char letter) {
    int index = LETTERS.indexOf(letter);
    if (index < 0) {
      throw new InvalidDescriptorException(AtomicShell.class, letter,
          format("Unknown shell letter (%c), expected one of %s", letter, LETTERS));
    }
    return of(index + 1);
  }

  /**
   * Getter for the field <code>principalQuantumNumber</code>.
   *
   * @return n.
   */
  public int getPrincipalQuantumNumber() {
    return principalQuantumNumber;
  }

  /**
   * Short form of {@link #getPrincipalQuantumNumber()}.
   *
   * @return n.
   */
  public int getN() {
    return principalQuantumNumber;
  }

  /**
   * IUPAC name of the shell: K, L, M, N, O, P or Q. Shells beyond Q are named by n.
   *
   * @return the IUPAC name.
   */
  public String getIupac() {
    if (principalQuantumNumber <= LETTERS.length()) {
      return String.valueOf(LETTERS.charAt(principalQuantumNumber - 1));
    }
    return Integer.toString(principalQuantumNumber);
  }

  /**
   * Siegbahn name of the shell, which is identical to its IUPAC name.
   *
   * @return the Siegbahn name.
   */
  public String getSiegbahn() {
    return getIupac();
  }

  /** {@inheritDoc} */
  @Override
  public int compareTo(AtomicShell other) {
    return Integer.compare(principalQuantumNumber, other.principalQuantumNumber);
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
    return principalQuantumNumber == ((AtomicShell) o).principalQuantumNumber;
  }

  /** {@inheritDoc} */
  @Override
  public int hashCode() {
    return Integer.hashCode(principalQuantumNumber);
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return format("AtomicShell(n=%d)", principalQuantumNumber);
  }
}
