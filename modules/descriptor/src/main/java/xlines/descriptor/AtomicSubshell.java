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
import static org.apache.commons.math3.util.FastMath.abs;

import java.util.Comparator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The AtomicSubshell class identifies an electron subshell by its principal quantum number n, its
 * azimuthal quantum number l and the numerator j_n of its total angular momentum j = j_n / 2.
 * <p>
 * Valid subshells satisfy 0 &lt;= l &lt;= n - 1 and j = l &plusmn; 1/2, i.e. j_n is either 2|l -
 * 0.5| or 2|l + 0.5|.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class AtomicSubshell implements Descriptor, Comparable<AtomicSubshell> {

  private static final Comparator<AtomicSubshell> ORDER =
      Comparator.comparing(AtomicSubshell::getAtomicShell)
          .thenComparingInt(AtomicSubshell::getAzimuthalQuantumNumber)
          .thenComparingInt(AtomicSubshell::getTotalAngularMomentumNumerator);

  private static final Pattern IUPAC_PATTERN = Pattern.compile("([A-Z])(\\d*)");
  private static final Pattern SIEGBAHN_PATTERN = Pattern.compile("([A-Z])([IVX]*)");
  private static final String[] ROMAN_UNITS = {"", "I", "II", "III", "IV", "V", "VI", "VII",
      "VIII", "IX"};
  private static final String[] ROMAN_TENS = {"", "X", "XX", "XXX"};

  private final AtomicShell atomicShell;
  private final int azimuthalQuantumNumber;
  private final int totalAngularMomentumNumerator;

  private AtomicSubshell(AtomicShell atomicShell, int azimuthalQuantumNumber,
      int totalAngularMomentumNumerator) {
    this.atomicShell = atomicShell;
    this.azimuthalQuantumNumber = azimuthalQuantumNumber;
    this.totalAngularMomentumNumerator = totalAngularMomentumNumerator;
  }

  /**
   * Returns the interned AtomicSubshell for the given quantum numbers.
   *
   * @param principalQuantumNumber        n.
   * @param azimuthalQuantumNumber        l.
   * @param totalAngularMomentumNumerator j_n (twice the total angular momentum).
   * @return the AtomicSubshell.
   * @throws InvalidDescriptorException if the quantum numbers are not consistent.
   */
  public static AtomicSubshell of(int principalQuantumNumber, int azimuthalQuantumNumber,
      int totalAngularMomentumNumerator) {
    return DescriptorCache.intern(AtomicSubshell.class,
        new Object[] {principalQuantumNumber, azimuthalQuantumNumber,
            totalAngularMomentumNumerator},
        () -> create(AtomicShell.of(principalQuantumNumber), azimuthalQuantumNumber,
            totalAngularMomentumNumerator));
  }

  /**
   * Returns the interned AtomicSubshell for the given shell and quantum numbers.
   *
   * @param atomicShell                   the shell.
   * @param azimuthalQuantumNumber        l.
   * @param totalAngularMomentumNumerator j_n (twice the total angular momentum).
   * @return the AtomicSubshell.
   * @throws InvalidDescriptorException if the quantum numbers are not consistent.
   */
  public static AtomicSubshell of(AtomicShell atomicShell, int azimuthalQuantumNumber,
      int totalAngularMomentumNumerator) {
    return DescriptorCache.intern(AtomicSubshell.class,
        new Object[] {atomicShell, azimuthalQuantumNumber, totalAngularMomentumNumerator},
        () -> create(atomicShell, azimuthalQuantumNumber, totalAngularMomentumNumerator));
  }

  private static AtomicSubshell create(AtomicShell atomicShell, int l, int jn) {
    if (atomicShell == null) {
      throw new InvalidDescriptorException(AtomicSubshell.class, null,
          "Atomic shell cannot be null");
    }
    int lmin = 0;
    int lmax = atomicShell.getPrincipalQuantumNumber() - 1;
    int jminN = (int) (2.0 * abs(l - 0.5));
    int jmaxN = (int) (2.0 * abs(l + 0.5));

    if (l < lmin || l > lmax) {
      throw new InvalidDescriptorException(AtomicSubshell.class, l,
          format("Azimuthal quantum number (%d) must be between [%d, %d]", l, lmin, lmax));
    }
    if (jn < jminN || jn > jmaxN || (jn != jminN && jn != jmaxN)) {
      throw new InvalidDescriptorException(AtomicSubshell.class, jn,
          format("Total angular momentum numerator (%d) must be %d or %d (between [%d, %d])", jn,
              jminN, jmaxN, jminN, jmaxN));
    }
    return new AtomicSubshell(atomicShell, l, jn);
  }

  /**
   * Parse an IUPAC subshell name such as K, L3 or N7.
   *
   * @param iupac the IUPAC name.
   * @return the AtomicSubshell.
   * @throws InvalidDescriptorException if the name is not a valid subshell.
   */
  public static AtomicSubshell fromIupac(String iupac) {
    Matcher matcher = (iupac == null) ? null : IUPAC_PATTERN.matcher(iupac.trim());
    if (matcher == null || !matcher.matches()) {
      throw new InvalidDescriptorException(AtomicSubshell.class, iupac,
          format("Unknown IUPAC subshell name (%s)", iupac));
    }
    AtomicShell shell = AtomicShell.fromLetter(matcher.group(1).charAt(0));
    String digits = matcher.group(2);
    if (digits.isEmpty()) {
      if (shell.getN() != 1) {
        throw new InvalidDescriptorException(AtomicSubshell.class, iupac,
            format("IUPAC subshell name (%s) requires an index", iupac));
      }
      return of(shell, 0, 1);
    }
    int position;
    try {
      position = Integer.parseInt(digits);
    } catch (NumberFormatException e) {
      throw new InvalidDescriptorException(AtomicSubshell.class, iupac,
          format("IUPAC subshell index of (%s) is out of range", iupac));
    }
    return fromPosition(shell, position, iupac);
  }

  /**
   * Parse a Siegbahn subshell name such as K, LIII or NVII.
   *
   * @param siegbahn the Siegbahn name.
   * @return the AtomicSubshell.
   * @throws InvalidDescriptorException if the name is not a valid subshell.
   */
  public static AtomicSubshell fromSiegbahn(String siegbahn) {
    Matcher matcher = (siegbahn == null) ? null : SIEGBAHN_PATTERN.matcher(siegbahn.trim());
    if (matcher == null || !matcher.matches()) {
      throw new InvalidDescriptorException(AtomicSubshell.class, siegbahn,
          format("Unknown Siegbahn subshell name (%s)", siegbahn));
    }
    AtomicShell shell = AtomicShell.fromLetter(matcher.group(1).charAt(0));
    String numeral = matcher.group(2);
    if (numeral.isEmpty()) {
      if (shell.getN() != 1) {
        throw new InvalidDescriptorException(AtomicSubshell.class, siegbahn,
            format("Siegbahn subshell name (%s) requires a numeral", siegbahn));
      }
      return of(shell, 0, 1);
    }
    for (int position = 1; position < 40; position++) {
      if (roman(position).equals(numeral)) {
        return fromPosition(shell, position, siegbahn);
      }
    }
    throw new InvalidDescriptorException(AtomicSubshell.class, siegbahn,
        format("Unknown Siegbahn subshell numeral (%s)", numeral));
  }

  /**
   * Subshells of a shell are numbered from 1 in order of increasing (l, j): s1/2, p1/2, p3/2, d3/2,
   * d5/2, ...
   */
  private static AtomicSubshell fromPosition(AtomicShell shell, int position, String name) {
    if (position < 1) {
      throw new InvalidDescriptorException(AtomicSubshell.class, name,
          format("Subshell index of (%s) must be positive", name));
    }
    if (position == 1) {
      return of(shell, 0, 1);
    }
    int l = position / 2;
    int jn = (position % 2 == 0) ? 2 * l - 1 : 2 * l + 1;
    return of(shell, l, jn);
  }

  private static String roman(int value) {
    return ROMAN_TENS[value / 10] + ROMAN_UNITS[value % 10];
  }

  /**
   * Getter for the field <code>atomicShell</code>.
   *
   * @return the shell.
   */
  public AtomicShell getAtomicShell() {
    return atomicShell;
  }

  /**
   * The principal quantum number of the shell.
   *
   * @return n.
   */
  public int getPrincipalQuantumNumber() {
    return atomicShell.getPrincipalQuantumNumber();
  }

  /**
   * Short form of {@link #getPrincipalQuantumNumber()}.
   *
   * @return n.
   */
  public int getN() {
    return getPrincipalQuantumNumber();
  }

  /**
   * Getter for the field <code>azimuthalQuantumNumber</code>.
   *
   * @return l.
   */
  public int getAzimuthalQuantumNumber() {
    return azimuthalQuantumNumber;
  }

  /**
   * Short form of {@link #getAzimuthalQuantumNumber()}.
   *
   * @return l.
   */
  public int getL() {
    return azimuthalQuantumNumber;
  }

  /**
   * Getter for the field <code>totalAngularMomentumNumerator</code>.
   *
   * @return j_n.
   */
  public int getTotalAngularMomentumNumerator() {
    return totalAngularMomentumNumerator;
  }

  /**
   * Short form of {@link #getTotalAngularMomentumNumerator()}.
   *
   * @return j_n.
   */
  public int getJn() {
    return totalAngularMomentumNumerator;
  }

  /**
   * The total angular momentum j = j_n / 2.
   *
   * @return j.
   */
  public double getTotalAngularMomentum() {
    return totalAngularMomentumNumerator / 2.0;
  }

  /**
   * Short form of {@link #getTotalAngularMomentum()}.
   *
   * @return j.
   */
  public double getJ() {
    return getTotalAngularMomentum();
  }

  /**
   * 1-based position of this subshell within its shell.
   *
   * @return the position.
   */
  private int getPosition() {
    if (azimuthalQuantumNumber == 0) {
      return 1;
    }
    return 2 * azimuthalQuantumNumber
        + (totalAngularMomentumNumerator - (2 * azimuthalQuantumNumber - 1)) / 2;
  }

  /**
   * IUPAC name of the subshell (K, L1, L2, L3, M1, ...).
   *
   * @return the IUPAC name.
   */
  public String getIupac() {
    if (getN() == 1) {
      return atomicShell.getIupac();
    }
    return atomicShell.getIupac() + getPosition();
  }

  /**
   * Siegbahn name of the subshell (K, LI, LII, LIII, MI, ...).
   *
   * @return the Siegbahn name.
   */
  public String getSiegbahn() {
    if (getN() == 1) {
      return atomicShell.getSiegbahn();
    }
    return atomicShell.getSiegbahn() + roman(getPosition());
  }

  /** {@inheritDoc} */
  @Override
  public int compareTo(AtomicSubshell other) {
    return ORDER.compare(this, other);
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
    AtomicSubshell other = (AtomicSubshell) o;
    return atomicShell.equals(other.atomicShell)
        && azimuthalQuantumNumber == other.azimuthalQuantumNumber
        && totalAngularMomentumNumerator == other.totalAngularMomentumNumerator;
  }

  /** {@inheritDoc} */
  @Override
  public int hashCode() {
    int result = atomicShell.hashCode();
    result = 31 * result + azimuthalQuantumNumber;
    result = 31 * result + totalAngularMomentumNumerator;
    return result;
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return format("AtomicSubshell(n=%d, l=%d, j=%.1f)", getN(), azimuthalQuantumNumber, getJ());
  }
}
