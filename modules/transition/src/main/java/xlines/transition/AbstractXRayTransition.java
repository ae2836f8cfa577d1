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

/**
 * The AbstractXRayTransition class holds what single X-ray transitions and sets of transitions have
 * in common: the element, and the Siegbahn and IUPAC names.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public abstract class AbstractXRayTransition {

  /** Atomic number. */
  protected final int z;
  /** Chemical symbol of the element. */
  protected final String symbol;
  /** Siegbahn name (Unicode). */
  protected final String siegbahn;
  /** IUPAC name. */
  protected final String iupac;

  /**
   * Constructor for AbstractXRayTransition.
   *
   * @param z        the atomic number.
   * @param symbol   the chemical symbol.
   * @param siegbahn the Siegbahn name (Unicode).
   * @param iupac    the IUPAC name.
   */
  protected AbstractXRayTransition(int z, String symbol, String siegbahn, String iupac) {
    this.z = z;
    this.symbol = symbol;
    this.siegbahn = siegbahn;
    this.iupac = iupac;
  }

  public int getZ() {
    return z;
  }

  public int getAtomicNumber() {
    return z;
  }

  public String getSymbol() {
    return symbol;
  }

  /**
   * Siegbahn name with Greek letters (e.g. Kα1).
   *
   * @return the Siegbahn name.
   */
  public String getSiegbahn() {
    return siegbahn;
  }

  /**
   * Siegbahn name with ASCII letters (e.g. Ka1).
   *
   * @return the ASCII Siegbahn name.
   */
  public String getSiegbahnAscii() {
    return SiegbahnNotation.toAscii(siegbahn);
  }

  /**
   * IUPAC name (e.g. K-L3).
   *
   * @return the IUPAC name.
   */
  public String getIupac() {
    return iupac;
  }

  /**
   * Element symbol followed by the ASCII Siegbahn name (e.g. Fe Ka1).
   *
   * @return the ASCII description.
   */
  @Override
  public String toString() {
    return format("%s %s", symbol, getSiegbahnAscii());
  }
}
