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

import xlines.descriptor.AtomicSubshell;

/**
 * The TransitionGroup enum lists the named groups of X-ray transitions: the families (K, L, M, N),
 * the Siegbahn line groups (Kα, Kβ, Lα, ...) and the shells (LI to MV), i.e. all transitions that
 * end on a given subshell.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public enum TransitionGroup {

  K(Type.FAMILY, "K", "K"),
  L(Type.FAMILY, "L", "L"),
  M(Type.FAMILY, "M", "M"),
  N(Type.FAMILY, "N", "N"),
  KA(Type.GROUP, "Kα", "K-L(2,3)"),
  KB(Type.GROUP, "Kβ", "K-M(2-5)N(2-5)"),
  LA(Type.GROUP, "Lα", "L3-M(4,5)"),
  LB(Type.GROUP, "Lβ", "L(1-3)-M(2-5)N(1,4-7)O(1,4-5)"),
  LG(Type.GROUP, "Lγ", "L(1,2)-N(1-6)O(1-3)"),
  MA(Type.GROUP, "Mα", "M5-N(6,7)"),
  MB(Type.GROUP, "Mβ", "M4-N6"),
  MG(Type.GROUP, "Mγ", "M3-N5"),
  LI(Type.SHELL, "LI", "L1"),
  LII(Type.SHELL, "LII", "L2"),
  LIII(Type.SHELL, "LIII", "L3"),
  MI(Type.SHELL, "MI", "M1"),
  MII(Type.SHELL, "MII", "M2"),
  MIII(Type.SHELL, "MIII", "M3"),
  MIV(Type.SHELL, "MIV", "M4"),
  MV(Type.SHELL, "MV", "M5");

  /** How the members of a group are selected from the catalog. */
  public enum Type {
    /** Siegbahn name starts with the shell letter. */
    FAMILY,
    /** Siegbahn name starts with the group label. */
    GROUP,
    /** Destination subshell is the shell of the group. */
    SHELL
  }

  private final Type type;
  private final String siegbahn;
  private final String iupac;

  TransitionGroup(Type type, String siegbahn, String iupac) {
    this.type = type;
    this.siegbahn = siegbahn;
    this.iupac = iupac;
  }

  public Type getType() {
    return type;
  }

  /**
   * Siegbahn label of the group (e.g. Kα or LIII).
   *
   * @return the Siegbahn label.
   */
  public String getSiegbahn() {
    return siegbahn;
  }

  /**
   * IUPAC label of the group (e.g. K-L(2,3) or L3).
   *
   * @return the IUPAC label.
   */
  public String getIupac() {
    return iupac;
  }

  /**
   * Check if a catalog entry belongs to this group.
   *
   * @param index the catalog index.
   * @return true if the entry is a member.
   */
  public boolean contains(int index) {
    switch (type) {
      case FAMILY:
      case GROUP:
        return TransitionCatalog.getSiegbahn(index).startsWith(siegbahn);
      case SHELL:
        AtomicSubshell destination = AtomicSubshell.fromIupac(iupac);
        return TransitionCatalog.getTransition(index).getDestinationSubshell().equals(destination);
      default:
        return false;
    }
  }

  /**
   * Find the group with the given Siegbahn label.
   *
   * @param siegbahn the Unicode Siegbahn label (e.g. Kα).
   * @return the TransitionGroup, or null if no group has this label.
   */
  public static TransitionGroup fromSiegbahn(String siegbahn) {
    for (TransitionGroup group : values()) {
      if (group.siegbahn.equals(siegbahn)) {
        return group;
      }
    }
    return null;
  }
}
