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
package xlines.data;

import java.util.Locale;
import xlines.descriptor.AtomicSubshell;
import xlines.descriptor.Descriptor;
import xlines.descriptor.Language;
import xlines.descriptor.Transition;

/**
 * The PropertyKind enum lists the physical and naming properties held by a property store. Each
 * kind declares the type of its values, the descriptor type that qualifies its subject (if any), and the
 * keyword used for it in property tables.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public enum PropertyKind {

  /** Chemical symbol of an element. */
  ELEMENT_SYMBOL(String.class, null, ""),
  /** Name of an element in a given language. */
  ELEMENT_NAME(String.class, Language.class, ""),
  /** Standard atomic weight. */
  ELEMENT_ATOMIC_WEIGHT(Double.class, null, ""),
  /** Mass density (kg/m^3). */
  ELEMENT_MASS_DENSITY(Double.class, null, "kg/m^3"),
  /** Ionization energy of a subshell (eV). */
  SUBSHELL_ENERGY(Double.class, AtomicSubshell.class, "eV"),
  /** Natural width of a subshell (eV). */
  SUBSHELL_WIDTH(Double.class, AtomicSubshell.class, "eV"),
  /** Energy of a transition (eV). */
  TRANSITION_ENERGY(Double.class, Transition.class, "eV"),
  /** Relative probability of a transition. */
  TRANSITION_PROBABILITY(Double.class, Transition.class, ""),
  /** Natural width of a transition line (eV). */
  TRANSITION_WIDTH(Double.class, Transition.class, "eV");

  private final Class<?> valueType;
  private final Class<? extends Descriptor> qualifierType;
  private final String unit;

  PropertyKind(Class<?> valueType, Class<? extends Descriptor> qualifierType, String unit) {
    this.valueType = valueType;
    this.qualifierType = qualifierType;
    this.unit = unit;
  }

  /**
   * Keyword of this kind in property tables (e.g. transition_energy).
   *
   * @return the keyword.
   */
  public String getKeyword() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Type of the values of this kind (String or Double).
   *
   * @return the value type.
   */
  public Class<?> getValueType() {
    return valueType;
  }

  /**
   * Descriptor type that qualifies the subject of this kind.
   *
   * @return the qualifier type, or null if the element alone is the subject.
   */
  public Class<? extends Descriptor> getQualifierType() {
    return qualifierType;
  }

  public String getUnit() {
    return unit;
  }

  public boolean isQualified() {
    return qualifierType != null;
  }

  /**
   * Find the kind with the given table keyword.
   *
   * @param keyword the keyword (case-insensitive).
   * @return the PropertyKind, or null if the keyword is unknown.
   */
  public static PropertyKind fromKeyword(String keyword) {
    if (keyword == null) {
      return null;
    }
    for (PropertyKind kind : values()) {
      if (kind.getKeyword().equalsIgnoreCase(keyword.trim())) {
        return kind;
      }
    }
    return null;
  }
}
