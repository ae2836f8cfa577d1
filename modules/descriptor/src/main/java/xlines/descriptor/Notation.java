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

import java.util.Locale;

/**
 * The Notation class identifies a naming convention (e.g. siegbahn or iupac). Names are stored in
 * lowercase.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class Notation implements Descriptor {

  private final String name;

  private Notation(String name) {
    this.name = name;
  }

  /**
   * Returns the interned Notation.
   *
   * @param name the notation name (case-insensitive).
   * @return the Notation.
   * @throws InvalidDescriptorException if the name is null or blank.
   */
  public static Notation of(String name) {
    return DescriptorCache.intern(Notation.class, new Object[] {name}, () -> {
      if (name == null || name.trim().isEmpty()) {
        throw new InvalidDescriptorException(Notation.class, name, "Name must be defined");
      }
      return new Notation(name.trim().toLowerCase(Locale.ROOT));
    });
  }

  public String getName() {
    return name;
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
    return name.equals(((Notation) o).name);
  }

  /** {@inheritDoc} */
  @Override
  public int hashCode() {
    return name.hashCode();
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return format("Notation(%s)", name);
  }
}
