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

import static java.lang.String.format;

import java.util.Objects;
import xlines.descriptor.Descriptor;
import xlines.descriptor.Element;

/**
 * The PropertySubject class is the thing a property describes: an element, optionally qualified by
 * a language, a subshell or a transition.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class PropertySubject {

  private final Element element;
  private final Descriptor qualifier;

  /**
   * Constructor for an element subject.
   *
   * @param element the element.
   */
  public PropertySubject(Element element) {
    this(element, null);
  }

  /**
   * Constructor for a qualified subject.
   *
   * @param element   the element.
   * @param qualifier a Language, AtomicSubshell or Transition (may be null).
   */
  public PropertySubject(Element element, Descriptor qualifier) {
    this.element = Objects.requireNonNull(element, "element");
    this.qualifier = qualifier;
  }

  /**
   * Create a subject from an atomic number.
   *
   * @param z         the atomic number.
   * @param qualifier the qualifier (may be null).
   * @return the PropertySubject.
   */
  public static PropertySubject of(int z, Descriptor qualifier) {
    return new PropertySubject(Element.of(z), qualifier);
  }

  public Element getElement() {
    return element;
  }

  public Descriptor getQualifier() {
    return qualifier;
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
    PropertySubject other = (PropertySubject) o;
    return element.equals(other.element) && Objects.equals(qualifier, other.qualifier);
  }

  /** {@inheritDoc} */
  @Override
  public int hashCode() {
    return Objects.hash(element, qualifier);
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    if (qualifier == null) {
      return element.toString();
    }
    return format("%s %s", element, qualifier);
  }
}
