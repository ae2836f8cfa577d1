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

import java.util.List;
import xlines.descriptor.Reference;

/**
 * The PropertyStore interface is the backing table of property values queried by a {@link
 * PropertyResolver}.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public interface PropertyStore {

  /**
   * Check if a reference reports a value of the given property for the subject.
   *
   * @param kind      the property kind.
   * @param subject   the subject.
   * @param reference the reference.
   * @return true if a value exists.
   */
  boolean hasProperty(PropertyKind kind, PropertySubject subject, Reference reference);

  /**
   * Value of a property for a subject as reported by a reference.
   *
   * @param kind      the property kind.
   * @param subject   the subject.
   * @param reference the reference.
   * @return the value, or null if the reference reports no value.
   */
  Object getProperty(PropertyKind kind, PropertySubject subject, Reference reference);

  /**
   * References that report a value of the given property for the subject, in insertion order.
   *
   * @param kind    the property kind.
   * @param subject the subject.
   * @return the references (empty if there are none).
   */
  List<Reference> getReferences(PropertyKind kind, PropertySubject subject);

  /**
   * All rows of a property kind, in insertion order.
   *
   * @param kind the property kind.
   * @return the rows (empty if there are none).
   */
  List<PropertyRow> getRows(PropertyKind kind);
}
