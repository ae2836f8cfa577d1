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
import xlines.descriptor.Reference;

/**
 * The PropertyRow class holds one value of one property, for one subject, as reported by one
 * reference.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class PropertyRow {

  private final PropertyKind kind;
  private final PropertySubject subject;
  private final Reference reference;
  private final Object value;

  /**
   * Constructor for PropertyRow.
   *
   * @param kind      the property kind.
   * @param subject   the subject.
   * @param reference the reference reporting the value.
   * @param value     the value, of the kind's value type.
   * @throws IllegalArgumentException if the qualifier or the value do not match the kind.
   */
  public PropertyRow(PropertyKind kind, PropertySubject subject, Reference reference,
      Object value) {
    this.kind = Objects.requireNonNull(kind, "kind");
    this.subject = Objects.requireNonNull(subject, "subject");
    this.reference = Objects.requireNonNull(reference, "reference");
    this.value = Objects.requireNonNull(value, "value");

    Descriptor qualifier = subject.getQualifier();
    Class<? extends Descriptor> qualifierType = kind.getQualifierType();
    if (qualifierType == null && qualifier != null) {
      throw new IllegalArgumentException(
          format(" Property %s does not accept the qualifier %s.", kind, qualifier));
    }
    if (qualifierType != null && !qualifierType.isInstance(qualifier)) {
      throw new IllegalArgumentException(
          format(" Property %s requires a %s qualifier (found %s).", kind,
              qualifierType.getSimpleName(), qualifier));
    }
    if (!kind.getValueType().isInstance(value)) {
      throw new IllegalArgumentException(
          format(" Property %s requires a %s value (found %s).", kind,
              kind.getValueType().getSimpleName(), value.getClass().getSimpleName()));
    }
  }

  public PropertyKind getKind() {
    return kind;
  }

  public PropertySubject getSubject() {
    return subject;
  }

  public Reference getReference() {
    return reference;
  }

  public Object getValue() {
    return value;
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return format("%s %s = %s [%s]", kind.getKeyword(), subject, value,
        reference.getBibtexkey());
  }
}
