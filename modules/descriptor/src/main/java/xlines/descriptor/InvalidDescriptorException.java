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
 * This exception is thrown when the arguments of a descriptor violate a range or a relation, for
 * example an azimuthal quantum number that is not smaller than the principal quantum number.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class InvalidDescriptorException extends IllegalArgumentException {

  /** Simple name of the descriptor type being created. */
  public final String descriptor;
  /** The offending value. */
  public final Object value;

  /**
   * Constructor for InvalidDescriptorException.
   *
   * @param descriptor the descriptor type.
   * @param value      the offending value.
   * @param message    the violated constraint, including the valid range.
   */
  public InvalidDescriptorException(Class<? extends Descriptor> descriptor, Object value,
      String message) {
    super(format(" Invalid %s: %s", descriptor.getSimpleName(), message));
    this.descriptor = descriptor.getSimpleName();
    this.value = value;
  }
}
