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

import java.util.Collections;
import java.util.List;

/**
 * This exception is thrown when a value is requested from a specific reference that has no row for
 * the subject, while other references do.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class AmbiguousReferenceException extends PropertyNotFoundException {

  /** BibTeX keys of the references that do report a value. */
  public final List<String> available;

  /**
   * Constructor for AmbiguousReferenceException.
   *
   * @param message   the detail message.
   * @param kind      the requested property kind.
   * @param subject   the requested subject.
   * @param reference BibTeX key of the requested reference.
   * @param available BibTeX keys of the references that report a value.
   */
  public AmbiguousReferenceException(String message, PropertyKind kind, PropertySubject subject,
      String reference, List<String> available) {
    super(message, kind, subject, reference);
    this.available = Collections.unmodifiableList(available);
  }
}
