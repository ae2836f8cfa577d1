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
 * The Language class identifies the language of a localized property such as an element name. The
 * code is an ISO 639 code (2 or 3 letters) stored in lowercase.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class Language implements Descriptor {

  /** English. */
  public static final Language ENGLISH = of("en");

  private final String code;

  private Language(String code) {
    this.code = code;
  }

  /**
   * Returns the interned Language.
   *
   * @param code a 2 or 3 character language code (case-insensitive).
   * @return the Language.
   * @throws InvalidDescriptorException if the code is null or not 2 or 3 characters long.
   */
  public static Language of(String code) {
    return DescriptorCache.intern(Language.class, new Object[] {code}, () -> {
      if (code == null) {
        throw new InvalidDescriptorException(Language.class, null, "Code must be defined");
      }
      String trimmed = code.trim();
      if (trimmed.length() < 2 || trimmed.length() > 3) {
        throw new InvalidDescriptorException(Language.class, code,
            format("Code (%s) must be 2 or 3 characters", code));
      }
      return new Language(trimmed.toLowerCase(Locale.ROOT));
    });
  }

  /**
   * Getter for the field <code>code</code>.
   *
   * @return the lowercase language code.
   */
  public String getCode() {
    return code;
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
    return code.equals(((Language) o).code);
  }

  /** {@inheritDoc} */
  @Override
  public int hashCode() {
    return code.hashCode();
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return format("Language(%s)", code);
  }
}
