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

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The IupacNotation class formats IUPAC transition names (K-L3) and group labels (K-L(2,3)) for
 * LaTeX.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class IupacNotation {

  /** A shell letter followed by an optional level, either digits or a parenthesized list. */
  private static final Pattern SHELL_PATTERN = Pattern.compile("([A-Z])(?:\\(([^)]*)\\)|(\\d+))?");

  // Library class: make the default constructor private to ensure it's never constructed.
  private IupacNotation() {}

  /**
   * Format an IUPAC name for LaTeX. Each level becomes a subscript (e.g. K-L3 becomes K-L$_{3}$
   * and K-L(2,3) becomes K-L$_{2,3}$).
   *
   * @param iupac an IUPAC name.
   * @return the LaTeX string.
   */
  public static String toLatex(String iupac) {
    Matcher matcher = SHELL_PATTERN.matcher(iupac);
    StringBuilder sb = new StringBuilder();
    int last = 0;
    while (matcher.find()) {
      sb.append(iupac, last, matcher.start());
      sb.append(matcher.group(1));
      String level = (matcher.group(2) != null) ? matcher.group(2) : matcher.group(3);
      if (level != null) {
        sb.append("$_{").append(level).append("}$");
      }
      last = matcher.end();
    }
    sb.append(iupac.substring(last));
    return sb.toString();
  }
}
