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

/**
 * The SiegbahnNotation class converts Siegbahn transition names between their Unicode form (Kα1),
 * their ASCII form (Ka1) and LaTeX (K$\alpha_{1}$).
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class SiegbahnNotation {

  /** Prime, as used in Lβ4′. */
  public static final char PRIME = '′';

  /** Greek (and script) letters used by Siegbahn names. */
  private static final char[] UNICODE = {'α', 'β', 'γ', 'ζ', 'η',
      'ν', 'ℓ'};
  /** ASCII replacement of each Unicode letter. */
  private static final char[] ASCII = {'a', 'b', 'g', 'z', 'n', 'v', 'l'};
  /** LaTeX macro of each Unicode letter. */
  private static final String[] LATEX = {"\\alpha", "\\beta", "\\gamma", "\\zeta", "\\eta",
      "\\nu", "l"};

  // Library class: make the default constructor private to ensure it's never constructed.
  private SiegbahnNotation() {}

  /**
   * Replace Greek letters by their ASCII letter (e.g. Kα1 becomes Ka1).
   *
   * @param siegbahn a Siegbahn name.
   * @return the ASCII name.
   */
  public static String toAscii(String siegbahn) {
    String ascii = siegbahn;
    for (int i = 0; i < UNICODE.length; i++) {
      ascii = ascii.replace(UNICODE[i], ASCII[i]);
    }
    return ascii;
  }

  /**
   * Replace ASCII letters by their Greek letter (e.g. Ka1 becomes Kα1). Upper case letters are
   * left unchanged.
   *
   * @param siegbahn an ASCII Siegbahn name.
   * @return the Unicode name.
   */
  public static String toUnicode(String siegbahn) {
    String unicode = siegbahn;
    for (int i = 0; i < ASCII.length; i++) {
      unicode = unicode.replace(ASCII[i], UNICODE[i]);
    }
    return unicode;
  }

  /**
   * Replace the letter p by a prime (e.g. Lβ4p becomes Lβ4′).
   *
   * @param siegbahn a Siegbahn name.
   * @return the name with primes.
   */
  public static String toPrime(String siegbahn) {
    return siegbahn.replace('p', PRIME);
  }

  /**
   * Replace primes by the letter p (e.g. Lβ4′ becomes Lβ4p).
   *
   * @param siegbahn a Siegbahn name.
   * @return the name without primes.
   */
  public static String fromPrime(String siegbahn) {
    return siegbahn.replace(PRIME, 'p');
  }

  /**
   * Format a Siegbahn name for LaTeX. Digit runs become subscripts and Greek letters become math
   * mode macros (e.g. Lβ15 becomes L$\beta_{15}$). The letter p is written as a prime.
   *
   * @param siegbahn a Siegbahn name (Unicode or ASCII).
   * @return the LaTeX string.
   */
  public static String toLatex(String siegbahn) {
    String unicode = toPrime(toUnicode(siegbahn));
    StringBuilder sb = new StringBuilder();
    int i = 0;
    while (i < unicode.length()) {
      char c = unicode.charAt(i);
      if (Character.isDigit(c)) {
        int start = i;
        while (i < unicode.length() && Character.isDigit(unicode.charAt(i))) {
          i++;
        }
        sb.append("$_{").append(unicode, start, i).append("}$");
        continue;
      }
      int greek = indexOf(c);
      if (greek >= 0) {
        sb.append("$").append(LATEX[greek]).append("$");
      } else if (c == PRIME) {
        sb.append("$'$");
      } else {
        sb.append(c);
      }
      i++;
    }
    return sb.toString().replace("$$", "");
  }

  private static int indexOf(char c) {
    for (int i = 0; i < UNICODE.length; i++) {
      if (UNICODE[i] == c) {
        return i;
      }
    }
    return -1;
  }
}
