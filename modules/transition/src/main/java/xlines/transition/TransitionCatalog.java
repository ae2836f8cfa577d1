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

import static java.lang.String.format;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import xlines.descriptor.AtomicSubshell;
import xlines.descriptor.Transition;

/**
 * The TransitionCatalog class is the fixed table of X-ray transitions known by name. Each entry is a
 * {@link Transition} and its Siegbahn name; entries are identified by their index in the table.
 * <p>
 * The table lists the diagram lines ordered by destination subshell (K, L3, L2, L1, M1, ...),
 * followed by the satellite lines.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class TransitionCatalog {

  /** Siegbahn name (Unicode) and IUPAC name of each entry. */
  private static final String[][] ENTRIES = {
      {"Kα1", "K-L3"},
      {"Kα2", "K-L2"},
      {"Kβ1", "K-M3"},
      {"Kβ2", "K-N3"},
      {"Kβ3", "K-M2"},
      {"Kβ4", "K-N5"},
      {"Kβ5", "K-M5"},
      {"L3N2", "L3-N2"},
      {"L3N3", "L3-N3"},
      {"L3O2", "L3-O2"},
      {"L3O3", "L3-O3"},
      {"L3P1", "L3-P1"},
      {"Lα1", "L3-M5"},
      {"Lα2", "L3-M4"},
      {"Lβ15", "L3-N4"},
      {"Lβ2", "L3-N5"},
      {"Lβ5", "L3-O4"},
      {"Lβ6", "L3-N1"},
      {"Lβ7", "L3-O1"},
      {"Lℓ", "L3-M1"},
      {"Ls", "L3-M3"},
      {"Lt", "L3-M2"},
      {"Lu", "L3-N6"},
      {"L2M2", "L2-M2"},
      {"L2M5", "L2-M5"},
      {"L2N2", "L2-N2"},
      {"L2N3", "L2-N3"},
      {"L2N5", "L2-N5"},
      {"L2O2", "L2-O2"},
      {"L2O3", "L2-O3"},
      {"L2P2", "L2-P2"},
      {"Lβ1", "L2-M4"},
      {"Lβ17", "L2-M3"},
      {"Lγ1", "L2-N4"},
      {"Lγ5", "L2-N1"},
      {"Lγ6", "L2-O4"},
      {"Lγ8", "L2-O1"},
      {"Lη", "L2-M1"},
      {"Lν", "L2-N6"},
      {"L1M1", "L1-M1"},
      {"L1N1", "L1-N1"},
      {"L1N4", "L1-N4"},
      {"L1O1", "L1-O1"},
      {"L1O4", "L1-O4"},
      {"Lβ10", "L1-M4"},
      {"Lβ3", "L1-M3"},
      {"Lβ4", "L1-M2"},
      {"Lβ9", "L1-M5"},
      {"Lγ2", "L1-N2"},
      {"Lγ11", "L1-N5"},
      {"Lγ3", "L1-N3"},
      {"Lγ4", "L1-O3"},
      {"Lγ4p", "L1-O2"},
      {"M1N2", "M1-N2"},
      {"M1N3", "M1-N3"},
      {"M2M4", "M2-M4"},
      {"M2N1", "M2-N1"},
      {"M2N4", "M2-N4"},
      {"M2O4", "M2-O4"},
      {"M3M4", "M3-M4"},
      {"M3M5", "M3-M5"},
      {"M3N1", "M3-N1"},
      {"M3N4", "M3-N4"},
      {"M3O1", "M3-O1"},
      {"M3O4", "M3-O4"},
      {"M3O5", "M3-O5"},
      {"Mγ", "M3-N5"},
      {"M4N3", "M4-N3"},
      {"M4O2", "M4-O2"},
      {"Mβ", "M4-N6"},
      {"Mζ2", "M4-N2"},
      {"M5O3", "M5-O3"},
      {"Mα1", "M5-N7"},
      {"Mα2", "M5-N6"},
      {"Mζ1", "M5-N3"},
      {"N4N6", "N4-N6"},
      {"N5N6", "N5-N6"},
      {"Kα3", "K-L3[1]"},
      {"Kα4", "K-L3[2]"}
  };

  /** Number of subshells of each shell, K to Q, used by the subshell index. */
  private static final int[] SUBSHELLS_PER_SHELL = {1, 3, 5, 7, 7, 5, 1};

  private static final List<Transition> transitions;
  private static final List<String> siegbahns;
  private static final Map<String, Integer> siegbahnIndex = new HashMap<>();
  private static final Map<Transition, Integer> transitionIndex = new HashMap<>();

  static {
    List<Transition> transitionList = new ArrayList<>(ENTRIES.length);
    List<String> siegbahnList = new ArrayList<>(ENTRIES.length);
    for (int i = 0; i < ENTRIES.length; i++) {
      Transition transition = Transition.fromIupac(ENTRIES[i][1]);
      transitionList.add(transition);
      siegbahnList.add(ENTRIES[i][0]);
      siegbahnIndex.put(ENTRIES[i][0], i);
      transitionIndex.put(transition, i);
    }
    transitions = Collections.unmodifiableList(transitionList);
    siegbahns = Collections.unmodifiableList(siegbahnList);
  }

  // Library class: make the default constructor private to ensure it's never constructed.
  private TransitionCatalog() {}

  /**
   * Number of entries. No index is equal to or larger than this value.
   *
   * @return the number of entries.
   */
  public static int size() {
    return transitions.size();
  }

  /**
   * Transition of an entry.
   *
   * @param index the entry index.
   * @return the Transition.
   */
  public static Transition getTransition(int index) {
    return transitions.get(index);
  }

  /**
   * Siegbahn name (Unicode) of an entry.
   *
   * @param index the entry index.
   * @return the Siegbahn name.
   */
  public static String getSiegbahn(int index) {
    return siegbahns.get(index);
  }

  /**
   * Index of the entry with the given Unicode Siegbahn name.
   *
   * @param siegbahn the Siegbahn name.
   * @return the index, or -1 if the name is unknown.
   */
  public static int indexOf(String siegbahn) {
    Integer index = siegbahnIndex.get(siegbahn);
    return (index == null) ? -1 : index;
  }

  /**
   * Index of the entry of the given transition.
   *
   * @param transition the Transition.
   * @return the index, or -1 if the transition is not in the table.
   */
  public static int indexOf(Transition transition) {
    Integer index = transitionIndex.get(transition);
    return (index == null) ? -1 : index;
  }

  /**
   * Subshell with the given subshell index, counting from 1 (K) through L1, L2, L3, M1, ... to 29
   * (Q1).
   *
   * @param index the subshell index.
   * @return the AtomicSubshell.
   * @throws IllegalArgumentException if the index is not between 1 and 29.
   */
  public static AtomicSubshell getSubshell(int index) {
    int remaining = index;
    if (remaining >= 1) {
      for (int shell = 0; shell < SUBSHELLS_PER_SHELL.length; shell++) {
        if (remaining <= SUBSHELLS_PER_SHELL[shell]) {
          String letter = String.valueOf("KLMNOPQ".charAt(shell));
          return AtomicSubshell.fromIupac(shell == 0 ? letter : letter + remaining);
        }
        remaining -= SUBSHELLS_PER_SHELL[shell];
      }
    }
    throw new IllegalArgumentException(format(" Subshell index (%d) must be [1, 29].", index));
  }
}
