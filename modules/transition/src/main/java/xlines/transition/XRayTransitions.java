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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import xlines.data.XRayDatabase;
import xlines.descriptor.AtomicSubshell;
import xlines.descriptor.InvalidDescriptorException;
import xlines.descriptor.Notation;
import xlines.descriptor.Transition;

/**
 * The XRayTransitions class parses, lists, groups and formats the X-ray transitions of the elements
 * known to an {@link XRayDatabase}.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class XRayTransitions {

  private static final Logger logger = Logger.getLogger(XRayTransitions.class.getName());

  /** Siegbahn notation (e.g. Kα1). */
  public static final Notation SIEGBAHN = Notation.of("siegbahn");
  /** IUPAC notation (e.g. K-L3). */
  public static final Notation IUPAC = Notation.of("iupac");

  /** Default lower energy limit (eV). */
  public static final double DEFAULT_ENERGY_LOW = 0.0;
  /** Default upper energy limit (eV). */
  public static final double DEFAULT_ENERGY_HIGH = 1.0e6;

  private final XRayDatabase database;

  /**
   * Constructor for XRayTransitions.
   *
   * @param database the XRayDatabase.
   */
  public XRayTransitions(XRayDatabase database) {
    this.database = database;
  }

  public XRayDatabase getDatabase() {
    return database;
  }

  /**
   * Parse a transition or a transition group from a string holding the element symbol and a
   * notation, separated by one space: a Siegbahn name (Fe Ka1 or Fe Kα1), an IUPAC name (Fe K-L3),
   * or a group label (Fe K, Fe Ka, Fe LIII).
   * <p>
   * Any text following a slash is ignored (N5N6/N6N7 is N5N6) and Le is read as Lη.
   *
   * @param text the string to parse.
   * @return an XRayTransition or an XRayTransitionSet.
   * @throws TransitionParseException       if the string cannot be parsed.
   * @throws EmptyTransitionGroupException  if a group has no existing transition.
   * @throws xlines.data.PropertyNotFoundException if the element symbol is unknown.
   */
  public AbstractXRayTransition fromString(String text) {
    if (text == null) {
      throw new TransitionParseException(" Cannot parse a null transition.", null);
    }
    String[] words = text.split(" ");
    if (words.length != 2) {
      throw new TransitionParseException(String.format(" The transition (%s) must have 2 words: "
          + "1. the symbol of the element and 2. the transition notation.", text), text);
    }
    int z = database.atomicNumber(words[0]);
    String notation = words[1];

    int slash = notation.indexOf('/');
    if (slash >= 0) {
      notation = notation.substring(0, slash);
    }
    if (notation.equals("Le")) {
      notation = "Ln";
    }
    notation = SiegbahnNotation.fromPrime(SiegbahnNotation.toUnicode(notation));

    if (logger.isLoggable(Level.FINE)) {
      logger.fine(String.format(" Parsing %s as element %d, notation %s.", text, z, notation));
    }

    int index = TransitionCatalog.indexOf(notation);
    if (index >= 0) {
      return new XRayTransition(database, z, index);
    }

    if (notation.contains("-")) {
      Transition transition;
      try {
        transition = Transition.fromIupac(notation);
      } catch (InvalidDescriptorException e) {
        throw new TransitionParseException(
            String.format(" Cannot parse transition string: %s", text), text, e);
      }
      index = TransitionCatalog.indexOf(transition);
      if (index < 0) {
        throw new TransitionParseException(String.format(" Unknown transition: %s", text), text);
      }
      return new XRayTransition(database, z, index);
    }

    TransitionGroup group = TransitionGroup.fromSiegbahn(notation);
    if (group != null) {
      return group(z, group);
    }

    throw new TransitionParseException(
        String.format(" Cannot parse transition string: %s", text), text);
  }

  /**
   * Transition with the given Siegbahn name.
   *
   * @param z        the atomic number.
   * @param siegbahn the Siegbahn name (Unicode or ASCII).
   * @return the XRayTransition.
   * @throws TransitionParseException if the name is unknown.
   */
  public XRayTransition transition(int z, String siegbahn) {
    int index = TransitionCatalog.indexOf(
        SiegbahnNotation.fromPrime(SiegbahnNotation.toUnicode(siegbahn)));
    if (index < 0) {
      throw new TransitionParseException(
          String.format(" Unknown transition (%s).", siegbahn), siegbahn);
    }
    return new XRayTransition(database, z, index);
  }

  /**
   * Diagram line between two subshells.
   *
   * @param z           the atomic number.
   * @param source      the source subshell.
   * @param destination the destination subshell.
   * @return the XRayTransition.
   * @throws IllegalArgumentException if the transition is not in the catalog.
   */
  public XRayTransition transition(int z, AtomicSubshell source, AtomicSubshell destination) {
    return transition(z, Transition.of(source, destination));
  }

  /**
   * Catalog transition of an element.
   *
   * @param z          the atomic number.
   * @param transition the transition descriptor.
   * @return the XRayTransition.
   * @throws IllegalArgumentException if the transition is not in the catalog.
   */
  public XRayTransition transition(int z, Transition transition) {
    int index = TransitionCatalog.indexOf(transition);
    if (index < 0) {
      throw new IllegalArgumentException(String.format(" Unknown transition (%s).", transition));
    }
    return new XRayTransition(database, z, index);
  }

  public List<XRayTransition> getTransitions(int z) {
    return getTransitions(z, DEFAULT_ENERGY_LOW, DEFAULT_ENERGY_HIGH, false);
  }

  public List<XRayTransition> getTransitions(int z, double energyLow, double energyHigh) {
    return getTransitions(z, energyLow, energyHigh, false);
  }

  /**
   * Existing transitions of an element whose energy is within the limits (inclusive), in
   * transition order.
   *
   * @param z                the atomic number.
   * @param energyLow        lower energy limit (eV).
   * @param energyHigh       upper energy limit (eV).
   * @param includeSatellite true to include satellite lines.
   * @return the transitions.
   */
  public List<XRayTransition> getTransitions(int z, double energyLow, double energyHigh,
      boolean includeSatellite) {
    List<XRayTransition> transitions = new ArrayList<>();
    for (int index = 0; index < TransitionCatalog.size(); index++) {
      Transition transition = TransitionCatalog.getTransition(index);
      if (transition.isSatellite() && !includeSatellite) {
        continue;
      }
      if (!database.transitionExists(z, transition)) {
        continue;
      }
      double energy = database.transitionEnergy(z, transition);
      if (energy < energyLow || energy > energyHigh) {
        continue;
      }
      transitions.add(new XRayTransition(database, z, index));
    }
    Collections.sort(transitions);
    return transitions;
  }

  public XRayTransitionSet group(int z, TransitionGroup group) {
    return group(z, group, false);
  }

  /**
   * Existing transitions of a group.
   *
   * @param z                the atomic number.
   * @param group            the group.
   * @param includeSatellite true to include satellite lines.
   * @return the XRayTransitionSet, labeled with the group's Siegbahn and IUPAC labels.
   * @throws EmptyTransitionGroupException if no transition of the group exists.
   */
  public XRayTransitionSet group(int z, TransitionGroup group, boolean includeSatellite) {
    List<XRayTransition> transitions = new ArrayList<>();
    for (int index = 0; index < TransitionCatalog.size(); index++) {
      if (!group.contains(index)) {
        continue;
      }
      Transition transition = TransitionCatalog.getTransition(index);
      if (transition.isSatellite() && !includeSatellite) {
        continue;
      }
      if (database.transitionExists(z, transition)) {
        transitions.add(new XRayTransition(database, z, index));
      }
    }
    if (transitions.isEmpty()) {
      String symbol = database.symbol(z);
      throw new EmptyTransitionGroupException(
          String.format(" No transition for %s %s.", symbol, group.getIupac()), z, group);
    }
    return new XRayTransitionSet(z, database.symbol(z), group.getSiegbahn(), group.getIupac(),
        transitions);
  }

  /**
   * Format the name of a transition or a transition set.
   *
   * @param transition the XRayTransition or XRayTransitionSet.
   * @param notation   {@link #SIEGBAHN} or {@link #IUPAC}.
   * @param encoding   the Encoding.
   * @return the formatted name (without the element symbol).
   * @throws IllegalArgumentException if the notation is not supported.
   */
  public static String format(AbstractXRayTransition transition, Notation notation,
      Encoding encoding) {
    if (SIEGBAHN.equals(notation)) {
      String siegbahn = transition.getSiegbahn();
      switch (encoding) {
        case ASCII:
          return SiegbahnNotation.toAscii(siegbahn);
        case LATEX:
          return SiegbahnNotation.toLatex(siegbahn);
        case UTF16:
        default:
          return siegbahn;
      }
    } else if (IUPAC.equals(notation)) {
      String iupac = transition.getIupac();
      if (encoding == Encoding.LATEX) {
        return IupacNotation.toLatex(iupac);
      }
      return iupac;
    }
    throw new IllegalArgumentException(String.format(" Unsupported notation (%s).", notation));
  }
}
