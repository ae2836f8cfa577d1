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

import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import xlines.descriptor.AtomicSubshell;
import xlines.descriptor.Element;
import xlines.descriptor.Language;
import xlines.descriptor.Reference;
import xlines.descriptor.Transition;

/**
 * The XRayDatabase class answers element, subshell and transition queries through a {@link
 * PropertyResolver}.
 * <p>
 * Every query accepts an optional reference BibTeX key. A null key applies the resolver's reference
 * priority.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class XRayDatabase {

  private static final Logger logger = Logger.getLogger(XRayDatabase.class.getName());

  private final PropertyResolver resolver;

  /**
   * Constructor for XRayDatabase.
   *
   * @param resolver the PropertyResolver.
   */
  public XRayDatabase(PropertyResolver resolver) {
    this.resolver = resolver;
  }

  public PropertyResolver getResolver() {
    return resolver;
  }

  public PropertyStore getStore() {
    return resolver.getStore();
  }

  public String symbol(int z) {
    return symbol(z, null);
  }

  /**
   * Chemical symbol of an element.
   *
   * @param z         the atomic number.
   * @param reference BibTeX key of the reference (may be null).
   * @return the symbol.
   * @throws PropertyNotFoundException if no symbol is known.
   */
  public String symbol(int z, String reference) {
    return resolver.lookupString(PropertyKind.ELEMENT_SYMBOL, subject(z), reference);
  }

  public int atomicNumber(String symbol) {
    return atomicNumber(symbol, null);
  }

  /**
   * Atomic number of the element with the given symbol (case-insensitive).
   *
   * @param symbol    the chemical symbol.
   * @param reference BibTeX key of the reference (may be null).
   * @return the atomic number.
   * @throws PropertyNotFoundException if the symbol is unknown.
   */
  public int atomicNumber(String symbol, String reference) {
    if (symbol != null) {
      List<PropertyRow> rows = getStore().getRows(PropertyKind.ELEMENT_SYMBOL);
      for (PropertyRow row : rows) {
        if (reference != null && !row.getReference().getBibtexkey().equals(reference)) {
          continue;
        }
        if (row.getValue().toString().equalsIgnoreCase(symbol.trim())) {
          return row.getSubject().getElement().getAtomicNumber();
        }
      }
    }
    String message = (reference == null) ? format(" Unknown element symbol (%s).", symbol)
        : format(" Unknown element symbol (%s) in reference %s.", symbol, reference);
    throw new PropertyNotFoundException(message, PropertyKind.ELEMENT_SYMBOL, null, reference);
  }

  public String name(int z) {
    return name(z, Language.ENGLISH.getCode(), null);
  }

  public String name(int z, String language) {
    return name(z, language, null);
  }

  /**
   * Name of an element.
   *
   * @param z         the atomic number.
   * @param language  the language code (e.g. en).
   * @param reference BibTeX key of the reference (may be null).
   * @return the name.
   * @throws PropertyNotFoundException if no name is known in the language.
   */
  public String name(int z, String language, String reference) {
    return resolver.lookupString(PropertyKind.ELEMENT_NAME,
        new PropertySubject(Element.of(z), Language.of(language)), reference);
  }

  public String name(String symbol) {
    return name(atomicNumber(symbol), Language.ENGLISH.getCode(), null);
  }

  public String name(String symbol, String language) {
    return name(atomicNumber(symbol), language, null);
  }

  public String name(String symbol, String language, String reference) {
    return name(atomicNumber(symbol), language, reference);
  }

  public double atomicWeight(int z) {
    return atomicWeight(z, null);
  }

  /**
   * Standard atomic weight of an element.
   *
   * @param z         the atomic number.
   * @param reference BibTeX key of the reference (may be null).
   * @return the atomic weight.
   */
  public double atomicWeight(int z, String reference) {
    return resolver.lookupDouble(PropertyKind.ELEMENT_ATOMIC_WEIGHT, subject(z), reference);
  }

  public double atomicWeight(String symbol) {
    return atomicWeight(atomicNumber(symbol), null);
  }

  public double atomicWeight(String symbol, String reference) {
    return atomicWeight(atomicNumber(symbol), reference);
  }

  public double massDensity(int z) {
    return massDensity(z, null);
  }

  /**
   * Mass density of an element.
   *
   * @param z         the atomic number.
   * @param reference BibTeX key of the reference (may be null).
   * @return the mass density (kg/m^3).
   */
  public double massDensity(int z, String reference) {
    return resolver.lookupDouble(PropertyKind.ELEMENT_MASS_DENSITY, subject(z), reference);
  }

  public double massDensity(String symbol) {
    return massDensity(atomicNumber(symbol), null);
  }

  public double massDensity(String symbol, String reference) {
    return massDensity(atomicNumber(symbol), reference);
  }

  public double subshellEnergy(int z, AtomicSubshell subshell) {
    return subshellEnergy(z, subshell, null);
  }

  /**
   * Ionization energy of a subshell.
   *
   * @param z         the atomic number.
   * @param subshell  the subshell.
   * @param reference BibTeX key of the reference (may be null).
   * @return the energy (eV).
   */
  public double subshellEnergy(int z, AtomicSubshell subshell, String reference) {
    return resolver.lookupDouble(PropertyKind.SUBSHELL_ENERGY, subject(z, subshell), reference);
  }

  public double subshellWidth(int z, AtomicSubshell subshell) {
    return subshellWidth(z, subshell, null);
  }

  /**
   * Natural width of a subshell.
   *
   * @param z         the atomic number.
   * @param subshell  the subshell.
   * @param reference BibTeX key of the reference (may be null).
   * @return the width (eV).
   */
  public double subshellWidth(int z, AtomicSubshell subshell, String reference) {
    return resolver.lookupDouble(PropertyKind.SUBSHELL_WIDTH, subject(z, subshell), reference);
  }

  /**
   * A subshell exists for an element if any reference reports its ionization energy.
   *
   * @param z        the atomic number.
   * @param subshell the subshell.
   * @return true if the subshell exists.
   */
  public boolean subshellExists(int z, AtomicSubshell subshell) {
    return !getStore().getReferences(PropertyKind.SUBSHELL_ENERGY, subject(z, subshell)).isEmpty();
  }

  public double transitionEnergy(int z, Transition transition) {
    return transitionEnergy(z, transition, null);
  }

  /**
   * Energy of a transition.
   *
   * @param z          the atomic number.
   * @param transition the transition.
   * @param reference  BibTeX key of the reference (may be null).
   * @return the energy (eV).
   */
  public double transitionEnergy(int z, Transition transition, String reference) {
    return resolver.lookupDouble(PropertyKind.TRANSITION_ENERGY, subject(z, transition),
        reference);
  }

  public double transitionProbability(int z, Transition transition) {
    return transitionProbability(z, transition, null);
  }

  /**
   * Relative probability of a transition.
   *
   * @param z          the atomic number.
   * @param transition the transition.
   * @param reference  BibTeX key of the reference (may be null).
   * @return the probability.
   */
  public double transitionProbability(int z, Transition transition, String reference) {
    return resolver.lookupDouble(PropertyKind.TRANSITION_PROBABILITY, subject(z, transition),
        reference);
  }

  public double transitionWidth(int z, Transition transition) {
    return transitionWidth(z, transition, null);
  }

  /**
   * Natural width of a transition line.
   *
   * @param z          the atomic number.
   * @param transition the transition.
   * @param reference  BibTeX key of the reference (may be null).
   * @return the width (eV).
   */
  public double transitionWidth(int z, Transition transition, String reference) {
    return resolver.lookupDouble(PropertyKind.TRANSITION_WIDTH, subject(z, transition), reference);
  }

  /**
   * A transition exists for an element if some reference reports its energy and some reference
   * reports a probability greater than zero.
   *
   * @param z          the atomic number.
   * @param transition the transition.
   * @return true if the transition exists.
   */
  public boolean transitionExists(int z, Transition transition) {
    PropertySubject subject = subject(z, transition);
    PropertyStore store = getStore();
    if (store.getReferences(PropertyKind.TRANSITION_ENERGY, subject).isEmpty()) {
      return false;
    }
    for (Reference reference : store.getReferences(PropertyKind.TRANSITION_PROBABILITY, subject)) {
      Object probability = store.getProperty(PropertyKind.TRANSITION_PROBABILITY, subject,
          reference);
      if (probability instanceof Number && ((Number) probability).doubleValue() > 0.0) {
        return true;
      }
    }
    if (logger.isLoggable(Level.FINER)) {
      logger.finer(format(" %s has an energy but no probability.", subject));
    }
    return false;
  }

  private static PropertySubject subject(int z) {
    return new PropertySubject(Element.of(z));
  }

  private static PropertySubject subject(int z, AtomicSubshell subshell) {
    return new PropertySubject(Element.of(z), subshell);
  }

  private static PropertySubject subject(int z, Transition transition) {
    return new PropertySubject(Element.of(z), transition);
  }
}
