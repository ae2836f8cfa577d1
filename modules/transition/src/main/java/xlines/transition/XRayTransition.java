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

import static xlines.utilities.Constants.HC_EV_M;

import java.util.Objects;
import xlines.data.XRayDatabase;
import xlines.descriptor.AtomicSubshell;
import xlines.descriptor.Transition;

/**
 * The XRayTransition class is a catalog transition of a given element, e.g. Fe Kα1.
 * <p>
 * Two instances are equal if they have the same atomic number and catalog index. Transitions are
 * ordered by atomic number, then by decreasing catalog index.
 * <p>
 * Energies, probabilities and widths are resolved through the {@link XRayDatabase} that created the
 * instance; a missing value raises a {@link xlines.data.PropertyNotFoundException}.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class XRayTransition extends AbstractXRayTransition implements Comparable<XRayTransition> {

  private final int index;
  private final Transition transition;
  private final XRayDatabase database;

  /**
   * Constructor for XRayTransition.
   *
   * @param database the XRayDatabase used to resolve values.
   * @param z        the atomic number.
   * @param index    the catalog index.
   */
  XRayTransition(XRayDatabase database, int z, int index) {
    super(z, database.symbol(z), TransitionCatalog.getSiegbahn(index),
        TransitionCatalog.getTransition(index).getIupac());
    this.index = index;
    this.transition = TransitionCatalog.getTransition(index);
    this.database = database;
  }

  /**
   * Catalog index of this transition.
   *
   * @return the index.
   */
  public int getIndex() {
    return index;
  }

  public Transition getTransition() {
    return transition;
  }

  public AtomicSubshell getSource() {
    return transition.getSourceSubshell();
  }

  public AtomicSubshell getDestination() {
    return transition.getDestinationSubshell();
  }

  public int getSatellite() {
    return transition.getSatellite();
  }

  public boolean isDiagramLine() {
    return transition.isDiagramLine();
  }

  public boolean isSatellite() {
    return transition.isSatellite();
  }

  /**
   * A transition exists if its energy and a non-zero probability are known.
   *
   * @return true if the transition exists.
   */
  public boolean exists() {
    return database.transitionExists(z, transition);
  }

  public double getEnergy() {
    return getEnergy(null);
  }

  /**
   * Energy of this transition.
   *
   * @param reference BibTeX key of the reference (may be null).
   * @return the energy (eV).
   */
  public double getEnergy(String reference) {
    return database.transitionEnergy(z, transition, reference);
  }

  public double getProbability() {
    return getProbability(null);
  }

  /**
   * Probability of this transition.
   *
   * @param reference BibTeX key of the reference (may be null).
   * @return the probability.
   */
  public double getProbability(String reference) {
    return database.transitionProbability(z, transition, reference);
  }

  public double getWidth() {
    return getWidth(null);
  }

  /**
   * Natural width of this transition.
   *
   * @param reference BibTeX key of the reference (may be null).
   * @return the width (eV).
   */
  public double getWidth(String reference) {
    return database.transitionWidth(z, transition, reference);
  }

  public double getWavelength() {
    return getWavelength(null);
  }

  /**
   * Wavelength of this transition, hc / E.
   *
   * @param reference BibTeX key of the reference used for the energy (may be null).
   * @return the wavelength (m).
   */
  public double getWavelength(String reference) {
    return HC_EV_M / getEnergy(reference);
  }

  /** {@inheritDoc} */
  @Override
  public int compareTo(XRayTransition other) {
    int c = Integer.compare(z, other.z);
    if (c != 0) {
      return c;
    }
    return -Integer.compare(index, other.index);
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
    XRayTransition other = (XRayTransition) o;
    return z == other.z && index == other.index;
  }

  /** {@inheritDoc} */
  @Override
  public int hashCode() {
    return Objects.hash(z, index);
  }
}
