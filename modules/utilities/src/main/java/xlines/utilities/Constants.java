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
package xlines.utilities;

/**
 * Library class containing physical constants used to convert between X-ray energies and
 * wavelengths.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class Constants {

  // SI units: kg, m, s, C.
  // Energies of subshells and transitions are tabulated in electron volts.

  /** Speed of light in m/s, defining the meter. <code>SPEED_OF_LIGHT_SI=299792458</code> */
  public static final int SPEED_OF_LIGHT_SI = 299792458;
  /**
   * Planck constant in J*s, defining the kilogram (by defining the derived Joule) <code>
   * PLANCK_CONSTANT_SI=6.62607015E-34d</code>
   */
  public static final double PLANCK_CONSTANT_SI = 6.62607015E-34d;
  /**
   * Elementary charge in Coulombs, defining the Coulomb. <code>
   *  ELEMENTARY_CHARGE_SI=1.602176634E-19d</code>
   */
  public static final double ELEMENTARY_CHARGE_SI = 1.602176634E-19d;
  /**
   * Planck constant in eV*s. <code>PLANCK_CONSTANT_EV = PLANCK_CONSTANT_SI /
   * ELEMENTARY_CHARGE_SI</code>
   */
  public static final double PLANCK_CONSTANT_EV = PLANCK_CONSTANT_SI / ELEMENTARY_CHARGE_SI;
  /**
   * Product of the Planck constant and the speed of light in eV*m, used to convert a photon energy
   * into its wavelength. <code>HC_EV_M = PLANCK_CONSTANT_EV * SPEED_OF_LIGHT_SI</code>
   */
  public static final double HC_EV_M = PLANCK_CONSTANT_EV * SPEED_OF_LIGHT_SI;
  /** Constant <code>METERS_TO_ANG=1E10</code> */
  public static final double METERS_TO_ANG = 1E10;

  // Library class: make the default constructor private to ensure it's never constructed.
  private Constants() {}
}
