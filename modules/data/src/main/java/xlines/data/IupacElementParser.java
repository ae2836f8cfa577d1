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

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.logging.Logger;
import xlines.descriptor.Element;
import xlines.descriptor.Language;
import xlines.descriptor.Reference;

/**
 * The IupacElementParser class provides the symbol, the English name and the standard atomic weight
 * of the elements Z = 1 to 118.
 * <p>
 * <a href="https://iupac.qmul.ac.uk/AtWt">IUPAC Commission</a> on Isotopic Abundances and Atomic
 * Weights. For elements without a stable isotope the mass number of the longest-lived isotope is
 * given.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class IupacElementParser implements PropertyParser {

  private static final Logger logger = Logger.getLogger(IupacElementParser.class.getName());

  /** BibTeX key of the IUPAC element table. */
  public static final String BIBTEXKEY = "iupac2022";

  /** IUPAC element table reference. */
  public static final Reference IUPAC_2022 = Reference.builder(BIBTEXKEY)
      .author("IUPAC Commission on Isotopic Abundances and Atomic Weights")
      .title("Standard Atomic Weights")
      .year(2022)
      .url("https://iupac.qmul.ac.uk/AtWt")
      .build();

  /** Symbol, English name and standard atomic weight, indexed by Z - 1. */
  private static final String[][] ELEMENTS = {
      {"H", "Hydrogen", "1.008"},
      {"He", "Helium", "4.002"},
      {"Li", "Lithium", "6.94"},
      {"Be", "Beryllium", "9.012"},
      {"B", "Boron", "10.81"},
      {"C", "Carbon", "12.011"},
      {"N", "Nitrogen", "14.007"},
      {"O", "Oxygen", "15.999"},
      {"F", "Fluorine", "18.998"},
      {"Ne", "Neon", "20.1797"},
      {"Na", "Sodium", "22.989"},
      {"Mg", "Magnesium", "24.305"},
      {"Al", "Aluminium", "26.981"},
      {"Si", "Silicon", "28.085"},
      {"P", "Phosphorus", "30.973"},
      {"S", "Sulfur", "32.06"},
      {"Cl", "Chlorine", "35.45"},
      {"Ar", "Argon", "39.948"},
      {"K", "Potassium", "39.0983"},
      {"Ca", "Calcium", "40.078"},
      {"Sc", "Scandium", "44.955"},
      {"Ti", "Titanium", "47.867"},
      {"V", "Vanadium", "50.9415"},
      {"Cr", "Chromium", "51.9961"},
      {"Mn", "Manganese", "54.938"},
      {"Fe", "Iron", "55.845"},
      {"Co", "Cobalt", "58.933"},
      {"Ni", "Nickel", "58.6934"},
      {"Cu", "Copper", "63.546"},
      {"Zn", "Zinc", "65.38"},
      {"Ga", "Gallium", "69.723"},
      {"Ge", "Germanium", "72.630"},
      {"As", "Arsenic", "74.921"},
      {"Se", "Selenium", "78.971"},
      {"Br", "Bromine", "79.904"},
      {"Kr", "Krypton", "83.798"},
      {"Rb", "Rubidium", "85.4678"},
      {"Sr", "Strontium", "87.62"},
      {"Y", "Yttrium", "88.905"},
      {"Zr", "Zirconium", "91.224"},
      {"Nb", "Niobium", "92.906"},
      {"Mo", "Molybdenum", "95.95"},
      {"Tc", "Technetium", "97.0"},
      {"Ru", "Ruthenium", "101.07"},
      {"Rh", "Rhodium", "102.905"},
      {"Pd", "Palladium", "106.42"},
      {"Ag", "Silver", "107.8682"},
      {"Cd", "Cadmium", "112.414"},
      {"In", "Indium", "114.818"},
      {"Sn", "Tin", "118.710"},
      {"Sb", "Antimony", "121.760"},
      {"Te", "Tellurium", "127.60"},
      {"I", "Iodine", "126.904"},
      {"Xe", "Xenon", "131.293"},
      {"Cs", "Caesium", "132.905"},
      {"Ba", "Barium", "137.327"},
      {"La", "Lanthanum", "138.905"},
      {"Ce", "Cerium", "140.116"},
      {"Pr", "Praseodymium", "140.907"},
      {"Nd", "Neodymium", "144.242"},
      {"Pm", "Promethium", "145.0"},
      {"Sm", "Samarium", "150.36"},
      {"Eu", "Europium", "151.964"},
      {"Gd", "Gadolinium", "157.25"},
      {"Tb", "Terbium", "158.925"},
      {"Dy", "Dysprosium", "162.500"},
      {"Ho", "Holmium", "164.930"},
      {"Er", "Erbium", "167.259"},
      {"Tm", "Thulium", "168.934"},
      {"Yb", "Ytterbium", "173.045"},
      {"Lu", "Lutetium", "174.9668"},
      {"Hf", "Hafnium", "178.486"},
      {"Ta", "Tantalum", "180.947"},
      {"W", "Tungsten", "183.84"},
      {"Re", "Rhenium", "186.207"},
      {"Os", "Osmium", "190.23"},
      {"Ir", "Iridium", "192.217"},
      {"Pt", "Platinum", "195.084"},
      {"Au", "Gold", "196.966"},
      {"Hg", "Mercury", "200.592"},
      {"Tl", "Thallium", "204.38"},
      {"Pb", "Lead", "207.2"},
      {"Bi", "Bismuth", "208.980"},
      {"Po", "Polonium", "209.0"},
      {"At", "Astatine", "210.0"},
      {"Rn", "Radon", "222.0"},
      {"Fr", "Francium", "223.0"},
      {"Ra", "Radium", "226.0"},
      {"Ac", "Actinium", "227.0"},
      {"Th", "Thorium", "232.0377"},
      {"Pa", "Protactinium", "231.035"},
      {"U", "Uranium", "238.028"},
      {"Np", "Neptunium", "237.0"},
      {"Pu", "Plutonium", "244.0"},
      {"Am", "Americium", "243.0"},
      {"Cm", "Curium", "247.0"},
      {"Bk", "Berkelium", "247.0"},
      {"Cf", "Californium", "251.0"},
      {"Es", "Einsteinium", "252.0"},
      {"Fm", "Fermium", "257.0"},
      {"Md", "Mendelevium", "258.0"},
      {"No", "Nobelium", "259.0"},
      {"Lr", "Lawrencium", "262.0"},
      {"Rf", "Rutherfordium", "267.0"},
      {"Db", "Dubnium", "270.0"},
      {"Sg", "Seaborgium", "269.0"},
      {"Bh", "Bohrium", "270.0"},
      {"Hs", "Hassium", "270.0"},
      {"Mt", "Meitnerium", "278.0"},
      {"Ds", "Darmstadtium", "281.0"},
      {"Rg", "Roentgenium", "281.0"},
      {"Cn", "Copernicium", "285.0"},
      {"Nh", "Nihonium", "286.0"},
      {"Fl", "Flerovium", "289.0"},
      {"Mc", "Moscovium", "289.0"},
      {"Lv", "Livermorium", "293.0"},
      {"Ts", "Tennessine", "293.0"},
      {"Og", "Oganesson", "294.0"}
  };

  /** {@inheritDoc} */
  @Override
  public Iterator<PropertyRow> iterator() {
    List<PropertyRow> rows = new ArrayList<>(3 * ELEMENTS.length);
    for (int i = 0; i < ELEMENTS.length; i++) {
      PropertySubject subject = new PropertySubject(Element.of(i + 1));
      rows.add(new PropertyRow(PropertyKind.ELEMENT_SYMBOL, subject, IUPAC_2022, ELEMENTS[i][0]));
      rows.add(new PropertyRow(PropertyKind.ELEMENT_NAME,
          new PropertySubject(subject.getElement(), Language.ENGLISH), IUPAC_2022, ELEMENTS[i][1]));
      rows.add(new PropertyRow(PropertyKind.ELEMENT_ATOMIC_WEIGHT, subject, IUPAC_2022,
          Double.valueOf(ELEMENTS[i][2])));
    }
    logger.fine(format(" Generated %d IUPAC element rows.", rows.size()));
    return Collections.unmodifiableList(rows).iterator();
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return "IUPAC element table (" + BIBTEXKEY + ")";
  }
}
