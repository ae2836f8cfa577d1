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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The Transition class identifies an electronic transition between subshells.
 * <p>
 * A transition between two subshells (source and destination) is radiative. A transition involving
 * a secondary destination subshell is nonradiative (e.g. Auger). A nonradiative transition whose
 * source and destination share the same principal quantum number is a Coster-Kronig transition.
 * <p>
 * The satellite index is 0 for a diagram line; a positive index denotes a satellite (non-diagram)
 * line that shares the same subshells.
 * <p>
 * Electric dipole and quadrupole selection rules are not enforced, so physically forbidden
 * transitions are accepted.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class Transition implements Descriptor {

  private static final Pattern SUBSHELL_PATTERN = Pattern.compile("[A-Z]\\d*");
  private static final Pattern SATELLITE_PATTERN = Pattern.compile("(.+)\\[(\\d+)]");

  private final AtomicSubshell sourceSubshell;
  private final AtomicSubshell destinationSubshell;
  private final AtomicSubshell secondaryDestinationSubshell;
  private final int satellite;

  private Transition(AtomicSubshell sourceSubshell, AtomicSubshell destinationSubshell,
      AtomicSubshell secondaryDestinationSubshell, int satellite) {
    this.sourceSubshell = sourceSubshell;
    this.destinationSubshell = destinationSubshell;
    this.secondaryDestinationSubshell = secondaryDestinationSubshell;
    this.satellite = satellite;
  }

  /**
   * Returns the interned radiative diagram-line Transition between two subshells.
   *
   * @param source      the source subshell.
   * @param destination the destination subshell.
   * @return the Transition.
   */
  public static Transition of(AtomicSubshell source, AtomicSubshell destination) {
    return of(source, destination, null, 0);
  }

  /**
   * Returns the interned radiative Transition between two subshells.
   *
   * @param source      the source subshell.
   * @param destination the destination subshell.
   * @param satellite   0 for a diagram line, otherwise the satellite index.
   * @return the Transition.
   */
  public static Transition of(AtomicSubshell source, AtomicSubshell destination, int satellite) {
    return of(source, destination, null, satellite);
  }

  /**
   * Returns the interned nonradiative diagram-line Transition between three subshells.
   *
   * @param source               the source subshell.
   * @param destination          the primary destination subshell.
   * @param secondaryDestination the secondary destination subshell (null for a radiative
   *                             transition).
   * @return the Transition.
   */
  public static Transition of(AtomicSubshell source, AtomicSubshell destination,
      AtomicSubshell secondaryDestination) {
    return of(source, destination, secondaryDestination, 0);
  }

  /**
   * Returns the interned Transition.
   *
   * @param source               the source subshell.
   * @param destination          the primary destination subshell.
   * @param secondaryDestination the secondary destination subshell (null for a radiative
   *                             transition).
   * @param satellite            0 for a diagram line, otherwise the satellite index.
   * @return the Transition.
   * @throws InvalidDescriptorException if a required subshell is missing or the satellite index is
   *                                    negative.
   */
  public static Transition of(AtomicSubshell source, AtomicSubshell destination,
      AtomicSubshell secondaryDestination, int satellite) {
    return DescriptorCache.intern(Transition.class,
        new Object[] {source, destination, secondaryDestination, satellite}, () -> {
          if (source == null || destination == null) {
            throw new InvalidDescriptorException(Transition.class, null,
                "Source and destination subshells must be defined");
          }
          if (satellite < 0) {
            throw new InvalidDescriptorException(Transition.class, satellite,
                format("Satellite index (%d) must be [0, inf[", satellite));
          }
          return new Transition(source, destination, secondaryDestination, satellite);
        });
  }

  /**
   * Parse an IUPAC transition name of the form Dest-Src (radiative, e.g. K-L3) or
   * Dest-SrcSecondary (nonradiative, e.g. K-L2L3). A satellite index may follow in brackets (e.g.
   * K-L3[1]).
   *
   * @param iupac the IUPAC name.
   * @return the Transition.
   * @throws InvalidDescriptorException if the name is malformed or a subshell is invalid.
   */
  public static Transition fromIupac(String iupac) {
    String name = (iupac == null) ? "" : iupac.trim();
    int satellite = 0;
    Matcher satelliteMatcher = SATELLITE_PATTERN.matcher(name);
    if (satelliteMatcher.matches()) {
      name = satelliteMatcher.group(1);
      try {
        satellite = Integer.parseInt(satelliteMatcher.group(2));
      } catch (NumberFormatException e) {
        throw new InvalidDescriptorException(Transition.class, iupac,
            format("Satellite index of (%s) is out of range", iupac));
      }
    }
    String[] tokens = name.split("-", -1);
    if (tokens.length != 2 || tokens[0].isEmpty() || tokens[1].isEmpty()) {
      throw new InvalidDescriptorException(Transition.class, iupac,
          format("IUPAC transition name (%s) must be of the form Dest-Src", iupac));
    }
    AtomicSubshell destination = AtomicSubshell.fromIupac(tokens[0]);
    List<AtomicSubshell> others = new ArrayList<>();
    Matcher matcher = SUBSHELL_PATTERN.matcher(tokens[1]);
    int end = 0;
    while (matcher.find()) {
      if (matcher.start() != end) {
        break;
      }
      others.add(AtomicSubshell.fromIupac(matcher.group()));
      end = matcher.end();
    }
    if (end != tokens[1].length() || others.isEmpty() || others.size() > 2) {
      throw new InvalidDescriptorException(Transition.class, iupac,
          format("Unknown IUPAC source subshell(s) in (%s)", iupac));
    }
    AtomicSubshell secondary = (others.size() == 2) ? others.get(1) : null;
    return of(others.get(0), destination, secondary, satellite);
  }

  /**
   * Getter for the field <code>sourceSubshell</code>.
   *
   * @return the source subshell.
   */
  public AtomicSubshell getSourceSubshell() {
    return sourceSubshell;
  }

  /**
   * Getter for the field <code>destinationSubshell</code>.
   *
   * @return the destination subshell.
   */
  public AtomicSubshell getDestinationSubshell() {
    return destinationSubshell;
  }

  /**
   * Getter for the field <code>secondaryDestinationSubshell</code>.
   *
   * @return the secondary destination subshell, or null for a radiative transition.
   */
  public AtomicSubshell getSecondaryDestinationSubshell() {
    return secondaryDestinationSubshell;
  }

  /**
   * Getter for the field <code>satellite</code>.
   *
   * @return 0 for a diagram line, otherwise the satellite index.
   */
  public int getSatellite() {
    return satellite;
  }

  public boolean isRadiative() {
    return secondaryDestinationSubshell == null;
  }

  public boolean isNonradiative() {
    return !isRadiative();
  }

  /**
   * A Coster-Kronig transition is a nonradiative transition within one shell.
   *
   * @return true if this is a Coster-Kronig transition.
   */
  public boolean isCosterKronig() {
    return isNonradiative() && sourceSubshell.getN() == destinationSubshell.getN();
  }

  public boolean isDiagramLine() {
    return satellite == 0;
  }

  public boolean isSatellite() {
    return satellite != 0;
  }

  /**
   * IUPAC name of the transition: destination subshell, then source subshell (e.g. K-L3 or
   * K-L2L3). The satellite index of a satellite line follows in brackets (e.g. K-L3[1]).
   *
   * @return the IUPAC name.
   */
  public String getIupac() {
    StringBuilder sb = new StringBuilder();
    sb.append(destinationSubshell.getIupac()).append("-").append(sourceSubshell.getIupac());
    if (secondaryDestinationSubshell != null) {
      sb.append(secondaryDestinationSubshell.getIupac());
    }
    if (satellite != 0) {
      sb.append("[").append(satellite).append("]");
    }
    return sb.toString();
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
    Transition other = (Transition) o;
    return satellite == other.satellite
        && sourceSubshell.equals(other.sourceSubshell)
        && destinationSubshell.equals(other.destinationSubshell)
        && Objects.equals(secondaryDestinationSubshell, other.secondaryDestinationSubshell);
  }

  /** {@inheritDoc} */
  @Override
  public int hashCode() {
    return Objects.hash(sourceSubshell, destinationSubshell, secondaryDestinationSubshell,
        satellite);
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("Transition(");
    sb.append(format("[n=%d, l=%d, j=%.1f]", sourceSubshell.getN(), sourceSubshell.getL(),
        sourceSubshell.getJ()));
    sb.append(format(" -> [n=%d, l=%d, j=%.1f]", destinationSubshell.getN(),
        destinationSubshell.getL(), destinationSubshell.getJ()));
    if (secondaryDestinationSubshell != null) {
      sb.append(format(" -> [n=%d, l=%d, j=%.1f]", secondaryDestinationSubshell.getN(),
          secondaryDestinationSubshell.getL(), secondaryDestinationSubshell.getJ()));
    }
    if (satellite != 0) {
      sb.append(format(" satellite %d", satellite));
    }
    sb.append(")");
    return sb.toString();
  }
}
