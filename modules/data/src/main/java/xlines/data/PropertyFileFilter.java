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

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.net.MalformedURLException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.apache.commons.io.FilenameUtils;
import xlines.descriptor.AtomicSubshell;
import xlines.descriptor.Descriptor;
import xlines.descriptor.Element;
import xlines.descriptor.InvalidDescriptorException;
import xlines.descriptor.Language;
import xlines.descriptor.Reference;
import xlines.descriptor.Transition;

/**
 * The PropertyFileFilter class parses a plain text property table.
 * <p>
 * Each non-blank line that does not start with # holds one row as five whitespace separated
 * columns:
 * <pre>
 * kind  z  qualifier  value  bibtexkey
 * </pre>
 * The kind is a {@link PropertyKind} keyword (e.g. transition_energy). The qualifier is "-" for
 * element properties, a language code for element names, an IUPAC subshell name (e.g. L3) for
 * subshell properties, or an IUPAC transition name (e.g. K-L3) for transition properties. A
 * satellite index may follow a transition name in brackets (e.g. K-L3[1]).
 * <p>
 * Malformed lines are logged and skipped.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class PropertyFileFilter implements PropertyParser {

  private static final Logger logger = Logger.getLogger(PropertyFileFilter.class.getName());

  private final URL url;
  private final String name;
  private final List<PropertyRow> rows = new ArrayList<>();
  private int skipped = 0;

  /**
   * Constructor for PropertyFileFilter.
   *
   * @param file the property table.
   */
  public PropertyFileFilter(File file) {
    this(toURL(file), FilenameUtils.getName(file.getPath()));
  }

  /**
   * Constructor for PropertyFileFilter.
   *
   * @param url the property table (e.g. a class path resource).
   */
  public PropertyFileFilter(URL url) {
    this(url, (url == null) ? null : FilenameUtils.getName(url.getPath()));
  }

  private PropertyFileFilter(URL url, String name) {
    this.url = url;
    this.name = name;
  }

  /**
   * Read the property table.
   *
   * @return true if the table was read, false if it could not be opened or read.
   */
  public boolean readFile() {
    rows.clear();
    skipped = 0;
    if (url == null) {
      logger.warning(" No property table to read.");
      return false;
    }
    try (BufferedReader br = new BufferedReader(
        new InputStreamReader(url.openStream(), StandardCharsets.UTF_8))) {
      String line;
      int lineNumber = 0;
      while ((line = br.readLine()) != null) {
        lineNumber++;
        line = line.trim();
        if (line.isEmpty() || line.startsWith("#")) {
          continue;
        }
        PropertyRow row = parseLine(line, lineNumber);
        if (row == null) {
          skipped++;
        } else {
          rows.add(row);
          if (logger.isLoggable(Level.FINE)) {
            logger.fine(format(" %s:%d %s", name, lineNumber, row));
          }
        }
      }
    } catch (IOException e) {
      logger.warning(format(" Exception reading %s: %s", name, e));
      return false;
    }
    logger.fine(format(" Read %d rows from %s (%d skipped).", rows.size(), name, skipped));
    return true;
  }

  /**
   * Parsed rows, in file order.
   *
   * @return an unmodifiable List of rows.
   */
  public List<PropertyRow> getRows() {
    return Collections.unmodifiableList(rows);
  }

  /**
   * Number of malformed lines skipped by the last read.
   *
   * @return the number of skipped lines.
   */
  public int getSkipped() {
    return skipped;
  }

  /** {@inheritDoc} */
  @Override
  public Iterator<PropertyRow> iterator() {
    return getRows().iterator();
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return format("Property table %s", name);
  }

  private PropertyRow parseLine(String line, int lineNumber) {
    String[] tokens = line.split("\\s+");
    if (tokens.length != 5) {
      logger.warning(format(" %s:%d expected 5 columns: %s", name, lineNumber, line));
      return null;
    }
    PropertyKind kind = PropertyKind.fromKeyword(tokens[0]);
    if (kind == null) {
      logger.warning(format(" %s:%d unknown property %s", name, lineNumber, tokens[0]));
      return null;
    }
    try {
      Element element = Element.of(Integer.parseInt(tokens[1]));
      Descriptor qualifier = parseQualifier(kind, tokens[2]);
      Object value = (kind.getValueType() == Double.class) ? Double.valueOf(tokens[3]) : tokens[3];
      Reference reference = Reference.of(tokens[4]);
      return new PropertyRow(kind, new PropertySubject(element, qualifier), reference, value);
    } catch (NumberFormatException e) {
      logger.warning(format(" %s:%d invalid number: %s", name, lineNumber, line));
    } catch (IllegalArgumentException e) {
      // Includes InvalidDescriptorException.
      logger.warning(format(" %s:%d %s", name, lineNumber, e.getMessage()));
    }
    return null;
  }

  /**
   * Parse the qualifier column of a row.
   *
   * @param kind  the property kind.
   * @param token the qualifier column.
   * @return the qualifier, or null for element properties.
   * @throws InvalidDescriptorException if the qualifier is malformed.
   */
  static Descriptor parseQualifier(PropertyKind kind, String token) {
    Class<? extends Descriptor> type = kind.getQualifierType();
    if (type == null) {
      if (!token.equals("-")) {
        throw new IllegalArgumentException(
            format(" Property %s does not accept the qualifier %s.", kind.getKeyword(), token));
      }
      return null;
    }
    if (type == Language.class) {
      return Language.of(token);
    }
    if (type == AtomicSubshell.class) {
      return AtomicSubshell.fromIupac(token);
    }
    return Transition.fromIupac(token);
  }

  private static URL toURL(File file) {
    try {
      return file.toURI().toURL();
    } catch (MalformedURLException e) {
      logger.warning(format(" Invalid file name %s: %s", file, e));
      return null;
    }
  }
}
