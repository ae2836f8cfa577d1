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
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import xlines.descriptor.Reference;

/**
 * The MemoryPropertyStore class keeps property rows in memory, in insertion order.
 * <p>
 * Only the first row for a given (kind, subject, reference) is kept; later rows are logged and
 * ignored.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class MemoryPropertyStore implements PropertyStore {

  private static final Logger logger = Logger.getLogger(MemoryPropertyStore.class.getName());

  private final Map<PropertyKind, Map<PropertySubject, Map<Reference, PropertyRow>>> table =
      new EnumMap<>(PropertyKind.class);
  private final Map<PropertyKind, List<PropertyRow>> rows = new EnumMap<>(PropertyKind.class);

  /**
   * Add a row.
   *
   * @param row the PropertyRow.
   * @return true if the row was added, false if a row for the same kind, subject and reference
   *     was already present.
   */
  public synchronized boolean add(PropertyRow row) {
    Map<Reference, PropertyRow> byReference = table
        .computeIfAbsent(row.getKind(), k -> new LinkedHashMap<>())
        .computeIfAbsent(row.getSubject(), k -> new LinkedHashMap<>());
    PropertyRow existing = byReference.putIfAbsent(row.getReference(), row);
    if (existing != null) {
      logger.warning(format(" Ignoring duplicate row %s (keeping %s).", row, existing.getValue()));
      return false;
    }
    rows.computeIfAbsent(row.getKind(), k -> new ArrayList<>()).add(row);
    if (logger.isLoggable(Level.FINEST)) {
      logger.finest(format(" Added %s", row));
    }
    return true;
  }

  /**
   * Add every row of a parser.
   *
   * @param parser the PropertyParser.
   * @return the number of rows added.
   */
  public synchronized int addAll(PropertyParser parser) {
    int count = 0;
    for (PropertyRow row : parser) {
      if (add(row)) {
        count++;
      }
    }
    logger.fine(format(" Loaded %d rows from %s.", count, parser));
    return count;
  }

  /**
   * Total number of rows.
   *
   * @return the number of rows.
   */
  public synchronized int size() {
    int size = 0;
    for (List<PropertyRow> list : rows.values()) {
      size += list.size();
    }
    return size;
  }

  /** {@inheritDoc} */
  @Override
  public synchronized boolean hasProperty(PropertyKind kind, PropertySubject subject,
      Reference reference) {
    return find(kind, subject, reference) != null;
  }

  /** {@inheritDoc} */
  @Override
  public synchronized Object getProperty(PropertyKind kind, PropertySubject subject,
      Reference reference) {
    PropertyRow row = find(kind, subject, reference);
    return (row == null) ? null : row.getValue();
  }

  /** {@inheritDoc} */
  @Override
  public synchronized List<Reference> getReferences(PropertyKind kind, PropertySubject subject) {
    Map<PropertySubject, Map<Reference, PropertyRow>> bySubject = table.get(kind);
    if (bySubject == null || !bySubject.containsKey(subject)) {
      return Collections.emptyList();
    }
    return new ArrayList<>(bySubject.get(subject).keySet());
  }

  /** {@inheritDoc} */
  @Override
  public synchronized List<PropertyRow> getRows(PropertyKind kind) {
    List<PropertyRow> list = rows.get(kind);
    if (list == null) {
      return Collections.emptyList();
    }
    return new ArrayList<>(list);
  }

  private PropertyRow find(PropertyKind kind, PropertySubject subject, Reference reference) {
    Map<PropertySubject, Map<Reference, PropertyRow>> bySubject = table.get(kind);
    if (bySubject == null) {
      return null;
    }
    Map<Reference, PropertyRow> byReference = bySubject.get(subject);
    if (byReference == null) {
      return null;
    }
    return byReference.get(reference);
  }
}
