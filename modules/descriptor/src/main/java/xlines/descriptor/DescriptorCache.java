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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The DescriptorCache interns descriptors for the lifetime of the process (or until {@link
 * #clear()} is called).
 * <p>
 * Each factory call is keyed by the descriptor type and its raw arguments. On a hit the cached
 * instance is returned without validating again. On a miss the supplied constructor validates and
 * normalizes the arguments; the new instance is then unified with any equal instance created from
 * different raw arguments (e.g. "EN" and "en" for a Language), so equal content always maps to the
 * identical object.
 * <p>
 * All access is guarded by a single lock.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class DescriptorCache {

  private static final Logger logger = Logger.getLogger(DescriptorCache.class.getName());

  private static final Object lock = new Object();
  /** Map from the descriptor type plus its raw arguments to the interned instance. */
  private static final Map<List<Object>, Descriptor> arguments = new HashMap<>();
  /** Map from each interned instance to itself, keyed by content. */
  private static final Map<Descriptor, Descriptor> instances = new HashMap<>();

  // Library class: make the default constructor private to ensure it's never constructed.
  private DescriptorCache() {}

  /**
   * Return the interned descriptor for the given raw arguments, creating it if necessary.
   *
   * @param type        the descriptor type.
   * @param args        the raw factory arguments (may contain nulls).
   * @param constructor validates the arguments and creates a new instance.
   * @param <T>         the descriptor type.
   * @return the interned instance.
   * @throws InvalidDescriptorException if the arguments are invalid.
   */
  static <T extends Descriptor> T intern(Class<T> type, Object[] args, Supplier<T> constructor) {
    List<Object> key = new ArrayList<>(args.length + 1);
    key.add(type);
    key.addAll(Arrays.asList(args));
    synchronized (lock) {
      Descriptor cached = arguments.get(key);
      if (cached != null) {
        return type.cast(cached);
      }
      T created = constructor.get();
      Descriptor existing = instances.putIfAbsent(created, created);
      T interned = (existing == null) ? created : type.cast(existing);
      arguments.put(key, interned);
      if (existing == null && logger.isLoggable(Level.FINEST)) {
        logger.finest(" Interned " + interned);
      }
      return interned;
    }
  }

  /**
   * Number of distinct interned descriptors.
   *
   * @return the number of interned descriptors.
   */
  public static int size() {
    synchronized (lock) {
      return instances.size();
    }
  }

  /** Remove all interned descriptors. Previously returned instances remain valid. */
  public static void clear() {
    synchronized (lock) {
      arguments.clear();
      instances.clear();
    }
  }
}
