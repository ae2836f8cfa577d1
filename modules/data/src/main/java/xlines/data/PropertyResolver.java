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
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.apache.commons.configuration2.CompositeConfiguration;
import xlines.descriptor.Reference;
import xlines.utilities.XLinesProperties;

/**
 * The PropertyResolver class selects one value of a property for a subject from a {@link
 * PropertyStore} whose references may disagree.
 * <p>
 * If a reference is requested, only its row is returned. Otherwise the first reference of the
 * priority list that reports a value wins; if none does, the first inserted row is returned. Values
 * of different references are never merged.
 * <p>
 * The priority list is a list of BibTeX keys (highest priority first). It may be configured with
 * the property xlines.reference.priority (a comma separated list).
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class PropertyResolver {

  private static final Logger logger = Logger.getLogger(PropertyResolver.class.getName());

  private final PropertyStore store;
  private final Object lock = new Object();
  private List<String> referencePriority = Collections.emptyList();

  /**
   * Constructor for a resolver with an empty priority list.
   *
   * @param store the PropertyStore.
   */
  public PropertyResolver(PropertyStore store) {
    this.store = store;
  }

  /**
   * Constructor for a resolver whose priority list is read from the properties.
   *
   * @param store      the PropertyStore.
   * @param properties a CompositeConfiguration (see {@link XLinesProperties#loadProperties()}).
   */
  public PropertyResolver(PropertyStore store, CompositeConfiguration properties) {
    this(store);
    List<String> priority = new ArrayList<>();
    if (properties != null && properties.containsKey(XLinesProperties.REFERENCE_PRIORITY)) {
      for (String value : properties.getStringArray(XLinesProperties.REFERENCE_PRIORITY)) {
        for (String key : value.split(",")) {
          if (!key.trim().isEmpty()) {
            priority.add(key.trim());
          }
        }
      }
    }
    setReferencePriority(priority);
  }

  public PropertyStore getStore() {
    return store;
  }

  /**
   * Getter for the reference priority list.
   *
   * @return an unmodifiable copy of the BibTeX keys, highest priority first.
   */
  public List<String> getReferencePriority() {
    synchronized (lock) {
      return referencePriority;
    }
  }

  /**
   * Replace the reference priority list.
   *
   * @param bibtexkeys BibTeX keys, highest priority first.
   */
  public void setReferencePriority(List<String> bibtexkeys) {
    List<String> priority = Collections.unmodifiableList(new ArrayList<>(bibtexkeys));
    synchronized (lock) {
      referencePriority = priority;
    }
    if (logger.isLoggable(Level.FINE)) {
      logger.fine(format(" Reference priority: %s", priority));
    }
  }

  /**
   * Replace the reference priority list.
   *
   * @param bibtexkeys BibTeX keys, highest priority first.
   */
  public void setReferencePriority(String... bibtexkeys) {
    setReferencePriority(Arrays.asList(bibtexkeys));
  }

  /**
   * Resolve a property using the priority list.
   *
   * @param kind    the property kind.
   * @param subject the subject.
   * @return the value.
   * @throws PropertyNotFoundException if no reference reports a value.
   */
  public Object lookup(PropertyKind kind, PropertySubject subject) {
    return lookup(kind, subject, (String) null);
  }

  /**
   * Resolve a property from the reference with the given BibTeX key.
   *
   * @param kind      the property kind.
   * @param subject   the subject.
   * @param bibtexkey BibTeX key of the requested reference, or null to use the priority list.
   * @return the value.
   * @throws AmbiguousReferenceException if the reference has no value but others do.
   * @throws PropertyNotFoundException   if no reference reports a value.
   */
  public Object lookup(PropertyKind kind, PropertySubject subject, String bibtexkey) {
    List<Reference> references = store.getReferences(kind, subject);
    if (bibtexkey != null) {
      for (Reference reference : references) {
        if (reference.getBibtexkey().equals(bibtexkey)) {
          return store.getProperty(kind, subject, reference);
        }
      }
      throw missing(kind, subject, bibtexkey, references);
    }
    return resolve(kind, subject, references);
  }

  /**
   * Resolve a property from the given reference.
   *
   * @param kind      the property kind.
   * @param subject   the subject.
   * @param reference the requested reference, or null to use the priority list.
   * @return the value.
   * @throws AmbiguousReferenceException if the reference has no value but others do.
   * @throws PropertyNotFoundException   if no reference reports a value.
   */
  public Object lookup(PropertyKind kind, PropertySubject subject, Reference reference) {
    if (reference == null) {
      return lookup(kind, subject);
    }
    if (store.hasProperty(kind, subject, reference)) {
      return store.getProperty(kind, subject, reference);
    }
    throw missing(kind, subject, reference.getBibtexkey(), store.getReferences(kind, subject));
  }

  /**
   * Resolve a numeric property.
   *
   * @param kind      the property kind.
   * @param subject   the subject.
   * @param bibtexkey BibTeX key of the requested reference, or null to use the priority list.
   * @return the value.
   */
  public double lookupDouble(PropertyKind kind, PropertySubject subject, String bibtexkey) {
    return ((Number) lookup(kind, subject, bibtexkey)).doubleValue();
  }

  /**
   * Resolve a text property.
   *
   * @param kind      the property kind.
   * @param subject   the subject.
   * @param bibtexkey BibTeX key of the requested reference, or null to use the priority list.
   * @return the value.
   */
  public String lookupString(PropertyKind kind, PropertySubject subject, String bibtexkey) {
    return lookup(kind, subject, bibtexkey).toString();
  }

  private Object resolve(PropertyKind kind, PropertySubject subject, List<Reference> references) {
    if (references.isEmpty()) {
      throw new PropertyNotFoundException(
          format(" No %s found for %s.", kind.getKeyword(), subject), kind, subject, null);
    }
    for (String bibtexkey : getReferencePriority()) {
      for (Reference reference : references) {
        if (reference.getBibtexkey().equals(bibtexkey)) {
          return store.getProperty(kind, subject, reference);
        }
      }
    }
    return store.getProperty(kind, subject, references.get(0));
  }

  private static PropertyNotFoundException missing(PropertyKind kind, PropertySubject subject,
      String bibtexkey, List<Reference> references) {
    if (references.isEmpty()) {
      return new PropertyNotFoundException(
          format(" No %s found for %s in reference %s.", kind.getKeyword(), subject, bibtexkey),
          kind, subject, bibtexkey);
    }
    List<String> available = new ArrayList<>();
    for (Reference reference : references) {
      available.add(reference.getBibtexkey());
    }
    return new AmbiguousReferenceException(
        format(" No %s found for %s in reference %s (available: %s).", kind.getKeyword(), subject,
            bibtexkey, available), kind, subject, bibtexkey, available);
  }
}
