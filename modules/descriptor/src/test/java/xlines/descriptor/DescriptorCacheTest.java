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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.Test;
import xlines.utilities.XLinesTest;

/**
 * @author Michael J. Schnieders
 */
public class DescriptorCacheTest extends XLinesTest {

  @Test
  public void testEqualContentIsIdentical() {
    // Different raw arguments that normalize to the same content.
    Language lower = Language.of("fr");
    Language upper = Language.of("FR");
    Language padded = Language.of(" fr ");
    assertSame(lower, upper);
    assertSame(lower, padded);
  }

  @Test
  public void testClear() {
    Element before = Element.of(42);
    DescriptorCache.clear();
    Element after = Element.of(42);
    assertEquals(before, after);
    assertSame(after, Element.of(42));
    assertTrue(DescriptorCache.size() >= 1);
  }

  @Test
  public void testConcurrentInterning() throws Exception {
    int threads = 8;
    ExecutorService executor = Executors.newFixedThreadPool(threads);
    try {
      List<Callable<AtomicSubshell>> tasks = new ArrayList<>();
      for (int i = 0; i < 64; i++) {
        tasks.add(() -> AtomicSubshell.of(5, 3, 5));
      }
      List<Future<AtomicSubshell>> futures = executor.invokeAll(tasks);
      AtomicSubshell first = futures.get(0).get();
      for (Future<AtomicSubshell> future : futures) {
        assertSame(first, future.get());
      }
    } finally {
      executor.shutdownNow();
    }
  }
}
