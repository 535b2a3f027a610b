/*
 * This file is part of OpenTSDB.
 * Copyright (C) 2021  Yahoo.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package net.opentsdb.aura.tagindex.core;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TagIndexStoreTest {

  @Test
  public void testGetMissing() {
    TagIndexStore store = new TagIndexStore();
    assertNull(store.get(1));
    assertEquals(0, store.size());
    assertTrue(store.tagKeyIds().isEmpty());
  }

  @Test
  public void testPutIfAbsentKeepsFirst() {
    TagIndexStore store = new TagIndexStore();
    TagIndex first = new TagIndex();
    TagIndex second = new TagIndex();

    assertSame(first, store.putIfAbsent(1, first));
    assertSame(first, store.putIfAbsent(1, second));
    assertSame(first, store.get(1));
    assertSame(first, store.getOrCreate(1));
    assertEquals(1, store.size());
  }

  @Test
  public void testTagKeyIdsAscendingUnsigned() {
    TagIndexStore store = new TagIndexStore();
    store.getOrCreate(5);
    store.getOrCreate(-2);
    store.getOrCreate(1);
    store.getOrCreate(3);

    assertArrayEquals(new int[] {1, 3, 5, -2}, store.tagKeyIds().toArray());
  }

  @Test
  public void testConcurrentCreateRetainsOneIndex() throws Exception {
    final TagIndexStore store = new TagIndexStore();
    final int threads = 8;
    final CountDownLatch start = new CountDownLatch(1);
    ExecutorService pool = Executors.newFixedThreadPool(threads);
    try {
      List<Future<TagIndex>> futures = new ArrayList<>();
      for (int i = 0; i < threads; i++) {
        futures.add(pool.submit(() -> {
          start.await();
          return store.getOrCreate(42);
        }));
      }
      start.countDown();

      for (Future<TagIndex> future : futures) {
        assertSame(store.get(42), future.get(10, TimeUnit.SECONDS));
      }
      assertEquals(1, store.size());
    } finally {
      pool.shutdownNow();
    }
  }
}
