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

import gnu.trove.map.TIntObjectMap;
import gnu.trove.map.hash.TIntObjectHashMap;
import org.roaringbitmap.RoaringBitmap;

import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Tag key id to {@link TagIndex} for one metric shard. Keys are only ever added. The key set is
 * also kept as a bitmap so it can be walked in ascending order at flush time.
 *
 * <p>The lock here only guards creating a tag key, which is rare. Writes to an existing key go
 * through that {@link TagIndex}'s own lock.
 */
public class TagIndexStore {

  private final TIntObjectMap<TagIndex> indexes;
  private final RoaringBitmap tagKeyIds = new RoaringBitmap();
  private final ReadWriteLock lock = new ReentrantReadWriteLock();
  private final int tagValueInitialCapacity;

  public TagIndexStore() {
    this(64, 16);
  }

  public TagIndexStore(final int initialCapacity, final int tagValueInitialCapacity) {
    this.indexes = new TIntObjectHashMap<>(initialCapacity);
    this.tagValueInitialCapacity = tagValueInitialCapacity;
  }

  /**
   * @return The index for the tag key or null if the key was never indexed.
   */
  public TagIndex get(final int tagKeyId) {
    lock.readLock().lock();
    try {
      return indexes.get(tagKeyId);
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Stores the index if the tag key doesn't have one yet.
   *
   * @return The index retained for the tag key, either the existing one or the given one.
   */
  public TagIndex putIfAbsent(final int tagKeyId, final TagIndex tagIndex) {
    lock.writeLock().lock();
    try {
      TagIndex extant = indexes.get(tagKeyId);
      if (extant != null) {
        return extant;
      }
      indexes.put(tagKeyId, tagIndex);
      tagKeyIds.add(tagKeyId);
      return tagIndex;
    } finally {
      lock.writeLock().unlock();
    }
  }

  public TagIndex getOrCreate(final int tagKeyId) {
    TagIndex tagIndex = get(tagKeyId);
    if (tagIndex != null) {
      return tagIndex;
    }
    return putIfAbsent(tagKeyId, new TagIndex(tagValueInitialCapacity));
  }

  /**
   * @return A copy of the tag key ids, iterating in ascending unsigned order.
   */
  public RoaringBitmap tagKeyIds() {
    lock.readLock().lock();
    try {
      return tagKeyIds.clone();
    } finally {
      lock.readLock().unlock();
    }
  }

  public int size() {
    lock.readLock().lock();
    try {
      return indexes.size();
    } finally {
      lock.readLock().unlock();
    }
  }
}
