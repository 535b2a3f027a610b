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

import gnu.trove.map.TIntIntMap;
import gnu.trove.map.TIntObjectMap;
import gnu.trove.map.hash.TIntObjectHashMap;
import org.roaringbitmap.PeekableIntIterator;
import org.roaringbitmap.RoaringBitmap;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Inverted index of a single tag key: tag value id to the ids of the series carrying that value.
 * Also keeps the union of all the series under the key so {@link #getAllSeriesIds()} doesn't have
 * to OR every value bitmap.
 *
 * <p>Writers and readers are serialized by a lock local to this tag key. Every read returns a
 * copy so callers never see a bitmap being mutated.
 */
public class TagIndex {

  private final TIntObjectMap<RoaringBitmap> values;
  private final RoaringBitmap allSeries = new RoaringBitmap();
  private final ReadWriteLock lock = new ReentrantReadWriteLock();

  public TagIndex() {
    this(16);
  }

  public TagIndex(final int initialCapacity) {
    this.values = new TIntObjectHashMap<>(initialCapacity);
  }

  public void buildInvertedIndex(final int tagValueId, final int seriesId) {
    lock.writeLock().lock();
    try {
      RoaringBitmap rr = values.get(tagValueId);
      if (rr == null) {
        values.put(tagValueId, RoaringBitmap.bitmapOf(seriesId));
      } else {
        rr.add(seriesId);
      }
      allSeries.add(seriesId);
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * ORs the series of the requested tag values. Values that were never indexed are ignored.
   *
   * @param tagValueIds The non-null tag value ids to look up.
   * @return A new bitmap, empty if none of the values matched.
   */
  public RoaringBitmap getSeriesIdsByTagValueIds(final RoaringBitmap tagValueIds) {
    List<RoaringBitmap> matched = new ArrayList<>();
    lock.readLock().lock();
    try {
      final PeekableIntIterator it = tagValueIds.getIntIterator();
      while (it.hasNext()) {
        RoaringBitmap rr = values.get(it.next());
        if (rr != null) {
          matched.add(rr);
        }
      }
      return SeriesIds.union(matched);
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * @return A copy of the union of every series indexed under this tag key.
   */
  public RoaringBitmap getAllSeriesIds() {
    lock.readLock().lock();
    try {
      return allSeries.clone();
    } finally {
      lock.readLock().unlock();
    }
  }

  public RoaringBitmap getTagValueIds() {
    lock.readLock().lock();
    try {
      return RoaringBitmap.bitmapOf(values.keys());
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Number of distinct tag values.
   */
  public int cardinality() {
    lock.readLock().lock();
    try {
      return values.size();
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Resolves the tag value of each of the given series and stores it in the sink keyed by series
   * id. Series that aren't indexed under this key are left out of the sink.
   *
   * @param seriesIds The series to resolve.
   * @param sink The map receiving series id to tag value id.
   */
  public void collectTagValues(final RoaringBitmap seriesIds, final TIntIntMap sink) {
    lock.readLock().lock();
    try {
      if (!RoaringBitmap.intersects(allSeries, seriesIds)) {
        return;
      }
      values.forEachEntry((tagValueId, rr) -> {
        if (RoaringBitmap.intersects(rr, seriesIds)) {
          final PeekableIntIterator it = RoaringBitmap.and(rr, seriesIds).getIntIterator();
          while (it.hasNext()) {
            sink.put(it.next(), tagValueId);
          }
        }
        return true;
      });
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Copies every tag value and its series under the read lock.
   *
   * @return The entries in ascending unsigned tag value id order.
   */
  public List<Entry> snapshot() {
    lock.readLock().lock();
    try {
      int[] tagValueIds = SeriesIds.sortUnsigned(values.keys());
      List<Entry> entries = new ArrayList<>(tagValueIds.length);
      for (int i = 0; i < tagValueIds.length; i++) {
        entries.add(new Entry(tagValueIds[i], values.get(tagValueIds[i]).clone()));
      }
      return entries;
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * A tag value id and a private copy of its series.
   */
  public static final class Entry {

    private final int tagValueId;
    private final RoaringBitmap seriesIds;

    public Entry(final int tagValueId, final RoaringBitmap seriesIds) {
      this.tagValueId = tagValueId;
      this.seriesIds = seriesIds;
    }

    public int getTagValueId() {
      return tagValueId;
    }

    public RoaringBitmap getSeriesIds() {
      return seriesIds;
    }
  }
}
