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

package net.opentsdb.aura.tagindex.query;

import gnu.trove.impl.Constants;
import gnu.trove.map.TIntIntMap;
import gnu.trove.map.hash.TIntIntHashMap;
import net.opentsdb.aura.tagindex.core.TagIndex;
import org.roaringbitmap.RoaringBitmap;

/**
 * The tag values of one tag key, resolved lazily for the series a query actually scans. Resolved
 * series are cached so each one is only looked up once per query.
 */
public class TagValuesEntrySet {

  /**
   * Returned by {@link #getTagValueId(int)} for a series without a value under the key. It is
   * also a valid unsigned tag value id, so use {@link #hasTagValue(int)} to tell them apart.
   */
  public static final int NO_TAG_VALUE = -1;

  private final int tagKeyId;
  private final TagIndex tagIndex;
  private final TIntIntMap seriesToTagValue;
  private final RoaringBitmap resolved = new RoaringBitmap();

  public TagValuesEntrySet(final int tagKeyId, final TagIndex tagIndex) {
    this.tagKeyId = tagKeyId;
    this.tagIndex = tagIndex;
    this.seriesToTagValue =
        new TIntIntHashMap(
            Constants.DEFAULT_CAPACITY, Constants.DEFAULT_LOAD_FACTOR, 0, NO_TAG_VALUE);
  }

  public int getTagKeyId() {
    return tagKeyId;
  }

  /**
   * Resolves the tag values of the series not seen yet.
   *
   * @param seriesIds The series about to be scanned.
   */
  public void resolve(final RoaringBitmap seriesIds) {
    RoaringBitmap pending = RoaringBitmap.andNot(seriesIds, resolved);
    if (pending.isEmpty()) {
      return;
    }
    tagIndex.collectTagValues(pending, seriesToTagValue);
    resolved.or(pending);
  }

  /**
   * @return True if the series carries a value under this key.
   */
  public boolean hasTagValue(final int seriesId) {
    if (!resolved.contains(seriesId)) {
      resolve(RoaringBitmap.bitmapOf(seriesId));
    }
    return seriesToTagValue.containsKey(seriesId);
  }

  /**
   * @return The tag value id of the series under this key or {@link #NO_TAG_VALUE}.
   */
  public int getTagValueId(final int seriesId) {
    if (!resolved.contains(seriesId)) {
      resolve(RoaringBitmap.bitmapOf(seriesId));
    }
    return seriesToTagValue.get(seriesId);
  }

  public int resolvedCount() {
    return resolved.getCardinality();
  }
}
