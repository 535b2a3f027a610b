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

import com.google.common.collect.Maps;
import org.roaringbitmap.PeekableIntIterator;
import org.roaringbitmap.RoaringBitmap;

import java.util.Map;

public class DefaultGroupingContext implements GroupingContext {

  private final TagValuesEntrySet[] entrySets;

  public DefaultGroupingContext(final int size) {
    this.entrySets = new TagValuesEntrySet[size];
  }

  public void setTagValuesEntrySet(final int index, final TagValuesEntrySet entrySet) {
    entrySets[index] = entrySet;
  }

  @Override
  public int[] getTagKeyIds() {
    int[] tagKeyIds = new int[entrySets.length];
    for (int i = 0; i < entrySets.length; i++) {
      tagKeyIds[i] = entrySets[i].getTagKeyId();
    }
    return tagKeyIds;
  }

  @Override
  public int size() {
    return entrySets.length;
  }

  @Override
  public TagValuesEntrySet getTagValuesEntrySet(final int index) {
    return entrySets[index];
  }

  @Override
  public GroupKey getGroupKey(final int seriesId) {
    int[] tagValueIds = new int[entrySets.length];
    boolean[] absent = new boolean[entrySets.length];
    for (int i = 0; i < entrySets.length; i++) {
      if (entrySets[i].hasTagValue(seriesId)) {
        tagValueIds[i] = entrySets[i].getTagValueId(seriesId);
      } else {
        absent[i] = true;
      }
    }
    return new GroupKey(tagValueIds, absent);
  }

  @Override
  public Map<GroupKey, RoaringBitmap> group(final RoaringBitmap seriesIds) {
    for (int i = 0; i < entrySets.length; i++) {
      entrySets[i].resolve(seriesIds);
    }

    Map<GroupKey, RoaringBitmap> groups = Maps.newHashMap();
    final PeekableIntIterator it = seriesIds.getIntIterator();
    while (it.hasNext()) {
      final int seriesId = it.next();
      GroupKey key = getGroupKey(seriesId);
      RoaringBitmap rr = groups.get(key);
      if (rr == null) {
        groups.put(key, RoaringBitmap.bitmapOf(seriesId));
      } else {
        rr.add(seriesId);
      }
    }
    return groups;
  }
}
