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

import org.roaringbitmap.RoaringBitmap;

import java.util.Map;

/**
 * Per query state used by group by to find the tag values of the scanned series. Position
 * {@code i} of the context corresponds to the {@code i}th tag key requested. Instances are not
 * thread safe and are discarded once the query completes.
 */
public interface GroupingContext {

  /**
   * @return The requested tag key ids in the order they were requested.
   */
  int[] getTagKeyIds();

  int size();

  TagValuesEntrySet getTagValuesEntrySet(int index);

  /**
   * @param seriesId A series id seen during the scan.
   * @return The tag value id under each tag key, aligned with {@link #getTagKeyIds()}. Keys the
   *     series doesn't carry are marked absent in the key.
   */
  GroupKey getGroupKey(int seriesId);

  /**
   * Buckets the series by their tag value ids.
   *
   * @param seriesIds The series to group.
   * @return One bitmap of series per distinct combination of tag values.
   */
  Map<GroupKey, RoaringBitmap> group(RoaringBitmap seriesIds);
}
