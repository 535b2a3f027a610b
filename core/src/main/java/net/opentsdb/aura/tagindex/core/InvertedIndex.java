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

import net.opentsdb.aura.tagindex.flush.InvertedIndexFlusher;
import net.opentsdb.aura.tagindex.query.GroupingContext;
import org.roaringbitmap.RoaringBitmap;

import java.io.IOException;
import java.util.Map;

/**
 * The tag inverted index of a shard: tag value to the series carrying it. Every operation is
 * safe to call concurrently with the others. Bitmaps returned are owned by the caller.
 */
public interface InvertedIndex {

  /**
   * @param tagKeyId The tag key to look under.
   * @param tagValueIds The tag values to match.
   * @return The union of the series of the tag values, empty if none matched.
   * @throws NotFoundException if the tag key was never indexed in this shard.
   */
  RoaringBitmap getSeriesIdsByTagValueIds(int tagKeyId, RoaringBitmap tagValueIds)
      throws NotFoundException;

  /**
   * @param tagKeyId The tag key to look under.
   * @return Every series carrying the tag key.
   * @throws NotFoundException if the tag key was never indexed in this shard.
   */
  RoaringBitmap getSeriesIdsForTag(int tagKeyId) throws NotFoundException;

  /**
   * Creates the context used to bucket the series of a group by query. Either every key is valid
   * and a context is returned, or nothing is.
   *
   * @param tagKeyIds The group by keys. Their order is kept in the context.
   * @return The grouping context.
   * @throws NotFoundException for the first tag key never indexed in this shard.
   */
  GroupingContext getGroupingContext(int[] tagKeyIds) throws NotFoundException;

  /**
   * Indexes a new series under each of its tags. A series without tags is indexed under
   * {@link IndexConfig#NO_TAGS_KEY}. Tags whose ids can't be resolved are logged and skipped,
   * the remaining tags are still indexed.
   *
   * @param namespace The namespace of the metric.
   * @param metricName The metric name.
   * @param tags The tags of the series, may be null or empty.
   * @param seriesId The id of the series.
   */
  void buildInvertedIndex(String namespace, String metricName, Map<String, String> tags, int seriesId);

  /**
   * Walks the tag keys in ascending order and, for each, passes its tag values to the flusher
   * before closing the key. Stops at the first error.
   *
   * @param flusher The non-null flusher.
   * @throws IOException the error raised by the flusher, unchanged.
   */
  void flushInvertedIndexTo(InvertedIndexFlusher flusher) throws IOException;
}
