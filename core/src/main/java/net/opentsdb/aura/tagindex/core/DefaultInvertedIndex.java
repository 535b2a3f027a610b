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

import com.codahale.metrics.Counter;
import com.codahale.metrics.MetricRegistry;
import com.google.common.base.Preconditions;
import net.opentsdb.aura.tagindex.flush.InvertedIndexFlusher;
import net.opentsdb.aura.tagindex.meta.IdGenerationException;
import net.opentsdb.aura.tagindex.meta.Metadata;
import net.opentsdb.aura.tagindex.meta.MetadataDatabase;
import net.opentsdb.aura.tagindex.meta.TagMetadata;
import net.opentsdb.aura.tagindex.query.DefaultGroupingContext;
import net.opentsdb.aura.tagindex.query.GroupingContext;
import net.opentsdb.aura.tagindex.query.TagValuesEntrySet;
import org.roaringbitmap.PeekableIntIterator;
import org.roaringbitmap.RoaringBitmap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

public class DefaultInvertedIndex implements InvertedIndex {

  public static final String M_SERIES_INDEXED = "index.series.indexed";
  public static final String M_TAG_KEY_FAILURES = "index.tagkey.failures";
  public static final String M_TAG_VALUE_FAILURES = "index.tagvalue.failures";

  private final IndexConfig config;
  private final TagIndexStore store;
  private final Metadata metadata;
  private final Logger logger;
  private final Lock flushLock = new ReentrantLock();

  private final Counter seriesIndexed;
  private final Counter tagKeyFailures;
  private final Counter tagValueFailures;

  public DefaultInvertedIndex(
      final IndexConfig config, final Metadata metadata, final MetricRegistry registry) {
    this(config, metadata, registry, LoggerFactory.getLogger(DefaultInvertedIndex.class));
  }

  public DefaultInvertedIndex(
      final IndexConfig config,
      final Metadata metadata,
      final MetricRegistry registry,
      final Logger logger) {
    this.config = config.validate();
    this.metadata = Preconditions.checkNotNull(metadata, "metadata");
    this.logger = Preconditions.checkNotNull(logger, "logger");
    this.store = new TagIndexStore(config.tagKeyInitialCapacity, config.tagValueInitialCapacity);
    this.seriesIndexed = registry.counter(M_SERIES_INDEXED);
    this.tagKeyFailures = registry.counter(M_TAG_KEY_FAILURES);
    this.tagValueFailures = registry.counter(M_TAG_VALUE_FAILURES);
  }

  @Override
  public RoaringBitmap getSeriesIdsByTagValueIds(
      final int tagKeyId, final RoaringBitmap tagValueIds) throws NotFoundException {
    return getTagIndex(tagKeyId).getSeriesIdsByTagValueIds(tagValueIds);
  }

  @Override
  public RoaringBitmap getSeriesIdsForTag(final int tagKeyId) throws NotFoundException {
    return getTagIndex(tagKeyId).getAllSeriesIds();
  }

  @Override
  public GroupingContext getGroupingContext(final int[] tagKeyIds) throws NotFoundException {
    Preconditions.checkNotNull(tagKeyIds, "tagKeyIds");
    DefaultGroupingContext context = new DefaultGroupingContext(tagKeyIds.length);
    for (int i = 0; i < tagKeyIds.length; i++) {
      // tag values are resolved when the series get scanned.
      TagIndex tagIndex = getTagIndex(tagKeyIds[i]);
      context.setTagValuesEntrySet(i, new TagValuesEntrySet(tagKeyIds[i], tagIndex));
    }
    return context;
  }

  @Override
  public void buildInvertedIndex(
      final String namespace,
      final String metricName,
      final Map<String, String> tags,
      final int seriesId) {
    if (tags == null || tags.isEmpty()) {
      buildInvertedIndex(
          namespace, metricName, IndexConfig.NO_TAGS_KEY, IndexConfig.NO_TAGS_VALUE, seriesId);
    } else {
      for (Map.Entry<String, String> tag : tags.entrySet()) {
        buildInvertedIndex(namespace, metricName, tag.getKey(), tag.getValue(), seriesId);
      }
    }
    seriesIndexed.inc();
  }

  private void buildInvertedIndex(
      final String namespace,
      final String metricName,
      final String tagKey,
      final String tagValue,
      final int seriesId) {
    final MetadataDatabase metadataDatabase = metadata.metadataDatabase();
    final TagMetadata tagMetadata = metadata.tagMetadata();

    final int tagKeyId;
    try {
      tagKeyId = metadataDatabase.genTagKeyId(namespace, metricName, tagKey);
    } catch (IdGenerationException e) {
      tagKeyFailures.inc();
      logger.error(
          "Gen tag key id failed, skipping index build for tag key: {} metric: {} series: {} shardId: {}",
          tagKey, metricName, Integer.toUnsignedString(seriesId), config.shardId, e);
      return;
    }

    final int tagValueId;
    try {
      tagValueId = tagMetadata.genTagValueId(tagKeyId, tagValue);
    } catch (IdGenerationException e) {
      tagValueFailures.inc();
      logger.error(
          "Gen tag value id failed, skipping index build for tag: {}={} metric: {} series: {} shardId: {}",
          tagKey, tagValue, metricName, Integer.toUnsignedString(seriesId), config.shardId, e);
      return;
    }

    store.getOrCreate(tagKeyId).buildInvertedIndex(tagValueId, seriesId);
  }

  @Override
  public void flushInvertedIndexTo(final InvertedIndexFlusher flusher) throws IOException {
    Preconditions.checkNotNull(flusher, "flusher");
    flushLock.lock();
    try {
      final RoaringBitmap tagKeyIds = store.tagKeyIds();
      logger.info(
          "Flushing inverted index for namespace: {} shard: {} tag keys: {}",
          config.namespace, config.shardId, tagKeyIds.getCardinality());
      final PeekableIntIterator it = tagKeyIds.getIntIterator();
      while (it.hasNext()) {
        final int tagKeyId = it.next();
        final List<TagIndex.Entry> entries = store.get(tagKeyId).snapshot();
        for (TagIndex.Entry entry : entries) {
          RoaringBitmap seriesIds = entry.getSeriesIds();
          if (config.runOptimizeOnFlush) {
            seriesIds.runOptimize();
          }
          flusher.flushTagValue(entry.getTagValueId(), seriesIds);
        }
        flusher.flushTagKeyId(tagKeyId);
        if (logger.isDebugEnabled()) {
          logger.debug(
              "Flushed tag key: {} values: {} namespace: {} shard: {}",
              Integer.toUnsignedString(tagKeyId), entries.size(), config.namespace, config.shardId);
        }
      }
    } finally {
      flushLock.unlock();
    }
  }

  /**
   * @return The number of tag keys indexed.
   */
  public int tagKeyCount() {
    return store.size();
  }

  private TagIndex getTagIndex(final int tagKeyId) throws NotFoundException {
    TagIndex tagIndex = store.get(tagKeyId);
    if (tagIndex == null) {
      throw new NotFoundException(tagKeyId);
    }
    return tagIndex;
  }
}
