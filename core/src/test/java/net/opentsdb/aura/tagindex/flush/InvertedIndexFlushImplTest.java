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

package net.opentsdb.aura.tagindex.flush;

import com.codahale.metrics.MetricRegistry;
import com.google.common.collect.ImmutableMap;
import com.google.common.util.concurrent.MoreExecutors;
import net.opentsdb.aura.tagindex.core.DefaultInvertedIndex;
import net.opentsdb.aura.tagindex.core.IndexConfig;
import net.opentsdb.aura.tagindex.meta.TestMetadata;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.roaringbitmap.RoaringBitmap;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class InvertedIndexFlushImplTest {

  private final ExecutorService executorService = MoreExecutors.newDirectExecutorService();
  private MetricRegistry registry;
  private TestMetadata metadata;
  private DefaultInvertedIndex index;
  private TestUploader uploader;
  private IndexConfig config;

  @BeforeEach
  public void beforeEach() {
    registry = new MetricRegistry();
    metadata = new TestMetadata()
        .withTagKeyId("host", 2)
        .withTagKeyId("colo", 1)
        .withTagValueId(2, "web01", 20)
        .withTagValueId(2, "web02", 21)
        .withTagValueId(1, "lga", 10);
    config = new IndexConfig();
    config.namespace = "ns";
    config.shardId = 4;
    index = new DefaultInvertedIndex(config, metadata, registry);
    index.buildInvertedIndex("ns", "m", ImmutableMap.of("host", "web01", "colo", "lga"), 1);
    index.buildInvertedIndex("ns", "m", ImmutableMap.of("host", "web02", "colo", "lga"), 2);
    uploader = new TestUploader(4);
  }

  @AfterEach
  public void afterEach() {
    executorService.shutdown();
  }

  @Test
  public void testFlushShard() throws Exception {
    InvertedIndexFlushImpl flush =
        new InvertedIndexFlushImpl(shardId -> uploader, executorService, registry, config);
    FlushStatus status = flush.flushShard(index, 1620000000);

    assertFalse(status.inProgress());
    assertFalse(status.failed());
    assertEquals(3600, flush.frequency());
    assertEquals(1, uploader.getUploads());
    assertEquals(1620000000, uploader.getTimestamp());

    List<TestUploader.Record> records = uploader.readRecords();
    assertEquals(2, records.size());
    assertEquals(1, records.get(0).tagKeyId);
    assertEquals(RoaringBitmap.bitmapOf(1, 2), records.get(0).values.get(10));
    assertEquals(2, records.get(1).tagKeyId);
    assertEquals(RoaringBitmap.bitmapOf(1), records.get(1).values.get(20));
    assertEquals(RoaringBitmap.bitmapOf(2), records.get(1).values.get(21));

    assertEquals(2, registry.counter(InvertedIndexFlushImpl.M_FLUSH_TAG_KEYS).getCount());
    assertEquals(0, registry.counter(InvertedIndexFlushImpl.M_FLUSH_ERRORS).getCount());
    assertEquals(1, registry.timer(InvertedIndexFlushImpl.M_FLUSH_DURATION).getCount());
  }

  @Test
  public void testFailedUploadIsReported() {
    Uploader failing = (timestamp, payload) -> {
      throw new IOException("Bucket not reachable");
    };
    InvertedIndexFlushImpl flush =
        new InvertedIndexFlushImpl(shardId -> failing, executorService, registry, config);
    FlushStatus status = flush.flushShard(index, 1);

    assertFalse(status.inProgress());
    assertTrue(status.failed());
    assertEquals(1, registry.counter(InvertedIndexFlushImpl.M_FLUSH_ERRORS).getCount());
    assertEquals(0, registry.counter(InvertedIndexFlushImpl.M_FLUSH_TAG_KEYS).getCount());
  }

  @Test
  public void testFailedWalkIsNotUploaded() {
    DefaultInvertedIndex broken = new DefaultInvertedIndex(new IndexConfig(), metadata, registry) {
      @Override
      public void flushInvertedIndexTo(final InvertedIndexFlusher flusher) throws IOException {
        flusher.flushTagValue(1, RoaringBitmap.bitmapOf(1));
        throw new IOException("Interrupted walk");
      }
    };
    InvertedIndexFlushImpl flush =
        new InvertedIndexFlushImpl(shardId -> uploader, executorService, registry, config);
    FlushStatus status = flush.flushShard(broken, 1);

    assertTrue(status.failed());
    assertEquals(0, uploader.getUploads());
    assertEquals(1, registry.counter(InvertedIndexFlushImpl.M_FLUSH_ERRORS).getCount());
  }

  @Test
  public void testSettingsComeFromConfig() {
    config.shardId = 7;
    config.flushFrequencySeconds = 60;
    List<Integer> shards = new ArrayList<>();
    InvertedIndexFlushImpl flush = new InvertedIndexFlushImpl(
        shardId -> {
          shards.add(shardId);
          return uploader;
        },
        executorService, registry, config);

    assertEquals(60, flush.frequency());
    assertFalse(flush.flushShard(index, 1).failed());
    assertEquals(Collections.singletonList(7), shards);
  }

  @Test
  public void testInvalidConfig() {
    config.flushFrequencySeconds = 0;
    assertThrows(
        IllegalArgumentException.class,
        () -> new InvertedIndexFlushImpl(shardId -> uploader, executorService, registry, config));
  }
}
