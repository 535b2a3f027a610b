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

import com.codahale.metrics.Counter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;
import net.opentsdb.aura.tagindex.core.IndexConfig;
import net.opentsdb.aura.tagindex.core.InvertedIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Flushes the inverted index of a shard on the given executor. The compressed output is only
 * uploaded if the whole index was written; a failed flush discards it and is not retried here.
 */
public class InvertedIndexFlushImpl {

  public static final String M_FLUSH_DURATION = "index.flush.duration";
  public static final String M_FLUSH_ERRORS = "index.flush.errors";
  public static final String M_FLUSH_TAG_KEYS = "index.flush.tagkeys";

  private final UploaderFactory uploaderFactory;
  private final ExecutorService pool;
  private final MetricRegistry registry;
  private final String namespace;
  private final int shardId;
  private final int frequency;

  public InvertedIndexFlushImpl(
      final UploaderFactory uploaderFactory,
      final ExecutorService service,
      final MetricRegistry registry,
      final IndexConfig config) {
    config.validate();
    this.uploaderFactory = uploaderFactory;
    this.pool = service;
    this.registry = registry;
    this.namespace = config.namespace;
    this.shardId = config.shardId;
    this.frequency = config.flushFrequencySeconds;
  }

  /**
   * @return Seconds between two flushes of the shard.
   */
  public long frequency() {
    return frequency;
  }

  public FlushStatus flushShard(final InvertedIndex index, final int flushTimestamp) {
    final FlushJob job = new FlushJob(index, flushTimestamp);
    final Future<?> submit = pool.submit(job);
    return new IndexFlushStatus(submit, job);
  }

  private static class IndexFlushStatus implements FlushStatus {

    private final Future<?> future;
    private final FlushJob job;

    IndexFlushStatus(final Future<?> future, final FlushJob job) {
      this.future = future;
      this.job = job;
    }

    @Override
    public boolean inProgress() {
      return !future.isDone();
    }

    @Override
    public boolean failed() {
      return future.isDone() && job.failed;
    }
  }

  public class FlushJob implements Runnable {

    private final Logger log = LoggerFactory.getLogger(getClass());

    private final InvertedIndex index;
    private final int flushTimestamp;
    private final Counter tagKeysWritten;
    private final Counter flushErrors;
    private final Timer flushDuration;
    private volatile boolean failed;

    public FlushJob(final InvertedIndex index, final int flushTimestamp) {
      this.index = index;
      this.flushTimestamp = flushTimestamp;
      this.tagKeysWritten = registry.counter(M_FLUSH_TAG_KEYS);
      this.flushErrors = registry.counter(M_FLUSH_ERRORS);
      this.flushDuration = registry.timer(M_FLUSH_DURATION);
    }

    @Override
    public void run() {
      final Timer.Context timer = flushDuration.time();
      CompressedInvertedIndexWriter writer = null;
      try {
        writer = new CompressedInvertedIndexWriter(uploaderFactory.create(shardId), shardId);
        writer.init(flushTimestamp);
        log.info(
            "Starting inverted index flush for namespace: {} shard: {} and time: {}",
            namespace, shardId, flushTimestamp);
        index.flushInvertedIndexTo(writer);
        writer.close();
        tagKeysWritten.inc(writer.getTagKeyCount());
        log.info(
            "Done flushing {} tag keys for namespace: {} shard: {} and time: {}",
            writer.getTagKeyCount(), namespace, shardId, flushTimestamp);
      } catch (Throwable t) {
        failed = true;
        log.error(
            "Error in inverted index flush for namespace: {} shard: {} and time: {}",
            namespace, shardId, flushTimestamp, t);
        flushErrors.inc();
        if (writer != null) {
          writer.discard();
        }
      } finally {
        timer.stop();
      }
    }

    public boolean failed() {
      return failed;
    }
  }
}
