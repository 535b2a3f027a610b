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

import com.google.common.base.Preconditions;
import net.opentsdb.aura.tagindex.core.SeriesIds;
import org.roaringbitmap.RoaringBitmap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.util.zip.GZIPOutputStream;

/**
 * Writes the inverted index of a shard as a GZIP compressed stream of records, one record per tag
 * key, and uploads it on {@link #close()}. A record is laid out as:
 *
 * <pre>
 * int length | SEPARATOR RECORD
 *            | (SEPARATOR TAG_VALUE int tagValueId int bitmapSize bitmap)*
 *            | SEPARATOR TAG_KEY int tagKeyId
 * </pre>
 *
 * where length counts the bytes following it. Bitmaps use the portable roaring format.
 */
public class CompressedInvertedIndexWriter implements InvertedIndexFlusher {

  public enum Type {
    SEPARATOR((byte) 1),
    RECORD((byte) 2),
    TAG_VALUE((byte) 3),
    TAG_KEY((byte) 4);
    byte type;

    Type(byte type) {
      this.type = type;
    }

    public byte get() {
      return type;
    }
  }

  private final Logger log = LoggerFactory.getLogger(getClass());

  private final Uploader uploader;
  private final int shardId;
  private final ByteArrayOutputStream record = new ByteArrayOutputStream(1024);
  private final DataOutputStream recordStream = new DataOutputStream(record);
  private ByteArrayOutputStream byteArrayOutputStream;
  private DataOutputStream outputStream;
  private boolean recordOpen;
  private int timestamp;
  private int tagKeyCount;
  private int tagValueCount;

  public CompressedInvertedIndexWriter(final Uploader uploader) {
    this(uploader, 0);
  }

  public CompressedInvertedIndexWriter(final Uploader uploader, final int shardId) {
    this.uploader = uploader;
    this.shardId = shardId;
  }

  public void init(final int timestamp) throws IOException {
    this.timestamp = timestamp;
    this.byteArrayOutputStream = new ByteArrayOutputStream();
    //TODO: Make the compression pluggable
    this.outputStream = new DataOutputStream(new GZIPOutputStream(byteArrayOutputStream));
    this.record.reset();
    this.recordOpen = false;
    this.tagKeyCount = 0;
    this.tagValueCount = 0;
  }

  @Override
  public void flushTagValue(final int tagValueId, final RoaringBitmap seriesIds)
      throws IOException {
    openRecord();
    writeType(Type.TAG_VALUE);
    recordStream.writeInt(tagValueId);
    SeriesIds.write(seriesIds, recordStream);
    tagValueCount++;
  }

  @Override
  public void flushTagKeyId(final int tagKeyId) throws IOException {
    openRecord();
    writeType(Type.TAG_KEY);
    recordStream.writeInt(tagKeyId);

    outputStream.writeInt(record.size());
    record.writeTo(outputStream);
    record.reset();
    recordOpen = false;
    tagKeyCount++;
  }

  /**
   * Finishes the compressed stream and uploads it.
   *
   * @throws IOException if finishing the stream or the upload failed.
   */
  public void close() throws IOException {
    Preconditions.checkState(outputStream != null, "Writer for shard %s not initialized", shardId);
    Preconditions.checkState(
        !recordOpen, "Tag key section still open in the writer for shard %s", shardId);
    outputStream.close();
    outputStream = null;
    byte[] payload = byteArrayOutputStream.toByteArray();
    uploader.upload(timestamp, payload);
    log.info(
        "Uploaded inverted index for shard: {} time: {} tag keys: {} tag values: {} bytes: {}",
        shardId, timestamp, tagKeyCount, tagValueCount, payload.length);
  }

  /**
   * Drops whatever was written since {@link #init(int)} without uploading.
   */
  public void discard() {
    record.reset();
    recordOpen = false;
    if (outputStream != null) {
      try {
        outputStream.close();
      } catch (IOException e) {
        log.warn("Error closing the discarded inverted index stream for shard: {}", shardId, e);
      }
      outputStream = null;
    }
    log.info("Discarded partial inverted index for shard: {} time: {}", shardId, timestamp);
  }

  public int getTagKeyCount() {
    return tagKeyCount;
  }

  public int getTagValueCount() {
    return tagValueCount;
  }

  private void openRecord() throws IOException {
    Preconditions.checkState(outputStream != null, "Writer for shard %s not initialized", shardId);
    if (!recordOpen) {
      writeType(Type.RECORD);
      recordOpen = true;
    }
  }

  private void writeType(final Type type) throws IOException {
    recordStream.writeByte(Type.SEPARATOR.get());
    recordStream.writeByte(type.get());
  }
}
