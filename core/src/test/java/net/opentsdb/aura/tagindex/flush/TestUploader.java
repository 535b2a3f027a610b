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

import net.opentsdb.aura.tagindex.core.SeriesIds;
import org.roaringbitmap.RoaringBitmap;

import java.io.ByteArrayInputStream;
import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.GZIPInputStream;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Keeps the uploaded payload and parses it back into tag key records.
 */
public class TestUploader implements Uploader {

  private final int shardId;
  private int timestamp;
  private int uploads;
  private byte[] payload;

  public TestUploader(final int shardId) {
    this.shardId = shardId;
  }

  @Override
  public void upload(final int timestamp, final byte[] payload) {
    this.timestamp = timestamp;
    this.payload = payload;
    this.uploads++;
  }

  public int getShardId() {
    return shardId;
  }

  public int getTimestamp() {
    return timestamp;
  }

  public int getUploads() {
    return uploads;
  }

  public List<Record> readRecords() throws IOException {
    List<Record> records = new ArrayList<>();
    try (DataInputStream in =
        new DataInputStream(new GZIPInputStream(new ByteArrayInputStream(payload)))) {
      while (true) {
        int length;
        try {
          length = in.readInt();
        } catch (EOFException e) {
          break;
        }
        byte[] body = new byte[length];
        in.readFully(body);
        records.add(parse(body));
      }
    }
    return records;
  }

  private Record parse(final byte[] body) throws IOException {
    DataInputStream in = new DataInputStream(new ByteArrayInputStream(body));
    expect(in, CompressedInvertedIndexWriter.Type.RECORD);
    Record record = new Record();
    while (true) {
      assertEquals(CompressedInvertedIndexWriter.Type.SEPARATOR.get(), in.readByte());
      byte type = in.readByte();
      if (type == CompressedInvertedIndexWriter.Type.TAG_VALUE.get()) {
        int tagValueId = in.readInt();
        record.values.put(tagValueId, SeriesIds.read(in));
      } else {
        assertEquals(CompressedInvertedIndexWriter.Type.TAG_KEY.get(), type);
        record.tagKeyId = in.readInt();
        assertEquals(0, in.available());
        return record;
      }
    }
  }

  private void expect(final DataInputStream in, final CompressedInvertedIndexWriter.Type type)
      throws IOException {
    assertEquals(CompressedInvertedIndexWriter.Type.SEPARATOR.get(), in.readByte());
    assertEquals(type.get(), in.readByte());
  }

  public static class Record {
    public int tagKeyId;
    public final Map<Integer, RoaringBitmap> values = new LinkedHashMap<>();
  }
}
