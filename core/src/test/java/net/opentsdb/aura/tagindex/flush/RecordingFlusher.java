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

import org.roaringbitmap.RoaringBitmap;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Records the calls made during a flush. Can be told to fail on a given tag key.
 */
public class RecordingFlusher implements InvertedIndexFlusher {

  public final List<Integer> tagKeyIds = new ArrayList<>();
  public final List<Integer> tagValueIds = new ArrayList<>();
  public final List<RoaringBitmap> seriesIds = new ArrayList<>();
  public final List<String> calls = new ArrayList<>();
  private Integer failOnTagKey;

  public RecordingFlusher failOnTagKey(final int tagKeyId) {
    this.failOnTagKey = tagKeyId;
    return this;
  }

  @Override
  public void flushTagValue(final int tagValueId, final RoaringBitmap seriesIds) {
    tagValueIds.add(tagValueId);
    this.seriesIds.add(seriesIds);
    calls.add("value:" + Integer.toUnsignedString(tagValueId));
  }

  @Override
  public void flushTagKeyId(final int tagKeyId) throws IOException {
    if (failOnTagKey != null && failOnTagKey == tagKeyId) {
      throw new IOException("Disk full flushing tag key " + tagKeyId);
    }
    tagKeyIds.add(tagKeyId);
    calls.add("key:" + Integer.toUnsignedString(tagKeyId));
  }
}
