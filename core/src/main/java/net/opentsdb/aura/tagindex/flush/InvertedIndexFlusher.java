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

/**
 * Receives the inverted index of a shard during a flush. For each tag key, in ascending tag key
 * id order, every tag value is passed to {@link #flushTagValue(int, RoaringBitmap)} and then the
 * key's section is closed with {@link #flushTagKeyId(int)}.
 */
public interface InvertedIndexFlusher {

  void flushTagValue(int tagValueId, RoaringBitmap seriesIds) throws IOException;

  void flushTagKeyId(int tagKeyId) throws IOException;
}
