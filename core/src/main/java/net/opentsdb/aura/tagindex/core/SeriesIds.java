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

import org.roaringbitmap.FastAggregation;
import org.roaringbitmap.RoaringBitmap;

import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;
import java.util.List;

/**
 * Helpers for the {@link RoaringBitmap}s used as series id sets. Ids are unsigned 32 bit
 * integers carried in an {@code int}; a bitmap always iterates them in unsigned order.
 */
public final class SeriesIds {

  private SeriesIds() {
  }

  /**
   * ORs the given bitmaps into a new bitmap. The inputs are not modified.
   *
   * @param bitmaps The non-null, possibly empty, list of bitmaps.
   * @return A new bitmap, empty if the list was.
   */
  public static RoaringBitmap union(final List<RoaringBitmap> bitmaps) {
    if (bitmaps.isEmpty()) {
      return new RoaringBitmap();
    }
    return FastAggregation.or(bitmaps.iterator());
  }

  /**
   * @return The ids in ascending unsigned order, without duplicates.
   */
  public static int[] sortUnsigned(final int[] ids) {
    return RoaringBitmap.bitmapOf(ids).toArray();
  }

  public static void write(final RoaringBitmap bitmap, final DataOutput out) throws IOException {
    out.writeInt(bitmap.serializedSizeInBytes());
    bitmap.serialize(out);
  }

  public static RoaringBitmap read(final DataInput in) throws IOException {
    in.readInt(); // size, only needed by readers that skip
    RoaringBitmap bitmap = new RoaringBitmap();
    bitmap.deserialize(in);
    return bitmap;
  }
}
