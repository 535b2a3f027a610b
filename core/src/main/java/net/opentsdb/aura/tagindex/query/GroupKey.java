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

import com.google.common.base.Preconditions;

import java.util.Arrays;

/**
 * Tag value ids identifying a group by bucket, aligned with the tag keys of the
 * {@link GroupingContext} that built it. A position can be absent when the series doesn't carry
 * that tag key. Absent is distinct from every tag value id, including {@code -1}.
 */
public final class GroupKey {

  private final int[] tagValueIds;
  private final boolean[] absent;
  private final int hash;

  public GroupKey(final int[] tagValueIds) {
    this(tagValueIds, new boolean[tagValueIds.length]);
  }

  /**
   * @param tagValueIds The tag value ids, ignored at absent positions.
   * @param absent True at the positions whose tag key the series doesn't carry.
   */
  public GroupKey(final int[] tagValueIds, final boolean[] absent) {
    Preconditions.checkArgument(
        tagValueIds.length == absent.length,
        "tagValueIds and absent lengths differ: %s != %s", tagValueIds.length, absent.length);
    this.tagValueIds = tagValueIds.clone();
    this.absent = absent.clone();
    for (int i = 0; i < absent.length; i++) {
      if (absent[i]) {
        this.tagValueIds[i] = 0;
      }
    }
    this.hash = 31 * Arrays.hashCode(this.tagValueIds) + Arrays.hashCode(this.absent);
  }

  public int size() {
    return tagValueIds.length;
  }

  public boolean isAbsent(final int index) {
    return absent[index];
  }

  /**
   * @throws IllegalStateException if the position is absent.
   */
  public int getTagValueId(final int index) {
    Preconditions.checkState(!absent[index], "No tag value at index: %s", index);
    return tagValueIds[index];
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof GroupKey)) {
      return false;
    }
    GroupKey that = (GroupKey) o;
    return Arrays.equals(tagValueIds, that.tagValueIds) && Arrays.equals(absent, that.absent);
  }

  @Override
  public int hashCode() {
    return hash;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("GroupKey[");
    for (int i = 0; i < tagValueIds.length; i++) {
      if (i > 0) {
        sb.append(", ");
      }
      if (absent[i]) {
        sb.append('-');
      } else {
        sb.append(Integer.toUnsignedString(tagValueIds[i]));
      }
    }
    return sb.append(']').toString();
  }
}
