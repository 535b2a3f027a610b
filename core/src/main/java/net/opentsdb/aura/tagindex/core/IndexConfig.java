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

import com.google.common.base.Preconditions;

public class IndexConfig {

  /**
   * Magic tag key a series without tags is indexed under.
   */
  public static final String NO_TAGS_KEY = "__AURANOTAGS";

  /**
   * Magic tag value paired with {@link #NO_TAGS_KEY}.
   */
  public static final String NO_TAGS_VALUE = "__AURANOTAGS";

  public String namespace;
  public int shardId;

  public int tagKeyInitialCapacity = 64;
  public int tagValueInitialCapacity = 16;

  public boolean runOptimizeOnFlush = true;
  public int flushFrequencySeconds = 3600;

  public IndexConfig validate() {
    Preconditions.checkArgument(shardId >= 0, "shardId must be >= 0: %s", shardId);
    Preconditions.checkArgument(
        tagKeyInitialCapacity > 0, "tagKeyInitialCapacity must be > 0: %s", tagKeyInitialCapacity);
    Preconditions.checkArgument(
        tagValueInitialCapacity > 0,
        "tagValueInitialCapacity must be > 0: %s",
        tagValueInitialCapacity);
    Preconditions.checkArgument(
        flushFrequencySeconds > 0, "flushFrequencySeconds must be > 0: %s", flushFrequencySeconds);
    return this;
  }
}
