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

/**
 * Thrown when a query references a tag key that was never indexed in the shard. Callers usually
 * treat it as zero matching series.
 */
public class NotFoundException extends Exception {

  private static final long serialVersionUID = -3526804152839127781L;
  private final int tagKeyId;

  public NotFoundException(final int tagKeyId) {
    super("Tag key not found: " + Integer.toUnsignedString(tagKeyId));
    this.tagKeyId = tagKeyId;
  }

  public int getTagKeyId() {
    return tagKeyId;
  }
}
