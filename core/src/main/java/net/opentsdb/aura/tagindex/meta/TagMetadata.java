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

package net.opentsdb.aura.tagindex.meta;

public interface TagMetadata {

  /**
   * Returns the id of the tag value under the tag key, generating it if the value is new.
   *
   * @param tagKeyId The id of the owning tag key.
   * @param tagValue The tag value.
   * @return The tag value id.
   * @throws IdGenerationException if the id couldn't be resolved or generated.
   */
  int genTagValueId(int tagKeyId, String tagValue) throws IdGenerationException;
}
