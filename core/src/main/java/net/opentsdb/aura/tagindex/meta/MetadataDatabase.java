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

public interface MetadataDatabase {

  /**
   * Returns the id of the tag key under the metric, generating it if the key is new.
   *
   * @param namespace The namespace of the metric.
   * @param metricName The metric name.
   * @param tagKey The tag key.
   * @return The tag key id.
   * @throws IdGenerationException if the id couldn't be resolved or generated.
   */
  int genTagKeyId(String namespace, String metricName, String tagKey) throws IdGenerationException;
}
