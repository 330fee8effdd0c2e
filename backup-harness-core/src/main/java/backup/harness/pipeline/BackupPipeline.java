/*
 * Copyright 2016 Fortitude Technologies LLC
 * 
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *     http://www.apache.org/licenses/LICENSE-2.0
 *     
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package backup.harness.pipeline;

import java.util.concurrent.CompletableFuture;

/**
 * The backup under test. The harness only starts it and then observes what
 * it writes to object storage.
 */
public interface BackupPipeline {

  /**
   * Starts consuming records and writing backups to the configured bucket.
   * The future completes when the pipeline stops.
   */
  CompletableFuture<Void> run();

}
