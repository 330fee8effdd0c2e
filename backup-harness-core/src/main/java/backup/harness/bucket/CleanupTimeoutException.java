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
package backup.harness.bucket;

import java.util.Set;

/**
 * Teardown did not finish deleting the tracked buckets in time, so cloud
 * resources may have been leaked.
 */
public class CleanupTimeoutException extends RuntimeException {

  private static final long serialVersionUID = -3580434926620233171L;

  private final Set<String> buckets;

  public CleanupTimeoutException(Set<String> buckets, long timeoutMillis, Throwable cause) {
    super("Cleanup of buckets " + buckets + " did not finish within " + timeoutMillis + " ms", cause);
    this.buckets = buckets;
  }

  public Set<String> getBuckets() {
    return buckets;
  }

}
