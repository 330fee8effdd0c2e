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
package backup.harness;

import java.util.concurrent.TimeUnit;

public class HarnessConstants {

  public static final String BACKUP_HARNESS_STORE_CLASS_KEY = "backup.harness.store.class";
  public static final String BACKUP_HARNESS_STORE_CLASS_DEFAULT = "backup.harness.store.local.LocalObjectStore";

  public static final String BACKUP_HARNESS_SCHEDULER_THREADS_KEY = "backup.harness.scheduler.threads";
  public static final int BACKUP_HARNESS_SCHEDULER_THREADS_DEFAULT = 4;

  public static final String BACKUP_HARNESS_BUCKET_PREFIX_KEY = "backup.harness.bucket.prefix";

  /**
   * Dots in bucket names only work with virtual host addressing when the
   * endpoint has a matching certificate, so this is off for real services.
   */
  public static final String BACKUP_HARNESS_BUCKET_VIRTUAL_DOT_HOST_KEY = "backup.harness.bucket.virtual.dot.host";
  public static final boolean BACKUP_HARNESS_BUCKET_VIRTUAL_DOT_HOST_DEFAULT = false;

  /**
   * Cleanup of created buckets is enabled only when this key is set.
   */
  public static final String BACKUP_HARNESS_BUCKET_CLEANUP_INITIAL_DELAY_KEY = "backup.harness.bucket.cleanup.initial.delay";

  public static final String BACKUP_HARNESS_BUCKET_CLEANUP_MAX_TIMEOUT_KEY = "backup.harness.bucket.cleanup.max.timeout";
  public static final long BACKUP_HARNESS_BUCKET_CLEANUP_MAX_TIMEOUT_DEFAULT = TimeUnit.MINUTES.toMillis(10);

  public static final String BACKUP_HARNESS_POLL_ATTEMPTS_KEY = "backup.harness.poll.attempts";
  public static final int BACKUP_HARNESS_POLL_ATTEMPTS_DEFAULT = 10;

  public static final String BACKUP_HARNESS_POLL_DELAY_KEY = "backup.harness.poll.delay";
  public static final long BACKUP_HARNESS_POLL_DELAY_DEFAULT = TimeUnit.SECONDS.toMillis(1);

}
