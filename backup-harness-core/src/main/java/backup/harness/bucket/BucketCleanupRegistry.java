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
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;

/**
 * Bucket names waiting to be deleted at teardown. Any number of test threads
 * may add names concurrently; the set is drained exactly once.
 */
public class BucketCleanupRegistry {

  private final Set<String> buckets = Sets.newConcurrentHashSet();
  private final ReadWriteLock lock = new ReentrantReadWriteLock();
  private boolean drained;

  /**
   * @return false if the bucket was already registered
   * @throws IllegalStateException
   *           if the registry has already been drained
   */
  public boolean add(String bucket) {
    Preconditions.checkNotNull(bucket, "bucket");
    lock.readLock()
        .lock();
    try {
      Preconditions.checkState(!drained, "Cleanup registry already drained, can not track bucket %s", bucket);
      return buckets.add(bucket);
    } finally {
      lock.readLock()
          .unlock();
    }
  }

  public boolean contains(String bucket) {
    return buckets.contains(bucket);
  }

  public int size() {
    return buckets.size();
  }

  /**
   * The registered buckets, without draining.
   */
  public Set<String> snapshot() {
    return ImmutableSet.copyOf(buckets);
  }

  /**
   * Returns every registered bucket and closes the registry for further adds.
   */
  public Set<String> drain() {
    lock.writeLock()
        .lock();
    try {
      Preconditions.checkState(!drained, "Cleanup registry already drained");
      drained = true;
      return ImmutableSet.copyOf(buckets);
    } finally {
      lock.writeLock()
          .unlock();
    }
  }

}
