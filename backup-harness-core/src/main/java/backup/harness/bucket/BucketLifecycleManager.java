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

import static backup.harness.HarnessConstants.BACKUP_HARNESS_BUCKET_CLEANUP_INITIAL_DELAY_KEY;
import static backup.harness.HarnessConstants.BACKUP_HARNESS_BUCKET_CLEANUP_MAX_TIMEOUT_DEFAULT;
import static backup.harness.HarnessConstants.BACKUP_HARNESS_BUCKET_CLEANUP_MAX_TIMEOUT_KEY;

import java.io.Closeable;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import org.apache.commons.configuration.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.codahale.metrics.Counter;

import backup.harness.metrics.Metrics;
import backup.harness.store.BucketAccess;
import backup.harness.store.ObjectStore;
import backup.harness.util.Futures;

/**
 * Creates buckets for tests, remembers the ones it created and deletes them
 * again when the harness shuts down.
 */
public class BucketLifecycleManager implements Closeable {

  private final static Logger LOG = LoggerFactory.getLogger(BucketLifecycleManager.class);

  private static final String BUCKETS_CREATED = "bucketsCreated";
  private static final String BUCKETS_CLEANED = "bucketsCleaned";
  private static final String BUCKET_CLEANUP_FAILURES = "bucketCleanupFailures";

  private final ObjectStore store;
  private final BucketCleanupRegistry registry;
  private final ScheduledExecutorService scheduler;
  private final Long cleanupInitialDelay;
  private final long maxCleanupTimeout;
  private final AtomicBoolean shutdown = new AtomicBoolean();
  private final Set<CompletableFuture<Void>> creating = ConcurrentHashMap.newKeySet();
  private final Counter bucketsCreated;
  private final Counter bucketsCleaned;
  private final Counter bucketCleanupFailures;

  public BucketLifecycleManager(ObjectStore store, BucketCleanupRegistry registry, Configuration conf,
      ScheduledExecutorService scheduler) {
    this.store = store;
    this.registry = registry;
    this.scheduler = scheduler;
    if (conf.containsKey(BACKUP_HARNESS_BUCKET_CLEANUP_INITIAL_DELAY_KEY)) {
      cleanupInitialDelay = conf.getLong(BACKUP_HARNESS_BUCKET_CLEANUP_INITIAL_DELAY_KEY);
    } else {
      cleanupInitialDelay = null;
    }
    maxCleanupTimeout = conf.getLong(BACKUP_HARNESS_BUCKET_CLEANUP_MAX_TIMEOUT_KEY,
        BACKUP_HARNESS_BUCKET_CLEANUP_MAX_TIMEOUT_DEFAULT);
    bucketsCreated = Metrics.METRICS.counter(BUCKETS_CREATED);
    bucketsCleaned = Metrics.METRICS.counter(BUCKETS_CLEANED);
    bucketCleanupFailures = Metrics.METRICS.counter(BUCKET_CLEANUP_FAILURES);
  }

  public boolean isCleanupEnabled() {
    return cleanupInitialDelay != null;
  }

  /**
   * Creates the bucket, first deleting it with all of its contents if it
   * already exists and is usable. Fails with {@link BucketConflictException}
   * without touching anything if the name is taken by someone else.
   * <p>
   * With cleanup enabled the bucket is registered before the store is
   * modified, so once the registry has been drained the store is left alone.
   */
  public CompletableFuture<Void> createBucket(String bucket) {
    CompletableFuture<Void> future = Futures.call(() -> store.bucketExists(bucket), scheduler)
                                            .thenCompose(access -> createBucket(bucket, access))
                                            .thenRun(bucketsCreated::inc);
    creating.add(future);
    future.whenComplete((v, t) -> creating.remove(future));
    return future;
  }

  private CompletableFuture<Void> createBucket(String bucket, BucketAccess access) {
    switch (access) {
    case ACCESS_DENIED:
      return CompletableFuture.failedFuture(new BucketConflictException(bucket));
    case ACCESS_GRANTED:
      LOG.info("Deleting and recreating bucket: {} since it already exists with correct permissions", bucket);
      return track(bucket).thenCompose(v -> Futures.run(() -> store.deleteBucketRecursive(bucket), scheduler))
                          .thenCompose(v -> Futures.run(() -> store.createBucket(bucket), scheduler));
    case NOT_EXISTS:
      return track(bucket).thenCompose(v -> Futures.run(() -> store.createBucket(bucket), scheduler));
    default:
      return CompletableFuture.failedFuture(new IllegalStateException("Unknown bucket access " + access));
    }
  }

  private CompletableFuture<Void> track(String bucket) {
    if (isCleanupEnabled()) {
      try {
        registry.add(bucket);
      } catch (IllegalStateException e) {
        return CompletableFuture.failedFuture(e);
      }
    }
    return CompletableFuture.completedFuture(null);
  }

  /**
   * Never completes exceptionally, errors are logged so that one bucket can
   * not prevent the others from being cleaned.
   */
  CompletableFuture<Void> cleanBucket(String bucket) {
    return Futures.call(() -> store.bucketExists(bucket), scheduler)
                  .thenCompose(access -> {
                    switch (access) {
                    case ACCESS_DENIED:
                      LOG.warn(
                          "Cannot delete bucket: {} due to having access denied. Please look into this as it can fill up your account",
                          bucket);
                      return CompletableFuture.<Void> completedFuture(null);
                    case ACCESS_GRANTED:
                      LOG.info("Cleaning up bucket: {}", bucket);
                      return Futures.run(() -> store.deleteBucketRecursive(bucket), scheduler)
                                    .thenRun(bucketsCleaned::inc);
                    default:
                      LOG.info("Not deleting bucket: {} since it no longer exists", bucket);
                      return CompletableFuture.<Void> completedFuture(null);
                    }
                  })
                  .exceptionally(t -> {
                    bucketCleanupFailures.inc();
                    LOG.error("Error deleting bucket: {}", bucket, Futures.unwrap(t));
                    return null;
                  });
  }

  /**
   * Deletes every bucket created through this manager. Does nothing when
   * cleanup is disabled or when called a second time.
   *
   * @throws CleanupTimeoutException
   *           if the cleanup does not finish within the configured maximum
   */
  public void shutdown() throws InterruptedException {
    if (!shutdown.compareAndSet(false, true)) {
      return;
    }
    if (!isCleanupEnabled()) {
      return;
    }
    AtomicReference<Set<String>> pending = new AtomicReference<>();
    CompletableFuture<Void> cleanup = Futures.delay(cleanupInitialDelay, TimeUnit.MILLISECONDS, scheduler)
                                             .thenCompose(v -> {
                                               Set<String> buckets = registry.drain();
                                               pending.set(buckets);
                                               LOG.info("Cleaning up {} buckets", buckets.size());
                                               return cleanBuckets(buckets);
                                             });
    try {
      cleanup.get(maxCleanupTimeout, TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      Set<String> buckets = pending.get();
      throw new CleanupTimeoutException(buckets == null ? registry.snapshot() : buckets, maxCleanupTimeout, e);
    } catch (ExecutionException e) {
      throw new IllegalStateException("Bucket cleanup failed", Futures.unwrap(e));
    } finally {
      Metrics.report();
    }
  }

  private CompletableFuture<Void> cleanBuckets(Set<String> buckets) {
    // creates registered before the drain may still be running
    CompletableFuture<?>[] running = creating.toArray(new CompletableFuture<?>[0]);
    return CompletableFuture.allOf(running)
                            .handle((v, t) -> null)
                            .thenCompose(v -> CompletableFuture.allOf(buckets.stream()
                                                                             .map(this::cleanBucket)
                                                                             .toArray(CompletableFuture[]::new)));
  }

  @Override
  public void close() throws IOException {
    try {
      shutdown();
    } catch (InterruptedException e) {
      Thread.currentThread()
            .interrupt();
      throw new InterruptedIOException("Interrupted while cleaning up buckets");
    }
  }

}
