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

import static backup.harness.HarnessConstants.BACKUP_HARNESS_BUCKET_PREFIX_KEY;
import static backup.harness.HarnessConstants.BACKUP_HARNESS_BUCKET_VIRTUAL_DOT_HOST_DEFAULT;
import static backup.harness.HarnessConstants.BACKUP_HARNESS_BUCKET_VIRTUAL_DOT_HOST_KEY;
import static backup.harness.HarnessConstants.BACKUP_HARNESS_SCHEDULER_THREADS_DEFAULT;
import static backup.harness.HarnessConstants.BACKUP_HARNESS_SCHEDULER_THREADS_KEY;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.Function;

import org.apache.commons.configuration.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

import backup.harness.bucket.BucketCleanupRegistry;
import backup.harness.bucket.BucketLifecycleManager;
import backup.harness.generator.RecordGenerators;
import backup.harness.poll.ConsistencyPoller;
import backup.harness.poll.PollResult;
import backup.harness.record.ReducedRecord;
import backup.harness.record.ReducedRecordCodec;
import backup.harness.store.ObjectStore;
import backup.harness.store.ObjectSummary;
import backup.harness.util.Futures;

/**
 * Everything a backup test needs against one object store, created once per
 * test class and closed in its teardown.
 */
public class BackupHarness implements Closeable {

  private final static Logger LOG = LoggerFactory.getLogger(BackupHarness.class);

  private final Configuration conf;
  private final ObjectStore store;
  private final ScheduledExecutorService scheduler;
  private final BucketCleanupRegistry registry;
  private final BucketLifecycleManager bucketManager;
  private final ConsistencyPoller poller;

  public static BackupHarness create(Configuration conf) throws Exception {
    ObjectStore store = ObjectStore.create(conf);
    int threads = conf.getInt(BACKUP_HARNESS_SCHEDULER_THREADS_KEY, BACKUP_HARNESS_SCHEDULER_THREADS_DEFAULT);
    ScheduledExecutorService scheduler = Executors.newScheduledThreadPool(threads,
        new ThreadFactoryBuilder().setDaemon(true)
                                  .setNameFormat("backup-harness-%d")
                                  .build());
    return new BackupHarness(conf, store, new BucketCleanupRegistry(), scheduler);
  }

  public BackupHarness(Configuration conf, ObjectStore store, BucketCleanupRegistry registry,
      ScheduledExecutorService scheduler) {
    this.conf = conf;
    this.store = store;
    this.scheduler = scheduler;
    this.registry = registry;
    this.bucketManager = new BucketLifecycleManager(store, registry, conf, scheduler);
    this.poller = new ConsistencyPoller(conf, scheduler);
  }

  public ObjectStore getStore() {
    return store;
  }

  public ScheduledExecutorService getScheduler() {
    return scheduler;
  }

  public BucketCleanupRegistry getRegistry() {
    return registry;
  }

  public BucketLifecycleManager getBucketManager() {
    return bucketManager;
  }

  public ConsistencyPoller getPoller() {
    return poller;
  }

  /**
   * A random bucket name using the configured prefix and dot host setting.
   */
  public String newBucketName(Random random) {
    return RecordGenerators.bucketName(random, conf.getString(BACKUP_HARNESS_BUCKET_PREFIX_KEY),
        conf.getBoolean(BACKUP_HARNESS_BUCKET_VIRTUAL_DOT_HOST_KEY, BACKUP_HARNESS_BUCKET_VIRTUAL_DOT_HOST_DEFAULT));
  }

  public CompletableFuture<Void> createBucket(String bucket) {
    return bucketManager.createBucket(bucket);
  }

  public <T> CompletableFuture<T> waitForListing(String bucket,
      Function<? super List<ObjectSummary>, PollResult<T>> transform) {
    return poller.waitForListing(store, bucket, transform);
  }

  /**
   * Downloads every object of the bucket in key order and decodes the records
   * they contain, dropping padding entries.
   */
  public CompletableFuture<List<ReducedRecord>> downloadRecords(String bucket) {
    return Futures.call(() -> store.listObjects(bucket, null), scheduler)
                  .thenCompose(summaries -> {
                    List<CompletableFuture<List<Optional<ReducedRecord>>>> downloads = new ArrayList<>();
                    for (ObjectSummary summary : summaries) {
                      downloads.add(Futures.call(() -> download(bucket, summary.getKey()), scheduler));
                    }
                    return CompletableFuture.allOf(downloads.toArray(new CompletableFuture[0]))
                                            .thenApply(v -> {
                                              List<ReducedRecord> records = new ArrayList<>();
                                              for (CompletableFuture<List<Optional<ReducedRecord>>> download : downloads) {
                                                for (Optional<ReducedRecord> record : download.join()) {
                                                  record.ifPresent(records::add);
                                                }
                                              }
                                              return records;
                                            });
                  });
  }

  private List<Optional<ReducedRecord>> download(String bucket, String key) throws Exception {
    LOG.debug("Downloading {} from bucket {}", key, bucket);
    try (InputStream input = store.getObject(bucket, key)) {
      return ReducedRecordCodec.decode(input);
    }
  }

  /**
   * Cleans up the tracked buckets, then releases the store and scheduler.
   */
  @Override
  public void close() throws IOException {
    try {
      bucketManager.close();
    } finally {
      try {
        store.close();
      } finally {
        scheduler.shutdownNow();
      }
    }
  }

}
