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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.util.List;
import java.util.Random;
import java.util.concurrent.TimeUnit;

import org.apache.commons.configuration.BaseConfiguration;
import org.apache.commons.configuration.Configuration;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;

import backup.harness.generator.KafkaDataWithTimePeriod;
import backup.harness.generator.RecordGenerators;
import backup.harness.kafka.ThrottledRecordSource;
import backup.harness.pipeline.BackupPipeline;
import backup.harness.pipeline.MockedBackupPipeline;
import backup.harness.poll.PollResult;
import backup.harness.record.ReducedRecord;
import backup.harness.store.BucketAccess;
import backup.harness.store.ObjectSummary;
import backup.harness.store.local.LocalObjectStore;
import backup.harness.store.local.LocalObjectStoreConstants;

public class BackupHarnessTest {

  @Rule
  public TemporaryFolder folder = new TemporaryFolder();

  private File storeDir;
  private BackupHarness harness;

  @Before
  public void setup() throws Exception {
    storeDir = folder.newFolder("store");
    Configuration conf = new BaseConfiguration();
    conf.setProperty(HarnessConstants.BACKUP_HARNESS_STORE_CLASS_KEY, LocalObjectStore.class.getName());
    conf.setProperty(LocalObjectStoreConstants.BACKUP_HARNESS_LOCAL_STORE_PATH_KEY, storeDir.getAbsolutePath());
    conf.setProperty(HarnessConstants.BACKUP_HARNESS_BUCKET_PREFIX_KEY, "harness-");
    conf.setProperty(HarnessConstants.BACKUP_HARNESS_BUCKET_CLEANUP_INITIAL_DELAY_KEY, 0);
    conf.setProperty(HarnessConstants.BACKUP_HARNESS_POLL_ATTEMPTS_KEY, 50);
    conf.setProperty(HarnessConstants.BACKUP_HARNESS_POLL_DELAY_KEY, 100);
    harness = BackupHarness.create(conf);
  }

  @After
  public void teardown() throws Exception {
    if (harness != null) {
      harness.close();
    }
  }

  @Test
  public void testNewBucketName() {
    String bucket = harness.newBucketName(new Random());
    assertTrue(bucket, bucket.startsWith("harness-"));
    assertTrue(bucket, RecordGenerators.isValidBucketName(bucket, false));
  }

  @Test
  public void testBackupOfManyPeriods() throws Exception {
    Random random = new Random();
    String bucket = harness.newBucketName(random);
    harness.createBucket(bucket)
           .get(10, TimeUnit.SECONDS);
    assertEquals(BucketAccess.ACCESS_GRANTED, harness.getStore()
                                                     .bucketExists(bucket));

    KafkaDataWithTimePeriod data = RecordGenerators.kafkaDataWithTimePeriods(random, "backup-topic", 20, 20, 1000,
        1000, true, 1500000000000L);
    BackupPipeline pipeline = new MockedBackupPipeline(
        new ThrottledRecordSource(data.getData(), 200, TimeUnit.MILLISECONDS), harness.getStore(), bucket,
        data.getPeriodMillis(), harness.getScheduler());
    pipeline.run();

    List<ObjectSummary> objects = harness.waitForListing(bucket, list -> {
      if (list.size() < 20) {
        return PollResult.notReady("found " + list.size() + " of 20 objects");
      }
      return PollResult.ready(list);
    })
                                         .get(30, TimeUnit.SECONDS);
    assertEquals(20, objects.size());

    List<ReducedRecord> downloaded = harness.downloadRecords(bucket)
                                            .get(30, TimeUnit.SECONDS);
    assertEquals(groupValuesByKey(data.getDataWithoutSentinel()), groupValuesByKey(downloaded));
    assertEquals(data.getDataWithoutSentinel(), downloaded);

    harness.close();
    harness = null;
    assertFalse(new File(storeDir, bucket).exists());
  }

  @Test
  public void testCloseWithoutBuckets() throws Exception {
    harness.close();
    harness = null;
    assertEquals(0, storeDir.list().length);
  }

  private static ListMultimap<String, String> groupValuesByKey(List<ReducedRecord> records) {
    ListMultimap<String, String> grouped = ArrayListMultimap.create();
    for (ReducedRecord record : records) {
      grouped.put(record.getKey(), record.getValue());
    }
    return grouped;
  }

}
