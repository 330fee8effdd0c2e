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
package backup.harness.store.s3;

import static org.junit.Assert.assertEquals;
import static org.junit.Assume.assumeTrue;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.UUID;

import org.apache.commons.configuration.CompositeConfiguration;
import org.apache.commons.configuration.SystemConfiguration;
import org.apache.commons.io.IOUtils;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import backup.harness.HarnessConstants;
import backup.harness.store.BucketAccess;
import backup.harness.store.ObjectStore;
import backup.harness.store.ObjectSummary;

/**
 * Runs against a real or emulated S3 endpoint configured through system
 * properties. Skipped unless -Dbackup.harness.s3.it.enabled=true is set.
 */
public class S3ObjectStoreIntegrationTest {

  private static final String ENABLED_KEY = "backup.harness.s3.it.enabled";

  private ObjectStore store;
  private String bucket;

  @Before
  public void setup() throws Exception {
    assumeTrue(Boolean.getBoolean(ENABLED_KEY));
    CompositeConfiguration conf = new CompositeConfiguration();
    conf.addConfiguration(new SystemConfiguration());
    conf.setProperty(HarnessConstants.BACKUP_HARNESS_STORE_CLASS_KEY, S3ObjectStore.class.getName());
    store = ObjectStore.create(conf);
    bucket = "harness-it-" + UUID.randomUUID()
                                 .toString();
  }

  @After
  public void teardown() throws Exception {
    if (store == null) {
      return;
    }
    try {
      if (store.bucketExists(bucket) == BucketAccess.ACCESS_GRANTED) {
        store.deleteBucketRecursive(bucket);
      }
    } finally {
      store.close();
    }
  }

  @Test
  public void testRoundTrip() throws Exception {
    assertEquals(BucketAccess.NOT_EXISTS, store.bucketExists(bucket));
    store.createBucket(bucket);
    assertEquals(BucketAccess.ACCESS_GRANTED, store.bucketExists(bucket));

    for (int i = 0; i < 5; i++) {
      byte[] bs = ("object-" + i).getBytes(StandardCharsets.UTF_8);
      store.putObject(bucket, "data/" + i, new ByteArrayInputStream(bs), bs.length);
    }
    List<ObjectSummary> summaries = store.listObjects(bucket, "data/");
    assertEquals(5, summaries.size());
    try (InputStream input = store.getObject(bucket, "data/3")) {
      assertEquals("object-3", new String(IOUtils.toByteArray(input), StandardCharsets.UTF_8));
    }

    store.deleteBucketRecursive(bucket);
    assertEquals(BucketAccess.NOT_EXISTS, store.bucketExists(bucket));
  }

}
