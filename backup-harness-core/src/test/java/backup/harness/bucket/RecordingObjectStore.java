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

import java.io.ByteArrayInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

import org.apache.commons.io.IOUtils;
import org.apache.commons.io.input.BoundedInputStream;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Sets;

import backup.harness.store.BucketAccess;
import backup.harness.store.ObjectStore;
import backup.harness.store.ObjectSummary;

/**
 * In memory store that lets tests decide how each bucket name is classified
 * and records every mutating call in order.
 */
public class RecordingObjectStore extends ObjectStore {

  private final Map<String, BucketAccess> access = new ConcurrentHashMap<>();
  private final Map<String, Map<String, byte[]>> objects = new ConcurrentHashMap<>();
  private final List<String> calls = Collections.synchronizedList(new ArrayList<>());
  private final Set<String> failingDeletes = Sets.newConcurrentHashSet();
  private volatile long deleteDelayMillis;

  @Override
  public void init() throws Exception {

  }

  public void setAccess(String bucket, BucketAccess bucketAccess) {
    if (bucketAccess == BucketAccess.NOT_EXISTS) {
      access.remove(bucket);
      objects.remove(bucket);
    } else {
      access.put(bucket, bucketAccess);
      objects.computeIfAbsent(bucket, b -> new ConcurrentSkipListMap<>());
    }
  }

  public void failDeletesOf(String bucket) {
    failingDeletes.add(bucket);
  }

  public void setDeleteDelayMillis(long deleteDelayMillis) {
    this.deleteDelayMillis = deleteDelayMillis;
  }

  public List<String> getCalls() {
    synchronized (calls) {
      return ImmutableList.copyOf(calls);
    }
  }

  public List<String> getCalls(String bucket) {
    List<String> result = new ArrayList<>();
    for (String call : getCalls()) {
      if (call.endsWith(":" + bucket)) {
        result.add(call);
      }
    }
    return result;
  }

  @Override
  public BucketAccess bucketExists(String bucket) throws Exception {
    return access.getOrDefault(bucket, BucketAccess.NOT_EXISTS);
  }

  @Override
  public void createBucket(String bucket) throws Exception {
    calls.add("create:" + bucket);
    if (access.containsKey(bucket)) {
      throw new IOException("Bucket " + bucket + " already exists");
    }
    setAccess(bucket, BucketAccess.ACCESS_GRANTED);
  }

  @Override
  public void deleteBucketRecursive(String bucket) throws Exception {
    calls.add("delete:" + bucket);
    if (deleteDelayMillis > 0) {
      Thread.sleep(deleteDelayMillis);
    }
    if (failingDeletes.contains(bucket)) {
      throw new IOException("Simulated failure deleting " + bucket);
    }
    if (access.get(bucket) != BucketAccess.ACCESS_GRANTED) {
      throw new IOException("Can not delete bucket " + bucket);
    }
    setAccess(bucket, BucketAccess.NOT_EXISTS);
  }

  @Override
  public List<ObjectSummary> listObjects(String bucket, String prefix) throws Exception {
    Map<String, byte[]> bucketObjects = getBucket(bucket);
    List<ObjectSummary> summaries = new ArrayList<>();
    for (Map.Entry<String, byte[]> entry : bucketObjects.entrySet()) {
      if (prefix == null || entry.getKey()
                                 .startsWith(prefix)) {
        summaries.add(new ObjectSummary(bucket, entry.getKey(), entry.getValue().length, 0L));
      }
    }
    return summaries;
  }

  @Override
  public InputStream getObject(String bucket, String key) throws Exception {
    byte[] bs = getBucket(bucket).get(key);
    if (bs == null) {
      throw new FileNotFoundException(key);
    }
    return new ByteArrayInputStream(bs);
  }

  @Override
  public void putObject(String bucket, String key, InputStream input, long length) throws Exception {
    getBucket(bucket).put(key, IOUtils.toByteArray(new BoundedInputStream(input, length)));
  }

  private Map<String, byte[]> getBucket(String bucket) throws FileNotFoundException {
    Map<String, byte[]> bucketObjects = objects.get(bucket);
    if (bucketObjects == null) {
      throw new FileNotFoundException("No such bucket " + bucket);
    }
    return bucketObjects;
  }

}
