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
package backup.harness.store;

import static backup.harness.HarnessConstants.BACKUP_HARNESS_STORE_CLASS_DEFAULT;
import static backup.harness.HarnessConstants.BACKUP_HARNESS_STORE_CLASS_KEY;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;

import org.apache.commons.configuration.Configuration;

/**
 * The minimal set of object storage operations needed to drive and verify a
 * backup pipeline. Implementations are blocking; callers that need
 * asynchronous behavior run them on their own executor.
 */
public abstract class ObjectStore extends Configured implements Closeable {

  public synchronized static ObjectStore create(Configuration conf) throws Exception {
    String classname = conf.getString(BACKUP_HARNESS_STORE_CLASS_KEY, BACKUP_HARNESS_STORE_CLASS_DEFAULT);
    Class<? extends ObjectStore> clazz = ReflectionUtils.loadClass(classname, ObjectStore.class);
    ObjectStore objectStore = ReflectionUtils.newInstance(clazz, conf);
    objectStore.init();
    return objectStore;
  }

  public abstract void init() throws Exception;

  /**
   * Classifies the bucket name for the current principal.
   */
  public abstract BucketAccess bucketExists(String bucket) throws Exception;

  public abstract void createBucket(String bucket) throws Exception;

  /**
   * Removes every object and every incomplete multipart upload from the bucket
   * and then deletes the bucket itself.
   */
  public abstract void deleteBucketRecursive(String bucket) throws Exception;

  /**
   * Lists all objects in the bucket ordered by key, optionally restricted to
   * keys starting with prefix (null lists everything).
   */
  public abstract List<ObjectSummary> listObjects(String bucket, String prefix) throws Exception;

  /**
   * The returned stream must be closed by the caller.
   */
  public abstract InputStream getObject(String bucket, String key) throws Exception;

  /**
   * Stores exactly length bytes read from input under key. The stream is not
   * closed.
   */
  public abstract void putObject(String bucket, String key, InputStream input, long length) throws Exception;

  /**
   * Called when the store is no longer in use.
   */
  public void close() throws IOException {

  }
}
