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
package backup.harness.store.local;

import java.io.File;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

import org.apache.commons.configuration.Configuration;
import org.apache.commons.io.FileUtils;
import org.apache.commons.io.IOUtils;
import org.apache.commons.io.input.BoundedInputStream;
import org.apache.commons.io.filefilter.DirectoryFileFilter;
import org.apache.commons.io.filefilter.NameFileFilter;
import org.apache.commons.io.filefilter.NotFileFilter;
import org.apache.commons.io.filefilter.TrueFileFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;

import backup.harness.store.BucketAccess;
import backup.harness.store.ObjectStore;
import backup.harness.store.ObjectSummary;

/**
 * {@link ObjectStore} backed by a local directory, one sub directory per
 * bucket. Uploads are staged under {@value #UPLOADS} inside the bucket and
 * moved into place once complete, so an interrupted put leaves a remnant the
 * same way an unfinished multipart upload does.
 */
public class LocalObjectStore extends ObjectStore {

  private final static Logger LOG = LoggerFactory.getLogger(LocalObjectStore.class);

  static final String UPLOADS = ".uploads";

  private static final Joiner JOINER = Joiner.on('/');
  private static final Splitter SPLITTER = Splitter.on('/');

  private File dir;

  @Override
  public void init() throws Exception {
    Configuration configuration = getConf();
    String localPath = configuration.getString(LocalObjectStoreConstants.BACKUP_HARNESS_LOCAL_STORE_PATH_KEY);
    if (localPath == null) {
      throw new IllegalArgumentException(
          "Missing " + LocalObjectStoreConstants.BACKUP_HARNESS_LOCAL_STORE_PATH_KEY + " for local object store");
    }
    dir = new File(localPath);
    dir.mkdirs();
  }

  @Override
  public BucketAccess bucketExists(String bucket) throws Exception {
    File bucketDir = getBucketDir(bucket);
    if (!bucketDir.exists()) {
      return BucketAccess.NOT_EXISTS;
    }
    if (bucketDir.isDirectory() && bucketDir.canWrite()) {
      return BucketAccess.ACCESS_GRANTED;
    }
    return BucketAccess.ACCESS_DENIED;
  }

  @Override
  public void createBucket(String bucket) throws Exception {
    File bucketDir = getBucketDir(bucket);
    if (bucketDir.exists()) {
      throw new IOException("Bucket " + bucket + " already exists");
    }
    if (!bucketDir.mkdirs()) {
      throw new IOException("Could not create bucket " + bucket + " at " + bucketDir);
    }
  }

  @Override
  public void deleteBucketRecursive(String bucket) throws Exception {
    File bucketDir = getExistingBucketDir(bucket);
    Collection<File> remnants = listIncompleteUploads(bucket);
    if (!remnants.isEmpty()) {
      LOG.info("Removing {} incomplete uploads from bucket {}", remnants.size(), bucket);
    }
    FileUtils.deleteDirectory(bucketDir);
  }

  @Override
  public List<ObjectSummary> listObjects(String bucket, String prefix) throws Exception {
    File bucketDir = getExistingBucketDir(bucket);
    Collection<File> files = FileUtils.listFiles(bucketDir, TrueFileFilter.INSTANCE,
        new NotFileFilter(new NameFileFilter(UPLOADS)));
    List<ObjectSummary> summaries = new ArrayList<>();
    String basePath = bucketDir.getAbsolutePath();
    for (File file : files) {
      String relative = file.getAbsolutePath()
                            .substring(basePath.length() + 1);
      String key = relative.replace(File.separatorChar, '/');
      if (prefix == null || key.startsWith(prefix)) {
        summaries.add(new ObjectSummary(bucket, key, file.length(), file.lastModified()));
      }
    }
    Collections.sort(summaries);
    return summaries;
  }

  @Override
  public InputStream getObject(String bucket, String key) throws Exception {
    File file = getObjectFile(getExistingBucketDir(bucket), key);
    if (!file.isFile()) {
      throw new FileNotFoundException("No object " + key + " in bucket " + bucket);
    }
    return new FileInputStream(file);
  }

  @Override
  public void putObject(String bucket, String key, InputStream input, long length) throws Exception {
    File bucketDir = getExistingBucketDir(bucket);
    File target = getObjectFile(bucketDir, key);
    File uploads = new File(bucketDir, UPLOADS);
    uploads.mkdirs();
    File upload = new File(uploads, UUID.randomUUID()
                                        .toString());
    try (FileOutputStream output = new FileOutputStream(upload)) {
      IOUtils.copy(new BoundedInputStream(input, length), output);
    }
    if (upload.length() != length) {
      throw new IOException(
          "length of upload " + upload.length() + " different than expected " + length + " for key " + key);
    }
    target.getParentFile()
          .mkdirs();
    Files.move(upload.toPath(), target.toPath(), StandardCopyOption.REPLACE_EXISTING,
        StandardCopyOption.ATOMIC_MOVE);
  }

  /**
   * Uploads that were started but never moved into place.
   */
  public Collection<File> listIncompleteUploads(String bucket) {
    File uploads = new File(getBucketDir(bucket), UPLOADS);
    if (!uploads.isDirectory()) {
      return ImmutableList.of();
    }
    return FileUtils.listFiles(uploads, TrueFileFilter.INSTANCE, DirectoryFileFilter.INSTANCE);
  }

  private File getBucketDir(String bucket) {
    if (bucket == null || bucket.isEmpty() || bucket.contains("/") || bucket.startsWith(".")) {
      throw new IllegalArgumentException("Invalid bucket name [" + bucket + "]");
    }
    return new File(dir, bucket);
  }

  private File getExistingBucketDir(String bucket) throws FileNotFoundException {
    File bucketDir = getBucketDir(bucket);
    if (!bucketDir.isDirectory()) {
      throw new FileNotFoundException("No such bucket " + bucket);
    }
    return bucketDir;
  }

  private File getObjectFile(File bucketDir, String key) {
    List<String> parts = ImmutableList.copyOf(SPLITTER.split(key));
    for (String part : parts) {
      if (part.isEmpty() || part.equals(".") || part.equals("..")) {
        throw new IllegalArgumentException("Invalid object key [" + key + "]");
      }
    }
    if (parts.get(0)
             .equals(UPLOADS)) {
      throw new IllegalArgumentException("Object key [" + key + "] uses reserved prefix " + UPLOADS);
    }
    return new File(bucketDir, JOINER.join(parts)
                                     .replace('/', File.separatorChar));
  }

}
