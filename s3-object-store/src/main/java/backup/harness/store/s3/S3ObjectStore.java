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

import static backup.harness.store.s3.S3ObjectStoreConstants.BACKUP_HARNESS_S3_CREDENTIALS_PROVIDER_FACTORY_DEFAULT;
import static backup.harness.store.s3.S3ObjectStoreConstants.BACKUP_HARNESS_S3_CREDENTIALS_PROVIDER_FACTORY_KEY;
import static backup.harness.store.s3.S3ObjectStoreConstants.BACKUP_HARNESS_S3_ENDPOINT_KEY;
import static backup.harness.store.s3.S3ObjectStoreConstants.BACKUP_HARNESS_S3_LISTING_MAXKEYS_DEFAULT;
import static backup.harness.store.s3.S3ObjectStoreConstants.BACKUP_HARNESS_S3_LISTING_MAXKEYS_KEY;
import static backup.harness.store.s3.S3ObjectStoreConstants.BACKUP_HARNESS_S3_PATH_STYLE_ACCESS_DEFAULT;
import static backup.harness.store.s3.S3ObjectStoreConstants.BACKUP_HARNESS_S3_PATH_STYLE_ACCESS_KEY;
import static backup.harness.store.s3.S3ObjectStoreConstants.BACKUP_HARNESS_S3_REGION_KEY;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import org.apache.commons.configuration.Configuration;
import org.apache.commons.configuration.SystemConfiguration;
import org.apache.commons.io.IOUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.amazonaws.AmazonServiceException;
import com.amazonaws.client.builder.AwsClientBuilder.EndpointConfiguration;
import com.amazonaws.services.s3.AmazonS3;
import com.amazonaws.services.s3.AmazonS3ClientBuilder;
import com.amazonaws.services.s3.model.AbortMultipartUploadRequest;
import com.amazonaws.services.s3.model.CreateBucketRequest;
import com.amazonaws.services.s3.model.DeleteObjectsRequest;
import com.amazonaws.services.s3.model.DeleteObjectsRequest.KeyVersion;
import com.amazonaws.services.s3.model.HeadBucketRequest;
import com.amazonaws.services.s3.model.ListMultipartUploadsRequest;
import com.amazonaws.services.s3.model.ListObjectsV2Request;
import com.amazonaws.services.s3.model.ListObjectsV2Result;
import com.amazonaws.services.s3.model.MultipartUpload;
import com.amazonaws.services.s3.model.MultipartUploadListing;
import com.amazonaws.services.s3.model.ObjectMetadata;
import com.amazonaws.services.s3.model.PutObjectRequest;
import com.amazonaws.services.s3.model.S3Object;
import com.amazonaws.services.s3.model.S3ObjectSummary;

import backup.harness.store.BucketAccess;
import backup.harness.store.ObjectStore;
import backup.harness.store.ObjectSummary;
import backup.harness.store.ReflectionUtils;

public class S3ObjectStore extends ObjectStore {

  private final static Logger LOG = LoggerFactory.getLogger(S3ObjectStore.class);

  private static final int FORBIDDEN = 403;
  private static final int NOT_FOUND = 404;

  private S3AWSCredentialsProviderFactory credentialsProviderFactory;
  private AmazonS3 s3Client;
  private int maxKeys;

  public S3ObjectStore() {

  }

  S3ObjectStore(AmazonS3 s3Client, int maxKeys) {
    this.s3Client = s3Client;
    this.maxKeys = maxKeys;
  }

  public static void main(String[] args) throws Exception {
    SystemConfiguration systemConfiguration = new SystemConfiguration();
    String bucket = "harness-store-test-" + UUID.randomUUID()
                                                .toString();
    try (S3ObjectStore store = new S3ObjectStore()) {
      store.setConf(systemConfiguration);
      store.init();
      if (store.bucketExists(bucket) != BucketAccess.NOT_EXISTS) {
        throw new RuntimeException("Random bucket " + bucket + " should not exist.");
      }
      store.createBucket(bucket);
      byte[] bs = "harness".getBytes(StandardCharsets.UTF_8);
      store.putObject(bucket, "check/object", new ByteArrayInputStream(bs), bs.length);
      List<ObjectSummary> objects = store.listObjects(bucket, "check/");
      if (objects.size() != 1) {
        throw new RuntimeException("Wrong number of objects. " + objects.size());
      }
      try (InputStream input = store.getObject(bucket, "check/object")) {
        String value = new String(IOUtils.toByteArray(input), StandardCharsets.UTF_8);
        if (!value.equals("harness")) {
          throw new RuntimeException("Can not read object that was just written.");
        }
      }
      store.deleteBucketRecursive(bucket);
    }
    System.out.println("Yay! The s3 object store seems to work.");
  }

  @Override
  public void init() throws Exception {
    Configuration conf = getConf();

    String classname = conf.getString(BACKUP_HARNESS_S3_CREDENTIALS_PROVIDER_FACTORY_KEY,
        BACKUP_HARNESS_S3_CREDENTIALS_PROVIDER_FACTORY_DEFAULT);
    Class<? extends S3AWSCredentialsProviderFactory> clazz = ReflectionUtils.loadClass(classname,
        S3AWSCredentialsProviderFactory.class);
    credentialsProviderFactory = ReflectionUtils.newInstance(clazz, conf);
    maxKeys = conf.getInt(BACKUP_HARNESS_S3_LISTING_MAXKEYS_KEY, BACKUP_HARNESS_S3_LISTING_MAXKEYS_DEFAULT);

    AmazonS3ClientBuilder builder = AmazonS3ClientBuilder.standard()
                                                         .withCredentials(credentialsProviderFactory.getCredentials())
                                                         .withPathStyleAccessEnabled(
                                                             conf.getBoolean(BACKUP_HARNESS_S3_PATH_STYLE_ACCESS_KEY,
                                                                 BACKUP_HARNESS_S3_PATH_STYLE_ACCESS_DEFAULT));
    String endpoint = conf.getString(BACKUP_HARNESS_S3_ENDPOINT_KEY);
    String region = conf.getString(BACKUP_HARNESS_S3_REGION_KEY);
    if (endpoint != null) {
      builder.withEndpointConfiguration(new EndpointConfiguration(endpoint, region));
    } else if (region != null) {
      builder.withRegion(region);
    }
    s3Client = builder.build();
  }

  protected AmazonS3 getAmazonS3Client() {
    return s3Client;
  }

  @Override
  public BucketAccess bucketExists(String bucket) throws Exception {
    AmazonS3 client = getAmazonS3Client();
    try {
      client.headBucket(new HeadBucketRequest(bucket));
      return BucketAccess.ACCESS_GRANTED;
    } catch (AmazonServiceException e) {
      switch (e.getStatusCode()) {
      case FORBIDDEN:
        return BucketAccess.ACCESS_DENIED;
      case NOT_FOUND:
        return BucketAccess.NOT_EXISTS;
      default:
        throw e;
      }
    }
  }

  @Override
  public void createBucket(String bucket) throws Exception {
    getAmazonS3Client().createBucket(new CreateBucketRequest(bucket));
  }

  @Override
  public void deleteBucketRecursive(String bucket) throws Exception {
    AmazonS3 client = getAmazonS3Client();
    abortMultipartUploads(client, bucket);
    deleteAllObjects(client, bucket);
    client.deleteBucket(bucket);
  }

  private void abortMultipartUploads(AmazonS3 client, String bucket) {
    ListMultipartUploadsRequest request = new ListMultipartUploadsRequest(bucket);
    while (true) {
      MultipartUploadListing listing = client.listMultipartUploads(request);
      for (MultipartUpload upload : listing.getMultipartUploads()) {
        LOG.info("Aborting incomplete upload {} of key {} in bucket {}", upload.getUploadId(), upload.getKey(), bucket);
        client.abortMultipartUpload(new AbortMultipartUploadRequest(bucket, upload.getKey(), upload.getUploadId()));
      }
      if (!listing.isTruncated()) {
        return;
      }
      request = new ListMultipartUploadsRequest(bucket).withKeyMarker(listing.getNextKeyMarker())
                                                        .withUploadIdMarker(listing.getNextUploadIdMarker());
    }
  }

  private void deleteAllObjects(AmazonS3 client, String bucket) {
    String continuationToken = null;
    while (true) {
      ListObjectsV2Result result = client.listObjectsV2(createObjectRequest(bucket, null, continuationToken));
      List<KeyVersion> keys = new ArrayList<>();
      for (S3ObjectSummary summary : result.getObjectSummaries()) {
        keys.add(new KeyVersion(summary.getKey()));
      }
      if (!keys.isEmpty()) {
        client.deleteObjects(new DeleteObjectsRequest(bucket).withKeys(keys)
                                                             .withQuiet(true));
      }
      if (!result.isTruncated()) {
        return;
      }
      continuationToken = result.getNextContinuationToken();
    }
  }

  @Override
  public List<ObjectSummary> listObjects(String bucket, String prefix) throws Exception {
    AmazonS3 client = getAmazonS3Client();
    List<ObjectSummary> summaries = new ArrayList<>();
    String continuationToken = null;
    while (true) {
      ListObjectsV2Result result = client.listObjectsV2(createObjectRequest(bucket, prefix, continuationToken));
      for (S3ObjectSummary summary : result.getObjectSummaries()) {
        long lastModified = summary.getLastModified() == null ? 0L
            : summary.getLastModified()
                     .getTime();
        summaries.add(new ObjectSummary(bucket, summary.getKey(), summary.getSize(), lastModified));
      }
      if (!result.isTruncated()) {
        return summaries;
      }
      continuationToken = result.getNextContinuationToken();
    }
  }

  private ListObjectsV2Request createObjectRequest(String bucket, String prefix, String continuationToken) {
    return new ListObjectsV2Request().withBucketName(bucket)
                                     .withPrefix(prefix)
                                     .withContinuationToken(continuationToken)
                                     .withMaxKeys(maxKeys);
  }

  @Override
  public InputStream getObject(String bucket, String key) throws Exception {
    S3Object s3Object = getAmazonS3Client().getObject(bucket, key);
    return s3Object.getObjectContent();
  }

  @Override
  public void putObject(String bucket, String key, InputStream input, long length) throws Exception {
    ObjectMetadata objectMetaData = new ObjectMetadata();
    objectMetaData.setContentLength(length);
    getAmazonS3Client().putObject(new PutObjectRequest(bucket, key, input, objectMetaData));
  }

  @Override
  public void close() throws IOException {
    if (s3Client != null) {
      s3Client.shutdown();
    }
  }

}
