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

import static backup.harness.store.s3.S3ObjectStoreConstants.BACKUP_HARNESS_S3_ACCESS_KEY_KEY;
import static backup.harness.store.s3.S3ObjectStoreConstants.BACKUP_HARNESS_S3_SECRET_KEY_KEY;

import org.apache.commons.configuration.Configuration;

import com.amazonaws.auth.AWSCredentialsProvider;
import com.amazonaws.auth.AWSStaticCredentialsProvider;
import com.amazonaws.auth.BasicAWSCredentials;

/**
 * Fixed access and secret keys taken from the configuration, typically for an
 * emulated S3 endpoint.
 */
public class StaticS3AWSCredentialsProviderFactory extends S3AWSCredentialsProviderFactory {

  @Override
  public AWSCredentialsProvider getCredentials() throws Exception {
    Configuration conf = getConf();
    String accessKey = conf.getString(BACKUP_HARNESS_S3_ACCESS_KEY_KEY);
    String secretKey = conf.getString(BACKUP_HARNESS_S3_SECRET_KEY_KEY);
    if (accessKey == null || secretKey == null) {
      throw new IllegalArgumentException("Both " + BACKUP_HARNESS_S3_ACCESS_KEY_KEY + " and "
          + BACKUP_HARNESS_S3_SECRET_KEY_KEY + " are required");
    }
    return new AWSStaticCredentialsProvider(new BasicAWSCredentials(accessKey, secretKey));
  }

}
