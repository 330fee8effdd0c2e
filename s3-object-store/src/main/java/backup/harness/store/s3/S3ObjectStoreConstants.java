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

public class S3ObjectStoreConstants {
  public static final String BACKUP_HARNESS_S3_ENDPOINT_KEY = "backup.harness.s3.endpoint";
  public static final String BACKUP_HARNESS_S3_REGION_KEY = "backup.harness.s3.region";
  public static final String BACKUP_HARNESS_S3_PATH_STYLE_ACCESS_KEY = "backup.harness.s3.path.style.access";
  public static final boolean BACKUP_HARNESS_S3_PATH_STYLE_ACCESS_DEFAULT = false;
  public static final String BACKUP_HARNESS_S3_LISTING_MAXKEYS_KEY = "backup.harness.s3.listing.maxkeys";
  public static final int BACKUP_HARNESS_S3_LISTING_MAXKEYS_DEFAULT = 1000;
  public static final String BACKUP_HARNESS_S3_ACCESS_KEY_KEY = "backup.harness.s3.access.key";
  public static final String BACKUP_HARNESS_S3_SECRET_KEY_KEY = "backup.harness.s3.secret.key";
  public static final String BACKUP_HARNESS_S3_CREDENTIALS_PROVIDER_FACTORY_KEY = "backup.harness.s3.credentials.provider.factory";
  public static final String BACKUP_HARNESS_S3_CREDENTIALS_PROVIDER_FACTORY_DEFAULT = "backup.harness.store.s3.DefaultS3AWSCredentialsProviderFactory";
}
