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

/**
 * The bucket name already exists but belongs to another principal, or this
 * principal lacks the permissions to use it.
 */
public class BucketConflictException extends RuntimeException {

  private static final long serialVersionUID = 2518706240427957337L;

  private final String bucket;

  public BucketConflictException(String bucket) {
    super("Unable to create bucket: " + bucket + " since it already exists however permissions are inadequate");
    this.bucket = bucket;
  }

  public String getBucket() {
    return bucket;
  }

}
