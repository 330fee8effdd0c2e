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

/**
 * What the current principal may do with a bucket name before creating it.
 */
public enum BucketAccess {

  /**
   * Bucket exists and can be modified by this principal.
   */
  ACCESS_GRANTED,

  /**
   * Bucket exists but is owned by someone else, or permissions are missing.
   */
  ACCESS_DENIED,

  NOT_EXISTS

}
