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
 * One entry of a bucket listing.
 */
public class ObjectSummary implements Comparable<ObjectSummary> {
  private final String bucket;
  private final String key;
  private final long size;
  private final long lastModified;

  public ObjectSummary(String bucket, String key, long size, long lastModified) {
    this.bucket = bucket;
    this.key = key;
    this.size = size;
    this.lastModified = lastModified;
  }

  public String getBucket() {
    return bucket;
  }

  public String getKey() {
    return key;
  }

  public long getSize() {
    return size;
  }

  public long getLastModified() {
    return lastModified;
  }

  @Override
  public String toString() {
    return "ObjectSummary [bucket=" + bucket + ", key=" + key + ", size=" + size + ", lastModified=" + lastModified
        + "]";
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = 1;
    result = prime * result + ((bucket == null) ? 0 : bucket.hashCode());
    result = prime * result + ((key == null) ? 0 : key.hashCode());
    result = prime * result + (int) (lastModified ^ (lastModified >>> 32));
    result = prime * result + (int) (size ^ (size >>> 32));
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null)
      return false;
    if (getClass() != obj.getClass())
      return false;
    ObjectSummary other = (ObjectSummary) obj;
    if (bucket == null) {
      if (other.bucket != null)
        return false;
    } else if (!bucket.equals(other.bucket))
      return false;
    if (key == null) {
      if (other.key != null)
        return false;
    } else if (!key.equals(other.key))
      return false;
    if (lastModified != other.lastModified)
      return false;
    if (size != other.size)
      return false;
    return true;
  }

  @Override
  public int compareTo(ObjectSummary o) {
    int compare = bucket.compareTo(o.bucket);
    if (compare == 0) {
      return key.compareTo(o.key);
    }
    return compare;
  }

}
