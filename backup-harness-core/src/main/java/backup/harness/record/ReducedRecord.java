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
package backup.harness.record;

import java.util.Base64;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;

/**
 * The parts of a Kafka consumer record that a backup keeps. Key and value are
 * held as base64 text, exactly as they appear in the backed up JSON.
 */
@JsonInclude(Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ReducedRecord {

  private final String topic;
  private final int partition;
  private final long offset;
  private final String key;
  private final String value;
  private final Long timestamp;

  @JsonCreator
  public ReducedRecord(@JsonProperty(value = "topic", required = true) String topic,
      @JsonProperty(value = "partition", required = true) int partition,
      @JsonProperty(value = "offset", required = true) long offset, @JsonProperty("key") String key,
      @JsonProperty(value = "value", required = true) String value, @JsonProperty("timestamp") Long timestamp) {
    this.topic = Preconditions.checkNotNull(topic, "topic");
    this.partition = partition;
    this.offset = offset;
    this.key = key;
    this.value = Preconditions.checkNotNull(value, "value");
    this.timestamp = timestamp;
  }

  /**
   * Builds a record from raw bytes, key may be null.
   */
  public static ReducedRecord fromBytes(String topic, int partition, long offset, byte[] key, byte[] value,
      Long timestamp) {
    Base64.Encoder encoder = Base64.getEncoder();
    return new ReducedRecord(topic, partition, offset, key == null ? null : encoder.encodeToString(key),
        encoder.encodeToString(value), timestamp);
  }

  @JsonProperty
  public String getTopic() {
    return topic;
  }

  @JsonProperty
  public int getPartition() {
    return partition;
  }

  @JsonProperty
  public long getOffset() {
    return offset;
  }

  /**
   * Base64 encoded key, null when the record has no key.
   */
  @JsonProperty
  public String getKey() {
    return key;
  }

  @JsonProperty
  public String getValue() {
    return value;
  }

  /**
   * Epoch millis, null when unknown.
   */
  @JsonProperty
  public Long getTimestamp() {
    return timestamp;
  }

  @JsonIgnore
  public boolean hasKey() {
    return key != null;
  }

  /**
   * @throws InvalidEncodingException
   *           if the key is not valid base64
   */
  @JsonIgnore
  public byte[] getKeyBytes() {
    if (key == null) {
      return null;
    }
    return decode("key", key);
  }

  /**
   * @throws InvalidEncodingException
   *           if the value is not valid base64
   */
  @JsonIgnore
  public byte[] getValueBytes() {
    return decode("value", value);
  }

  private byte[] decode(String field, String base64) {
    try {
      return Base64.getDecoder()
                   .decode(base64);
    } catch (IllegalArgumentException e) {
      throw new InvalidEncodingException(
          "Record " + topic + "-" + partition + "@" + offset + " has a " + field + " that is not valid base64", e);
    }
  }

  @Override
  public String toString() {
    return "ReducedRecord [topic=" + topic + ", partition=" + partition + ", offset=" + offset + ", key=" + key
        + ", value=" + value + ", timestamp=" + timestamp + "]";
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = 1;
    result = prime * result + ((key == null) ? 0 : key.hashCode());
    result = prime * result + (int) (offset ^ (offset >>> 32));
    result = prime * result + partition;
    result = prime * result + ((timestamp == null) ? 0 : timestamp.hashCode());
    result = prime * result + topic.hashCode();
    result = prime * result + value.hashCode();
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
    ReducedRecord other = (ReducedRecord) obj;
    if (key == null) {
      if (other.key != null)
        return false;
    } else if (!key.equals(other.key))
      return false;
    if (offset != other.offset)
      return false;
    if (partition != other.partition)
      return false;
    if (timestamp == null) {
      if (other.timestamp != null)
        return false;
    } else if (!timestamp.equals(other.timestamp))
      return false;
    if (!topic.equals(other.topic))
      return false;
    if (!value.equals(other.value))
      return false;
    return true;
  }

}
