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
package backup.harness.generator;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.regex.Pattern;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import backup.harness.record.ReducedRecord;

/**
 * Random test fixtures: keyed record streams spread over time and bucket names
 * that S3 accepts.
 */
public class RecordGenerators {

  static final int MIN_BUCKET_NAME_LENGTH = 3;
  static final int MAX_BUCKET_NAME_LENGTH = 63;

  private static final int MAX_RANDOM_BUCKET_PART = 24;
  private static final int MIN_RANDOM_BUCKET_PART = 8;
  private static final int MIN_VALUE_LENGTH = 8;
  private static final int MAX_VALUE_LENGTH = 64;

  private static final String LETTERS = "abcdefghijklmnopqrstuvwxyz";
  private static final String ALPHANUMERIC = LETTERS + "0123456789";

  private static final Pattern BUCKET_NAME = Pattern.compile("[a-z0-9][a-z0-9.-]*[a-z0-9]");
  private static final Pattern IP_ADDRESS = Pattern.compile("\\d+\\.\\d+\\.\\d+\\.\\d+");

  public static KafkaDataWithTimePeriod kafkaDataWithTimePeriods(Random random, String topic, int recordCount,
      int distinctKeys, long padTimestampsMillis, long periodMillis, boolean trailingSentinel) {
    return kafkaDataWithTimePeriods(random, topic, recordCount, distinctKeys, padTimestampsMillis, periodMillis,
        trailingSentinel, System.currentTimeMillis());
  }

  /**
   * Generates recordCount records on partition 0 of topic with consecutive
   * offsets. Keys cycle over distinctKeys distinct values and timestamps are
   * spaced padTimestampsMillis apart starting at startTimestamp. With
   * trailingSentinel one extra key-less record is appended a full period after
   * the last one, which makes a period based backup close its final period.
   */
  public static KafkaDataWithTimePeriod kafkaDataWithTimePeriods(Random random, String topic, int recordCount,
      int distinctKeys, long padTimestampsMillis, long periodMillis, boolean trailingSentinel, long startTimestamp) {
    Preconditions.checkArgument(recordCount > 0, "recordCount must be positive");
    Preconditions.checkArgument(distinctKeys > 0 && distinctKeys <= recordCount,
        "distinctKeys must be between 1 and recordCount");
    Preconditions.checkArgument(padTimestampsMillis >= 0, "padTimestampsMillis must not be negative");
    Preconditions.checkArgument(periodMillis > 0, "periodMillis must be positive");

    List<byte[]> keys = new ArrayList<>();
    for (int i = 0; i < distinctKeys; i++) {
      keys.add(("key-" + i + "-" + randomString(random, LETTERS, 6)).getBytes(StandardCharsets.UTF_8));
    }

    ImmutableList.Builder<ReducedRecord> builder = ImmutableList.builder();
    long timestamp = startTimestamp;
    for (int offset = 0; offset < recordCount; offset++) {
      byte[] value = new byte[MIN_VALUE_LENGTH + random.nextInt(MAX_VALUE_LENGTH - MIN_VALUE_LENGTH + 1)];
      random.nextBytes(value);
      timestamp = startTimestamp + offset * padTimestampsMillis;
      builder.add(ReducedRecord.fromBytes(topic, 0, offset, keys.get(offset % distinctKeys), value, timestamp));
    }
    if (trailingSentinel) {
      byte[] sentinel = "sentinel".getBytes(StandardCharsets.UTF_8);
      builder.add(ReducedRecord.fromBytes(topic, 0, recordCount, null, sentinel, timestamp + periodMillis));
    }
    return new KafkaDataWithTimePeriod(builder.build(), periodMillis, trailingSentinel);
  }

  /**
   * A random bucket name starting with prefix (may be null). Dots are only
   * used when useVirtualDotHost is enabled.
   */
  public static String bucketName(Random random, String prefix, boolean useVirtualDotHost) {
    String start = prefix == null ? "" : prefix;
    Preconditions.checkArgument(start.isEmpty() || start.matches("[a-z0-9][a-z0-9.-]*"),
        "Bucket prefix [%s] must start with a lowercase letter or digit and contain only [a-z0-9.-]", start);
    Preconditions.checkArgument(!start.contains("..") && !start.contains(".-") && !start.contains("-."),
        "Bucket prefix [%s] must not contain a dot next to another dot or a dash", start);
    Preconditions.checkArgument(useVirtualDotHost || !start.contains("."),
        "Bucket prefix [%s] contains dots but virtual dot host is disabled", start);
    int available = MAX_BUCKET_NAME_LENGTH - start.length();
    Preconditions.checkArgument(available >= MIN_RANDOM_BUCKET_PART, "Bucket prefix [%s] is too long", start);

    int length = MIN_RANDOM_BUCKET_PART
        + random.nextInt(Math.min(available, MAX_RANDOM_BUCKET_PART) - MIN_RANDOM_BUCKET_PART + 1);
    StringBuilder builder = new StringBuilder(start);
    builder.append(LETTERS.charAt(random.nextInt(LETTERS.length())));
    for (int i = 1; i < length - 1; i++) {
      char previous = builder.charAt(builder.length() - 1);
      int choice = random.nextInt(10);
      if (useVirtualDotHost && choice == 0 && previous != '.' && previous != '-') {
        builder.append('.');
      } else if (choice == 1 && previous != '.') {
        builder.append('-');
      } else {
        builder.append(ALPHANUMERIC.charAt(random.nextInt(ALPHANUMERIC.length())));
      }
    }
    builder.append(ALPHANUMERIC.charAt(random.nextInt(ALPHANUMERIC.length())));
    return builder.toString();
  }

  /**
   * Checks the S3 bucket naming rules that matter for generated names.
   */
  public static boolean isValidBucketName(String name, boolean allowDots) {
    if (name == null || name.length() < MIN_BUCKET_NAME_LENGTH || name.length() > MAX_BUCKET_NAME_LENGTH) {
      return false;
    }
    if (!BUCKET_NAME.matcher(name)
                    .matches()) {
      return false;
    }
    if (name.contains(".")) {
      if (!allowDots) {
        return false;
      }
      if (name.contains("..") || name.contains(".-") || name.contains("-.")) {
        return false;
      }
    }
    return !IP_ADDRESS.matcher(name)
                      .matches();
  }

  private static String randomString(Random random, String chars, int length) {
    StringBuilder builder = new StringBuilder(length);
    for (int i = 0; i < length; i++) {
      builder.append(chars.charAt(random.nextInt(chars.length())));
    }
    return builder.toString();
  }

}
