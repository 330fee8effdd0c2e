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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.nio.charset.StandardCharsets;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import org.junit.Test;

import backup.harness.record.ReducedRecord;

public class RecordGeneratorsTest {

  private static final long START = 1500000000000L;

  @Test
  public void testKafkaDataWithSentinel() {
    KafkaDataWithTimePeriod data = RecordGenerators.kafkaDataWithTimePeriods(new Random(1), "topic", 20, 5, 1000,
        3000, true, START);
    List<ReducedRecord> records = data.getData();
    assertEquals(21, records.size());
    assertEquals(20, data.getDataWithoutSentinel()
                         .size());
    assertEquals(3000, data.getPeriodMillis());
    assertTrue(data.hasTrailingSentinel());

    Set<String> keys = new HashSet<>();
    for (int i = 0; i < 20; i++) {
      ReducedRecord record = records.get(i);
      assertEquals("topic", record.getTopic());
      assertEquals(0, record.getPartition());
      assertEquals(i, record.getOffset());
      assertEquals(Long.valueOf(START + i * 1000L), record.getTimestamp());
      assertTrue(record.hasKey());
      int length = record.getValueBytes().length;
      assertTrue(length >= 8 && length <= 64);
      keys.add(record.getKey());
    }
    assertEquals(5, keys.size());
    assertEquals(records.get(0)
                        .getKey(),
        records.get(5)
               .getKey());

    ReducedRecord sentinel = records.get(20);
    assertFalse(sentinel.hasKey());
    assertEquals(20, sentinel.getOffset());
    assertEquals(Long.valueOf(START + 19 * 1000L + 3000), sentinel.getTimestamp());
    assertArrayEquals("sentinel".getBytes(StandardCharsets.UTF_8), sentinel.getValueBytes());
  }

  @Test
  public void testKafkaDataWithoutSentinel() {
    KafkaDataWithTimePeriod data = RecordGenerators.kafkaDataWithTimePeriods(new Random(2), "topic", 10, 10, 0, 100,
        false, START);
    assertEquals(10, data.getData()
                         .size());
    assertEquals(data.getData(), data.getDataWithoutSentinel());
    for (ReducedRecord record : data.getData()) {
      assertEquals(Long.valueOf(START), record.getTimestamp());
    }
  }

  @Test
  public void testKafkaDataInvalidArguments() {
    try {
      RecordGenerators.kafkaDataWithTimePeriods(new Random(), "topic", 5, 6, 0, 100, false);
      fail();
    } catch (IllegalArgumentException e) {
      // expected
    }
    try {
      RecordGenerators.kafkaDataWithTimePeriods(new Random(), "topic", 5, 5, 0, 0, false);
      fail();
    } catch (IllegalArgumentException e) {
      // expected
    }
  }

  @Test
  public void testBucketNames() {
    Random random = new Random(3);
    for (int i = 0; i < 1000; i++) {
      String name = RecordGenerators.bucketName(random, "harness-", false);
      assertTrue(name, name.startsWith("harness-"));
      assertFalse(name, name.contains("."));
      assertTrue(name, RecordGenerators.isValidBucketName(name, false));
    }
    for (int i = 0; i < 1000; i++) {
      String name = RecordGenerators.bucketName(random, null, true);
      assertTrue(name, RecordGenerators.isValidBucketName(name, true));
    }
  }

  @Test
  public void testBucketNameRejectsPrefix() {
    for (String prefix : new String[] { "Upper", "-dash", "dotted.", "under_score" }) {
      try {
        RecordGenerators.bucketName(new Random(), prefix, false);
        fail(prefix);
      } catch (IllegalArgumentException e) {
        // expected
      }
    }
    for (String prefix : new String[] { "a..b", "a.-b", "a-.b" }) {
      try {
        RecordGenerators.bucketName(new Random(), prefix, true);
        fail(prefix);
      } catch (IllegalArgumentException e) {
        // expected
      }
    }
    Random random = new Random(11);
    for (int i = 0; i < 200; i++) {
      String name = RecordGenerators.bucketName(random, "a.b-c.", true);
      assertTrue(name, RecordGenerators.isValidBucketName(name, true));
    }
    StringBuilder tooLong = new StringBuilder();
    for (int i = 0; i < RecordGenerators.MAX_BUCKET_NAME_LENGTH; i++) {
      tooLong.append('a');
    }
    try {
      RecordGenerators.bucketName(new Random(), tooLong.toString(), false);
      fail();
    } catch (IllegalArgumentException e) {
      // expected
    }
    assertTrue(RecordGenerators.bucketName(new Random(), "dotted.", true)
                               .startsWith("dotted."));
  }

  @Test
  public void testIsValidBucketName() {
    assertTrue(RecordGenerators.isValidBucketName("abc", false));
    assertTrue(RecordGenerators.isValidBucketName("my.bucket", true));
    assertFalse(RecordGenerators.isValidBucketName("my.bucket", false));
    assertFalse(RecordGenerators.isValidBucketName("ab", false));
    assertFalse(RecordGenerators.isValidBucketName("Abc", false));
    assertFalse(RecordGenerators.isValidBucketName("abc-", false));
    assertFalse(RecordGenerators.isValidBucketName("a..b", true));
    assertFalse(RecordGenerators.isValidBucketName("a.-b", true));
    assertFalse(RecordGenerators.isValidBucketName("192.168.1.1", true));
    assertFalse(RecordGenerators.isValidBucketName(null, true));
  }

}
