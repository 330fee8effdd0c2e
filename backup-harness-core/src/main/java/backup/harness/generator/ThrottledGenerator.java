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

import java.util.Iterator;
import java.util.List;
import java.util.concurrent.TimeUnit;

import org.apache.kafka.clients.producer.ProducerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.codahale.metrics.Meter;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableList.Builder;
import com.google.common.collect.UnmodifiableIterator;
import com.google.common.util.concurrent.RateLimiter;

import backup.harness.metrics.Metrics;
import backup.harness.record.ReducedRecord;

/**
 * Paces a finite list of records so they are handed out over a period of time
 * instead of all at once.
 */
public class ThrottledGenerator {

  private final static Logger LOG = LoggerFactory.getLogger(ThrottledGenerator.class);

  private static final String EMITTED_RECORDS = "emittedRecords";

  /**
   * Each call to {@link Iterable#iterator()} starts a new paced run over the
   * same records, so the result can be replayed. A single iterator must only
   * be consumed by one thread.
   * <p>
   * Records are emitted at {@link #recordsPerMillisecond(int, long)} records
   * per millisecond, never slower than one per millisecond.
   */
  public static <T> Iterable<T> emit(List<T> records, long duration, TimeUnit unit) {
    long durationMillis = unit.toMillis(duration);
    Preconditions.checkArgument(durationMillis > 0, "duration must be at least one millisecond, was %s %s",
        duration, unit);
    List<T> copy = ImmutableList.copyOf(records);
    int perMillisecond = recordsPerMillisecond(copy.size(), durationMillis);
    LOG.debug("Emitting {} records over {} ms at {} records per ms", copy.size(), durationMillis, perMillisecond);
    Meter emitted = Metrics.METRICS.meter(EMITTED_RECORDS);
    return () -> new ThrottledIterator<>(copy.iterator(), RateLimiter.create(perMillisecond * 1000.0), emitted);
  }

  /**
   * Integer records per millisecond needed to spread count records across
   * durationMillis, clamped to at least one.
   */
  public static int recordsPerMillisecond(int count, long durationMillis) {
    Preconditions.checkArgument(durationMillis > 0, "durationMillis must be positive");
    long rate = count / durationMillis;
    return (int) Math.max(1L, Math.min(rate, Integer.MAX_VALUE));
  }

  /**
   * Only the topic, key and value are carried over. Records without a key
   * become key-less producer records.
   *
   * @throws backup.harness.record.InvalidEncodingException
   *           if a key or value is not valid base64
   */
  public static List<ProducerRecord<byte[], byte[]>> toProducerRecords(List<ReducedRecord> records) {
    Builder<ProducerRecord<byte[], byte[]>> builder = ImmutableList.builder();
    for (ReducedRecord record : records) {
      byte[] value = record.getValueBytes();
      if (record.hasKey()) {
        builder.add(new ProducerRecord<byte[], byte[]>(record.getTopic(), record.getKeyBytes(), value));
      } else {
        builder.add(new ProducerRecord<byte[], byte[]>(record.getTopic(), value));
      }
    }
    return builder.build();
  }

  private static class ThrottledIterator<T> extends UnmodifiableIterator<T> {

    private final Iterator<T> iterator;
    private final RateLimiter rateLimiter;
    private final Meter emitted;

    ThrottledIterator(Iterator<T> iterator, RateLimiter rateLimiter, Meter emitted) {
      this.iterator = iterator;
      this.rateLimiter = rateLimiter;
      this.emitted = emitted;
    }

    @Override
    public boolean hasNext() {
      return iterator.hasNext();
    }

    @Override
    public T next() {
      T next = iterator.next();
      rateLimiter.acquire();
      emitted.mark();
      return next;
    }
  }

}
