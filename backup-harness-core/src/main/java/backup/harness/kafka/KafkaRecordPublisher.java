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
package backup.harness.kafka;

import java.io.Closeable;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sends producer records to Kafka in iteration order. Combined with
 * {@link backup.harness.generator.ThrottledGenerator#emit} the records arrive
 * at the broker spread over time.
 */
public class KafkaRecordPublisher implements Closeable {

  private final static Logger LOG = LoggerFactory.getLogger(KafkaRecordPublisher.class);

  private final Producer<byte[], byte[]> producer;

  public KafkaRecordPublisher(Producer<byte[], byte[]> producer) {
    this.producer = producer;
  }

  public List<Future<RecordMetadata>> publish(Iterable<ProducerRecord<byte[], byte[]>> records) {
    List<Future<RecordMetadata>> futures = new ArrayList<>();
    for (ProducerRecord<byte[], byte[]> record : records) {
      futures.add(producer.send(record));
    }
    producer.flush();
    LOG.info("Published {} records", futures.size());
    return futures;
  }

  /**
   * Publishes and waits for every send to be acknowledged.
   *
   * @throws ExecutionException
   *           with the first send failure
   */
  public List<RecordMetadata> publishAndWait(Iterable<ProducerRecord<byte[], byte[]>> records)
      throws InterruptedException, ExecutionException {
    List<RecordMetadata> metadata = new ArrayList<>();
    for (Future<RecordMetadata> future : publish(records)) {
      metadata.add(future.get());
    }
    return metadata;
  }

  @Override
  public void close() {
    producer.close();
  }

}
