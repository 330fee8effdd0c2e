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
package backup.harness.pipeline;

import java.io.ByteArrayInputStream;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import backup.harness.kafka.RecordSource;
import backup.harness.record.ReducedRecord;
import backup.harness.record.ReducedRecordCodec;
import backup.harness.store.ObjectStore;
import backup.harness.util.Futures;

/**
 * Stand-in backup that splits the consumed records into fixed periods starting
 * at the first record's timestamp and writes one object per closed period.
 * Each object ends with a null entry. The period that is still open when the
 * source runs dry is never written.
 */
public class MockedBackupPipeline implements BackupPipeline {

  private final static Logger LOG = LoggerFactory.getLogger(MockedBackupPipeline.class);

  private static final DateTimeFormatter KEY_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH-mm-ss.SSS'Z'")
                                                               .withZone(ZoneOffset.UTC);

  private final RecordSource source;
  private final ObjectStore store;
  private final String bucket;
  private final long periodMillis;
  private final Executor executor;

  public MockedBackupPipeline(RecordSource source, ObjectStore store, String bucket, long periodMillis,
      Executor executor) {
    this.source = source;
    this.store = store;
    this.bucket = bucket;
    this.periodMillis = periodMillis;
    this.executor = executor;
  }

  @Override
  public CompletableFuture<Void> run() {
    return Futures.run(this::backup, executor);
  }

  private void backup() throws Exception {
    Long periodStart = null;
    List<ReducedRecord> period = new ArrayList<>();
    for (ReducedRecord record : source.records()) {
      long timestamp = record.getTimestamp();
      if (periodStart == null) {
        periodStart = timestamp;
      }
      while (timestamp >= periodStart + periodMillis) {
        if (!period.isEmpty()) {
          write(periodStart, period);
          period = new ArrayList<>();
        }
        periodStart += periodMillis;
      }
      period.add(record);
    }
    LOG.info("Source exhausted, dropping {} records of the open period", period.size());
  }

  private void write(long periodStart, List<ReducedRecord> records) throws Exception {
    List<ReducedRecord> payload = new ArrayList<>(records);
    payload.add(null);
    byte[] bs = ReducedRecordCodec.encode(payload);
    String key = KEY_FORMAT.format(Instant.ofEpochMilli(periodStart));
    LOG.debug("Writing {} records to {}", records.size(), key);
    store.putObject(bucket, key, new ByteArrayInputStream(bs), bs.length);
  }

}
