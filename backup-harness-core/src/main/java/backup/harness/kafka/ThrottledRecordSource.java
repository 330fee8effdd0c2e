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

import java.util.List;
import java.util.concurrent.TimeUnit;

import backup.harness.generator.ThrottledGenerator;
import backup.harness.record.ReducedRecord;

/**
 * Serves a fixed list of records paced over a duration.
 */
public class ThrottledRecordSource implements RecordSource {

  private final Iterable<ReducedRecord> records;

  public ThrottledRecordSource(List<ReducedRecord> records, long duration, TimeUnit unit) {
    this.records = ThrottledGenerator.emit(records, duration, unit);
  }

  @Override
  public Iterable<ReducedRecord> records() {
    return records;
  }

}
