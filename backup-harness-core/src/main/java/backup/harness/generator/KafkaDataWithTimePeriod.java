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

import java.util.List;

import backup.harness.record.ReducedRecord;

/**
 * Generated records together with the backup period length they were spread
 * over.
 */
public class KafkaDataWithTimePeriod {

  private final List<ReducedRecord> data;
  private final long periodMillis;
  private final boolean trailingSentinel;

  public KafkaDataWithTimePeriod(List<ReducedRecord> data, long periodMillis, boolean trailingSentinel) {
    this.data = data;
    this.periodMillis = periodMillis;
    this.trailingSentinel = trailingSentinel;
  }

  public List<ReducedRecord> getData() {
    return data;
  }

  public long getPeriodMillis() {
    return periodMillis;
  }

  public boolean hasTrailingSentinel() {
    return trailingSentinel;
  }

  /**
   * The records a backup is expected to contain, which excludes the sentinel.
   */
  public List<ReducedRecord> getDataWithoutSentinel() {
    if (trailingSentinel) {
      return data.subList(0, data.size() - 1);
    }
    return data;
  }

}
