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
package backup.harness.metrics;

import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Slf4jReporter;

public class Metrics {

  private final static Logger LOG = LoggerFactory.getLogger(Metrics.class);

  public static final MetricRegistry METRICS;
  public static final Slf4jReporter REPORTER;

  static {
    METRICS = new MetricRegistry();
    REPORTER = Slf4jReporter.forRegistry(METRICS)
                            .outputTo(LOG)
                            .convertRatesTo(TimeUnit.SECONDS)
                            .convertDurationsTo(TimeUnit.MILLISECONDS)
                            .build();
  }

  /**
   * Writes the current values of all harness metrics to the log once.
   */
  public static void report() {
    REPORTER.report();
  }

}
