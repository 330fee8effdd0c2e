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
package backup.harness.poll;

/**
 * The expected storage state never materialized within the attempt budget.
 */
public class PollingExhaustedException extends RuntimeException {

  private static final long serialVersionUID = -6419734458106652437L;

  private final int attempts;
  private final String lastReason;

  public PollingExhaustedException(int attempts, String lastReason) {
    this(attempts, lastReason, null);
  }

  public PollingExhaustedException(int attempts, String lastReason, Throwable cause) {
    super("Expected state not reached after " + attempts + " attempts, last state: " + lastReason, cause);
    this.attempts = attempts;
    this.lastReason = lastReason;
  }

  public int getAttempts() {
    return attempts;
  }

  public String getLastReason() {
    return lastReason;
  }

}
