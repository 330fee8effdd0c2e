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
 * Outcome of inspecting one listing: either the extracted value, or the
 * reason the expected state has not been reached yet.
 */
public final class PollResult<T> {

  private final boolean ready;
  private final T value;
  private final String reason;

  private PollResult(boolean ready, T value, String reason) {
    this.ready = ready;
    this.value = value;
    this.reason = reason;
  }

  public static <T> PollResult<T> ready(T value) {
    return new PollResult<>(true, value, null);
  }

  public static <T> PollResult<T> notReady(String reason) {
    return new PollResult<>(false, null, reason);
  }

  public boolean isReady() {
    return ready;
  }

  public T get() {
    if (!ready) {
      throw new IllegalStateException("Not ready: " + reason);
    }
    return value;
  }

  public String getReason() {
    return reason;
  }

  @Override
  public String toString() {
    return ready ? "Ready [" + value + "]" : "NotReady [" + reason + "]";
  }

}
