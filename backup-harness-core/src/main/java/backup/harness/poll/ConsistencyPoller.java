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

import static backup.harness.HarnessConstants.BACKUP_HARNESS_POLL_ATTEMPTS_DEFAULT;
import static backup.harness.HarnessConstants.BACKUP_HARNESS_POLL_ATTEMPTS_KEY;
import static backup.harness.HarnessConstants.BACKUP_HARNESS_POLL_DELAY_DEFAULT;
import static backup.harness.HarnessConstants.BACKUP_HARNESS_POLL_DELAY_KEY;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.function.Supplier;

import org.apache.commons.configuration.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

import backup.harness.store.ObjectStore;
import backup.harness.store.ObjectSummary;
import backup.harness.util.Futures;

/**
 * Repeats a listing until a transform reports that the expected state has
 * been reached. Object listings are only eventually consistent after writes,
 * in particular after multipart uploads, so a single read is not enough.
 * <p>
 * Attempts run one after another with a fixed delay in between. A failed
 * listing counts as a not ready attempt, since a bucket or object may not be
 * visible yet. Exceptions thrown by the transform are not retried.
 */
public class ConsistencyPoller {

  private final static Logger LOG = LoggerFactory.getLogger(ConsistencyPoller.class);

  private final ScheduledExecutorService scheduler;
  private final int defaultAttempts;
  private final long defaultDelayMillis;

  public ConsistencyPoller(Configuration conf, ScheduledExecutorService scheduler) {
    this(scheduler, conf.getInt(BACKUP_HARNESS_POLL_ATTEMPTS_KEY, BACKUP_HARNESS_POLL_ATTEMPTS_DEFAULT),
        conf.getLong(BACKUP_HARNESS_POLL_DELAY_KEY, BACKUP_HARNESS_POLL_DELAY_DEFAULT), TimeUnit.MILLISECONDS);
  }

  public ConsistencyPoller(ScheduledExecutorService scheduler, int defaultAttempts, long defaultDelay,
      TimeUnit unit) {
    checkBounds(defaultAttempts, defaultDelay);
    this.scheduler = scheduler;
    this.defaultAttempts = defaultAttempts;
    this.defaultDelayMillis = unit.toMillis(defaultDelay);
  }

  public <S, T> CompletableFuture<T> waitUntil(Supplier<? extends CompletableFuture<S>> list,
      Function<? super S, PollResult<T>> transform) {
    return waitUntil(list, transform, defaultAttempts, defaultDelayMillis, TimeUnit.MILLISECONDS);
  }

  /**
   * @param list
   *          starts one listing, called at most attempts times
   * @param transform
   *          extracts the result from a listing or explains why it is not
   *          ready yet
   * @param attempts
   *          total number of attempts
   * @param delay
   *          the delay between each attempt after the first
   * @return completes with the first ready value, or fails with
   *         {@link PollingExhaustedException} once all attempts were not ready,
   *         carrying the last listing failure as its cause
   */
  public <S, T> CompletableFuture<T> waitUntil(Supplier<? extends CompletableFuture<S>> list,
      Function<? super S, PollResult<T>> transform, int attempts, long delay, TimeUnit unit) {
    checkBounds(attempts, delay);
    CompletableFuture<T> result = new CompletableFuture<>();
    attempt(list, transform, 1, attempts, unit.toMillis(delay), result);
    return result;
  }

  /**
   * Polls the listing of bucket, running the list calls on this poller's
   * scheduler.
   */
  public <T> CompletableFuture<T> waitForListing(ObjectStore store, String bucket,
      Function<? super List<ObjectSummary>, PollResult<T>> transform) {
    return waitUntil(() -> Futures.call(() -> store.listObjects(bucket, null), scheduler), transform);
  }

  private <S, T> void attempt(Supplier<? extends CompletableFuture<S>> list,
      Function<? super S, PollResult<T>> transform, int attempt, int attempts, long delayMillis,
      CompletableFuture<T> result) {
    CompletableFuture<S> listing;
    try {
      listing = Preconditions.checkNotNull(list.get(), "list returned null");
    } catch (Throwable t) {
      listing = CompletableFuture.failedFuture(t);
    }
    listing.whenComplete((snapshot, error) -> {
      String reason;
      Throwable cause = null;
      if (error != null) {
        cause = Futures.unwrap(error);
        reason = "listing failed: " + cause;
      } else {
        PollResult<T> pollResult;
        try {
          pollResult = Preconditions.checkNotNull(transform.apply(snapshot), "transform returned null");
        } catch (Throwable t) {
          result.completeExceptionally(t);
          return;
        }
        if (pollResult.isReady()) {
          result.complete(pollResult.get());
          return;
        }
        reason = pollResult.getReason();
      }
      if (attempt >= attempts) {
        result.completeExceptionally(new PollingExhaustedException(attempts, reason, cause));
        return;
      }
      LOG.info("Attempt {} of {} not ready, retrying in {} ms: {}", attempt, attempts, delayMillis, reason);
      try {
        scheduler.schedule(() -> attempt(list, transform, attempt + 1, attempts, delayMillis, result), delayMillis,
            TimeUnit.MILLISECONDS);
      } catch (RejectedExecutionException e) {
        result.completeExceptionally(e);
      }
    });
  }

  private static void checkBounds(int attempts, long delay) {
    Preconditions.checkArgument(attempts >= 1, "attempts must be at least 1, was %s", attempts);
    Preconditions.checkArgument(delay >= 0, "delay must not be negative, was %s", delay);
  }

}
