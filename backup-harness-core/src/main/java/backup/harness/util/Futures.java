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
package backup.harness.util;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Bridges the blocking store calls onto an explicitly supplied executor.
 */
public class Futures {

  public interface Action {
    void run() throws Exception;
  }

  public static <T> CompletableFuture<T> call(Callable<T> callable, Executor executor) {
    CompletableFuture<T> future = new CompletableFuture<>();
    try {
      executor.execute(() -> {
        try {
          future.complete(callable.call());
        } catch (Throwable t) {
          future.completeExceptionally(t);
        }
      });
    } catch (RejectedExecutionException e) {
      future.completeExceptionally(e);
    }
    return future;
  }

  public static CompletableFuture<Void> run(Action action, Executor executor) {
    return call(() -> {
      action.run();
      return null;
    }, executor);
  }

  /**
   * Completes after the given delay without holding a thread while waiting.
   */
  public static CompletableFuture<Void> delay(long delay, TimeUnit unit, ScheduledExecutorService scheduler) {
    CompletableFuture<Void> future = new CompletableFuture<>();
    try {
      scheduler.schedule(() -> future.complete(null), delay, unit);
    } catch (RejectedExecutionException e) {
      future.completeExceptionally(e);
    }
    return future;
  }

  /**
   * Strips the wrappers added by {@link CompletableFuture} composition.
   */
  public static Throwable unwrap(Throwable t) {
    Throwable current = t;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }

}
