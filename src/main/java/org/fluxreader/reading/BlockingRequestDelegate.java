/* This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.fluxreader.reading;

import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

import org.fluxreader.background.common.log.Logger;
import org.fluxreader.sync.net.FluxResponse;

/**
 * Collects the outcome of a request so that a caller can wait for it.
 * Good for exactly one request.
 */
public class BlockingRequestDelegate implements FluxRequestDelegate {
  private static final String LOG_TAG = "BlockingDelegate";

  // Extra wait for remotes that answer on another thread.
  private static final long AWAIT_SLACK_MILLIS = 5 * 1000;

  private static final ScheduledExecutorService deadlines = Executors.newSingleThreadScheduledExecutor(new ThreadFactory() {
    @Override
    public Thread newThread(Runnable r) {
      final Thread thread = new Thread(r, "FluxRequestDeadlines");
      thread.setDaemon(true);
      return thread;
    }
  });

  /**
   * Starts one request against a remote.
   */
  public interface Call {
    public void start(FluxRemote remote, FluxRequestDelegate delegate);
  }

  public static class Result {
    public final FluxResponse response;
    public final Exception exception;

    protected Result(FluxResponse response, Exception exception) {
      this.response = response;
      this.exception = exception;
    }

    public static Result failure(Exception e) {
      return new Result(null, e);
    }

    public boolean wasSuccessful() {
      return exception == null && response != null && response.wasSuccessful();
    }

    /**
     * A human-readable reason for a failure.
     */
    public String describeFailure() {
      if (exception != null) {
        final String message = exception.getMessage();
        return message == null ? exception.getClass().getSimpleName() : message;
      }
      if (response != null) {
        return response.getErrorMessage();
      }
      return "No result";
    }

    @Override
    public String toString() {
      return wasSuccessful() ? "Result[success]" : "Result[" + describeFailure() + "]";
    }
  }

  private final LinkedBlockingQueue<Result> queue = new LinkedBlockingQueue<Result>(1);

  @Override
  public void onSuccess(FluxResponse response) {
    queue.offer(new Result(response, null));
  }

  @Override
  public void onFailure(FluxResponse response) {
    queue.offer(new Result(response, null));
  }

  @Override
  public void onFailure(Exception e) {
    queue.offer(new Result(null, e));
  }

  /**
   * Wait for the outcome.
   *
   * @return the outcome; a timed-out wait is reported as a failed result.
   */
  public Result await(long timeout, TimeUnit unit) throws InterruptedException {
    final Result result = queue.poll(timeout, unit);
    if (result == null) {
      return Result.failure(new TimeoutException("No response after " + unit.toMillis(timeout) + "ms."));
    }
    return result;
  }

  /**
   * Convenience for remotes that run synchronously, where the result is
   * already present when the call returns.
   */
  public Result take() throws InterruptedException {
    return queue.take();
  }

  /**
   * The longest a request may take: connecting plus the total timeout.
   */
  public static long deadlineMillis(ServerCredentials credentials) {
    return (long) credentials.connectTimeoutMillis + credentials.socketTimeoutMillis;
  }

  /**
   * Run one request on a fresh remote, aborting it at the deadline.
   */
  public static Result execute(FluxRemoteFactory factory, ServerCredentials credentials, String description, Call call) {
    return execute(factory.createRemote(credentials), deadlineMillis(credentials), description, call);
  }

  /**
   * Run one request and wait for its outcome. A request still running after
   * <code>deadlineMillis</code> is stopped with {@link FluxRemote#abortAll()},
   * so <code>remote</code> must not be shared with other requests.
   * <p>
   * An interrupted wait is reported as a failure, with the thread's
   * interrupt flag set again.
   */
  public static Result execute(final FluxRemote remote, final long deadlineMillis, final String description, Call call) {
    final AtomicBoolean expired = new AtomicBoolean(false);
    final ScheduledFuture<?> deadline = deadlines.schedule(new Runnable() {
      @Override
      public void run() {
        Logger.warn(LOG_TAG, description + " still running after " + deadlineMillis + "ms; aborting.");
        expired.set(true);
        remote.abortAll();
      }
    }, deadlineMillis, TimeUnit.MILLISECONDS);

    final BlockingRequestDelegate delegate = new BlockingRequestDelegate();
    try {
      call.start(remote, delegate);
      final Result result = delegate.await(deadlineMillis + AWAIT_SLACK_MILLIS, TimeUnit.MILLISECONDS);
      if (expired.get() && !result.wasSuccessful()) {
        return Result.failure(new TimeoutException(description + " timed out after " + deadlineMillis + "ms."));
      }
      return result;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return Result.failure(e);
    } finally {
      deadline.cancel(false);
    }
  }
}
