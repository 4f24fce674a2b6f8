package net.haproxy.dataplane.client.utils;

import java.util.Collections;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import net.haproxy.dataplane.abstractions.exceptions.OperationCancelledException;

import org.apache.http.client.methods.HttpUriRequest;


public class CancellationTokenSource {

  private volatile boolean cancelled = false;

  private final CountDownLatch cancelledLatch = new CountDownLatch(1);

  private final Set<HttpUriRequest> inFlightRequests = Collections.newSetFromMap(new ConcurrentHashMap<HttpUriRequest, Boolean>());

  public CancellationToken getToken() {
    return new CancellationToken();
  }

  public class CancellationToken {
    private CancellationToken() {

    }

    public boolean isCancellationRequested() {
      return cancelled;
    }

    public void throwIfCancellationRequested() {
      if (cancelled) {
        throw new OperationCancelledException("Operation was cancelled");
      }
    }

    /**
     * Request is aborted if cancellation happens while it is executing.
     */
    public void register(HttpUriRequest request) {
      inFlightRequests.add(request);
      if (cancelled) {
        request.abort();
      }
    }

    public void unregister(HttpUriRequest request) {
      inFlightRequests.remove(request);
    }

    /**
     * Blocks until cancelled or the timeout elapses.
     * @return true when cancellation was requested
     */
    public boolean await(long timeoutMillis) throws InterruptedException {
      return cancelledLatch.await(timeoutMillis, TimeUnit.MILLISECONDS);
    }
  }

  public void cancel() {
    cancelled = true;
    cancelledLatch.countDown();
    for (HttpUriRequest request : inFlightRequests) {
      request.abort();
    }
  }
}
