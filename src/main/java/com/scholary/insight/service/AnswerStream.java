package com.scholary.insight.service;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;

/**
 * Answer fragments forwarded from a streaming chat completion.
 *
 * <p>Each fragment is handed to the consumer as soon as the upstream produces it and is also
 * appended to an accumulator. Exactly one {@link Listener} callback fires when the stream ends:
 *
 * <ul>
 *   <li>{@code onCompleted} with the full answer once the upstream is exhausted
 *   <li>{@code onFailed} if the upstream throws; the consumer then gets a single {@code "Error:
 *       ..."} fragment and the stream ends
 *   <li>{@code onCancelled} after {@link #cancel()} or an early {@link #close()}; the partial
 *       answer is dropped
 * </ul>
 *
 * <p>Iteration is single-threaded. {@link #cancel()} may be called from any thread; it closes the
 * upstream so a blocked read returns promptly.
 */
public final class AnswerStream implements Iterator<String>, AutoCloseable {

  /** End-of-stream callbacks. */
  public interface Listener {

    Listener NONE = new Listener() {};

    default void onCompleted(String answer, int fragments) {}

    default void onFailed(RuntimeException error, int fragments) {}

    default void onCancelled(int fragments) {}
  }

  private final Stream<String> upstream;
  private final Iterator<String> fragments;
  private final Listener listener;
  private final StringBuilder accumulated = new StringBuilder();
  private final AtomicBoolean finished = new AtomicBoolean();
  private final AtomicBoolean upstreamClosed = new AtomicBoolean();

  private volatile boolean cancelled;
  private String buffered;
  private int forwarded;

  public AnswerStream(Stream<String> upstream, Listener listener) {
    this.upstream = upstream;
    this.fragments = upstream.iterator();
    this.listener = listener;
  }

  /** A stream that yields one error fragment and ends. */
  public static AnswerStream ofError(String message) {
    return new AnswerStream(Stream.of(message), Listener.NONE);
  }

  @Override
  public boolean hasNext() {
    if (cancelled) {
      buffered = null;
      return false;
    }
    if (buffered != null) {
      return true;
    }
    if (finished.get()) {
      return false;
    }

    try {
      if (fragments.hasNext()) {
        String fragment = fragments.next();
        if (cancelled) {
          return false;
        }
        accumulated.append(fragment);
        forwarded++;
        buffered = fragment;
        return true;
      }
    } catch (RuntimeException e) {
      if (cancelled) {
        // closing the upstream from cancel() makes a blocked read fail
        return false;
      }
      if (finished.compareAndSet(false, true)) {
        closeUpstream();
        listener.onFailed(e, forwarded);
        buffered = "Error: " + e.getMessage();
        return true;
      }
      return false;
    }

    if (finished.compareAndSet(false, true)) {
      closeUpstream();
      listener.onCompleted(accumulated.toString(), forwarded);
    }
    return false;
  }

  @Override
  public String next() {
    if (!hasNext()) {
      throw new NoSuchElementException();
    }
    String fragment = buffered;
    buffered = null;
    return fragment;
  }

  /** Stop forwarding, abort the upstream and discard the partial answer. No-op once ended. */
  public void cancel() {
    if (finished.compareAndSet(false, true)) {
      cancelled = true;
      closeUpstream();
      listener.onCancelled(forwarded);
    }
  }

  public boolean isCancelled() {
    return cancelled;
  }

  /** Cancels the stream if it has not ended yet. */
  @Override
  public void close() {
    cancel();
  }

  private void closeUpstream() {
    if (upstreamClosed.compareAndSet(false, true)) {
      upstream.close();
    }
  }
}
