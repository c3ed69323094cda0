package com.coursesync.scrape.http;

import com.coursesync.scrape.model.RequestLane;

public final class RequestLaneContext {
  private static final ThreadLocal<RequestLane> CURRENT = new ThreadLocal<>();

  private RequestLaneContext() {}

  public static RequestLane current() {
    RequestLane lane = CURRENT.get();
    return lane == null ? RequestLane.BACKGROUND : lane;
  }

  public static Scope activate(RequestLane lane) {
    RequestLane previous = CURRENT.get();
    CURRENT.set(lane);
    return () -> {
      if (previous == null) {
        CURRENT.remove();
      } else {
        CURRENT.set(previous);
      }
    };
  }

  public interface Scope extends AutoCloseable {
    @Override
    void close();
  }
}
