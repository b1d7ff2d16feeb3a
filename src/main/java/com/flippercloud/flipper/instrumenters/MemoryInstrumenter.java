package com.flippercloud.flipper.instrumenters;

import com.flippercloud.flipper.subsystems.Instrumenter;
import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Keeps every event in memory so that tests can inspect them.
 */
public final class MemoryInstrumenter implements Instrumenter {
  /**
   * One recorded event. The payload is the state after the operation finished.
   */
  public static final class Event {
    private final String name;
    private final Map<String, Object> payload;
    private final Object result;

    Event(String name, Map<String, Object> payload, Object result) {
      this.name = name;
      this.payload = payload;
      this.result = result;
    }

    public String getName() {
      return name;
    }

    public Map<String, Object> getPayload() {
      return payload;
    }

    public Object getResult() {
      return result;
    }

    @Override
    public String toString() {
      return "Event(" + name + ", " + payload + ")";
    }
  }

  private final List<Event> events = new ArrayList<>();

  @Override
  public <T> T instrument(String name, Map<String, Object> payload, Function<Map<String, Object>, T> operation) {
    Map<String, Object> recorded = payload == null ? new HashMap<>() : new HashMap<>(payload);
    T result;
    try {
      result = operation.apply(recorded);
    } catch (RuntimeException e) {
      recorded.put("exception", e);
      record(new Event(name, recorded, null));
      throw e;
    }
    record(new Event(name, recorded, result));
    return result;
  }

  private void record(Event event) {
    synchronized (events) {
      events.add(event);
    }
  }

  /**
   * Returns every event recorded so far.
   *
   * @return the events in the order they finished
   */
  public List<Event> getEvents() {
    synchronized (events) {
      return ImmutableList.copyOf(events);
    }
  }

  public List<Event> eventsByName(String name) {
    ImmutableList.Builder<Event> builder = ImmutableList.builder();
    for (Event e: getEvents()) {
      if (e.getName().equals(name)) {
        builder.add(e);
      }
    }
    return builder.build();
  }

  /**
   * Returns the first event with a name.
   *
   * @param name the event name
   * @return the event, or null
   */
  public Event eventByName(String name) {
    List<Event> matching = eventsByName(name);
    return matching.isEmpty() ? null : matching.get(0);
  }

  public int count() {
    synchronized (events) {
      return events.size();
    }
  }

  public void reset() {
    synchronized (events) {
      events.clear();
    }
  }
}
