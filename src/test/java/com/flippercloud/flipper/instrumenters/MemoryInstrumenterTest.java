package com.flippercloud.flipper.instrumenters;

import com.flippercloud.flipper.BaseTest;
import com.google.common.collect.ImmutableMap;

import org.junit.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.fail;

@SuppressWarnings("javadoc")
public class MemoryInstrumenterTest extends BaseTest {
  private final MemoryInstrumenter instrumenter = new MemoryInstrumenter();

  @Test
  public void recordsNamePayloadAndResult() {
    Map<String, Object> payload = new HashMap<>();
    payload.put("feature_name", "search");
    String result = instrumenter.instrument("feature_operation.flipper", payload, p -> {
      p.put("gate_name", "boolean");
      return "done";
    });

    assertEquals("done", result);
    MemoryInstrumenter.Event event = instrumenter.eventByName("feature_operation.flipper");
    assertEquals("feature_operation.flipper", event.getName());
    assertEquals(ImmutableMap.of("feature_name", "search", "gate_name", "boolean"), event.getPayload());
    assertEquals("done", event.getResult());
    assertEquals(ImmutableMap.of("feature_name", "search"), payload);
  }

  @Test
  public void recordsExceptionAndRethrows() {
    IllegalStateException error = new IllegalStateException("boom");
    try {
      instrumenter.instrument("adapter_operation.flipper", null, p -> {
        throw error;
      });
      fail("expected exception");
    } catch (IllegalStateException e) {
      assertSame(error, e);
    }
    MemoryInstrumenter.Event event = instrumenter.eventByName("adapter_operation.flipper");
    assertSame(error, event.getPayload().get("exception"));
    assertNull(event.getResult());
  }

  @Test
  public void filtersByNameAndResets() {
    instrumenter.instrument("a", new HashMap<>(), p -> 1);
    instrumenter.instrument("b", new HashMap<>(), p -> 2);
    instrumenter.instrument("a", new HashMap<>(), p -> 3);

    assertEquals(3, instrumenter.count());
    assertEquals(2, instrumenter.eventsByName("a").size());
    assertEquals(3, instrumenter.eventsByName("a").get(1).getResult());
    assertNull(instrumenter.eventByName("c"));

    instrumenter.reset();
    assertEquals(0, instrumenter.count());
  }

  @Test
  public void noopInstrumenterJustRuns() {
    assertEquals(Integer.valueOf(5), NoopInstrumenter.INSTANCE.instrument("a", new HashMap<>(), p -> 5));
  }
}
