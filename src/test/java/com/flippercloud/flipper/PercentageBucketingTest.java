package com.flippercloud.flipper;

import org.junit.Test;

import java.nio.charset.StandardCharsets;
import java.util.zip.CRC32;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

@SuppressWarnings("javadoc")
public class PercentageBucketingTest extends BaseTest {
  @Test
  public void crc32MatchesStandardChecksum() {
    for (String input: new String[] { "", "f", "fuser-42", "searchéuser", "a longer string with spaces" }) {
      CRC32 expected = new CRC32();
      expected.update(input.getBytes(StandardCharsets.UTF_8));
      assertEquals(input, expected.getValue(), PercentageBucketing.crc32(input));
    }
  }

  @Test
  public void bucketIsChecksumOfPrefixAndIdModuloScaledRange() {
    assertEquals(24536L, PercentageBucketing.bucketFor("f", "user-42"));
    assertEquals(PercentageBucketing.crc32("fuser-42") % 100000, PercentageBucketing.bucketFor("f", "user-42"));
  }

  @Test
  public void actorIsIncludedWhenBucketIsBelowScaledPercentage() {
    assertTrue(PercentageBucketing.isIncluded("f", "user-42", 25));
    assertTrue(PercentageBucketing.isIncluded("f", "user-42", 24.6));
    assertFalse(PercentageBucketing.isIncluded("f", "user-42", 24.5));
    assertFalse(PercentageBucketing.isIncluded("f", "user-42", 0));
    assertTrue(PercentageBucketing.isIncluded("f", "user-42", 100));
  }

  @Test
  public void fractionalPercentagesSplitBuckets() {
    // bucket 12480
    assertFalse(PercentageBucketing.isIncluded("search", "user-280", 12.0));
    assertTrue(PercentageBucketing.isIncluded("search", "user-280", 12.5));
  }

  @Test
  public void inclusionIsMonotonicInPercentage() {
    for (int i = 0; i < 500; i++) {
      String id = "user-" + i;
      boolean previous = false;
      for (double pct = 0; pct <= 100; pct += 0.5) {
        boolean included = PercentageBucketing.isIncluded("search", id, pct);
        if (previous) {
          assertTrue(id + " at " + pct, included);
        }
        previous = included;
      }
      assertTrue(previous);
    }
  }

  @Test
  public void inclusionIsDeterministic() {
    for (int i = 0; i < 100; i++) {
      String id = "user-" + i;
      assertEquals(PercentageBucketing.isIncluded("search", id, 33), PercentageBucketing.isIncluded("search", id, 33));
    }
  }

  @Test
  public void roughlyTheRequestedShareOfActorsIsIncluded() {
    int included = 0;
    for (int i = 0; i < 10000; i++) {
      if (PercentageBucketing.isIncluded("search", "user-" + i, 25)) {
        included++;
      }
    }
    assertEquals(2427, included);
  }

  @Test
  public void featureNameChangesBucket() {
    int differing = 0;
    for (int i = 0; i < 100; i++) {
      if (PercentageBucketing.bucketFor("search", "user-" + i) != PercentageBucketing.bucketFor("checkout", "user-" + i)) {
        differing++;
      }
    }
    assertTrue(differing > 90);
  }
}
