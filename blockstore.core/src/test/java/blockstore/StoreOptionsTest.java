package blockstore;

import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class StoreOptionsTest {

  @Test
  void classpathDefaults() {
    StoreOptions options = StoreOptions.load();
    assertEquals("block", options.idPrefix);
    assertTrue(options.verifyChanges);
    assertFalse(options.verifyIndex);
  }

  @Test
  void systemPropertiesOverrideDefaults() {
    System.setProperty("blockstore.idPrefix", "sys");
    System.setProperty("blockstore.verifyIndex", "true");
    try {
      StoreOptions options = StoreOptions.load();
      assertEquals("sys", options.idPrefix);
      assertTrue(options.verifyIndex);
    }
    finally {
      System.clearProperty("blockstore.idPrefix");
      System.clearProperty("blockstore.verifyIndex");
    }
  }

  @Test
  void fromProperties() {
    Properties props = new Properties();
    props.setProperty("blockstore.idPrefix", "n");
    props.setProperty("blockstore.verifyChanges", " FALSE ");
    assertEquals(new StoreOptions("n", false, false), StoreOptions.fromProperties(props));
    assertEquals(StoreOptions.DEFAULTS, StoreOptions.fromProperties(new Properties()));
  }

  @Test
  void invalidFlagFallsBackToDefault() {
    Properties props = new Properties();
    props.setProperty("blockstore.verifyChanges", "sometimes");
    assertTrue(StoreOptions.fromProperties(props).verifyChanges);
  }

  @Test
  void withers() {
    StoreOptions options = StoreOptions.DEFAULTS.withIdPrefix("x").withVerifyChanges(false).withVerifyIndex(true);
    assertEquals(new StoreOptions("x", false, true), options);
    assertEquals("block", StoreOptions.DEFAULTS.idPrefix);
  }
}
