package blockstore;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;
import java.util.Properties;

/**
 * Settings of a {@link BlockStore}.
 * <p>
 * {@link #load()} reads {@code blockstore.properties} from the classpath and lets {@code blockstore.*}
 * system properties override it:
 * <ul>
 *   <li>{@code blockstore.idPrefix} prefix of generated block ids</li>
 *   <li>{@code blockstore.verifyChanges} run {@link BlockStore#check()} after every committed change</li>
 *   <li>{@code blockstore.verifyIndex} compare the index with the block list after every committed change</li>
 * </ul>
 */
public final class StoreOptions {

  private static final Logger LOG = LogManager.getLogger(StoreOptions.class);

  public static final String RESOURCE = "/blockstore.properties";
  public static final String PREFIX = "blockstore.";

  public static final StoreOptions DEFAULTS = new StoreOptions("block", true, false);

  public final String idPrefix;
  public final boolean verifyChanges;
  public final boolean verifyIndex;

  public StoreOptions(String idPrefix, boolean verifyChanges, boolean verifyIndex) {
    this.idPrefix = idPrefix;
    this.verifyChanges = verifyChanges;
    this.verifyIndex = verifyIndex;
  }

  public static StoreOptions load() {
    Properties props = new Properties();
    try (InputStream in = StoreOptions.class.getResourceAsStream(RESOURCE)) {
      if (in != null) {
        props.load(in);
      }
    }
    catch (IOException e) {
      LOG.warn("Failed to read {}: {}", RESOURCE, e.getMessage());
    }
    for (String name : System.getProperties().stringPropertyNames()) {
      if (name.startsWith(PREFIX)) {
        props.setProperty(name, System.getProperty(name));
      }
    }
    return fromProperties(props);
  }

  public static StoreOptions fromProperties(Properties props) {
    return new StoreOptions(props.getProperty(PREFIX + "idPrefix", DEFAULTS.idPrefix),
                            flag(props, "verifyChanges", DEFAULTS.verifyChanges),
                            flag(props, "verifyIndex", DEFAULTS.verifyIndex));
  }

  private static boolean flag(Properties props, String name, boolean defaultValue) {
    String raw = props.getProperty(PREFIX + name);
    if (raw == null) {
      return defaultValue;
    }
    raw = raw.trim();
    if (raw.equalsIgnoreCase("true") || raw.equalsIgnoreCase("false")) {
      return Boolean.parseBoolean(raw);
    }
    LOG.warn("Ignoring invalid value '{}' of {}{}", raw, PREFIX, name);
    return defaultValue;
  }

  public StoreOptions withIdPrefix(String idPrefix) {
    return new StoreOptions(idPrefix, verifyChanges, verifyIndex);
  }

  public StoreOptions withVerifyChanges(boolean verifyChanges) {
    return new StoreOptions(idPrefix, verifyChanges, verifyIndex);
  }

  public StoreOptions withVerifyIndex(boolean verifyIndex) {
    return new StoreOptions(idPrefix, verifyChanges, verifyIndex);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    StoreOptions options = (StoreOptions)o;
    return verifyChanges == options.verifyChanges &&
           verifyIndex == options.verifyIndex &&
           idPrefix.equals(options.idPrefix);
  }

  @Override
  public int hashCode() {
    return Objects.hash(idPrefix, verifyChanges, verifyIndex);
  }

  @Override
  public String toString() {
    return "StoreOptions{" +
           "idPrefix='" + idPrefix + '\'' +
           ", verifyChanges=" + verifyChanges +
           ", verifyIndex=" + verifyIndex +
           '}';
  }
}
