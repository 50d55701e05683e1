package org.labrad.awg.parser;

import java.io.IOException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Set;

import org.labrad.awg.Constants;
import org.labrad.awg.description.SequenceDescription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import com.google.common.io.Resources;

/**
 * Named sequence templates that can be inserted with {@code load preset}.
 * A registry is passed to each parse explicitly.
 */
public final class PresetRegistry {
  private static final Logger log = LoggerFactory.getLogger(PresetRegistry.class);

  private final ImmutableMap<String, SequenceDescription> presets;

  private PresetRegistry(Map<String, SequenceDescription> presets) {
    this.presets = ImmutableMap.copyOf(presets);
  }

  public static PresetRegistry empty() {
    return builder().build();
  }

  /**
   * The presets bundled on the classpath.
   */
  public static PresetRegistry standard() {
    Builder builder = builder();
    for (String name : Constants.STANDARD_PRESETS) {
      builder.addResource(name, Constants.PRESET_PATH + name + ".seq");
    }
    return builder.build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public boolean contains(String name) {
    return presets.containsKey(name.toLowerCase());
  }

  /**
   * Look up a preset, or null if none is registered under that name.
   */
  public SequenceDescription get(String name) {
    return presets.get(name.toLowerCase());
  }

  public Set<String> getNames() {
    return presets.keySet();
  }

  public static class Builder {
    private final Map<String, SequenceDescription> presets = Maps.newLinkedHashMap();

    private Builder() {}

    public Builder add(String name, SequenceDescription preset) {
      String key = name.toLowerCase();
      Preconditions.checkArgument(!presets.containsKey(key), "Preset '%s' is already registered", name);
      presets.put(key, Preconditions.checkNotNull(preset));
      return this;
    }

    /**
     * Parse a preset from sequence text. Presets cannot load other presets.
     */
    public Builder addSource(String name, String source) {
      return add(name, new SequenceParser(PresetRegistry.empty()).parse(source));
    }

    public Builder addResource(String name, String resource) {
      URL url = Resources.getResource(PresetRegistry.class, resource);
      String source;
      try {
        source = Resources.toString(url, StandardCharsets.UTF_8);
      } catch (IOException e) {
        throw new IllegalStateException("Failed to read preset resource " + resource, e);
      }
      log.debug("Loaded preset '{}' from {}", name, resource);
      return addSource(name, source);
    }

    public PresetRegistry build() {
      return new PresetRegistry(presets);
    }
  }
}
