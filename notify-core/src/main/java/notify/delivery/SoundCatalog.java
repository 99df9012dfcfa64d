package notify.delivery;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Maps notification categories to sound resources, with a fallback for unmapped ones.
 */
public final class SoundCatalog {
  public static final String DEFAULT_SOUND = "/sounds/notification.mp3";

  private final Map<String, String> sounds;
  private final String fallback;

  private SoundCatalog(Map<String, String> sounds, String fallback) {
    this.sounds = Map.copyOf(sounds);
    this.fallback = fallback;
  }

  /**
   * Catalog with the built-in mapping: {@code message}, {@code system} and {@code alert}
   * have their own sound; everything else plays {@value #DEFAULT_SOUND}.
   *
   * @return the default catalog
   */
  public static SoundCatalog defaults() {
    return builder()
        .sound("message", "/sounds/message.mp3")
        .sound("system", "/sounds/system.mp3")
        .sound("alert", "/sounds/alert.mp3")
        .build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public String soundFor(String category) {
    return sounds.getOrDefault(category, fallback);
  }

  public static final class Builder {
    private final Map<String, String> sounds = new LinkedHashMap<>();
    private String fallback = DEFAULT_SOUND;

    private Builder() {
    }

    public Builder sound(String category, String resource) {
      sounds.put(Objects.requireNonNull(category, "category"), Objects.requireNonNull(resource, "resource"));
      return this;
    }

    /**
     * Optional. Defaults to {@value SoundCatalog#DEFAULT_SOUND}.
     */
    public Builder fallback(String fallback) {
      this.fallback = Objects.requireNonNull(fallback, "fallback");
      return this;
    }

    public SoundCatalog build() {
      return new SoundCatalog(sounds, fallback);
    }
  }
}
