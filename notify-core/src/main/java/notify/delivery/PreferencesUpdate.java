package notify.delivery;

import java.time.ZoneId;
import java.util.Set;

/**
 * Partial update of {@link NotificationPreferences}. Fields left unset keep their stored
 * value.
 */
public final class PreferencesUpdate {
  private final Set<DeliveryChannel> channelsEnabled;
  private final Set<String> mutedCategories;
  private final QuietHours quietHours;
  private final ZoneId zone;

  private PreferencesUpdate(Builder builder) {
    this.channelsEnabled = builder.channelsEnabled == null ? null : Set.copyOf(builder.channelsEnabled);
    this.mutedCategories = builder.mutedCategories == null ? null : Set.copyOf(builder.mutedCategories);
    this.quietHours = builder.quietHours;
    this.zone = builder.zone;
  }

  public static Builder builder() {
    return new Builder();
  }

  public Set<DeliveryChannel> channelsEnabled() {
    return channelsEnabled;
  }

  public Set<String> mutedCategories() {
    return mutedCategories;
  }

  public QuietHours quietHours() {
    return quietHours;
  }

  public ZoneId zone() {
    return zone;
  }

  public static final class Builder {
    private Set<DeliveryChannel> channelsEnabled;
    private Set<String> mutedCategories;
    private QuietHours quietHours;
    private ZoneId zone;

    private Builder() {
    }

    public Builder channelsEnabled(Set<DeliveryChannel> channelsEnabled) {
      this.channelsEnabled = channelsEnabled;
      return this;
    }

    public Builder mutedCategories(Set<String> mutedCategories) {
      this.mutedCategories = mutedCategories;
      return this;
    }

    public Builder quietHours(QuietHours quietHours) {
      this.quietHours = quietHours;
      return this;
    }

    public Builder zone(ZoneId zone) {
      this.zone = zone;
      return this;
    }

    public PreferencesUpdate build() {
      return new PreferencesUpdate(this);
    }
  }
}
