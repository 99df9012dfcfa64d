package notify;

import com.github.f4b6a3.ulid.UlidCreator;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A single notification as it arrives from the change stream, before batching.
 *
 * <p>Each event carries a ULID-based {@code eventId} unless the source row already has an
 * identifier. Events are grouped by {@code (recipientId, category)} in the
 * {@linkplain notify.batch.BatchQueue batch queue}.
 *
 * @see Deliverable
 */
public final class RawEvent {
  /** Category that is always delivered immediately regardless of priority. */
  public static final String URGENT_CATEGORY = "urgent";

  private final String eventId;
  private final String recipientId;
  private final String category;
  private final String title;
  private final String body;
  private final Priority priority;
  private final Map<String, String> payload;
  private final Instant occurredAt;

  private RawEvent(Builder builder) {
    this.eventId = builder.eventId == null ? UlidCreator.getMonotonicUlid().toString() : builder.eventId;
    this.recipientId = requireText(builder.recipientId, "recipientId");
    this.category = requireText(builder.category, "category");
    this.title = builder.title == null ? "" : builder.title;
    this.body = builder.body == null ? "" : builder.body;
    this.priority = builder.priority == null ? Priority.NORMAL : builder.priority;
    this.occurredAt = builder.occurredAt == null ? Instant.now() : builder.occurredAt;

    Map<String, String> copy = builder.payload == null
        ? Collections.emptyMap()
        : Collections.unmodifiableMap(new LinkedHashMap<>(builder.payload));
    if (copy.containsKey(null)) {
      throw new IllegalArgumentException("payload cannot contain null keys");
    }
    this.payload = copy;
  }

  private static String requireText(String value, String name) {
    Objects.requireNonNull(value, name);
    if (value.isEmpty()) {
      throw new IllegalArgumentException(name + " cannot be empty");
    }
    return value;
  }

  /**
   * Creates a builder for an event addressed to {@code recipientId} in {@code category}.
   *
   * @param recipientId the user the event is addressed to
   * @param category    the notification type, e.g. {@code "message"}
   * @return a new builder
   */
  public static Builder builder(String recipientId, String category) {
    return new Builder(recipientId, category);
  }

  public String eventId() {
    return eventId;
  }

  public String recipientId() {
    return recipientId;
  }

  public String category() {
    return category;
  }

  public String title() {
    return title;
  }

  public String body() {
    return body;
  }

  public Priority priority() {
    return priority;
  }

  public Map<String, String> payload() {
    return payload;
  }

  public Instant occurredAt() {
    return occurredAt;
  }

  /**
   * Returns {@code true} if this event skips the batch window: it has
   * {@link Priority#HIGH} priority or belongs to the {@value #URGENT_CATEGORY} category.
   *
   * @return whether the event is delivered immediately
   */
  public boolean isUrgent() {
    return priority == Priority.HIGH || URGENT_CATEGORY.equals(category);
  }

  @Override
  public String toString() {
    return "RawEvent{eventId=" + eventId
        + ", recipientId=" + recipientId
        + ", category=" + category
        + ", priority=" + priority + '}';
  }

  /**
   * Builder for {@link RawEvent}.
   */
  public static final class Builder {
    private final String recipientId;
    private final String category;
    private String eventId;
    private String title;
    private String body;
    private Priority priority;
    private Map<String, String> payload;
    private Instant occurredAt;

    private Builder(String recipientId, String category) {
      this.recipientId = recipientId;
      this.category = category;
    }

    /**
     * Sets the event identifier, typically the id of the stored notification row.
     *
     * <p>Optional. Defaults to a monotonic ULID.
     *
     * @param eventId the event identifier
     * @return this builder
     */
    public Builder eventId(String eventId) {
      this.eventId = eventId;
      return this;
    }

    /**
     * Sets the notification title.
     *
     * <p>Optional. Defaults to an empty string.
     *
     * @param title the title
     * @return this builder
     */
    public Builder title(String title) {
      this.title = title;
      return this;
    }

    /**
     * Sets the notification body.
     *
     * <p>Optional. Defaults to an empty string.
     *
     * @param body the body text
     * @return this builder
     */
    public Builder body(String body) {
      this.body = body;
      return this;
    }

    /**
     * Sets the priority.
     *
     * <p>Optional. Defaults to {@link Priority#NORMAL}.
     *
     * @param priority the priority
     * @return this builder
     */
    public Builder priority(Priority priority) {
      this.priority = priority;
      return this;
    }

    /**
     * Sets free-form string attributes carried to the in-app event.
     *
     * @param payload the attributes; copied on build
     * @return this builder
     */
    public Builder payload(Map<String, String> payload) {
      this.payload = payload;
      return this;
    }

    /**
     * Sets when the notification was created.
     *
     * <p>Optional. Defaults to {@link Instant#now()}.
     *
     * @param occurredAt the creation time
     * @return this builder
     */
    public Builder occurredAt(Instant occurredAt) {
      this.occurredAt = occurredAt;
      return this;
    }

    /**
     * Builds the event.
     *
     * @return a new {@link RawEvent}
     * @throws NullPointerException     if {@code recipientId} or {@code category} is null
     * @throws IllegalArgumentException if either is empty or the payload has a null key
     */
    public RawEvent build() {
      return new RawEvent(this);
    }
  }
}
