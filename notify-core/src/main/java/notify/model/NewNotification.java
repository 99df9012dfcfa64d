package notify.model;

import com.github.f4b6a3.ulid.UlidCreator;
import notify.Priority;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A notification to be inserted through a {@link notify.spi.NotificationStore}.
 *
 * <p>{@code userId}, {@code category}, {@code title} and {@code content} are required and
 * must not be blank. The id defaults to a monotonic ULID.
 */
public final class NewNotification {
  private final String id;
  private final String userId;
  private final String category;
  private final String title;
  private final String content;
  private final Priority priority;
  private final Map<String, String> metadata;
  private final Instant createdAt;
  private final Instant expiresAt;

  private NewNotification(Builder builder) {
    this.id = builder.id == null ? UlidCreator.getMonotonicUlid().toString() : builder.id;
    this.userId = requireText(builder.userId, "userId");
    this.category = requireText(builder.category, "category");
    this.title = requireText(builder.title, "title");
    this.content = requireText(builder.content, "content");
    this.priority = builder.priority == null ? Priority.NORMAL : builder.priority;
    this.metadata = builder.metadata == null
        ? Collections.emptyMap()
        : Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
    this.createdAt = builder.createdAt == null ? Instant.now() : builder.createdAt;
    if (builder.expiresAt != null && !builder.expiresAt.isAfter(this.createdAt)) {
      throw new IllegalArgumentException("expiresAt must be after createdAt");
    }
    this.expiresAt = builder.expiresAt;
  }

  private static String requireText(String value, String name) {
    Objects.requireNonNull(value, name);
    if (value.isBlank()) {
      throw new IllegalArgumentException(name + " cannot be blank");
    }
    return value;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns a copy addressed to another user with a fresh id. Used for bulk sends.
   *
   * @param otherUserId the recipient of the copy
   * @return a new notification
   */
  public NewNotification forUser(String otherUserId) {
    return builder()
        .userId(otherUserId)
        .category(category)
        .title(title)
        .content(content)
        .priority(priority)
        .metadata(metadata)
        .createdAt(createdAt)
        .expiresAt(expiresAt)
        .build();
  }

  public String id() {
    return id;
  }

  public String userId() {
    return userId;
  }

  public String category() {
    return category;
  }

  public String title() {
    return title;
  }

  public String content() {
    return content;
  }

  public Priority priority() {
    return priority;
  }

  public Map<String, String> metadata() {
    return metadata;
  }

  public Instant createdAt() {
    return createdAt;
  }

  public Instant expiresAt() {
    return expiresAt;
  }

  /**
   * Builder for {@link NewNotification}.
   */
  public static final class Builder {
    private String id;
    private String userId;
    private String category;
    private String title;
    private String content;
    private Priority priority;
    private Map<String, String> metadata;
    private Instant createdAt;
    private Instant expiresAt;

    private Builder() {
    }

    public Builder id(String id) {
      this.id = id;
      return this;
    }

    /**
     * <b>Required.</b>
     */
    public Builder userId(String userId) {
      this.userId = userId;
      return this;
    }

    /**
     * <b>Required.</b> The notification type, e.g. {@code "message"} or {@code "payment"}.
     */
    public Builder category(String category) {
      this.category = category;
      return this;
    }

    /**
     * <b>Required.</b>
     */
    public Builder title(String title) {
      this.title = title;
      return this;
    }

    /**
     * <b>Required.</b>
     */
    public Builder content(String content) {
      this.content = content;
      return this;
    }

    /**
     * Optional. Defaults to {@link Priority#NORMAL}.
     */
    public Builder priority(Priority priority) {
      this.priority = priority;
      return this;
    }

    public Builder metadata(Map<String, String> metadata) {
      this.metadata = metadata;
      return this;
    }

    /**
     * Optional. Defaults to {@link Instant#now()}.
     */
    public Builder createdAt(Instant createdAt) {
      this.createdAt = createdAt;
      return this;
    }

    /**
     * Optional. Rows past their expiry are removed by
     * {@link notify.spi.NotificationStore#purgeExpired}.
     */
    public Builder expiresAt(Instant expiresAt) {
      this.expiresAt = expiresAt;
      return this;
    }

    public NewNotification build() {
      return new NewNotification(this);
    }
  }
}
