package notify.spring.boot;

import notify.NotifyConfig;
import notify.delivery.SoundCatalog;
import notify.jdbc.TableNames;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration properties for realtime notification sessions.
 *
 * @see NotifyAutoConfiguration
 */
@ConfigurationProperties(prefix = "notify")
public class NotifyProperties {

  private final Connection connection = new Connection();
  private final Batch batch = new Batch();
  private final Delivery delivery = new Delivery();
  private final Jdbc jdbc = new Jdbc();
  private final Metrics metrics = new Metrics();

  public Connection getConnection() {
    return connection;
  }

  public Batch getBatch() {
    return batch;
  }

  public Delivery getDelivery() {
    return delivery;
  }

  public Jdbc getJdbc() {
    return jdbc;
  }

  public Metrics getMetrics() {
    return metrics;
  }

  /**
   * Builds the session tuning from the bound values.
   *
   * @return a fresh config
   */
  public NotifyConfig toConfig() {
    return new NotifyConfig()
        .setReconnectBaseDelayMs(connection.getReconnectBaseDelayMs())
        .setReconnectMaxDelayMs(connection.getReconnectMaxDelayMs())
        .setMaxReconnectAttempts(connection.getMaxReconnectAttempts())
        .setStaleTimeoutMs(connection.getStaleTimeoutMs())
        .setBatchDelayMs(batch.getDelayMs())
        .setFlushOnClose(batch.isFlushOnClose())
        .setDeliveryWorkers(delivery.getWorkerCount())
        .setPopupAutoCloseMs(delivery.getPopupAutoCloseMs());
  }

  public static class Connection {
    private long reconnectBaseDelayMs = 1000;
    private long reconnectMaxDelayMs = 30000;
    private int maxReconnectAttempts = 5;

    /**
     * Silence after which a subscribed channel counts as dropped. 0 disables the check.
     */
    private long staleTimeoutMs = 0;

    public long getReconnectBaseDelayMs() {
      return reconnectBaseDelayMs;
    }

    public void setReconnectBaseDelayMs(long reconnectBaseDelayMs) {
      this.reconnectBaseDelayMs = reconnectBaseDelayMs;
    }

    public long getReconnectMaxDelayMs() {
      return reconnectMaxDelayMs;
    }

    public void setReconnectMaxDelayMs(long reconnectMaxDelayMs) {
      this.reconnectMaxDelayMs = reconnectMaxDelayMs;
    }

    public int getMaxReconnectAttempts() {
      return maxReconnectAttempts;
    }

    public void setMaxReconnectAttempts(int maxReconnectAttempts) {
      this.maxReconnectAttempts = maxReconnectAttempts;
    }

    public long getStaleTimeoutMs() {
      return staleTimeoutMs;
    }

    public void setStaleTimeoutMs(long staleTimeoutMs) {
      this.staleTimeoutMs = staleTimeoutMs;
    }
  }

  public static class Batch {
    private long delayMs = 1000;
    private boolean flushOnClose = false;

    public long getDelayMs() {
      return delayMs;
    }

    public void setDelayMs(long delayMs) {
      this.delayMs = delayMs;
    }

    public boolean isFlushOnClose() {
      return flushOnClose;
    }

    public void setFlushOnClose(boolean flushOnClose) {
      this.flushOnClose = flushOnClose;
    }
  }

  public static class Delivery {
    private int workerCount = 2;
    private long popupAutoCloseMs = 5000;

    /**
     * Sound resource per category. Replaces the built-in mapping when non-empty.
     */
    private Map<String, String> sounds = new LinkedHashMap<>();

    private String fallbackSound = SoundCatalog.DEFAULT_SOUND;

    /**
     * Display label per category, used in batch titles.
     */
    private Map<String, String> categoryLabels = new LinkedHashMap<>();

    public int getWorkerCount() {
      return workerCount;
    }

    public void setWorkerCount(int workerCount) {
      this.workerCount = workerCount;
    }

    public long getPopupAutoCloseMs() {
      return popupAutoCloseMs;
    }

    public void setPopupAutoCloseMs(long popupAutoCloseMs) {
      this.popupAutoCloseMs = popupAutoCloseMs;
    }

    public Map<String, String> getSounds() {
      return sounds;
    }

    public void setSounds(Map<String, String> sounds) {
      this.sounds = sounds;
    }

    public String getFallbackSound() {
      return fallbackSound;
    }

    public void setFallbackSound(String fallbackSound) {
      this.fallbackSound = fallbackSound;
    }

    public Map<String, String> getCategoryLabels() {
      return categoryLabels;
    }

    public void setCategoryLabels(Map<String, String> categoryLabels) {
      this.categoryLabels = categoryLabels;
    }
  }

  public static class Jdbc {
    private boolean enabled = true;
    private String notificationsTable = TableNames.DEFAULT_NOTIFICATIONS_TABLE;
    private String settingsTable = TableNames.DEFAULT_SETTINGS_TABLE;

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getNotificationsTable() {
      return notificationsTable;
    }

    public void setNotificationsTable(String notificationsTable) {
      this.notificationsTable = notificationsTable;
    }

    public String getSettingsTable() {
      return settingsTable;
    }

    public void setSettingsTable(String settingsTable) {
      this.settingsTable = settingsTable;
    }
  }

  public static class Metrics {
    private boolean enabled = true;
    private String namePrefix = "notify";

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getNamePrefix() {
      return namePrefix;
    }

    public void setNamePrefix(String namePrefix) {
      this.namePrefix = namePrefix;
    }
  }
}
