package notify.connection;

import notify.NotifyException;

/**
 * Thrown by {@link ConnectionManager#subscribe} when a live channel already uses the name.
 */
public class DuplicateChannelException extends NotifyException {
  private final String channelName;

  public DuplicateChannelException(String channelName) {
    super("Channel already subscribed: " + channelName);
    this.channelName = channelName;
  }

  public String channelName() {
    return channelName;
  }
}
