package notify.spi;

/**
 * Opaque transport-side handle for one open channel.
 */
public interface TransportChannel {

  /**
   * @return the name the channel was opened with
   */
  String name();
}
