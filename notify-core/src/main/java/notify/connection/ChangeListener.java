package notify.connection;

/**
 * Receives the row changes of one subscribed channel, in the order the transport
 * delivered them. Exceptions thrown here are logged and do not affect the connection.
 */
@FunctionalInterface
public interface ChangeListener {

  void onChange(ChangeEvent event);
}
