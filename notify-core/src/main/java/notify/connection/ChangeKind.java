package notify.connection;

/**
 * Kind of row change delivered on a channel. {@link #ALL} is only meaningful in a
 * {@link ChannelFilter}.
 */
public enum ChangeKind {
  INSERT,
  UPDATE,
  DELETE,
  ALL;

  /**
   * Returns {@code true} if a change of kind {@code actual} passes this filter kind.
   *
   * @param actual the kind of an incoming change
   * @return whether the change matches
   */
  public boolean matches(ChangeKind actual) {
    return this == ALL || this == actual;
  }
}
