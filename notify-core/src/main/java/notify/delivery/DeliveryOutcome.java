package notify.delivery;

import notify.Deliverable;

/**
 * What the dispatcher did with one deliverable.
 *
 * @param deliverable            the deliverable
 * @param published              whether the in-app publish succeeded
 * @param popupShown             whether a desktop popup was shown
 * @param soundPlayed            whether a sound was played
 * @param suppression            why popup and sound were withheld, or {@link Suppression#NONE}
 * @param usedDefaultPreferences whether default preferences were applied
 */
public record DeliveryOutcome(
    Deliverable deliverable,
    boolean published,
    boolean popupShown,
    boolean soundPlayed,
    Suppression suppression,
    boolean usedDefaultPreferences
) {

  public boolean isSuppressed() {
    return suppression != Suppression.NONE;
  }

  public enum Suppression {
    /** Popup and sound were allowed (individual channels may still be off). */
    NONE,
    /** The category is muted. */
    MUTED,
    /** Quiet hours were in effect and the deliverable was not high priority. */
    QUIET_HOURS,
    /** The dispatcher was closed before the deliverable was fully delivered. */
    CLOSED
  }
}
