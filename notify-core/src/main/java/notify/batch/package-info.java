/**
 * Burst coalescing: one deliverable per recipient and category per batch window.
 */
package notify.batch;
