package works.grove;

/**
 * Handed to each callback of a walk or search so the callback can stop it.
 * Stopping is cooperative: the walk ends right after the callback that
 * called {@link #cancel()} returns.
 */
public final class Cancellation {
	private boolean cancelled = false;

	public void cancel() {
		cancelled = true;
	}

	public boolean isCancelled() {
		return cancelled;
	}
}
