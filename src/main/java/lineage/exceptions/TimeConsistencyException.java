package lineage.exceptions;

/**
 * Thrown when a time assignment would make a node older than its parent or younger than
 * one of its children.
 */
public class TimeConsistencyException extends LineageTreeException {

	private static final long serialVersionUID = 1L;

	public TimeConsistencyException(String msg) {
		super(msg);
	}
}
