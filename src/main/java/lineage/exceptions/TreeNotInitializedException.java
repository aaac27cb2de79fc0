package lineage.exceptions;

/**
 * Thrown when a structural query or mutation is attempted before a topology exists, or when
 * a character matrix is requested that was never supplied.
 */
public class TreeNotInitializedException extends LineageTreeException {

	private static final long serialVersionUID = 1L;

	public TreeNotInitializedException() {
		super("Tree has not been initialized.");
	}

	public TreeNotInitializedException(String msg) {
		super(msg);
	}
}
