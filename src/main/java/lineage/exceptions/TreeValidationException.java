package lineage.exceptions;

/**
 * Thrown when the arguments of a call do not describe something that exists in, or could be
 * added to, the tree.
 */
public class TreeValidationException extends LineageTreeException {

	private static final long serialVersionUID = 1L;

	public TreeValidationException(String msg) {
		super(msg);
	}
}
