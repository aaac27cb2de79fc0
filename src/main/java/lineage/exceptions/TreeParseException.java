package lineage.exceptions;

import java.io.PrintStream;

/**
 * Thrown by the readers when a serialized tree (bracket notation or a JSON topology snapshot)
 * can not be turned into a topology.
 */
public class TreeParseException extends Exception {

	private static final long serialVersionUID = 1L;
	private String message;
	private int position;

	public TreeParseException(String msg) {
		this(msg, -1);
	}

	public TreeParseException(String msg, int position) {
		super(msg);
		this.message = msg;
		this.position = position;
	}

	public int getPosition() {
		return this.position;
	}

	@Override
	public String toString() {
		if (this.position < 0) {
			return "Tree not parsable: " + this.message;
		}
		return "Tree not parsable at character " + this.position + ": " + this.message;
	}

	public void reportFailedAction(PrintStream out, String failedAction) {
		out.println(failedAction + " failed. " + this.toString());
	}
}
