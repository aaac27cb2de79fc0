package lineage.exceptions;

import java.io.PrintStream;

/**
 * Base class for the faults raised by a LineageTree. Every fault is raised at the point of
 * the violation and the tree is left unchanged by the failing call.
 */
public class LineageTreeException extends java.lang.IllegalStateException {

	private static final long serialVersionUID = 1L;

	public LineageTreeException(String msg) {
		super(msg);
	}

	@Override
	public String toString() {
		return this.getClass().getSimpleName() + ": " + this.getMessage();
	}

	public void reportFailedAction(PrintStream out, String failedAction) {
		out.println(failedAction + " failed due to " + this.toString());
	}
}
