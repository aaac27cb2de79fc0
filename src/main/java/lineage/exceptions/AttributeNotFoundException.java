package lineage.exceptions;

import java.io.PrintStream;

/**
 * Thrown when an attribute that was never set is read from a node.
 */
public class AttributeNotFoundException extends LineageTreeException {

	private static final long serialVersionUID = 1L;
	private final String node;
	private final String attributeName;

	public AttributeNotFoundException(String node, String attributeName) {
		super("Attribute " + attributeName + " not detected for node " + node + ".");
		this.node = node;
		this.attributeName = attributeName;
	}

	public String getNode() {
		return this.node;
	}

	public String getAttributeName() {
		return this.attributeName;
	}

	@Override
	public void reportFailedAction(PrintStream out, String failedAction) {
		out.println(failedAction + " failed; attribute not recognized: '" + this.attributeName + "'");
	}
}
