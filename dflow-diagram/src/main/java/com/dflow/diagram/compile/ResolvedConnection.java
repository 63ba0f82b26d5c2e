package com.dflow.diagram.compile;

import com.dflow.diagram.description.ConnectionDescription;
import com.dflow.diagram.model.Edge;

/**
 * Connection after Resolution: canonical edge plus the raw description it came from.
 */
public record ResolvedConnection(String connectionId, Edge edge, ConnectionDescription description) {
}
