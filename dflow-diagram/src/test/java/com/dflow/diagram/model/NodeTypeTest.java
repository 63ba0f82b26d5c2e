package com.dflow.diagram.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NodeTypeTest {

    @Test
    void fromValue_acceptsCaseAndDashVariants() {
        assertEquals(NodeType.PERSON_JOB, NodeType.fromValue("person_job"));
        assertEquals(NodeType.PERSON_JOB, NodeType.fromValue("Person-Job"));
        assertEquals(NodeType.SUB_DIAGRAM, NodeType.fromValue(" SUB_DIAGRAM "));
    }

    @Test
    void fromValue_unknownFallsBack() {
        assertEquals(NodeType.UNKNOWN, NodeType.fromValue("teleporter"));
        assertEquals(NodeType.UNKNOWN, NodeType.fromValue(null));
        assertEquals(NodeType.UNKNOWN, NodeType.fromValue("unknown"));
    }

    @Test
    void ports_followRole() {
        assertEquals(List.of(), NodeType.START.defaultInputPorts());
        assertEquals(List.of(Ports.DEFAULT), NodeType.START.defaultOutputPorts());
        assertEquals(List.of(), NodeType.ENDPOINT.defaultOutputPorts());
        assertEquals(List.of(Ports.DEFAULT, Ports.FIRST), NodeType.PERSON_JOB.defaultInputPorts());
        assertEquals(List.of(Ports.DEFAULT), NodeType.CODE_JOB.defaultInputPorts());
        assertTrue(NodeType.API_JOB.defaultOutputPorts().contains(Ports.ERROR));
        assertEquals(List.of(Ports.CONDITION_TRUE, Ports.CONDITION_FALSE, Ports.ERROR),
                NodeType.CONDITION.defaultOutputPorts());
    }

    @Test
    void branching_onlyForCondition() {
        for (NodeType type : NodeType.values()) {
            assertEquals(type == NodeType.CONDITION, type.isBranching(), type.name());
        }
        assertEquals(Set.of(Ports.CONDITION_TRUE, Ports.CONDITION_FALSE), NodeType.CONDITION.exclusivePorts());
        assertTrue(NodeType.CODE_JOB.exclusivePorts().isEmpty());
    }

    @Test
    void outputCapability() {
        assertTrue(NodeType.START.isOutputCapable());
        assertTrue(NodeType.CONDITION.isOutputCapable());
        assertFalse(NodeType.ENDPOINT.isOutputCapable());
        assertFalse(NodeType.UNKNOWN.isOutputCapable());
    }
}
