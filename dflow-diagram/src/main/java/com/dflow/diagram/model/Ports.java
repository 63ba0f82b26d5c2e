package com.dflow.diagram.model;

/**
 * Conventional port names shared by the compiler, the token runtime and handlers.
 */
public final class Ports {

    /** Port used when a connection does not name one. */
    public static final String DEFAULT = "default";
    /** CONDITION output fired when the condition holds. */
    public static final String CONDITION_TRUE = "condtrue";
    /** CONDITION output fired when the condition does not hold. */
    public static final String CONDITION_FALSE = "condfalse";
    /** Output that carries a failure envelope when a handler fails. */
    public static final String ERROR = "error";
    /** Input consumed only on a node's first execution. */
    public static final String FIRST = "first";

    private Ports() {
    }

    public static String orDefault(String port) {
        return port != null && !port.isBlank() ? port.trim() : DEFAULT;
    }
}
