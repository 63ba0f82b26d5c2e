/**
 * Contract between the engine and the outside world: the {@link com.dflow.protocol.Envelope} payload,
 * node handlers ({@code handler}) and execution events ({@code event}).
 */
package com.dflow.protocol;
