/**
 * Process wiring.
 *
 * <p>{@link io.agentrelay.runtime.AgentRelayRuntime} builds the transport, result store,
 * broker and agent registry from a runtime root and hands out worker dispatchers and task
 * services bound to them.
 */
package io.agentrelay.runtime;
