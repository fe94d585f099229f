/**
 * AgentRelay source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.agentrelay.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.agentrelay.client.TaskService} is what submitting code talks to.</li>
 *   <li>{@code io.agentrelay.worker.WorkerDispatcher} turns each received task into one terminal result.</li>
 *   <li>{@code io.agentrelay.broker.PubSubTaskBroker} maps both sides onto the transport topics and the result store.</li>
 * </ul>
 */
package io.agentrelay;
