/**
 * RelayShell source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.relayshell.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.relayshell.runtime.RelayShellRuntime} wires sessions, dispatch and monitoring.</li>
 *   <li>{@code io.relayshell.session.Session} owns one authenticated connection and its healing.</li>
 *   <li>{@code io.relayshell.agent.RemoteAgentServer} is the far end of the protocol.</li>
 * </ul>
 */
package io.relayshell;
