/**
 * Runtime wiring package.
 *
 * <p>{@link io.relayshell.runtime.RelayShellRuntime} assembles transport, authentication,
 * sessions, dispatch, restart handling and monitoring, and is what the CLI talks to.
 */
package io.relayshell.runtime;
