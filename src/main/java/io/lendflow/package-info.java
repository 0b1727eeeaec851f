/**
 * LendFlow source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.lendflow.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.lendflow.cli.LendFlowCommand} maps commands to runtime APIs.</li>
 *   <li>{@code io.lendflow.runtime.LendFlowRuntime} wires storage, audit, state machine and recovery.</li>
 *   <li>{@code io.lendflow.workflow.CollaborationManager} drives sessions through collaboration patterns.</li>
 * </ul>
 */
package io.lendflow;
