/**
 * Runtime wiring package.
 *
 * <p>{@link io.lendflow.runtime.LendFlowRuntime} owns one data root: it builds every
 * component with explicit constructor injection and exposes the operational queries
 * used by the CLI.
 */
package io.lendflow.runtime;
