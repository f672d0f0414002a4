/**
 * Process lifecycle.
 *
 * <p>{@link io.kartlink.runtime.CollectorRuntime} owns the worker threads and
 * the {@link io.kartlink.runtime.StopSignal} that ends them, and exposes the
 * read surface used by the CLI.
 */
package io.kartlink.runtime;
