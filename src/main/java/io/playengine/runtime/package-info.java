/**
 * Run lifecycle package.
 *
 * <p>{@link io.playengine.runtime.BaseRunTask} owns the state machine shared by every run:
 * marking it running, early cancellation, private data and credentials, sandboxing, the
 * interactive process and the single terminal status. Subclasses only build the command line.
 */
package io.playengine.runtime;
