/**
 * PlayEngine source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.playengine.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.playengine.cli.PlayEngineCommand} maps commands to runtime APIs.</li>
 *   <li>{@code io.playengine.runtime.EngineRuntime} wires the collaborators and dispatches runs.</li>
 *   <li>{@code io.playengine.credential.CredentialInjector} turns credentials into env, files and prompts.</li>
 * </ul>
 */
package io.playengine;
