/**
 * Shard-local target state for a metrics scraping sidecar.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.kvasssidecar.KvassSidecarApplication} wires the process.</li>
 *   <li>{@code io.kvasssidecar.targets.TargetsManager} owns the target set, its status and idle time.</li>
 *   <li>{@code io.kvasssidecar.store.TargetsStore} reads and writes the snapshot file.</li>
 * </ul>
 */
package io.kvasssidecar;
