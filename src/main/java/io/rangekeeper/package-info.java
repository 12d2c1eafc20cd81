/**
 * RangeKeeper source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.rangekeeper.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.rangekeeper.cli.RangeKeeperCommand} maps commands to runtime APIs.</li>
 *   <li>{@code io.rangekeeper.runtime.RangeKeeperRuntime} wires the components and turns failures into outcomes.</li>
 *   <li>{@code io.rangekeeper.lifecycle.InstanceLifecycleManager} owns every instance state transition.</li>
 *   <li>{@code io.rangekeeper.storage.InstanceStore} is the authoritative persistence layer.</li>
 * </ul>
 */
package io.rangekeeper;
