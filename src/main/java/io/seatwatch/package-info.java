/**
 * SeatWatch source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.seatwatch.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.seatwatch.SeatWatchApp} wires storage, keys, audit and the registry.</li>
 *   <li>{@code io.seatwatch.runtime.JobRegistry} owns job lifecycle and the running set.</li>
 *   <li>{@code io.seatwatch.runtime.JobRuntime} is the per-job poll / verify / act loop.</li>
 *   <li>{@code io.seatwatch.storage.JobStore} is the persistence layer.</li>
 * </ul>
 */
package io.seatwatch;
