/**
 * KartLink collector source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.kartlink.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.kartlink.runtime.CollectorRuntime} wires store, bus ingest, uplink and time sync.</li>
 *   <li>{@code io.kartlink.storage.TelemetryStore} is the durable record log.</li>
 *   <li>{@code io.kartlink.uplink.UplinkManager} delivers records to the remote collector.</li>
 *   <li>{@code io.kartlink.timesync.PingBroadcaster} keeps bus node clocks aligned.</li>
 * </ul>
 */
package io.kartlink;
