/**
 * EHS desk source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.ehsdesk.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.ehsdesk.cli.EhsDeskCommand} maps commands to desk operations.</li>
 *   <li>{@code io.ehsdesk.runtime.EhsDeskRuntime} wires components and hands out role views.</li>
 *   <li>{@code io.ehsdesk.reporting.ReportingExecutor} runs report transfers off the caller thread.</li>
 *   <li>{@code io.ehsdesk.storage.Database} owns the SQLite schema and the store write lock.</li>
 * </ul>
 */
package io.ehsdesk;
