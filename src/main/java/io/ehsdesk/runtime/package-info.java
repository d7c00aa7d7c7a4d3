/**
 * Process wiring and role-scoped entry points.
 *
 * <p>{@link io.ehsdesk.runtime.EhsDeskRuntime} builds the store, task lifecycle, rule ledger and
 * reporting executor for a data root. Callers act through {@link io.ehsdesk.runtime.ManagerDesk}
 * or {@link io.ehsdesk.runtime.WorkerDesk}, obtained for an authenticated actor.
 */
package io.ehsdesk.runtime;
