package io.ehsdesk.runtime;

import io.ehsdesk.config.DeskSettings;
import io.ehsdesk.config.EhsDeskConfig;
import io.ehsdesk.error.AuthorizationException;
import io.ehsdesk.error.EhsDeskException;
import io.ehsdesk.identity.IdentityService;
import io.ehsdesk.model.Actor;
import io.ehsdesk.model.Role;
import io.ehsdesk.observability.AuditLogger;
import io.ehsdesk.reporting.MediaTransfer;
import io.ehsdesk.reporting.ReportingExecutor;
import io.ehsdesk.reporting.StreamingMediaTransfer;
import io.ehsdesk.rules.RuleFeedbackLedger;
import io.ehsdesk.storage.Database;
import io.ehsdesk.storage.ReportStore;
import io.ehsdesk.storage.RuleStore;
import io.ehsdesk.storage.TaskStore;
import io.ehsdesk.storage.UserStore;
import io.ehsdesk.tasks.TaskLifecycle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Wires the desk components for one data root and hands out role-scoped views.
 *
 * <p>Call {@link #init()} once before use and {@link #close()} when done; closing waits for
 * in-flight report transfers up to the configured shutdown grace.
 */
public final class EhsDeskRuntime implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(EhsDeskRuntime.class);

    private final EhsDeskConfig config;
    private final DeskSettings settings;
    private final Database database;
    private final TaskLifecycle lifecycle;
    private final RuleFeedbackLedger ledger;
    private final IdentityService identity;
    private final AuditLogger auditLogger;
    private final ReportingExecutor reportingExecutor;
    private final AtomicBoolean initialized;

    public EhsDeskRuntime(EhsDeskConfig config) {
        this(config, DeskSettings.load(config.settingsFile()));
    }

    public EhsDeskRuntime(EhsDeskConfig config, DeskSettings settings) {
        this(config, settings,
                new StreamingMediaTransfer(settings.transferChunkBytes(), settings.transferLatencyMs()),
                Clock.systemDefaultZone());
    }

    public EhsDeskRuntime(EhsDeskConfig config, DeskSettings settings, MediaTransfer mediaTransfer, Clock clock) {
        this.config = config;
        this.settings = settings;
        this.database = new Database(config);
        UserStore userStore = new UserStore(database);
        ReportStore reportStore = new ReportStore(database);
        this.lifecycle = new TaskLifecycle(new TaskStore(database), userStore, database.writeLock(), settings, clock);
        this.ledger = new RuleFeedbackLedger(new RuleStore(database), clock);
        this.identity = new IdentityService(userStore, database.writeLock());
        this.auditLogger = new AuditLogger(config.auditFile());
        this.reportingExecutor = new ReportingExecutor(
                lifecycle,
                reportStore,
                database.writeLock(),
                mediaTransfer,
                config,
                settings,
                auditLogger,
                clock
        );
        this.initialized = new AtomicBoolean(false);
    }

    public void init() {
        if (!initialized.compareAndSet(false, true)) {
            return;
        }
        database.init();
        int recovered = reportingExecutor.recoverInterrupted();
        log.info("EHS desk ready at {} (recovered {} interrupted report(s))", config.rootDir(), recovered);
    }

    public EhsDeskConfig config() {
        return config;
    }

    public DeskSettings settings() {
        return settings;
    }

    public AuditLogger auditLogger() {
        return auditLogger;
    }

    public Actor register(String username, String password, Role role) {
        Actor created = identity.register(username, password, role);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("user_id", created.id());
        details.put("role", created.role().dbValue());
        auditLogger.log(AuditLogger.AuditEvent.of("user.register", created.username(), "user/" + created.id(), "ok", details));
        return created;
    }

    public Optional<Actor> login(String username, String password) {
        Optional<Actor> actor = identity.login(username, password);
        if (actor.isEmpty()) {
            auditLogger.log(AuditLogger.AuditEvent.of("user.login", username == null ? "" : username.trim(),
                    "session", "rejected", Map.of()));
        }
        return actor;
    }

    public List<Actor> listWorkers() {
        return identity.listWorkers();
    }

    public ManagerDesk managerDesk(Actor actor) {
        requireRole(actor, Role.MANAGER);
        return new ManagerDesk(this, actor);
    }

    public WorkerDesk workerDesk(Actor actor) {
        requireRole(actor, Role.WORKER);
        return new WorkerDesk(this, actor);
    }

    public Desk desk(Actor actor) {
        return switch (actor.role()) {
            case MANAGER -> managerDesk(actor);
            case WORKER -> workerDesk(actor);
        };
    }

    public int inFlightReports() {
        return reportingExecutor.inFlightCount();
    }

    /**
     * Blocks until the report jobs this process started have finished. The wait is bounded by one
     * transfer timeout per round of queued jobs, plus the shutdown grace.
     */
    public boolean awaitPendingReports() {
        int inFlight = inFlightReports();
        if (inFlight == 0) {
            return true;
        }
        long rounds = (inFlight + settings.reportWorkers() - 1L) / settings.reportWorkers();
        Duration limit = Duration.ofMillis(rounds * settings.transferTimeoutMs() + settings.shutdownGraceMs());
        log.info("Waiting up to {} ms for {} report transfer(s)", limit.toMillis(), inFlight);
        return reportingExecutor.awaitIdle(limit);
    }

    @Override
    public void close() {
        reportingExecutor.close();
    }

    TaskLifecycle lifecycle() {
        return lifecycle;
    }

    RuleFeedbackLedger ledger() {
        return ledger;
    }

    ReportingExecutor reportingExecutor() {
        return reportingExecutor;
    }

    /** Runs {@code operation} and writes one audit row for its result, rejected or not. */
    <T> T audited(Actor actor, String action, String resource, Map<String, Object> details, Supplier<T> operation) {
        T result = auditRejection(actor, action, resource, details, operation);
        auditLogger.log(AuditLogger.AuditEvent.of(action, actorLabel(actor), resource, "ok", details));
        return result;
    }

    void auditedRun(Actor actor, String action, String resource, Map<String, Object> details, Runnable operation) {
        audited(actor, action, resource, details, () -> {
            operation.run();
            return null;
        });
    }

    /** Audits only a rejection; the operation records its own success rows. */
    <T> T auditRejection(Actor actor, String action, String resource, Map<String, Object> details,
                         Supplier<T> operation) {
        try {
            return operation.get();
        } catch (EhsDeskException e) {
            Map<String, Object> rejected = new LinkedHashMap<>(details);
            rejected.put("error_code", e.code());
            rejected.put("error", e.getMessage());
            auditLogger.log(AuditLogger.AuditEvent.of(action, actorLabel(actor), resource, "rejected", rejected));
            throw e;
        }
    }

    static String actorLabel(Actor actor) {
        return actor.role().dbValue() + ":" + actor.id();
    }

    private static void requireRole(Actor actor, Role role) {
        if (actor == null || actor.role() != role) {
            throw new AuthorizationException("Operation requires the " + role.dbValue() + " role");
        }
    }
}
