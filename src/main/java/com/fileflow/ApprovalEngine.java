package com.fileflow;

import com.fileflow.adapter.out.audit.Slf4jAuditSink;
import com.fileflow.adapter.out.directory.JsonTeamDirectory;
import com.fileflow.adapter.out.file.LocalFileInspector;
import com.fileflow.adapter.out.persistence.DocumentCodec;
import com.fileflow.adapter.out.persistence.JsonDocumentStore;
import com.fileflow.adapter.out.persistence.JsonFileApprovalRecordStore;
import com.fileflow.adapter.out.persistence.JsonFileNotificationRepository;
import com.fileflow.adapter.out.persistence.JsonFileUserOverlayRepository;
import com.fileflow.application.port.in.NotificationCenter;
import com.fileflow.application.port.in.ReviewerGateway;
import com.fileflow.application.port.in.UserSubmissionGateway;
import com.fileflow.application.port.out.ApprovalRecordStore;
import com.fileflow.application.port.out.AuditSink;
import com.fileflow.application.port.out.FileInspector;
import com.fileflow.application.port.out.TeamDirectory;
import com.fileflow.application.port.out.UserOverlayRepository;
import com.fileflow.application.service.BackgroundTaskQueue;
import com.fileflow.application.service.NotificationCenterImpl;
import com.fileflow.application.service.ReviewerGatewayImpl;
import com.fileflow.application.service.UserSubmissionGatewayImpl;
import com.fileflow.domain.workflow.ApprovalStateMachine;
import com.fileflow.infrastructure.config.ApprovalEngineConfig;
import com.fileflow.infrastructure.config.ConfigLoader;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;

/**
 * Composition root: wires the JSON-file adapters into the workflow services.
 * One instance per process, shared by every gateway it hands out.
 */
@Slf4j
public class ApprovalEngine {

    private final ApprovalEngineConfig config;
    private final JsonDocumentStore documents;
    private final ApprovalRecordStore store;
    private final UserOverlayRepository overlays;
    private final FileInspector files;
    private final TeamDirectory teams;
    private final AuditSink audit;
    private final ApprovalStateMachine stateMachine;
    private final BackgroundTaskQueue tasks;
    private final NotificationCenter notifications;
    private final ReviewerGateway reviewers;
    private final Clock clock;

    private ApprovalEngine(Vertx vertx, ApprovalEngineConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;

        // Output ports (adapters)
        this.documents = new JsonDocumentStore(vertx, new DocumentCodec(), config.getLockTimeoutMs());
        this.store = new JsonFileApprovalRecordStore(documents, config.getDataDir());
        this.overlays = new JsonFileUserOverlayRepository(documents, config.getUsersDir());
        this.files = new LocalFileInspector(vertx, config.getUsersDir());
        this.teams = new JsonTeamDirectory(vertx, config.getTeamDirectoryFile(), config.getDefaultTeam());
        this.audit = new Slf4jAuditSink();

        // Application services (use cases)
        this.stateMachine = new ApprovalStateMachine(clock);
        this.tasks = new BackgroundTaskQueue(vertx, config.getTaskMaxAttempts(), config.getTaskRetryDelayMs());
        this.notifications = new NotificationCenterImpl(
                new JsonFileNotificationRepository(documents, config.getUsersDir()),
                config.getMaxNotifications(),
                clock);
        this.reviewers = new ReviewerGatewayImpl(store, overlays, notifications, stateMachine, tasks, audit, clock);
    }

    /**
     * Start with application.yml from the classpath
     */
    public static Future<ApprovalEngine> start(Vertx vertx) {
        try {
            return start(vertx, ConfigLoader.load());
        } catch (RuntimeException e) {
            return Future.failedFuture(e);
        }
    }

    public static Future<ApprovalEngine> start(Vertx vertx, ApprovalEngineConfig config) {
        return start(vertx, config, Clock.systemDefaultZone());
    }

    public static Future<ApprovalEngine> start(Vertx vertx, ApprovalEngineConfig config, Clock clock) {
        log.info("Starting approval engine (data: {}, users: {})", config.getDataDir(), config.getUsersDir());
        try {
            config.validate();
        } catch (IllegalArgumentException e) {
            return Future.failedFuture(e);
        }

        ApprovalEngine engine = new ApprovalEngine(vertx, config, clock);
        return engine.store.initialize()
                .map(engine)
                .onSuccess(v -> log.info("Approval engine ready"))
                .onFailure(error -> log.error("Failed to start approval engine", error));
    }

    /**
     * Submission gateway bound to one user
     */
    public UserSubmissionGateway forUser(String userId) {
        return new UserSubmissionGatewayImpl(userId, store, overlays, files, teams, documents,
                stateMachine, tasks, audit, clock);
    }

    public ReviewerGateway reviewers() {
        return reviewers;
    }

    public NotificationCenter notifications() {
        return notifications;
    }

    public ApprovalRecordStore store() {
        return store;
    }

    public BackgroundTaskQueue tasks() {
        return tasks;
    }

    public ApprovalEngineConfig config() {
        return config;
    }

    /**
     * Waits for outstanding background tasks; the Vertx instance stays open
     */
    public Future<Void> close() {
        return tasks.drain()
                .onComplete(ar -> log.info("Approval engine stopped"));
    }
}
