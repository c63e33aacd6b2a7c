package com.superteacher;

import akka.actor.typed.ActorRef;
import akka.actor.typed.ActorSystem;
import com.superteacher.actors.ChatGatewayActor;
import com.superteacher.actors.ChatMessages;
import com.superteacher.engine.ConversationEngine;
import com.superteacher.engine.FollowUpResponder;
import com.superteacher.engine.StepCollaborators;
import com.superteacher.engine.WorkflowDescriptor;
import com.superteacher.engine.Workflows;
import com.superteacher.extraction.MarkExtractor;
import com.superteacher.grading.GradingCollaborator;
import com.superteacher.grading.GradingOrchestrator;
import com.superteacher.grading.GradingResponseFormatter;
import com.superteacher.grading.GradingResponseParser;
import com.superteacher.grading.OfflineGradingCollaborator;
import com.superteacher.grading.RetryPolicy;
import com.superteacher.intent.IntentClassifier;
import com.superteacher.session.InMemorySessionStore;
import com.superteacher.session.SessionStore;
import com.superteacher.utils.ConfigurationException;
import com.superteacher.utils.DemoVisionClient;
import com.superteacher.utils.GraderSettings;
import com.superteacher.utils.ImageTextExtractor;
import com.superteacher.utils.LocalObjectStorage;
import com.superteacher.utils.OpenAIClient;
import com.superteacher.utils.OpenAIGradingClient;
import com.superteacher.utils.OpenAIVisionClient;
import com.superteacher.utils.RemoteOcrClient;
import com.superteacher.utils.VisionClient;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;

/**
 * Starts the grading assistant: reads the configuration, wires the engine
 * and its collaborators, and serves the chat endpoint.
 */
public class GraderMain {
    private static final Logger logger = LoggerFactory.getLogger(GraderMain.class);

    static final Duration ASK_TIMEOUT = Duration.ofSeconds(170);

    public static void main(String[] args) {
        Config config = ConfigFactory.load();
        GraderSettings settings;
        try {
            settings = GraderSettings.load(config);
        } catch (ConfigurationException e) {
            logger.error("Cannot start: {}", e.getMessage());
            System.exit(1);
            return;
        }

        SessionStore store = new InMemorySessionStore(settings.getWorkflow());
        ConversationEngine engine = createEngine(settings, store, Clock.systemUTC());

        ActorSystem<ChatMessages.Message> system = ActorSystem.create(
                ChatGatewayActor.create(engine), "SuperTeacher", config);
        ActorRef<ChatMessages.Message> gateway = system;

        WebServer server = new WebServer(system, gateway, store, ASK_TIMEOUT);
        server.start(settings.getHttpHost(), settings.getHttpPort())
                .exceptionally(failure -> {
                    logger.error("Failed to bind {}:{}", settings.getHttpHost(), settings.getHttpPort(), failure);
                    system.terminate();
                    return null;
                });

        try {
            system.getWhenTerminated().toCompletableFuture().join();
        } catch (RuntimeException e) {
            logger.error("Actor system stopped abnormally", e);
        }
    }

    /**
     * Wires the engine for the configured workflow. Without an API key grading
     * resolves through the local fallback grader.
     */
    static ConversationEngine createEngine(GraderSettings settings, SessionStore store, Clock clock) {
        GradingCollaborator primary;
        GradingCollaborator backup = null;
        RetryPolicy gradingRetry = settings.getRetryPolicy();
        VisionClient vision;

        if (settings.hasApiKey()) {
            String apiKey = settings.getApiKey().get();
            OpenAIClient grading = new OpenAIClient(apiKey, settings.getOpenAiBaseUrl(),
                    settings.getGradingModel(), settings.getOpenAiTimeout());
            primary = new OpenAIGradingClient(grading, "openai");
            if (settings.getBackupBaseUrl().isPresent()) {
                OpenAIClient backupClient = new OpenAIClient(apiKey, settings.getBackupBaseUrl().get(),
                        settings.getBackupModel(), settings.getOpenAiTimeout());
                backup = new OpenAIGradingClient(backupClient, "backup");
            }
        } else {
            logger.warn("No OpenAI API key configured, grading will use the local fallback grader");
            primary = new OfflineGradingCollaborator();
            // offline grading always fails, go straight to the fallback
            gradingRetry = new RetryPolicy(1, Duration.ZERO, Duration.ZERO);
        }

        if (settings.getVisionMode() == GraderSettings.VisionMode.OPENAI) {
            vision = new OpenAIVisionClient(new OpenAIClient(settings.getApiKey().get(),
                    settings.getOpenAiBaseUrl(), settings.getVisionModel(), settings.getOpenAiTimeout()));
        } else {
            vision = new DemoVisionClient();
        }
        VisionClient ocr = settings.getOcrEndpoint()
                .map(endpoint -> (VisionClient) new RemoteOcrClient(endpoint, settings.getOpenAiTimeout()))
                .orElse(null);

        StepCollaborators collaborators = new StepCollaborators(
                new MarkExtractor(),
                new GradingOrchestrator(primary, backup, gradingRetry, new GradingResponseParser(), clock),
                new ImageTextExtractor(vision, ocr, new LocalObjectStorage(settings.getStorageDirectory()),
                        settings.getRetryPolicy()),
                new GradingResponseFormatter(),
                new FollowUpResponder());
        WorkflowDescriptor workflow = Workflows.forKind(settings.getWorkflow(), collaborators);

        logger.info("Workflow {} ready: grading via {}{}, vision {}", settings.getWorkflow(), primary.name(),
                backup == null ? "" : " with backup " + backup.name(), settings.getVisionMode());
        return new ConversationEngine(store, workflow, new IntentClassifier(), clock);
    }
}
