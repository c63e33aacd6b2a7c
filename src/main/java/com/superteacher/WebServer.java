package com.superteacher;

import akka.actor.typed.ActorRef;
import akka.actor.typed.ActorSystem;
import akka.actor.typed.javadsl.AskPattern;
import akka.http.javadsl.Http;
import akka.http.javadsl.ServerBinding;
import akka.http.javadsl.marshallers.jackson.Jackson;
import akka.http.javadsl.model.ContentTypes;
import akka.http.javadsl.model.HttpResponse;
import akka.http.javadsl.model.StatusCodes;
import akka.http.javadsl.server.AllDirectives;
import akka.http.javadsl.server.PathMatchers;
import akka.http.javadsl.server.Route;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.superteacher.actors.ChatMessages;
import com.superteacher.models.ImageSource;
import com.superteacher.session.SessionStore;
import com.superteacher.utils.CsvUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.Base64;
import java.util.UUID;
import java.util.concurrent.CompletionStage;

/**
 * HTTP adapter in front of the chat gateway.
 *
 * <ul>
 *   <li>{@code POST /chat} with {@code {"userId", "message"}} or {@code {"userId", "imageUrl"}}
 *       (or {@code imageBase64} plus {@code fileName}) runs one turn and returns the reply.</li>
 *   <li>{@code GET /chat/{userId}/history.csv} exports the user's grading history.</li>
 * </ul>
 */
public class WebServer extends AllDirectives {
    private static final Logger logger = LoggerFactory.getLogger(WebServer.class);

    private final ActorSystem<?> system;
    private final ActorRef<ChatMessages.Message> gateway;
    private final SessionStore store;
    private final Duration askTimeout;
    private final ObjectMapper objectMapper;

    public WebServer(ActorSystem<?> system, ActorRef<ChatMessages.Message> gateway, SessionStore store,
                     Duration askTimeout) {
        this.system = system;
        this.gateway = gateway;
        this.store = store;
        this.askTimeout = askTimeout;
        this.objectMapper = new ObjectMapper();
    }

    public CompletionStage<ServerBinding> start(String host, int port) {
        return Http.get(system)
                .newServerAt(host, port)
                .bind(createRoute())
                .thenApply(binding -> {
                    logger.info("Chat endpoint online at http://{}:{}/chat", host, port);
                    return binding;
                });
    }

    Route createRoute() {
        return pathPrefix("chat", () -> concat(
                pathEndOrSingleSlash(() ->
                        post(() ->
                                entity(Jackson.unmarshaller(objectMapper, ChatRequest.class), this::onChat))),
                path(PathMatchers.segment().slash("history.csv"), userId ->
                        get(() -> onHistory(userId)))
        ));
    }

    private Route onChat(ChatRequest request) {
        String userId = request.userId == null || request.userId.isBlank()
                ? UUID.randomUUID().toString()
                : request.userId.trim();

        ChatMessages.Message turn;
        try {
            turn = toTurn(userId, request);
        } catch (IllegalArgumentException e) {
            return complete(StatusCodes.BAD_REQUEST, new ErrorResponse(e.getMessage()), Jackson.marshaller(objectMapper));
        }
        final ChatMessages.Message message = turn;

        CompletionStage<ChatMessages.ChatReply> reply = AskPattern.ask(
                gateway,
                replyTo -> withReplyTo(message, replyTo),
                askTimeout,
                system.scheduler());

        return onComplete(reply, tryReply -> {
            if (tryReply.isSuccess()) {
                ChatMessages.ChatReply chatReply = tryReply.get();
                ChatResponse body = new ChatResponse(chatReply.getUserId(), chatReply.getMessage(),
                        chatReply.getStep() == null ? null : chatReply.getStep().name());
                return complete(StatusCodes.OK, body, Jackson.marshaller(objectMapper));
            }
            Throwable failure = tryReply.failed().get();
            logger.error("Chat turn for user {} did not complete", userId, failure);
            return complete(StatusCodes.SERVICE_UNAVAILABLE,
                    new ErrorResponse("The grading assistant is busy, please try again."),
                    Jackson.marshaller(objectMapper));
        });
    }

    private Route onHistory(String userId) {
        if (!store.contains(userId)) {
            return complete(StatusCodes.NOT_FOUND, new ErrorResponse("Unknown user " + userId),
                    Jackson.marshaller(objectMapper));
        }
        try {
            String csv = CsvUtils.gradingHistoryToCsv(userId, store.get(userId).getGradingHistory());
            return complete(HttpResponse.create()
                    .withStatus(StatusCodes.OK)
                    .withEntity(ContentTypes.TEXT_CSV_UTF8, csv));
        } catch (IOException e) {
            logger.error("Could not export grading history for {}", userId, e);
            return complete(StatusCodes.INTERNAL_SERVER_ERROR, new ErrorResponse("History export failed"),
                    Jackson.marshaller(objectMapper));
        }
    }

    /**
     * Builds the turn message without its reply address.
     */
    static ChatMessages.Message toTurn(String userId, ChatRequest request) {
        boolean hasText = request.message != null && !request.message.isBlank();
        boolean hasUrl = request.imageUrl != null && !request.imageUrl.isBlank();
        boolean hasBytes = request.imageBase64 != null && !request.imageBase64.isBlank();
        if (hasUrl || hasBytes) {
            ImageSource image = hasBytes
                    ? ImageSource.ofBytes(request.fileName, Base64.getDecoder().decode(request.imageBase64.trim()))
                    : ImageSource.ofUri(request.imageUrl);
            return new ChatMessages.HandleImage(userId, image, null);
        }
        if (hasText) {
            return new ChatMessages.HandleText(userId, request.message, null);
        }
        throw new IllegalArgumentException("A chat request needs a message, an imageUrl or imageBase64");
    }

    private static ChatMessages.Message withReplyTo(ChatMessages.Message message,
                                                    ActorRef<ChatMessages.ChatReply> replyTo) {
        if (message instanceof ChatMessages.HandleImage) {
            ChatMessages.HandleImage image = (ChatMessages.HandleImage) message;
            return new ChatMessages.HandleImage(image.getUserId(), image.getImage(), replyTo);
        }
        ChatMessages.HandleText text = (ChatMessages.HandleText) message;
        return new ChatMessages.HandleText(text.getUserId(), text.getText(), replyTo);
    }

    public static class ChatRequest {
        public String userId;
        public String message;
        public String imageUrl;
        public String imageBase64;
        public String fileName;

        public ChatRequest() {}
    }

    public static class ChatResponse {
        public String userId;
        public String message;
        public String step;

        public ChatResponse(String userId, String message, String step) {
            this.userId = userId;
            this.message = message;
            this.step = step;
        }

        public ChatResponse() {}
    }

    public static class ErrorResponse {
        public String error;

        public ErrorResponse(String error) {
            this.error = error;
        }

        public ErrorResponse() {}
    }
}
