package com.superteacher.actors;

import akka.actor.typed.ActorRef;
import akka.actor.typed.Behavior;
import akka.actor.typed.DispatcherSelector;
import akka.actor.typed.javadsl.AbstractBehavior;
import akka.actor.typed.javadsl.ActorContext;
import akka.actor.typed.javadsl.Behaviors;
import akka.actor.typed.javadsl.Receive;
import com.superteacher.engine.ConversationEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

/**
 * Entry point for chat traffic. Routes every message to the session actor of
 * its user, spawning one on first contact.
 */
public class ChatGatewayActor extends AbstractBehavior<ChatMessages.Message> {
    private static final Logger logger = LoggerFactory.getLogger(ChatGatewayActor.class);

    private final ConversationEngine engine;
    private final Map<String, ActorRef<ChatMessages.Message>> sessions = new HashMap<>();

    private ChatGatewayActor(ActorContext<ChatMessages.Message> context, ConversationEngine engine) {
        super(context);
        this.engine = engine;
        logger.info("Chat gateway ready for the {} workflow", engine.getWorkflow().getKind());
    }

    public static Behavior<ChatMessages.Message> create(ConversationEngine engine) {
        return Behaviors.setup(context -> new ChatGatewayActor(context, engine));
    }

    @Override
    public Receive<ChatMessages.Message> createReceive() {
        return newReceiveBuilder()
                .onMessage(ChatMessages.HandleText.class, msg -> forward(msg.getUserId(), msg))
                .onMessage(ChatMessages.HandleImage.class, msg -> forward(msg.getUserId(), msg))
                .build();
    }

    private Behavior<ChatMessages.Message> forward(String userId, ChatMessages.Message msg) {
        sessionFor(userId).tell(msg);
        return this;
    }

    private ActorRef<ChatMessages.Message> sessionFor(String userId) {
        return sessions.computeIfAbsent(userId, id -> {
            logger.debug("Spawning session actor for user {}", id);
            // Turns call remote services synchronously
            return getContext().spawn(
                    ChatSessionActor.create(id, engine),
                    "session-" + URLEncoder.encode(id, StandardCharsets.UTF_8),
                    DispatcherSelector.blocking());
        });
    }

}
