package com.superteacher.actors;

import akka.actor.typed.Behavior;
import akka.actor.typed.javadsl.AbstractBehavior;
import akka.actor.typed.javadsl.ActorContext;
import akka.actor.typed.javadsl.Behaviors;
import akka.actor.typed.javadsl.Receive;
import com.superteacher.engine.ConversationEngine;
import com.superteacher.engine.TurnResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serialises the turns of one user. Each message runs a full engine turn
 * before the next one is taken from the mailbox, so vision and grading calls
 * block this actor only.
 */
public class ChatSessionActor extends AbstractBehavior<ChatMessages.Message> {
    private static final Logger logger = LoggerFactory.getLogger(ChatSessionActor.class);

    private final String userId;
    private final ConversationEngine engine;

    private ChatSessionActor(ActorContext<ChatMessages.Message> context, String userId, ConversationEngine engine) {
        super(context);
        this.userId = userId;
        this.engine = engine;
        logger.info("Chat session started for user {}", userId);
    }

    public static Behavior<ChatMessages.Message> create(String userId, ConversationEngine engine) {
        return Behaviors.setup(context -> new ChatSessionActor(context, userId, engine));
    }

    @Override
    public Receive<ChatMessages.Message> createReceive() {
        return newReceiveBuilder()
                .onMessage(ChatMessages.HandleText.class, this::onHandleText)
                .onMessage(ChatMessages.HandleImage.class, this::onHandleImage)
                .build();
    }

    private Behavior<ChatMessages.Message> onHandleText(ChatMessages.HandleText msg) {
        TurnResult result = engine.processText(userId, msg.getText());
        msg.getReplyTo().tell(new ChatMessages.ChatReply(userId, result.reply(), result.step()));
        return this;
    }

    private Behavior<ChatMessages.Message> onHandleImage(ChatMessages.HandleImage msg) {
        TurnResult result = engine.processImage(userId, msg.getImage());
        msg.getReplyTo().tell(new ChatMessages.ChatReply(userId, result.reply(), result.step()));
        return this;
    }
}
