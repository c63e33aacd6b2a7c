package com.superteacher.actors;

import akka.actor.typed.ActorRef;
import com.superteacher.models.ConversationStep;
import com.superteacher.models.ImageSource;

/**
 * Message types exchanged with the chat gateway and the per-user session actors
 */
public class ChatMessages {

    // Marker interface for every message a chat actor accepts
    public interface Message {
    }

    public static class HandleText implements Message {
        private final String userId;
        private final String text;
        private final ActorRef<ChatReply> replyTo;

        public HandleText(String userId, String text, ActorRef<ChatReply> replyTo) {
            this.userId = userId;
            this.text = text;
            this.replyTo = replyTo;
        }

        public String getUserId() { return userId; }
        public String getText() { return text; }
        public ActorRef<ChatReply> getReplyTo() { return replyTo; }
    }

    public static class HandleImage implements Message {
        private final String userId;
        private final ImageSource image;
        private final ActorRef<ChatReply> replyTo;

        public HandleImage(String userId, ImageSource image, ActorRef<ChatReply> replyTo) {
            this.userId = userId;
            this.image = image;
            this.replyTo = replyTo;
        }

        public String getUserId() { return userId; }
        public ImageSource getImage() { return image; }
        public ActorRef<ChatReply> getReplyTo() { return replyTo; }
    }

    public static class ChatReply {
        private final String userId;
        private final String message;
        private final ConversationStep step;

        public ChatReply(String userId, String message, ConversationStep step) {
            this.userId = userId;
            this.message = message;
            this.step = step;
        }

        public String getUserId() { return userId; }
        public String getMessage() { return message; }
        public ConversationStep getStep() { return step; }
    }
}
