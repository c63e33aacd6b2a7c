package com.superteacher.engine;

import com.superteacher.models.ConversationStep;
import com.superteacher.models.UserIntent;

/**
 * Outcome of one engine turn.
 *
 * @param committed false when the session moved on concurrently and this
 *                  turn's state was discarded
 */
public record TurnResult(String reply, ConversationStep step, UserIntent intent, boolean committed) {
}
