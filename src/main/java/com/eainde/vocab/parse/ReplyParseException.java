package com.eainde.vocab.parse;

import com.eainde.vocab.error.VocabularyException;

/**
 * Thrown when no structured item list can be recovered from a generator reply.
 */
public class ReplyParseException extends VocabularyException {

    private final String reply;

    public ReplyParseException(String message, String reply) {
        super(message);
        this.reply = reply != null ? reply : "";
    }

    public ReplyParseException(String message, String reply, Throwable cause) {
        super(message, cause);
        this.reply = reply != null ? reply : "";
    }

    /** The raw reply that could not be parsed. */
    public String reply() {
        return reply;
    }
}
