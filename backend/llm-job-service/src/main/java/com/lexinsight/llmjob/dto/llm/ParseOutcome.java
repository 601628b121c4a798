package com.lexinsight.llmjob.dto.llm;

/**
 * Result of extracting structured output from a completed provider response.
 */
public record ParseOutcome(Kind kind, String outputText, FlaggingResponse response) {

    public enum Kind {
        /**
         * Completed, but no output content is queryable yet; poll again later
         */
        NOT_READY,

        /**
         * Output found but it is not valid structured JSON; terminal for the item
         */
        INVALID,

        /**
         * Output parsed into a flagging response
         */
        PARSED
    }

    public static ParseOutcome notReady() {
        return new ParseOutcome(Kind.NOT_READY, null, null);
    }

    public static ParseOutcome invalid(String outputText) {
        return new ParseOutcome(Kind.INVALID, outputText, null);
    }

    public static ParseOutcome parsed(String outputText, FlaggingResponse response) {
        return new ParseOutcome(Kind.PARSED, outputText, response);
    }
}
