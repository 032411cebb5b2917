package com.creditrust.rag.chat;

/**
 * Abstraction over the language model integration. Implementations can either
 * invoke the real OpenAI API or return predictable responses for testing.
 */
public interface GenerationClient {

    /**
     * Start generating an answer for the prompt. The call returns once the
     * generation has been accepted; text increments are then pulled from the
     * returned stream.
     *
     * @param prompt the assembled prompt
     * @return a stream of answer increments
     */
    GenerationStream generate(Prompt prompt);
}
