package com.creditrust.rag.chat;

import java.util.List;

import com.creditrust.rag.index.RetrievalResult;
import com.creditrust.rag.index.ScoredChunk;
import com.creditrust.rag.ingest.Chunk;
import com.creditrust.rag.ingest.SourceMetadata;

/**
 * Renders the retrieved complaint excerpts into the analyst prompt. The output
 * depends on nothing but the arguments.
 */
public class PromptAssembler {

    static final String INSTRUCTION = """
            You are a financial analyst assistant for CrediTrust. Your task is to answer questions about \
            customer complaints. Use ONLY the following retrieved complaint excerpts to formulate your answer \
            and do not rely on any other knowledge. Refer to the complaints you use by their number. If the \
            context doesn't contain the answer, state that you don't have enough information.""";

    static final String NO_CONTEXT = "(no complaint excerpts were retrieved)";

    public Prompt assemble(String question, RetrievalResult result) {
        List<ScoredChunk> sources = result.chunks();
        if (sources.isEmpty()) {
            return new Prompt(INSTRUCTION, NO_CONTEXT, question.strip(), sources);
        }
        StringBuilder context = new StringBuilder();
        for (int i = 0; i < sources.size(); i++) {
            if (i > 0) {
                context.append("\n\n");
            }
            appendSource(context, i + 1, sources.get(i).chunk());
        }
        return new Prompt(INSTRUCTION, context.toString(), question.strip(), sources);
    }

    private static void appendSource(StringBuilder out, int number, Chunk chunk) {
        SourceMetadata source = chunk.source();
        out.append('[').append(number).append("] Complaint ").append(chunk.documentId());
        out.append(" | Product: ").append(orUnknown(source.product()));
        out.append(" | Company: ").append(orUnknown(source.company()));
        out.append(" | Submitted: ").append(source.submittedOn() == null ? "unknown" : source.submittedOn());
        out.append('\n').append(chunk.text().strip());
    }

    private static String orUnknown(String value) {
        return value == null || value.isBlank() ? "unknown" : value;
    }
}
