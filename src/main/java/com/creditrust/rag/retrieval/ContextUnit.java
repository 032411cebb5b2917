package com.creditrust.rag.retrieval;

import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingType;

/**
 * Unit in which the context budget is measured.
 */
public enum ContextUnit {

    CHARACTERS {
        @Override
        public int measure(String text) {
            return text.length();
        }
    },

    /**
     * {@code cl100k_base} tokens, the encoding of the OpenAI chat and
     * embedding models.
     */
    TOKENS {
        @Override
        public int measure(String text) {
            return TokenizerHolder.ENCODING.countTokens(text);
        }
    };

    public abstract int measure(String text);

    private static final class TokenizerHolder {

        private static final Encoding ENCODING = Encodings.newDefaultEncodingRegistry()
                .getEncoding(EncodingType.CL100K_BASE);
    }
}
