package com.creditrust.rag.ingest;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;

import com.creditrust.rag.error.ConfigurationException;

/**
 * Splits a document into overlapping chunks of at most {@code maxSize}
 * characters. Cuts are placed on the last paragraph break inside the window,
 * falling back to line breaks, sentence ends, whitespace and finally a hard
 * character cut. Consecutive chunks share at most {@code overlap} characters.
 * <p>
 * The returned sequence is lazy and restartable: every call to
 * {@link Iterable#iterator()} walks the document again from the start.
 */
public class Chunker {

    private final int maxSize;
    private final int overlap;
    private final int minSize;
    private final String version;

    public Chunker(int maxSize, int overlap, int minSize, String version) {
        validate(maxSize, overlap);
        if (minSize < 1) {
            throw new ConfigurationException("Minimum chunk size must be at least 1 but was " + minSize);
        }
        this.maxSize = maxSize;
        this.overlap = overlap;
        this.minSize = minSize;
        this.version = Objects.requireNonNull(version, "version");
    }

    public String version() {
        return version;
    }

    public Iterable<Chunk> chunk(Document document) {
        return chunk(document, maxSize, overlap);
    }

    public Iterable<Chunk> chunk(Document document, int maxSize, int overlap) {
        Objects.requireNonNull(document, "document");
        validate(maxSize, overlap);
        String text = document.text();
        if (text.isBlank() || text.strip().length() < minSize) {
            return List.of();
        }
        return () -> new ChunkIterator(document, maxSize, overlap);
    }

    private static void validate(int maxSize, int overlap) {
        if (overlap < 0) {
            throw new ConfigurationException("Chunk overlap must not be negative but was " + overlap);
        }
        if (maxSize <= overlap) {
            throw new ConfigurationException(
                    "Chunk size (" + maxSize + ") must be greater than chunk overlap (" + overlap + ")");
        }
    }

    private final class ChunkIterator implements Iterator<Chunk> {

        private final Document document;
        private final String text;
        private final int maxSize;
        private final int overlap;
        private int start;
        private int ordinal;
        private boolean done;

        ChunkIterator(Document document, int maxSize, int overlap) {
            this.document = document;
            this.text = document.text();
            this.maxSize = maxSize;
            this.overlap = overlap;
        }

        @Override
        public boolean hasNext() {
            return !done;
        }

        @Override
        public Chunk next() {
            if (done) {
                throw new NoSuchElementException();
            }
            int length = text.length();
            int end = length - start <= maxSize ? length : findCut(start + overlap, start + maxSize);
            Chunk chunk = new Chunk(document.id() + ":" + ordinal, document.id(), new TextSpan(start, end),
                    text.substring(start, end), document.source(), version);
            ordinal++;
            if (end >= length) {
                done = true;
            } else {
                start = nextStart(end);
            }
            return chunk;
        }

        /**
         * Returns the cut position in {@code (floor, windowEnd]}. Keeping the cut
         * above {@code floor} guarantees that the next chunk starts after the
         * current one.
         */
        private int findCut(int floor, int windowEnd) {
            int cut = lastCut(floor, windowEnd, Boundary.PARAGRAPH);
            if (cut < 0) {
                cut = lastCut(floor, windowEnd, Boundary.LINE);
            }
            if (cut < 0) {
                cut = lastCut(floor, windowEnd, Boundary.SENTENCE);
            }
            if (cut < 0) {
                cut = lastCut(floor, windowEnd, Boundary.WORD);
            }
            if (cut >= 0) {
                return cut;
            }
            return splitsSurrogatePair(windowEnd) && windowEnd - 1 > floor ? windowEnd - 1 : windowEnd;
        }

        private int lastCut(int floor, int windowEnd, Boundary boundary) {
            for (int cut = windowEnd; cut > floor; cut--) {
                if (boundary.endsAt(text, cut)) {
                    return cut;
                }
            }
            return -1;
        }

        private int nextStart(int end) {
            if (overlap == 0) {
                return end;
            }
            int candidate = end - overlap;
            for (int position = candidate; position < end; position++) {
                if (isWordStart(position)) {
                    return position;
                }
            }
            return splitsSurrogatePair(candidate) ? candidate + 1 : candidate;
        }

        private boolean splitsSurrogatePair(int position) {
            return position > 0 && position < text.length() && Character.isLowSurrogate(text.charAt(position))
                    && Character.isHighSurrogate(text.charAt(position - 1));
        }

        private boolean isWordStart(int position) {
            return !Character.isWhitespace(text.charAt(position))
                    && (position == 0 || Character.isWhitespace(text.charAt(position - 1)));
        }
    }

    private enum Boundary {
        PARAGRAPH {
            @Override
            boolean endsAt(String text, int cut) {
                return cut >= 2 && text.charAt(cut - 1) == '\n' && text.charAt(cut - 2) == '\n';
            }
        },
        LINE {
            @Override
            boolean endsAt(String text, int cut) {
                return text.charAt(cut - 1) == '\n';
            }
        },
        SENTENCE {
            @Override
            boolean endsAt(String text, int cut) {
                if (cut < 2 || !Character.isWhitespace(text.charAt(cut - 1))) {
                    return false;
                }
                char terminal = text.charAt(cut - 2);
                return terminal == '.' || terminal == '!' || terminal == '?';
            }
        },
        WORD {
            @Override
            boolean endsAt(String text, int cut) {
                return Character.isWhitespace(text.charAt(cut - 1));
            }
        };

        abstract boolean endsAt(String text, int cut);
    }
}
