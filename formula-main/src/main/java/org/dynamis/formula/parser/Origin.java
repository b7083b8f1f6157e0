package org.dynamis.formula.parser;

import java.util.Arrays;
import java.util.Collection;
import java.util.Objects;

/**
 * A span of characters in a formula's source text, {@code [start, end)}.
 * <p>
 * Parse nodes, factors and errors carry an origin so a problem can be reported
 * by underlining the text that caused it.
 */
public final class Origin {

    private final String code;
    private final int start;
    private final int end;

    public Origin(String code, int start, int end) {
        this.code = Objects.requireNonNull(code, "code must not be null");
        if (start < 0 || end < start || end > code.length()) {
            throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ") for code of length " + code.length());
        }
        this.start = start;
        this.end = end;
    }

    /**
     * The smallest origin covering every non-null argument, or {@code null} if there are none.
     *
     * @throws IllegalArgumentException if the origins refer to different code
     */
    public static Origin combine(Origin... origins) {
        return combine(Arrays.asList(origins));
    }

    public static Origin combine(Collection<Origin> origins) {
        String code = null;
        int start = Integer.MAX_VALUE;
        int end = Integer.MIN_VALUE;
        for (Origin origin : origins) {
            if (origin == null) {
                continue;
            }
            if (code == null) {
                code = origin.code;
            } else if (!code.equals(origin.code)) {
                throw new IllegalArgumentException("Cannot combine origins from different code");
            }
            start = Math.min(start, origin.start);
            end = Math.max(end, origin.end);
        }
        return code == null ? null : new Origin(code, start, end);
    }

    public String getCode() {
        return code;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    /**
     * The text this origin spans.
     */
    public String relevantCode() {
        return code.substring(start, end);
    }

    /**
     * Renders the code with a caret underline beneath this span, e.g.
     * <pre>
     *     a + b:1
     *           ^
     * </pre>
     */
    public String caretize(int indent) {
        String pad = " ".repeat(indent);
        return pad + code + "\n" + pad + " ".repeat(start) + "^".repeat(Math.max(1, end - start));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Origin that = (Origin) o;
        return start == that.start && end == that.end && code.equals(that.code);
    }

    @Override
    public int hashCode() {
        return Objects.hash(code, start, end);
    }

    @Override
    public String toString() {
        return "Origin{" +
               "code='" + code + '\'' +
               ", start=" + start +
               ", end=" + end +
               '}';
    }
}
