package net.jrector.api;

/**
 * A half-open range {@code [start, end)} of character offsets into the original source of a file.
 */
public record SourceSpan(int start, int end) {
    public SourceSpan {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ")");
        }
    }

    public int length() {
        return end - start;
    }

    public boolean contains(SourceSpan other) {
        return start <= other.start && other.end <= end;
    }

    public CharSequence slice(CharSequence text) {
        return text.subSequence(start, end);
    }
}
