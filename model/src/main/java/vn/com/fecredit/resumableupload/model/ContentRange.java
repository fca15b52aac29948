package vn.com.fecredit.resumableupload.model;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Inclusive byte range of a chunk within the whole file, as carried by a
 * {@code Content-Range: bytes <start>-<end>/<total>} header.
 *
 * <p>
 * Usage example:
 * <pre>
 * ContentRange range = ContentRange.parse("bytes 0-4/10", ContentRange.DEFAULT_PATTERN).orElseThrow();
 * range.length();      // 5
 * range.isFinal();     // false
 * </pre>
 */
public final class ContentRange {

    /** Header syntax accepted by default. Groups: start, end, total. */
    public static final String DEFAULT_PATTERN_TEXT = "^bytes (\\d+)-(\\d+)/(\\d+)$";
    public static final Pattern DEFAULT_PATTERN = Pattern.compile(DEFAULT_PATTERN_TEXT);

    private final long start;
    private final long end;
    private final long total;

    private ContentRange(long start, long end, long total) {
        this.start = start;
        this.end = end;
        this.total = total;
    }

    public static ContentRange of(long start, long end, long total) {
        return new ContentRange(start, end, total);
    }

    /**
     * Parses a header value against the given pattern. The pattern must expose
     * start, end and total as its first three capturing groups.
     *
     * @param headerValue raw header text, may be null
     * @param pattern     header syntax
     * @return the parsed range, or empty when the value is null, does not match,
     * or holds a number that does not fit in a {@code long}
     */
    public static Optional<ContentRange> parse(String headerValue, Pattern pattern) {
        if (headerValue == null) {
            return Optional.empty();
        }
        Matcher matcher = pattern.matcher(headerValue);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        try {
            return Optional.of(new ContentRange(
                    Long.parseLong(matcher.group(1)),
                    Long.parseLong(matcher.group(2)),
                    Long.parseLong(matcher.group(3))));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    public long getStart() {
        return start;
    }

    public long getEnd() {
        return end;
    }

    public long getTotal() {
        return total;
    }

    /** Number of bytes the range covers; zero or negative for a malformed range. */
    public long length() {
        return end - start + 1;
    }

    /** True when this range ends on the last byte of the file. */
    public boolean isFinal() {
        return end + 1 == total;
    }

    public String toHeaderValue() {
        return "bytes " + start + "-" + end + "/" + total;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ContentRange)) return false;
        ContentRange that = (ContentRange) o;
        return start == that.start && end == that.end && total == that.total;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(start) * 31 * 31 + Long.hashCode(end) * 31 + Long.hashCode(total);
    }

    @Override
    public String toString() {
        return toHeaderValue();
    }
}
