package works.bolt.host;

import static java.util.Objects.requireNonNull;

/**
 * A contiguous region of source text, from {@code start} inclusive to {@code end} exclusive.
 */
public record SourceSpan(
	SourceLocation start,
	SourceLocation end
) {
	public SourceSpan {
		requireNonNull(start);
		requireNonNull(end);
		if (end.compareTo(start) < 0) {
			throw new IllegalArgumentException("Span ends at " + end + " before it starts at " + start);
		}
	}

	public int length() {
		return end.pos() - start.pos();
	}

	public boolean contains(SourceSpan other) {
		return start.compareTo(other.start) <= 0
			&& other.end.compareTo(end) <= 0;
	}

	/**
	 * @return the portion of {@code source} this span covers
	 */
	public String extract(CharSequence source) {
		return source.subSequence(start.pos(), end.pos()).toString();
	}

	@Override
	public String toString() {
		return start + "-" + end;
	}
}
