package works.bolt.host;

/**
 * A position in the source text.
 *
 * @param pos zero-based character offset
 * @param lineno one-based line number
 * @param colno one-based column number
 */
public record SourceLocation(
	int pos,
	int lineno,
	int colno
) implements Comparable<SourceLocation> {
	public SourceLocation {
		assert pos >= 0: "pos can't be negative: " + pos;
		assert lineno >= 1: "lineno must be positive: " + lineno;
		assert colno >= 1: "colno must be positive: " + colno;
	}

	public static final SourceLocation START = new SourceLocation(0, 1, 1);

	@Override
	public int compareTo(SourceLocation other) {
		return Integer.compare(pos, other.pos);
	}

	@Override
	public String toString() {
		return lineno + ":" + colno;
	}
}
