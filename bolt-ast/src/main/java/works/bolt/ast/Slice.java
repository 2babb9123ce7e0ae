package works.bolt.ast;

import lombok.With;
import org.jetbrains.annotations.Nullable;

/**
 * {@code start:stop:step}, any of which may be absent.
 */
@With
public record Slice(
	@Nullable Expression start,
	@Nullable Expression stop,
	@Nullable Expression step
) implements Subscript {
	/**
	 * The bare {@code :} slice.
	 */
	public Slice() {
		this(null, null, null);
	}
}
