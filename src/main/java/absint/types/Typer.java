package absint.types;

import com.google.common.base.Suppliers;

import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Maps frontend type hints to semantic types.
 *
 * @param <H>
 *         The frontend's type hint representation.
 */
@FunctionalInterface
public interface Typer<H> {
	/**
	 * @return The type for the hint, or nothing if this typer cannot type it.
	 */
	Optional<Type> fromHint(H hint);

	/**
	 * @return A typer that tries this one first, then the other.
	 */
	default Typer<H> or(Typer<H> other) {
		return hint -> {
			var ret = fromHint(hint);
			if (ret.isPresent()) {
				return ret;
			} else {
				return other.fromHint(hint);
			}
		};
	}

	/**
	 * @return A typer that only answers for hints of the given class.
	 */
	static <H, T extends H> Typer<H> forClass(Class<T> cls, Function<? super T, Optional<Type>> func) {
		return hint -> cls.isInstance(hint) ? func.apply(cls.cast(hint)) : Optional.empty();
	}

	/**
	 * Build a typer that delegates to a lazily created one.  Allows recursive
	 * typers, e.g. a pointer typer that types its target with the full typer.
	 */
	static <H> Typer<H> delegating(Supplier<Typer<H>> supplier) {
		var delegate = Suppliers.memoize(supplier::get);
		return hint -> delegate.get().fromHint(hint);
	}
}
