package absint.util;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.RecursiveTask;
import java.util.function.Function;

/**
 * Idempotent memoization table.
 *
 * The function is invoked at most once per key, even when the same key is
 * queried concurrently: the first caller computes the value and the others
 * block until it is ready.  Every caller therefore observes the very same
 * value instance for equal keys.
 */
public final class Cache<K, V> {
	private final ConcurrentMap<K, Task> map = new ConcurrentHashMap<>();
	private final Function<? super K, ? extends V> func;

	private final class Task extends RecursiveTask<V> {
		private static final long serialVersionUID = 1L;

		private final K key;

		Task(K key) {
			this.key = key;
		}

		@Override
		protected V compute() {
			return func.apply(this.key);
		}
	}

	private Cache(Function<? super K, ? extends V> func) {
		this.func = func;
	}

	/**
	 * Create a cache.
	 *
	 * @param func
	 *         The function that computes values from keys.
	 */
	public static <K, V> Cache<K, V> of(Function<? super K, ? extends V> func) {
		return new Cache<>(func);
	}

	/**
	 * @return The (possibly cached) value for this key.
	 */
	public V get(K key) {
		var task = this.map.get(key);
		if (task != null) {
			return task.join();
		}

		var newTask = new Task(key);
		task = this.map.putIfAbsent(key, newTask);
		if (task == null) {
			// We won the race, so we are the unique task for this key
			task = newTask;
			task.invoke();
		}

		return task.join();
	}

	/**
	 * @return The number of keys queried so far.
	 */
	public int size() {
		return this.map.size();
	}
}
