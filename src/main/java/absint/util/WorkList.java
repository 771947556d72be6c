package absint.util;

import java.util.ArrayDeque;
import java.util.HashSet;
import java.util.Set;

/**
 * A double-ended queue for work-list algorithms.  An item is never queued
 * twice at the same time.
 */
public final class WorkList<T> {
	private final ArrayDeque<T> deque = new ArrayDeque<>();
	private final Set<T> set = new HashSet<>();

	/**
	 * @return Whether any items are in the list.
	 */
	public boolean isEmpty() {
		return this.deque.isEmpty();
	}

	/**
	 * @return The number of queued items.
	 */
	public int size() {
		return this.deque.size();
	}

	/**
	 * @return Whether this list already contains the item.
	 */
	public boolean contains(T item) {
		return this.set.contains(item);
	}

	/**
	 * Add an item to the front of the queue.
	 *
	 * @return Whether a new item was added.
	 */
	public boolean addFirst(T item) {
		if (this.set.add(item)) {
			this.deque.addFirst(item);
			return true;
		} else {
			return false;
		}
	}

	/**
	 * Add an item to the back of the queue.
	 *
	 * @return Whether a new item was added.
	 */
	public boolean addLast(T item) {
		if (this.set.add(item)) {
			this.deque.addLast(item);
			return true;
		} else {
			return false;
		}
	}

	/**
	 * Add several items to the back of the queue, in iteration order.
	 *
	 * @return Whether any new item was added.
	 */
	public boolean addAllLast(Iterable<? extends T> items) {
		var ret = false;
		for (var item : items) {
			ret |= addLast(item);
		}
		return ret;
	}

	/**
	 * Pop an element from the front of the queue.
	 */
	public T removeFirst() {
		var ret = this.deque.removeFirst();
		this.set.remove(ret);
		return ret;
	}
}
