package absint.semantics;

import absint.ConfigurationException;
import absint.ir.Ident;
import absint.model.Model;

import com.google.common.collect.ImmutableMap;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * An abstract environment: an immutable map from variables to abstract values.
 *
 * Variables are keyed by identity.  The lattice operations take the model
 * to find the domain of each variable.
 */
public final class Env {
	private static final Env EMPTY = new Env(ImmutableMap.of());

	private final ImmutableMap<Ident, Object> values;

	private Env(ImmutableMap<Ident, Object> values) {
		this.values = values;
	}

	public static Env empty() {
		return EMPTY;
	}

	public static Env of(Map<Ident, ?> values) {
		return new Env(ImmutableMap.copyOf(values));
	}

	/**
	 * @return The value of a variable.
	 * @throws ConfigurationException
	 *         If the variable is unbound.
	 */
	public Object get(Ident ident) {
		var ret = this.values.get(ident);
		if (ret == null) {
			throw new ConfigurationException("Unbound variable '%s'", ident.getName());
		}
		return ret;
	}

	public Optional<Object> find(Ident ident) {
		return Optional.ofNullable(this.values.get(ident));
	}

	/**
	 * @return The value of the variable with the given name.
	 */
	public Object get(String name) {
		for (var e : this.values.entrySet()) {
			if (e.getKey().getName().equals(name)) {
				return e.getValue();
			}
		}
		throw new IllegalArgumentException("No variable named " + name);
	}

	/**
	 * @return A copy of this environment with a variable bound to a new value.
	 */
	public Env with(Ident ident, Object value) {
		Objects.requireNonNull(value);
		var map = new LinkedHashMap<Ident, Object>(this.values);
		map.put(ident, value);
		return new Env(ImmutableMap.copyOf(map));
	}

	public Set<Ident> variables() {
		return this.values.keySet();
	}

	public ImmutableMap<Ident, Object> asMap() {
		return this.values;
	}

	/**
	 * @return Whether every variable's value is below its value in the other environment.
	 */
	public boolean le(Env other, Model model) {
		for (var e : this.values.entrySet()) {
			var ident = e.getKey();
			var theirs = other.values.get(ident);
			if (theirs == null) {
				if (!model.domain(ident).isEmpty(e.getValue())) {
					return false;
				}
			} else if (!model.domain(ident).le(e.getValue(), theirs)) {
				return false;
			}
		}
		return true;
	}

	/**
	 * @return The pointwise join of two environments.
	 */
	public Env join(Env other, Model model) {
		return combine(other, model, false);
	}

	/**
	 * @return The pointwise widening of this (previous) environment by the other (next) one.
	 */
	public Env widen(Env next, Model model) {
		return combine(next, model, true);
	}

	private Env combine(Env other, Model model, boolean widen) {
		var map = new LinkedHashMap<Ident, Object>(this.values);
		for (var e : other.values.entrySet()) {
			var ident = e.getKey();
			var mine = map.get(ident);
			if (mine == null) {
				map.put(ident, e.getValue());
			} else {
				var domain = model.domain(ident);
				map.put(ident, widen ? domain.widen(mine, e.getValue()) : domain.join(mine, e.getValue()));
			}
		}
		return new Env(ImmutableMap.copyOf(map));
	}

	@Override
	public boolean equals(Object obj) {
		if (obj == this) {
			return true;
		} else if (obj instanceof Env other) {
			return this.values.equals(other.values);
		} else {
			return false;
		}
	}

	@Override
	public int hashCode() {
		return this.values.hashCode();
	}

	@Override
	public String toString() {
		var ret = new StringBuilder("{");
		var first = true;
		for (var e : this.values.entrySet()) {
			if (!first) {
				ret.append(", ");
			}
			first = false;
			ret.append(e.getKey().getName()).append(": ").append(e.getValue());
		}
		return ret.append("}").toString();
	}
}
