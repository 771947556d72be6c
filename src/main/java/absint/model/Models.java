package absint.model;

import absint.ConfigurationException;
import absint.dataflow.Domain;
import absint.dataflow.Operation;
import absint.dataflow.OperationProvider;
import absint.dataflow.Signature;
import absint.ir.BinExpr;
import absint.ir.Expr;
import absint.ir.Ident;
import absint.ir.IrNode;
import absint.ir.Lit;
import absint.ir.Operator;
import absint.ir.Program;
import absint.ir.UnExpr;
import absint.types.LiteralBuilder;
import absint.types.Type;
import absint.types.TypeInterpretation;
import absint.types.TypeInterpreter;
import absint.types.Typer;
import absint.util.Cache;
import absint.util.Log;

import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Builds {@link Model}s from a typer and a type interpreter.
 *
 * Hints and types are memoized, so identical hints get identical types and
 * identical types get the very same domain instance.  A Models object can
 * build models for several programs that then share their domains.
 */
public final class Models {
	private final Cache<Object, Type> types;
	private final Cache<Type, TypeInterpretation> interpretations;

	public Models(Typer<Object> typer, TypeInterpreter interpreter) {
		this.types = Cache.of(hint -> typer.fromHint(hint)
			.orElseThrow(() -> new ConfigurationException("No type for hint '%s'", hint)));
		this.interpretations = Cache.of(type -> interpreter.fromType(type)
			.orElseThrow(() -> new ConfigurationException("No interpretation for type '%s'", type)));
	}

	/**
	 * @return The interpretation of a type hint.
	 */
	public TypeInterpretation interpret(Object hint) {
		return this.interpretations.get(this.types.get(hint));
	}

	/**
	 * Build the model of the given programs.
	 *
	 * @throws ConfigurationException
	 *         If a hint has no type, a type no interpretation, or an
	 *         operator no semantics for its signature.
	 */
	public Model of(Program... programs) {
		Map<IrNode, Domain<?>> domains = new IdentityHashMap<>();
		Set<OperationProvider> providers = new LinkedHashSet<>();
		Map<Domain<?>, LiteralBuilder> builders = new LinkedHashMap<>();

		for (var program : programs) {
			program.nodes()
				.filter(n -> n instanceof Expr)
				.forEach(node -> node.getData().getTypeHint().ifPresent(hint -> {
					var interp = interpret(hint);
					domains.put(node, interp.domain());
					providers.add(interp.operations());
					builders.putIfAbsent(interp.domain(), interp.builder());
				}));
		}

		var aggregate = new Aggregate(providers);
		var entries = new IdentityHashMap<IrNode, ModelEntry>();
		for (var e : domains.entrySet()) {
			var node = e.getKey();
			entries.put(node, entry(node, e.getValue(), domains, aggregate, builders));
		}

		Log.debug("Modelled %d nodes of %d program(s) with %d interpretation(s)",
			entries.size(), programs.length, this.interpretations.size());
		return new Model(entries);
	}

	private static ModelEntry entry(
		IrNode node,
		Domain<?> domain,
		Map<IrNode, Domain<?>> domains,
		Aggregate operations,
		Map<Domain<?>, LiteralBuilder> builders
	) {
		if (node instanceof Ident) {
			return ModelEntry.ofIdent(domain);
		} else if (node instanceof Lit) {
			return ModelEntry.ofLiteral(domain, builders.get(domain));
		} else if (node instanceof UnExpr un) {
			var sig = Signature.unary(operandDomain(un.getOperand(), domains), domain);
			return ModelEntry.ofOperation(domain, operations.get(un.getOperator(), sig));
		} else if (node instanceof BinExpr bin) {
			var sig = Signature.binary(
				operandDomain(bin.getLhs(), domains),
				operandDomain(bin.getRhs(), domains),
				domain);
			return ModelEntry.ofOperation(domain, operations.get(bin.getOperator(), sig));
		} else {
			throw new ConfigurationException("Cannot model '%s'", node);
		}
	}

	private static Domain<?> operandDomain(Expr operand, Map<IrNode, Domain<?>> domains) {
		var ret = domains.get(operand);
		if (ret == null) {
			throw new ConfigurationException("Operand '%s' has no type hint", operand);
		}
		return ret;
	}

	/**
	 * Looks up operations in every provider used by the program.
	 */
	private static final class Aggregate {
		private final Set<OperationProvider> providers;

		Aggregate(Set<OperationProvider> providers) {
			this.providers = providers;
		}

		Operation get(Operator op, Signature sig) {
			for (var provider : this.providers) {
				var ret = provider.lookup(op, sig);
				if (ret.isPresent()) {
					return ret.get();
				}
			}
			throw new ConfigurationException("No provider for '%s' %s", op.getSymbol(), sig);
		}
	}
}
