package cfg.grammar;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

import cfg.CFGException;
import cfg.Config;

import static cfg.util.Utils.formatSymbolSet;

/**
 * The FIRST(1) sets of all symbols of a grammar.
 *
 * FIRST(X) contains the terminals that can begin a word derived from X and epsilon if X can be derived
 * to the empty word. Read only after {@link #calculate(Grammar)} returns.
 */
public class FirstSets implements Serializable {

	private static final Logger LOG = Logger.getLogger(FirstSets.class.getName());

	private final Map<Symbol, Set<Symbol>> sets;

	private FirstSets(Map<Symbol, Set<Symbol>> sets) {
		this.sets = sets;
	}

	/**
	 * Fixed point iteration: for every production A → α union FIRST(α) into FIRST(A) until no set
	 * changes anymore. Terminates as every FIRST(A) only grows and is bounded by the alphabet ∪ {ε}.
	 */
	public static FirstSets calculate(Grammar grammar){
		Map<Symbol, Set<Symbol>> first = new HashMap<>();
		for (Terminal terminal : grammar.getTerminals()){
			first.put(terminal, new HashSet<>(Collections.singleton(terminal)));
		}
		first.put(Epsilon.INSTANCE, new HashSet<>(Collections.singleton(Epsilon.INSTANCE)));
		first.put(EndMarker.INSTANCE, new HashSet<>(Collections.singleton(EndMarker.INSTANCE)));
		for (NonTerminal nonTerminal : grammar.getNonTerminals()){
			first.put(nonTerminal, new HashSet<>());
		}
		FirstSets working = new FirstSets(first);
		int iterations = 0;
		boolean somethingChanged;
		do {
			somethingChanged = false;
			if (++iterations > Config.maxIterations()){
				throw new CFGException("FIRST set calculation didn't terminate after " + Config.maxIterations() + " passes");
			}
			for (Production production : grammar.getProductions()){
				Set<Symbol> rightFirst = working.firstOfString(production.right);
				somethingChanged = first.get(production.left).addAll(rightFirst) || somethingChanged;
			}
		} while (somethingChanged);
		if (LOG.isLoggable(Level.FINE)){
			LOG.fine(String.format("FIRST sets converged after %d passes", iterations));
		}
		Map<Symbol, Set<Symbol>> frozen = new HashMap<>();
		for (Map.Entry<Symbol, Set<Symbol>> entry : first.entrySet()){
			frozen.put(entry.getKey(), Collections.unmodifiableSet(entry.getValue()));
		}
		return new FirstSets(Collections.unmodifiableMap(frozen));
	}

	/**
	 * FIRST set of the passed symbol. Terminals (even those not in the grammar), epsilon and the end
	 * marker always yield themselves, unknown non terminals the empty set.
	 */
	public Set<Symbol> get(Symbol symbol){
		switch (symbol.kind()){
			case NONTERMINAL:
				return sets.getOrDefault(symbol, Collections.emptySet());
			case TERMINAL:
			case EPSILON:
			case END_MARKER:
				return sets.getOrDefault(symbol, Collections.singleton(symbol));
			default:
				throw new AssertionError(symbol.kind());
		}
	}

	/**
	 * FIRST set of a sequence of symbols
	 *
	 * Accumulates FIRST(X₁) - {ε}, continues with X₂ if ε ∈ FIRST(X₁) and so on. Contains ε if every symbol
	 * can be derived to ε, this includes the empty sequence.
	 *
	 * @return set of terminals, the end marker and maybe ε, never a non terminal
	 */
	public Set<Symbol> firstOfString(List<Symbol> symbols){
		Set<Symbol> ret = new HashSet<>();
		for (Symbol symbol : symbols){
			Set<Symbol> symbolFirst = get(symbol);
			for (Symbol sym : symbolFirst){
				if (!sym.isEpsilon()){
					ret.add(sym);
				}
			}
			if (!symbolFirst.contains(Epsilon.INSTANCE)){
				return ret;
			}
		}
		ret.add(Epsilon.INSTANCE);
		return ret;
	}

	/**
	 * Can the passed symbol be derived to the empty word?
	 */
	public boolean isEpsilonable(Symbol symbol){
		return get(symbol).contains(Epsilon.INSTANCE);
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof FirstSets && ((FirstSets)obj).sets.equals(sets);
	}

	@Override
	public int hashCode() {
		return sets.hashCode();
	}

	/**
	 * One <code>FIRST(A) = { ... }</code> line per non terminal, sorted
	 */
	@Override
	public String toString() {
		List<Symbol> symbols = new ArrayList<>();
		for (Symbol symbol : sets.keySet()){
			if (symbol.isNonTerminal()){
				symbols.add(symbol);
			}
		}
		Collections.sort(symbols);
		List<String> lines = new ArrayList<>();
		for (Symbol symbol : symbols){
			lines.add("FIRST(" + symbol + ") = " + formatSymbolSet(sets.get(symbol)));
		}
		return String.join("\n", lines);
	}
}
