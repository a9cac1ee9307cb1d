package cfg.parser.lr;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import cfg.grammar.Grammar;
import cfg.grammar.NonTerminal;
import cfg.grammar.Production;
import cfg.grammar.Symbol;

import static cfg.util.Utils.sorted;

/**
 * A state of the LR(0) automaton: a set of items closed under {@link #closure(Grammar, Collection)}.
 * Two states are the same iff their item sets are equal.
 */
public class State implements Comparable<State> {

	public final int id;

	/**
	 * Items the state was created from (before the closure)
	 */
	public final Set<Situation> nonClosureItems;

	/**
	 * All items, the kernel items come first
	 */
	public final Set<Situation> items;

	/**
	 * Outgoing transitions, set while the automaton is built
	 */
	final Map<Symbol, State> adjacentStates = new HashMap<>();

	State(int id, Set<Situation> nonClosureItems, Set<Situation> items){
		this.id = id;
		this.nonClosureItems = Collections.unmodifiableSet(nonClosureItems);
		this.items = Collections.unmodifiableSet(items);
	}

	/**
	 * Closure of a set of items: for every item [A → α•Bβ] add [B → •γ] for every production B → γ
	 * until nothing is added.
	 *
	 * @return kernel items followed by the added items
	 */
	public static Set<Situation> closure(Grammar grammar, Collection<Situation> kernel){
		Set<Situation> closure = new LinkedHashSet<>(kernel);
		List<Situation> todo = new ArrayList<>(kernel);
		while (!todo.isEmpty()){
			Situation situation = todo.remove(todo.size() - 1);
			if (!situation.inFrontOfNonTerminal()){
				continue;
			}
			for (Production production : grammar.getProductionsOf((NonTerminal)situation.nextSymbol())){
				Situation added = new Situation(production);
				if (closure.add(added)){
					todo.add(added);
				}
			}
		}
		return closure;
	}

	/**
	 * Kernel of goto(this, symbol): the items that have the dot right in front of the symbol, advanced
	 * over it. Empty if no item can be advanced over the symbol.
	 */
	public Set<Situation> shift(Symbol symbol){
		Set<Situation> kernel = new LinkedHashSet<>();
		for (Situation situation : items){
			if (symbol.equals(situation.nextSymbol())){
				kernel.add(situation.advance());
			}
		}
		return kernel;
	}

	/**
	 * Symbols that appear right after a dot, in symbol order
	 */
	public List<Symbol> shiftSymbols(){
		Set<Symbol> symbols = new TreeSet<>();
		for (Situation situation : items){
			if (situation.canAdvance()){
				symbols.add(situation.nextSymbol());
			}
		}
		return new ArrayList<>(symbols);
	}

	/**
	 * @return target of the transition over the symbol or null if there is none
	 */
	public State getAdjacentState(Symbol symbol){
		return adjacentStates.get(symbol);
	}

	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder("State ").append(id);
		for (Situation situation : sorted(items)) {
			builder.append("\n- ").append(situation);
		}
		for (Symbol symbol : sorted(adjacentStates.keySet())){
			builder.append("\n  ").append(symbol).append(" → ").append(adjacentStates.get(symbol).id);
		}
		return builder.toString();
	}

	@Override
	public int compareTo(State o) {
		return Integer.compare(id, o.id);
	}
}
