package cfg.parser.lr;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

import cfg.grammar.Grammar;
import cfg.grammar.Production;
import cfg.grammar.Symbol;

/**
 * The canonical LR(0) automaton of a grammar, augmented with <code>S' → S</code>.
 *
 * State 0 is the closure of [S' → •S]. Independent of any lookahead.
 */
public class Graph {

	private static final Logger LOG = Logger.getLogger(Graph.class.getName());

	public final Grammar grammar;
	/**
	 * The augmented start production <code>S' → S</code>
	 */
	public final Production startProduction;
	public final List<State> states;
	public final State startState;

	private Graph(Grammar grammar, Production startProduction, List<State> states) {
		this.grammar = grammar;
		this.startProduction = startProduction;
		this.states = Collections.unmodifiableList(states);
		this.startState = states.get(0);
	}

	/**
	 * Build the canonical collection of LR(0) item sets with a work list. The goto of every processed
	 * state over every symbol after a dot is computed. A non empty result that equals (as an item set) an
	 * already recorded state is mapped to it, otherwise it becomes a new state.
	 */
	public static Graph createFromGrammar(Grammar grammar){
		Production startProduction = grammar.augmentedStartProduction();
		Set<Situation> startKernel = new LinkedHashSet<>();
		startKernel.add(new Situation(startProduction));
		List<State> states = new ArrayList<>();
		Map<Set<Situation>, State> statesByItems = new HashMap<>();
		State startState = new State(0, startKernel, State.closure(grammar, startKernel));
		states.add(startState);
		statesByItems.put(startState.items, startState);
		Queue<State> worklist = new ArrayDeque<>();
		worklist.add(startState);
		while (!worklist.isEmpty()){
			State currentState = worklist.poll();
			for (Symbol shiftSymbol : currentState.shiftSymbols()){
				Set<Situation> kernel = currentState.shift(shiftSymbol);
				if (kernel.isEmpty()){
					continue;
				}
				Set<Situation> items = State.closure(grammar, kernel);
				State nextState = statesByItems.get(items);
				if (nextState == null){
					nextState = new State(states.size(), kernel, items);
					states.add(nextState);
					statesByItems.put(nextState.items, nextState);
					worklist.add(nextState);
				}
				currentState.adjacentStates.put(shiftSymbol, nextState);
			}
		}
		if (LOG.isLoggable(Level.FINE)){
			LOG.fine(String.format("LR(0) automaton has %d states", states.size()));
		}
		return new Graph(grammar, startProduction, states);
	}

	/**
	 * @return id of the target state of the transition or -1 if there is none
	 */
	public int transition(int stateId, Symbol symbol){
		State target = states.get(stateId).getAdjacentState(symbol);
		return target == null ? -1 : target.id;
	}

	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder();
		for (State state : states){
			if (state != startState){
				builder.append("\n–––––––\n");
			}
			builder.append(state.toString());
		}
		return builder.toString();
	}
}
