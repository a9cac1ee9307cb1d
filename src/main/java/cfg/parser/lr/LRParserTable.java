package cfg.parser.lr;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

import cfg.grammar.EndMarker;
import cfg.grammar.FollowSets;
import cfg.grammar.Grammar;
import cfg.grammar.NonTerminal;
import cfg.grammar.Production;
import cfg.grammar.Symbol;
import cfg.util.BuildResult;

import static cfg.util.Utils.sorted;

/**
 * SLR(1) ACTION and GOTO tables, built from the LR(0) automaton and the FOLLOW sets. Immutable.
 */
public class LRParserTable implements Serializable {

	private static final Logger LOG = Logger.getLogger(LRParserTable.class.getName());

	public final transient Graph graph;

	/**
	 * Mapping of lookahead (terminal or end marker) to action for each state.
	 */
	private final List<Map<Symbol, Action>> actionTable;

	/**
	 * Mapping of non terminal to next state (for each state).
	 */
	private final List<Map<NonTerminal, Integer>> gotoTable;

	private LRParserTable(Graph graph, List<Map<Symbol, Action>> actionTable, List<Map<NonTerminal, Integer>> gotoTable) {
		this.graph = graph;
		this.actionTable = actionTable;
		this.gotoTable = gotoTable;
	}

	public static abstract class Action implements Serializable {

		public abstract String name();
	}

	public static final class ShiftAction extends Action {

		public final int stateToBeShifted;

		public ShiftAction(int stateToBeShifted) {
			this.stateToBeShifted = stateToBeShifted;
		}

		@Override
		public String toString() {
			return "shift(" + stateToBeShifted + ")";
		}

		@Override
		public String name() {
			return "shift";
		}

		@Override
		public boolean equals(Object obj) {
			return obj instanceof ShiftAction && ((ShiftAction)obj).stateToBeShifted == stateToBeShifted;
		}

		@Override
		public int hashCode() {
			return stateToBeShifted;
		}
	}

	public static final class ReduceAction extends Action {

		public final Production production;

		public ReduceAction(Production production) {
			this.production = production;
		}

		@Override
		public String toString() {
			return "reduce(" + production + ")";
		}

		@Override
		public String name() {
			return "reduce";
		}

		@Override
		public boolean equals(Object obj) {
			return obj instanceof ReduceAction && ((ReduceAction)obj).production.equals(production);
		}

		@Override
		public int hashCode() {
			return production.hashCode();
		}
	}

	public static final class Accept extends Action {

		@Override
		public String toString() {
			return "accept()";
		}

		@Override
		public String name() {
			return "accept";
		}

		@Override
		public boolean equals(Object obj) {
			return obj instanceof Accept;
		}

		@Override
		public int hashCode() {
			return 1;
		}
	}

	public static BuildResult<LRParserTable, LRConflict> fromGrammar(Grammar grammar){
		return build(grammar, grammar.calculateFollowSets());
	}

	/**
	 * Build the LR(0) automaton of the grammar and the tables from it
	 */
	public static BuildResult<LRParserTable, LRConflict> build(Grammar grammar, FollowSets follow){
		return build(Graph.createFromGrammar(grammar), follow);
	}

	/**
	 * Build the tables. In every state the shift items are processed first, then the accept item and
	 * then the reduce items in production order, each over its lookaheads in symbol order:
	 *
	 * <ul>
	 *     <li>[A → α•aβ], a terminal: ACTION[i, a] = shift(goto(i, a))</li>
	 *     <li>[S' → S•]: ACTION[i, $] = accept</li>
	 *     <li>[A → α•]: ACTION[i, b] = reduce(A → α) for every b ∈ FOLLOW(A)</li>
	 * </ul>
	 *
	 * GOTO[i, A] is the target of the automaton's transition over A. Writing an action into a cell that
	 * holds a different action is a conflict.
	 *
	 * @return tables or the first conflict
	 */
	public static BuildResult<LRParserTable, LRConflict> build(Graph graph, FollowSets follow){
		List<Map<Symbol, Action>> actionTable = new ArrayList<>();
		List<Map<NonTerminal, Integer>> gotoTable = new ArrayList<>();
		for (State state : graph.states){
			Map<Symbol, Action> row = new HashMap<>();
			Map<NonTerminal, Integer> gotoRow = new HashMap<>();
			List<Situation> situations = sorted(state.items);
			for (Situation situation : situations){
				if (situation.inFrontOfTerminal()){
					State nextState = state.getAdjacentState(situation.nextSymbol());
					LRConflict conflict = insert(state, row, situation.nextSymbol(), new ShiftAction(nextState.id));
					if (conflict != null){
						return failure(conflict);
					}
				} else if (situation.inFrontOfNonTerminal()){
					NonTerminal nonTerminal = (NonTerminal)situation.nextSymbol();
					gotoRow.put(nonTerminal, state.getAdjacentState(nonTerminal).id);
				}
			}
			for (Situation situation : situations){
				if (!situation.canAdvance() && situation.production.left.augmented){
					LRConflict conflict = insert(state, row, EndMarker.INSTANCE, new Accept());
					if (conflict != null){
						return failure(conflict);
					}
				}
			}
			for (Situation situation : situations){
				if (situation.canAdvance() || situation.production.left.augmented){
					continue;
				}
				for (Symbol lookahead : sorted(follow.get(situation.production.left))){
					LRConflict conflict = insert(state, row, lookahead, new ReduceAction(situation.production));
					if (conflict != null){
						return failure(conflict);
					}
				}
			}
			actionTable.add(Collections.unmodifiableMap(row));
			gotoTable.add(Collections.unmodifiableMap(gotoRow));
		}
		if (LOG.isLoggable(Level.FINE)){
			LOG.fine(String.format("Built SLR(1) table with %d states", actionTable.size()));
		}
		return BuildResult.success(new LRParserTable(graph, Collections.unmodifiableList(actionTable),
				Collections.unmodifiableList(gotoTable)));
	}

	private static BuildResult<LRParserTable, LRConflict> failure(LRConflict conflict){
		LOG.info(conflict.toString());
		return BuildResult.failure(conflict);
	}

	/**
	 * @return conflict if the cell holds a different action, null otherwise
	 */
	private static LRConflict insert(State state, Map<Symbol, Action> row, Symbol lookahead, Action action){
		Action cur = row.get(lookahead);
		if (cur == null){
			row.put(lookahead, action);
			return null;
		}
		if (cur.equals(action)){
			return null;
		}
		return new LRConflict(state.id, lookahead, cur, action);
	}

	/**
	 * @return action for the cell or null if it is empty
	 */
	public Action getAction(int state, Symbol lookahead){
		return actionTable.get(state).get(lookahead);
	}

	/**
	 * @return next state or -1 if the cell is empty
	 */
	public int getGoto(int state, NonTerminal nonTerminal){
		Integer next = gotoTable.get(state).get(nonTerminal);
		return next == null ? -1 : next;
	}

	public int stateCount(){
		return actionTable.size();
	}

	/**
	 * Is the passed string a word of the grammar?
	 */
	public boolean parse(String input){
		return new LRParser(this).parse(input);
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof LRParserTable)){
			return false;
		}
		LRParserTable other = (LRParserTable)obj;
		return actionTable.equals(other.actionTable) && gotoTable.equals(other.gotoTable);
	}

	@Override
	public int hashCode() {
		return actionTable.hashCode() * 31 + gotoTable.hashCode();
	}

	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder();
		for (int i = 0; i < actionTable.size(); i++){
			if (i != 0){
				builder.append("\n");
			}
			builder.append(String.format("State = %5d: ", i));
			builder.append(" Actions = [");
			Map<Symbol, Action> row = actionTable.get(i);
			List<Symbol> keys = sorted(row.keySet());
			for (int j = 0; j < keys.size(); j++){
				if (j != 0){
					builder.append(", ");
				}
				builder.append(keys.get(j)).append(" = ").append(row.get(keys.get(j)));
			}
			builder.append("] GOTO = [");
			Map<NonTerminal, Integer> gotoRow = gotoTable.get(i);
			List<NonTerminal> nonTerminals = sorted(gotoRow.keySet());
			for (int j = 0; j < nonTerminals.size(); j++){
				if (j != 0){
					builder.append(", ");
				}
				builder.append(nonTerminals.get(j)).append(" = ").append(gotoRow.get(nonTerminals.get(j)));
			}
			builder.append("]");
		}
		return builder.toString();
	}
}
