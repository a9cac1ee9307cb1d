package cfg.parser.ll;

import java.io.Serializable;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

import cfg.grammar.Epsilon;
import cfg.grammar.FirstSets;
import cfg.grammar.FollowSets;
import cfg.grammar.Grammar;
import cfg.grammar.NonTerminal;
import cfg.grammar.Production;
import cfg.grammar.Symbol;
import cfg.util.BuildResult;

import static cfg.util.Utils.sorted;

/**
 * Predictive LL(1) parser table, maps a non terminal and a lookahead (terminal or end marker) to the
 * production to expand. Immutable.
 */
public class LLParserTable implements Serializable {

	private static final Logger LOG = Logger.getLogger(LLParserTable.class.getName());

	public final Grammar grammar;

	/**
	 * Maps a non terminal and a lookahead to the executed production.
	 */
	private final Map<NonTerminal, Map<Symbol, Production>> table;

	private LLParserTable(Grammar grammar, Map<NonTerminal, Map<Symbol, Production>> table){
		this.grammar = grammar;
		this.table = table;
	}

	public static BuildResult<LLParserTable, LLConflict> fromGrammar(Grammar grammar){
		return build(grammar, grammar.calculateFirstSets(), grammar.calculateFollowSets());
	}

	/**
	 * Build the table: for each production A → α, A → α is inserted at M[A, a] for every terminal a in
	 * FIRST(α) and, if ε ∈ FIRST(α), at M[A, b] for every b in FOLLOW(A).
	 *
	 * Productions are processed in grammar order and lookaheads in symbol order, so that the reported
	 * conflict is always the same.
	 *
	 * @return the table or the first conflict (a cell that is already occupied by another production)
	 */
	public static BuildResult<LLParserTable, LLConflict> build(Grammar grammar, FirstSets first, FollowSets follow){
		Map<NonTerminal, Map<Symbol, Production>> table = new HashMap<>();
		for (Production production : grammar.getProductions()){
			Set<Symbol> firstSet = first.firstOfString(production.right);
			for (Symbol lookahead : sorted(firstSet)){
				if (lookahead.isEpsilon()){
					continue;
				}
				LLConflict conflict = insertAction(table, production, lookahead, false);
				if (conflict != null){
					return failure(conflict);
				}
			}
			if (firstSet.contains(Epsilon.INSTANCE)){
				for (Symbol lookahead : sorted(follow.get(production.left))){
					LLConflict conflict = insertAction(table, production, lookahead, true);
					if (conflict != null){
						return failure(conflict);
					}
				}
			}
		}
		Map<NonTerminal, Map<Symbol, Production>> frozen = new HashMap<>();
		for (Map.Entry<NonTerminal, Map<Symbol, Production>> entry : table.entrySet()){
			frozen.put(entry.getKey(), Collections.unmodifiableMap(entry.getValue()));
		}
		if (LOG.isLoggable(Level.FINE)){
			LOG.fine(String.format("Built LL(1) table with %d rows", frozen.size()));
		}
		return BuildResult.success(new LLParserTable(grammar, Collections.unmodifiableMap(frozen)));
	}

	private static BuildResult<LLParserTable, LLConflict> failure(LLConflict conflict){
		LOG.info(conflict.toString());
		return BuildResult.failure(conflict);
	}

	/**
	 * @return conflict if the cell is occupied by a different production, null otherwise
	 */
	private static LLConflict insertAction(Map<NonTerminal, Map<Symbol, Production>> table,
	                                       Production production, Symbol lookahead, boolean viaFollow){
		Map<Symbol, Production> row = table.computeIfAbsent(production.left, n -> new HashMap<>());
		Production existing = row.get(lookahead);
		if (existing != null && !existing.equals(production)){
			return new LLConflict(production.left, lookahead, existing, production, viaFollow);
		}
		row.put(lookahead, production);
		return null;
	}

	/**
	 * @return production for the passed cell or null if the cell is empty
	 */
	public Production get(NonTerminal nonTerminal, Symbol lookahead){
		return table.getOrDefault(nonTerminal, Collections.emptyMap()).get(lookahead);
	}

	/**
	 * Number of non empty cells
	 */
	public int size(){
		int size = 0;
		for (Map<Symbol, Production> row : table.values()){
			size += row.size();
		}
		return size;
	}

	/**
	 * Is the passed string a word of the grammar?
	 */
	public boolean parse(String input){
		return new LLParser(this).parse(input);
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof LLParserTable && ((LLParserTable)obj).table.equals(table);
	}

	@Override
	public int hashCode() {
		return table.hashCode();
	}

	/**
	 * One <code>M[A, a] = A → α</code> line per cell, sorted by non terminal and lookahead
	 */
	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder();
		List<NonTerminal> nonTerminals = sorted(table.keySet());
		for (NonTerminal nonTerminal : nonTerminals){
			Map<Symbol, Production> row = table.get(nonTerminal);
			for (Symbol lookahead : sorted(row.keySet())){
				if (builder.length() > 0){
					builder.append("\n");
				}
				builder.append("M[").append(nonTerminal).append(", ").append(lookahead).append("] = ")
						.append(row.get(lookahead));
			}
		}
		return builder.toString();
	}
}
