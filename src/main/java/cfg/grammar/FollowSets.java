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
 * The FOLLOW(1) sets of all non terminals of a grammar.
 */
public class FollowSets implements Serializable {

	private static final Logger LOG = Logger.getLogger(FollowSets.class.getName());

	private final Map<NonTerminal, Set<Symbol>> sets;

	private FollowSets(Map<NonTerminal, Set<Symbol>> sets) {
		this.sets = sets;
	}

	/**
	 * Calculate the follow 1 set for all non terminals
	 *
	 * First put $ (the end of input marker) in Follow(S) (S is the start symbol)
	 * If there is a production A → aBb, (where a can be a whole string) then everything in FIRST(b) except for ε is placed in FOLLOW(B).
	 * If there is a production A → aB, then everything in FOLLOW(A) is in FOLLOW(B)
	 * If there is a production A → aBb, where FIRST(b) contains ε, then everything in FOLLOW(A) is in FOLLOW(B)
	 *
	 * Repeat until no set changes.
	 */
	public static FollowSets calculate(Grammar grammar, FirstSets first){
		Map<NonTerminal, Set<Symbol>> follow = new HashMap<>();
		for (NonTerminal nonTerminal : grammar.getNonTerminals()){
			follow.put(nonTerminal, new HashSet<>());
		}
		follow.get(grammar.getStart()).add(EndMarker.INSTANCE);
		int iterations = 0;
		boolean followChanged;
		do {
			followChanged = false;
			if (++iterations > Config.maxIterations()){
				throw new CFGException("FOLLOW set calculation didn't terminate after " + Config.maxIterations() + " passes");
			}
			for (Production production : grammar.getProductions()){
				List<Symbol> right = production.right;
				for (int i = 0; i < right.size(); i++){
					if (!right.get(i).isNonTerminal()){
						continue;
					}
					// non terminals without productions get a FOLLOW set too
					Set<Symbol> followSet = follow.computeIfAbsent((NonTerminal)right.get(i), n -> new HashSet<>());
					Set<Symbol> restFirst = first.firstOfString(right.subList(i + 1, right.size()));
					for (Symbol symbol : restFirst){
						if (!symbol.isEpsilon()){
							followChanged = followSet.add(symbol) || followChanged;
						}
					}
					if (restFirst.contains(Epsilon.INSTANCE)){
						followChanged = followSet.addAll(follow.get(production.left)) || followChanged;
					}
				}
			}
		} while (followChanged);
		if (LOG.isLoggable(Level.FINE)){
			LOG.fine(String.format("FOLLOW sets converged after %d passes", iterations));
		}
		Map<NonTerminal, Set<Symbol>> frozen = new HashMap<>();
		for (Map.Entry<NonTerminal, Set<Symbol>> entry : follow.entrySet()){
			frozen.put(entry.getKey(), Collections.unmodifiableSet(entry.getValue()));
		}
		return new FollowSets(Collections.unmodifiableMap(frozen));
	}

	/**
	 * FOLLOW set of the passed non terminal (terminals and maybe the end marker), empty if unknown
	 */
	public Set<Symbol> get(NonTerminal nonTerminal){
		return sets.getOrDefault(nonTerminal, Collections.emptySet());
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof FollowSets && ((FollowSets)obj).sets.equals(sets);
	}

	@Override
	public int hashCode() {
		return sets.hashCode();
	}

	/**
	 * One <code>FOLLOW(A) = { ... }</code> line per non terminal, sorted
	 */
	@Override
	public String toString() {
		List<NonTerminal> nonTerminals = new ArrayList<>(sets.keySet());
		Collections.sort(nonTerminals);
		List<String> lines = new ArrayList<>();
		for (NonTerminal nonTerminal : nonTerminals){
			lines.add("FOLLOW(" + nonTerminal + ") = " + formatSymbolSet(sets.get(nonTerminal)));
		}
		return String.join("\n", lines);
	}
}
