package cfg.grammar;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

import static cfg.util.Utils.join;

/**
 * Grammar consisting of terminals, non terminals and productions. The start non terminal is always
 * <code>S</code>.
 *
 * Use {@link #fromLines(List)} or {@link #fromInput(List)} to create a grammar from its textual form.
 * A grammar is immutable.
 */
public class Grammar implements Serializable {

	private static final Logger LOG = Logger.getLogger(Grammar.class.getName());

	public static final char START_NAME = 'S';

	public static final String SEPARATOR = "->";

	/**
	 * Non terminals in the order of their first appearance as a left hand side
	 */
	private final Set<NonTerminal> nonTerminals;

	private final List<Production> productions;

	/**
	 * Terminals used in any right hand side, in the order of their first appearance
	 */
	private final Set<Terminal> terminals;

	private final NonTerminal start = new NonTerminal(START_NAME);

	private final Map<NonTerminal, List<Production>> productionsPerNonTerminal;

	private transient FirstSets firstSets;
	private transient FollowSets followSets;

	/**
	 * Create a new Grammar object
	 *
	 * Removes duplicate productions (keeping the first one) and renumbers the remaining ones.
	 *
	 * @param productions productions in their semantically relevant order
	 * @throws GrammarFormatException if there is no production for the start non terminal
	 */
	public Grammar(List<Production> productions) {
		this.productions = Collections.unmodifiableList(removeDuplicateProductions(productions));
		Set<NonTerminal> nonTerminals = new LinkedHashSet<>();
		Set<Terminal> terminals = new LinkedHashSet<>();
		Map<NonTerminal, List<Production>> perNonTerminal = new LinkedHashMap<>();
		for (Production production : this.productions){
			nonTerminals.add(production.left);
			terminals.addAll(production.terminals);
			perNonTerminal.computeIfAbsent(production.left, n -> new ArrayList<>()).add(production);
		}
		perNonTerminal.replaceAll((n, l) -> Collections.unmodifiableList(l));
		this.nonTerminals = Collections.unmodifiableSet(nonTerminals);
		this.terminals = Collections.unmodifiableSet(terminals);
		this.productionsPerNonTerminal = Collections.unmodifiableMap(perNonTerminal);
		if (!perNonTerminal.containsKey(start)){
			throw new GrammarFormatException("No production for the start non terminal " + start);
		}
	}

	/**
	 * Parse a grammar from production lines like <code>S -> aS b</code>. Every space separated
	 * alternative on the right hand side is a production on its own.
	 *
	 * @throws GrammarFormatException if a line is malformed or the start non terminal has no productions
	 */
	public static Grammar fromLines(List<String> lines){
		return fromLines(lines, 1);
	}

	/**
	 * Parse a grammar from the counted input format: the first line contains the number <code>n</code>
	 * of production lines, the remaining <code>n</code> lines the productions.
	 *
	 * @throws GrammarFormatException if the count is missing, invalid or doesn't match the number of lines
	 */
	public static Grammar fromInput(List<String> lines){
		if (lines.isEmpty()){
			throw new GrammarFormatException("Empty grammar input");
		}
		int count = parseCount(lines.get(0));
		List<String> productionLines = lines.subList(1, lines.size());
		if (productionLines.size() != count){
			throw new GrammarFormatException(String.format("Expected %d production lines, got %d", count,
					productionLines.size()));
		}
		return fromLines(productionLines, 2);
	}

	/**
	 * Parse the first line of the counted input format
	 *
	 * @throws GrammarFormatException if the line doesn't contain a non negative integer
	 */
	public static int parseCount(String line){
		int count;
		try {
			count = Integer.parseInt(line.trim());
		} catch (NumberFormatException ex){
			throw new GrammarFormatException(1, "Expected the number of production lines, got \"" + line + "\"");
		}
		if (count < 0){
			throw new GrammarFormatException(1, "Negative number of production lines " + count);
		}
		return count;
	}

	private static Grammar fromLines(List<String> lines, int firstLineNumber){
		List<Production> productions = new ArrayList<>();
		for (int i = 0; i < lines.size(); i++){
			parseProductionLine(lines.get(i), firstLineNumber + i, productions);
		}
		if (productions.isEmpty()){
			throw new GrammarFormatException("Grammar without productions");
		}
		return new Grammar(productions);
	}

	private static void parseProductionLine(String line, int lineNumber, List<Production> acc){
		int sepIndex = line.indexOf(SEPARATOR);
		if (sepIndex == -1){
			throw new GrammarFormatException(lineNumber, "Missing \"" + SEPARATOR + "\" in \"" + line + "\"");
		}
		String left = line.substring(0, sepIndex).trim();
		String right = line.substring(sepIndex + SEPARATOR.length()).trim();
		if (left.length() != 1){
			throw new GrammarFormatException(lineNumber, "Left hand side must be a single character: \"" + left + "\"");
		}
		Symbol lhs = Symbol.of(left.charAt(0));
		if (!lhs.isNonTerminal()){
			throw new GrammarFormatException(lineNumber, "Left hand side must be a non terminal: \"" + left + "\"");
		}
		if (right.isEmpty()){
			throw new GrammarFormatException(lineNumber, "No alternatives for " + lhs);
		}
		for (String alternative : right.split("\\s+")){
			acc.add(new Production(acc.size(), (NonTerminal)lhs, Symbol.listOf(alternative)));
		}
	}

	private static List<Production> removeDuplicateProductions(List<Production> productions){
		Set<Production> seen = new LinkedHashSet<>();
		for (Production production : productions){
			if (!seen.add(production) && LOG.isLoggable(Level.FINE)){
				LOG.fine("Removed duplicate production " + production);
			}
		}
		List<Production> ret = new ArrayList<>();
		for (Production production : seen){
			ret.add(new Production(ret.size(), production.left, production.right));
		}
		return ret;
	}

	/**
	 * Productions of the passed non terminal in grammar order, empty if there are none
	 */
	public List<Production> getProductionsOf(NonTerminal nonTerminal) {
		return productionsPerNonTerminal.getOrDefault(nonTerminal, Collections.emptyList());
	}

	/**
	 * Create the <code>S' → S</code> production of the augmented grammar. Its id follows the ids of
	 * the grammar's productions.
	 */
	public Production augmentedStartProduction(){
		List<Symbol> right = new ArrayList<>();
		right.add(start);
		return new Production(productions.size(), NonTerminal.augmentedStart(start), right);
	}

	public FirstSets calculateFirstSets(){
		if (firstSets == null){
			firstSets = FirstSets.calculate(this);
		}
		return firstSets;
	}

	public FollowSets calculateFollowSets(){
		if (followSets == null){
			followSets = FollowSets.calculate(this, calculateFirstSets());
		}
		return followSets;
	}

	public String longDescription(){
		return "Start non terminal: " + start + "\n" +
				"NonTerminals: " + nonTerminals + "\n" +
				"Terminals: " + terminals + "\n" +
				"Productions: \n" + join(productions, "\n");
	}

	public List<Production> getProductions(){
		return productions;
	}

	public Set<NonTerminal> getNonTerminals() {
		return nonTerminals;
	}

	public Set<Terminal> getTerminals() {
		return terminals;
	}

	public NonTerminal getStart(){
		return start;
	}

	@Override
	public String toString() {
		return join(productions, "\n");
	}
}
