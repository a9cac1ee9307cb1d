package cfg.grammar.random;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.TreeSet;

import cfg.grammar.Grammar;
import cfg.grammar.NonTerminal;
import cfg.grammar.Production;
import cfg.grammar.Symbol;

/**
 * A generator of sentences that are valid for a given grammar, either all sentences up to a derivation
 * length or random ones.
 *
 * Sentences are strings of terminal characters, as accepted by the parsers.
 */
public class SentenceGenerator {

	private final Grammar grammar;
	private final Random rand;
	/**
	 * Weight exponent of each production, productions that add non terminals are drawn less often
	 */
	private final Map<Production, Double> productionLengths = new HashMap<>();

	public SentenceGenerator(Grammar grammar) {
		this(grammar, new Random());
	}

	public SentenceGenerator(Grammar grammar, long seed) {
		this(grammar, new Random(seed));
	}

	private SentenceGenerator(Grammar grammar, Random rand) {
		this.grammar = grammar;
		this.rand = rand;
		for (Production production : grammar.getProductions()) {
			productionLengths.put(production, production.nonTerminals.size() * 2.0);
		}
	}

	/**
	 * All sentences with a leftmost derivation from the start symbol that applies at most
	 * <code>maxSteps</code> productions.
	 *
	 * @return sentences in lexicographic order
	 */
	public Set<String> enumerate(int maxSteps){
		Set<String> sentences = new TreeSet<>();
		List<Symbol> start = new ArrayList<>();
		start.add(grammar.getStart());
		enumerate(start, maxSteps, sentences);
		return Collections.unmodifiableSet(sentences);
	}

	private void enumerate(List<Symbol> sententialForm, int stepsLeft, Set<String> sentences){
		int index = leftmostNonTerminal(sententialForm);
		if (index == -1){
			sentences.add(toSentence(sententialForm));
			return;
		}
		if (stepsLeft == 0){
			return;
		}
		for (Production production : grammar.getProductionsOf((NonTerminal)sententialForm.get(index))){
			enumerate(apply(sententialForm, index, production), stepsLeft - 1, sentences);
		}
	}

	/**
	 * Derive a random sentence by repeatedly replacing the leftmost non terminal.
	 *
	 * @param maxSteps maximum number of applied productions
	 * @return null if no valid sentence is found within the given number of steps
	 */
	public String generateRandomSentence(int maxSteps){
		List<Symbol> sententialForm = new ArrayList<>();
		sententialForm.add(grammar.getStart());
		for (int step = 0; step < maxSteps; step++){
			int index = leftmostNonTerminal(sententialForm);
			if (index == -1){
				return toSentence(sententialForm);
			}
			List<Production> productions = grammar.getProductionsOf((NonTerminal)sententialForm.get(index));
			if (productions.isEmpty()){
				return null;
			}
			sententialForm = apply(sententialForm, index, weightedProduction(0.5, productions));
		}
		return leftmostNonTerminal(sententialForm) == -1 ? toSentence(sententialForm) : null;
	}

	private Production weightedProduction(double factor, List<Production> avProds){
		double sum = 0;
		for (Production avProd : avProds) {
			sum += Math.pow(factor, productionLengths.get(avProd));
		}
		double randomNum = rand.nextDouble() * sum;
		Production ret = avProds.get(avProds.size() - 1);
		sum = 0;
		for (Production avProd : avProds) {
			sum += Math.pow(factor, productionLengths.get(avProd));
			if (randomNum <= sum){
				ret = avProd;
				break;
			}
		}
		return ret;
	}

	private static List<Symbol> apply(List<Symbol> sententialForm, int index, Production production){
		List<Symbol> result = new ArrayList<>(sententialForm.subList(0, index));
		if (!production.isEpsilonProduction()){
			result.addAll(production.right);
		}
		result.addAll(sententialForm.subList(index + 1, sententialForm.size()));
		return result;
	}

	private static int leftmostNonTerminal(List<Symbol> sententialForm){
		for (int i = 0; i < sententialForm.size(); i++){
			if (sententialForm.get(i).isNonTerminal()){
				return i;
			}
		}
		return -1;
	}

	private static String toSentence(List<Symbol> terminals){
		StringBuilder builder = new StringBuilder();
		for (Symbol symbol : terminals){
			builder.append(symbol.value);
		}
		return builder.toString();
	}
}
