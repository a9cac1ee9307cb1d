package cfg.parser.ll;

import java.io.Serializable;
import java.util.Objects;

import cfg.grammar.NonTerminal;
import cfg.grammar.Production;
import cfg.grammar.Symbol;

/**
 * Two productions compete for the same cell of the LL(1) table, the grammar isn't LL(1).
 */
public final class LLConflict implements Serializable {

	public final NonTerminal nonTerminal;
	/**
	 * Terminal or end marker
	 */
	public final Symbol lookahead;
	/**
	 * Production already in the cell
	 */
	public final Production existing;
	public final Production conflicting;
	/**
	 * Was the conflicting production inserted because of the FOLLOW set (its right hand side can be
	 * derived to ε)?
	 */
	public final boolean viaFollow;

	public LLConflict(NonTerminal nonTerminal, Symbol lookahead, Production existing, Production conflicting,
	                  boolean viaFollow) {
		this.nonTerminal = nonTerminal;
		this.lookahead = lookahead;
		this.existing = existing;
		this.conflicting = conflicting;
		this.viaFollow = viaFollow;
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof LLConflict)){
			return false;
		}
		LLConflict other = (LLConflict)obj;
		return nonTerminal.equals(other.nonTerminal) && lookahead.equals(other.lookahead)
				&& existing.equals(other.existing) && conflicting.equals(other.conflicting)
				&& viaFollow == other.viaFollow;
	}

	@Override
	public int hashCode() {
		return Objects.hash(nonTerminal, lookahead, existing, conflicting, viaFollow);
	}

	@Override
	public String toString() {
		return String.format("Not LL(1): conflict at M[%s, %s]%s between %s and %s", nonTerminal, lookahead,
				viaFollow ? " (via FOLLOW)" : "", existing, conflicting);
	}
}
