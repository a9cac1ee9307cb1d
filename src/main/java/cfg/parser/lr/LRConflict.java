package cfg.parser.lr;

import java.io.Serializable;
import java.util.Objects;

import cfg.grammar.Symbol;

/**
 * Two actions compete for the same cell of the ACTION table, the grammar isn't SLR(1).
 */
public final class LRConflict implements Serializable {

	public enum Kind {
		SHIFT_REDUCE("shift/reduce"),
		/**
		 * Also used for accept/reduce, accepting is reducing with the augmented start production
		 */
		REDUCE_REDUCE("reduce/reduce");

		private final String description;

		Kind(String description) {
			this.description = description;
		}

		static Kind of(LRParserTable.Action existing, LRParserTable.Action conflicting){
			if (existing instanceof LRParserTable.ShiftAction || conflicting instanceof LRParserTable.ShiftAction){
				return SHIFT_REDUCE;
			}
			return REDUCE_REDUCE;
		}

		@Override
		public String toString() {
			return description;
		}
	}

	public final int state;
	/**
	 * Terminal or end marker
	 */
	public final Symbol lookahead;
	public final Kind kind;
	public final LRParserTable.Action existing;
	public final LRParserTable.Action conflicting;

	public LRConflict(int state, Symbol lookahead, LRParserTable.Action existing, LRParserTable.Action conflicting) {
		this.state = state;
		this.lookahead = lookahead;
		this.kind = Kind.of(existing, conflicting);
		this.existing = existing;
		this.conflicting = conflicting;
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof LRConflict)){
			return false;
		}
		LRConflict other = (LRConflict)obj;
		return state == other.state && lookahead.equals(other.lookahead) && kind == other.kind
				&& existing.equals(other.existing) && conflicting.equals(other.conflicting);
	}

	@Override
	public int hashCode() {
		return Objects.hash(state, lookahead, kind, existing, conflicting);
	}

	@Override
	public String toString() {
		return String.format("Not SLR(1): %s conflict in state %d at %s between %s and %s", kind, state, lookahead,
				existing, conflicting);
	}
}
