package cfg;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import cfg.grammar.Grammar;
import cfg.parser.ll.LLConflict;
import cfg.parser.ll.LLParserTable;
import cfg.parser.lr.LRConflict;
import cfg.parser.lr.LRParserTable;
import cfg.util.BuildResult;
import cfg.util.Utils;

/**
 * Command line recognizer: reads a grammar in the counted format from standard input, checks whether it
 * is LL(1) and/or SLR(1) and answers <code>yes</code> or <code>no</code> for the strings that follow.
 */
public class Main {

	private static final Logger LOG = Logger.getLogger(Main.class.getName());

	static final String SELECT_PROMPT = "Select a parser (T: for LL(1), B: for SLR(1), Q: quit):";

	public static void main(String[] args) {
		BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
		System.exit(run(in, System.out, System.err));
	}

	/**
	 * @return exit status
	 */
	static int run(BufferedReader in, PrintStream out, PrintStream err){
		try {
			Grammar grammar = Grammar.fromInput(readGrammarLines(in));
			BuildResult<LLParserTable, LLConflict> ll = LLParserTable.fromGrammar(grammar);
			BuildResult<LRParserTable, LRConflict> lr = LRParserTable.fromGrammar(grammar);
			if (Config.debug()){
				printDebugInfo(out, grammar, ll, lr);
			}
			if (ll.isSuccess() && lr.isSuccess()){
				selectParser(in, out, ll.get(), lr.get());
			} else if (ll.isSuccess()){
				out.println("Grammar is LL(1).");
				Utils.parserRepl(in, out, ll.get()::parse);
			} else if (lr.isSuccess()){
				out.println("Grammar is SLR(1).");
				Utils.parserRepl(in, out, lr.get()::parse);
			} else {
				out.println("Grammar is neither LL(1) nor SLR(1).");
			}
			return 0;
		} catch (CFGException ex){
			err.println("Error: " + ex.getMessage());
			return 1;
		} catch (IOException ex){
			LOG.log(Level.SEVERE, "Can't read the input", ex);
			err.println("Error: " + ex.getMessage());
			return 1;
		}
	}

	/**
	 * Read the count line and as many production lines as it announces (fewer at the end of the input).
	 */
	private static List<String> readGrammarLines(BufferedReader in) throws IOException {
		List<String> lines = new ArrayList<>();
		String countLine = in.readLine();
		if (countLine == null){
			return lines;
		}
		lines.add(countLine);
		int count = Grammar.parseCount(countLine);
		String line;
		for (int i = 0; i < count && (line = in.readLine()) != null; i++){
			lines.add(line);
		}
		return lines;
	}

	private static void selectParser(BufferedReader in, PrintStream out, LLParserTable ll, LRParserTable lr)
			throws IOException {
		while (true){
			out.println(SELECT_PROMPT);
			String line = in.readLine();
			if (line == null){
				return;
			}
			switch (line.trim().toUpperCase()){
				case "T":
					Utils.parserRepl(in, out, ll::parse);
					break;
				case "B":
					Utils.parserRepl(in, out, lr::parse);
					break;
				case "Q":
					return;
				default:
					out.println("Unknown option \"" + line.trim() + "\"");
			}
		}
	}

	private static void printDebugInfo(PrintStream out, Grammar grammar, BuildResult<LLParserTable, LLConflict> ll,
			BuildResult<LRParserTable, LRConflict> lr){
		out.println(grammar.longDescription());
		out.println(grammar.calculateFirstSets());
		out.println(grammar.calculateFollowSets());
		out.println(ll.isSuccess() ? ll.get() : ll.conflict());
		if (lr.isSuccess()){
			out.println(lr.get().graph);
			out.println(lr.get());
		} else {
			out.println(lr.conflict());
		}
	}
}
