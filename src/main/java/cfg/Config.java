package cfg;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileReader;
import java.io.IOException;
import java.util.HashMap;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Global configuration.
 *
 * Defaults are overridden by the <code>key = value</code> lines of {@value #configFile} in the working
 * directory, which are in turn overridden by <code>cfg.key</code> system properties.
 */
public class Config {

	private static final Logger LOG = Logger.getLogger(Config.class.getName());

	public static final String configFile = "cfg.ini";

	private static final Map<String, String> config = new HashMap<String, String>(){{
		put("debug", "no");
		put("maxIterations", "10000");
	}};

	/** Print the tables and the automaton before parsing strings? */
	public static boolean debug(){
		return get("debug").equals("yes");
	}

	/**
	 * Maximum number of passes of a fixed point iteration. The iterations terminate on their own, this
	 * is a guard against bugs.
	 */
	public static int maxIterations(){
		String value = get("maxIterations");
		try {
			return Integer.parseInt(value);
		} catch (NumberFormatException ex){
			throw new CFGException("Invalid value for maxIterations: \"" + value + "\"", ex);
		}
	}

	private static String get(String key){
		return System.getProperty("cfg." + key, config.get(key)).trim();
	}

	private static void loadConfig(){
		File file = new File(configFile);
		if (!file.exists()){
			return;
		}
		try (BufferedReader reader = new BufferedReader(new FileReader(file))) {
			String line;
			while ((line = reader.readLine()) != null){
				if (line.contains(" = ")){
					String[] parts = line.split(" = ", 2);
					if (config.containsKey(parts[0].trim())){
						config.put(parts[0].trim(), parts[1]);
					} else {
						LOG.warning("Unknown config key \"" + parts[0] + "\"");
					}
				}
			}
		} catch (IOException e) {
			LOG.log(Level.WARNING, "Can't read " + configFile + ", using the defaults", e);
		}
	}

	static {
		loadConfig();
	}
}
