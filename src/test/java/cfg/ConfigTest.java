package cfg;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ConfigTest {

	@AfterEach
	public void clearProperties(){
		System.clearProperty("cfg.debug");
		System.clearProperty("cfg.maxIterations");
	}

	@Test
	public void testDefaults(){
		assertFalse(Config.debug());
		assertEquals(10000, Config.maxIterations());
	}

	@Test
	public void testSystemPropertiesOverride(){
		System.setProperty("cfg.debug", "yes");
		System.setProperty("cfg.maxIterations", " 12 ");
		assertTrue(Config.debug());
		assertEquals(12, Config.maxIterations());
	}

	@Test
	public void testInvalidMaxIterations(){
		System.setProperty("cfg.maxIterations", "many");
		assertThrows(CFGException.class, Config::maxIterations);
	}
}
