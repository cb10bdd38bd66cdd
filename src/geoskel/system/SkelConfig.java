package geoskel.system;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;
import org.json.JSONTokener;

/**
 * Library wide settings. Defaults are read from {@code geoskel.json} on the
 * classpath and then overwritten key by key with the file named by the
 * {@code geoskel.config} system property, if that file exists.
 */
public class SkelConfig
{
	/**
	 * Name of the classpath resource holding the defaults
	 */
	public static final String RESOURCE = "geoskel.json";

	/**
	 * System property naming an override file
	 */
	public static final String PROPERTY = "geoskel.config";

	/**
	 * Log4J logger object
	 */
	private static final Logger m_oLogger = LogManager.getLogger(SkelConfig.class);

	/**
	 * Merged configuration object
	 */
	private final JSONObject m_oConfig;


	/**
	 * Holder for the lazily created singleton
	 */
	private static class Holder
	{
		private static final SkelConfig INSTANCE = load();
	}


	/**
	 * Wraps the given configuration object
	 * @param oConfig configuration values
	 */
	public SkelConfig(JSONObject oConfig)
	{
		m_oConfig = oConfig;
	}


	/**
	 * Get the singleton configuration
	 * @return the process wide configuration
	 */
	public static SkelConfig getInstance()
	{
		return Holder.INSTANCE;
	}


	/**
	 * Reads the classpath defaults and applies the override file
	 * @return the merged configuration
	 */
	static SkelConfig load()
	{
		JSONObject oConfig = new JSONObject();
		try (InputStream oIn = SkelConfig.class.getClassLoader().getResourceAsStream(RESOURCE))
		{
			if (oIn != null)
				merge(oConfig, new JSONObject(new JSONTokener(new InputStreamReader(oIn, StandardCharsets.UTF_8))));
			else
				m_oLogger.debug("No {} on the classpath, using built in defaults", RESOURCE);
		}
		catch (IOException oEx)
		{
			m_oLogger.error(String.format("Failed to load %s", RESOURCE), oEx);
		}

		String sOverride = System.getProperty(PROPERTY);
		if (sOverride != null)
		{
			Path oFile = Paths.get(sOverride);
			if (Files.exists(oFile))
			{
				try (BufferedReader oIn = Files.newBufferedReader(oFile, StandardCharsets.UTF_8))
				{
					merge(oConfig, new JSONObject(new JSONTokener(oIn)));
				}
				catch (IOException oEx)
				{
					m_oLogger.error(String.format("Failed to load configuration override %s", sOverride), oEx);
				}
			}
			else
				m_oLogger.warn("Configuration override {} does not exist", sOverride);
		}
		return new SkelConfig(oConfig);
	}


	/**
	 * Copies every key of the override into the target
	 * @param oConfig object receiving the values
	 * @param oOverWrite values that take precedence
	 */
	private static void merge(JSONObject oConfig, JSONObject oOverWrite)
	{
		for (String sKey : oOverWrite.keySet())
			oConfig.put(sKey, oOverWrite.get(sKey));
	}


	/**
	 * @return true if new containers start in lazy array mode
	 */
	public boolean isLazy()
	{
		return m_oConfig.optBoolean("lazy", false);
	}


	/**
	 * @return true if the reshape engine may transpose two dimensional data
	 */
	public boolean allowTranspose()
	{
		return m_oConfig.optBoolean("transpose", true);
	}


	/**
	 * @return southern latitude limit applied before UTM conversions
	 */
	public double getUtmLatMin()
	{
		return utm().optDouble("latmin", -80.0);
	}


	/**
	 * @return northern latitude limit applied before UTM conversions
	 */
	public double getUtmLatMax()
	{
		return utm().optDouble("latmax", 84.0);
	}


	/**
	 * @return zone such as "33W" used for cartesian containers created
	 * without a projection, or null
	 */
	public String getDefaultUtmZone()
	{
		String sZone = utm().optString("default", "");
		return sZone.isEmpty() ? null : sZone;
	}


	private JSONObject utm()
	{
		JSONObject oUtm = m_oConfig.optJSONObject("utm");
		return oUtm == null ? new JSONObject() : oUtm;
	}
}
