package geoskel.array;

import geoskel.system.SkelConfig;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Per container switch between eager and lazy array storage. Every array a
 * container stores or returns passes through {@link #apply}.
 */
public class ArrayMode
{
	private static final Logger m_oLogger = LogManager.getLogger(ArrayMode.class);

	/**
	 * True while arrays are kept deferred
	 */
	private boolean m_bLazy;


	/**
	 * Creates a mode using the configured default
	 */
	public ArrayMode()
	{
		this(SkelConfig.getInstance().isLazy());
	}


	public ArrayMode(boolean bLazy)
	{
		m_bLazy = bLazy;
	}


	public boolean isLazy()
	{
		return m_bLazy;
	}


	/**
	 * Switches to lazy storage
	 */
	public void activate()
	{
		if (!m_bLazy)
			m_oLogger.debug("Lazy array mode activated");
		m_bLazy = true;
	}


	/**
	 * Switches to eager storage
	 */
	public void deactivate()
	{
		if (m_bLazy)
			m_oLogger.debug("Lazy array mode deactivated");
		m_bLazy = false;
	}


	/**
	 * Brings an array into the form the mode asks for
	 * @param oArray array to convert
	 * @param bRealize null to follow the mode, true to force concrete values,
	 * false to leave the array as it is
	 * @return the converted array
	 */
	public NumericArray apply(NumericArray oArray, Boolean bRealize)
	{
		if (oArray == null)
			return null;
		if (bRealize == null)
			return m_bLazy ? oArray.defer() : oArray.realize();
		if (bRealize)
			return oArray.realize();
		return oArray;
	}


	public NumericArray apply(NumericArray oArray)
	{
		return apply(oArray, null);
	}
}
