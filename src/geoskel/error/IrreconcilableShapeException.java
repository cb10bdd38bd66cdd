package geoskel.error;

import java.util.Arrays;

/**
 * Raised when incoming data cannot be brought to the shape a field expects
 * by the allowed reshape steps. Both shapes are kept for the caller.
 */
public class IrreconcilableShapeException extends GeoSkelException
{
	/**
	 * Shape of the data as it was given
	 */
	private final int[] m_nGiven;

	/**
	 * Shape the field expects
	 */
	private final int[] m_nExpected;


	/**
	 * Constructs the exception for the named field
	 * @param sName field the data was set on
	 * @param nGiven shape of the incoming data
	 * @param nExpected shape expected by the container
	 */
	public IrreconcilableShapeException(String sName, int[] nGiven, int[] nExpected)
	{
		super(String.format("Cannot reshape data for '%s' from %s to %s", sName, Arrays.toString(nGiven), Arrays.toString(nExpected)));
		m_nGiven = nGiven.clone();
		m_nExpected = nExpected.clone();
	}


	public int[] getGivenShape()
	{
		return m_nGiven.clone();
	}


	public int[] getExpectedShape()
	{
		return m_nExpected.clone();
	}
}
