package geoskel.error;

/**
 * Raised when a container is constructed without a value for a non-spatial
 * coordinate its schema declares.
 */
public class MissingCoordinateException extends GeoSkelException
{
	/**
	 * Name of the coordinate without values
	 */
	private final String m_sCoord;


	public MissingCoordinateException(String sCoord)
	{
		super(String.format("No values given for coordinate '%s'", sCoord));
		m_sCoord = sCoord;
	}


	public String getCoordinate()
	{
		return m_sCoord;
	}
}
