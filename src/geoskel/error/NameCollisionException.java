package geoskel.error;

/**
 * Raised when a coordinate, field, mask, magnitude or direction is registered
 * under a name that is already in use by the same schema.
 */
public class NameCollisionException extends GeoSkelException
{
	/**
	 * Name that was already taken
	 */
	private final String m_sName;


	/**
	 * Constructs the exception for the given name
	 * @param sName the colliding name
	 */
	public NameCollisionException(String sName)
	{
		super(String.format("Name '%s' is already registered", sName));
		m_sName = sName;
	}


	/**
	 * @return the colliding name
	 */
	public String getName()
	{
		return m_sName;
	}
}
