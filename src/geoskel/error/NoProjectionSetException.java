package geoskel.error;

/**
 * Raised when a conversion between geographic and projected coordinates is
 * requested before any projection is set on the container.
 */
public class NoProjectionSetException extends GeoSkelException
{
	public NoProjectionSetException()
	{
		super("No projection is set. Set a UTM zone or coordinate reference system first");
	}
}
