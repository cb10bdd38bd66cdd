package geoskel.error;

/**
 * Raised when a container is given both cartesian (x/y) and spherical
 * (lon/lat) spatial coordinates.
 */
public class AmbiguousGridException extends GeoSkelException
{
	public AmbiguousGridException()
	{
		super("Both cartesian (x, y) and spherical (lon, lat) coordinates were given");
	}
}
