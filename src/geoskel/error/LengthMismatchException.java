package geoskel.error;

/**
 * Raised when the two spatial vectors of a point container cannot be
 * broadcast to a common length.
 */
public class LengthMismatchException extends GeoSkelException
{
	public LengthMismatchException(String sFirst, int nFirst, String sSecond, int nSecond)
	{
		super(String.format("Length of %s (%d) does not match length of %s (%d)", sFirst, nFirst, sSecond, nSecond));
	}
}
