package geoskel.error;

/**
 * Raised when a mask is declared with a lower bound that is not strictly below
 * its upper bound.
 */
public class InvalidRangeException extends GeoSkelException
{
	public InvalidRangeException(String sMask, Double dLower, Double dUpper)
	{
		super(String.format("Mask '%s' has a non-increasing valid range (%s, %s)", sMask, dLower, dUpper));
	}
}
