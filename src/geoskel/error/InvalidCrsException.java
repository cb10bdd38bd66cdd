package geoskel.error;

/**
 * Raised when a coordinate reference system or UTM zone description cannot
 * be interpreted.
 */
public class InvalidCrsException extends GeoSkelException
{
	public InvalidCrsException(String sMessage)
	{
		super(sMessage);
	}


	public InvalidCrsException(String sMessage, Throwable oCause)
	{
		super(sMessage, oCause);
	}
}
