package geoskel.error;

/**
 * Base class of every error raised by the container library. All of them are
 * unchecked so callers decide where schema and shape problems are handled.
 */
public class GeoSkelException extends RuntimeException
{
	/**
	 * Constructs an exception with the given message
	 * @param sMessage detail message
	 */
	public GeoSkelException(String sMessage)
	{
		super(sMessage);
	}


	/**
	 * Constructs an exception with the given message and cause
	 * @param sMessage detail message
	 * @param oCause underlying error
	 */
	public GeoSkelException(String sMessage, Throwable oCause)
	{
		super(sMessage, oCause);
	}
}
