package geoskel.error;

/**
 * Raised when a read or write names something the schema does not declare.
 */
public class UnknownNameException extends GeoSkelException
{
	public UnknownNameException(String sName)
	{
		super(String.format("'%s' is not declared by this schema", sName));
	}
}
