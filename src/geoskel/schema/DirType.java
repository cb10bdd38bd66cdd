package geoskel.schema;

import geoskel.error.GeoSkelException;

/**
 * Conventions for directional values. FROM and TO are compass degrees
 * measured clockwise from north, MATH is radians counter clockwise from the
 * positive x axis.
 */
public enum DirType
{
	FROM("from", 180.0),
	TO("to", 0.0),
	MATH("math", 0.0);


	/**
	 * Lower case name used in configuration and metadata
	 */
	private final String m_sName;

	/**
	 * Degrees added when converting to and from the mathematical convention
	 */
	private final double m_dOffset;


	private DirType(String sName, double dOffset)
	{
		m_sName = sName;
		m_dOffset = dOffset;
	}


	public double getOffset()
	{
		return m_dOffset;
	}


	@Override
	public String toString()
	{
		return m_sName;
	}


	/**
	 * @param sName "from", "to" or "math", any case
	 * @return the matching convention
	 */
	public static DirType fromString(String sName)
	{
		for (DirType eType : values())
		{
			if (eType.m_sName.equalsIgnoreCase(sName))
				return eType;
		}
		throw new GeoSkelException(String.format("Unknown direction convention '%s'", sName));
	}
}
