package geoskel.schema;

import org.json.JSONObject;

/**
 * Physical parameter description attached to a coordinate or field.
 */
public class Param
{
	/**
	 * Short name, for example "hs"
	 */
	private final String m_sName;

	/**
	 * Human readable description
	 */
	private final String m_sLongName;

	/**
	 * Unit string
	 */
	private final String m_sUnit;

	/**
	 * CF standard name, empty if there is none
	 */
	private final String m_sStdName;

	/**
	 * Convention of directional parameters, null for everything else
	 */
	private final DirType m_eDirType;


	public Param(String sName, String sLongName, String sUnit, String sStdName)
	{
		this(sName, sLongName, sUnit, sStdName, inferDirType(sStdName));
	}


	public Param(String sName, String sLongName, String sUnit, String sStdName, DirType eDirType)
	{
		m_sName = sName;
		m_sLongName = sLongName;
		m_sUnit = sUnit;
		m_sStdName = sStdName;
		m_eDirType = eDirType;
	}


	/**
	 * Standard names of directional quantities state the convention as
	 * "from_direction" or "to_direction".
	 * @param sStdName CF standard name
	 * @return the convention, or null if the name is not directional
	 */
	static DirType inferDirType(String sStdName)
	{
		if (sStdName == null)
			return null;
		if (sStdName.contains("from_direction"))
			return DirType.FROM;
		if (sStdName.contains("to_direction"))
			return DirType.TO;
		return null;
	}


	public String getName()
	{
		return m_sName;
	}


	public String getLongName()
	{
		return m_sLongName;
	}


	public String getUnit()
	{
		return m_sUnit;
	}


	public String getStdName()
	{
		return m_sStdName;
	}


	public DirType getDirType()
	{
		return m_eDirType;
	}


	/**
	 * @return attributes describing the parameter, as written to metadata
	 */
	public JSONObject toMeta()
	{
		JSONObject oMeta = new JSONObject();
		oMeta.put("short_name", m_sName);
		oMeta.put("long_name", m_sLongName);
		oMeta.put("units", m_sUnit);
		if (!m_sStdName.isEmpty())
			oMeta.put("standard_name", m_sStdName);
		return oMeta;
	}


	@Override
	public String toString()
	{
		return String.format("%s [%s]", m_sName, m_sUnit);
	}
}
