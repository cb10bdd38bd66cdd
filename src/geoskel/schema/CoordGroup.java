package geoskel.schema;

import geoskel.error.GeoSkelException;

/**
 * Named selections of coordinates. Coordinates are tagged SPATIAL, GRID or
 * GRIDPOINT; fields are tagged ALL, SPATIAL, GRID or GRIDPOINT and are
 * indexed by the coordinates their group selects.
 */
public enum CoordGroup
{
	ALL("all"),
	SPATIAL("spatial"),
	NONSPATIAL("nonspatial"),
	GRID("grid"),
	GRIDPOINT("gridpoint");


	private final String m_sName;


	private CoordGroup(String sName)
	{
		m_sName = sName;
	}


	/**
	 * Tells whether a coordinate tagged with the given group belongs to this
	 * selection
	 * @param eTag group a coordinate was registered with
	 * @return true if the coordinate is selected
	 */
	public boolean selects(CoordGroup eTag)
	{
		switch (this)
		{
			case ALL:
				return true;
			case SPATIAL:
				return eTag == SPATIAL;
			case NONSPATIAL:
				return eTag != SPATIAL;
			case GRID:
				return eTag == SPATIAL || eTag == GRID;
			case GRIDPOINT:
				return eTag == GRIDPOINT;
			default:
				return false;
		}
	}


	@Override
	public String toString()
	{
		return m_sName;
	}


	public static CoordGroup fromString(String sName)
	{
		for (CoordGroup eGroup : values())
		{
			if (eGroup.m_sName.equalsIgnoreCase(sName))
				return eGroup;
		}
		throw new GeoSkelException(String.format("Unknown coordinate group '%s'", sName));
	}
}
