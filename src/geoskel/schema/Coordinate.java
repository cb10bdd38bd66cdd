package geoskel.schema;

/**
 * A named one dimensional axis.
 */
public class Coordinate extends Var
{
	/**
	 * @param sName coordinate name
	 * @param oParam physical parameter, or null to look it up by name
	 * @param eGroup SPATIAL, GRID or GRIDPOINT
	 */
	public Coordinate(String sName, Param oParam, CoordGroup eGroup)
	{
		super(sName, oParam, eGroup);
		if (eGroup != CoordGroup.SPATIAL && eGroup != CoordGroup.GRID && eGroup != CoordGroup.GRIDPOINT)
			throw new IllegalArgumentException(String.format("Coordinate %s cannot be tagged %s", sName, eGroup));
	}


	public Coordinate(String sName, CoordGroup eGroup)
	{
		this(sName, null, eGroup);
	}


	@Override
	public VarKind getKind()
	{
		return VarKind.COORDINATE;
	}
}
