package geoskel.schema;

/**
 * Direction of the vector given by two stored component fields, reported in
 * a fixed convention unless the reader asks for another.
 */
public class Direction extends Var
{
	private final String m_sX;

	private final String m_sY;

	private final DirType m_eDirType;


	public Direction(String sName, Param oParam, String sX, String sY, CoordGroup eGroup, DirType eDirType)
	{
		super(sName, oParam, eGroup);
		m_sX = sX;
		m_sY = sY;
		m_eDirType = eDirType == null ? DirType.FROM : eDirType;
	}


	@Override
	public VarKind getKind()
	{
		return VarKind.DIRECTION;
	}


	public String getX()
	{
		return m_sX;
	}


	public String getY()
	{
		return m_sY;
	}


	@Override
	public DirType getDirType()
	{
		return m_eDirType;
	}
}
