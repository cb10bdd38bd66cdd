package geoskel.schema;

/**
 * Length of the vector given by two stored component fields.
 */
public class Magnitude extends Var
{
	private final String m_sX;

	private final String m_sY;

	/**
	 * Name of the paired direction, null if there is none
	 */
	private final String m_sDirection;


	public Magnitude(String sName, Param oParam, String sX, String sY, CoordGroup eGroup, String sDirection)
	{
		super(sName, oParam, eGroup);
		m_sX = sX;
		m_sY = sY;
		m_sDirection = sDirection;
	}


	@Override
	public VarKind getKind()
	{
		return VarKind.MAGNITUDE;
	}


	public String getX()
	{
		return m_sX;
	}


	public String getY()
	{
		return m_sY;
	}


	public String getDirection()
	{
		return m_sDirection;
	}
}
