package geoskel.schema;

/**
 * Base descriptor of every name a registry holds. Descriptors are immutable
 * so registries can share them between copies.
 */
public abstract class Var
{
	/**
	 * Name, unique within a registry
	 */
	protected final String m_sName;

	/**
	 * Physical parameter
	 */
	protected final Param m_oParam;

	/**
	 * Group tag, for coordinates the group they belong to and for fields the
	 * group of coordinates they are indexed by
	 */
	protected final CoordGroup m_eGroup;


	protected Var(String sName, Param oParam, CoordGroup eGroup)
	{
		if (sName == null || sName.isEmpty())
			throw new IllegalArgumentException("Name must not be empty");
		m_sName = sName;
		m_oParam = oParam == null ? Params.getOrGeneric(sName) : oParam;
		m_eGroup = eGroup;
	}


	public String getName()
	{
		return m_sName;
	}


	public Param getParam()
	{
		return m_oParam;
	}


	public CoordGroup getGroup()
	{
		return m_eGroup;
	}


	/**
	 * @return the kind of descriptor
	 */
	public abstract VarKind getKind();


	/**
	 * @return fill value of default arrays
	 */
	public double getDefault()
	{
		return Double.NaN;
	}


	/**
	 * @return directional convention of the values, or null
	 */
	public DirType getDirType()
	{
		return null;
	}


	@Override
	public String toString()
	{
		return String.format("%s %s (%s)", getKind(), m_sName, m_eGroup);
	}
}
