package geoskel.schema;

/**
 * A stored numeric field.
 */
public class DataVar extends Var
{
	private final double m_dDefault;

	private final DirType m_eDirType;


	/**
	 * @param sName field name
	 * @param oParam physical parameter, or null to look it up by name
	 * @param eGroup coordinates the field is indexed by
	 * @param dDefault fill value for unset reads
	 * @param eDirType convention of directional values, or null to take the
	 * parameter's
	 */
	public DataVar(String sName, Param oParam, CoordGroup eGroup, double dDefault, DirType eDirType)
	{
		super(sName, oParam, eGroup);
		if (eGroup == CoordGroup.NONSPATIAL)
			throw new IllegalArgumentException(String.format("Field %s cannot use group %s", sName, eGroup));
		m_dDefault = dDefault;
		m_eDirType = eDirType == null ? m_oParam.getDirType() : eDirType;
	}


	public DataVar(String sName, Param oParam, CoordGroup eGroup, double dDefault)
	{
		this(sName, oParam, eGroup, dDefault, null);
	}


	public DataVar(String sName, CoordGroup eGroup, double dDefault)
	{
		this(sName, null, eGroup, dDefault, null);
	}


	@Override
	public VarKind getKind()
	{
		return VarKind.DATA;
	}


	@Override
	public double getDefault()
	{
		return m_dDefault;
	}


	@Override
	public DirType getDirType()
	{
		return m_eDirType;
	}
}
