package geoskel.schema;

/**
 * A boolean field stored as integers. A primary mask is stored, an opposite
 * mask is the negation of its primary and is never stored. A primary mask may
 * be triggered by a data field, in which case writing that field recomputes
 * the mask from the valid range.
 */
public class GridMask extends Var
{
	/**
	 * True for stored masks
	 */
	private final boolean m_bPrimary;

	/**
	 * Name of the paired mask, null if there is none
	 */
	private final String m_sOpposite;

	/**
	 * Field that recomputes the mask when written, null if there is none
	 */
	private final String m_sTriggeredBy;

	/**
	 * Lower bound of the valid range, null for unbounded
	 */
	private final Double m_dLower;

	/**
	 * Upper bound of the valid range, null for unbounded
	 */
	private final Double m_dUpper;

	private final boolean m_bLowerInclusive;

	private final boolean m_bUpperInclusive;

	/**
	 * Value of unset masks
	 */
	private final boolean m_bDefault;


	/**
	 * Creates a primary mask
	 * @param sName mask name
	 * @param eGroup coordinates the mask is indexed by
	 * @param bDefault value of unset masks
	 * @param sOpposite name of the derived opposite mask, or null
	 * @param sTriggeredBy field that recomputes the mask, or null
	 * @param dLower lower bound of the valid range, or null
	 * @param dUpper upper bound of the valid range, or null
	 * @param bLowerInclusive true if the lower bound is part of the range
	 * @param bUpperInclusive true if the upper bound is part of the range
	 */
	public GridMask(String sName, CoordGroup eGroup, boolean bDefault, String sOpposite, String sTriggeredBy,
		Double dLower, Double dUpper, boolean bLowerInclusive, boolean bUpperInclusive)
	{
		this(sName, eGroup, true, bDefault, sOpposite, sTriggeredBy, dLower, dUpper, bLowerInclusive, bUpperInclusive);
	}


	private GridMask(String sName, CoordGroup eGroup, boolean bPrimary, boolean bDefault, String sOpposite, String sTriggeredBy,
		Double dLower, Double dUpper, boolean bLowerInclusive, boolean bUpperInclusive)
	{
		super(sName, new Param(sName, sName.replace('_', ' '), "-", ""), eGroup);
		if (eGroup == CoordGroup.NONSPATIAL)
			throw new IllegalArgumentException(String.format("Mask %s cannot use group %s", sName, eGroup));
		m_bPrimary = bPrimary;
		m_bDefault = bDefault;
		m_sOpposite = sOpposite;
		m_sTriggeredBy = sTriggeredBy;
		m_dLower = dLower;
		m_dUpper = dUpper;
		m_bLowerInclusive = bLowerInclusive;
		m_bUpperInclusive = bUpperInclusive;
	}


	/**
	 * Creates a primary mask without trigger
	 * @param sName mask name
	 * @param eGroup coordinates the mask is indexed by
	 * @param bDefault value of unset masks
	 * @param sOpposite name of the derived opposite mask, or null
	 */
	public GridMask(String sName, CoordGroup eGroup, boolean bDefault, String sOpposite)
	{
		this(sName, eGroup, bDefault, sOpposite, null, null, null, true, true);
	}


	/**
	 * @return descriptor of the opposite mask, or null if the mask has none
	 */
	public GridMask opposite()
	{
		if (!m_bPrimary || m_sOpposite == null)
			return null;
		return new GridMask(m_sOpposite, m_eGroup, false, !m_bDefault, m_sName, null, null, null, true, true);
	}


	@Override
	public VarKind getKind()
	{
		return VarKind.MASK;
	}


	@Override
	public double getDefault()
	{
		return m_bDefault ? 1.0 : 0.0;
	}


	public boolean isPrimary()
	{
		return m_bPrimary;
	}


	/**
	 * @return for a primary mask its opposite, for an opposite mask its
	 * primary
	 */
	public String getOpposite()
	{
		return m_sOpposite;
	}


	public String getTriggeredBy()
	{
		return m_sTriggeredBy;
	}


	public Double getLower()
	{
		return m_dLower;
	}


	public Double getUpper()
	{
		return m_dUpper;
	}


	/**
	 * Tests a value against the valid range
	 * @param dValue value of the triggering field
	 * @return true if the value lies within the range
	 */
	public boolean inRange(double dValue)
	{
		if (Double.isNaN(dValue))
			return false;
		if (m_dLower != null)
		{
			if (m_bLowerInclusive ? dValue < m_dLower : dValue <= m_dLower)
				return false;
		}
		if (m_dUpper != null)
		{
			if (m_bUpperInclusive ? dValue > m_dUpper : dValue >= m_dUpper)
				return false;
		}
		return true;
	}
}
