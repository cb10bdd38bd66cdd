package geoskel.store;

import geoskel.array.NumericArray;
import geoskel.schema.DirType;
import java.util.List;

/**
 * Typed access to one named field of a container.
 * <pre>
 * FieldAccessor oHs = oGrid.field("hs");
 * oHs.set(dValues);
 * NumericArray oValues = oHs.getOrDefault();
 * </pre>
 */
public class FieldAccessor
{
	private final Skeleton m_oSkel;

	private final String m_sName;


	FieldAccessor(Skeleton oSkel, String sName)
	{
		m_oSkel = oSkel;
		m_sName = sName;
	}


	public String getName()
	{
		return m_sName;
	}


	/**
	 * @return stored or derived values, null if unset
	 */
	public NumericArray get()
	{
		return m_oSkel.get(m_sName);
	}


	/**
	 * @return stored or derived values, default values if unset
	 */
	public NumericArray getOrDefault()
	{
		return m_oSkel.get(m_sName, true);
	}


	/**
	 * @param eDir convention of the returned directions
	 * @return directions, default values if unset
	 */
	public NumericArray get(DirType eDir)
	{
		return m_oSkel.get(m_sName, true, eDir, null);
	}


	public NumericArray get(boolean bDefault, DirType eDir, Boolean bRealize)
	{
		return m_oSkel.get(m_sName, bDefault, eDir, bRealize);
	}


	public void set(NumericArray oValue)
	{
		m_oSkel.set(m_sName, oValue);
	}


	public void set(NumericArray oValue, List<String> oDims)
	{
		m_oSkel.set(m_sName, oValue, oDims);
	}


	public void set(double dValue)
	{
		m_oSkel.set(m_sName, dValue);
	}


	public void set(double[] dValues)
	{
		m_oSkel.set(m_sName, dValues);
	}


	public void set(double[][] dValues)
	{
		m_oSkel.set(m_sName, dValues);
	}


	/**
	 * Resets the field to its default values
	 */
	public void reset()
	{
		m_oSkel.set(m_sName);
	}
}
