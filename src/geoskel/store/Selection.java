package geoskel.store;

import geoskel.error.GeoSkelException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Positions to pick along coordinates, by index or by coordinate value.
 * Single picks (an index, a value, the nearest value) remove the axis from
 * read results; ranges keep it. Containers created from a selection keep
 * every axis, with length one for single picks.
 */
public class Selection
{
	/**
	 * Relative tolerance for matching coordinate values exactly
	 */
	private static final double TOLERANCE = 1e-9;

	private enum Kind
	{
		INDEX,
		INDEX_RANGE,
		VALUE,
		NEAREST,
		VALUE_RANGE
	}

	/**
	 * One pick along one coordinate
	 */
	private static class Pick
	{
		private final Kind m_eKind;

		private final double m_dFirst;

		private final double m_dSecond;


		private Pick(Kind eKind, double dFirst, double dSecond)
		{
			m_eKind = eKind;
			m_dFirst = dFirst;
			m_dSecond = dSecond;
		}
	}

	private final LinkedHashMap<String, Pick> m_oPicks = new LinkedHashMap();


	/**
	 * Picks one position by index
	 * @param sCoord coordinate name
	 * @param nIndex zero based index
	 * @return this selection
	 */
	public Selection index(String sCoord, int nIndex)
	{
		m_oPicks.put(sCoord, new Pick(Kind.INDEX, nIndex, nIndex));
		return this;
	}


	/**
	 * Picks the positions from start up to, but not including, end
	 * @param sCoord coordinate name
	 * @param nStart first index
	 * @param nEnd index after the last one
	 * @return this selection
	 */
	public Selection indexRange(String sCoord, int nStart, int nEnd)
	{
		if (nStart >= nEnd)
			throw new IllegalArgumentException(String.format("Empty index range %d to %d for %s", nStart, nEnd, sCoord));
		m_oPicks.put(sCoord, new Pick(Kind.INDEX_RANGE, nStart, nEnd));
		return this;
	}


	/**
	 * Picks the position holding a coordinate value
	 * @param sCoord coordinate name
	 * @param dValue value that must be present in the coordinate
	 * @return this selection
	 */
	public Selection value(String sCoord, double dValue)
	{
		m_oPicks.put(sCoord, new Pick(Kind.VALUE, dValue, dValue));
		return this;
	}


	/**
	 * Picks the position whose coordinate value is closest
	 * @param sCoord coordinate name
	 * @param dValue target value
	 * @return this selection
	 */
	public Selection nearest(String sCoord, double dValue)
	{
		m_oPicks.put(sCoord, new Pick(Kind.NEAREST, dValue, dValue));
		return this;
	}


	/**
	 * Picks every position whose coordinate value lies within the bounds,
	 * both inclusive
	 * @param sCoord coordinate name
	 * @param dLower lower bound
	 * @param dUpper upper bound
	 * @return this selection
	 */
	public Selection range(String sCoord, double dLower, double dUpper)
	{
		if (dLower > dUpper)
			throw new IllegalArgumentException(String.format("Range %f to %f for %s is decreasing", dLower, dUpper, sCoord));
		m_oPicks.put(sCoord, new Pick(Kind.VALUE_RANGE, dLower, dUpper));
		return this;
	}


	/**
	 * @return names of the coordinates picked along, in the order they were
	 * added
	 */
	public Set<String> coords()
	{
		return Collections.unmodifiableSet(m_oPicks.keySet());
	}


	public boolean has(String sCoord)
	{
		return m_oPicks.containsKey(sCoord);
	}


	/**
	 * @param sCoord coordinate name
	 * @return true if the pick is a single position that read results drop
	 */
	public boolean drops(String sCoord)
	{
		Pick oPick = m_oPicks.get(sCoord);
		return oPick != null && oPick.m_eKind != Kind.INDEX_RANGE && oPick.m_eKind != Kind.VALUE_RANGE;
	}


	/**
	 * Resolves the pick along a coordinate to indices
	 * @param sCoord coordinate name
	 * @param dValues the coordinate's values
	 * @return picked indices in coordinate order, all of them if the
	 * coordinate is not picked along
	 * @throws GeoSkelException if a value is not found or a range holds no
	 * values
	 * @throws IndexOutOfBoundsException if an index is outside the coordinate
	 */
	public int[] indices(String sCoord, double[] dValues)
	{
		Pick oPick = m_oPicks.get(sCoord);
		if (oPick == null)
			return all(dValues.length);
		switch (oPick.m_eKind)
		{
			case INDEX:
				return new int[]{checkIndex(sCoord, (int)oPick.m_dFirst, dValues.length)};
			case INDEX_RANGE:
			{
				int nStart = checkIndex(sCoord, (int)oPick.m_dFirst, dValues.length);
				int nEnd = Math.min((int)oPick.m_dSecond, dValues.length);
				int[] nRet = new int[nEnd - nStart];
				for (int nIndex = 0; nIndex < nRet.length; nIndex++)
					nRet[nIndex] = nStart + nIndex;
				return nRet;
			}
			case VALUE:
			{
				for (int nIndex = 0; nIndex < dValues.length; nIndex++)
				{
					if (Math.abs(dValues[nIndex] - oPick.m_dFirst) <= TOLERANCE * Math.max(1.0, Math.abs(oPick.m_dFirst)))
						return new int[]{nIndex};
				}
				throw new GeoSkelException(String.format("%s has no value %s", sCoord, oPick.m_dFirst));
			}
			case NEAREST:
			{
				if (dValues.length == 0)
					throw new GeoSkelException(String.format("%s has no values", sCoord));
				int nBest = 0;
				for (int nIndex = 1; nIndex < dValues.length; nIndex++)
				{
					if (Math.abs(dValues[nIndex] - oPick.m_dFirst) < Math.abs(dValues[nBest] - oPick.m_dFirst))
						nBest = nIndex;
				}
				return new int[]{nBest};
			}
			default:
			{
				ArrayList<Integer> oInside = new ArrayList();
				for (int nIndex = 0; nIndex < dValues.length; nIndex++)
				{
					if (dValues[nIndex] >= oPick.m_dFirst && dValues[nIndex] <= oPick.m_dSecond)
						oInside.add(nIndex);
				}
				if (oInside.isEmpty())
					throw new GeoSkelException(String.format("%s has no values between %s and %s", sCoord, oPick.m_dFirst, oPick.m_dSecond));
				int[] nRet = new int[oInside.size()];
				for (int nIndex = 0; nIndex < nRet.length; nIndex++)
					nRet[nIndex] = oInside.get(nIndex);
				return nRet;
			}
		}
	}


	private static int checkIndex(String sCoord, int nIndex, int nLength)
	{
		if (nIndex < 0 || nIndex >= nLength)
			throw new IndexOutOfBoundsException(String.format("Index %d outside %s of length %d", nIndex, sCoord, nLength));
		return nIndex;
	}


	static int[] all(int nLength)
	{
		int[] nRet = new int[nLength];
		for (int nIndex = 0; nIndex < nLength; nIndex++)
			nRet[nIndex] = nIndex;
		return nRet;
	}


	/**
	 * @param oIndices index by coordinate name
	 * @return selection picking each index
	 */
	public static Selection ofIndices(Map<String, Integer> oIndices)
	{
		Selection oSel = new Selection();
		for (Map.Entry<String, Integer> oEntry : oIndices.entrySet())
			oSel.index(oEntry.getKey(), oEntry.getValue());
		return oSel;
	}


	/**
	 * @param oValues coordinate value by coordinate name
	 * @return selection picking each value
	 */
	public static Selection ofValues(Map<String, Double> oValues)
	{
		Selection oSel = new Selection();
		for (Map.Entry<String, Double> oEntry : oValues.entrySet())
			oSel.value(oEntry.getKey(), oEntry.getValue());
		return oSel;
	}


	@Override
	public String toString()
	{
		StringBuilder sBuf = new StringBuilder("Selection");
		for (Map.Entry<String, Pick> oEntry : m_oPicks.entrySet())
		{
			Pick oPick = oEntry.getValue();
			sBuf.append(' ').append(oEntry.getKey()).append('=').append(oPick.m_eKind.name().toLowerCase())
				.append('(').append(oPick.m_dFirst);
			if (oPick.m_dSecond != oPick.m_dFirst)
				sBuf.append(", ").append(oPick.m_dSecond);
			sBuf.append(')');
		}
		return sBuf.toString();
	}
}
