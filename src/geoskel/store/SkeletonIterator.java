package geoskel.store;

import geoskel.array.Shapes;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Walks every combination of indices along a list of coordinates and
 * selects the matching part of a container. The last coordinate changes
 * fastest. With no coordinates the whole container is given once.
 */
public class SkeletonIterator implements Iterator<Skeleton>
{
	private final Skeleton m_oSkel;

	private final String[] m_sCoords;

	private final int[] m_nShape;

	private final int[] m_nCounter;

	private boolean m_bHasNext;


	SkeletonIterator(Skeleton oSkel, List<String> oCoords)
	{
		m_oSkel = oSkel;
		m_sCoords = oCoords.toArray(new String[0]);
		m_nShape = new int[m_sCoords.length];
		for (int nIndex = 0; nIndex < m_sCoords.length; nIndex++)
			m_nShape[nIndex] = oSkel.coordLength(m_sCoords[nIndex]);
		m_nCounter = new int[m_sCoords.length];
		m_bHasNext = Shapes.size(m_nShape) > 0;
	}


	@Override
	public boolean hasNext()
	{
		return m_bHasNext;
	}


	@Override
	public Skeleton next()
	{
		if (!m_bHasNext)
			throw new NoSuchElementException();
		Selection oSel = new Selection();
		for (int nIndex = 0; nIndex < m_sCoords.length; nIndex++)
			oSel.index(m_sCoords[nIndex], m_nCounter[nIndex]);
		m_bHasNext = Shapes.next(m_nCounter, m_nShape);
		return m_oSkel.sel(oSel);
	}
}
