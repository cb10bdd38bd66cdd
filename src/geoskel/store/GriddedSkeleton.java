package geoskel.store;

import geoskel.array.EagerArray;
import geoskel.array.NumericArray;
import geoskel.geosrv.GeoUtil;
import geoskel.geosrv.ProjManager;
import geoskel.schema.CoordGroup;
import geoskel.schema.Coordinate;
import geoskel.schema.Registry;
import geoskel.error.GeoSkelException;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Rectilinear grid. The two spatial coordinates are independent axes and
 * the grid is their outer product, y outermost.
 */
public class GriddedSkeleton extends Skeleton
{
	private static final Logger m_oLogger = LogManager.getLogger(GriddedSkeleton.class);


	/**
	 * @return registry of a bare grid, spatial axes y and x
	 */
	static Registry initialRegistry()
	{
		Registry oRegistry = new Registry();
		oRegistry.addCoordinate(new Coordinate("y", CoordGroup.SPATIAL));
		oRegistry.addCoordinate(new Coordinate("x", CoordGroup.SPATIAL));
		return oRegistry;
	}


	/**
	 * Creates a grid of a gridded type
	 * @param oType gridded schema
	 * @param oCoords coordinate values by name
	 * @param oCrs projection specifier, or null
	 */
	public GriddedSkeleton(SkeletonType oType, Map<String, double[]> oCoords, Object oCrs)
	{
		super(checkTopology(oType), oCoords, oCrs);
	}


	/**
	 * Creates a bare grid with no fields
	 */
	public GriddedSkeleton(Map<String, double[]> oCoords)
	{
		this(SkeletonType.GRIDDED, oCoords, null);
	}


	private static SkeletonType checkTopology(SkeletonType oType)
	{
		if (oType.getTopology() != SkeletonType.Topology.GRIDDED)
			throw new GeoSkelException(String.format("%s is not a gridded type", oType.getName()));
		return oType;
	}


	@Override
	public boolean isGridded()
	{
		return true;
	}


	@Override
	protected void initSpatial(double[] dFirst, double[] dSecond, String sFirst, String sSecond)
	{
		m_oRegistry.setSpatial(Arrays.asList(new Coordinate(sSecond, CoordGroup.SPATIAL), new Coordinate(sFirst, CoordGroup.SPATIAL)),
			Collections.emptyList(), Collections.emptyList());
		m_oStore.setCoord(sSecond, dSecond);
		m_oStore.setCoord(sFirst, dFirst);
	}


	/**
	 * @return native x axis values (x or lon)
	 */
	private double[] firstAxis()
	{
		return m_oStore.getCoord(xStr());
	}


	/**
	 * @return native y axis values (y or lat)
	 */
	private double[] secondAxis()
	{
		return m_oStore.getCoord(yStr());
	}


	private static double[] repeat(double dValue, int nCount)
	{
		double[] dRet = new double[nCount];
		Arrays.fill(dRet, dValue);
		return dRet;
	}


	/**
	 * Converts the x axis of a cartesian grid to another projection along
	 * the median y, or projects the lon axis of a spherical grid along the
	 * median lat. Ignores the rotation between the two systems.
	 */
	@Override
	public double[] x(boolean bNative, boolean bStrict, boolean bNormalize, Object oUtm)
	{
		checkFlags(bNative, bStrict);
		double[] dRet;
		if (isEmpty())
			dRet = new double[0];
		else if (bNative || (!m_bSpherical && isOwnZone(oUtm)))
			dRet = firstAxis();
		else if (m_bSpherical && (bStrict || m_bStrict))
			return null;
		else if (m_bSpherical)
		{
			double[] dLon = firstAxis();
			double[] dLat = repeat(GeoUtil.median(secondAxis()), dLon.length);
			dRet = ProjManager.toProjected(projFor(oUtm), dLon, dLat)[0];
		}
		else
		{
			double[] dX = firstAxis();
			double[][] dGeo = m_oProj.toGeographic(dX, repeat(GeoUtil.median(secondAxis()), dX.length));
			dRet = ProjManager.toProjected(projFor(oUtm), dGeo[0], dGeo[1])[0];
		}
		return bNormalize ? normalize(dRet) : dRet;
	}


	@Override
	public double[] y(boolean bNative, boolean bStrict, boolean bNormalize, Object oUtm)
	{
		checkFlags(bNative, bStrict);
		double[] dRet;
		if (isEmpty())
			dRet = new double[0];
		else if (bNative || (!m_bSpherical && isOwnZone(oUtm)))
			dRet = secondAxis();
		else if (m_bSpherical && (bStrict || m_bStrict))
			return null;
		else if (m_bSpherical)
		{
			double[] dLat = secondAxis();
			double[] dLon = repeat(GeoUtil.median(firstAxis()), dLat.length);
			dRet = ProjManager.toProjected(projFor(oUtm), dLon, dLat)[1];
		}
		else
		{
			double[] dY = secondAxis();
			double[][] dGeo = m_oProj.toGeographic(repeat(GeoUtil.median(firstAxis()), dY.length), dY);
			dRet = ProjManager.toProjected(projFor(oUtm), dGeo[0], dGeo[1])[1];
		}
		return bNormalize ? normalize(dRet) : dRet;
	}


	@Override
	public double[] lon(boolean bNative, boolean bStrict)
	{
		checkFlags(bNative, bStrict);
		if (isEmpty())
			return new double[0];
		if (m_bSpherical || bNative)
			return firstAxis();
		if (bStrict || m_bStrict)
			return null;
		double[] dX = firstAxis();
		return m_oProj.toGeographic(dX, repeat(GeoUtil.median(secondAxis()), dX.length))[0];
	}


	@Override
	public double[] lat(boolean bNative, boolean bStrict)
	{
		checkFlags(bNative, bStrict);
		if (isEmpty())
			return new double[0];
		if (m_bSpherical || bNative)
			return secondAxis();
		if (bStrict || m_bStrict)
			return null;
		double[] dY = secondAxis();
		return m_oProj.toGeographic(repeat(GeoUtil.median(firstAxis()), dY.length), dY)[1];
	}


	/**
	 * @return native positions of every grid point, x changing fastest
	 */
	private double[][] mesh()
	{
		double[] dFirst = firstAxis();
		double[] dSecond = secondAxis();
		double[][] dRet = new double[2][dFirst.length * dSecond.length];
		int nIndex = 0;
		for (int nY = 0; nY < dSecond.length; nY++)
		{
			for (int nX = 0; nX < dFirst.length; nX++)
			{
				dRet[0][nIndex] = dFirst[nX];
				dRet[1][nIndex++] = dSecond[nY];
			}
		}
		return dRet;
	}


	@Override
	public double[][] xy(boolean[] bMask, boolean bNative, boolean bStrict, boolean bNormalize, Object oUtm)
	{
		checkFlags(bNative, bStrict);
		if (m_bSpherical && bNative)
			return lonlat(bMask, false, false);
		if (m_bSpherical && (bStrict || m_bStrict))
			return null;
		double[][] dRet = mesh();
		if (dRet[0].length > 0)
		{
			if (m_bSpherical)
				dRet = ProjManager.toProjected(projFor(oUtm), dRet[0], dRet[1]);
			else if (!isOwnZone(oUtm))
			{
				double[][] dGeo = m_oProj.toGeographic(dRet[0], dRet[1]);
				dRet = ProjManager.toProjected(projFor(oUtm), dGeo[0], dGeo[1]);
			}
		}
		dRet[0] = select(dRet[0], bMask);
		dRet[1] = select(dRet[1], bMask);
		if (bNormalize)
		{
			dRet[0] = normalize(dRet[0]);
			dRet[1] = normalize(dRet[1]);
		}
		return dRet;
	}


	@Override
	public double[][] lonlat(boolean[] bMask, boolean bNative, boolean bStrict)
	{
		checkFlags(bNative, bStrict);
		if (!m_bSpherical && bNative)
			return xy(bMask, false, false, false, null);
		if (!m_bSpherical && (bStrict || m_bStrict))
			return null;
		double[][] dRet = mesh();
		if (!m_bSpherical && dRet[0].length > 0)
			dRet = m_oProj.toGeographic(dRet[0], dRet[1]);
		dRet[0] = select(dRet[0], bMask);
		dRet[1] = select(dRet[1], bMask);
		return dRet;
	}


	private NumericArray toGrid(double[] dValues)
	{
		if (dValues == null)
			return null;
		return EagerArray.of(dValues, secondAxis().length, firstAxis().length);
	}


	@Override
	public NumericArray xgrid(boolean bNative, boolean bStrict)
	{
		double[][] dXy = xy(null, bNative, bStrict, false, null);
		return dXy == null ? null : toGrid(dXy[0]);
	}


	@Override
	public NumericArray ygrid(boolean bNative, boolean bStrict)
	{
		double[][] dXy = xy(null, bNative, bStrict, false, null);
		return dXy == null ? null : toGrid(dXy[1]);
	}


	@Override
	public NumericArray longrid(boolean bNative, boolean bStrict)
	{
		double[][] dLonLat = lonlat(null, bNative, bStrict);
		return dLonLat == null ? null : toGrid(dLonLat[0]);
	}


	@Override
	public NumericArray latgrid(boolean bNative, boolean bStrict)
	{
		double[][] dLonLat = lonlat(null, bNative, bStrict);
		return dLonLat == null ? null : toGrid(dLonLat[1]);
	}


	/**
	 * Rebuilds the grid over the same area with new spacing. Stored fields
	 * are dropped. Options are tried in the order point count, degrees,
	 * metres; zero means not given. Without any option an axis keeps its
	 * number of points.
	 * @param nNx number of x points
	 * @param nNy number of y points
	 * @param dDlon longitude spacing in degrees
	 * @param dDlat latitude spacing in degrees
	 * @param dDm spacing in metres for both axes
	 * @param dDx x spacing in metres
	 * @param dDy y spacing in metres
	 * @param bFloatingEdge true to keep the exact spacing and move the far
	 * edge instead, only for native spacing
	 */
	public void setSpacing(int nNx, int nNy, double dDlon, double dDlat, double dDm, double dDx, double dDy, boolean bFloatingEdge)
	{
		if (isEmpty())
			throw new GeoSkelException("Cannot set the spacing of an empty grid");
		double[] dX = axisSpacing("x", "lon", nNx, dDlon, dDm != 0.0 ? dDm : dDx, bFloatingEdge);
		double[] dY = axisSpacing("y", "lat", nNy, dDlat, dDm != 0.0 ? dDm : dDy, bFloatingEdge);
		double[] dFirst = linspace(firstAxis()[0], dX[1], (int)dX[0]);
		double[] dSecond = linspace(secondAxis()[0], dY[1], (int)dY[0]);

		HashMap<String, double[]> oCoords = new HashMap();
		oCoords.put(xStr(), dFirst);
		oCoords.put(yStr(), dSecond);
		m_oLogger.info("{} spacing set to {} x {} points", m_sName, dFirst.length, dSecond.length);
		initStructure(oCoords, getProjection());
	}


	public void setSpacing(int nNx, int nNy)
	{
		setSpacing(nNx, nNy, 0.0, 0.0, 0.0, 0.0, 0.0, false);
	}


	/**
	 * @return {number of points, native end value} of one axis
	 */
	private double[] axisSpacing(String sCart, String sGeo, int nCount, double dDeg, double dMetres, boolean bFloatingEdge)
	{
		double dEnd = edges(sCart, true, false)[1];
		if (nCount > 0)
			return new double[]{nCount, dEnd};
		if (dDeg != 0.0)
		{
			double[] dEdges = edges(sGeo);
			double dN = Math.round((dEdges[1] - dEdges[0]) / dDeg) + 1;
			if (bFloatingEdge)
			{
				if (!m_bSpherical)
					throw new GeoSkelException("Grid is cartesian, exact degree spacing cannot use a floating edge");
				dEnd = dEdges[0] + (dN - 1) * dDeg;
			}
			return new double[]{dN, dEnd};
		}
		if (dMetres != 0.0)
		{
			double[] dEdges = edges(sCart);
			double dN = Math.round((dEdges[1] - dEdges[0]) / dMetres) + 1;
			if (bFloatingEdge)
			{
				if (m_bSpherical)
					throw new GeoSkelException("Grid is spherical, exact metre spacing cannot use a floating edge");
				dEnd = dEdges[0] + (dN - 1) * dMetres;
			}
			return new double[]{dN, dEnd};
		}
		return new double[]{sCart.equals("x") ? nx() : ny(), dEnd};
	}


	/**
	 * Evenly spaced values with repeats removed
	 */
	private static double[] linspace(double dStart, double dEnd, int nCount)
	{
		if (nCount <= 1)
			return new double[]{dStart};
		double[] dRet = new double[nCount];
		double dStep = (dEnd - dStart) / (nCount - 1);
		for (int nIndex = 0; nIndex < nCount; nIndex++)
			dRet[nIndex] = dStart + nIndex * dStep;
		dRet[nCount - 1] = dEnd;
		return Arrays.stream(dRet).distinct().toArray();
	}
}
