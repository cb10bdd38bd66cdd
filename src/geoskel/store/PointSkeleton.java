package geoskel.store;

import geoskel.array.EagerArray;
import geoskel.array.NumericArray;
import geoskel.error.GeoSkelException;
import geoskel.error.LengthMismatchException;
import geoskel.geosrv.ProjManager;
import geoskel.schema.CoordGroup;
import geoskel.schema.Coordinate;
import geoskel.schema.DataVar;
import geoskel.schema.Registry;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Unstructured points. The only spatial coordinate is the point index
 * "inds"; the positions are stored as fields over it.
 */
public class PointSkeleton extends Skeleton
{
	/**
	 * Names of every possible position field
	 */
	private static final List<String> POSITION_FIELDS = Arrays.asList("x", "y", "lon", "lat");


	/**
	 * @return registry of bare points, index coordinate and cartesian
	 * positions
	 */
	static Registry initialRegistry()
	{
		Registry oRegistry = new Registry();
		oRegistry.addCoordinate(new Coordinate("inds", CoordGroup.SPATIAL));
		oRegistry.addVar(new DataVar("x", CoordGroup.SPATIAL, 0.0));
		oRegistry.addVar(new DataVar("y", CoordGroup.SPATIAL, 0.0));
		return oRegistry;
	}


	/**
	 * Creates points of a point type
	 * @param oType point schema
	 * @param oCoords coordinate values by name
	 * @param oCrs projection specifier, or null
	 */
	public PointSkeleton(SkeletonType oType, Map<String, double[]> oCoords, Object oCrs)
	{
		super(checkTopology(oType), oCoords, oCrs);
	}


	/**
	 * Creates bare points with no fields
	 */
	public PointSkeleton(Map<String, double[]> oCoords)
	{
		this(SkeletonType.POINT, oCoords, null);
	}


	private static SkeletonType checkTopology(SkeletonType oType)
	{
		if (oType.getTopology() != SkeletonType.Topology.POINT)
			throw new GeoSkelException(String.format("%s is not a point type", oType.getName()));
		return oType;
	}


	/**
	 * Creates points at the positions of another container
	 * @param oType point schema of the result
	 * @param oOther container to take positions from
	 * @param bMask selects the points to keep, null for all
	 * @return points with the other container's positions, non spatial
	 * coordinates and projection
	 */
	public static PointSkeleton fromSkeleton(SkeletonType oType, Skeleton oOther, boolean[] bMask)
	{
		HashMap<String, double[]> oCoords = new HashMap();
		if (oOther.isSpherical())
		{
			double[][] dLonLat = oOther.lonlat(bMask, false, false);
			oCoords.put("lon", dLonLat[0]);
			oCoords.put("lat", dLonLat[1]);
		}
		else
		{
			double[][] dXy = oOther.xy(bMask, false, false, false, null);
			oCoords.put("x", dXy[0]);
			oCoords.put("y", dXy[1]);
		}
		List<String> oOtherCoords = oOther.coords(CoordGroup.NONSPATIAL);
		for (String sCoord : oType.getRegistry().coords(CoordGroup.NONSPATIAL))
		{
			if (oOtherCoords.contains(sCoord))
				oCoords.put(sCoord, oOther.getStore().getCoord(sCoord));
		}
		return new PointSkeleton(oType, oCoords, oOther.getProjection());
	}


	public static PointSkeleton fromSkeleton(Skeleton oOther, boolean[] bMask)
	{
		return fromSkeleton(SkeletonType.POINT, oOther, bMask);
	}


	@Override
	public boolean isGridded()
	{
		return false;
	}


	/**
	 * Repeats single positions to the length of the other vector
	 */
	@Override
	protected void initSpatial(double[] dFirst, double[] dSecond, String sFirst, String sSecond)
	{
		double[] dF = dFirst;
		double[] dS = dSecond;
		if (dF.length != dS.length)
		{
			if (dF.length == 1)
				dF = repeat(dF[0], dS.length);
			else if (dS.length == 1)
				dS = repeat(dS[0], dF.length);
			else
				throw new LengthMismatchException(sFirst, dF.length, sSecond, dS.length);
		}

		m_oRegistry.setSpatial(Collections.singletonList(new Coordinate("inds", CoordGroup.SPATIAL)),
			Arrays.asList(new DataVar(sFirst, CoordGroup.SPATIAL, 0.0), new DataVar(sSecond, CoordGroup.SPATIAL, 0.0)),
			POSITION_FIELDS);
		double[] dInds = new double[dF.length];
		for (int nIndex = 0; nIndex < dInds.length; nIndex++)
			dInds[nIndex] = nIndex;
		m_oStore.setCoord("inds", dInds);
		List<String> oDims = Collections.singletonList("inds");
		m_oStore.put(sFirst, EagerArray.of(dF), oDims);
		m_oStore.put(sSecond, EagerArray.of(dS), oDims);
	}


	private static double[] repeat(double dValue, int nCount)
	{
		double[] dRet = new double[nCount];
		Arrays.fill(dRet, dValue);
		return dRet;
	}


	private double[] position(String sName)
	{
		return m_oStore.get(sName).toDoubleArray();
	}


	@Override
	public double[] x(boolean bNative, boolean bStrict, boolean bNormalize, Object oUtm)
	{
		checkFlags(bNative, bStrict);
		double[] dRet;
		if (isEmpty())
			dRet = new double[0];
		else if (bNative || (!m_bSpherical && isOwnZone(oUtm)))
			dRet = position(xStr());
		else if (m_bSpherical && (bStrict || m_bStrict))
			return null;
		else
			dRet = project(oUtm)[0];
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
			dRet = position(yStr());
		else if (m_bSpherical && (bStrict || m_bStrict))
			return null;
		else
			dRet = project(oUtm)[1];
		return bNormalize ? normalize(dRet) : dRet;
	}


	/**
	 * @param oUtm target projection specifier, null for the container's
	 * @return {x, y} of every point in the target projection
	 */
	private double[][] project(Object oUtm)
	{
		double[] dFirst = position(xStr());
		double[] dSecond = position(yStr());
		if (m_bSpherical)
			return ProjManager.toProjected(projFor(oUtm), dFirst, dSecond);
		double[][] dGeo = m_oProj.toGeographic(dFirst, dSecond);
		return ProjManager.toProjected(projFor(oUtm), dGeo[0], dGeo[1]);
	}


	@Override
	public double[] lon(boolean bNative, boolean bStrict)
	{
		checkFlags(bNative, bStrict);
		if (isEmpty())
			return new double[0];
		if (m_bSpherical || bNative)
			return position(xStr());
		if (bStrict || m_bStrict)
			return null;
		return m_oProj.toGeographic(position("x"), position("y"))[0];
	}


	@Override
	public double[] lat(boolean bNative, boolean bStrict)
	{
		checkFlags(bNative, bStrict);
		if (isEmpty())
			return new double[0];
		if (m_bSpherical || bNative)
			return position(yStr());
		if (bStrict || m_bStrict)
			return null;
		return m_oProj.toGeographic(position("x"), position("y"))[1];
	}


	@Override
	public double[][] xy(boolean[] bMask, boolean bNative, boolean bStrict, boolean bNormalize, Object oUtm)
	{
		checkFlags(bNative, bStrict);
		if (m_bSpherical && bNative)
			return lonlat(bMask, false, false);
		if (m_bSpherical && (bStrict || m_bStrict))
			return null;
		double[][] dRet = new double[][]{x(false, false, false, oUtm), y(false, false, false, oUtm)};
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
		double[][] dRet;
		if (m_bSpherical || isEmpty())
			dRet = new double[][]{position(xStr()), position(yStr())};
		else
			dRet = m_oProj.toGeographic(position("x"), position("y"));
		dRet[0] = select(dRet[0], bMask);
		dRet[1] = select(dRet[1], bMask);
		return dRet;
	}


	private static NumericArray toArray(double[] dValues)
	{
		return dValues == null ? null : EagerArray.of(dValues);
	}


	@Override
	public NumericArray xgrid(boolean bNative, boolean bStrict)
	{
		return toArray(x(bNative, bStrict, false, null));
	}


	@Override
	public NumericArray ygrid(boolean bNative, boolean bStrict)
	{
		return toArray(y(bNative, bStrict, false, null));
	}


	@Override
	public NumericArray longrid(boolean bNative, boolean bStrict)
	{
		return toArray(lon(bNative, bStrict));
	}


	@Override
	public NumericArray latgrid(boolean bNative, boolean bStrict)
	{
		return toArray(lat(bNative, bStrict));
	}
}
