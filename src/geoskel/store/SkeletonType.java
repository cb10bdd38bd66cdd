package geoskel.store;

import geoskel.array.EagerArray;
import geoskel.array.NumericArray;
import geoskel.error.GeoSkelException;
import geoskel.error.UnknownNameException;
import geoskel.schema.CoordGroup;
import geoskel.schema.Coordinate;
import geoskel.schema.DataVar;
import geoskel.schema.DirType;
import geoskel.schema.Direction;
import geoskel.schema.GridMask;
import geoskel.schema.Magnitude;
import geoskel.schema.Param;
import geoskel.schema.Params;
import geoskel.schema.Registry;
import geoskel.system.JSONUtil;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;

/**
 * Immutable container schema: a topology and a registry of coordinates and
 * fields. Every add operation returns a new type built on a private copy of
 * the registry, so a type is never changed by the types derived from it.
 * <pre>
 * SkeletonType oWind = SkeletonType.GRIDDED.named("Wind")
 *	.addTime(true)
 *	.addField("u", Params.X_WIND, CoordGroup.ALL, 0.0)
 *	.addField("v", Params.Y_WIND, CoordGroup.ALL, 0.0)
 *	.addMagnitude("ff", Params.WIND, "u", "v", "dd", Params.WIND_DIR, DirType.FROM);
 * Skeleton oGrid = oWind.create(oCoords, "33W");
 * </pre>
 */
public class SkeletonType
{
	private static final Logger m_oLogger = LogManager.getLogger(SkeletonType.class);

	public enum Topology
	{
		GRIDDED,
		POINT
	}

	/**
	 * Bare rectilinear grid
	 */
	public static final SkeletonType GRIDDED = new SkeletonType("GriddedSkeleton", Topology.GRIDDED, GriddedSkeleton.initialRegistry(), new ArrayList());

	/**
	 * Bare point cloud
	 */
	public static final SkeletonType POINT = new SkeletonType("PointSkeleton", Topology.POINT, PointSkeleton.initialRegistry(), new ArrayList());

	private final String m_sName;

	private final Topology m_eTopology;

	private final Registry m_oRegistry;

	/**
	 * Names that got an accessor when they were added, in order
	 */
	private final List<String> m_oAccessors;


	private SkeletonType(String sName, Topology eTopology, Registry oRegistry, List<String> oAccessors)
	{
		m_sName = sName;
		m_eTopology = eTopology;
		m_oRegistry = oRegistry;
		m_oAccessors = Collections.unmodifiableList(oAccessors);
	}


	/**
	 * @return a copy of the registry and accessor list to build a derived
	 * type on
	 */
	private SkeletonType derive(Registry oRegistry, String... sAccessors)
	{
		ArrayList<String> oAccessors = new ArrayList(m_oAccessors);
		for (String sAccessor : sAccessors)
			oAccessors.add(sAccessor);
		return new SkeletonType(m_sName, m_eTopology, oRegistry, oAccessors);
	}


	public String getName()
	{
		return m_sName;
	}


	public Topology getTopology()
	{
		return m_eTopology;
	}


	/**
	 * @return the registry. Containers copy it, callers must not change it.
	 */
	Registry getRegistry()
	{
		return m_oRegistry;
	}


	/**
	 * @return true for the shared registries of the bare types
	 */
	public boolean isInitialState()
	{
		return m_oRegistry.isInitialState();
	}


	/**
	 * @return names that have accessors, in the order they were added
	 */
	public List<String> accessors()
	{
		return m_oAccessors;
	}


	/**
	 * @param sName type name used in logs and descriptions
	 * @return the same schema under another name
	 */
	public SkeletonType named(String sName)
	{
		return new SkeletonType(sName, m_eTopology, m_oRegistry.copy(), new ArrayList(m_oAccessors));
	}


	/**
	 * Adds a coordinate
	 * @param oCoord coordinate, tagged GRID or GRIDPOINT
	 * @return the extended type
	 * @throws geoskel.error.NameCollisionException if the name is taken
	 */
	public SkeletonType addCoordinate(Coordinate oCoord)
	{
		if (oCoord.getGroup() == CoordGroup.SPATIAL)
			throw new GeoSkelException(String.format("Spatial coordinates are given by the topology, %s cannot be added", oCoord.getName()));
		Registry oRegistry = m_oRegistry.copy();
		oRegistry.addCoordinate(oCoord);
		m_oLogger.debug("{} coordinate {} added", m_sName, oCoord.getName());
		return derive(oRegistry);
	}


	public SkeletonType addCoordinate(String sName, CoordGroup eGroup)
	{
		return addCoordinate(new Coordinate(sName, eGroup));
	}


	/**
	 * Adds the time coordinate, which always comes first in canonical order
	 * @param bGridCoord true if gridded fields are indexed by time
	 * @return the extended type
	 */
	public SkeletonType addTime(boolean bGridCoord)
	{
		return addCoordinate(new Coordinate(Registry.TIME, Params.TIME, bGridCoord ? CoordGroup.GRID : CoordGroup.GRIDPOINT));
	}


	/**
	 * Adds a stored field
	 * @param oVar field descriptor
	 * @return the extended type
	 */
	public SkeletonType addField(DataVar oVar)
	{
		Registry oRegistry = m_oRegistry.copy();
		oRegistry.addVar(oVar);
		m_oLogger.debug("{} field {} added over {}", m_sName, oVar.getName(), oVar.getGroup());
		return derive(oRegistry, oVar.getName());
	}


	public SkeletonType addField(String sName, Param oParam, CoordGroup eGroup, double dDefault)
	{
		return addField(new DataVar(sName, oParam, eGroup, dDefault));
	}


	public SkeletonType addField(String sName, CoordGroup eGroup, double dDefault)
	{
		return addField(new DataVar(sName, eGroup, dDefault));
	}


	/**
	 * Adds a mask stored as "&lt;name&gt;_mask", and its opposite
	 * "&lt;opposite&gt;_mask" if one is named
	 * @param sName mask name without suffix
	 * @param eGroup coordinates the mask is indexed by
	 * @param bDefault value of unset masks
	 * @param sOpposite opposite mask name without suffix, or null
	 * @param sTriggeredBy field whose writes recompute the mask, or null
	 * @param dLower lower bound of the valid range, or null
	 * @param dUpper upper bound of the valid range, or null
	 * @param bLowerInclusive true if the lower bound is valid
	 * @param bUpperInclusive true if the upper bound is valid
	 * @return the extended type
	 * @throws geoskel.error.InvalidRangeException if lower is not below upper
	 * @throws UnknownNameException if the trigger is not registered
	 * @throws GeoSkelException if the trigger is not a stored field indexed
	 * by the same coordinates as the mask
	 */
	public SkeletonType addMask(String sName, CoordGroup eGroup, boolean bDefault, String sOpposite, String sTriggeredBy,
		Double dLower, Double dUpper, boolean bLowerInclusive, boolean bUpperInclusive)
	{
		String sMask = sName + "_mask";
		GridMask oMask = new GridMask(sMask, eGroup, bDefault, sOpposite == null ? null : sOpposite + "_mask", sTriggeredBy,
			dLower, dUpper, bLowerInclusive, bUpperInclusive);
		Registry oRegistry = m_oRegistry.copy();
		oRegistry.addMask(oMask);
		m_oLogger.debug("{} mask {} added", m_sName, sMask);
		if (sOpposite != null)
			return derive(oRegistry, sMask, sOpposite + "_mask");
		return derive(oRegistry, sMask);
	}


	/**
	 * Adds a grid mask with the usual valid range of zero and above, lower
	 * bound inclusive
	 */
	public SkeletonType addMask(String sName, String sOpposite, String sTriggeredBy)
	{
		return addMask(sName, CoordGroup.GRID, false, sOpposite, sTriggeredBy, sTriggeredBy == null ? null : 0.0, null, true, false);
	}


	/**
	 * Adds a magnitude of two stored components, and a direction of the same
	 * components if one is named
	 * @param sName magnitude name
	 * @param oParam magnitude parameter, or null
	 * @param sX x component field
	 * @param sY y component field
	 * @param sDirection direction name, or null
	 * @param oDirParam direction parameter, or null
	 * @param eDirType convention of the direction, null for FROM
	 * @return the extended type
	 * @throws UnknownNameException if a component is not a
	 * stored field
	 */
	public SkeletonType addMagnitude(String sName, Param oParam, String sX, String sY, String sDirection, Param oDirParam, DirType eDirType)
	{
		Registry oRegistry = m_oRegistry.copy();
		CoordGroup eGroup = componentGroup(sX, sY);
		oRegistry.addMagnitude(new Magnitude(sName, oParam, sX, sY, eGroup, sDirection));
		SkeletonType oType = derive(oRegistry, sName);
		if (sDirection != null)
			return oType.addDirection(sDirection, oDirParam, sX, sY, eDirType);
		return oType;
	}


	public SkeletonType addMagnitude(String sName, String sX, String sY)
	{
		return addMagnitude(sName, null, sX, sY, null, null, null);
	}


	/**
	 * Adds a direction of two stored components
	 * @param sName direction name
	 * @param oParam parameter, or null
	 * @param sX x component field
	 * @param sY y component field
	 * @param eDirType convention of the direction, null for FROM
	 * @return the extended type
	 */
	public SkeletonType addDirection(String sName, Param oParam, String sX, String sY, DirType eDirType)
	{
		Registry oRegistry = m_oRegistry.copy();
		oRegistry.addDirection(new Direction(sName, oParam, sX, sY, componentGroup(sX, sY), eDirType == null ? DirType.FROM : eDirType));
		return derive(oRegistry, sName);
	}


	/**
	 * @return the group both components are indexed by
	 */
	private CoordGroup componentGroup(String sX, String sY)
	{
		if (!m_oRegistry.vars(CoordGroup.ALL).contains(sX))
			throw new UnknownNameException(sX);
		if (!m_oRegistry.vars(CoordGroup.ALL).contains(sY))
			throw new UnknownNameException(sY);
		CoordGroup eGroup = m_oRegistry.coordGroup(sX);
		if (eGroup != m_oRegistry.coordGroup(sY))
			throw new GeoSkelException(String.format("Components %s and %s are indexed by different coordinates", sX, sY));
		return eGroup;
	}


	/**
	 * @param eGroup group to select
	 * @return coordinate names of the group in canonical order, for the
	 * type's default cartesian layout
	 */
	public List<String> coordinates(CoordGroup eGroup)
	{
		return m_oRegistry.coords(eGroup);
	}


	public List<String> fields(CoordGroup eGroup)
	{
		return m_oRegistry.fields(eGroup);
	}


	public CoordGroup coordinateGroup(String sName)
	{
		return m_oRegistry.coordGroup(sName);
	}


	public Param physicalParameter(String sName)
	{
		return m_oRegistry.param(sName);
	}


	public double defaultValue(String sName)
	{
		return m_oRegistry.defaultValue(sName);
	}


	/**
	 * Creates a container of this type
	 * @param oCoords coordinate values by name
	 * @param oCrs projection specifier, or null
	 * @return a gridded or point container
	 */
	public Skeleton create(Map<String, double[]> oCoords, Object oCrs)
	{
		if (m_eTopology == Topology.GRIDDED)
			return new GriddedSkeleton(this, oCoords, oCrs);
		return new PointSkeleton(this, oCoords, oCrs);
	}


	public Skeleton create(Map<String, double[]> oCoords)
	{
		return create(oCoords, null);
	}


	/**
	 * Creates a container and fills it from arrays named differently from
	 * the fields
	 * @param oCoords coordinate values by name
	 * @param oFieldMap field name to external name
	 * @param oData arrays by external name
	 * @param oDims axis names by external name, or null where the arrays are
	 * already in canonical order
	 * @param oCrs projection specifier, or null
	 * @return the filled container
	 */
	public Skeleton fromStore(Map<String, double[]> oCoords, Map<String, String> oFieldMap, Map<String, NumericArray> oData,
		Map<String, List<String>> oDims, Object oCrs)
	{
		Skeleton oSkel = create(oCoords, oCrs);
		for (Map.Entry<String, String> oEntry : oFieldMap.entrySet())
		{
			NumericArray oArray = oData.get(oEntry.getValue());
			if (oArray == null)
			{
				m_oLogger.warn("{} has no array named {} for field {}", m_sName, oEntry.getValue(), oEntry.getKey());
				continue;
			}
			List<String> oArrayDims = oDims == null ? null : oDims.get(oEntry.getValue());
			oSkel.set(oEntry.getKey(), oArray, oArrayDims);
		}
		return oSkel;
	}


	/**
	 * Creates a container from the JSON written by {@link Skeleton#toJson()}
	 * @param oJson serialized container
	 * @return the restored container
	 */
	public Skeleton fromJson(JSONObject oJson)
	{
		if (oJson.has("gridded") && oJson.getBoolean("gridded") != (m_eTopology == Topology.GRIDDED))
			throw new GeoSkelException(String.format("Serialized container does not match the topology of %s", m_sName));

		JSONObject oJsonCoords = oJson.getJSONObject("coords");
		HashMap<String, double[]> oCoords = new HashMap();
		for (String sKey : oJsonCoords.keySet())
		{
			if (!sKey.equals("inds"))
				oCoords.put(sKey, JSONUtil.getDoubleArray(oJsonCoords, sKey));
		}
		JSONObject oJsonData = oJson.optJSONObject("data");
		if (m_eTopology == Topology.POINT && oJsonData != null)
		{
			for (String sPos : new String[]{"x", "y", "lon", "lat"})
			{
				if (oJsonData.has(sPos))
					oCoords.put(sPos, JSONUtil.getDoubleArray(oJsonData.getJSONObject(sPos), "values"));
			}
		}
		Object oCrs = oJson.optJSONObject("crs");
		Skeleton oSkel = create(oCoords, oCrs);
		if (oJson.has("name"))
			oSkel.setName(oJson.getString("name"));

		if (oJsonData != null)
		{
			for (String sName : oJsonData.keySet())
			{
				if (m_eTopology == Topology.POINT && oCoords.containsKey(sName))
					continue;
				JSONObject oVar = oJsonData.getJSONObject(sName);
				NumericArray oArray = EagerArray.of(JSONUtil.getDoubleArray(oVar, "values"), JSONUtil.getIntArray(oVar, "shape"));
				if (oVar.optBoolean("integer"))
					oArray = oArray.toInteger();
				oSkel.set(sName, oArray, JSONUtil.getStringList(oVar, "dims"));
			}
		}

		JSONObject oMeta = oJson.optJSONObject("meta");
		if (oMeta != null)
		{
			for (String sKey : oMeta.keySet())
			{
				if (sKey.equals(DataStore.GLOBAL))
					oSkel.setMetadata(null, oMeta.getJSONObject(sKey), true);
				else
					oSkel.setMetadata(sKey, oMeta.getJSONObject(sKey), false);
			}
		}
		return oSkel;
	}


	@Override
	public String toString()
	{
		return String.format("%s (%s) %s", m_sName, m_eTopology, m_oRegistry);
	}
}
