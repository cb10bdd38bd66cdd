package geoskel.schema;

import geoskel.error.GeoSkelException;
import geoskel.error.InvalidRangeException;
import geoskel.error.NameCollisionException;
import geoskel.error.UnknownNameException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * The set of coordinates, data fields, masks, magnitudes and directions a
 * container type declares. Names are unique across all kinds.
 * <p>
 * A registry built for a base container type starts in its initial state and
 * is shared. Extending a type never changes the shared instance: the
 * extension works on a {@link #copy()}, which is private to the new type and
 * no longer in the initial state.
 */
public class Registry
{
	private static final Logger m_oLogger = LogManager.getLogger(Registry.class);

	/**
	 * Name of the coordinate always placed first in canonical order
	 */
	public static final String TIME = "time";

	private final LinkedHashMap<String, Coordinate> m_oCoords = new LinkedHashMap();

	private final LinkedHashMap<String, DataVar> m_oVars = new LinkedHashMap();

	private final LinkedHashMap<String, GridMask> m_oMasks = new LinkedHashMap();

	private final LinkedHashMap<String, Magnitude> m_oMagnitudes = new LinkedHashMap();

	private final LinkedHashMap<String, Direction> m_oDirections = new LinkedHashMap();

	/**
	 * True until the registry is copied for an extension
	 */
	private final boolean m_bInitialState;


	/**
	 * Creates an empty registry in its initial state
	 */
	public Registry()
	{
		m_bInitialState = true;
	}


	private Registry(Registry oOther)
	{
		m_bInitialState = false;
		m_oCoords.putAll(oOther.m_oCoords);
		m_oVars.putAll(oOther.m_oVars);
		m_oMasks.putAll(oOther.m_oMasks);
		m_oMagnitudes.putAll(oOther.m_oMagnitudes);
		m_oDirections.putAll(oOther.m_oDirections);
	}


	/**
	 * Copies the registry. Descriptors are immutable and shared, the maps are
	 * not, so changing the copy never affects this registry.
	 * @return a private copy that is not in the initial state
	 */
	public Registry copy()
	{
		if (m_bInitialState)
			m_oLogger.debug("Copying initial registry before first change");
		return new Registry(this);
	}


	public boolean isInitialState()
	{
		return m_bInitialState;
	}


	/**
	 * @param sName name to test
	 * @return true if any kind of descriptor uses the name
	 */
	public boolean has(String sName)
	{
		return m_oCoords.containsKey(sName) || m_oVars.containsKey(sName) || m_oMasks.containsKey(sName)
			|| m_oMagnitudes.containsKey(sName) || m_oDirections.containsKey(sName);
	}


	private void checkName(String sName)
	{
		if (has(sName))
			throw new NameCollisionException(sName);
	}


	/**
	 * Adds a coordinate. Fails if the new coordinate would leave a triggered
	 * mask indexed differently from its trigger.
	 * @param oCoord coordinate
	 */
	public void addCoordinate(Coordinate oCoord)
	{
		checkName(oCoord.getName());
		m_oCoords.put(oCoord.getName(), oCoord);
		try
		{
			for (GridMask oMask : m_oMasks.values())
				checkTrigger(oMask);
		}
		catch (GeoSkelException oEx)
		{
			m_oCoords.remove(oCoord.getName());
			throw oEx;
		}
	}


	/**
	 * A trigger must be a stored data field indexed by the same coordinates
	 * as the mask, so each write of the field yields a complete mask.
	 * @param oMask mask to check
	 */
	private void checkTrigger(GridMask oMask)
	{
		String sField = oMask.getTriggeredBy();
		if (sField == null)
			return;
		DataVar oVar = m_oVars.get(sField);
		if (oVar == null)
		{
			if (!has(sField))
				throw new UnknownNameException(sField);
			throw new GeoSkelException(String.format("%s can only be triggered by a stored data field, %s is not one", oMask.getName(), sField));
		}
		List<String> oMaskCoords = coords(oMask.getGroup());
		List<String> oFieldCoords = coords(oVar.getGroup());
		if (!oMaskCoords.equals(oFieldCoords))
			throw new GeoSkelException(String.format("%s over %s cannot be triggered by %s over %s", oMask.getName(), oMaskCoords, sField, oFieldCoords));
	}


	public void addVar(DataVar oVar)
	{
		checkName(oVar.getName());
		m_oVars.put(oVar.getName(), oVar);
	}


	/**
	 * Registers a primary mask and, if it names one, its opposite
	 * @param oMask primary mask
	 */
	public void addMask(GridMask oMask)
	{
		if (oMask.getLower() != null && oMask.getUpper() != null && oMask.getLower() >= oMask.getUpper())
			throw new InvalidRangeException(oMask.getName(), oMask.getLower(), oMask.getUpper());
		checkName(oMask.getName());
		checkTrigger(oMask);
		GridMask oOpposite = oMask.opposite();
		if (oOpposite != null)
		{
			if (oOpposite.getName().equals(oMask.getName()))
				throw new NameCollisionException(oOpposite.getName());
			checkName(oOpposite.getName());
		}
		m_oMasks.put(oMask.getName(), oMask);
		if (oOpposite != null)
			m_oMasks.put(oOpposite.getName(), oOpposite);
	}


	public void addMagnitude(Magnitude oMag)
	{
		checkComponents(oMag.getX(), oMag.getY());
		checkName(oMag.getName());
		m_oMagnitudes.put(oMag.getName(), oMag);
	}


	public void addDirection(Direction oDir)
	{
		checkComponents(oDir.getX(), oDir.getY());
		checkName(oDir.getName());
		m_oDirections.put(oDir.getName(), oDir);
	}


	private void checkComponents(String sX, String sY)
	{
		if (!m_oVars.containsKey(sX))
			throw new UnknownNameException(sX);
		if (!m_oVars.containsKey(sY))
			throw new UnknownNameException(sY);
	}


	/**
	 * Replaces the spatial coordinates and the spatial position fields. Used
	 * when a container decides between cartesian and spherical coordinates.
	 * @param oCoords new spatial coordinates, outermost first
	 * @param oVars new position fields, empty for grids
	 * @param oOldVars names of position fields to drop
	 */
	public void setSpatial(List<Coordinate> oCoords, List<DataVar> oVars, List<String> oOldVars)
	{
		LinkedHashMap<String, Coordinate> oKeep = new LinkedHashMap();
		for (Coordinate oCoord : m_oCoords.values())
		{
			if (oCoord.getGroup() != CoordGroup.SPATIAL)
				oKeep.put(oCoord.getName(), oCoord);
		}
		m_oCoords.clear();
		for (String sOld : oOldVars)
			m_oVars.remove(sOld);

		for (Coordinate oCoord : oCoords)
		{
			checkName(oCoord.getName());
			m_oCoords.put(oCoord.getName(), oCoord);
		}
		for (Coordinate oCoord : oKeep.values())
		{
			checkName(oCoord.getName());
			m_oCoords.put(oCoord.getName(), oCoord);
		}

		LinkedHashMap<String, DataVar> oFields = new LinkedHashMap(m_oVars);
		m_oVars.clear();
		for (DataVar oVar : oVars)
		{
			if (oFields.containsKey(oVar.getName()) || has(oVar.getName()))
				throw new NameCollisionException(oVar.getName());
			m_oVars.put(oVar.getName(), oVar);
		}
		m_oVars.putAll(oFields);
	}


	/**
	 * Lists the coordinates of a group in canonical order: time first, then
	 * the spatial coordinates, then the rest in registration order
	 * @param eGroup group to select
	 * @return ordered coordinate names
	 */
	public List<String> coords(CoordGroup eGroup)
	{
		ArrayList<String> oRet = new ArrayList();
		Coordinate oTime = m_oCoords.get(TIME);
		if (oTime != null && eGroup.selects(oTime.getGroup()))
			oRet.add(TIME);
		for (Coordinate oCoord : m_oCoords.values())
		{
			if (oCoord.getGroup() == CoordGroup.SPATIAL && eGroup.selects(CoordGroup.SPATIAL))
				oRet.add(oCoord.getName());
		}
		for (Coordinate oCoord : m_oCoords.values())
		{
			if (oCoord.getGroup() != CoordGroup.SPATIAL && !oCoord.getName().equals(TIME) && eGroup.selects(oCoord.getGroup()))
				oRet.add(oCoord.getName());
		}
		return oRet;
	}


	private static boolean fieldIn(Var oVar, CoordGroup eGroup)
	{
		switch (eGroup)
		{
			case ALL:
				return true;
			case NONSPATIAL:
				return oVar.getGroup() != CoordGroup.SPATIAL;
			default:
				return oVar.getGroup() == eGroup;
		}
	}


	private static <T extends Var> List<String> select(Map<String, T> oMap, CoordGroup eGroup)
	{
		ArrayList<String> oRet = new ArrayList();
		for (T oVar : oMap.values())
		{
			if (fieldIn(oVar, eGroup))
				oRet.add(oVar.getName());
		}
		return oRet;
	}


	/**
	 * @param eGroup group to select
	 * @return stored data fields indexed by the group
	 */
	public List<String> vars(CoordGroup eGroup)
	{
		return select(m_oVars, eGroup);
	}


	/**
	 * @param eGroup group to select
	 * @param bPrimaryOnly true to leave out opposite masks
	 * @return masks indexed by the group
	 */
	public List<String> masks(CoordGroup eGroup, boolean bPrimaryOnly)
	{
		ArrayList<String> oRet = new ArrayList();
		for (GridMask oMask : m_oMasks.values())
		{
			if (fieldIn(oMask, eGroup) && (oMask.isPrimary() || !bPrimaryOnly))
				oRet.add(oMask.getName());
		}
		return oRet;
	}


	/**
	 * Lists every non coordinate name of a group: data fields, masks,
	 * magnitudes and directions, in that order
	 * @param eGroup group to select
	 * @return field names
	 */
	public List<String> fields(CoordGroup eGroup)
	{
		ArrayList<String> oRet = new ArrayList(vars(eGroup));
		oRet.addAll(masks(eGroup, false));
		oRet.addAll(select(m_oMagnitudes, eGroup));
		oRet.addAll(select(m_oDirections, eGroup));
		return oRet;
	}


	/**
	 * @param sName any registered name
	 * @return its descriptor
	 * @throws UnknownNameException if the name is not registered
	 */
	public Var get(String sName)
	{
		Var oVar = m_oCoords.get(sName);
		if (oVar == null)
			oVar = m_oVars.get(sName);
		if (oVar == null)
			oVar = m_oMasks.get(sName);
		if (oVar == null)
			oVar = m_oMagnitudes.get(sName);
		if (oVar == null)
			oVar = m_oDirections.get(sName);
		if (oVar == null)
			throw new UnknownNameException(sName);
		return oVar;
	}


	public Coordinate getCoordinate(String sName)
	{
		Coordinate oCoord = m_oCoords.get(sName);
		if (oCoord == null)
			throw new UnknownNameException(sName);
		return oCoord;
	}


	public GridMask getMask(String sName)
	{
		GridMask oMask = m_oMasks.get(sName);
		if (oMask == null)
			throw new UnknownNameException(sName);
		return oMask;
	}


	public Magnitude getMagnitude(String sName)
	{
		Magnitude oMag = m_oMagnitudes.get(sName);
		if (oMag == null)
			throw new UnknownNameException(sName);
		return oMag;
	}


	public Direction getDirection(String sName)
	{
		Direction oDir = m_oDirections.get(sName);
		if (oDir == null)
			throw new UnknownNameException(sName);
		return oDir;
	}


	/**
	 * @param sName any registered name
	 * @return the group a field is indexed by, or the group a coordinate is
	 * tagged with
	 */
	public CoordGroup coordGroup(String sName)
	{
		return get(sName).getGroup();
	}


	public Param param(String sName)
	{
		return get(sName).getParam();
	}


	public double defaultValue(String sName)
	{
		return get(sName).getDefault();
	}


	/**
	 * @param sField name of a data field
	 * @return primary masks recomputed when the field is written
	 */
	public List<GridMask> triggeredBy(String sField)
	{
		ArrayList<GridMask> oRet = new ArrayList();
		for (GridMask oMask : m_oMasks.values())
		{
			if (oMask.isPrimary() && sField.equals(oMask.getTriggeredBy()))
				oRet.add(oMask);
		}
		return oRet;
	}


	/**
	 * @return true if positions are x and y
	 */
	public boolean isCartesian()
	{
		return m_oCoords.containsKey("x") || m_oVars.containsKey("x");
	}


	/**
	 * @return true if positions are lon and lat
	 */
	public boolean isSpherical()
	{
		return m_oCoords.containsKey("lon") || m_oVars.containsKey("lon");
	}


	/**
	 * @return true if the only spatial coordinate is a point index
	 */
	public boolean isPointIndexed()
	{
		return m_oCoords.containsKey("inds");
	}


	@Override
	public String toString()
	{
		return String.format("Registry coords=%s vars=%s masks=%s magnitudes=%s directions=%s",
			m_oCoords.keySet(), m_oVars.keySet(), m_oMasks.keySet(), m_oMagnitudes.keySet(), m_oDirections.keySet());
	}
}
