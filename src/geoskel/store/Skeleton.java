package geoskel.store;

import geoskel.array.ArrayMode;
import geoskel.array.EagerArray;
import geoskel.array.NumericArray;
import geoskel.array.Shapes;
import geoskel.comp.DerivedFields;
import geoskel.comp.DirConverter;
import geoskel.comp.ReshapeEngine;
import geoskel.error.AmbiguousGridException;
import geoskel.error.GeoSkelException;
import geoskel.error.LengthMismatchException;
import geoskel.error.MissingCoordinateException;
import geoskel.error.UnknownNameException;
import geoskel.geosrv.CrsFactory;
import geoskel.geosrv.GeoUtil;
import geoskel.geosrv.Proj;
import geoskel.geosrv.ProjManager;
import geoskel.geosrv.UtmZone;
import geoskel.schema.CoordGroup;
import geoskel.schema.DirType;
import geoskel.schema.Direction;
import geoskel.schema.GridMask;
import geoskel.schema.Magnitude;
import geoskel.schema.Param;
import geoskel.schema.Registry;
import geoskel.schema.ShapeResolver;
import geoskel.schema.Var;
import geoskel.schema.VarKind;
import geoskel.system.SkelConfig;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;

/**
 * Container binding a schema to concrete coordinate values. Each instance
 * owns a private copy of its type's registry, a {@link DataStore} of named
 * arrays, a projection and an array mode. Every stored array has the shape
 * of its field's coordinate group in canonical axis order.
 * <p>
 * Subclasses decide the topology: {@link GriddedSkeleton} uses the two
 * spatial vectors as independent axes, {@link PointSkeleton} stores them as
 * fields over a point index.
 */
public abstract class Skeleton implements Iterable<Skeleton>
{
	private static final Logger m_oLogger = LogManager.getLogger(Skeleton.class);

	/**
	 * Names that may be given as spatial coordinates
	 */
	protected static final List<String> SPATIAL_NAMES = Collections.unmodifiableList(Arrays.asList("x", "y", "lon", "lat"));

	/**
	 * Type the container was created from
	 */
	protected final SkeletonType m_oType;

	/**
	 * Private copy of the type's registry
	 */
	protected final Registry m_oRegistry;

	protected final DataStore m_oStore = new DataStore();

	protected final ArrayMode m_oMode;

	protected final ProjManager m_oProj = new ProjManager();

	protected final ReshapeEngine m_oReshape;

	protected String m_sName;

	/**
	 * When true, reads of non native coordinates give null instead of
	 * converting
	 */
	protected boolean m_bStrict;

	/**
	 * True if the positions are lon and lat
	 */
	protected boolean m_bSpherical;


	/**
	 * Creates a container
	 * @param oType schema of the container
	 * @param oCoords coordinate values by name. Give "x" and "y" or "lon" and
	 * "lat" (or neither for an empty cartesian container) plus every other
	 * coordinate the schema declares.
	 * @param oCrs projection specifier, or null to detect one from
	 * geographic positions
	 */
	protected Skeleton(SkeletonType oType, Map<String, double[]> oCoords, Object oCrs)
	{
		m_oType = oType;
		m_oRegistry = oType.getRegistry().copy();
		m_oMode = new ArrayMode();
		m_oReshape = new ReshapeEngine();
		m_sName = oType.getName();
		initStructure(oCoords, oCrs);
	}


	/**
	 * @return true for rectilinear grids
	 */
	public abstract boolean isGridded();


	/**
	 * Sets up the spatial coordinates of the topology
	 * @param dFirst x or lon values
	 * @param dSecond y or lat values
	 * @param sFirst "x" or "lon"
	 * @param sSecond "y" or "lat"
	 */
	protected abstract void initSpatial(double[] dFirst, double[] dSecond, String sFirst, String sSecond);


	/**
	 * Determines the grid type and sets all coordinate values. Stored fields
	 * are dropped. Non spatial coordinates not given keep the values of a
	 * previous structure.
	 * @param oCoords coordinate values by name
	 * @param oCrs projection specifier, or null
	 */
	protected final void initStructure(Map<String, double[]> oCoords, Object oCrs)
	{
		HashMap<String, double[]> oGiven = new HashMap();
		if (oCoords != null)
			oGiven.putAll(oCoords);
		oGiven.remove("inds");

		double[] dX = nonEmpty(oGiven.remove("x"));
		double[] dY = nonEmpty(oGiven.remove("y"));
		double[] dLon = nonEmpty(oGiven.remove("lon"));
		double[] dLat = nonEmpty(oGiven.remove("lat"));
		boolean bCartesian = dX != null || dY != null;
		boolean bSpherical = dLon != null || dLat != null;
		if (bCartesian && bSpherical)
			throw new AmbiguousGridException();

		String sFirst = bSpherical ? "lon" : "x";
		String sSecond = bSpherical ? "lat" : "y";
		double[] dFirst = bSpherical ? dLon : dX;
		double[] dSecond = bSpherical ? dLat : dY;
		if ((dFirst == null) != (dSecond == null))
			throw new LengthMismatchException(sFirst, dFirst == null ? 0 : dFirst.length, sSecond, dSecond == null ? 0 : dSecond.length);
		if (dFirst == null)
		{
			dFirst = new double[0];
			dSecond = new double[0];
		}
		if (bSpherical)
			dFirst = GeoUtil.adjustLon(dFirst);

		HashMap<String, double[]> oPrior = new HashMap();
		for (String sCoord : m_oRegistry.coords(CoordGroup.NONSPATIAL))
		{
			if (m_oStore.hasCoord(sCoord))
				oPrior.put(sCoord, m_oStore.getCoord(sCoord));
		}
		Proj oPriorProj = m_oProj.isSet() ? m_oProj.get() : null;

		m_oStore.clear();
		m_bSpherical = bSpherical;
		initSpatial(dFirst, dSecond, sFirst, sSecond);

		for (String sCoord : m_oRegistry.coords(CoordGroup.NONSPATIAL))
		{
			double[] dValues = oGiven.remove(sCoord);
			if (dValues == null)
				dValues = oPrior.get(sCoord);
			if (dValues == null)
				throw new MissingCoordinateException(sCoord);
			m_oStore.setCoord(sCoord, dValues);
		}
		if (!oGiven.isEmpty())
			throw new UnknownNameException(oGiven.keySet().iterator().next());

		m_oProj.unset();
		Object oUse = oCrs != null ? oCrs : oPriorProj;
		String sDefaultZone = SkelConfig.getInstance().getDefaultUtmZone();
		if (oUse != null)
			setProjection(oUse);
		else if (m_bSpherical && !isEmpty())
			resetProjection();
		else if (!m_bSpherical && sDefaultZone != null)
			setProjection(sDefaultZone);
		else
			updateProjMeta();

		m_oLogger.debug("{} initialized with {} {}", m_sName, m_bSpherical ? "spherical" : "cartesian", Shapes.toString(size(CoordGroup.ALL)));
	}


	/**
	 * @return null for null or empty arrays, the array otherwise
	 */
	private static double[] nonEmpty(double[] dValues)
	{
		if (dValues == null || dValues.length == 0)
			return null;
		return dValues;
	}


	public String getName()
	{
		return m_sName;
	}


	public void setName(String sName)
	{
		m_sName = sName;
	}


	public SkeletonType getType()
	{
		return m_oType;
	}


	public boolean isStrict()
	{
		return m_bStrict;
	}


	public void setStrict(boolean bStrict)
	{
		m_bStrict = bStrict;
	}


	public boolean isCartesian()
	{
		return !m_bSpherical;
	}


	public boolean isSpherical()
	{
		return m_bSpherical;
	}


	/**
	 * @return true if there are no spatial points
	 */
	public boolean isEmpty()
	{
		return Shapes.size(size(CoordGroup.SPATIAL)) == 0;
	}


	/**
	 * @return name of the native x coordinate, "x" or "lon"
	 */
	public String xStr()
	{
		return m_bSpherical ? "lon" : "x";
	}


	/**
	 * @return name of the native y coordinate, "y" or "lat"
	 */
	public String yStr()
	{
		return m_bSpherical ? "lat" : "y";
	}


	/**
	 * @param eGroup coordinate group
	 * @return coordinate names of the group in canonical order
	 */
	public List<String> coords(CoordGroup eGroup)
	{
		return m_oRegistry.coords(eGroup);
	}


	/**
	 * @param eGroup coordinate group
	 * @return field names indexed by the group
	 */
	public List<String> fields(CoordGroup eGroup)
	{
		return m_oRegistry.fields(eGroup);
	}


	/**
	 * @param eGroup coordinate group
	 * @return shape of arrays indexed by the group
	 */
	public int[] size(CoordGroup eGroup)
	{
		return ShapeResolver.shapeOf(m_oRegistry, eGroup, m_oStore.coordValues());
	}


	public int[] size()
	{
		return size(CoordGroup.ALL);
	}


	public CoordGroup coordGroup(String sName)
	{
		return m_oRegistry.coordGroup(sName);
	}


	public Param param(String sName)
	{
		return m_oRegistry.param(sName);
	}


	public double defaultValue(String sName)
	{
		return m_oRegistry.defaultValue(sName);
	}


	/**
	 * @param sName a registered name
	 * @return accessor bound to the name
	 */
	public FieldAccessor field(String sName)
	{
		m_oRegistry.get(sName);
		return new FieldAccessor(this, sName);
	}


	/**
	 * @return true if the field has stored values
	 */
	public boolean isSet(String sName)
	{
		return m_oStore.has(sName);
	}


	/**
	 * @return the backing store
	 */
	public DataStore getStore()
	{
		return m_oStore;
	}


	public NumericArray get(String sName)
	{
		return get(sName, false, null, null);
	}


	public NumericArray get(String sName, boolean bDefault)
	{
		return get(sName, bDefault, null, null);
	}


	/**
	 * Reads a coordinate, field, mask, magnitude or direction
	 * @param sName registered name
	 * @param bDefault true to get an array of default values for unset fields
	 * instead of null
	 * @param eDir convention of directional results, null for the field's own
	 * @param bRealize null to follow the array mode, true to force concrete
	 * values
	 * @return the values, null if the field is unset and no default was
	 * asked for
	 */
	public NumericArray get(String sName, boolean bDefault, DirType eDir, Boolean bRealize)
	{
		return get(sName, bDefault, eDir, bRealize, null);
	}


	/**
	 * Reads part of a coordinate, field, mask, magnitude or direction
	 * @param sName registered name
	 * @param oSel positions to read, coordinates the name is not indexed by
	 * are ignored
	 * @return the selected values, null if the field is unset
	 */
	public NumericArray get(String sName, Selection oSel)
	{
		return get(sName, false, null, null, oSel);
	}


	/**
	 * Reads a coordinate, field, mask, magnitude or direction, or part of it
	 * @param sName registered name
	 * @param bDefault true to get an array of default values for unset fields
	 * instead of null
	 * @param eDir convention of directional results, null for the field's own
	 * @param bRealize null to follow the array mode, true to force concrete
	 * values
	 * @param oSel positions to read, null for all
	 * @return the values, null if the field is unset and no default was
	 * asked for
	 */
	public NumericArray get(String sName, boolean bDefault, DirType eDir, Boolean bRealize, Selection oSel)
	{
		Var oVar = m_oRegistry.get(sName);
		NumericArray oRet;
		switch (oVar.getKind())
		{
			case COORDINATE:
				oRet = EagerArray.of(m_oStore.getCoord(sName));
				break;
			case DATA:
				oRet = getData(oVar, bDefault);
				if (oRet != null && eDir != null)
				{
					if (oVar.getDirType() == null)
						throw new GeoSkelException(String.format("%s is not a directional field", sName));
					oRet = DirConverter.convert(oRet, oVar.getDirType(), eDir);
				}
				break;
			case MASK:
				oRet = getMaskArray((GridMask)oVar, bDefault);
				break;
			case MAGNITUDE:
				oRet = getMagnitude(m_oRegistry.getMagnitude(sName), bDefault);
				break;
			case DIRECTION:
			{
				Direction oDir = m_oRegistry.getDirection(sName);
				oRet = getDirection(oDir, bDefault, eDir == null ? oDir.getDirType() : eDir);
				break;
			}
			default:
				throw new UnknownNameException(sName);
		}
		if (oRet != null && oSel != null)
			oRet = select(oRet, dimsOf(oVar), oSel, true);
		return m_oMode.apply(oRet, bRealize);
	}


	/**
	 * @return stored values, default values, or null
	 */
	private NumericArray getData(Var oVar, boolean bDefault)
	{
		NumericArray oRet = m_oStore.get(oVar.getName());
		if (oRet == null && bDefault)
			oRet = defaultArray(oVar);
		return oRet;
	}


	/**
	 * @return array of the field's shape filled with its default value
	 */
	protected NumericArray defaultArray(Var oVar)
	{
		EagerArray oArray = EagerArray.full(size(oVar.getGroup()), oVar.getDefault());
		if (oVar instanceof GridMask)
			return oArray.toInteger();
		return oArray;
	}


	private NumericArray getMaskArray(GridMask oMask, boolean bDefault)
	{
		if (oMask.isPrimary())
			return getData(oMask, bDefault);
		GridMask oPrimary = m_oRegistry.getMask(oMask.getOpposite());
		NumericArray oValues = getData(oPrimary, bDefault);
		if (oValues == null)
			return null;
		return negate(oValues);
	}


	private static NumericArray negate(NumericArray oMask)
	{
		return oMask.map(dVal -> dVal != 0.0 && !Double.isNaN(dVal) ? 0.0 : 1.0).toInteger();
	}


	private static NumericArray toMask(NumericArray oValues)
	{
		return oValues.map(dVal -> dVal != 0.0 && !Double.isNaN(dVal) ? 1.0 : 0.0).toInteger();
	}


	private NumericArray getMagnitude(Magnitude oMag, boolean bDefault)
	{
		if (!bDefault && !m_oStore.has(oMag.getX()) && !m_oStore.has(oMag.getY()))
			return null;
		return DerivedFields.magnitude(component(oMag.getX()), component(oMag.getY()));
	}


	private NumericArray getDirection(Direction oDir, boolean bDefault, DirType eDir)
	{
		if (!bDefault && !m_oStore.has(oDir.getX()) && !m_oStore.has(oDir.getY()))
			return null;
		return DerivedFields.direction(component(oDir.getX()), component(oDir.getY()), eDir);
	}


	/**
	 * @return stored component values, or defaults if unset
	 */
	private NumericArray component(String sName)
	{
		return getData(m_oRegistry.get(sName), true);
	}


	/**
	 * Reads a mask as booleans in row major order
	 * @param sName primary or opposite mask
	 * @return flat mask values, defaults if unset
	 */
	public boolean[] getMask(String sName)
	{
		if (m_oRegistry.get(sName).getKind() != VarKind.MASK)
			throw new GeoSkelException(String.format("%s is not a mask", sName));
		double[] dValues = get(sName, true, null, true).toDoubleArray();
		boolean[] bRet = new boolean[dValues.length];
		for (int nIndex = 0; nIndex < dValues.length; nIndex++)
			bRet[nIndex] = dValues[nIndex] != 0.0;
		return bRet;
	}


	/**
	 * Resets a field to its default values
	 * @param sName field name
	 */
	public void set(String sName)
	{
		set(sName, (NumericArray)null, null, null);
	}


	/**
	 * Fills a field with one value
	 * @param sName field name
	 * @param dValue value of every element
	 */
	public void set(String sName, double dValue)
	{
		set(sName, EagerArray.full(size(m_oRegistry.coordGroup(sName)), dValue), null, null);
	}


	public void set(String sName, double[] dValues)
	{
		set(sName, EagerArray.of(dValues), null, null);
	}


	public void set(String sName, double[][] dValues)
	{
		set(sName, EagerArray.of(dValues), null, null);
	}


	/**
	 * Sets a mask from booleans given as a one dimensional array
	 * @param sName mask name
	 * @param bValues values
	 */
	public void set(String sName, boolean[] bValues)
	{
		set(sName, EagerArray.ofBooleans(bValues, bValues.length), null, null);
	}


	public void set(String sName, NumericArray oValue)
	{
		set(sName, oValue, null, null);
	}


	public void set(String sName, NumericArray oValue, List<String> oDims)
	{
		set(sName, oValue, oDims, null);
	}


	/**
	 * Writes a field, mask, magnitude or direction. The value is aligned to
	 * the field's shape. Writing a field recomputes the masks it triggers.
	 * @param sName registered name
	 * @param oValue values, or null to reset to default values
	 * @param oDims names of the value's axes in order, or null
	 * @param bRealize null to follow the array mode, true to store concrete
	 * values
	 * @throws geoskel.error.IrreconcilableShapeException if the value cannot
	 * be aligned
	 */
	public void set(String sName, NumericArray oValue, List<String> oDims, Boolean bRealize)
	{
		Var oVar = m_oRegistry.get(sName);
		switch (oVar.getKind())
		{
			case COORDINATE:
				throw new GeoSkelException(String.format("Coordinate %s can only be set when the structure is created", sName));
			case DATA:
				setData(oVar, oValue, oDims, bRealize);
				break;
			case MASK:
			{
				GridMask oMask = (GridMask)oVar;
				if (oMask.isPrimary())
					setData(oMask, oValue, oDims, bRealize);
				else
					setData(m_oRegistry.getMask(oMask.getOpposite()), oValue == null ? null : negate(oValue), oDims, bRealize);
				break;
			}
			case MAGNITUDE:
				setMagnitude(sName, oValue, oDims, bRealize);
				break;
			case DIRECTION:
				setDirection(sName, oValue, null, oDims, bRealize);
				break;
			default:
				throw new UnknownNameException(sName);
		}
	}


	/**
	 * Aligns a data field or primary mask and recomputes the masks it
	 * triggers. Nothing is stored unless every array could be aligned.
	 */
	private void setData(Var oVar, NumericArray oValue, List<String> oDims, Boolean bRealize)
	{
		String sName = oVar.getName();
		List<String> oTargetDims = m_oRegistry.coords(oVar.getGroup());
		int[] nTarget = size(oVar.getGroup());
		NumericArray oAligned;
		if (oValue == null)
			oAligned = defaultArray(oVar);
		else
			oAligned = m_oReshape.align(sName, oValue, oDims, oTargetDims, nTarget);
		if (oVar instanceof GridMask)
			oAligned = toMask(oAligned);

		LinkedHashMap<GridMask, NumericArray> oTriggered = new LinkedHashMap();
		for (GridMask oMask : m_oRegistry.triggeredBy(sName))
		{
			NumericArray oMaskValues = oAligned.map(dVal -> oMask.inRange(dVal) ? 1.0 : 0.0);
			oMaskValues = m_oReshape.align(oMask.getName(), oMaskValues, oTargetDims, m_oRegistry.coords(oMask.getGroup()), size(oMask.getGroup()));
			oTriggered.put(oMask, oMaskValues.toInteger());
		}

		m_oStore.put(sName, m_oMode.apply(oAligned, bRealize), oTargetDims);
		for (Map.Entry<GridMask, NumericArray> oEntry : oTriggered.entrySet())
		{
			GridMask oMask = oEntry.getKey();
			m_oStore.put(oMask.getName(), m_oMode.apply(oEntry.getValue(), bRealize), m_oRegistry.coords(oMask.getGroup()));
			m_oLogger.debug("{} recomputed from {}", oMask.getName(), sName);
		}
	}


	/**
	 * Writes a magnitude by rescaling the stored components, keeping their
	 * direction
	 * @param sName magnitude name
	 * @param oValue new magnitudes, null to reset both components
	 * @param oDims names of the value's axes, or null
	 * @param bRealize array mode override
	 */
	public void setMagnitude(String sName, NumericArray oValue, List<String> oDims, Boolean bRealize)
	{
		Magnitude oMag = m_oRegistry.getMagnitude(sName);
		if (oValue == null)
		{
			setData(m_oRegistry.get(oMag.getX()), null, null, bRealize);
			setData(m_oRegistry.get(oMag.getY()), null, null, bRealize);
			return;
		}
		Var oX = m_oRegistry.get(oMag.getX());
		NumericArray oAligned = m_oReshape.align(sName, oValue, oDims, m_oRegistry.coords(oX.getGroup()), size(oX.getGroup()));
		NumericArray oMath = DerivedFields.mathDirection(component(oMag.getX()), component(oMag.getY()));
		writeComponents(oMag.getX(), oMag.getY(), DerivedFields.decompose(oAligned, oMath), bRealize);
	}


	public void setMagnitude(String sName, double dValue)
	{
		setMagnitude(sName, EagerArray.full(size(m_oRegistry.coordGroup(sName)), dValue), null, null);
	}


	/**
	 * Writes a direction by rotating the stored components, keeping their
	 * magnitude
	 * @param sName direction name
	 * @param oValue new directions, null to reset both components
	 * @param eDir convention of the values, null for the field's own
	 * @param oDims names of the value's axes, or null
	 * @param bRealize array mode override
	 */
	public void setDirection(String sName, NumericArray oValue, DirType eDir, List<String> oDims, Boolean bRealize)
	{
		Direction oDir = m_oRegistry.getDirection(sName);
		if (oValue == null)
		{
			setData(m_oRegistry.get(oDir.getX()), null, null, bRealize);
			setData(m_oRegistry.get(oDir.getY()), null, null, bRealize);
			return;
		}
		Var oX = m_oRegistry.get(oDir.getX());
		NumericArray oAligned = m_oReshape.align(sName, oValue, oDims, m_oRegistry.coords(oX.getGroup()), size(oX.getGroup()));
		NumericArray oMath = DirConverter.toMath(oAligned, eDir == null ? oDir.getDirType() : eDir);
		NumericArray oMagnitude = DerivedFields.magnitude(component(oDir.getX()), component(oDir.getY()));
		writeComponents(oDir.getX(), oDir.getY(), DerivedFields.decompose(oMagnitude, oMath), bRealize);
	}


	public void setDirection(String sName, double dValue, DirType eDir)
	{
		setDirection(sName, EagerArray.full(size(m_oRegistry.coordGroup(sName)), dValue), eDir, null, null);
	}


	private void writeComponents(String sX, String sY, NumericArray[] oComponents, Boolean bRealize)
	{
		setData(m_oRegistry.get(sX), oComponents[0], null, bRealize);
		setData(m_oRegistry.get(sY), oComponents[1], null, bRealize);
	}


	/**
	 * Switches to lazy arrays and defers every stored array
	 */
	public void activateLazy()
	{
		m_oMode.activate();
		m_oStore.replaceAll(NumericArray::defer);
	}


	/**
	 * Switches to eager arrays
	 * @param bRealize true to compute every stored array now
	 */
	public void deactivateLazy(boolean bRealize)
	{
		m_oMode.deactivate();
		if (bRealize)
			m_oStore.replaceAll(NumericArray::realize);
	}


	public boolean isLazy()
	{
		return m_oMode.isLazy();
	}


	/**
	 * Sets the projection used to convert between geographic and projected
	 * coordinates
	 * @param oCrs anything {@link CrsFactory#create(Object)} accepts
	 */
	public void setProjection(Object oCrs)
	{
		m_oProj.set(oCrs);
		updateProjMeta();
	}


	/**
	 * Detects the UTM zone from the geographic positions. Cartesian
	 * containers have no geographic positions to detect from and are left
	 * without projection.
	 */
	public void resetProjection()
	{
		if (m_bSpherical)
		{
			double[][] dLonLat = lonlat(null, true, false);
			m_oProj.reset(dLonLat[0], dLonLat[1]);
		}
		else
		{
			m_oLogger.info("{} is cartesian, projection cleared", m_sName);
			m_oProj.unset();
		}
		updateProjMeta();
	}


	/**
	 * @return the projection, null if none is set
	 */
	public Proj getProjection()
	{
		return m_oProj.isSet() ? m_oProj.get() : null;
	}


	/**
	 * @return the UTM zone, null if unset or not a UTM projection
	 */
	public UtmZone zone()
	{
		return m_oProj.getZone();
	}


	/**
	 * Records the zone of cartesian containers in the global metadata
	 */
	private void updateProjMeta()
	{
		UtmZone oZone = m_oProj.getZone();
		if (!m_bSpherical && oZone != null)
		{
			JSONObject oMeta = new JSONObject();
			oMeta.put("utm_zone", oZone.toString());
			m_oStore.setMeta(DataStore.GLOBAL, oMeta, true);
		}
		else
			m_oStore.removeMeta(DataStore.GLOBAL, "utm_zone");
	}


	/**
	 * @param oUtm target projection specifier, or null for the container's
	 * @return the projection to convert with
	 */
	protected Proj projFor(Object oUtm)
	{
		if (oUtm == null)
			return m_oProj.get();
		return CrsFactory.create(oUtm);
	}


	/**
	 * @param oUtm projection specifier, or null
	 * @return true if no specifier is given or it names the container's UTM
	 * zone
	 */
	protected boolean isOwnZone(Object oUtm)
	{
		if (oUtm == null)
			return true;
		UtmZone oZone = m_oProj.getZone();
		return oZone != null && oZone.equals(CrsFactory.create(oUtm).getZone());
	}


	protected static void checkFlags(boolean bNative, boolean bStrict)
	{
		if (bNative && bStrict)
			throw new IllegalArgumentException("native and strict cannot both be set");
	}


	protected static double[] normalize(double[] dValues)
	{
		double dMin = GeoUtil.min(dValues);
		double[] dRet = new double[dValues.length];
		for (int nIndex = 0; nIndex < dValues.length; nIndex++)
			dRet[nIndex] = dValues[nIndex] - dMin;
		return dRet;
	}


	/**
	 * Keeps the values where the mask is true
	 * @param dValues values, one per spatial point
	 * @param bMask mask, one per spatial point, or null to keep all
	 * @return selected values
	 */
	protected static double[] select(double[] dValues, boolean[] bMask)
	{
		if (bMask == null)
			return dValues;
		if (bMask.length != dValues.length)
			throw new IllegalArgumentException(String.format("Mask has %d values for %d points", bMask.length, dValues.length));
		int nCount = 0;
		for (boolean bVal : bMask)
		{
			if (bVal)
				++nCount;
		}
		double[] dRet = new double[nCount];
		nCount = 0;
		for (int nIndex = 0; nIndex < bMask.length; nIndex++)
		{
			if (bMask[nIndex])
				dRet[nCount++] = dValues[nIndex];
		}
		return dRet;
	}


	public double[] x()
	{
		return x(false, false, false, null);
	}


	/**
	 * Reads the x coordinate. Spherical containers convert with their
	 * projection.
	 * @param bNative true to get lon for spherical containers instead
	 * @param bStrict true to get null for spherical containers instead
	 * @param bNormalize true to subtract the minimum
	 * @param oUtm projection to convert to, null for the container's
	 * @return x values, null if strict and not native
	 */
	public abstract double[] x(boolean bNative, boolean bStrict, boolean bNormalize, Object oUtm);


	public double[] y()
	{
		return y(false, false, false, null);
	}


	public abstract double[] y(boolean bNative, boolean bStrict, boolean bNormalize, Object oUtm);


	public double[] lon()
	{
		return lon(false, false);
	}


	/**
	 * Reads longitudes. Cartesian containers convert with their projection.
	 * @param bNative true to get x for cartesian containers instead
	 * @param bStrict true to get null for cartesian containers instead
	 * @return longitudes, null if strict and not native
	 */
	public abstract double[] lon(boolean bNative, boolean bStrict);


	public double[] lat()
	{
		return lat(false, false);
	}


	public abstract double[] lat(boolean bNative, boolean bStrict);


	public double[][] xy()
	{
		return xy(null, false, false, false, null);
	}


	/**
	 * Positions of all points, for grids the raveled mesh with x changing
	 * fastest
	 * @param bMask selects points, null for all
	 * @param bNative true to get lon/lat for spherical containers instead
	 * @param bStrict true to get null for spherical containers instead
	 * @param bNormalize true to subtract the minimum from each coordinate
	 * @param oUtm projection to convert to, null for the container's
	 * @return {x, y}, or null
	 */
	public abstract double[][] xy(boolean[] bMask, boolean bNative, boolean bStrict, boolean bNormalize, Object oUtm);


	public double[][] lonlat()
	{
		return lonlat(null, false, false);
	}


	public abstract double[][] lonlat(boolean[] bMask, boolean bNative, boolean bStrict);


	/**
	 * @param bNative as for {@link #x(boolean, boolean, boolean, Object)}
	 * @param bStrict as for {@link #x(boolean, boolean, boolean, Object)}
	 * @return x of every point, shaped like the spatial grid
	 */
	public abstract NumericArray xgrid(boolean bNative, boolean bStrict);


	public abstract NumericArray ygrid(boolean bNative, boolean bStrict);


	public abstract NumericArray longrid(boolean bNative, boolean bStrict);


	public abstract NumericArray latgrid(boolean bNative, boolean bStrict);


	/**
	 * Smallest and largest value of a position coordinate
	 * @param sCoord "x", "y", "lon" or "lat"
	 * @param bNative true to use native values
	 * @param bStrict true to give null instead of converting
	 * @return {min, max}, or null if the container is empty or strict
	 */
	public double[] edges(String sCoord, boolean bNative, boolean bStrict)
	{
		if (isEmpty())
			return null;
		double[][] dPos;
		switch (sCoord)
		{
			case "x":
			case "y":
				dPos = xy(null, bNative, bStrict, false, null);
				break;
			case "lon":
			case "lat":
				dPos = lonlat(null, bNative, bStrict);
				break;
			default:
				throw new IllegalArgumentException(String.format("Coordinate must be x, y, lon or lat, not %s", sCoord));
		}
		if (dPos == null)
			return null;
		double[] dVals = sCoord.equals("x") || sCoord.equals("lon") ? dPos[0] : dPos[1];
		return new double[]{GeoUtil.min(dVals), GeoUtil.max(dVals)};
	}


	public double[] edges(String sCoord)
	{
		return edges(sCoord, false, false);
	}


	/**
	 * @return number of native x values
	 */
	public int nx()
	{
		if (isEmpty())
			return 0;
		return x(true, false, false, null).length;
	}


	/**
	 * @return number of native y values
	 */
	public int ny()
	{
		if (isEmpty())
			return 0;
		return y(true, false, false, null).length;
	}


	/**
	 * Mean spacing of the x values
	 * @param bNative true to use lon for spherical containers
	 * @param bStrict true to give null for spherical containers
	 * @return spacing, null if empty or strict
	 */
	public Double dx(boolean bNative, boolean bStrict)
	{
		if (isEmpty() || (m_bSpherical && (bStrict || m_bStrict) && !bNative))
			return null;
		return spacing(x(bNative, false, false, null), nx());
	}


	public Double dy(boolean bNative, boolean bStrict)
	{
		if (isEmpty() || (m_bSpherical && (bStrict || m_bStrict) && !bNative))
			return null;
		return spacing(y(bNative, false, false, null), ny());
	}


	public Double dlon(boolean bNative, boolean bStrict)
	{
		if (isEmpty() || (!m_bSpherical && (bStrict || m_bStrict) && !bNative))
			return null;
		return spacing(lon(bNative, false), nx());
	}


	public Double dlat(boolean bNative, boolean bStrict)
	{
		if (isEmpty() || (!m_bSpherical && (bStrict || m_bStrict) && !bNative))
			return null;
		return spacing(lat(bNative, false), ny());
	}


	private static Double spacing(double[] dValues, int nCount)
	{
		if (nCount <= 1)
			return 0.0;
		return (GeoUtil.max(dValues) - GeoUtil.min(dValues)) / (nCount - 1);
	}


	/**
	 * @return names of the axes the values of a name are laid out along
	 */
	private List<String> dimsOf(Var oVar)
	{
		if (oVar.getKind() == VarKind.COORDINATE)
			return Collections.singletonList(oVar.getName());
		return m_oRegistry.coords(oVar.getGroup());
	}


	/**
	 * @throws UnknownNameException if the selection names something that is
	 * not a coordinate
	 */
	private void checkSelection(Selection oSel)
	{
		List<String> oCoords = m_oRegistry.coords(CoordGroup.ALL);
		for (String sCoord : oSel.coords())
		{
			if (!oCoords.contains(sCoord))
				throw new UnknownNameException(sCoord);
		}
	}


	/**
	 * Picks positions along every selected axis of an array
	 * @param oArray values laid out along the dimensions
	 * @param oDims axis names
	 * @param oSel positions to pick
	 * @param bDrop true to remove axes of single picks
	 * @return the picked values
	 */
	private NumericArray select(NumericArray oArray, List<String> oDims, Selection oSel, boolean bDrop)
	{
		checkSelection(oSel);
		NumericArray oRet = oArray;
		for (int nAxis = 0; nAxis < oDims.size(); nAxis++)
		{
			String sDim = oDims.get(nAxis);
			if (oSel.has(sDim))
				oRet = oRet.take(nAxis, oSel.indices(sDim, m_oStore.getCoord(sDim)));
		}
		if (bDrop)
		{
			for (int nAxis = oDims.size() - 1; nAxis >= 0; nAxis--)
			{
				if (oSel.drops(oDims.get(nAxis)))
					oRet = oRet.reduce(nAxis);
			}
		}
		return oRet;
	}


	/**
	 * @return true for the names of point positions, which are rebuilt
	 * together with the structure
	 */
	private boolean isPosition(String sName)
	{
		return !isGridded() && (sName.equals(xStr()) || sName.equals(yStr()));
	}


	/**
	 * Carries name, strictness, array mode and metadata over to a container
	 * derived from this one
	 */
	private void copyStateTo(Skeleton oOther)
	{
		oOther.m_sName = m_sName;
		oOther.m_bStrict = m_bStrict;
		if (isLazy())
			oOther.activateLazy();
		for (String sKey : m_oStore.metaNames())
			oOther.m_oStore.setMeta(sKey, m_oStore.getMeta(sKey), true);
	}


	/**
	 * Creates a container holding part of this one. Every axis is kept,
	 * single picks leave it with length one. Points are renumbered from 0.
	 * @param oSel positions to keep
	 * @return a new container of the same type and projection
	 */
	public Skeleton sel(Selection oSel)
	{
		checkSelection(oSel);
		HashMap<String, double[]> oCoords = new HashMap();
		for (String sCoord : m_oRegistry.coords(CoordGroup.ALL))
		{
			if (!isGridded() && sCoord.equals("inds"))
				continue;
			double[] dValues = m_oStore.getCoord(sCoord);
			oCoords.put(sCoord, pick(dValues, oSel.indices(sCoord, dValues)));
		}
		if (!isGridded())
		{
			int[] nInds = oSel.indices("inds", m_oStore.getCoord("inds"));
			oCoords.put(xStr(), pick(m_oStore.get(xStr()).toDoubleArray(), nInds));
			oCoords.put(yStr(), pick(m_oStore.get(yStr()).toDoubleArray(), nInds));
		}

		Skeleton oRet = m_oType.create(oCoords, getProjection());
		copyStateTo(oRet);
		for (String sName : m_oStore.names())
		{
			if (isPosition(sName))
				continue;
			List<String> oDims = m_oStore.dims(sName);
			oRet.set(sName, select(m_oStore.get(sName), oDims, oSel, false), oDims, null);
		}
		m_oLogger.debug("{} selected {}", m_sName, oSel);
		return oRet;
	}


	private static double[] pick(double[] dValues, int[] nIndices)
	{
		double[] dRet = new double[nIndices.length];
		for (int nIndex = 0; nIndex < nIndices.length; nIndex++)
			dRet[nIndex] = dValues[nIndices[nIndex]];
		return dRet;
	}


	/**
	 * Iterates over every combination of the grid coordinates: the spatial
	 * ones plus those tagged GRID.
	 * @return one container per combination, see {@link #iterate(String...)}
	 */
	@Override
	public Iterator<Skeleton> iterator()
	{
		return new SkeletonIterator(this, m_oRegistry.coords(CoordGroup.GRID));
	}


	/**
	 * Iterates over every combination of the given coordinates' values. The
	 * coordinates are combined in canonical order, the last one changing
	 * fastest. Each element is the container selected at one index of each
	 * coordinate. Names that are not coordinates are skipped.
	 * @param sCoords coordinates to iterate over
	 * @return iterable over the selected containers
	 */
	public Iterable<Skeleton> iterate(String... sCoords)
	{
		List<String> oWanted = Arrays.asList(sCoords);
		ArrayList<String> oCoords = new ArrayList();
		for (String sCoord : m_oRegistry.coords(CoordGroup.ALL))
		{
			if (oWanted.contains(sCoord))
				oCoords.add(sCoord);
		}
		for (String sCoord : sCoords)
		{
			if (!oCoords.contains(sCoord))
				m_oLogger.warn("Cannot iterate over {}, {} has no such coordinate", sCoord, m_sName);
		}
		return () -> new SkeletonIterator(this, oCoords);
	}


	/**
	 * @param sCoord coordinate name
	 * @return number of values of the coordinate
	 */
	int coordLength(String sCoord)
	{
		double[] dValues = m_oStore.getCoord(sCoord);
		return dValues == null ? 0 : dValues.length;
	}


	/**
	 * Joins another container of the same type along one coordinate. All
	 * other coordinates must be equal. The joined coordinate is sorted,
	 * except the point index, which is renumbered with the other container's
	 * points appended.
	 * @param oOther container to join
	 * @param sDim coordinate to join along
	 * @return a new container with the fields of both; fields set in only
	 * one of them take default values for the other's part
	 */
	public Skeleton absorb(Skeleton oOther, String sDim)
	{
		if (oOther.m_oType != m_oType || oOther.isSpherical() != isSpherical())
			throw new GeoSkelException(String.format("Cannot absorb %s into %s, the types differ", oOther.m_sName, m_sName));
		if (!m_oRegistry.coords(CoordGroup.ALL).contains(sDim))
			throw new UnknownNameException(sDim);
		boolean bPoints = !isGridded() && sDim.equals("inds");

		HashMap<String, double[]> oCoords = new HashMap();
		for (String sCoord : m_oRegistry.coords(CoordGroup.ALL))
		{
			if (sCoord.equals(sDim) || (!isGridded() && sCoord.equals("inds")))
				continue;
			double[] dValues = m_oStore.getCoord(sCoord);
			if (!Arrays.equals(dValues, oOther.m_oStore.getCoord(sCoord)))
				throw new GeoSkelException(String.format("Cannot absorb along %s, %s differs", sDim, sCoord));
			oCoords.put(sCoord, dValues);
		}

		int[] nOrder;
		if (bPoints)
		{
			nOrder = Selection.all(coordLength("inds") + oOther.coordLength("inds"));
			oCoords.put(xStr(), join(m_oStore.get(xStr()).toDoubleArray(), oOther.m_oStore.get(xStr()).toDoubleArray()));
			oCoords.put(yStr(), join(m_oStore.get(yStr()).toDoubleArray(), oOther.m_oStore.get(yStr()).toDoubleArray()));
		}
		else
		{
			double[] dJoined = join(m_oStore.getCoord(sDim), oOther.m_oStore.getCoord(sDim));
			nOrder = sortOrder(dJoined);
			oCoords.put(sDim, pick(dJoined, nOrder));
			if (!isGridded())
			{
				double[][] dPos = new double[][]{m_oStore.get(xStr()).toDoubleArray(), m_oStore.get(yStr()).toDoubleArray()};
				if (!Arrays.equals(dPos[0], oOther.m_oStore.get(xStr()).toDoubleArray()) || !Arrays.equals(dPos[1], oOther.m_oStore.get(yStr()).toDoubleArray()))
					throw new GeoSkelException(String.format("Cannot absorb along %s, the point positions differ", sDim));
				oCoords.put(xStr(), dPos[0]);
				oCoords.put(yStr(), dPos[1]);
			}
		}

		Skeleton oRet = m_oType.create(oCoords, getProjection());
		copyStateTo(oRet);
		LinkedHashSet<String> oNames = new LinkedHashSet(m_oStore.names());
		oNames.addAll(oOther.m_oStore.names());
		for (String sName : oNames)
		{
			if (isPosition(sName))
				continue;
			List<String> oDims = m_oRegistry.coords(m_oRegistry.coordGroup(sName));
			NumericArray oValues = get(sName, true, null, true);
			int nAxis = oDims.indexOf(sDim);
			if (nAxis >= 0)
			{
				oValues = EagerArray.concat(oValues, oOther.get(sName, true, null, true), nAxis);
				if (!bPoints)
					oValues = oValues.take(nAxis, nOrder);
			}
			oRet.set(sName, oValues, oDims, null);
		}
		m_oLogger.debug("{} absorbed {} along {}", m_sName, oOther.m_sName, sDim);
		return oRet;
	}


	private static double[] join(double[] dFirst, double[] dSecond)
	{
		double[] dRet = Arrays.copyOf(dFirst, dFirst.length + dSecond.length);
		System.arraycopy(dSecond, 0, dRet, dFirst.length, dSecond.length);
		return dRet;
	}


	/**
	 * @return indices that sort the values ascending, equal values keeping
	 * their order
	 */
	private static int[] sortOrder(double[] dValues)
	{
		Integer[] nOrder = new Integer[dValues.length];
		for (int nIndex = 0; nIndex < nOrder.length; nIndex++)
			nOrder[nIndex] = nIndex;
		Arrays.sort(nOrder, (nA, nB) -> Double.compare(dValues[nA], dValues[nB]));
		int[] nRet = new int[nOrder.length];
		for (int nIndex = 0; nIndex < nRet.length; nIndex++)
			nRet[nIndex] = nOrder[nIndex];
		return nRet;
	}


	/**
	 * Writes values into part of a field. Unset fields start from their
	 * defaults. Masks triggered by the field are recomputed.
	 * @param sName data field or mask
	 * @param oData values for the selected block, laid out along the
	 * field's axes without those of single picks
	 * @param oAt block to write, every coordinate must index the field
	 */
	public void insert(String sName, NumericArray oData, Selection oAt)
	{
		Var oVar = m_oRegistry.get(sName);
		if (oVar.getKind() != VarKind.DATA && oVar.getKind() != VarKind.MASK)
			throw new GeoSkelException(String.format("Only stored fields and masks can be inserted into, %s is a %s", sName, oVar.getKind()));
		checkSelection(oAt);
		List<String> oDims = dimsOf(oVar);
		for (String sCoord : oAt.coords())
		{
			if (!oDims.contains(sCoord))
				throw new GeoSkelException(String.format("%s is not indexed by %s", sName, sCoord));
		}

		int[][] nIndices = new int[oDims.size()][];
		ArrayList<String> oBlockDims = new ArrayList();
		ArrayList<Integer> oBlockShape = new ArrayList();
		for (int nAxis = 0; nAxis < nIndices.length; nAxis++)
		{
			String sDim = oDims.get(nAxis);
			nIndices[nAxis] = oAt.indices(sDim, m_oStore.getCoord(sDim));
			if (!oAt.drops(sDim))
			{
				oBlockDims.add(sDim);
				oBlockShape.add(nIndices[nAxis].length);
			}
		}
		int[] nBlock = new int[oBlockShape.size()];
		for (int nIndex = 0; nIndex < nBlock.length; nIndex++)
			nBlock[nIndex] = oBlockShape.get(nIndex);

		NumericArray oBlock = m_oReshape.align(sName, oData, null, oBlockDims, nBlock);
		EagerArray oCurrent = get(sName, true, null, true).realize();
		set(sName, oCurrent.assign(nIndices, oBlock), oDims, null);
	}


	/**
	 * Writes values at the positions holding the given coordinate values
	 * @param sName data field or mask
	 * @param oData values for the block
	 * @param oValues coordinate value by coordinate name
	 */
	public void insert(String sName, NumericArray oData, Map<String, Double> oValues)
	{
		insert(sName, oData, Selection.ofValues(oValues));
	}


	/**
	 * Writes values at the given coordinate indices
	 * @param sName data field or mask
	 * @param oData values for the block
	 * @param oIndices index by coordinate name
	 */
	public void indInsert(String sName, NumericArray oData, Map<String, Integer> oIndices)
	{
		insert(sName, oData, Selection.ofIndices(oIndices));
	}


	/**
	 * Finds the points nearest to query positions by great circle distance
	 * @param dLon query longitudes, or null to query by x/y
	 * @param dLat query latitudes, or null
	 * @param dX query x values, used when no lon/lat is given
	 * @param dY query y values
	 * @param bUnique true to drop repeated points
	 * @return indices of the nearest points and the distances in km
	 */
	public YankResult yankPoint(double[] dLon, double[] dLat, double[] dX, double[] dY, boolean bUnique)
	{
		double[] dQLon = dLon;
		double[] dQLat = dLat;
		if (dQLon == null || dQLat == null)
		{
			if (dX == null || dY == null)
				throw new IllegalArgumentException("Give either an x-y pair or a lon-lat pair");
			double[][] dGeo = m_oProj.toGeographic(dX, dY);
			dQLon = dGeo[0];
			dQLat = dGeo[1];
		}
		if (dQLon.length != dQLat.length)
			throw new LengthMismatchException("lon", dQLon.length, "lat", dQLat.length);

		double[][] dPoints = lonlat();
		int[] nInds = new int[dQLon.length];
		double[] dDist = new double[dQLon.length];
		for (int nQuery = 0; nQuery < dQLon.length; nQuery++)
		{
			int nBest = -1;
			double dBest = Double.POSITIVE_INFINITY;
			for (int nPoint = 0; nPoint < dPoints[0].length; nPoint++)
			{
				double dDistance = GeoUtil.distanceFromLatLon(dQLat[nQuery], dQLon[nQuery], dPoints[1][nPoint], dPoints[0][nPoint]);
				if (dDistance < dBest)
				{
					dBest = dDistance;
					nBest = nPoint;
				}
			}
			nInds[nQuery] = nBest;
			dDist[nQuery] = dBest;
		}

		if (bUnique)
		{
			TreeMap<Integer, Double> oUnique = new TreeMap();
			for (int nIndex = 0; nIndex < nInds.length; nIndex++)
				oUnique.putIfAbsent(nInds[nIndex], dDist[nIndex]);
			nInds = new int[oUnique.size()];
			dDist = new double[oUnique.size()];
			int nIndex = 0;
			for (Map.Entry<Integer, Double> oEntry : oUnique.entrySet())
			{
				nInds[nIndex] = oEntry.getKey();
				dDist[nIndex++] = oEntry.getValue();
			}
		}
		return new YankResult(nInds, dDist, isGridded() ? nx() : 0);
	}


	/**
	 * Positions where a mask is true
	 * @param sMask primary or opposite mask indexed by the spatial points
	 * @param bCartesian true for x/y, false for lon/lat
	 * @return {x, y} or {lon, lat} of the selected points
	 */
	public double[][] maskedPoints(String sMask, boolean bCartesian)
	{
		boolean[] bMask = getMask(sMask);
		if (bCartesian)
			return xy(bMask, false, false, false, null);
		return lonlat(bMask, false, false);
	}


	public double[][] maskedPoints(String sMask)
	{
		return maskedPoints(sMask, !m_bSpherical);
	}


	/**
	 * @param sName field name
	 * @return the field's attributes, or those of its physical parameter if
	 * none were set
	 */
	public JSONObject metadata(String sName)
	{
		JSONObject oMeta = m_oStore.getMeta(sName);
		if (oMeta == null)
			oMeta = m_oRegistry.param(sName).toMeta();
		return oMeta;
	}


	/**
	 * @return the global attributes
	 */
	public JSONObject metadata()
	{
		JSONObject oMeta = m_oStore.getMeta(DataStore.GLOBAL);
		return oMeta == null ? new JSONObject() : oMeta;
	}


	/**
	 * @param sName field name, or null for the global attributes
	 * @param oMeta attributes
	 * @param bAppend true to add to existing attributes
	 */
	public void setMetadata(String sName, JSONObject oMeta, boolean bAppend)
	{
		if (sName != null)
			m_oRegistry.get(sName);
		m_oStore.setMeta(sName == null ? DataStore.GLOBAL : sName, oMeta, bAppend);
	}


	/**
	 * @return coordinates, stored fields, metadata, topology and projection
	 */
	public JSONObject toJson()
	{
		JSONObject oJson = m_oStore.toJson();
		oJson.put("name", m_sName);
		oJson.put("gridded", isGridded());
		if (m_oProj.isSet())
			oJson.put("crs", m_oProj.get().toJson());
		return oJson;
	}


	@Override
	public String toString()
	{
		StringBuilder sBuf = new StringBuilder();
		sBuf.append(String.format("<%s> %s (%s) %s\n", m_sName, isGridded() ? "gridded" : "point", m_bSpherical ? "spherical" : "cartesian", m_oProj));
		for (String sCoord : coords(CoordGroup.ALL))
			sBuf.append(String.format("  %s: %d\n", sCoord, m_oStore.coordValues().get(sCoord).length));
		List<String> oSet = new ArrayList();
		for (String sName : m_oStore.names())
			oSet.add(sName);
		sBuf.append("  stored: ").append(oSet);
		return sBuf.toString();
	}


	/**
	 * Result of a nearest point search
	 */
	public static class YankResult
	{
		private final int[] m_nInds;

		private final double[] m_dDist;

		/**
		 * Number of x values of gridded containers, 0 for points
		 */
		private final int m_nNx;


		YankResult(int[] nInds, double[] dDist, int nNx)
		{
			m_nInds = nInds;
			m_dDist = dDist;
			m_nNx = nNx;
		}


		/**
		 * @return flat indices of the nearest points
		 */
		public int[] getInds()
		{
			return m_nInds.clone();
		}


		/**
		 * @return x indices of the nearest grid points
		 */
		public int[] getIndsX()
		{
			int[] nRet = new int[m_nInds.length];
			for (int nIndex = 0; nIndex < nRet.length; nIndex++)
				nRet[nIndex] = m_nNx == 0 ? m_nInds[nIndex] : m_nInds[nIndex] % m_nNx;
			return nRet;
		}


		/**
		 * @return y indices of the nearest grid points
		 */
		public int[] getIndsY()
		{
			int[] nRet = new int[m_nInds.length];
			for (int nIndex = 0; nIndex < nRet.length; nIndex++)
				nRet[nIndex] = m_nNx == 0 ? m_nInds[nIndex] : m_nInds[nIndex] / m_nNx;
			return nRet;
		}


		/**
		 * @return distances to the nearest points in km
		 */
		public double[] getDistances()
		{
			return m_dDist.clone();
		}
	}
}
