package geoskel.store;

import geoskel.array.NumericArray;
import geoskel.system.JSONUtil;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;
import org.json.JSONArray;
import org.json.JSONObject;

/**
 * Named arrays of one container: coordinate vectors, stored fields with the
 * names of their dimensions, and metadata dictionaries keyed by field name
 * plus one global entry.
 */
public class DataStore
{
	/**
	 * Metadata key of the dataset wide attributes
	 */
	public static final String GLOBAL = "_global_";

	private final LinkedHashMap<String, double[]> m_oCoords = new LinkedHashMap();

	private final LinkedHashMap<String, NumericArray> m_oData = new LinkedHashMap();

	private final HashMap<String, List<String>> m_oDims = new HashMap();

	private final LinkedHashMap<String, JSONObject> m_oMeta = new LinkedHashMap();


	/**
	 * @param sName coordinate name
	 * @param dValues values, copied
	 */
	public void setCoord(String sName, double[] dValues)
	{
		m_oCoords.put(sName, dValues.clone());
	}


	/**
	 * @param sName coordinate name
	 * @return copy of the values, null if the coordinate is not set
	 */
	public double[] getCoord(String sName)
	{
		double[] dValues = m_oCoords.get(sName);
		return dValues == null ? null : dValues.clone();
	}


	public boolean hasCoord(String sName)
	{
		return m_oCoords.containsKey(sName);
	}


	/**
	 * @return read only view of the coordinate values
	 */
	public Map<String, double[]> coordValues()
	{
		return Collections.unmodifiableMap(m_oCoords);
	}


	/**
	 * Stores a field
	 * @param sName field name
	 * @param oArray values
	 * @param oDims names of the array's dimensions in order
	 */
	public void put(String sName, NumericArray oArray, List<String> oDims)
	{
		m_oData.put(sName, oArray);
		m_oDims.put(sName, new ArrayList(oDims));
	}


	public NumericArray get(String sName)
	{
		return m_oData.get(sName);
	}


	public boolean has(String sName)
	{
		return m_oData.containsKey(sName);
	}


	/**
	 * @param sName field name
	 * @return dimension names of the stored field, null if not stored
	 */
	public List<String> dims(String sName)
	{
		List<String> oDims = m_oDims.get(sName);
		return oDims == null ? null : Collections.unmodifiableList(oDims);
	}


	public void remove(String sName)
	{
		m_oData.remove(sName);
		m_oDims.remove(sName);
	}


	/**
	 * @return names of the stored fields in storing order
	 */
	public List<String> names()
	{
		return new ArrayList(m_oData.keySet());
	}


	/**
	 * Replaces every stored array by the result of the function
	 * @param oOp conversion applied to each array
	 */
	public void replaceAll(UnaryOperator<NumericArray> oOp)
	{
		m_oData.replaceAll((sName, oArray) -> oOp.apply(oArray));
	}


	/**
	 * Drops every coordinate and stored field. Metadata is kept.
	 */
	public void clear()
	{
		m_oCoords.clear();
		m_oData.clear();
		m_oDims.clear();
	}


	/**
	 * @return names with attributes, {@link #GLOBAL} included if set
	 */
	public List<String> metaNames()
	{
		return new ArrayList(m_oMeta.keySet());
	}


	/**
	 * @param sName field name or {@link #GLOBAL}
	 * @return copy of the attributes, null if none were set
	 */
	public JSONObject getMeta(String sName)
	{
		JSONObject oMeta = m_oMeta.get(sName);
		return oMeta == null ? null : new JSONObject(oMeta.toString());
	}


	/**
	 * @param sName field name or {@link #GLOBAL}
	 * @param oMeta attributes
	 * @param bAppend true to add to the existing attributes instead of
	 * replacing them
	 */
	public void setMeta(String sName, JSONObject oMeta, boolean bAppend)
	{
		JSONObject oTarget = bAppend ? m_oMeta.get(sName) : null;
		if (oTarget == null)
			oTarget = new JSONObject();
		for (String sKey : oMeta.keySet())
			oTarget.put(sKey, oMeta.get(sKey));
		m_oMeta.put(sName, oTarget);
	}


	/**
	 * Removes one attribute
	 * @param sName field name or {@link #GLOBAL}
	 * @param sKey attribute
	 */
	public void removeMeta(String sName, String sKey)
	{
		JSONObject oMeta = m_oMeta.get(sName);
		if (oMeta != null)
			oMeta.remove(sKey);
	}


	/**
	 * Writes coordinates, stored fields and metadata. Stored fields are
	 * realized.
	 * @return JSON representation of the store
	 */
	public JSONObject toJson()
	{
		JSONObject oJson = new JSONObject();
		JSONObject oCoords = new JSONObject();
		for (Map.Entry<String, double[]> oEntry : m_oCoords.entrySet())
			oCoords.put(oEntry.getKey(), JSONUtil.toJSONArray(oEntry.getValue()));
		oJson.put("coords", oCoords);

		JSONObject oData = new JSONObject();
		for (Map.Entry<String, NumericArray> oEntry : m_oData.entrySet())
		{
			NumericArray oArray = oEntry.getValue();
			JSONObject oVar = new JSONObject();
			oVar.put("dims", new JSONArray(m_oDims.get(oEntry.getKey())));
			oVar.put("shape", JSONUtil.toJSONArray(oArray.getShape()));
			oVar.put("integer", oArray.isInteger());
			oVar.put("values", JSONUtil.toJSONArray(oArray.toDoubleArray()));
			oData.put(oEntry.getKey(), oVar);
		}
		oJson.put("data", oData);

		JSONObject oMeta = new JSONObject();
		for (Map.Entry<String, JSONObject> oEntry : m_oMeta.entrySet())
			oMeta.put(oEntry.getKey(), oEntry.getValue());
		oJson.put("meta", oMeta);
		return oJson;
	}
}
