package geoskel.store;

import static org.junit.jupiter.api.Assertions.*;

import geoskel.array.EagerArray;
import java.util.Arrays;
import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

class DataStoreTest
{
	@Test
	void coordinatesAreCopied()
	{
		DataStore oStore = new DataStore();
		double[] dX = new double[]{1, 2, 3};
		oStore.setCoord("x", dX);
		dX[0] = 99;
		assertEquals(1.0, oStore.getCoord("x")[0]);
		oStore.getCoord("x")[1] = 99;
		assertEquals(2.0, oStore.getCoord("x")[1]);
		assertNull(oStore.getCoord("y"));
	}


	@Test
	void fieldsKeepTheirDimensions()
	{
		DataStore oStore = new DataStore();
		oStore.put("hs", EagerArray.of(new double[]{1, 2}), Arrays.asList("inds"));
		assertTrue(oStore.has("hs"));
		assertEquals(Arrays.asList("inds"), oStore.dims("hs"));
		assertThrows(UnsupportedOperationException.class, () -> oStore.dims("hs").add("time"));

		oStore.replaceAll(oArray -> oArray.map(dVal -> dVal * 2));
		assertArrayEquals(new double[]{2, 4}, oStore.get("hs").toDoubleArray());

		oStore.remove("hs");
		assertNull(oStore.dims("hs"));
		assertTrue(oStore.names().isEmpty());
	}


	@Test
	void metadataSurvivesClear()
	{
		DataStore oStore = new DataStore();
		oStore.setCoord("x", new double[]{1});
		oStore.setMeta("hs", new JSONObject().put("units", "m"), false);
		oStore.setMeta("hs", new JSONObject().put("long_name", "wave height"), true);
		oStore.clear();

		assertFalse(oStore.hasCoord("x"));
		JSONObject oMeta = oStore.getMeta("hs");
		assertEquals("m", oMeta.getString("units"));
		assertEquals("wave height", oMeta.getString("long_name"));

		oStore.setMeta("hs", new JSONObject().put("units", "cm"), false);
		assertFalse(oStore.getMeta("hs").has("long_name"));
		oStore.removeMeta("hs", "units");
		assertTrue(oStore.getMeta("hs").isEmpty());
	}


	@Test
	void jsonWritesMissingValuesAsNull()
	{
		DataStore oStore = new DataStore();
		oStore.setCoord("inds", new double[]{0, 1});
		oStore.put("sea_mask", EagerArray.of(new double[]{1, 0}).toInteger(), Arrays.asList("inds"));
		oStore.put("hs", EagerArray.of(new double[]{Double.NaN, 2}), Arrays.asList("inds"));

		JSONObject oJson = oStore.toJson();
		JSONObject oHs = oJson.getJSONObject("data").getJSONObject("hs");
		JSONArray oValues = oHs.getJSONArray("values");
		assertTrue(oValues.isNull(0));
		assertEquals(2.0, oValues.getDouble(1));
		assertFalse(oHs.getBoolean("integer"));
		assertTrue(oJson.getJSONObject("data").getJSONObject("sea_mask").getBoolean("integer"));
		assertEquals(2, oJson.getJSONObject("coords").getJSONArray("inds").length());
	}
}
