package geoskel.schema;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * The parameters known to the library. The table is built once and never
 * modified.
 */
public abstract class Params
{
	/**
	 * Each parameter is defined by a String[] in the format [short name, long
	 * name, unit, CF standard name]
	 */
	private static final String[][] PARAMS = new String[][]
	{
		{"lon", "longitude", "degrees_east", "longitude"},
		{"lat", "latitude", "degrees_north", "latitude"},
		{"x", "x distance", "m", "projection_x_coordinate"},
		{"y", "y distance", "m", "projection_y_coordinate"},
		{"inds", "point index", "-", ""},
		{"time", "time", "ms since 1970-01-01", "time"},
		{"hs", "significant wave height", "m", "sea_surface_wave_significant_height"},
		{"tp", "peak period", "s", "sea_surface_wave_period_at_variance_spectral_density_maximum"},
		{"tm01", "mean period", "s", "sea_surface_wave_mean_period_from_variance_spectral_density_first_frequency_moment"},
		{"dirp", "peak direction", "deg", "sea_surface_wave_from_direction_at_variance_spectral_density_maximum"},
		{"dirm", "mean direction", "deg", "sea_surface_wave_from_direction"},
		{"freq", "frequency", "Hz", "wave_frequency"},
		{"dirs", "wave direction", "deg", "sea_surface_wave_from_direction"},
		{"spec", "variance spectral density", "m2/Hz", "sea_surface_wave_variance_spectral_density"},
		{"topo", "topography", "m", "sea_floor_depth_below_sea_surface"},
		{"u", "eastward wind", "m/s", "x_wind"},
		{"v", "northward wind", "m/s", "y_wind"},
		{"ff", "wind speed", "m/s", "wind_speed"},
		{"dd", "wind direction", "deg", "wind_from_direction"},
		{"uc", "eastward current", "m/s", "eastward_sea_water_velocity"},
		{"vc", "northward current", "m/s", "northward_sea_water_velocity"},
		{"cspd", "current speed", "m/s", "sea_water_speed"},
		{"cdir", "current direction", "deg", "direction_of_sea_water_velocity"},
		{"eta", "sea surface elevation", "m", "sea_surface_height_above_sea_level"},
		{"ice", "sea ice fraction", "-", "sea_ice_area_fraction"},
	};

	/**
	 * Parameters by short name
	 */
	private static final Map<String, Param> BY_NAME;

	static
	{
		HashMap<String, Param> oMap = new HashMap();
		for (String[] sParam : PARAMS)
			oMap.put(sParam[0], new Param(sParam[0], sParam[1], sParam[2], sParam[3]));
		// the current direction standard name gives no convention, it points "to"
		oMap.put("cdir", new Param("cdir", "current direction", "deg", "direction_of_sea_water_velocity", DirType.TO));
		BY_NAME = Collections.unmodifiableMap(oMap);
	}

	public static final Param LON = BY_NAME.get("lon");
	public static final Param LAT = BY_NAME.get("lat");
	public static final Param X = BY_NAME.get("x");
	public static final Param Y = BY_NAME.get("y");
	public static final Param INDS = BY_NAME.get("inds");
	public static final Param TIME = BY_NAME.get("time");
	public static final Param HS = BY_NAME.get("hs");
	public static final Param TP = BY_NAME.get("tp");
	public static final Param TM01 = BY_NAME.get("tm01");
	public static final Param DIRP = BY_NAME.get("dirp");
	public static final Param DIRM = BY_NAME.get("dirm");
	public static final Param FREQ = BY_NAME.get("freq");
	public static final Param DIRS = BY_NAME.get("dirs");
	public static final Param SPEC = BY_NAME.get("spec");
	public static final Param TOPO = BY_NAME.get("topo");
	public static final Param X_WIND = BY_NAME.get("u");
	public static final Param Y_WIND = BY_NAME.get("v");
	public static final Param WIND = BY_NAME.get("ff");
	public static final Param WIND_DIR = BY_NAME.get("dd");
	public static final Param X_CURRENT = BY_NAME.get("uc");
	public static final Param Y_CURRENT = BY_NAME.get("vc");
	public static final Param CURRENT = BY_NAME.get("cspd");
	public static final Param CURRENT_DIR = BY_NAME.get("cdir");
	public static final Param ETA = BY_NAME.get("eta");
	public static final Param ICE = BY_NAME.get("ice");


	/**
	 * @param sName short name
	 * @return the parameter, or null if it is not in the table
	 */
	public static Param get(String sName)
	{
		return BY_NAME.get(sName);
	}


	/**
	 * Builds a parameter for names that are not in the table
	 * @param sName short name
	 * @return the known parameter or a description holding only the name
	 */
	public static Param getOrGeneric(String sName)
	{
		Param oParam = BY_NAME.get(sName);
		if (oParam == null)
			oParam = new Param(sName, sName, "-", "");
		return oParam;
	}
}
