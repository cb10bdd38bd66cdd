package geoskel.geosrv;

import geoskel.error.InvalidCrsException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * UTM zone given by number (1 to 60) and latitude band letter (C to X
 * without I and O).
 */
public class UtmZone
{
	/**
	 * Latitude band letters, each 8 degrees starting at 80S. X covers 72N to
	 * 84N.
	 */
	public static final String LETTERS = "CDEFGHJKLMNPQRSTUVWX";

	/**
	 * Zone strings such as "33W" or "5 N"
	 */
	private static final Pattern ZONE = Pattern.compile("^\\s*(\\d{1,2})\\s*([A-Za-z])\\s*$");

	private final int m_nNumber;

	private final char m_cLetter;


	/**
	 * @param nNumber zone number, 1 to 60
	 * @param cLetter latitude band, C to X without I and O
	 * @throws InvalidCrsException if either part is out of range
	 */
	public UtmZone(int nNumber, char cLetter)
	{
		char cUpper = Character.toUpperCase(cLetter);
		if (nNumber < 1 || nNumber > 60)
			throw new InvalidCrsException(String.format("UTM zone number %d is not within 1 to 60", nNumber));
		if (LETTERS.indexOf(cUpper) < 0)
			throw new InvalidCrsException(String.format("UTM zone letter '%c' is not valid", cLetter));
		m_nNumber = nNumber;
		m_cLetter = cUpper;
	}


	/**
	 * @param sZone zone such as "33W"
	 * @return the zone
	 * @throws InvalidCrsException if the string is not a valid zone
	 */
	public static UtmZone parse(String sZone)
	{
		Matcher oMatch = ZONE.matcher(sZone);
		if (!oMatch.matches())
			throw new InvalidCrsException(String.format("'%s' is not a UTM zone", sZone));
		return new UtmZone(Integer.parseInt(oMatch.group(1)), oMatch.group(2).charAt(0));
	}


	/**
	 * @param sZone string to test
	 * @return true if the string has the form of a zone, valid or not
	 */
	public static boolean looksLikeZone(String sZone)
	{
		return ZONE.matcher(sZone).matches();
	}


	/**
	 * Finds the zone of a position, including the exceptions for southern
	 * Norway and Svalbard
	 * @param dLon longitude in decimal degrees
	 * @param dLat latitude in decimal degrees within [-80, 84]
	 * @return the zone containing the position
	 */
	public static UtmZone detect(double dLon, double dLat)
	{
		dLon = GeoUtil.adjustLon(dLon);
		int nNumber = (int)Math.floor((dLon + 180.0) / 6.0) + 1;
		if (nNumber > 60)
			nNumber = 60;

		if (dLat >= 56.0 && dLat < 64.0 && dLon >= 3.0 && dLon < 12.0)
			nNumber = 32;
		if (dLat >= 72.0 && dLat <= 84.0)
		{
			if (dLon >= 0.0 && dLon < 9.0)
				nNumber = 31;
			else if (dLon >= 9.0 && dLon < 21.0)
				nNumber = 33;
			else if (dLon >= 21.0 && dLon < 33.0)
				nNumber = 35;
			else if (dLon >= 33.0 && dLon < 42.0)
				nNumber = 37;
		}
		return new UtmZone(nNumber, letterFor(dLat));
	}


	/**
	 * @param dLat latitude in decimal degrees
	 * @return band letter, latitudes outside [-80, 84] get the outermost band
	 */
	public static char letterFor(double dLat)
	{
		int nBand = (int)Math.floor((dLat + 80.0) / 8.0);
		if (nBand < 0)
			nBand = 0;
		if (nBand >= LETTERS.length())
			nBand = LETTERS.length() - 1;
		return LETTERS.charAt(nBand);
	}


	public int getNumber()
	{
		return m_nNumber;
	}


	public char getLetter()
	{
		return m_cLetter;
	}


	/**
	 * @return true for bands N and above
	 */
	public boolean isNorthern()
	{
		return m_cLetter >= 'N';
	}


	/**
	 * @return longitude of the central meridian
	 */
	public double getCentralMeridian()
	{
		return (m_nNumber - 1) * 6.0 - 180.0 + 3.0;
	}


	/**
	 * @return EPSG code of the WGS 84 UTM projection of the zone
	 */
	public int getEpsg()
	{
		return (isNorthern() ? 32600 : 32700) + m_nNumber;
	}


	@Override
	public boolean equals(Object oObj)
	{
		if (!(oObj instanceof UtmZone))
			return false;
		UtmZone oOther = (UtmZone)oObj;
		return m_nNumber == oOther.m_nNumber && m_cLetter == oOther.m_cLetter;
	}


	@Override
	public int hashCode()
	{
		return m_nNumber * 31 + m_cLetter;
	}


	@Override
	public String toString()
	{
		return String.format("%02d%c", m_nNumber, m_cLetter);
	}
}
