package geoskel.geosrv;

import static org.junit.jupiter.api.Assertions.*;

import geoskel.error.InvalidCrsException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class UtmZoneTest
{
	@Test
	@DisplayName("Zones parse and print with two digits")
	void parse()
	{
		UtmZone oZone = UtmZone.parse("33W");
		assertEquals(33, oZone.getNumber());
		assertEquals('W', oZone.getLetter());
		assertEquals("33W", oZone.toString());
		assertEquals("05N", new UtmZone(5, 'N').toString());
		assertEquals(32633, oZone.getEpsg());
		assertEquals(15.0, oZone.getCentralMeridian());
	}


	@Test
	@DisplayName("Invalid zones are rejected")
	void invalid()
	{
		assertThrows(InvalidCrsException.class, () -> new UtmZone(61, 'N'));
		assertThrows(InvalidCrsException.class, () -> new UtmZone(0, 'N'));
		assertThrows(InvalidCrsException.class, () -> new UtmZone(33, 'I'));
		assertThrows(InvalidCrsException.class, () -> new UtmZone(33, 'O'));
		assertThrows(InvalidCrsException.class, () -> UtmZone.parse("W33"));
	}


	@Test
	@DisplayName("Detection follows the standard grid")
	void detect()
	{
		assertEquals(new UtmZone(33, 'V'), UtmZone.detect(15.0, 60.0));
		assertEquals(new UtmZone(31, 'N'), UtmZone.detect(0.5, 0.5));
		assertEquals(new UtmZone(1, 'M'), UtmZone.detect(-179.5, -1.0));
		assertEquals(new UtmZone(60, 'C'), UtmZone.detect(180.0, -80.0));
		assertFalse(UtmZone.detect(10.0, -30.0).isNorthern());
	}


	@Test
	@DisplayName("Norway and Svalbard exceptions apply")
	void exceptions()
	{
		assertEquals(32, UtmZone.detect(5.0, 60.0).getNumber());
		assertEquals(33, UtmZone.detect(15.0, 78.0).getNumber());
		assertEquals(31, UtmZone.detect(8.0, 78.0).getNumber());
		assertEquals(35, UtmZone.detect(25.0, 78.0).getNumber());
	}
}
