package geoskel.comp;

import static org.junit.jupiter.api.Assertions.*;

import geoskel.array.EagerArray;
import geoskel.array.NumericArray;
import geoskel.schema.DirType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class DerivedFieldsTest
{
	@Test
	@DisplayName("Magnitude is the vector length")
	void magnitude()
	{
		NumericArray oMag = DerivedFields.magnitude(EagerArray.of(new double[]{3, 0}), EagerArray.of(new double[]{4, -2}));
		assertArrayEquals(new double[]{5, 2}, oMag.toDoubleArray(), 1e-12);
	}


	@Test
	@DisplayName("Eastward vectors come from the west")
	void direction()
	{
		NumericArray oX = EagerArray.of(new double[]{1, 0});
		NumericArray oY = EagerArray.of(new double[]{0, 1});
		assertArrayEquals(new double[]{270, 180}, DerivedFields.direction(oX, oY, DirType.FROM).toDoubleArray(), 1e-9);
		assertArrayEquals(new double[]{90, 0}, DerivedFields.direction(oX, oY, DirType.TO).toDoubleArray(), 1e-9);
	}


	@Test
	@DisplayName("Decomposing and recomposing keeps magnitude and direction")
	void recompose()
	{
		for (double dDir = 0.0; dDir < 360.0; dDir += 15.0)
		{
			NumericArray oMag = EagerArray.of(new double[]{7.5});
			NumericArray oMath = DirConverter.toMath(EagerArray.of(new double[]{dDir}), DirType.FROM);
			NumericArray[] oXy = DerivedFields.decompose(oMag, oMath);
			assertEquals(7.5, DerivedFields.magnitude(oXy[0], oXy[1]).toDoubleArray()[0], 1e-9);
			double dBack = DerivedFields.direction(oXy[0], oXy[1], DirType.FROM).toDoubleArray()[0];
			double dDiff = Math.abs(dBack - dDir) % 360.0;
			assertTrue(dDiff < 1e-6 || 360.0 - dDiff < 1e-6);
		}
	}
}
