package geoskel.schema;

/**
 * Kinds of names a registry holds. Magnitudes, directions and opposite masks
 * are derived on read and never stored.
 */
public enum VarKind
{
	COORDINATE,
	DATA,
	MASK,
	MAGNITUDE,
	DIRECTION
}
