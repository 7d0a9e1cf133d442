package com.jeffdisher.tessera.patches;


/**
 * The closed set of patch kinds.  Each corresponds to exactly one IPatchKind implementation.
 */
public enum PatchType
{
	ENTITY,
	COMPONENT,
	LAYER,
	ASSET,
	HIERARCHY,
	CAMERA,
}
