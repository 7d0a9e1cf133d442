package com.jeffdisher.tessera.patches;

import com.jeffdisher.tessera.types.EntityRef;


/**
 * The payload of a Patch:  a description of exactly one mutation.  Implementations are immutable records and callers
 * dispatch on getType() and down-cast to the matching record.
 */
public interface IPatchKind
{
	PatchType getType();

	/**
	 * @return The entity this mutation targets, or null if it targets a layer or asset.
	 */
	EntityRef targetEntity();
}
