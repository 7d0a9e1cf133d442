package com.jeffdisher.tessera.transactions;

import com.jeffdisher.tessera.types.EntityRef;


/**
 * A mutation target claimed by an in-flight transaction.  The same record is used both for the claim and to report a
 * collision with it.
 * ENTITY claims the whole entity (entity, hierarchy and camera patches), COMPONENT one component of an entity, and
 * LAYER/ASSET a layer or asset id (held in name).
 */
public record Conflict(Kind kind, EntityRef entity, String name)
{
	public enum Kind
	{
		ENTITY,
		COMPONENT,
		LAYER,
		ASSET,
	}

	public static Conflict entity(EntityRef entity)
	{
		return new Conflict(Kind.ENTITY, entity, null);
	}

	public static Conflict component(EntityRef entity, String component)
	{
		return new Conflict(Kind.COMPONENT, entity, component);
	}

	public static Conflict layer(String layerId)
	{
		return new Conflict(Kind.LAYER, null, layerId);
	}

	public static Conflict asset(String assetId)
	{
		return new Conflict(Kind.ASSET, null, assetId);
	}
}
