package com.jeffdisher.tessera.patches;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

import com.jeffdisher.tessera.types.EntityRef;
import com.jeffdisher.tessera.types.Value;


/**
 * Writes one component of an entity.
 * SET replaces the whole value, UPDATE writes individual fields into an OBJECT value, and REMOVE deletes it.
 */
public record ComponentPatch(EntityRef entity
		, String component
		, Op op
		, Value data
		, Map<String, Value> fields
) implements IPatchKind
{
	public enum Op
	{
		SET,
		UPDATE,
		REMOVE,
	}

	public static ComponentPatch set(EntityRef entity, String component, Value data)
	{
		return new ComponentPatch(entity, component, Op.SET, data, Map.of());
	}

	public static ComponentPatch update(EntityRef entity, String component, Map<String, Value> fields)
	{
		return new ComponentPatch(entity, component, Op.UPDATE, null, fields);
	}

	public static ComponentPatch remove(EntityRef entity, String component)
	{
		return new ComponentPatch(entity, component, Op.REMOVE, null, Map.of());
	}

	public ComponentPatch
	{
		fields = Collections.unmodifiableMap(new TreeMap<>(fields));
	}

	@Override
	public PatchType getType()
	{
		return PatchType.COMPONENT;
	}

	@Override
	public EntityRef targetEntity()
	{
		return this.entity;
	}
}
