package com.jeffdisher.tessera.patches;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

import com.jeffdisher.tessera.types.EntityRef;
import com.jeffdisher.tessera.types.Value;


/**
 * Creates, destroys, enables or disables an entity.
 * A CREATE may carry an archetype name and initial components.  When replaceExisting is set, an existing entity with
 * the same reference is destroyed first (this is what a DESTROY followed by a CREATE collapses into).
 */
public record EntityPatch(EntityRef entity
		, Op op
		, String archetype
		, Map<String, Value> components
		, boolean replaceExisting
) implements IPatchKind
{
	public enum Op
	{
		CREATE,
		DESTROY,
		ENABLE,
		DISABLE,
	}

	public static EntityPatch create(EntityRef entity)
	{
		return new EntityPatch(entity, Op.CREATE, null, Map.of(), false);
	}

	public static EntityPatch create(EntityRef entity, String archetype, Map<String, Value> components)
	{
		return new EntityPatch(entity, Op.CREATE, archetype, components, false);
	}

	public static EntityPatch destroy(EntityRef entity)
	{
		return new EntityPatch(entity, Op.DESTROY, null, Map.of(), false);
	}

	public static EntityPatch enable(EntityRef entity)
	{
		return new EntityPatch(entity, Op.ENABLE, null, Map.of(), false);
	}

	public static EntityPatch disable(EntityRef entity)
	{
		return new EntityPatch(entity, Op.DISABLE, null, Map.of(), false);
	}

	public EntityPatch
	{
		components = Collections.unmodifiableMap(new TreeMap<>(components));
	}

	public EntityPatch withComponent(String name, Value value)
	{
		Map<String, Value> updated = new TreeMap<>(this.components);
		updated.put(name, value);
		return new EntityPatch(this.entity, this.op, this.archetype, updated, this.replaceExisting);
	}

	public EntityPatch asReplacement()
	{
		return new EntityPatch(this.entity, this.op, this.archetype, this.components, true);
	}

	@Override
	public PatchType getType()
	{
		return PatchType.ENTITY;
	}

	@Override
	public EntityRef targetEntity()
	{
		return this.entity;
	}
}
