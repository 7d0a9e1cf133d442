package com.jeffdisher.tessera.world;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

import com.jeffdisher.tessera.types.EntityRef;
import com.jeffdisher.tessera.types.Value;


/**
 * The immutable state of one entity in the world.  Changes are made by building a new record with the with*()
 * helpers and writing it back with IWorld.replace(), which also makes the previous record a free undo copy.
 */
public record EntityRecord(EntityRef ref
		, String archetype
		, boolean enabled
		, EntityRef parent
		, Map<String, Value> components
)
{
	public static EntityRecord create(EntityRef ref, String archetype, Map<String, Value> components)
	{
		return new EntityRecord(ref, archetype, true, null, components);
	}

	public EntityRecord
	{
		components = Collections.unmodifiableMap(new TreeMap<>(components));
	}

	public Value getComponent(String name)
	{
		return this.components.get(name);
	}

	public EntityRecord withEnabled(boolean enabled)
	{
		return new EntityRecord(this.ref, this.archetype, enabled, this.parent, this.components);
	}

	public EntityRecord withParent(EntityRef parent)
	{
		return new EntityRecord(this.ref, this.archetype, this.enabled, parent, this.components);
	}

	public EntityRecord withComponent(String name, Value value)
	{
		Map<String, Value> updated = new TreeMap<>(this.components);
		updated.put(name, value);
		return new EntityRecord(this.ref, this.archetype, this.enabled, this.parent, updated);
	}

	public EntityRecord withoutComponent(String name)
	{
		Map<String, Value> updated = new TreeMap<>(this.components);
		updated.remove(name);
		return new EntityRecord(this.ref, this.archetype, this.enabled, this.parent, updated);
	}
}
