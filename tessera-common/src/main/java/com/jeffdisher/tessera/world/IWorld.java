package com.jeffdisher.tessera.world;

import java.util.List;

import com.jeffdisher.tessera.types.EntityRef;


/**
 * The kernel's only view of the entity store.  Implementations are only accessed from the kernel thread.
 */
public interface IWorld
{
	boolean contains(EntityRef ref);

	/**
	 * @return The entity's current record, or null if it doesn't exist.
	 */
	EntityRecord get(EntityRef ref);

	/**
	 * Adds a new entity.
	 * 
	 * @return False if an entity with the same ref already exists (nothing is changed).
	 */
	boolean insert(EntityRecord record);

	/**
	 * Overwrites an existing entity with an updated record.
	 * 
	 * @return False if the entity doesn't exist (nothing is changed).
	 */
	boolean replace(EntityRecord record);

	/**
	 * @return The removed record, or null if the entity didn't exist.
	 */
	EntityRecord destroy(EntityRef ref);

	/**
	 * @return A copy of the refs of all entities, ordered by namespace then local id.
	 */
	List<EntityRef> entities();

	/**
	 * @return The refs of the entities whose parent is the given entity, in the same order as entities().
	 */
	List<EntityRef> childrenOf(EntityRef parent);

	int entityCount();
}
