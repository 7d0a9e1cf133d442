package com.jeffdisher.tessera.patches;

import com.jeffdisher.tessera.types.EntityRef;


/**
 * Changes the parent/child structure of entities.
 * "other" is the new parent for SET_PARENT and REPARENT_CHILDREN (null there means "detach") and unused otherwise.
 */
public record HierarchyPatch(EntityRef entity
		, Op op
		, EntityRef other
		, boolean visible
) implements IPatchKind
{
	/**
	 * The component written by SET_VISIBLE.
	 */
	public static final String VISIBLE_COMPONENT = "Visible";

	public enum Op
	{
		SET_PARENT,
		REMOVE_PARENT,
		DESPAWN_RECURSIVE,
		REPARENT_CHILDREN,
		DETACH_CHILDREN,
		SET_VISIBLE,
	}

	public static HierarchyPatch setParent(EntityRef child, EntityRef parent)
	{
		return new HierarchyPatch(child, Op.SET_PARENT, parent, false);
	}

	public static HierarchyPatch removeParent(EntityRef child)
	{
		return new HierarchyPatch(child, Op.REMOVE_PARENT, null, false);
	}

	public static HierarchyPatch despawnRecursive(EntityRef root)
	{
		return new HierarchyPatch(root, Op.DESPAWN_RECURSIVE, null, false);
	}

	public static HierarchyPatch reparentChildren(EntityRef parent, EntityRef newParent)
	{
		return new HierarchyPatch(parent, Op.REPARENT_CHILDREN, newParent, false);
	}

	public static HierarchyPatch detachChildren(EntityRef parent)
	{
		return new HierarchyPatch(parent, Op.DETACH_CHILDREN, null, false);
	}

	public static HierarchyPatch setVisible(EntityRef entity, boolean visible)
	{
		return new HierarchyPatch(entity, Op.SET_VISIBLE, null, visible);
	}

	@Override
	public PatchType getType()
	{
		return PatchType.HIERARCHY;
	}

	@Override
	public EntityRef targetEntity()
	{
		return this.entity;
	}
}
